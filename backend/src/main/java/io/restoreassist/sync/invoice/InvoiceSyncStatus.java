package io.restoreassist.sync.invoice;

/**
 * Accounting sync state. NOT_SYNCED → PENDING → SYNCED or FAILED; FAILED may be re-enqueued and
 * SYNCED/FAILED may be reset to NOT_SYNCED. PENDING means a sync is in flight.
 */
public enum InvoiceSyncStatus {
  NOT_SYNCED,
  PENDING,
  SYNCED,
  FAILED
}
