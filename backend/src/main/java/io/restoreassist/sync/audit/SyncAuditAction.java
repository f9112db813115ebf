package io.restoreassist.sync.audit;

/** What happened to an invoice's accounting sync. */
public enum SyncAuditAction {
  INITIATED,
  SUCCEEDED,
  FAILED,
  RETRIED,
  /** The provider's breaker was open; the job was put back without counting an attempt. */
  DEFERRED,
  RESET,
  PAYMENT_RECEIVED,
  EXTERNAL_UPDATED,
  EXTERNAL_DELETED
}
