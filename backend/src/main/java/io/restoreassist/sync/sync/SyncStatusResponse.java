package io.restoreassist.sync.sync;

import io.restoreassist.sync.invoice.Invoice;
import io.restoreassist.sync.invoice.InvoiceSyncStatus;
import java.time.Instant;
import java.util.UUID;

/** Sync state of one invoice. {@code queued} is true while a job waits in the local queue. */
public record SyncStatusResponse(
    UUID invoiceId,
    InvoiceSyncStatus status,
    String provider,
    String externalId,
    String error,
    Instant lastSyncedAt,
    boolean queued) {

  static SyncStatusResponse from(Invoice invoice, boolean queued) {
    return new SyncStatusResponse(
        invoice.getId(),
        invoice.getSyncStatus(),
        invoice.getSyncProvider() != null ? invoice.getSyncProvider().getSlug() : null,
        invoice.getExternalId(),
        invoice.getLastSyncError(),
        invoice.getLastSyncedAt(),
        queued);
  }
}
