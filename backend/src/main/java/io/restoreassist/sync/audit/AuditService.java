package io.restoreassist.sync.audit;

import java.util.List;
import java.util.UUID;

/** Records and reads the append-only sync audit trail. */
public interface AuditService {

  /**
   * Records one audit entry within the current transaction. If the enclosing transaction rolls
   * back, the entry is rolled back with the state change it describes.
   */
  void log(SyncAuditRecord record);

  /** All entries for an invoice, oldest first. */
  List<SyncAuditEntry> historyFor(UUID invoiceId);
}
