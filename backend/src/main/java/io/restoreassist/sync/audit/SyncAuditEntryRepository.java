package io.restoreassist.sync.audit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SyncAuditEntryRepository extends JpaRepository<SyncAuditEntry, UUID> {

  List<SyncAuditEntry> findByInvoiceIdOrderByOccurredAtAsc(UUID invoiceId);
}
