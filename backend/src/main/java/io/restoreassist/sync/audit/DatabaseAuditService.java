package io.restoreassist.sync.audit;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Database-backed {@link AuditService}; {@code log()} joins the caller's transaction. */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final SyncAuditEntryRepository repository;
  private final Clock clock;

  public DatabaseAuditService(SyncAuditEntryRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Override
  @Transactional
  public void log(SyncAuditRecord record) {
    repository.save(new SyncAuditEntry(record, clock.instant()));
    log.debug(
        "Recorded sync audit: invoice={}, provider={}, action={}, attempt={}",
        record.invoiceId(),
        record.provider(),
        record.action(),
        record.attempt());
  }

  @Override
  @Transactional(readOnly = true)
  public List<SyncAuditEntry> historyFor(UUID invoiceId) {
    return repository.findByInvoiceIdOrderByOccurredAtAsc(invoiceId);
  }
}
