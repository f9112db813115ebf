package io.restoreassist.sync.sync;

import io.restoreassist.sync.invoice.InvoiceRepository;
import io.restoreassist.sync.invoice.InvoiceSyncStatus;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Rebuilds the in-memory queue after a restart. Every invoice still PENDING had a job in flight
 * or queued when the process stopped; it is re-enqueued at NORMAL priority.
 */
@Component
public class SyncQueueRecovery {

  private static final Logger log = LoggerFactory.getLogger(SyncQueueRecovery.class);

  private final InvoiceRepository invoiceRepository;
  private final SyncQueue syncQueue;
  private final Clock clock;

  public SyncQueueRecovery(InvoiceRepository invoiceRepository, SyncQueue syncQueue, Clock clock) {
    this.invoiceRepository = invoiceRepository;
    this.syncQueue = syncQueue;
    this.clock = clock;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void recoverPendingJobs() {
    var pending = invoiceRepository.findBySyncStatus(InvoiceSyncStatus.PENDING);
    int recovered = 0;
    for (var invoice : pending) {
      if (invoice.getSyncProvider() == null) {
        log.warn("Invoice {} is PENDING without a provider, skipping recovery", invoice.getId());
        continue;
      }
      syncQueue.enqueue(
          SyncJob.create(
              invoice.getId(), invoice.getSyncProvider(), SyncPriority.NORMAL, clock.instant()));
      recovered++;
    }
    log.info("Sync queue recovery completed: {} pending invoices re-enqueued", recovered);
  }
}
