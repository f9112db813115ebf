package io.restoreassist.sync.sync;

import io.restoreassist.sync.audit.AuditService;
import io.restoreassist.sync.audit.SyncAuditAction;
import io.restoreassist.sync.audit.SyncAuditRecordBuilder;
import io.restoreassist.sync.exception.InvalidStateException;
import io.restoreassist.sync.exception.ResourceNotFoundException;
import io.restoreassist.sync.integration.IntegrationProvider;
import io.restoreassist.sync.integration.IntegrationService;
import io.restoreassist.sync.invoice.Invoice;
import io.restoreassist.sync.invoice.InvoiceRepository;
import io.restoreassist.sync.invoice.InvoiceSyncStatus;
import java.time.Clock;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Entry point for starting, retrying and resetting invoice syncs. Marks the invoice PENDING and
 * writes the audit entry in one transaction; the job reaches the queue only after that commit, so
 * a worker never sees a job whose invoice is not yet PENDING.
 */
@Service
public class SyncService {

  private static final Logger log = LoggerFactory.getLogger(SyncService.class);

  private final InvoiceRepository invoiceRepository;
  private final IntegrationService integrationService;
  private final AuditService auditService;
  private final SyncQueue syncQueue;
  private final Clock clock;

  public SyncService(
      InvoiceRepository invoiceRepository,
      IntegrationService integrationService,
      AuditService auditService,
      SyncQueue syncQueue,
      Clock clock) {
    this.invoiceRepository = invoiceRepository;
    this.integrationService = integrationService;
    this.auditService = auditService;
    this.syncQueue = syncQueue;
    this.clock = clock;
  }

  /**
   * Starts a sync of the invoice to {@code provider}.
   *
   * @throws AlreadySyncingException if the invoice is PENDING or already queued
   * @throws InvoiceAlreadySyncedException if the invoice is SYNCED
   */
  @Transactional
  public EnqueueResult enqueueSync(
      UUID invoiceId, IntegrationProvider provider, SyncPriority priority) {
    var invoice = requireInvoice(invoiceId);
    if (invoice.getSyncStatus() == InvoiceSyncStatus.PENDING
        || syncQueue.contains(invoiceId, provider)) {
      throw new AlreadySyncingException(invoiceId);
    }
    if (invoice.getSyncStatus() == InvoiceSyncStatus.SYNCED) {
      throw new InvoiceAlreadySyncedException(invoiceId);
    }
    return start(invoice, provider, priority, SyncAuditAction.INITIATED);
  }

  /** Re-runs a FAILED sync against the provider it failed on, ahead of normal traffic. */
  @Transactional
  public EnqueueResult retrySync(UUID invoiceId) {
    var invoice = requireInvoice(invoiceId);
    switch (invoice.getSyncStatus()) {
      case PENDING -> throw new AlreadySyncingException(invoiceId);
      case SYNCED -> throw new InvoiceAlreadySyncedException(invoiceId);
      case NOT_SYNCED ->
          throw new InvalidStateException(
              "Nothing to retry", "Invoice " + invoiceId + " has no failed sync to retry");
      case FAILED -> {}
    }
    return start(invoice, invoice.getSyncProvider(), SyncPriority.HIGH, SyncAuditAction.RETRIED);
  }

  /** Returns a SYNCED or FAILED invoice to NOT_SYNCED. Rejected while a sync is pending. */
  @Transactional
  public SyncStatusResponse resetSync(UUID invoiceId) {
    var invoice = requireInvoice(invoiceId);
    var previous = invoice.getSyncStatus();
    invoice.resetSync();
    invoiceRepository.save(invoice);
    if (invoice.getSyncProvider() != null) {
      auditService.log(
          SyncAuditRecordBuilder.builder()
              .invoiceId(invoiceId)
              .provider(invoice.getSyncProvider())
              .action(SyncAuditAction.RESET)
              .detail("reset from " + previous)
              .build());
    }
    log.info("Reset sync state of invoice {} from {}", invoiceId, previous);
    return SyncStatusResponse.from(invoice, false);
  }

  @Transactional(readOnly = true)
  public SyncStatusResponse getSyncStatus(UUID invoiceId) {
    var invoice = requireInvoice(invoiceId);
    boolean queued =
        invoice.getSyncProvider() != null
            && syncQueue.contains(invoiceId, invoice.getSyncProvider());
    return SyncStatusResponse.from(invoice, queued);
  }

  private EnqueueResult start(
      Invoice invoice,
      IntegrationProvider provider,
      SyncPriority priority,
      SyncAuditAction action) {
    if (!invoice.isSyncable()) {
      throw new InvalidStateException(
          "Invoice not syncable",
          "Invoice " + invoice.getInvoiceNumber() + " in status " + invoice.getStatus()
              + " cannot be synced");
    }
    integrationService.requireConnected(invoice.getOrganizationId(), provider);

    invoice.beginSync(provider);
    invoiceRepository.saveAndFlush(invoice);

    var job = SyncJob.create(invoice.getId(), provider, priority, clock.instant());
    auditService.log(
        SyncAuditRecordBuilder.forJob(job)
            .action(action)
            .detail("priority=" + priority)
            .build());
    enqueueAfterCommit(job);

    log.info(
        "Queued sync of invoice {} to provider={} priority={} job={}",
        invoice.getId(),
        provider,
        priority,
        job.id());
    return new EnqueueResult(job.id(), invoice.getId(), provider.getSlug(), priority);
  }

  private void enqueueAfterCommit(SyncJob job) {
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      syncQueue.enqueue(job);
      return;
    }
    TransactionSynchronizationManager.registerSynchronization(
        new TransactionSynchronization() {
          @Override
          public void afterCommit() {
            syncQueue.enqueue(job);
          }
        });
  }

  private Invoice requireInvoice(UUID invoiceId) {
    return invoiceRepository
        .findById(invoiceId)
        .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
  }
}
