package io.restoreassist.sync.sync;

import io.restoreassist.sync.audit.AuditService;
import io.restoreassist.sync.audit.SyncAuditAction;
import io.restoreassist.sync.audit.SyncAuditRecordBuilder;
import io.restoreassist.sync.integration.IntegrationService;
import io.restoreassist.sync.integration.accounting.AuthExpiredException;
import io.restoreassist.sync.integration.accounting.InvoiceSyncRequest;
import io.restoreassist.sync.integration.accounting.ProviderException;
import io.restoreassist.sync.invoice.InvoiceLineRepository;
import io.restoreassist.sync.invoice.InvoiceRepository;
import io.restoreassist.sync.invoice.InvoiceSyncStatus;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists the outcome of each orchestrator step. Each method is one transaction covering the
 * invoice change, the integration change and the single audit entry for that transition.
 */
@Component
public class SyncStateRecorder {

  private static final Logger log = LoggerFactory.getLogger(SyncStateRecorder.class);

  private final InvoiceRepository invoiceRepository;
  private final InvoiceLineRepository invoiceLineRepository;
  private final IntegrationService integrationService;
  private final AuditService auditService;
  private final Clock clock;

  public SyncStateRecorder(
      InvoiceRepository invoiceRepository,
      InvoiceLineRepository invoiceLineRepository,
      IntegrationService integrationService,
      AuditService auditService,
      Clock clock) {
    this.invoiceRepository = invoiceRepository;
    this.invoiceLineRepository = invoiceLineRepository;
    this.integrationService = integrationService;
    this.auditService = auditService;
    this.clock = clock;
  }

  /** Builds the provider request, or empty if the invoice is no longer waiting on this job. */
  @Transactional(readOnly = true)
  public Optional<InvoiceSyncRequest> prepare(SyncJob job) {
    return invoiceRepository
        .findById(job.invoiceId())
        .filter(
            invoice ->
                invoice.getSyncStatus() == InvoiceSyncStatus.PENDING
                    && invoice.getSyncProvider() == job.provider())
        .map(
            invoice ->
                InvoiceSyncRequest.from(
                    invoice,
                    invoiceLineRepository.findByInvoiceIdOrderBySortOrder(invoice.getId()),
                    job.attempt()));
  }

  /** Returns {@code false} if the invoice was already SYNCED and nothing was written. */
  @Transactional
  public boolean recordSuccess(SyncJob job, String externalId) {
    var invoice = invoiceRepository.findById(job.invoiceId()).orElse(null);
    if (invoice == null) {
      log.warn("Invoice {} disappeared before its sync result was recorded", job.invoiceId());
      return false;
    }
    var now = clock.instant();
    if (!invoice.markSynced(externalId, now)) {
      log.info("Invoice {} already SYNCED, ignoring duplicate success", job.invoiceId());
      return false;
    }
    invoiceRepository.save(invoice);
    integrationService.recordSuccess(invoice.getOrganizationId(), job.provider(), now);
    auditService.log(
        SyncAuditRecordBuilder.forJob(job)
            .action(SyncAuditAction.SUCCEEDED)
            .detail("externalId=" + invoice.getExternalId())
            .build());
    return true;
  }

  @Transactional
  public void recordRetry(SyncJob job, ProviderException error, Duration delay) {
    auditService.log(
        SyncAuditRecordBuilder.forJob(job)
            .action(SyncAuditAction.RETRIED)
            .detail(error.getMessage() + " (retry in " + delay.toMillis() + "ms)")
            .build());
  }

  @Transactional
  public void recordFailure(SyncJob job, ProviderException error) {
    var invoice = invoiceRepository.findById(job.invoiceId()).orElse(null);
    if (invoice == null || !invoice.markSyncFailed(error.getMessage())) {
      log.info("Invoice {} no longer PENDING, not recording failure", job.invoiceId());
      return;
    }
    invoiceRepository.save(invoice);
    if (error instanceof AuthExpiredException) {
      integrationService.markAuthExpired(
          invoice.getOrganizationId(), job.provider(), error.getMessage());
    } else {
      integrationService.recordError(
          invoice.getOrganizationId(), job.provider(), error.getMessage());
    }
    auditService.log(
        SyncAuditRecordBuilder.forJob(job)
            .action(SyncAuditAction.FAILED)
            .detail(error.getMessage())
            .build());
  }

  @Transactional
  public void recordCircuitOpenDeferral(SyncJob job, Duration retryAfter) {
    auditService.log(
        SyncAuditRecordBuilder.forJob(job)
            .action(SyncAuditAction.DEFERRED)
            .detail("circuit open, retry in " + retryAfter.toMillis() + "ms")
            .build());
  }
}
