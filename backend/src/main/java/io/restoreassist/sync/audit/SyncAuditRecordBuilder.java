package io.restoreassist.sync.audit;

import io.restoreassist.sync.integration.IntegrationProvider;
import io.restoreassist.sync.sync.SyncJob;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;

/**
 * Builder for {@link SyncAuditRecord}. Usage:
 *
 * <pre>{@code
 * auditService.log(
 *     SyncAuditRecordBuilder.forJob(job)
 *         .action(SyncAuditAction.RETRIED)
 *         .detail(error.getMessage())
 *         .build());
 * }</pre>
 */
public class SyncAuditRecordBuilder {

  private UUID invoiceId;
  private IntegrationProvider provider;
  private SyncAuditAction action;
  private int attempt;
  private UUID jobId;
  private String detail;

  private SyncAuditRecordBuilder() {}

  public static SyncAuditRecordBuilder builder() {
    return new SyncAuditRecordBuilder();
  }

  /** Pre-fills invoice, provider, attempt and job id from a queue job. */
  public static SyncAuditRecordBuilder forJob(SyncJob job) {
    return builder()
        .invoiceId(job.invoiceId())
        .provider(job.provider())
        .attempt(job.attempt())
        .jobId(job.id());
  }

  public SyncAuditRecordBuilder invoiceId(UUID invoiceId) {
    this.invoiceId = invoiceId;
    return this;
  }

  public SyncAuditRecordBuilder provider(IntegrationProvider provider) {
    this.provider = provider;
    return this;
  }

  public SyncAuditRecordBuilder action(SyncAuditAction action) {
    this.action = action;
    return this;
  }

  public SyncAuditRecordBuilder attempt(int attempt) {
    this.attempt = attempt;
    return this;
  }

  public SyncAuditRecordBuilder jobId(UUID jobId) {
    this.jobId = jobId;
    return this;
  }

  public SyncAuditRecordBuilder detail(String detail) {
    this.detail = detail;
    return this;
  }

  public SyncAuditRecord build() {
    if (invoiceId == null || provider == null || action == null) {
      throw new IllegalStateException("invoiceId, provider and action are required");
    }
    var source = RequestContextHolder.getRequestAttributes() != null ? "API" : "WORKER";
    return new SyncAuditRecord(invoiceId, provider, action, attempt, jobId, detail, source);
  }
}
