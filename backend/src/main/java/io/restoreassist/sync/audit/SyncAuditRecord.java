package io.restoreassist.sync.audit;

import io.restoreassist.sync.integration.IntegrationProvider;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(SyncAuditRecord)}. Constructed by {@link
 * SyncAuditRecordBuilder}, which fills in the source.
 *
 * @param invoiceId the invoice the entry belongs to
 * @param provider the accounting provider involved
 * @param action what happened
 * @param attempt the job's attempt count at the time, 0 for the first try
 * @param jobId the queue job, null for entries not tied to a job (webhooks, resets)
 * @param detail free-form detail such as the provider error or external id
 * @param source "API" when written during an HTTP request, "WORKER" otherwise
 */
public record SyncAuditRecord(
    UUID invoiceId,
    IntegrationProvider provider,
    SyncAuditAction action,
    int attempt,
    UUID jobId,
    String detail,
    String source) {}
