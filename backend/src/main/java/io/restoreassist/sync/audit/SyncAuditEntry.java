package io.restoreassist.sync.audit;

import io.restoreassist.sync.integration.IntegrationProvider;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Append-only history of sync activity. No setters: entries are never modified. */
@Entity
@Table(name = "sync_audit_log")
public class SyncAuditEntry {

  static final int MAX_DETAIL_LENGTH = 2000;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "invoice_id", nullable = false, updatable = false)
  private UUID invoiceId;

  @Enumerated(EnumType.STRING)
  @Column(name = "provider", nullable = false, updatable = false, length = 20)
  private IntegrationProvider provider;

  @Enumerated(EnumType.STRING)
  @Column(name = "action", nullable = false, updatable = false, length = 30)
  private SyncAuditAction action;

  @Column(name = "attempt", nullable = false, updatable = false)
  private int attempt;

  @Column(name = "job_id", updatable = false)
  private UUID jobId;

  @Column(name = "detail", updatable = false, columnDefinition = "TEXT")
  private String detail;

  @Column(name = "source", nullable = false, updatable = false, length = 20)
  private String source;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  protected SyncAuditEntry() {}

  public SyncAuditEntry(SyncAuditRecord record, Instant occurredAt) {
    this.invoiceId = record.invoiceId();
    this.provider = record.provider();
    this.action = record.action();
    this.attempt = record.attempt();
    this.jobId = record.jobId();
    this.detail = truncate(record.detail());
    this.source = record.source();
    this.occurredAt = occurredAt;
  }

  private static String truncate(String detail) {
    if (detail == null || detail.length() <= MAX_DETAIL_LENGTH) {
      return detail;
    }
    return detail.substring(0, MAX_DETAIL_LENGTH);
  }

  public UUID getId() {
    return id;
  }

  public UUID getInvoiceId() {
    return invoiceId;
  }

  public IntegrationProvider getProvider() {
    return provider;
  }

  public SyncAuditAction getAction() {
    return action;
  }

  public int getAttempt() {
    return attempt;
  }

  public UUID getJobId() {
    return jobId;
  }

  public String getDetail() {
    return detail;
  }

  public String getSource() {
    return source;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }
}
