package io.restoreassist.sync.webhook;

import io.restoreassist.sync.integration.IntegrationProvider;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;

/**
 * A provider webhook delivery, stored before it is acknowledged. The idempotency key is unique, so
 * a redelivery of the same event only bumps {@code deliveryCount}.
 *
 * <p>Status moves PENDING → PROCESSING → PROCESSED | SKIPPED | FAILED. A FAILED event with a
 * {@code nextAttemptAt} is retried; one without is dead-lettered.
 */
@Entity
@Table(name = "webhook_events")
public class WebhookEvent {

  @Id private UUID id;

  @Version
  @Column(name = "version")
  private Long version;

  @Enumerated(EnumType.STRING)
  @Column(name = "provider", nullable = false, updatable = false, length = 20)
  private IntegrationProvider provider;

  @Column(name = "idempotency_key", nullable = false, updatable = false, unique = true)
  private String idempotencyKey;

  @Column(name = "event_type", nullable = false, updatable = false, length = 100)
  private String eventType;

  @Column(name = "provider_event_id", updatable = false)
  private String providerEventId;

  @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "TEXT")
  private String payload;

  @Column(name = "received_at", nullable = false, updatable = false)
  private Instant receivedAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private WebhookEventStatus status = WebhookEventStatus.PENDING;

  @Column(name = "attempts", nullable = false)
  private int attempts;

  @Column(name = "next_attempt_at")
  private Instant nextAttemptAt;

  @Column(name = "claimed_at")
  private Instant claimedAt;

  @Column(name = "last_error", columnDefinition = "TEXT")
  private String lastError;

  @Column(name = "delivery_count", nullable = false)
  private int deliveryCount = 1;

  @Column(name = "processed_at")
  private Instant processedAt;

  protected WebhookEvent() {}

  public WebhookEvent(
      IntegrationProvider provider,
      String idempotencyKey,
      String eventType,
      String providerEventId,
      String payload,
      Instant receivedAt) {
    this.id = UUID.randomUUID();
    this.provider = provider;
    this.idempotencyKey = idempotencyKey;
    this.eventType = eventType;
    this.providerEventId = providerEventId;
    this.payload = payload;
    this.receivedAt = receivedAt;
  }

  public void recordDuplicateDelivery() {
    this.deliveryCount++;
  }

  public void markProcessed(Instant now) {
    this.status = WebhookEventStatus.PROCESSED;
    this.processedAt = now;
    this.nextAttemptAt = null;
    this.lastError = null;
  }

  public void markSkipped(String reason, Instant now) {
    this.status = WebhookEventStatus.SKIPPED;
    this.processedAt = now;
    this.nextAttemptAt = null;
    this.lastError = reason;
  }

  /**
   * @param retryAt when to try again, or {@code null} to dead-letter the event
   */
  public void markFailed(String error, Instant retryAt) {
    this.status = WebhookEventStatus.FAILED;
    this.lastError = error;
    this.nextAttemptAt = retryAt;
  }

  /** Puts a dead-lettered event back in line with a fresh attempt budget. */
  public void rearm(Instant now) {
    this.status = WebhookEventStatus.PENDING;
    this.attempts = 0;
    this.nextAttemptAt = now;
  }

  public boolean isDeadLettered() {
    return status == WebhookEventStatus.FAILED && nextAttemptAt == null;
  }

  public UUID getId() {
    return id;
  }

  public Long getVersion() {
    return version;
  }

  public IntegrationProvider getProvider() {
    return provider;
  }

  public String getIdempotencyKey() {
    return idempotencyKey;
  }

  public String getEventType() {
    return eventType;
  }

  public String getProviderEventId() {
    return providerEventId;
  }

  public String getPayload() {
    return payload;
  }

  public Instant getReceivedAt() {
    return receivedAt;
  }

  public WebhookEventStatus getStatus() {
    return status;
  }

  public int getAttempts() {
    return attempts;
  }

  public Instant getNextAttemptAt() {
    return nextAttemptAt;
  }

  public Instant getClaimedAt() {
    return claimedAt;
  }

  public String getLastError() {
    return lastError;
  }

  public int getDeliveryCount() {
    return deliveryCount;
  }

  public Instant getProcessedAt() {
    return processedAt;
  }
}
