package io.restoreassist.sync.sync;

import io.restoreassist.sync.integration.IntegrationProvider;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable queue entry: "push this invoice to this provider". Retries produce a copy with a
 * higher {@code attempt} and a later {@code eligibleAt}; {@code enqueuedAt} never changes, so a
 * retried job keeps its FIFO position among jobs of the same priority.
 *
 * @param attempt number of provider calls already made and failed transiently (0 before the first)
 */
public record SyncJob(
    UUID id,
    UUID invoiceId,
    IntegrationProvider provider,
    SyncPriority priority,
    int attempt,
    Instant eligibleAt,
    Instant enqueuedAt) {

  public static SyncJob create(
      UUID invoiceId, IntegrationProvider provider, SyncPriority priority, Instant now) {
    return new SyncJob(UUID.randomUUID(), invoiceId, provider, priority, 0, now, now);
  }

  /** Next attempt after a failure. */
  public SyncJob retryAt(Instant nextEligibleAt) {
    return new SyncJob(
        id, invoiceId, provider, priority, attempt + 1, nextEligibleAt, enqueuedAt);
  }

  /** Same attempt, later start: used when the call was never made. */
  public SyncJob deferredUntil(Instant nextEligibleAt) {
    return new SyncJob(id, invoiceId, provider, priority, attempt, nextEligibleAt, enqueuedAt);
  }

  SyncJob mergedWith(SyncJob other) {
    var earliest = other.eligibleAt.isBefore(eligibleAt) ? other.eligibleAt : eligibleAt;
    return new SyncJob(
        id, invoiceId, provider, priority.max(other.priority), attempt, earliest, enqueuedAt);
  }

  public boolean isEligible(Instant now) {
    return !eligibleAt.isAfter(now);
  }
}
