package io.restoreassist.sync.metrics;

import io.restoreassist.sync.integration.resilience.CircuitBreakerSnapshot;
import io.restoreassist.sync.integration.resilience.RateLimiterSnapshot;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Point-in-time view served by {@code GET /api/internal/sync/metrics}. */
public record SyncMetricsSnapshot(
    Instant generatedAt,
    QueueStats queue,
    List<CircuitBreakerSnapshot> circuitBreakers,
    List<RateLimiterSnapshot> rateLimiters,
    SyncMetricsService.RollingWindowStats rollingWindow,
    WebhookStats webhooks) {

  /**
   * @param oldestJobAgeSeconds null when the queue is empty
   */
  public record QueueStats(
      int depth, Map<String, Integer> depthByProvider, Long oldestJobAgeSeconds) {}

  public record WebhookStats(long pending, long processing, long failed, long deadLettered) {}
}
