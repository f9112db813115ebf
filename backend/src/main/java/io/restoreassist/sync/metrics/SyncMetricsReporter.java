package io.restoreassist.sync.metrics;

import io.restoreassist.sync.integration.resilience.CircuitBreakerRegistry;
import io.restoreassist.sync.integration.resilience.RateLimiterRegistry;
import io.restoreassist.sync.sync.SyncQueue;
import io.restoreassist.sync.webhook.WebhookEventRepository;
import io.restoreassist.sync.webhook.WebhookEventStatus;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Gathers queue, breaker, limiter, rolling-window and webhook figures into one snapshot. */
@Service
public class SyncMetricsReporter {

  private final SyncQueue syncQueue;
  private final CircuitBreakerRegistry circuitBreakers;
  private final RateLimiterRegistry rateLimiters;
  private final SyncMetricsService metricsService;
  private final WebhookEventRepository webhookEventRepository;
  private final Clock clock;

  public SyncMetricsReporter(
      SyncQueue syncQueue,
      CircuitBreakerRegistry circuitBreakers,
      RateLimiterRegistry rateLimiters,
      SyncMetricsService metricsService,
      WebhookEventRepository webhookEventRepository,
      Clock clock) {
    this.syncQueue = syncQueue;
    this.circuitBreakers = circuitBreakers;
    this.rateLimiters = rateLimiters;
    this.metricsService = metricsService;
    this.webhookEventRepository = webhookEventRepository;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public SyncMetricsSnapshot snapshot() {
    var depthByProvider = new LinkedHashMap<String, Integer>();
    syncQueue.depthByProvider().forEach((p, depth) -> depthByProvider.put(p.getSlug(), depth));
    var queue =
        new SyncMetricsSnapshot.QueueStats(
            depthByProvider.values().stream().mapToInt(Integer::intValue).sum(),
            depthByProvider,
            syncQueue.oldestJobAge().map(Duration::toSeconds).orElse(null));

    var webhooks =
        new SyncMetricsSnapshot.WebhookStats(
            webhookEventRepository.countByStatus(WebhookEventStatus.PENDING),
            webhookEventRepository.countByStatus(WebhookEventStatus.PROCESSING),
            webhookEventRepository.countByStatus(WebhookEventStatus.FAILED),
            webhookEventRepository.countByStatusAndNextAttemptAtIsNull(WebhookEventStatus.FAILED));

    return new SyncMetricsSnapshot(
        clock.instant(),
        queue,
        circuitBreakers.snapshots(),
        rateLimiters.snapshots(),
        metricsService.rollingWindow(),
        webhooks);
  }
}
