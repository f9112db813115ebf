package io.restoreassist.sync.config;

import io.restoreassist.sync.integration.IntegrationProvider;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning values for the outbound sync path, bound from {@code restoreassist.sync.*}. Every value
 * has a default so the service starts with an empty configuration.
 */
@ConfigurationProperties("restoreassist.sync")
public record SyncProperties(
    Worker worker,
    Retry retry,
    Breaker breaker,
    Duration providerTimeout,
    Duration metricsWindow,
    Map<IntegrationProvider, RateLimit> rateLimits) {

  private static final Map<IntegrationProvider, RateLimit> DEFAULT_RATE_LIMITS =
      Map.of(
          IntegrationProvider.XERO, new RateLimit(60, Duration.ofMinutes(1)),
          IntegrationProvider.QUICKBOOKS, new RateLimit(500, Duration.ofMinutes(1)),
          IntegrationProvider.MYOB, new RateLimit(8, Duration.ofSeconds(1)));

  public SyncProperties {
    worker = worker != null ? worker : new Worker(null, null);
    retry = retry != null ? retry : new Retry(null, null, null, null);
    breaker = breaker != null ? breaker : new Breaker(null, null, null, null);
    providerTimeout = providerTimeout != null ? providerTimeout : Duration.ofSeconds(30);
    metricsWindow = metricsWindow != null ? metricsWindow : Duration.ofMinutes(15);
    var limits = new EnumMap<IntegrationProvider, RateLimit>(DEFAULT_RATE_LIMITS);
    if (rateLimits != null) {
      limits.putAll(rateLimits);
    }
    rateLimits = Map.copyOf(limits);
  }

  public static SyncProperties defaults() {
    return new SyncProperties(null, null, null, null, null, null);
  }

  public RateLimit rateLimitFor(IntegrationProvider provider) {
    return rateLimits.get(provider);
  }

  /** Orchestrator worker pool. {@code count} bounds how many jobs are in flight at once. */
  public record Worker(Integer count, Long pollIntervalMs) {
    public Worker {
      count = count != null ? count : 4;
      pollIntervalMs = pollIntervalMs != null ? pollIntervalMs : 250L;
    }
  }

  public record Retry(
      Integer maxRetries, Duration baseDelay, Duration maxDelay, Double jitterRatio) {
    public Retry {
      maxRetries = maxRetries != null ? maxRetries : 5;
      baseDelay = baseDelay != null ? baseDelay : Duration.ofSeconds(2);
      maxDelay = maxDelay != null ? maxDelay : Duration.ofMinutes(10);
      jitterRatio = jitterRatio != null ? jitterRatio : 0.2;
    }
  }

  public record Breaker(
      Integer failureThreshold,
      Duration cooldown,
      Double cooldownMultiplier,
      Duration maxCooldown) {
    public Breaker {
      failureThreshold = failureThreshold != null ? failureThreshold : 5;
      cooldown = cooldown != null ? cooldown : Duration.ofSeconds(60);
      cooldownMultiplier = cooldownMultiplier != null ? cooldownMultiplier : 2.0;
      maxCooldown = maxCooldown != null ? maxCooldown : Duration.ofMinutes(30);
    }
  }

  /** Provider quota: {@code capacity} calls per {@code window}. */
  public record RateLimit(Integer capacity, Duration window) {
    public RateLimit {
      capacity = capacity != null ? capacity : 60;
      window = window != null ? window : Duration.ofMinutes(1);
    }
  }
}
