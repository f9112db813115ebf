package io.restoreassist.sync.metrics;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.restoreassist.sync.config.SyncProperties;
import io.restoreassist.sync.integration.IntegrationProvider;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Rolling-window sync outcome counters. Outcomes land in one-minute buckets per provider; buckets
 * older than the window are ignored when reading and evicted by Caffeine shortly after.
 */
@Service
public class SyncMetricsService {

  private final Duration window;
  private final long windowMinutes;
  private final Clock clock;
  private final Cache<BucketKey, Bucket> buckets;

  @Autowired
  public SyncMetricsService(SyncProperties properties, Clock clock) {
    this(properties.metricsWindow(), clock, Ticker.systemTicker());
  }

  SyncMetricsService(Duration window, Clock clock, Ticker ticker) {
    this.window = window;
    this.windowMinutes = Math.max(1, window.toMinutes());
    this.clock = clock;
    this.buckets =
        Caffeine.newBuilder()
            .expireAfterWrite(window.plusMinutes(1))
            .maximumSize(10_000)
            .ticker(ticker)
            .build();
  }

  public void recordSuccess(IntegrationProvider provider, Duration elapsed) {
    var bucket = currentBucket(provider);
    bucket.successes.incrementAndGet();
    bucket.recordDuration(elapsed);
  }

  public void recordFailure(IntegrationProvider provider, Duration elapsed) {
    var bucket = currentBucket(provider);
    bucket.failures.incrementAndGet();
    bucket.recordDuration(elapsed);
  }

  public void recordRetry(IntegrationProvider provider, Duration elapsed) {
    var bucket = currentBucket(provider);
    bucket.retries.incrementAndGet();
    bucket.recordDuration(elapsed);
  }

  public void recordDeferral(IntegrationProvider provider) {
    currentBucket(provider).deferrals.incrementAndGet();
  }

  public RollingWindowStats rollingWindow() {
    long oldestMinute = currentMinute() - windowMinutes + 1;
    var perProvider = new EnumMap<IntegrationProvider, Totals>(IntegrationProvider.class);
    var overall = new Totals();
    buckets
        .asMap()
        .forEach(
            (key, bucket) -> {
              if (key.minute() >= oldestMinute) {
                overall.add(bucket);
                perProvider.computeIfAbsent(key.provider(), p -> new Totals()).add(bucket);
              }
            });
    var byProvider = new LinkedHashMap<String, ProviderStats>();
    perProvider.forEach((provider, totals) -> byProvider.put(provider.getSlug(), totals.toStats()));
    var stats = overall.toStats();
    return new RollingWindowStats(
        window.toSeconds(),
        stats.successes(),
        stats.failures(),
        stats.retries(),
        stats.deferrals(),
        stats.averageDurationMs(),
        byProvider);
  }

  private Bucket currentBucket(IntegrationProvider provider) {
    return buckets.get(new BucketKey(provider, currentMinute()), k -> new Bucket());
  }

  private long currentMinute() {
    return clock.millis() / 60_000;
  }

  /** Outcome counts over the window; {@code averageDurationMs} is null when nothing ran. */
  public record RollingWindowStats(
      long windowSeconds,
      long successes,
      long failures,
      long retries,
      long deferrals,
      Double averageDurationMs,
      Map<String, ProviderStats> byProvider) {}

  public record ProviderStats(
      long successes, long failures, long retries, long deferrals, Double averageDurationMs) {}

  private record BucketKey(IntegrationProvider provider, long minute) {}

  private static final class Bucket {
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong deferrals = new AtomicLong();
    private final AtomicLong durationMillis = new AtomicLong();
    private final AtomicLong durationSamples = new AtomicLong();

    private void recordDuration(Duration elapsed) {
      durationMillis.addAndGet(elapsed.toMillis());
      durationSamples.incrementAndGet();
    }
  }

  private static final class Totals {
    private long successes;
    private long failures;
    private long retries;
    private long deferrals;
    private long durationMillis;
    private long durationSamples;

    private void add(Bucket bucket) {
      successes += bucket.successes.get();
      failures += bucket.failures.get();
      retries += bucket.retries.get();
      deferrals += bucket.deferrals.get();
      durationMillis += bucket.durationMillis.get();
      durationSamples += bucket.durationSamples.get();
    }

    private ProviderStats toStats() {
      Double average = durationSamples == 0 ? null : (double) durationMillis / durationSamples;
      return new ProviderStats(successes, failures, retries, deferrals, average);
    }
  }
}
