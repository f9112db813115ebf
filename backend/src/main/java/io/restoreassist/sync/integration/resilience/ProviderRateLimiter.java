package io.restoreassist.sync.integration.resilience;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.TimeMeter;
import io.restoreassist.sync.config.SyncProperties;
import io.restoreassist.sync.integration.IntegrationProvider;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-window quota for one provider: {@code capacity} admissions per {@code window}, held in a
 * Bucket4j bucket that refills all at once at each window boundary. The bucket reads time from the
 * injected {@link Clock}.
 */
public class ProviderRateLimiter {

  private static final Logger log = LoggerFactory.getLogger(ProviderRateLimiter.class);

  private final IntegrationProvider provider;
  private final int capacity;
  private final Duration window;
  private final Clock clock;
  private final Bucket bucket;
  private final AtomicReference<Instant> blockedUntil = new AtomicReference<>();

  public ProviderRateLimiter(
      IntegrationProvider provider, SyncProperties.RateLimit config, Clock clock) {
    this.provider = provider;
    this.capacity = config.capacity();
    this.window = config.window();
    this.clock = clock;
    this.bucket =
        Bucket.builder()
            .addLimit(
                Bandwidth.builder()
                    .capacity(capacity)
                    .refillIntervally(capacity, window)
                    .build())
            .withCustomTimePrecision(new ClockTimeMeter(clock))
            .build();
  }

  public RateLimitDecision tryAcquire() {
    var now = clock.instant();
    var until = blockedUntil.get();
    if (until != null && now.isBefore(until)) {
      return RateLimitDecision.deny(min(Duration.between(now, until), window));
    }
    var consumption = bucket.tryConsumeAndReturnRemaining(1);
    if (consumption.isConsumed()) {
      return RateLimitDecision.allow((int) consumption.getRemainingTokens());
    }
    return RateLimitDecision.deny(Duration.ofNanos(consumption.getNanosToWaitForRefill()));
  }

  /**
   * Empties the bucket and refuses admissions until {@code until}. Used when the provider itself
   * answers 429, which means our local view of the quota was too optimistic.
   */
  public void drainUntil(Instant until) {
    bucket.tryConsumeAsMuchAsPossible();
    blockedUntil.accumulateAndGet(
        until, (current, next) -> current == null || next.isAfter(current) ? next : current);
    log.warn("Rate limiter {} drained until {}", provider, until);
  }

  public int remainingTokens() {
    var until = blockedUntil.get();
    if (until != null && clock.instant().isBefore(until)) {
      return 0;
    }
    return (int) bucket.getAvailableTokens();
  }

  public RateLimiterSnapshot snapshot() {
    var until = blockedUntil.get();
    if (until != null && !clock.instant().isBefore(until)) {
      until = null;
    }
    return new RateLimiterSnapshot(provider.getSlug(), capacity, remainingTokens(), window, until);
  }

  public IntegrationProvider getProvider() {
    return provider;
  }

  private static Duration min(Duration a, Duration b) {
    return a.compareTo(b) <= 0 ? a : b;
  }

  /** Bucket4j time source backed by a {@link Clock}, so tests can move time by hand. */
  private record ClockTimeMeter(Clock clock) implements TimeMeter {

    @Override
    public long currentTimeNanos() {
      var now = clock.instant();
      return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }

    @Override
    public boolean isWallClockBased() {
      return true;
    }
  }
}
