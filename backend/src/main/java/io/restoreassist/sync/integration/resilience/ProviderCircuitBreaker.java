package io.restoreassist.sync.integration.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;
import io.github.resilience4j.core.IntervalFunction;
import io.restoreassist.sync.config.SyncProperties;
import io.restoreassist.sync.integration.IntegrationProvider;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consecutive-failure circuit breaker for one provider, backed by a Resilience4j state machine.
 *
 * <p>The count-based window is exactly {@code failureThreshold} calls wide and trips at a 100%
 * failure rate, so the breaker opens after that many consecutive failures. OPEN rejects until the
 * cooldown has elapsed, then admits a single trial call in HALF_OPEN. A failed trial call reopens
 * it with the cooldown multiplied by {@code cooldownMultiplier}, capped at {@code maxCooldown}.
 *
 * <p>Every granted {@link Permit} carries the transition epoch it was issued in and is settled with
 * exactly one of {@link #onSuccess}, {@link #onFailure} or {@link #releasePermission}. Settling a
 * permit from an earlier epoch is a no-op: a call admitted before the breaker opened can neither
 * close it nor hand back the half-open trial slot.
 */
public class ProviderCircuitBreaker {

  private static final Logger log = LoggerFactory.getLogger(ProviderCircuitBreaker.class);

  /** Wait suggested to callers that arrive while the half-open trial call is still running. */
  static final Duration TRIAL_CALL_WAIT = Duration.ofSeconds(1);

  private final IntegrationProvider provider;
  private final CircuitBreaker delegate;
  private final IntervalFunction cooldowns;
  private final Duration baseCooldown;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();

  private CircuitState state = CircuitState.CLOSED;
  private long epoch;
  private int consecutiveFailures;
  private int openings;
  private Instant lastTransitionAt;
  private Duration currentCooldown;

  public ProviderCircuitBreaker(
      IntegrationProvider provider, SyncProperties.Breaker config, Clock clock) {
    this.provider = provider;
    this.baseCooldown = config.cooldown();
    this.clock = clock;
    this.cooldowns =
        IntervalFunction.ofExponentialBackoff(
            config.cooldown(), config.cooldownMultiplier(), config.maxCooldown());
    var breakerConfig =
        CircuitBreakerConfig.custom()
            .slidingWindowType(SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(config.failureThreshold())
            .minimumNumberOfCalls(config.failureThreshold())
            .failureRateThreshold(100)
            .permittedNumberOfCallsInHalfOpenState(1)
            .waitIntervalFunctionInOpenState(cooldowns)
            .build();
    this.delegate = new CircuitBreakerStateMachine(provider.getSlug(), breakerConfig, clock);
    this.currentCooldown = baseCooldown;
    this.lastTransitionAt = clock.instant();
  }

  /**
   * @throws CircuitOpenException if the breaker is OPEN or its half-open trial call is still
   *     running
   */
  public Permit acquirePermission() {
    lock.lock();
    try {
      boolean permitted = delegate.tryAcquirePermission();
      syncState();
      if (!permitted) {
        var remaining = remainingCooldownLocked();
        throw new CircuitOpenException(provider, remaining.isZero() ? TRIAL_CALL_WAIT : remaining);
      }
      return new Permit(epoch);
    } finally {
      lock.unlock();
    }
  }

  public void onSuccess(Permit permit, Duration elapsed) {
    lock.lock();
    try {
      if (isStale(permit, "success")) {
        return;
      }
      consecutiveFailures = 0;
      delegate.onSuccess(elapsed.toNanos(), TimeUnit.NANOSECONDS);
      syncState();
    } finally {
      lock.unlock();
    }
  }

  public void onFailure(Permit permit, Duration elapsed, Throwable error) {
    lock.lock();
    try {
      if (isStale(permit, "failure")) {
        return;
      }
      consecutiveFailures++;
      delegate.onError(elapsed.toNanos(), TimeUnit.NANOSECONDS, error);
      syncState();
    } finally {
      lock.unlock();
    }
  }

  /** Hands back a permission without reporting an outcome (the call was never a health signal). */
  public void releasePermission(Permit permit) {
    lock.lock();
    try {
      if (isStale(permit, "release")) {
        return;
      }
      delegate.releasePermission();
    } finally {
      lock.unlock();
    }
  }

  /** Time until an OPEN breaker will admit a trial call; zero in any other state. */
  public Duration remainingCooldown() {
    lock.lock();
    try {
      return remainingCooldownLocked();
    } finally {
      lock.unlock();
    }
  }

  public CircuitState getState() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  public CircuitBreakerSnapshot snapshot() {
    lock.lock();
    try {
      return new CircuitBreakerSnapshot(
          provider.getSlug(), state, consecutiveFailures, lastTransitionAt, currentCooldown);
    } finally {
      lock.unlock();
    }
  }

  /** Forces the breaker CLOSED with a clean failure count and base cooldown. */
  public void reset() {
    lock.lock();
    try {
      delegate.reset();
      consecutiveFailures = 0;
      syncState();
    } finally {
      lock.unlock();
    }
  }

  public IntegrationProvider getProvider() {
    return provider;
  }

  private boolean isStale(Permit permit, String outcome) {
    if (permit.epoch() == epoch) {
      return false;
    }
    log.debug(
        "Ignoring {} on circuit breaker {} from epoch {} (now {}, state {})",
        outcome,
        provider,
        permit.epoch(),
        epoch,
        state);
    return true;
  }

  private Duration remainingCooldownLocked() {
    if (state != CircuitState.OPEN) {
      return Duration.ZERO;
    }
    var reopensAt = lastTransitionAt.plus(currentCooldown);
    var now = clock.instant();
    return now.isBefore(reopensAt) ? Duration.between(now, reopensAt) : Duration.ZERO;
  }

  /** Mirrors a transition made by the state machine; each one starts a new permit epoch. */
  private void syncState() {
    var next = toCircuitState(delegate.getState());
    if (next == state) {
      return;
    }
    var previous = state;
    state = next;
    epoch++;
    lastTransitionAt = clock.instant();
    switch (next) {
      case OPEN -> {
        openings++;
        currentCooldown = Duration.ofMillis(cooldowns.apply(openings));
      }
      case CLOSED -> {
        openings = 0;
        currentCooldown = baseCooldown;
      }
      case HALF_OPEN -> {}
    }
    log.info(
        "Circuit breaker {} transition {} -> {} (consecutiveFailures={}, cooldown={})",
        provider,
        previous,
        next,
        consecutiveFailures,
        currentCooldown);
  }

  private static CircuitState toCircuitState(CircuitBreaker.State state) {
    return switch (state) {
      case OPEN, FORCED_OPEN -> CircuitState.OPEN;
      case HALF_OPEN -> CircuitState.HALF_OPEN;
      default -> CircuitState.CLOSED;
    };
  }

  /** Proof of an admitted call, tied to the transition epoch it was granted in. */
  public record Permit(long epoch) {}
}
