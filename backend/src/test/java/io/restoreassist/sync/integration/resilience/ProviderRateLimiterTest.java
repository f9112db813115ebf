package io.restoreassist.sync.integration.resilience;

import static org.assertj.core.api.Assertions.assertThat;

import io.restoreassist.sync.config.SyncProperties;
import io.restoreassist.sync.integration.IntegrationProvider;
import io.restoreassist.sync.testutil.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProviderRateLimiterTest {

  private MutableClock clock;
  private ProviderRateLimiter limiter;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2025-03-01T09:00:00Z");
    limiter =
        new ProviderRateLimiter(
            IntegrationProvider.MYOB,
            new SyncProperties.RateLimit(3, Duration.ofSeconds(10)),
            clock);
  }

  @Test
  void tryAcquire_allowsUpToCapacityWithinWindow() {
    assertThat(limiter.tryAcquire().remainingTokens()).isEqualTo(2);
    assertThat(limiter.tryAcquire().remainingTokens()).isEqualTo(1);
    assertThat(limiter.tryAcquire().allowed()).isTrue();

    var denied = limiter.tryAcquire();

    assertThat(denied.allowed()).isFalse();
    assertThat(denied.retryAfter()).isEqualTo(Duration.ofSeconds(10));
  }

  @Test
  void retryAfter_shrinksAsWindowElapses() {
    exhaust();
    clock.advance(Duration.ofSeconds(7));

    var denied = limiter.tryAcquire();

    assertThat(denied.allowed()).isFalse();
    assertThat(denied.retryAfter()).isEqualTo(Duration.ofSeconds(3));
  }

  @Test
  void tryAcquire_refillsWholeQuotaOnceWindowElapsed() {
    exhaust();
    clock.advance(Duration.ofSeconds(10));

    var decision = limiter.tryAcquire();

    assertThat(decision.allowed()).isTrue();
    assertThat(decision.remainingTokens()).isEqualTo(2);
  }

  @Test
  void tryAcquire_doesNotRefillPartwayThroughWindow() {
    exhaust();
    clock.advance(Duration.ofSeconds(5));
    assertThat(limiter.tryAcquire().allowed()).isFalse();
    assertThat(limiter.snapshot().remainingTokens()).isZero();

    clock.advance(Duration.ofSeconds(5));

    assertThat(limiter.snapshot().remainingTokens()).isEqualTo(3);
  }

  @Test
  void retryAfter_neverExceedsWindow() {
    exhaust();
    for (int second = 0; second < 25; second++) {
      var decision = limiter.tryAcquire();
      if (!decision.allowed()) {
        assertThat(decision.retryAfter()).isLessThanOrEqualTo(Duration.ofSeconds(10));
      }
      clock.advance(Duration.ofSeconds(1));
    }
  }

  @Test
  void drainUntil_blocksAdmissionsButCapsRetryAfterAtWindow() {
    limiter.drainUntil(clock.instant().plus(Duration.ofSeconds(30)));

    var denied = limiter.tryAcquire();
    assertThat(denied.allowed()).isFalse();
    assertThat(denied.retryAfter()).isEqualTo(Duration.ofSeconds(10));
    assertThat(limiter.snapshot().blockedUntil()).isEqualTo(clock.instant().plusSeconds(30));

    clock.advance(Duration.ofSeconds(29));
    assertThat(limiter.tryAcquire().allowed()).isFalse();

    clock.advance(Duration.ofSeconds(1));
    var allowed = limiter.tryAcquire();
    assertThat(allowed.allowed()).isTrue();
    assertThat(allowed.remainingTokens()).isEqualTo(2);
    assertThat(limiter.snapshot().blockedUntil()).isNull();
  }

  @Test
  void drainUntil_keepsTheLaterOfTwoBlocks() {
    limiter.drainUntil(clock.instant().plusSeconds(20));
    limiter.drainUntil(clock.instant().plusSeconds(5));

    clock.advance(Duration.ofSeconds(15));

    assertThat(limiter.tryAcquire().allowed()).isFalse();
    assertThat(limiter.remainingTokens()).isZero();
  }

  private void exhaust() {
    for (int i = 0; i < 3; i++) {
      assertThat(limiter.tryAcquire().allowed()).isTrue();
    }
  }
}
