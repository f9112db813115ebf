package io.restoreassist.sync.integration.resilience;

import java.time.Duration;

/**
 * Outcome of a {@link ProviderRateLimiter#tryAcquire()} call. {@code retryAfter} is zero when
 * allowed.
 */
public record RateLimitDecision(boolean allowed, int remainingTokens, Duration retryAfter) {

  static RateLimitDecision allow(int remainingTokens) {
    return new RateLimitDecision(true, remainingTokens, Duration.ZERO);
  }

  static RateLimitDecision deny(Duration retryAfter) {
    return new RateLimitDecision(false, 0, retryAfter);
  }
}
