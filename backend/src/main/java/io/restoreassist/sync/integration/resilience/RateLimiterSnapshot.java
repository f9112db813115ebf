package io.restoreassist.sync.integration.resilience;

import java.time.Duration;
import java.time.Instant;

/** {@code blockedUntil} is set only while a provider 429 is holding the limiter shut. */
public record RateLimiterSnapshot(
    String provider, int capacity, int remainingTokens, Duration window, Instant blockedUntil) {}
