package io.restoreassist.sync.integration.resilience;

import java.time.Duration;
import java.time.Instant;

/** Point-in-time view of a breaker for the metrics surface. */
public record CircuitBreakerSnapshot(
    String provider,
    CircuitState state,
    int consecutiveFailures,
    Instant lastTransitionAt,
    Duration currentCooldown) {}
