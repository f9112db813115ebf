package io.restoreassist.sync.integration.resilience;

import io.restoreassist.sync.integration.IntegrationProvider;
import java.time.Duration;

/** Raised instead of calling a provider whose breaker is rejecting traffic. Not a failure. */
public class CircuitOpenException extends RuntimeException {

  private final IntegrationProvider provider;
  private final Duration retryAfter;

  public CircuitOpenException(IntegrationProvider provider, Duration retryAfter) {
    super("Circuit for " + provider + " is open, retry after " + retryAfter);
    this.provider = provider;
    this.retryAfter = retryAfter;
  }

  public IntegrationProvider getProvider() {
    return provider;
  }

  public Duration getRetryAfter() {
    return retryAfter;
  }
}
