package io.restoreassist.sync.integration.accounting;

import io.restoreassist.sync.integration.IntegrationProvider;
import java.time.Duration;

/** The provider answered 429. A deferral, not a failure. */
public final class RateLimitedException extends ProviderException {

  private final Duration retryAfter;

  public RateLimitedException(IntegrationProvider provider, Duration retryAfter) {
    super(provider, provider + " rate limit exceeded, retry after " + retryAfter, null);
    this.retryAfter = retryAfter;
  }

  public Duration getRetryAfter() {
    return retryAfter;
  }
}
