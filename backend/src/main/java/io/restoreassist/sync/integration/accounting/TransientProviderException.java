package io.restoreassist.sync.integration.accounting;

import io.restoreassist.sync.integration.IntegrationProvider;

/** Timeouts, 5xx responses and connection errors. Retryable; counts against the breaker. */
public final class TransientProviderException extends ProviderException {

  public TransientProviderException(IntegrationProvider provider, String message) {
    super(provider, message, null);
  }

  public TransientProviderException(
      IntegrationProvider provider, String message, Throwable cause) {
    super(provider, message, cause);
  }
}
