package io.restoreassist.sync.integration.accounting;

import io.restoreassist.sync.integration.IntegrationProvider;

/** Typed failure of a provider call, classified once at the orchestrator boundary. */
public abstract sealed class ProviderException extends RuntimeException
    permits TransientProviderException, PermanentProviderException, RateLimitedException {

  private final IntegrationProvider provider;

  protected ProviderException(IntegrationProvider provider, String message, Throwable cause) {
    super(message, cause);
    this.provider = provider;
  }

  public IntegrationProvider getProvider() {
    return provider;
  }
}
