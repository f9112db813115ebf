package io.restoreassist.sync.integration.accounting;

import io.restoreassist.sync.integration.IntegrationProvider;

/** The provider rejected the request as sent. Terminal; not a dependency-health signal. */
public sealed class PermanentProviderException extends ProviderException
    permits AuthExpiredException {

  public PermanentProviderException(IntegrationProvider provider, String message) {
    super(provider, message, null);
  }

  public PermanentProviderException(
      IntegrationProvider provider, String message, Throwable cause) {
    super(provider, message, cause);
  }
}
