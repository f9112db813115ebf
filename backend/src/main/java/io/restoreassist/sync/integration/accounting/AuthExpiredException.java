package io.restoreassist.sync.integration.accounting;

import io.restoreassist.sync.integration.IntegrationProvider;

/** Credentials are missing or were refused. The integration has to be reconnected. */
public final class AuthExpiredException extends PermanentProviderException {

  public AuthExpiredException(IntegrationProvider provider, String message) {
    super(provider, message);
  }

  public AuthExpiredException(IntegrationProvider provider, String message, Throwable cause) {
    super(provider, message, cause);
  }
}
