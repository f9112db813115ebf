package io.restoreassist.sync.webhook;

import io.restoreassist.sync.integration.IntegrationProvider;

/** A webhook request whose signature could not be verified against the provider's secret. */
public class WebhookAuthenticationException extends RuntimeException {

  public enum Reason {
    SECRET_NOT_CONFIGURED("signing secret not configured"),
    MISSING_SIGNATURE("Missing signature header"),
    MALFORMED_SIGNATURE("Malformed signature, expected Base64"),
    INVALID_SIGNATURE("Invalid signature");

    private final String description;

    Reason(String description) {
      this.description = description;
    }
  }

  private final IntegrationProvider provider;
  private final Reason reason;

  public WebhookAuthenticationException(IntegrationProvider provider, Reason reason) {
    super(provider.getSlug() + " webhook rejected: " + reason.description);
    this.provider = provider;
    this.reason = reason;
  }

  public IntegrationProvider getProvider() {
    return provider;
  }

  public Reason getReason() {
    return reason;
  }
}
