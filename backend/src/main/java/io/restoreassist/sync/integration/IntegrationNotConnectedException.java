package io.restoreassist.sync.integration;

import io.restoreassist.sync.exception.ProblemException;
import org.springframework.http.HttpStatus;

/** Thrown at enqueue time when the organization has no usable connection to the provider. */
public class IntegrationNotConnectedException extends ProblemException {

  public IntegrationNotConnectedException(IntegrationProvider provider, String reason) {
    super(
        HttpStatus.BAD_REQUEST,
        "Integration not connected",
        provider.getSlug() + " integration is not available: " + reason);
    getBody().setProperty("provider", provider.getSlug());
  }
}
