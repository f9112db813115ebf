package io.restoreassist.sync.webhook;

import io.restoreassist.sync.integration.IntegrationProvider;
import org.springframework.http.HttpHeaders;

public interface WebhookSignatureVerifier {

  /**
   * Checks that {@code payload} was signed by {@code provider}.
   *
   * @throws WebhookAuthenticationException if the signature is missing, wrong, or cannot be checked
   */
  void verify(IntegrationProvider provider, String payload, HttpHeaders headers);
}
