package io.restoreassist.sync.webhook;

import io.restoreassist.sync.integration.IntegrationProvider;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Inbound webhook settings, bound from {@code restoreassist.webhooks.*}. Signing secrets are
 * expected from the environment; a provider without one has all its webhooks rejected.
 */
@ConfigurationProperties("restoreassist.webhooks")
public record WebhookProperties(
    Integer maxAttempts,
    Duration retryBaseDelay,
    Duration retryMaxDelay,
    Long pollIntervalMs,
    Duration stallTimeout,
    Integer batchSize,
    Map<IntegrationProvider, String> secrets) {

  public WebhookProperties {
    maxAttempts = maxAttempts != null ? maxAttempts : 5;
    retryBaseDelay = retryBaseDelay != null ? retryBaseDelay : Duration.ofSeconds(30);
    retryMaxDelay = retryMaxDelay != null ? retryMaxDelay : Duration.ofHours(1);
    pollIntervalMs = pollIntervalMs != null ? pollIntervalMs : 5_000L;
    stallTimeout = stallTimeout != null ? stallTimeout : Duration.ofMinutes(5);
    batchSize = batchSize != null ? batchSize : 50;
    var copy = new EnumMap<IntegrationProvider, String>(IntegrationProvider.class);
    if (secrets != null) {
      copy.putAll(secrets);
    }
    secrets = copy;
  }

  public static WebhookProperties defaults() {
    return new WebhookProperties(null, null, null, null, null, null, null);
  }

  public Optional<String> secretFor(IntegrationProvider provider) {
    return Optional.ofNullable(secrets.get(provider)).filter(s -> !s.isBlank());
  }
}
