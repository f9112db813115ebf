package io.restoreassist.sync.webhook;

import io.restoreassist.sync.integration.IntegrationProvider;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Accepts webhook deliveries: verify, parse, then persist under an idempotency key before the
 * caller acknowledges. Processing happens later, off the request thread.
 */
@Service
public class WebhookIngestionService {

  private static final Logger log = LoggerFactory.getLogger(WebhookIngestionService.class);

  private final WebhookSignatureVerifier signatureVerifier;
  private final AccountingWebhookParser parser;
  private final WebhookEventRepository repository;
  private final ApplicationEventPublisher eventPublisher;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public WebhookIngestionService(
      WebhookSignatureVerifier signatureVerifier,
      AccountingWebhookParser parser,
      WebhookEventRepository repository,
      ApplicationEventPublisher eventPublisher,
      TransactionTemplate transactionTemplate,
      Clock clock) {
    this.signatureVerifier = signatureVerifier;
    this.parser = parser;
    this.repository = repository;
    this.eventPublisher = eventPublisher;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  /**
   * @throws WebhookAuthenticationException on a missing or invalid signature
   * @throws WebhookPayloadException if the payload cannot be parsed
   * @throws WebhookQueueUnavailableException if the event could not be stored
   */
  public WebhookReceipt receive(IntegrationProvider provider, String payload, HttpHeaders headers) {
    signatureVerifier.verify(provider, payload, headers);
    var parsed = parser.parse(provider, payload);
    var key = idempotencyKey(provider, parsed, payload);

    try {
      return transactionTemplate.execute(status -> store(provider, key, parsed, payload));
    } catch (DataIntegrityViolationException e) {
      // Lost an insert race with a concurrent delivery of the same event.
      log.info("Concurrent delivery of webhook {}, recording as duplicate", key);
      return recordDuplicateAfterRace(key, e);
    } catch (DataAccessException e) {
      log.error("Could not store {} webhook {}", provider, key, e);
      throw new WebhookQueueUnavailableException("Webhook store unavailable", e);
    }
  }

  private WebhookReceipt store(
      IntegrationProvider provider, String key, ParsedWebhookEvent parsed, String payload) {
    var existing = repository.findByIdempotencyKey(key);
    if (existing.isPresent()) {
      var event = existing.get();
      event.recordDuplicateDelivery();
      repository.save(event);
      log.info(
          "Duplicate {} webhook {} (delivery #{}, status={})",
          provider,
          key,
          event.getDeliveryCount(),
          event.getStatus());
      return new WebhookReceipt(event.getId(), true);
    }

    var event =
        repository.saveAndFlush(
            new WebhookEvent(
                provider, key, parsed.eventType(), parsed.eventId(), payload, clock.instant()));
    eventPublisher.publishEvent(new WebhookEventReceivedEvent(event.getId()));
    log.info(
        "Queued {} webhook {} type={} as {}", provider, key, parsed.eventType(), event.getId());
    return new WebhookReceipt(event.getId(), false);
  }

  private WebhookReceipt recordDuplicateAfterRace(String key, DataIntegrityViolationException e) {
    try {
      return transactionTemplate.execute(
          status -> {
            var event =
                repository
                    .findByIdempotencyKey(key)
                    .orElseThrow(
                        () -> new WebhookQueueUnavailableException("Webhook store conflict", e));
            event.recordDuplicateDelivery();
            repository.save(event);
            return new WebhookReceipt(event.getId(), true);
          });
    } catch (DataAccessException retryError) {
      throw new WebhookQueueUnavailableException("Webhook store unavailable", retryError);
    }
  }

  /** {@code provider:eventId}, or a SHA-256 of the body when the provider sent no event id. */
  static String idempotencyKey(
      IntegrationProvider provider, ParsedWebhookEvent parsed, String payload) {
    if (parsed.eventId() != null) {
      return provider.getSlug() + ":" + parsed.eventId();
    }
    return provider.getSlug() + ":sha256:" + sha256(payload);
  }

  private static String sha256(String payload) {
    try {
      var digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(payload.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 unavailable", e);
    }
  }
}
