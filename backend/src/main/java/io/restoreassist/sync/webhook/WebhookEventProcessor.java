package io.restoreassist.sync.webhook;

import io.github.resilience4j.core.IntervalFunction;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Claims and applies a stored webhook event. The claim is a conditional update, so two consumers
 * racing on the same id cannot both apply it, and PROCESSED or SKIPPED events are never claimed.
 *
 * <p>A failed event is retried with randomized exponential backoff until {@code maxAttempts}. A
 * {@link WebhookPayloadException} cannot succeed on a later attempt and is dead-lettered at once.
 */
@Service
public class WebhookEventProcessor {

  private static final Logger log = LoggerFactory.getLogger(WebhookEventProcessor.class);

  private static final double BACKOFF_MULTIPLIER = 2.0;
  private static final double BACKOFF_RANDOMIZATION = 0.1;

  private final WebhookEventRepository repository;
  private final AccountingWebhookParser parser;
  private final WebhookEventHandler handler;
  private final TransactionTemplate transactionTemplate;
  private final IntervalFunction retryBackoff;
  private final int maxAttempts;
  private final Clock clock;

  @Autowired
  public WebhookEventProcessor(
      WebhookEventRepository repository,
      AccountingWebhookParser parser,
      WebhookEventHandler handler,
      TransactionTemplate transactionTemplate,
      WebhookProperties properties,
      Clock clock) {
    this(
        repository,
        parser,
        handler,
        transactionTemplate,
        IntervalFunction.ofExponentialRandomBackoff(
            properties.retryBaseDelay(),
            BACKOFF_MULTIPLIER,
            BACKOFF_RANDOMIZATION,
            properties.retryMaxDelay()),
        properties.maxAttempts(),
        clock);
  }

  WebhookEventProcessor(
      WebhookEventRepository repository,
      AccountingWebhookParser parser,
      WebhookEventHandler handler,
      TransactionTemplate transactionTemplate,
      IntervalFunction retryBackoff,
      int maxAttempts,
      Clock clock) {
    this.repository = repository;
    this.parser = parser;
    this.handler = handler;
    this.transactionTemplate = transactionTemplate;
    this.retryBackoff = retryBackoff;
    this.maxAttempts = maxAttempts;
    this.clock = clock;
  }

  /** Returns the status the event ended in, or {@code null} if another consumer holds it. */
  public WebhookEventStatus process(UUID eventId) {
    Integer claimed =
        transactionTemplate.execute(
            status ->
                repository.claim(
                    eventId,
                    clock.instant(),
                    WebhookEventStatus.PROCESSING,
                    WebhookEventStatus.PENDING,
                    WebhookEventStatus.FAILED));
    if (claimed == null || claimed == 0) {
      log.debug("Webhook event {} not claimable, skipping", eventId);
      return null;
    }

    try {
      return transactionTemplate.execute(status -> apply(eventId));
    } catch (RuntimeException e) {
      return transactionTemplate.execute(status -> recordFailure(eventId, e));
    }
  }

  private WebhookEventStatus apply(UUID eventId) {
    var event = load(eventId);
    var parsed = parser.parse(event.getProvider(), event.getPayload());
    var now = clock.instant();
    if (handler.handle(event, parsed)) {
      event.markProcessed(now);
      log.info(
          "Processed {} webhook {} type={}", event.getProvider(), eventId, parsed.eventType());
    } else {
      event.markSkipped("Unsupported event type: " + parsed.eventType(), now);
      log.info("Skipped {} webhook {} type={}", event.getProvider(), eventId, parsed.eventType());
    }
    repository.save(event);
    return event.getStatus();
  }

  private WebhookEventStatus recordFailure(UUID eventId, RuntimeException error) {
    var event = load(eventId);
    boolean unusablePayload = error instanceof WebhookPayloadException;
    Instant retryAt = null;
    if (!unusablePayload && event.getAttempts() < maxAttempts) {
      var delayMillis = retryBackoff.apply(Math.max(event.getAttempts(), 1));
      retryAt = clock.instant().plusMillis(delayMillis);
    }
    event.markFailed(error.getMessage(), retryAt);
    repository.save(event);
    if (unusablePayload) {
      log.error(
          "Webhook event {} dead-lettered on attempt {}, payload unusable: {}",
          eventId,
          event.getAttempts(),
          error.getMessage());
    } else if (retryAt == null) {
      log.error(
          "Webhook event {} dead-lettered after {} attempts: {}",
          eventId,
          event.getAttempts(),
          error.getMessage(),
          error);
    } else {
      log.warn(
          "Webhook event {} failed (attempt {}/{}), retry at {}: {}",
          eventId,
          event.getAttempts(),
          maxAttempts,
          retryAt,
          error.getMessage());
    }
    return WebhookEventStatus.FAILED;
  }

  private WebhookEvent load(UUID eventId) {
    return repository
        .findById(eventId)
        .orElseThrow(() -> new IllegalStateException("Webhook event " + eventId + " vanished"));
  }
}
