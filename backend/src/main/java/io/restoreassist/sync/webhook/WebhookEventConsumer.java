package io.restoreassist.sync.webhook;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Feeds stored webhook events to the {@link WebhookEventProcessor} on the {@code webhookExecutor}
 * pool. New events are picked up right after their ingestion commits; the poller catches anything
 * missed (restart, executor rejection) plus FAILED events whose retry is due.
 */
@Component
public class WebhookEventConsumer {

  private static final Logger log = LoggerFactory.getLogger(WebhookEventConsumer.class);

  private final WebhookEventRepository repository;
  private final WebhookEventProcessor processor;
  private final WebhookProperties properties;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public WebhookEventConsumer(
      WebhookEventRepository repository,
      WebhookEventProcessor processor,
      WebhookProperties properties,
      TransactionTemplate transactionTemplate,
      Clock clock) {
    this.repository = repository;
    this.processor = processor;
    this.properties = properties;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  @Async("webhookExecutor")
  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onWebhookEventReceived(WebhookEventReceivedEvent event) {
    try {
      processor.process(event.webhookEventId());
    } catch (Exception e) {
      log.error("Failed to process webhook event {}", event.webhookEventId(), e);
    }
  }

  @Scheduled(
      fixedDelayString = "${restoreassist.webhooks.poll-interval-ms:5000}",
      initialDelayString = "${restoreassist.webhooks.poll-interval-ms:5000}")
  public void pollDueEvents() {
    var now = clock.instant();
    Integer released =
        transactionTemplate.execute(
            status ->
                repository.releaseStalled(
                    now.minus(properties.stallTimeout()),
                    now,
                    WebhookEventStatus.PROCESSING,
                    WebhookEventStatus.FAILED));
    if (released != null && released > 0) {
      log.warn("Released {} stalled webhook events back to FAILED", released);
    }

    var due =
        repository.findDueIds(
            now,
            WebhookEventStatus.PENDING,
            WebhookEventStatus.FAILED,
            PageRequest.of(0, properties.batchSize()));
    int processed = 0;
    for (var id : due) {
      try {
        if (processor.process(id) != null) {
          processed++;
        }
      } catch (Exception e) {
        log.error("Failed to process webhook event {}", id, e);
      }
    }
    if (!due.isEmpty()) {
      log.info("Webhook poller handled {} of {} due events", processed, due.size());
    }
  }
}
