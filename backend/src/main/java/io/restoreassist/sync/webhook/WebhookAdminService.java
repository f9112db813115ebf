package io.restoreassist.sync.webhook;

import io.restoreassist.sync.exception.InvalidStateException;
import io.restoreassist.sync.exception.ResourceNotFoundException;
import java.time.Clock;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class WebhookAdminService {

  private static final Logger log = LoggerFactory.getLogger(WebhookAdminService.class);

  private final WebhookEventRepository repository;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public WebhookAdminService(
      WebhookEventRepository repository, ApplicationEventPublisher eventPublisher, Clock clock) {
    this.repository = repository;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public WebhookEvent getEvent(UUID id) {
    return require(id);
  }

  /**
   * Re-arms a FAILED event (usually dead-lettered) with a fresh attempt budget and hands it to the
   * consumer once the change commits.
   */
  @Transactional
  public WebhookEvent retry(UUID id) {
    var event = require(id);
    if (event.getStatus() != WebhookEventStatus.FAILED) {
      throw new InvalidStateException(
          "Webhook event not failed",
          "Only FAILED events can be retried; event " + id + " is " + event.getStatus());
    }
    event.rearm(clock.instant());
    repository.save(event);
    eventPublisher.publishEvent(new WebhookEventReceivedEvent(event.getId()));
    log.info("Re-armed webhook event {} for processing", id);
    return event;
  }

  private WebhookEvent require(UUID id) {
    return repository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("WebhookEvent", id));
  }
}
