package io.restoreassist.sync.webhook;

/** The event store could not durably accept a delivery; the provider should redeliver. */
public class WebhookQueueUnavailableException extends RuntimeException {

  public WebhookQueueUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
