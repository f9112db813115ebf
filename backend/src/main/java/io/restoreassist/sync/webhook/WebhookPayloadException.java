package io.restoreassist.sync.webhook;

/**
 * Thrown when a webhook body cannot be parsed or lacks a field the event type needs. {@link
 * #getField()} names the offending field, or is null when the body as a whole is unreadable.
 */
public class WebhookPayloadException extends RuntimeException {

  private final String field;

  private WebhookPayloadException(String field, String message, Throwable cause) {
    super(message, cause);
    this.field = field;
  }

  static WebhookPayloadException malformed(String message, Throwable cause) {
    return new WebhookPayloadException(null, message, cause);
  }

  static WebhookPayloadException missing(String field, String message) {
    return new WebhookPayloadException(field, message, null);
  }

  static WebhookPayloadException invalid(String field, String value) {
    return new WebhookPayloadException(field, "Invalid " + field + ": " + value, null);
  }

  public String getField() {
    return field;
  }
}
