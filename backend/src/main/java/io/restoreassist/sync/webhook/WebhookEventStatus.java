package io.restoreassist.sync.webhook;

public enum WebhookEventStatus {
  PENDING,
  PROCESSING,
  PROCESSED,
  FAILED,
  SKIPPED
}
