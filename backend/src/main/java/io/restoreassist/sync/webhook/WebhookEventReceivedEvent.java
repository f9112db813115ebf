package io.restoreassist.sync.webhook;

import java.util.UUID;

/** Published inside the ingestion transaction; consumed once the event row is committed. */
public record WebhookEventReceivedEvent(UUID webhookEventId) {}
