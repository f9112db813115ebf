package io.restoreassist.sync.webhook;

import java.util.UUID;

/**
 * @param duplicate true when the delivery matched an already stored event
 */
public record WebhookReceipt(UUID eventId, boolean duplicate) {}
