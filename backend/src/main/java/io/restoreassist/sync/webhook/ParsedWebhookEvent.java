package io.restoreassist.sync.webhook;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Provider-neutral view of a webhook body. Only {@code eventType} is always present; the rest
 * depends on the event.
 *
 * @param eventId the provider's delivery id, used for the idempotency key when present
 * @param externalInvoiceId the provider's id of the invoice the event concerns
 * @param externalPaymentId the provider's payment id, for payment events
 */
public record ParsedWebhookEvent(
    String eventId,
    String eventType,
    String externalInvoiceId,
    String externalPaymentId,
    BigDecimal amount,
    LocalDate paidOn,
    String reference) {}
