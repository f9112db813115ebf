package io.restoreassist.sync.invoice;

import io.restoreassist.sync.integration.IntegrationProvider;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/** A payment notification from a provider, already parsed into local terms. */
public record ExternalPayment(
    IntegrationProvider provider,
    String externalInvoiceId,
    String externalPaymentId,
    BigDecimal amount,
    LocalDate paidOn,
    String reference,
    UUID webhookEventId) {}
