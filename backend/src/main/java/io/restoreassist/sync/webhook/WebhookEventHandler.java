package io.restoreassist.sync.webhook;

import io.restoreassist.sync.audit.AuditService;
import io.restoreassist.sync.audit.SyncAuditAction;
import io.restoreassist.sync.audit.SyncAuditRecordBuilder;
import io.restoreassist.sync.invoice.ExternalPayment;
import io.restoreassist.sync.invoice.InvoicePaymentService;
import io.restoreassist.sync.invoice.InvoiceRepository;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies one parsed webhook to local state. Runs inside the processor's transaction, so any
 * exception rolls back the application and leaves the event to be retried.
 */
@Component
public class WebhookEventHandler {

  private static final Logger log = LoggerFactory.getLogger(WebhookEventHandler.class);

  private static final Set<String> PAYMENT_EVENTS = Set.of("invoice.paid", "payment.created");

  private final InvoicePaymentService paymentService;
  private final InvoiceRepository invoiceRepository;
  private final AuditService auditService;

  public WebhookEventHandler(
      InvoicePaymentService paymentService,
      InvoiceRepository invoiceRepository,
      AuditService auditService) {
    this.paymentService = paymentService;
    this.invoiceRepository = invoiceRepository;
    this.auditService = auditService;
  }

  /**
   * @return {@code false} if the event type is not one this service acts on
   */
  public boolean handle(WebhookEvent event, ParsedWebhookEvent parsed) {
    var type = parsed.eventType();
    if (PAYMENT_EVENTS.contains(type)) {
      applyPayment(event, parsed);
      return true;
    }
    switch (type) {
      case "invoice.updated" ->
          recordExternalChange(event, parsed, SyncAuditAction.EXTERNAL_UPDATED);
      case "invoice.deleted" ->
          recordExternalChange(event, parsed, SyncAuditAction.EXTERNAL_DELETED);
      case "invoice.created" ->
          log.debug("Invoice created in {}, nothing to apply", event.getProvider());
      default -> {
        if (!type.startsWith("customer.")) {
          return false;
        }
        log.debug("Customer event {} from {} acknowledged", type, event.getProvider());
      }
    }
    return true;
  }

  private void applyPayment(WebhookEvent event, ParsedWebhookEvent parsed) {
    if (parsed.externalInvoiceId() == null) {
      throw WebhookPayloadException.missing(
          "externalInvoiceId", "Payment event has no invoice reference");
    }
    if (parsed.amount() == null || parsed.amount().signum() <= 0) {
      throw WebhookPayloadException.missing("amount", "Payment event has no positive amount");
    }
    var paymentId =
        parsed.externalPaymentId() != null ? parsed.externalPaymentId() : event.getIdempotencyKey();

    var application =
        paymentService.applyExternalPayment(
            new ExternalPayment(
                event.getProvider(),
                parsed.externalInvoiceId(),
                paymentId,
                parsed.amount(),
                parsed.paidOn(),
                parsed.reference(),
                event.getId()));
    if (!application.applied()) {
      return;
    }
    auditService.log(
        SyncAuditRecordBuilder.builder()
            .invoiceId(application.invoice().getId())
            .provider(event.getProvider())
            .action(SyncAuditAction.PAYMENT_RECEIVED)
            .detail(
                "amount="
                    + parsed.amount().toPlainString()
                    + " paymentId="
                    + paymentId
                    + " webhookEvent="
                    + event.getId())
            .build());
  }

  private void recordExternalChange(
      WebhookEvent event, ParsedWebhookEvent parsed, SyncAuditAction action) {
    if (parsed.externalInvoiceId() == null) {
      throw WebhookPayloadException.missing(
          "externalInvoiceId", parsed.eventType() + " event has no invoice reference");
    }
    var invoice =
        invoiceRepository.findBySyncProviderAndExternalId(
            event.getProvider(), parsed.externalInvoiceId());
    if (invoice.isEmpty()) {
      log.warn(
          "No local invoice for {} external id {}, ignoring {}",
          event.getProvider(),
          parsed.externalInvoiceId(),
          parsed.eventType());
      return;
    }
    auditService.log(
        SyncAuditRecordBuilder.builder()
            .invoiceId(invoice.get().getId())
            .provider(event.getProvider())
            .action(action)
            .detail("externalId=" + parsed.externalInvoiceId() + " webhookEvent=" + event.getId())
            .build());
  }
}
