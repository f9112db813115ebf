package io.restoreassist.sync.invoice;

import io.restoreassist.sync.exception.ResourceNotFoundException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class InvoicePaymentService {

  private static final Logger log = LoggerFactory.getLogger(InvoicePaymentService.class);

  private final InvoiceRepository invoiceRepository;
  private final InvoicePaymentRepository paymentRepository;
  private final Clock clock;

  public InvoicePaymentService(
      InvoiceRepository invoiceRepository,
      InvoicePaymentRepository paymentRepository,
      Clock clock) {
    this.invoiceRepository = invoiceRepository;
    this.paymentRepository = paymentRepository;
    this.clock = clock;
  }

  /**
   * Applies a provider payment to the invoice synced under {@code externalInvoiceId}. A payment
   * id already recorded for the provider is a no-op, so the same payment arriving under two
   * different webhook events is counted once.
   *
   * @throws ResourceNotFoundException if no local invoice carries that external id; the caller
   *     retries, since the payment can race ahead of our own sync
   */
  @Transactional
  public PaymentApplication applyExternalPayment(ExternalPayment payment) {
    if (paymentRepository.existsByProviderAndExternalPaymentId(
        payment.provider(), payment.externalPaymentId())) {
      log.info(
          "Payment {} from {} already applied, skipping",
          payment.externalPaymentId(),
          payment.provider());
      return new PaymentApplication(null, false);
    }

    var invoice =
        invoiceRepository
            .findBySyncProviderAndExternalId(payment.provider(), payment.externalInvoiceId())
            .orElseThrow(
                () ->
                    new ResourceNotFoundException(
                        "Invoice", payment.provider() + ":" + payment.externalInvoiceId()));

    var now = clock.instant();
    invoice.applyPayment(payment.amount(), now);
    invoiceRepository.save(invoice);
    paymentRepository.save(
        new InvoicePayment(
            invoice.getId(),
            payment.provider(),
            payment.externalPaymentId(),
            payment.amount(),
            payment.paidOn(),
            payment.reference(),
            payment.webhookEventId(),
            now));

    log.info(
        "Applied payment {} of {} to invoice {} (status={}, amountDue={})",
        payment.externalPaymentId(),
        payment.amount(),
        invoice.getInvoiceNumber(),
        invoice.getStatus(),
        invoice.getAmountDue());
    return new PaymentApplication(invoice, true);
  }

  /** {@code invoice} is null when the payment was a duplicate. */
  public record PaymentApplication(Invoice invoice, boolean applied) {}
}
