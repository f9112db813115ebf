package io.restoreassist.sync.integration.accounting;

import io.restoreassist.sync.invoice.Invoice;
import io.restoreassist.sync.invoice.InvoiceLine;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Provider-neutral view of an invoice to push.
 *
 * @param attempt provider calls already made for this sync; on a retry an earlier create may have
 *     landed remotely even though it failed locally
 */
public record InvoiceSyncRequest(
    UUID organizationId,
    UUID invoiceId,
    String invoiceNumber,
    String customerName,
    String customerEmail,
    String customerAccountRef,
    List<LineItem> lineItems,
    String currency,
    LocalDate issueDate,
    LocalDate dueDate,
    BigDecimal total,
    String existingExternalId,
    int attempt) {

  public static InvoiceSyncRequest from(Invoice invoice, List<InvoiceLine> lines, int attempt) {
    return new InvoiceSyncRequest(
        invoice.getOrganizationId(),
        invoice.getId(),
        invoice.getInvoiceNumber(),
        invoice.getCustomerName(),
        invoice.getCustomerEmail(),
        invoice.getCustomerAccountRef(),
        lines.stream()
            .map(
                line ->
                    new LineItem(
                        line.getDescription(),
                        line.getQuantity(),
                        line.getUnitPrice(),
                        line.getTaxAmount(),
                        line.getAccountCode()))
            .toList(),
        invoice.getCurrency(),
        invoice.getIssueDate(),
        invoice.getDueDate(),
        invoice.getTotal(),
        invoice.getExternalId(),
        attempt);
  }

  public boolean isUpdate() {
    return existingExternalId != null;
  }

  public boolean isRetry() {
    return attempt > 0;
  }
}
