package io.restoreassist.sync.integration.accounting;

import io.restoreassist.sync.integration.IntegrationProvider;
import io.restoreassist.sync.integration.secret.SecretStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import tools.jackson.databind.ObjectMapper;

/**
 * Xero Accounting API. Creation carries the local invoice id as {@code Idempotency-Key}, so a
 * request replayed after a lost response does not create a second document.
 */
@Component
public class XeroAccountingProvider extends RestAccountingProvider {

  static final String TENANT_HEADER = "xero-tenant-id";
  static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

  @Autowired
  public XeroAccountingProvider(
      AccountingProviderProperties properties, SecretStore secretStore, ObjectMapper objectMapper) {
    this(defaultBuilder(properties), properties, secretStore, objectMapper);
  }

  XeroAccountingProvider(
      RestClient.Builder builder,
      AccountingProviderProperties properties,
      SecretStore secretStore,
      ObjectMapper objectMapper) {
    super(builder.baseUrl(properties.xeroBaseUrl()).build(), secretStore, objectMapper);
  }

  @Override
  public IntegrationProvider provider() {
    return IntegrationProvider.XERO;
  }

  @Override
  protected String push(InvoiceSyncRequest request, ProviderCredentials credentials) {
    var invoice = objectMapper.createObjectNode();
    if (request.isUpdate()) {
      invoice.put("InvoiceID", request.existingExternalId());
    }
    invoice.put("Type", "ACCREC");
    invoice
        .putObject("Contact")
        .put("Name", request.customerName())
        .put("EmailAddress", request.customerEmail());
    invoice.put("InvoiceNumber", request.invoiceNumber());
    invoice.put("Date", request.issueDate() != null ? request.issueDate().toString() : null);
    invoice.put("DueDate", request.dueDate() != null ? request.dueDate().toString() : null);
    invoice.put("CurrencyCode", request.currency());
    invoice.put("Status", "AUTHORISED");
    invoice.put("LineAmountTypes", "Exclusive");
    var lines = invoice.putArray("LineItems");
    for (var line : request.lineItems()) {
      var entry =
          lines
              .addObject()
              .put("Description", line.description())
              .put("Quantity", line.quantity())
              .put("UnitAmount", line.unitPrice())
              .put("TaxAmount", line.taxAmount());
      if (line.accountCode() != null) {
        entry.put("AccountCode", line.accountCode());
      }
    }
    var body = objectMapper.createObjectNode();
    body.putArray("Invoices").add(invoice);

    var call =
        restClient
            .post()
            .uri("/api.xro/2.0/Invoices")
            .header(HttpHeaders.AUTHORIZATION, credentials.bearer())
            .header(TENANT_HEADER, credentials.accountId())
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON);
    if (!request.isUpdate()) {
      call = call.header(IDEMPOTENCY_HEADER, request.invoiceId().toString());
    }
    var response = call.body(writeJson(body)).retrieve().body(String.class);
    return textOrNull(readJson(response).path("Invoices").path(0).path("InvoiceID"));
  }
}
