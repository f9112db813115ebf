package io.restoreassist.sync.integration.accounting;

import io.restoreassist.sync.integration.IntegrationProvider;
import io.restoreassist.sync.integration.secret.SecretStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ObjectNode;

/**
 * QuickBooks Online Accounting API. Creates pass {@code requestid} so Intuit deduplicates
 * replays; updates are sparse and need the current {@code SyncToken}, fetched first.
 */
@Component
public class QuickBooksAccountingProvider extends RestAccountingProvider {

  private final String minorVersion;

  @Autowired
  public QuickBooksAccountingProvider(
      AccountingProviderProperties properties, SecretStore secretStore, ObjectMapper objectMapper) {
    this(defaultBuilder(properties), properties, secretStore, objectMapper);
  }

  QuickBooksAccountingProvider(
      RestClient.Builder builder,
      AccountingProviderProperties properties,
      SecretStore secretStore,
      ObjectMapper objectMapper) {
    super(builder.baseUrl(properties.quickbooksBaseUrl()).build(), secretStore, objectMapper);
    this.minorVersion = properties.quickbooksMinorVersion();
  }

  @Override
  public IntegrationProvider provider() {
    return IntegrationProvider.QUICKBOOKS;
  }

  @Override
  protected String push(InvoiceSyncRequest request, ProviderCredentials credentials) {
    if (request.customerAccountRef() == null) {
      throw new PermanentProviderException(
          provider(),
          "QuickBooks requires a customer reference on invoice " + request.invoiceNumber());
    }
    var invoice = objectMapper.createObjectNode();
    if (request.isUpdate()) {
      invoice.put("Id", request.existingExternalId());
      invoice.put("SyncToken", currentSyncToken(request.existingExternalId(), credentials));
      invoice.put("sparse", true);
    }
    invoice.put("DocNumber", request.invoiceNumber());
    invoice.put("TxnDate", request.issueDate() != null ? request.issueDate().toString() : null);
    invoice.put("DueDate", request.dueDate() != null ? request.dueDate().toString() : null);
    invoice.putObject("CustomerRef").put("value", request.customerAccountRef());
    invoice.putObject("CurrencyRef").put("value", request.currency());
    if (request.customerEmail() != null) {
      invoice.putObject("BillEmail").put("Address", request.customerEmail());
    }
    var lines = invoice.putArray("Line");
    for (var line : request.lineItems()) {
      ObjectNode entry = lines.addObject();
      entry.put("DetailType", "SalesItemLineDetail");
      entry.put("Description", line.description());
      entry.put("Amount", line.total());
      entry
          .putObject("SalesItemLineDetail")
          .put("Qty", line.quantity())
          .put("UnitPrice", line.unitPrice());
    }

    var response =
        restClient
            .post()
            .uri(
                uriBuilder -> {
                  uriBuilder
                      .path("/v3/company/{realmId}/invoice")
                      .queryParam("minorversion", minorVersion);
                  if (!request.isUpdate()) {
                    uriBuilder.queryParam("requestid", request.invoiceId());
                  }
                  return uriBuilder.build(credentials.accountId());
                })
            .header(HttpHeaders.AUTHORIZATION, credentials.bearer())
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .body(writeJson(invoice))
            .retrieve()
            .body(String.class);
    return textOrNull(readJson(response).path("Invoice").path("Id"));
  }

  private String currentSyncToken(String externalId, ProviderCredentials credentials) {
    var response =
        restClient
            .get()
            .uri(
                uriBuilder ->
                    uriBuilder
                        .path("/v3/company/{realmId}/invoice/{invoiceId}")
                        .queryParam("minorversion", minorVersion)
                        .build(credentials.accountId(), externalId))
            .header(HttpHeaders.AUTHORIZATION, credentials.bearer())
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .body(String.class);
    var token = textOrNull(readJson(response).path("Invoice").path("SyncToken"));
    if (token == null) {
      throw new PermanentProviderException(
          provider(), "QuickBooks invoice " + externalId + " has no SyncToken");
    }
    return token;
  }
}
