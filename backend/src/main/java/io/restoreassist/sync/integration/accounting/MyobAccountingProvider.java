package io.restoreassist.sync.integration.accounting;

import io.restoreassist.sync.integration.IntegrationProvider;
import io.restoreassist.sync.integration.secret.SecretStore;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import tools.jackson.databind.ObjectMapper;

/**
 * MYOB AccountRight API. A create answers 201 with no body; the new document's UID is the last
 * segment of the {@code Location} header.
 *
 * <p>MYOB has no idempotency key for creates. A retried create first looks the invoice up by its
 * number and adopts the UID of a match, so a create that landed before a timeout is not posted
 * again.
 */
@Component
public class MyobAccountingProvider extends RestAccountingProvider {

  private static final Logger log = LoggerFactory.getLogger(MyobAccountingProvider.class);

  static final String API_KEY_HEADER = "x-myobapi-key";
  static final String API_VERSION_HEADER = "x-myobapi-version";

  private final String apiKey;

  @Autowired
  public MyobAccountingProvider(
      AccountingProviderProperties properties, SecretStore secretStore, ObjectMapper objectMapper) {
    this(defaultBuilder(properties), properties, secretStore, objectMapper);
  }

  MyobAccountingProvider(
      RestClient.Builder builder,
      AccountingProviderProperties properties,
      SecretStore secretStore,
      ObjectMapper objectMapper) {
    super(builder.baseUrl(properties.myobBaseUrl()).build(), secretStore, objectMapper);
    this.apiKey = properties.myobApiKey();
  }

  @Override
  public IntegrationProvider provider() {
    return IntegrationProvider.MYOB;
  }

  @Override
  protected String push(InvoiceSyncRequest request, ProviderCredentials credentials) {
    if (request.customerAccountRef() == null) {
      throw new PermanentProviderException(
          provider(), "MYOB requires a customer UID on invoice " + request.invoiceNumber());
    }
    var invoice = objectMapper.createObjectNode();
    if (request.isUpdate()) {
      invoice.put("UID", request.existingExternalId());
    }
    invoice.put("Number", request.invoiceNumber());
    invoice.put("Date", request.issueDate() != null ? request.issueDate() + "T00:00:00" : null);
    invoice.putObject("Customer").put("UID", request.customerAccountRef());
    invoice.put("IsTaxInclusive", false);
    invoice.put("JournalMemo", "Invoice " + request.invoiceNumber());
    var lines = invoice.putArray("Lines");
    for (var line : request.lineItems()) {
      lines
          .addObject()
          .put("Type", "Transaction")
          .put("Description", line.description())
          .put("Total", line.total());
    }

    if (request.isUpdate()) {
      restClient
          .put()
          .uri(
              "/{companyFile}/Sale/Invoice/Service/{uid}",
              credentials.accountId(),
              request.existingExternalId())
          .headers(headers -> applyHeaders(headers, credentials))
          .contentType(MediaType.APPLICATION_JSON)
          .body(writeJson(invoice))
          .retrieve()
          .toBodilessEntity();
      return request.existingExternalId();
    }

    if (request.isRetry()) {
      var existingUid = findUidByNumber(request.invoiceNumber(), credentials);
      if (existingUid != null) {
        log.info(
            "MYOB already holds invoice {} as {} (attempt {}), adopting it",
            request.invoiceNumber(),
            existingUid,
            request.attempt());
        return existingUid;
      }
    }

    var response =
        restClient
            .post()
            .uri("/{companyFile}/Sale/Invoice/Service", credentials.accountId())
            .headers(headers -> applyHeaders(headers, credentials))
            .contentType(MediaType.APPLICATION_JSON)
            .body(writeJson(invoice))
            .retrieve()
            .toBodilessEntity();
    var location = response.getHeaders().getLocation();
    if (location == null || location.getPath() == null) {
      return null;
    }
    var path = location.getPath();
    return path.substring(path.lastIndexOf('/') + 1);
  }

  private String findUidByNumber(String invoiceNumber, ProviderCredentials credentials) {
    var filter = "Number eq '" + invoiceNumber.replace("'", "''") + "'";
    var response =
        restClient
            .get()
            .uri(
                uriBuilder ->
                    uriBuilder
                        .path("/{companyFile}/Sale/Invoice/Service")
                        .queryParam("$filter", "{filter}")
                        .build(credentials.accountId(), filter))
            .headers(headers -> applyHeaders(headers, credentials))
            .retrieve()
            .body(String.class);
    var items = readJson(response).path("Items");
    return items.isEmpty() ? null : textOrNull(items.path(0).path("UID"));
  }

  private void applyHeaders(HttpHeaders headers, ProviderCredentials credentials) {
    headers.set(HttpHeaders.AUTHORIZATION, credentials.bearer());
    headers.set(API_KEY_HEADER, apiKey);
    headers.set(API_VERSION_HEADER, "v2");
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
  }
}
