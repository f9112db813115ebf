package io.restoreassist.sync.integration.accounting;

import io.restoreassist.sync.integration.secret.SecretStore;
import java.net.http.HttpClient;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Base for the HTTP provider clients. Loads the organization's credentials, delegates the
 * provider-specific exchange to {@link #push}, and converts every failure into the {@link
 * ProviderException} taxonomy.
 */
public abstract class RestAccountingProvider implements AccountingProvider {

  private static final Logger log = LoggerFactory.getLogger(RestAccountingProvider.class);

  protected final RestClient restClient;
  protected final ObjectMapper objectMapper;
  private final SecretStore secretStore;

  protected RestAccountingProvider(
      RestClient restClient, SecretStore secretStore, ObjectMapper objectMapper) {
    this.restClient = restClient;
    this.secretStore = secretStore;
    this.objectMapper = objectMapper;
  }

  protected static RestClient.Builder defaultBuilder(AccountingProviderProperties properties) {
    var httpClient = HttpClient.newBuilder().connectTimeout(properties.connectTimeout()).build();
    var requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.readTimeout());
    return RestClient.builder().requestFactory(requestFactory);
  }

  @Override
  public final AccountingSyncResult syncInvoice(InvoiceSyncRequest request) {
    var credentials = credentialsFor(request.organizationId());
    String externalId;
    try {
      externalId = push(request, credentials);
    } catch (RestClientException e) {
      throw ProviderErrorClassifier.classify(provider(), e);
    } catch (JacksonException e) {
      // The provider may have created the document; retrying could post it twice.
      throw new PermanentProviderException(
          provider(), provider() + " returned an unreadable response", e);
    }
    if (externalId == null || externalId.isBlank()) {
      throw new PermanentProviderException(
          provider(), provider() + " response did not contain a document id");
    }
    log.debug("{} accepted invoice {} as {}", provider(), request.invoiceNumber(), externalId);
    return new AccountingSyncResult(externalId);
  }

  /** Performs the provider call and returns the external document id. */
  protected abstract String push(InvoiceSyncRequest request, ProviderCredentials credentials);

  protected JsonNode readJson(String body) {
    return objectMapper.readTree(body == null || body.isBlank() ? "{}" : body);
  }

  protected String writeJson(JsonNode node) {
    return objectMapper.writeValueAsString(node);
  }

  protected static String textOrNull(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull()) {
      return null;
    }
    var text = node.asText();
    return text.isBlank() ? null : text;
  }

  private ProviderCredentials credentialsFor(UUID organizationId) {
    var token =
        secretStore
            .retrieve(SecretStore.keyFor(organizationId, provider(), SecretStore.ACCESS_TOKEN))
            .orElseThrow(
                () ->
                    new AuthExpiredException(
                        provider(), "No access token stored for " + provider()));
    var accountId =
        secretStore
            .retrieve(SecretStore.keyFor(organizationId, provider(), SecretStore.ACCOUNT_ID))
            .orElseThrow(
                () ->
                    new PermanentProviderException(
                        provider(), "No account id stored for " + provider()));
    return new ProviderCredentials(token, accountId);
  }

  protected record ProviderCredentials(String accessToken, String accountId) {

    String bearer() {
      return "Bearer " + accessToken;
    }
  }
}
