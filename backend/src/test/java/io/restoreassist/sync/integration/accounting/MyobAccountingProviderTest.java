package io.restoreassist.sync.integration.accounting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withCreatedEntity;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withNoContent;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import io.restoreassist.sync.integration.IntegrationProvider;
import io.restoreassist.sync.integration.secret.SecretStore;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import tools.jackson.databind.ObjectMapper;

class MyobAccountingProviderTest {

  private static final String SERVICE_URL =
      "https://api.myob.com/accountright/cf-0042/Sale/Invoice/Service";

  private final UUID organizationId = UUID.randomUUID();

  private MockRestServiceServer server;
  private MyobAccountingProvider provider;

  @BeforeEach
  void setUp() {
    var secretStore = mock(SecretStore.class);
    when(secretStore.retrieve(
            SecretStore.keyFor(organizationId, IntegrationProvider.MYOB, SecretStore.ACCESS_TOKEN)))
        .thenReturn(Optional.of("myob-token"));
    when(secretStore.retrieve(
            SecretStore.keyFor(organizationId, IntegrationProvider.MYOB, SecretStore.ACCOUNT_ID)))
        .thenReturn(Optional.of("cf-0042"));

    var properties =
        new AccountingProviderProperties(null, null, null, null, null, null, "developer-key");
    var builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    provider = new MyobAccountingProvider(builder, properties, secretStore, new ObjectMapper());
  }

  @Test
  void syncInvoice_createReadsUidFromLocationHeader() {
    server
        .expect(requestTo(SERVICE_URL))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer myob-token"))
        .andExpect(header(MyobAccountingProvider.API_KEY_HEADER, "developer-key"))
        .andExpect(header(MyobAccountingProvider.API_VERSION_HEADER, "v2"))
        .andExpect(jsonPath("$.Number").value("INV-0917"))
        .andExpect(jsonPath("$.Customer.UID").value("cust-uid-1"))
        .andExpect(jsonPath("$.Lines[0].Type").value("Transaction"))
        .andRespond(withCreatedEntity(URI.create(SERVICE_URL + "/a1b2-c3d4")));

    assertThat(provider.syncInvoice(request(null, 0)).externalId()).isEqualTo("a1b2-c3d4");
    server.verify();
  }

  @Test
  void syncInvoice_updatePutsToExistingUid() {
    server
        .expect(requestTo(SERVICE_URL + "/a1b2-c3d4"))
        .andExpect(method(HttpMethod.PUT))
        .andExpect(jsonPath("$.UID").value("a1b2-c3d4"))
        .andRespond(withNoContent());

    assertThat(provider.syncInvoice(request("a1b2-c3d4", 0)).externalId()).isEqualTo("a1b2-c3d4");
    server.verify();
  }

  @Test
  void syncInvoice_createWithoutLocationIsPermanent() {
    server.expect(requestTo(SERVICE_URL)).andRespond(withStatus(HttpStatus.CREATED));

    assertThatThrownBy(() -> provider.syncInvoice(request(null, 0)))
        .isExactlyInstanceOf(PermanentProviderException.class)
        .hasMessageContaining("document id");
  }

  @Test
  void syncInvoice_unauthorizedIsAuthExpired() {
    server.expect(requestTo(SERVICE_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertThatThrownBy(() -> provider.syncInvoice(request(null, 0)))
        .isInstanceOf(AuthExpiredException.class);
  }

  @Test
  void syncInvoice_retriedCreateAdoptsInvoiceAlreadyInMyob() {
    server
        .expect(requestTo(startsWith(SERVICE_URL + "?")))
        .andExpect(method(HttpMethod.GET))
        .andExpect(
            request ->
                assertThat(decodedQuery(request.getURI()))
                    .isEqualTo("$filter=Number eq 'INV-0917'"))
        .andExpect(header(MyobAccountingProvider.API_KEY_HEADER, "developer-key"))
        .andRespond(
            withSuccess(
                "{\"Items\":[{\"UID\":\"e5f6-a7b8\",\"Number\":\"INV-0917\"}],\"Count\":1}",
                MediaType.APPLICATION_JSON));

    assertThat(provider.syncInvoice(request(null, 1)).externalId()).isEqualTo("e5f6-a7b8");
    server.verify();
  }

  @Test
  void syncInvoice_retriedCreatePostsWhenLookupFindsNothing() {
    server
        .expect(requestTo(startsWith(SERVICE_URL + "?")))
        .andExpect(method(HttpMethod.GET))
        .andRespond(withSuccess("{\"Items\":[],\"Count\":0}", MediaType.APPLICATION_JSON));
    server
        .expect(requestTo(SERVICE_URL))
        .andExpect(method(HttpMethod.POST))
        .andRespond(withCreatedEntity(URI.create(SERVICE_URL + "/c9d0-e1f2")));

    assertThat(provider.syncInvoice(request(null, 2)).externalId()).isEqualTo("c9d0-e1f2");
    server.verify();
  }

  @Test
  void syncInvoice_retriedUpdateSkipsLookup() {
    server
        .expect(requestTo(SERVICE_URL + "/a1b2-c3d4"))
        .andExpect(method(HttpMethod.PUT))
        .andRespond(withNoContent());

    assertThat(provider.syncInvoice(request("a1b2-c3d4", 3)).externalId()).isEqualTo("a1b2-c3d4");
    server.verify();
  }

  private static String decodedQuery(URI uri) {
    return URLDecoder.decode(uri.getRawQuery(), StandardCharsets.UTF_8);
  }

  private InvoiceSyncRequest request(String existingExternalId, int attempt) {
    return new InvoiceSyncRequest(
        organizationId,
        UUID.randomUUID(),
        "INV-0917",
        "Westgate Insurance Brokers",
        "claims@westgate.example",
        "cust-uid-1",
        List.of(
            new LineItem(
                "Mould remediation",
                new BigDecimal("2"),
                new BigDecimal("310.00"),
                new BigDecimal("62.00"),
                null)),
        "AUD",
        LocalDate.of(2025, 3, 9),
        LocalDate.of(2025, 4, 8),
        new BigDecimal("682.00"),
        existingExternalId,
        attempt);
  }
}
