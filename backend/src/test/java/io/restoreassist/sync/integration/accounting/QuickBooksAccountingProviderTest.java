package io.restoreassist.sync.integration.accounting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import io.restoreassist.sync.integration.IntegrationProvider;
import io.restoreassist.sync.integration.secret.SecretStore;
import java.math.BigDecimal;
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

class QuickBooksAccountingProviderTest {

  private static final String COMPANY_URL =
      "https://quickbooks.api.intuit.com/v3/company/realm-9/invoice";

  private final UUID organizationId = UUID.randomUUID();
  private final UUID invoiceId = UUID.randomUUID();

  private MockRestServiceServer server;
  private QuickBooksAccountingProvider provider;

  @BeforeEach
  void setUp() {
    var secretStore = mock(SecretStore.class);
    when(secretStore.retrieve(
            SecretStore.keyFor(
                organizationId, IntegrationProvider.QUICKBOOKS, SecretStore.ACCESS_TOKEN)))
        .thenReturn(Optional.of("qb-token"));
    when(secretStore.retrieve(
            SecretStore.keyFor(
                organizationId, IntegrationProvider.QUICKBOOKS, SecretStore.ACCOUNT_ID)))
        .thenReturn(Optional.of("realm-9"));

    var builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    provider =
        new QuickBooksAccountingProvider(
            builder, AccountingProviderProperties.defaults(), secretStore, new ObjectMapper());
  }

  @Test
  void syncInvoice_createPassesRequestIdForDeduplication() {
    server
        .expect(requestTo(startsWith(COMPANY_URL)))
        .andExpect(method(HttpMethod.POST))
        .andExpect(queryParam("minorversion", "75"))
        .andExpect(queryParam("requestid", invoiceId.toString()))
        .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer qb-token"))
        .andExpect(jsonPath("$.DocNumber").value("INV-4410"))
        .andExpect(jsonPath("$.CustomerRef.value").value("58"))
        .andExpect(jsonPath("$.Line[0].DetailType").value("SalesItemLineDetail"))
        .andRespond(withSuccess("{\"Invoice\":{\"Id\":\"131\"}}", MediaType.APPLICATION_JSON));

    assertThat(provider.syncInvoice(request("58", null)).externalId()).isEqualTo("131");
    server.verify();
  }

  @Test
  void syncInvoice_updateFetchesSyncTokenAndSendsSparseUpdate() {
    server
        .expect(requestTo(COMPANY_URL + "/131?minorversion=75"))
        .andExpect(method(HttpMethod.GET))
        .andRespond(
            withSuccess(
                "{\"Invoice\":{\"Id\":\"131\",\"SyncToken\":\"3\"}}", MediaType.APPLICATION_JSON));
    server
        .expect(requestTo(COMPANY_URL + "?minorversion=75"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(jsonPath("$.Id").value("131"))
        .andExpect(jsonPath("$.SyncToken").value("3"))
        .andExpect(jsonPath("$.sparse").value(true))
        .andRespond(withSuccess("{\"Invoice\":{\"Id\":\"131\"}}", MediaType.APPLICATION_JSON));

    assertThat(provider.syncInvoice(request("58", "131")).externalId()).isEqualTo("131");
    server.verify();
  }

  @Test
  void syncInvoice_updateWithoutSyncTokenIsPermanent() {
    server
        .expect(requestTo(COMPANY_URL + "/131?minorversion=75"))
        .andRespond(withSuccess("{\"Invoice\":{\"Id\":\"131\"}}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> provider.syncInvoice(request("58", "131")))
        .isExactlyInstanceOf(PermanentProviderException.class)
        .hasMessageContaining("SyncToken");
  }

  @Test
  void syncInvoice_missingCustomerReferenceIsRejectedBeforeAnyCall() {
    assertThatThrownBy(() -> provider.syncInvoice(request(null, null)))
        .isExactlyInstanceOf(PermanentProviderException.class)
        .hasMessageContaining("customer reference");
    server.verify();
  }

  @Test
  void syncInvoice_badGatewayIsTransient() {
    server
        .expect(requestTo(startsWith(COMPANY_URL)))
        .andRespond(withStatus(HttpStatus.BAD_GATEWAY));

    assertThatThrownBy(() -> provider.syncInvoice(request("58", null)))
        .isInstanceOf(TransientProviderException.class);
  }

  private InvoiceSyncRequest request(String customerRef, String existingExternalId) {
    return new InvoiceSyncRequest(
        organizationId,
        invoiceId,
        "INV-4410",
        "Harbour Strata Management",
        null,
        customerRef,
        List.of(
            new LineItem(
                "Water extraction",
                BigDecimal.ONE,
                new BigDecimal("880.00"),
                BigDecimal.ZERO,
                null)),
        "AUD",
        LocalDate.of(2025, 7, 14),
        LocalDate.of(2025, 8, 13),
        new BigDecimal("880.00"),
        existingExternalId,
        0);
  }
}
