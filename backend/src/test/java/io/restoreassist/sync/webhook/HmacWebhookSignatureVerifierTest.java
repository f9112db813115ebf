package io.restoreassist.sync.webhook;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.restoreassist.sync.integration.IntegrationProvider;
import java.util.Base64;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

class HmacWebhookSignatureVerifierTest {

  private static final String SECRET = "xero-webhook-key";
  private static final String PAYLOAD =
      "{\"events\":[],\"firstEventSequence\":0,\"lastEventSequence\":0}";

  private HmacWebhookSignatureVerifier verifier;

  @BeforeEach
  void setUp() {
    var properties =
        new WebhookProperties(
            null, null, null, null, null, null, Map.of(IntegrationProvider.XERO, SECRET));
    verifier = new HmacWebhookSignatureVerifier(properties);
  }

  @Test
  void verify_validSignaturePasses() {
    var headers = headers("x-xero-signature", signatureOf(SECRET, PAYLOAD));

    assertThatCode(() -> verifier.verify(IntegrationProvider.XERO, PAYLOAD, headers))
        .doesNotThrowAnyException();
  }

  @Test
  void verify_headerLookupIsCaseInsensitive() {
    var headers = headers("X-Xero-Signature", signatureOf(SECRET, PAYLOAD));

    assertThatCode(() -> verifier.verify(IntegrationProvider.XERO, PAYLOAD, headers))
        .doesNotThrowAnyException();
  }

  @Test
  void verify_signatureOverDifferentBodyIsRejected() {
    var headers = headers("x-xero-signature", signatureOf(SECRET, PAYLOAD));

    assertThatThrownBy(() -> verifier.verify(IntegrationProvider.XERO, PAYLOAD + " ", headers))
        .isInstanceOf(WebhookAuthenticationException.class)
        .hasMessageContaining("Invalid");
  }

  @Test
  void verify_signatureWithWrongSecretIsRejected() {
    var headers = headers("x-xero-signature", signatureOf("another-key", PAYLOAD));

    assertThatThrownBy(() -> verifier.verify(IntegrationProvider.XERO, PAYLOAD, headers))
        .isInstanceOf(WebhookAuthenticationException.class);
  }

  @Test
  void verify_missingSignatureIsRejected() {
    assertThatThrownBy(() -> verifier.verify(IntegrationProvider.XERO, PAYLOAD, new HttpHeaders()))
        .isInstanceOf(WebhookAuthenticationException.class)
        .hasMessageContaining("Missing");
  }

  @Test
  void verify_nonBase64SignatureIsRejected() {
    var headers = headers("x-xero-signature", "not*base64!");

    assertThatThrownBy(() -> verifier.verify(IntegrationProvider.XERO, PAYLOAD, headers))
        .isInstanceOf(WebhookAuthenticationException.class)
        .hasMessageContaining("Malformed");
  }

  @Test
  void verify_providerWithoutSecretFailsClosed() {
    var headers = headers("x-myob-signature", signatureOf(SECRET, PAYLOAD));

    assertThatThrownBy(() -> verifier.verify(IntegrationProvider.MYOB, PAYLOAD, headers))
        .isInstanceOfSatisfying(
            WebhookAuthenticationException.class,
            e ->
                assertThat(e.getReason())
                    .isEqualTo(WebhookAuthenticationException.Reason.SECRET_NOT_CONFIGURED));
  }

  private static HttpHeaders headers(String name, String value) {
    var headers = new HttpHeaders();
    headers.set(name, value);
    return headers;
  }

  private static String signatureOf(String secret, String payload) {
    return Base64.getEncoder()
        .encodeToString(HmacWebhookSignatureVerifier.sign(secret, payload));
  }
}
