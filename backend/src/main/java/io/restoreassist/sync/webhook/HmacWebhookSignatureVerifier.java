package io.restoreassist.sync.webhook;

import io.restoreassist.sync.integration.IntegrationProvider;
import io.restoreassist.sync.webhook.WebhookAuthenticationException.Reason;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Verifies the Base64 HMAC-SHA256 of the raw body that Xero, QuickBooks and MYOB send in a
 * provider-specific header. Fails closed when no secret is configured for the provider.
 */
@Component
public class HmacWebhookSignatureVerifier implements WebhookSignatureVerifier {

  private static final Logger log = LoggerFactory.getLogger(HmacWebhookSignatureVerifier.class);

  private static final String HMAC_ALGORITHM = "HmacSHA256";

  static final Map<IntegrationProvider, String> SIGNATURE_HEADERS =
      Map.of(
          IntegrationProvider.XERO, "x-xero-signature",
          IntegrationProvider.QUICKBOOKS, "intuit-signature",
          IntegrationProvider.MYOB, "x-myob-signature");

  private final WebhookProperties properties;

  public HmacWebhookSignatureVerifier(WebhookProperties properties) {
    this.properties = properties;
  }

  @Override
  public void verify(IntegrationProvider provider, String payload, HttpHeaders headers) {
    var secret = properties.secretFor(provider).orElse(null);
    if (secret == null) {
      log.warn(
          "Webhook secret not configured for provider={}, rejecting request. "
              + "Set restoreassist.webhooks.secrets.{} to enable webhook processing.",
          provider,
          provider.name().toLowerCase(Locale.ROOT));
      throw new WebhookAuthenticationException(provider, Reason.SECRET_NOT_CONFIGURED);
    }

    var signature = headers.getFirst(SIGNATURE_HEADERS.get(provider));
    if (signature == null || signature.isBlank()) {
      throw new WebhookAuthenticationException(provider, Reason.MISSING_SIGNATURE);
    }

    byte[] provided;
    try {
      provided = Base64.getDecoder().decode(signature.trim());
    } catch (IllegalArgumentException e) {
      throw new WebhookAuthenticationException(provider, Reason.MALFORMED_SIGNATURE);
    }

    if (!MessageDigest.isEqual(sign(secret, payload), provided)) {
      throw new WebhookAuthenticationException(provider, Reason.INVALID_SIGNATURE);
    }
  }

  static byte[] sign(String secret, String payload) {
    try {
      var mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
      return mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HmacSHA256 unavailable", e);
    }
  }
}
