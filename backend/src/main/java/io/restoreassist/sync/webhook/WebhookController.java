package io.restoreassist.sync.webhook;

import io.restoreassist.sync.integration.IntegrationProvider;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives accounting provider webhooks. 202 means the event is durably queued; 200 means it was a
 * redelivery of one already stored. Anything else tells the provider to redeliver or give up.
 */
@RestController
@RequestMapping("/api/webhooks/accounting")
public class WebhookController {

  private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

  /** Maximum length for the provider path variable to prevent log injection. */
  private static final int MAX_PROVIDER_LENGTH = 32;

  private final WebhookIngestionService ingestionService;

  public WebhookController(WebhookIngestionService ingestionService) {
    this.ingestionService = ingestionService;
  }

  @PostMapping("/{provider}")
  public ResponseEntity<Map<String, Object>> receive(
      @PathVariable String provider,
      @RequestBody String payload,
      @RequestHeader HttpHeaders headers) {
    var resolved = IntegrationProvider.fromSlug(provider).orElse(null);
    if (resolved == null) {
      log.warn("Webhook for unknown provider: {}", sanitize(provider));
      return ResponseEntity.notFound().build();
    }

    try {
      var receipt = ingestionService.receive(resolved, payload, headers);
      Map<String, Object> body =
          Map.of("eventId", receipt.eventId(), "duplicate", receipt.duplicate());
      return receipt.duplicate()
          ? ResponseEntity.ok(body)
          : ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    } catch (WebhookAuthenticationException e) {
      log.warn("{} webhook authentication failed: {}", resolved, e.getReason());
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
    } catch (WebhookPayloadException e) {
      log.warn("Invalid {} webhook payload: {}", resolved, e.getMessage());
      return ResponseEntity.badRequest().build();
    } catch (WebhookQueueUnavailableException e) {
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }
  }

  private static String sanitize(String provider) {
    var trimmed =
        provider.length() > MAX_PROVIDER_LENGTH
            ? provider.substring(0, MAX_PROVIDER_LENGTH)
            : provider;
    return trimmed.replaceAll("[^a-zA-Z0-9_-]", "_");
  }
}
