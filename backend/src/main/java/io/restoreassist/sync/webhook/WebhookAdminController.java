package io.restoreassist.sync.webhook;

import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Manual intervention on stored webhook events, mainly re-arming dead letters. */
@RestController
@RequestMapping("/api/internal/webhooks")
public class WebhookAdminController {

  private final WebhookAdminService adminService;

  public WebhookAdminController(WebhookAdminService adminService) {
    this.adminService = adminService;
  }

  @GetMapping("/{id}")
  public ResponseEntity<WebhookEventResponse> getEvent(@PathVariable UUID id) {
    return ResponseEntity.ok(WebhookEventResponse.from(adminService.getEvent(id)));
  }

  @PostMapping("/{id}/retry")
  public ResponseEntity<WebhookEventResponse> retry(@PathVariable UUID id) {
    return ResponseEntity.accepted().body(WebhookEventResponse.from(adminService.retry(id)));
  }

  public record WebhookEventResponse(
      UUID id,
      String provider,
      String eventType,
      WebhookEventStatus status,
      int attempts,
      int deliveryCount,
      Instant receivedAt,
      Instant nextAttemptAt,
      Instant processedAt,
      String lastError) {

    static WebhookEventResponse from(WebhookEvent event) {
      return new WebhookEventResponse(
          event.getId(),
          event.getProvider().getSlug(),
          event.getEventType(),
          event.getStatus(),
          event.getAttempts(),
          event.getDeliveryCount(),
          event.getReceivedAt(),
          event.getNextAttemptAt(),
          event.getProcessedAt(),
          event.getLastError());
    }
  }
}
