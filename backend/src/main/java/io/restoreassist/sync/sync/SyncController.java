package io.restoreassist.sync.sync;

import io.restoreassist.sync.exception.InvalidStateException;
import io.restoreassist.sync.integration.IntegrationProvider;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/invoices/{invoiceId}/sync")
public class SyncController {

  private final SyncService syncService;

  public SyncController(SyncService syncService) {
    this.syncService = syncService;
  }

  /**
   * Queues the invoice for push to an accounting provider.
   *
   * @return 202 Accepted with the job id; the push itself happens asynchronously
   */
  @PostMapping
  public ResponseEntity<EnqueueResult> enqueueSync(
      @PathVariable UUID invoiceId, @Valid @RequestBody EnqueueSyncRequest request) {
    var provider =
        IntegrationProvider.fromSlug(request.provider())
            .orElseThrow(
                () ->
                    new InvalidStateException(
                        "Unknown provider", "Unsupported provider: " + request.provider()));
    var priority = request.priority() != null ? request.priority() : SyncPriority.NORMAL;
    return ResponseEntity.accepted().body(syncService.enqueueSync(invoiceId, provider, priority));
  }

  @PostMapping("/retry")
  public ResponseEntity<EnqueueResult> retrySync(@PathVariable UUID invoiceId) {
    return ResponseEntity.accepted().body(syncService.retrySync(invoiceId));
  }

  @PostMapping("/reset")
  public ResponseEntity<SyncStatusResponse> resetSync(@PathVariable UUID invoiceId) {
    return ResponseEntity.ok(syncService.resetSync(invoiceId));
  }

  @GetMapping
  public ResponseEntity<SyncStatusResponse> getSyncStatus(@PathVariable UUID invoiceId) {
    return ResponseEntity.ok(syncService.getSyncStatus(invoiceId));
  }

  public record EnqueueSyncRequest(@NotBlank String provider, SyncPriority priority) {}
}
