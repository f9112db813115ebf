package io.restoreassist.sync.audit;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuditController {

  private final AuditService auditService;

  public AuditController(AuditService auditService) {
    this.auditService = auditService;
  }

  @GetMapping("/api/invoices/{invoiceId}/sync/audit")
  public ResponseEntity<List<SyncAuditEntryResponse>> history(@PathVariable UUID invoiceId) {
    return ResponseEntity.ok(
        auditService.historyFor(invoiceId).stream().map(SyncAuditEntryResponse::from).toList());
  }

  public record SyncAuditEntryResponse(
      UUID id,
      String provider,
      String action,
      int attempt,
      UUID jobId,
      String detail,
      String source,
      Instant occurredAt) {

    static SyncAuditEntryResponse from(SyncAuditEntry entry) {
      return new SyncAuditEntryResponse(
          entry.getId(),
          entry.getProvider().getSlug(),
          entry.getAction().name(),
          entry.getAttempt(),
          entry.getJobId(),
          entry.getDetail(),
          entry.getSource(),
          entry.getOccurredAt());
    }
  }
}
