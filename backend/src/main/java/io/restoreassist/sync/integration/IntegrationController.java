package io.restoreassist.sync.integration;

import io.restoreassist.sync.exception.ResourceNotFoundException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/organizations/{organizationId}/integrations")
public class IntegrationController {

  private final IntegrationService integrationService;

  public IntegrationController(IntegrationService integrationService) {
    this.integrationService = integrationService;
  }

  @GetMapping
  public ResponseEntity<List<OrgIntegrationDto>> listIntegrations(
      @PathVariable UUID organizationId) {
    return ResponseEntity.ok(integrationService.listIntegrations(organizationId));
  }

  @PutMapping("/{provider}/credentials")
  public ResponseEntity<OrgIntegrationDto> storeCredentials(
      @PathVariable UUID organizationId,
      @PathVariable String provider,
      @Valid @RequestBody StoreCredentialsRequest request) {
    return ResponseEntity.ok(
        integrationService.storeCredentials(
            organizationId,
            resolve(provider),
            request.accessToken(),
            request.accountId(),
            request.tokenExpiresAt()));
  }

  @DeleteMapping("/{provider}")
  public ResponseEntity<Void> disconnect(
      @PathVariable UUID organizationId, @PathVariable String provider) {
    integrationService.disconnect(organizationId, resolve(provider));
    return ResponseEntity.noContent().build();
  }

  private static IntegrationProvider resolve(String slug) {
    return IntegrationProvider.fromSlug(slug)
        .orElseThrow(() -> new ResourceNotFoundException("Provider", slug));
  }

  // --- DTOs ---

  public record StoreCredentialsRequest(
      @NotBlank(message = "accessToken must not be blank") String accessToken,
      @NotBlank(message = "accountId must not be blank") String accountId,
      Instant tokenExpiresAt) {}
}
