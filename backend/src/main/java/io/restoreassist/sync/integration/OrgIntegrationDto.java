package io.restoreassist.sync.integration;

import java.time.Instant;
import java.util.UUID;

/** Response record for an organization's connection to one provider. */
public record OrgIntegrationDto(
    UUID organizationId,
    String provider,
    String status,
    Instant tokenExpiresAt,
    Instant lastSyncAt,
    String lastError,
    Instant updatedAt) {

  public static OrgIntegrationDto from(OrgIntegration entity) {
    return new OrgIntegrationDto(
        entity.getOrganizationId(),
        entity.getProvider().getSlug(),
        entity.getStatus().name(),
        entity.getTokenExpiresAt(),
        entity.getLastSyncAt(),
        entity.getLastError(),
        entity.getUpdatedAt());
  }

  /** Synthesizes a DTO for a provider the organization has never connected. */
  public static OrgIntegrationDto unconfigured(UUID organizationId, IntegrationProvider provider) {
    return new OrgIntegrationDto(
        organizationId,
        provider.getSlug(),
        IntegrationStatus.DISCONNECTED.name(),
        null,
        null,
        null,
        null);
  }
}
