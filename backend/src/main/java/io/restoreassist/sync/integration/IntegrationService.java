package io.restoreassist.sync.integration;

import io.restoreassist.sync.exception.ResourceNotFoundException;
import io.restoreassist.sync.integration.secret.SecretStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class IntegrationService {

  private static final Logger log = LoggerFactory.getLogger(IntegrationService.class);

  private final OrgIntegrationRepository repository;
  private final SecretStore secretStore;
  private final Clock clock;

  public IntegrationService(
      OrgIntegrationRepository repository, SecretStore secretStore, Clock clock) {
    this.repository = repository;
    this.secretStore = secretStore;
    this.clock = clock;
  }

  /**
   * Returns the organization's integration for the provider, or throws {@link
   * IntegrationNotConnectedException} if it is missing, not CONNECTED or its token has expired.
   */
  @Transactional(readOnly = true)
  public OrgIntegration requireConnected(UUID organizationId, IntegrationProvider provider) {
    var integration =
        repository
            .findByOrganizationIdAndProvider(organizationId, provider)
            .orElseThrow(
                () -> new IntegrationNotConnectedException(provider, "no integration configured"));
    if (!integration.isConnected(clock.instant())) {
      var reason =
          integration.getStatus() == IntegrationStatus.CONNECTED
              ? "access token expired"
              : "status is " + integration.getStatus();
      throw new IntegrationNotConnectedException(provider, reason);
    }
    return integration;
  }

  @Transactional
  public void recordSuccess(UUID organizationId, IntegrationProvider provider, Instant syncedAt) {
    repository
        .findByOrganizationIdAndProvider(organizationId, provider)
        .ifPresent(integration -> integration.recordSuccessfulSync(syncedAt));
  }

  @Transactional
  public void recordError(UUID organizationId, IntegrationProvider provider, String error) {
    repository
        .findByOrganizationIdAndProvider(organizationId, provider)
        .ifPresent(integration -> integration.recordSyncError(error));
  }

  @Transactional
  public void markAuthExpired(UUID organizationId, IntegrationProvider provider, String error) {
    repository
        .findByOrganizationIdAndProvider(organizationId, provider)
        .ifPresent(
            integration -> {
              integration.markAuthExpired(error);
              log.warn(
                  "Integration {} for organization {} moved to ERROR: {}",
                  provider,
                  organizationId,
                  error);
            });
  }

  /** One entry per known provider; providers never connected are reported as DISCONNECTED. */
  @Transactional(readOnly = true)
  public List<OrgIntegrationDto> listIntegrations(UUID organizationId) {
    var existing = repository.findByOrganizationId(organizationId);
    return Arrays.stream(IntegrationProvider.values())
        .map(
            provider ->
                existing.stream()
                    .filter(i -> i.getProvider() == provider)
                    .findFirst()
                    .map(OrgIntegrationDto::from)
                    .orElseGet(() -> OrgIntegrationDto.unconfigured(organizationId, provider)))
        .toList();
  }

  /**
   * Accepts credentials obtained by the external OAuth connect flow and marks the integration
   * CONNECTED.
   */
  @Transactional
  public OrgIntegrationDto storeCredentials(
      UUID organizationId,
      IntegrationProvider provider,
      String accessToken,
      String accountId,
      Instant tokenExpiresAt) {
    secretStore.store(
        SecretStore.keyFor(organizationId, provider, SecretStore.ACCESS_TOKEN), accessToken);
    secretStore.store(
        SecretStore.keyFor(organizationId, provider, SecretStore.ACCOUNT_ID), accountId);

    var integration =
        repository
            .findByOrganizationIdAndProvider(organizationId, provider)
            .orElseGet(() -> new OrgIntegration(organizationId, provider));
    integration.connect(tokenExpiresAt);
    integration = repository.save(integration);
    log.info(
        "Integration {} connected for organization {} (token expires {})",
        provider,
        organizationId,
        tokenExpiresAt);
    return OrgIntegrationDto.from(integration);
  }

  @Transactional
  public void disconnect(UUID organizationId, IntegrationProvider provider) {
    var integration =
        repository
            .findByOrganizationIdAndProvider(organizationId, provider)
            .orElseThrow(() -> new ResourceNotFoundException("Integration", provider.getSlug()));
    integration.disconnect();
    repository.save(integration);
    secretStore.delete(SecretStore.keyFor(organizationId, provider, SecretStore.ACCESS_TOKEN));
    secretStore.delete(SecretStore.keyFor(organizationId, provider, SecretStore.ACCOUNT_ID));
    log.info("Integration {} disconnected for organization {}", provider, organizationId);
  }
}
