package io.restoreassist.sync.integration;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OrgIntegrationRepository extends JpaRepository<OrgIntegration, UUID> {

  Optional<OrgIntegration> findByOrganizationIdAndProvider(
      UUID organizationId, IntegrationProvider provider);

  List<OrgIntegration> findByOrganizationId(UUID organizationId);
}
