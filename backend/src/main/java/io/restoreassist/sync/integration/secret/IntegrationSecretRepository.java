package io.restoreassist.sync.integration.secret;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface IntegrationSecretRepository extends JpaRepository<IntegrationSecret, UUID> {

  Optional<IntegrationSecret> findBySecretKey(String secretKey);

  void deleteBySecretKey(String secretKey);
}
