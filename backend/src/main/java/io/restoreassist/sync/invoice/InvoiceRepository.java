package io.restoreassist.sync.invoice;

import io.restoreassist.sync.integration.IntegrationProvider;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface InvoiceRepository extends JpaRepository<Invoice, UUID> {

  Optional<Invoice> findBySyncProviderAndExternalId(
      IntegrationProvider syncProvider, String externalId);

  List<Invoice> findBySyncStatus(InvoiceSyncStatus syncStatus);
}
