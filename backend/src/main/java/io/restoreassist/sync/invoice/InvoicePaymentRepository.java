package io.restoreassist.sync.invoice;

import io.restoreassist.sync.integration.IntegrationProvider;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface InvoicePaymentRepository extends JpaRepository<InvoicePayment, UUID> {

  boolean existsByProviderAndExternalPaymentId(
      IntegrationProvider provider, String externalPaymentId);

  List<InvoicePayment> findByInvoiceIdOrderByReceivedAt(UUID invoiceId);
}
