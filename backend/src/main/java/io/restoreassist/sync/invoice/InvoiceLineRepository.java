package io.restoreassist.sync.invoice;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface InvoiceLineRepository extends JpaRepository<InvoiceLine, UUID> {

  List<InvoiceLine> findByInvoiceIdOrderBySortOrder(UUID invoiceId);
}
