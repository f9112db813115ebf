package io.restoreassist.sync.invoice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.restoreassist.sync.exception.InvalidStateException;
import io.restoreassist.sync.integration.IntegrationProvider;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InvoiceTest {

  private static final Instant NOW = Instant.parse("2025-05-06T10:00:00Z");

  private Invoice invoice;

  @BeforeEach
  void setUp() {
    invoice =
        new Invoice(
            UUID.randomUUID(),
            "INV-0042",
            "Riverside Apartments",
            "accounts@riverside.example",
            "AUD",
            LocalDate.of(2025, 5, 1),
            LocalDate.of(2025, 5, 31),
            new BigDecimal("1000.00"),
            new BigDecimal("100.00"));
    invoice.markSent();
  }

  @Test
  void isSyncable_falseForDraftAndVoidInvoices() {
    var draft =
        new Invoice(
            UUID.randomUUID(),
            "INV-0043",
            "Riverside Apartments",
            null,
            "AUD",
            null,
            null,
            BigDecimal.TEN,
            BigDecimal.ZERO);

    assertThat(draft.isSyncable()).isFalse();
    assertThat(invoice.isSyncable()).isTrue();
  }

  @Test
  void beginSync_twice_is_rejected() {
    invoice.beginSync(IntegrationProvider.XERO);

    assertThatThrownBy(() -> invoice.beginSync(IntegrationProvider.XERO))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void markSynced_is_idempotent_and_keeps_first_external_id() {
    invoice.beginSync(IntegrationProvider.XERO);

    assertThat(invoice.markSynced("ext-1", NOW)).isTrue();
    assertThat(invoice.markSynced("ext-2", NOW.plusSeconds(5))).isFalse();

    assertThat(invoice.getExternalId()).isEqualTo("ext-1");
    assertThat(invoice.getLastSyncedAt()).isEqualTo(NOW);
  }

  @Test
  void markSynced_keepsInvoiceBoundToItsProvider() {
    invoice.beginSync(IntegrationProvider.XERO);
    invoice.markSynced("ext-1", NOW);
    invoice.resetSync();

    assertThatThrownBy(() -> invoice.beginSync(IntegrationProvider.QUICKBOOKS))
        .isInstanceOf(InvalidStateException.class);

    invoice.beginSync(IntegrationProvider.XERO);
    assertThat(invoice.getSyncStatus()).isEqualTo(InvoiceSyncStatus.PENDING);
    assertThat(invoice.getExternalId()).isEqualTo("ext-1");
  }

  @Test
  void markSyncFailed_onlyAppliesToPendingSync() {
    assertThat(invoice.markSyncFailed("nope")).isFalse();

    invoice.beginSync(IntegrationProvider.MYOB);
    assertThat(invoice.markSyncFailed("HTTP 400")).isTrue();
    assertThat(invoice.getSyncStatus()).isEqualTo(InvoiceSyncStatus.FAILED);
    assertThat(invoice.getLastSyncError()).isEqualTo("HTTP 400");
  }

  @Test
  void applyPayment_accumulatesRegardlessOfOrder() {
    invoice.applyPayment(new BigDecimal("600.00"), NOW);
    assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.PARTIALLY_PAID);
    assertThat(invoice.getAmountDue()).isEqualByComparingTo("500.00");

    invoice.applyPayment(new BigDecimal("500.00"), NOW.plusSeconds(60));
    assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.PAID);
    assertThat(invoice.getPaidAt()).isEqualTo(NOW.plusSeconds(60));
    assertThat(invoice.getAmountDue()).isEqualByComparingTo("0");
  }

  @Test
  void applyPayment_overpaymentDoesNotGoNegative() {
    invoice.applyPayment(new BigDecimal("1200.00"), NOW);

    assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.PAID);
    assertThat(invoice.getAmountDue()).isEqualByComparingTo("0");
  }
}
