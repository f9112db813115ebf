package io.restoreassist.sync.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.restoreassist.sync.audit.AuditService;
import io.restoreassist.sync.audit.SyncAuditAction;
import io.restoreassist.sync.exception.InvalidStateException;
import io.restoreassist.sync.exception.ResourceNotFoundException;
import io.restoreassist.sync.integration.IntegrationNotConnectedException;
import io.restoreassist.sync.integration.IntegrationProvider;
import io.restoreassist.sync.integration.IntegrationService;
import io.restoreassist.sync.invoice.Invoice;
import io.restoreassist.sync.invoice.InvoiceRepository;
import io.restoreassist.sync.invoice.InvoiceSyncStatus;
import io.restoreassist.sync.testutil.MutableClock;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SyncServiceTest {

  @Mock private InvoiceRepository invoiceRepository;
  @Mock private IntegrationService integrationService;
  @Mock private AuditService auditService;

  private MutableClock clock;
  private InMemorySyncQueue queue;
  private SyncService syncService;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2025-03-01T09:00:00Z");
    queue = new InMemorySyncQueue(clock);
    syncService =
        new SyncService(invoiceRepository, integrationService, auditService, queue, clock);
  }

  @Test
  void enqueueSync_marks_pending_audits_and_queues() {
    var invoice = sentInvoice();
    stubFind(invoice);

    var result =
        syncService.enqueueSync(invoice.getId(), IntegrationProvider.XERO, SyncPriority.NORMAL);

    assertThat(invoice.getSyncStatus()).isEqualTo(InvoiceSyncStatus.PENDING);
    assertThat(invoice.getSyncProvider()).isEqualTo(IntegrationProvider.XERO);
    assertThat(result.provider()).isEqualTo("xero");
    assertThat(queue.contains(invoice.getId(), IntegrationProvider.XERO)).isTrue();
    verify(invoiceRepository).saveAndFlush(invoice);
    verify(auditService)
        .log(
            argThat(
                r ->
                    r.action() == SyncAuditAction.INITIATED
                        && r.jobId().equals(result.jobId())
                        && r.attempt() == 0));
  }

  @Test
  void enqueue_secondRequestWhilePendingIsRejected() {
    var invoice = sentInvoice();
    stubFind(invoice);
    syncService.enqueueSync(invoice.getId(), IntegrationProvider.XERO, SyncPriority.NORMAL);

    assertThatThrownBy(
            () ->
                syncService.enqueueSync(
                    invoice.getId(), IntegrationProvider.XERO, SyncPriority.HIGH))
        .isInstanceOf(AlreadySyncingException.class);
    assertThat(queue.depth()).isEqualTo(1);
  }

  @Test
  void enqueueSync_rejects_synced_invoice() {
    var invoice = sentInvoice();
    invoice.beginSync(IntegrationProvider.XERO);
    invoice.markSynced("xero-1", clock.instant());
    stubFind(invoice);

    assertThatThrownBy(
            () ->
                syncService.enqueueSync(
                    invoice.getId(), IntegrationProvider.XERO, SyncPriority.NORMAL))
        .isInstanceOf(InvoiceAlreadySyncedException.class);
  }

  @Test
  void enqueueSync_rejects_draft_invoice() {
    var invoice = draftInvoice();
    stubFind(invoice);

    assertThatThrownBy(
            () ->
                syncService.enqueueSync(
                    invoice.getId(), IntegrationProvider.XERO, SyncPriority.NORMAL))
        .isInstanceOf(InvalidStateException.class);
    assertThat(invoice.getSyncStatus()).isEqualTo(InvoiceSyncStatus.NOT_SYNCED);
  }

  @Test
  void enqueueSync_requires_connected_integration() {
    var invoice = sentInvoice();
    stubFind(invoice);
    doThrow(new IntegrationNotConnectedException(IntegrationProvider.MYOB, "access token expired"))
        .when(integrationService)
        .requireConnected(invoice.getOrganizationId(), IntegrationProvider.MYOB);

    assertThatThrownBy(
            () ->
                syncService.enqueueSync(
                    invoice.getId(), IntegrationProvider.MYOB, SyncPriority.NORMAL))
        .isInstanceOf(IntegrationNotConnectedException.class);
    assertThat(invoice.getSyncStatus()).isEqualTo(InvoiceSyncStatus.NOT_SYNCED);
    assertThat(queue.depth()).isZero();
    verify(auditService, never()).log(any());
  }

  @Test
  void enqueueSync_unknown_invoice_is_not_found() {
    var id = UUID.randomUUID();
    when(invoiceRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(
            () -> syncService.enqueueSync(id, IntegrationProvider.XERO, SyncPriority.NORMAL))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void retrySync_requeues_failed_invoice_at_high_priority() {
    var invoice = sentInvoice();
    invoice.beginSync(IntegrationProvider.QUICKBOOKS);
    invoice.markSyncFailed("HTTP 400 from QuickBooks");
    stubFind(invoice);

    var result = syncService.retrySync(invoice.getId());

    assertThat(result.priority()).isEqualTo(SyncPriority.HIGH);
    assertThat(invoice.getSyncStatus()).isEqualTo(InvoiceSyncStatus.PENDING);
    assertThat(invoice.getLastSyncError()).isNull();
    assertThat(queue.dequeue().orElseThrow().priority()).isEqualTo(SyncPriority.HIGH);
    verify(auditService).log(argThat(r -> r.action() == SyncAuditAction.RETRIED));
  }

  @Test
  void retrySync_rejects_invoice_that_never_failed() {
    var invoice = sentInvoice();
    stubFind(invoice);

    assertThatThrownBy(() -> syncService.retrySync(invoice.getId()))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void resetSync_keeps_external_id_and_audits() {
    var invoice = sentInvoice();
    invoice.beginSync(IntegrationProvider.XERO);
    invoice.markSynced("xero-77", clock.instant());
    stubFind(invoice);

    var status = syncService.resetSync(invoice.getId());

    assertThat(status.status()).isEqualTo(InvoiceSyncStatus.NOT_SYNCED);
    assertThat(status.externalId()).isEqualTo("xero-77");
    verify(auditService).log(argThat(r -> r.action() == SyncAuditAction.RESET));
  }

  @Test
  void resetSync_rejected_while_pending() {
    var invoice = sentInvoice();
    invoice.beginSync(IntegrationProvider.XERO);
    stubFind(invoice);

    assertThatThrownBy(() -> syncService.resetSync(invoice.getId()))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void getSyncStatus_reports_queued_job() {
    var invoice = sentInvoice();
    stubFind(invoice);
    syncService.enqueueSync(invoice.getId(), IntegrationProvider.XERO, SyncPriority.NORMAL);

    var status = syncService.getSyncStatus(invoice.getId());

    assertThat(status.status()).isEqualTo(InvoiceSyncStatus.PENDING);
    assertThat(status.provider()).isEqualTo("xero");
    assertThat(status.queued()).isTrue();
  }

  private void stubFind(Invoice invoice) {
    when(invoiceRepository.findById(invoice.getId())).thenReturn(Optional.of(invoice));
  }

  private static Invoice draftInvoice() {
    return new Invoice(
        UUID.randomUUID(),
        "INV-1001",
        "Coastal Water Damage Pty Ltd",
        "billing@coastal.example",
        "AUD",
        LocalDate.of(2025, 3, 1),
        LocalDate.of(2025, 3, 31),
        new BigDecimal("1000.00"),
        new BigDecimal("100.00"));
  }

  private static Invoice sentInvoice() {
    var invoice = draftInvoice();
    invoice.markSent();
    return invoice;
  }
}
