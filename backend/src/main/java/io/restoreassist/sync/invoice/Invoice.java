package io.restoreassist.sync.invoice;

import io.restoreassist.sync.exception.InvalidStateException;
import io.restoreassist.sync.integration.IntegrationProvider;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Invoice as seen by the accounting sync layer: the business fields pushed to providers plus the
 * sync projection (status, provider, external id, last sync time and error).
 *
 * <p>Sync invariants enforced here:
 *
 * <ul>
 *   <li>the external id is written on the first successful sync and never replaced
 *   <li>a second SYNCED outcome is a no-op ({@link #markSynced} returns {@code false})
 *   <li>a PENDING invoice cannot be re-claimed or reset
 * </ul>
 *
 * <p>The {@code version} column makes concurrent claims of the same invoice fail with an
 * optimistic locking error instead of both succeeding.
 */
@Entity
@Table(name = "invoices")
public class Invoice {

  @Id private UUID id;

  @Version
  @Column(name = "version")
  private Long version;

  @Column(name = "organization_id", nullable = false, updatable = false)
  private UUID organizationId;

  @Column(name = "invoice_number", nullable = false, length = 50)
  private String invoiceNumber;

  @Column(name = "customer_name", nullable = false, length = 255)
  private String customerName;

  @Column(name = "customer_email", length = 255)
  private String customerEmail;

  @Column(name = "customer_account_ref", length = 100)
  private String customerAccountRef;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "issue_date")
  private LocalDate issueDate;

  @Column(name = "due_date")
  private LocalDate dueDate;

  @Column(name = "subtotal", nullable = false, precision = 14, scale = 2)
  private BigDecimal subtotal;

  @Column(name = "tax_amount", nullable = false, precision = 14, scale = 2)
  private BigDecimal taxAmount;

  @Column(name = "total", nullable = false, precision = 14, scale = 2)
  private BigDecimal total;

  @Column(name = "amount_paid", nullable = false, precision = 14, scale = 2)
  private BigDecimal amountPaid = BigDecimal.ZERO;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InvoiceStatus status = InvoiceStatus.DRAFT;

  @Column(name = "paid_at")
  private Instant paidAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "sync_status", nullable = false, length = 20)
  private InvoiceSyncStatus syncStatus = InvoiceSyncStatus.NOT_SYNCED;

  @Enumerated(EnumType.STRING)
  @Column(name = "sync_provider", length = 20)
  private IntegrationProvider syncProvider;

  @Column(name = "external_id", length = 100)
  private String externalId;

  @Column(name = "last_synced_at")
  private Instant lastSyncedAt;

  @Column(name = "last_sync_error", columnDefinition = "TEXT")
  private String lastSyncError;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Invoice() {}

  public Invoice(
      UUID organizationId,
      String invoiceNumber,
      String customerName,
      String customerEmail,
      String currency,
      LocalDate issueDate,
      LocalDate dueDate,
      BigDecimal subtotal,
      BigDecimal taxAmount) {
    this.id = UUID.randomUUID();
    this.organizationId = organizationId;
    this.invoiceNumber = invoiceNumber;
    this.customerName = customerName;
    this.customerEmail = customerEmail;
    this.currency = currency;
    this.issueDate = issueDate;
    this.dueDate = dueDate;
    this.subtotal = subtotal;
    this.taxAmount = taxAmount;
    this.total = subtotal.add(taxAmount);
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  public void markSent() {
    if (!status.canTransitionTo(InvoiceStatus.SENT)) {
      throw new InvalidStateException(
          "Invalid invoice transition", "Cannot send invoice in status " + status);
    }
    this.status = InvoiceStatus.SENT;
  }

  /** DRAFT and VOID invoices are never pushed to a provider. */
  public boolean isSyncable() {
    return status != InvoiceStatus.DRAFT && status != InvoiceStatus.VOID;
  }

  /**
   * Claims the invoice for a sync to {@code provider}. An invoice that already has an external id
   * can only be synced again to the provider that issued it.
   */
  public void beginSync(IntegrationProvider provider) {
    if (syncStatus == InvoiceSyncStatus.PENDING) {
      throw new InvalidStateException(
          "Sync already in progress", "Invoice " + invoiceNumber + " is already being synced");
    }
    if (externalId != null && syncProvider != provider) {
      throw new InvalidStateException(
          "Invoice bound to another provider",
          "Invoice " + invoiceNumber + " was already synced to " + syncProvider);
    }
    this.syncStatus = InvoiceSyncStatus.PENDING;
    this.syncProvider = provider;
    this.lastSyncError = null;
  }

  /**
   * Records a successful sync. Returns {@code false} without changing anything if the invoice is
   * already SYNCED. An existing external id is kept even if the provider reports another one.
   */
  public boolean markSynced(String providerDocumentId, Instant syncedAt) {
    if (syncStatus == InvoiceSyncStatus.SYNCED) {
      return false;
    }
    if (this.externalId == null) {
      this.externalId = providerDocumentId;
    }
    this.syncStatus = InvoiceSyncStatus.SYNCED;
    this.lastSyncedAt = syncedAt;
    this.lastSyncError = null;
    return true;
  }

  /** Terminal failure of the in-flight sync. Ignored unless the invoice is PENDING. */
  public boolean markSyncFailed(String error) {
    if (syncStatus != InvoiceSyncStatus.PENDING) {
      return false;
    }
    this.syncStatus = InvoiceSyncStatus.FAILED;
    this.lastSyncError = error;
    return true;
  }

  /**
   * Returns a SYNCED or FAILED invoice to NOT_SYNCED so it can be pushed again. The external id
   * and provider are kept, so the next push updates the same document.
   */
  public void resetSync() {
    if (syncStatus == InvoiceSyncStatus.PENDING) {
      throw new InvalidStateException(
          "Sync in progress", "Cannot reset invoice " + invoiceNumber + " while a sync is pending");
    }
    this.syncStatus = InvoiceSyncStatus.NOT_SYNCED;
    this.lastSyncError = null;
  }

  /**
   * Adds a payment received from the provider. Order-independent: the resulting status depends
   * only on the accumulated amount.
   */
  public void applyPayment(BigDecimal amount, Instant receivedAt) {
    this.amountPaid = this.amountPaid.add(amount);
    if (amountPaid.compareTo(total) >= 0) {
      if (status.canTransitionTo(InvoiceStatus.PAID)) {
        this.status = InvoiceStatus.PAID;
        this.paidAt = receivedAt;
      }
    } else if (amountPaid.signum() > 0 && status.canTransitionTo(InvoiceStatus.PARTIALLY_PAID)) {
      this.status = InvoiceStatus.PARTIALLY_PAID;
    }
  }

  public BigDecimal getAmountDue() {
    return total.subtract(amountPaid).max(BigDecimal.ZERO);
  }

  public void setCustomerAccountRef(String customerAccountRef) {
    this.customerAccountRef = customerAccountRef;
  }

  public UUID getId() {
    return id;
  }

  public Long getVersion() {
    return version;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public String getInvoiceNumber() {
    return invoiceNumber;
  }

  public String getCustomerName() {
    return customerName;
  }

  public String getCustomerEmail() {
    return customerEmail;
  }

  public String getCustomerAccountRef() {
    return customerAccountRef;
  }

  public String getCurrency() {
    return currency;
  }

  public LocalDate getIssueDate() {
    return issueDate;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public BigDecimal getSubtotal() {
    return subtotal;
  }

  public BigDecimal getTaxAmount() {
    return taxAmount;
  }

  public BigDecimal getTotal() {
    return total;
  }

  public BigDecimal getAmountPaid() {
    return amountPaid;
  }

  public InvoiceStatus getStatus() {
    return status;
  }

  public Instant getPaidAt() {
    return paidAt;
  }

  public InvoiceSyncStatus getSyncStatus() {
    return syncStatus;
  }

  public IntegrationProvider getSyncProvider() {
    return syncProvider;
  }

  public String getExternalId() {
    return externalId;
  }

  public Instant getLastSyncedAt() {
    return lastSyncedAt;
  }

  public String getLastSyncError() {
    return lastSyncError;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
