package io.restoreassist.sync.invoice;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.util.UUID;

/**
 * A billable line of an invoice. Read-only to the sync layer, which copies lines into each push in
 * {@code sortOrder}.
 */
@Entity
@Table(name = "invoice_lines")
public class InvoiceLine {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "invoice_id", nullable = false, updatable = false)
  private UUID invoiceId;

  @Column(name = "description", nullable = false, columnDefinition = "TEXT")
  private String description;

  @Column(name = "quantity", nullable = false, precision = 10, scale = 4)
  private BigDecimal quantity;

  @Column(name = "unit_price", nullable = false, precision = 12, scale = 2)
  private BigDecimal unitPrice;

  @Column(name = "tax_amount", nullable = false, precision = 14, scale = 2)
  private BigDecimal taxAmount;

  @Column(name = "account_code", length = 20)
  private String accountCode;

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  protected InvoiceLine() {}

  public InvoiceLine(
      UUID invoiceId,
      String description,
      BigDecimal quantity,
      BigDecimal unitPrice,
      BigDecimal taxAmount,
      String accountCode,
      int sortOrder) {
    this.invoiceId = invoiceId;
    this.description = description;
    this.quantity = quantity;
    this.unitPrice = unitPrice;
    this.taxAmount = taxAmount;
    this.accountCode = accountCode;
    this.sortOrder = sortOrder;
  }

  public UUID getId() {
    return id;
  }

  public UUID getInvoiceId() {
    return invoiceId;
  }

  public String getDescription() {
    return description;
  }

  public BigDecimal getQuantity() {
    return quantity;
  }

  public BigDecimal getUnitPrice() {
    return unitPrice;
  }

  public BigDecimal getTaxAmount() {
    return taxAmount;
  }

  public String getAccountCode() {
    return accountCode;
  }

  public int getSortOrder() {
    return sortOrder;
  }
}
