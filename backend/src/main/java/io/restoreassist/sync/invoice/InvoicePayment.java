package io.restoreassist.sync.invoice;

import io.restoreassist.sync.integration.IntegrationProvider;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** A payment recorded in an accounting system and applied to a local invoice. */
@Entity
@Table(
    name = "invoice_payments",
    uniqueConstraints = @UniqueConstraint(columnNames = {"provider", "external_payment_id"}))
public class InvoicePayment {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "invoice_id", nullable = false, updatable = false)
  private UUID invoiceId;

  @Enumerated(EnumType.STRING)
  @Column(name = "provider", nullable = false, updatable = false, length = 20)
  private IntegrationProvider provider;

  @Column(name = "external_payment_id", nullable = false, updatable = false, length = 100)
  private String externalPaymentId;

  @Column(name = "amount", nullable = false, updatable = false, precision = 14, scale = 2)
  private BigDecimal amount;

  @Column(name = "paid_on")
  private LocalDate paidOn;

  @Column(name = "reference", length = 255)
  private String reference;

  @Column(name = "webhook_event_id")
  private UUID webhookEventId;

  @Column(name = "received_at", nullable = false, updatable = false)
  private Instant receivedAt;

  protected InvoicePayment() {}

  public InvoicePayment(
      UUID invoiceId,
      IntegrationProvider provider,
      String externalPaymentId,
      BigDecimal amount,
      LocalDate paidOn,
      String reference,
      UUID webhookEventId,
      Instant receivedAt) {
    this.invoiceId = invoiceId;
    this.provider = provider;
    this.externalPaymentId = externalPaymentId;
    this.amount = amount;
    this.paidOn = paidOn;
    this.reference = reference;
    this.webhookEventId = webhookEventId;
    this.receivedAt = receivedAt;
  }

  public UUID getId() {
    return id;
  }

  public UUID getInvoiceId() {
    return invoiceId;
  }

  public IntegrationProvider getProvider() {
    return provider;
  }

  public String getExternalPaymentId() {
    return externalPaymentId;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public LocalDate getPaidOn() {
    return paidOn;
  }

  public String getReference() {
    return reference;
  }

  public UUID getWebhookEventId() {
    return webhookEventId;
  }

  public Instant getReceivedAt() {
    return receivedAt;
  }
}
