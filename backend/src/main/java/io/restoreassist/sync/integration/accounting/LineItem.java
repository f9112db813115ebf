package io.restoreassist.sync.integration.accounting;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One line of an invoice as pushed to a provider. Amounts are tax-exclusive; {@code accountCode}
 * is the provider's revenue account and may be null, in which case the provider default applies.
 */
public record LineItem(
    String description,
    BigDecimal quantity,
    BigDecimal unitPrice,
    BigDecimal taxAmount,
    String accountCode) {

  public LineItem {
    Objects.requireNonNull(quantity, "quantity");
    Objects.requireNonNull(unitPrice, "unitPrice");
    taxAmount = taxAmount != null ? taxAmount : BigDecimal.ZERO;
  }

  /** Quantity times unit price, before tax. */
  public BigDecimal total() {
    return quantity.multiply(unitPrice);
  }
}
