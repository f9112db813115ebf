package io.restoreassist.sync.invoice;

/**
 * Business lifecycle of an invoice, independent of its accounting sync state.
 *
 * <ul>
 *   <li>DRAFT → SENT or VOID
 *   <li>SENT → PARTIALLY_PAID, PAID or VOID
 *   <li>PARTIALLY_PAID → PAID
 *   <li>PAID and VOID are terminal
 * </ul>
 */
public enum InvoiceStatus {
  DRAFT,
  SENT,
  PARTIALLY_PAID,
  PAID,
  VOID;

  public boolean canTransitionTo(InvoiceStatus target) {
    return switch (this) {
      case DRAFT -> target == SENT || target == VOID;
      case SENT -> target == PARTIALLY_PAID || target == PAID || target == VOID;
      case PARTIALLY_PAID -> target == PAID;
      case PAID, VOID -> false;
    };
  }
}
