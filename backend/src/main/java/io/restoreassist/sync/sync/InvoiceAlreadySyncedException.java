package io.restoreassist.sync.sync;

import io.restoreassist.sync.exception.ResourceConflictException;
import java.util.UUID;

/** A SYNCED invoice must be reset before it can be pushed again. */
public class InvoiceAlreadySyncedException extends ResourceConflictException {

  public InvoiceAlreadySyncedException(UUID invoiceId) {
    super(
        "Invoice already synced",
        "Invoice " + invoiceId + " is already synced; reset it before syncing again");
  }
}
