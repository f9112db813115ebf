package io.restoreassist.sync.sync;

import io.restoreassist.sync.exception.ResourceConflictException;
import java.util.UUID;

public class AlreadySyncingException extends ResourceConflictException {

  public AlreadySyncingException(UUID invoiceId) {
    super("Sync already in progress", "Invoice " + invoiceId + " already has a sync in progress");
  }
}
