package io.restoreassist.sync.integration.accounting;

import io.restoreassist.sync.integration.IntegrationProvider;

/**
 * Port for pushing invoices to an external accounting system. One implementation per {@link
 * IntegrationProvider}; the orchestrator never sees raw HTTP errors from it.
 */
public interface AccountingProvider {

  IntegrationProvider provider();

  /**
   * Creates the invoice in the external system, or updates it when {@link
   * InvoiceSyncRequest#existingExternalId()} is set.
   *
   * @throws TransientProviderException when a retry may succeed (timeouts, 5xx, I/O)
   * @throws PermanentProviderException when the request will never succeed as sent
   * @throws AuthExpiredException when the stored credentials are missing or rejected
   * @throws RateLimitedException when the provider refused the call for quota reasons
   */
  AccountingSyncResult syncInvoice(InvoiceSyncRequest request);
}
