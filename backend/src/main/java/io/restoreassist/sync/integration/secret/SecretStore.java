package io.restoreassist.sync.integration.secret;

import io.restoreassist.sync.integration.IntegrationProvider;
import java.util.Optional;
import java.util.UUID;

/** Storage for provider credentials handed over by the connection flow. */
public interface SecretStore {

  String ACCESS_TOKEN = "access_token";

  /** Provider-side account selector: Xero tenant id, QuickBooks realm id, MYOB company file. */
  String ACCOUNT_ID = "account_id";

  /** Store a secret (encrypts before persistence). Overwrites if key exists. */
  void store(String secretKey, String plaintext);

  /** Retrieve and decrypt a secret, empty if none is stored under the key. */
  Optional<String> retrieve(String secretKey);

  /** Delete a secret. No-op if not found. */
  void delete(String secretKey);

  static String keyFor(UUID organizationId, IntegrationProvider provider, String name) {
    return organizationId + ":" + provider.getSlug() + ":" + name;
  }
}
