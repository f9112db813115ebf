package io.restoreassist.sync.integration;

import io.restoreassist.sync.integration.accounting.AccountingProvider;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Maps each {@link IntegrationProvider} to the single {@link AccountingProvider} bean that talks
 * to it. Built once at startup; fails fast if two clients claim the same provider.
 */
@Component
public class IntegrationRegistry {

  private final Map<IntegrationProvider, AccountingProvider> clients;

  public IntegrationRegistry(List<AccountingProvider> providers) {
    var map = new EnumMap<IntegrationProvider, AccountingProvider>(IntegrationProvider.class);
    for (var client : providers) {
      var existing = map.putIfAbsent(client.provider(), client);
      if (existing != null) {
        throw new IllegalStateException(
            "Duplicate AccountingProvider for "
                + client.provider()
                + ": registered by both "
                + existing.getClass().getName()
                + " and "
                + client.getClass().getName());
      }
    }
    this.clients = Collections.unmodifiableMap(map);
  }

  /**
   * @throws IllegalArgumentException if no client is registered for the provider
   */
  public AccountingProvider resolve(IntegrationProvider provider) {
    var client = clients.get(provider);
    if (client == null) {
      throw new IllegalArgumentException("No accounting client registered for " + provider);
    }
    return client;
  }

  public Set<IntegrationProvider> availableProviders() {
    return clients.keySet();
  }
}
