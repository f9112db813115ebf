package io.restoreassist.sync.integration.resilience;

import io.restoreassist.sync.config.SyncProperties;
import io.restoreassist.sync.integration.IntegrationProvider;
import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Owns one {@link ProviderCircuitBreaker} per provider for the lifetime of the process. */
@Component
public class CircuitBreakerRegistry {

  private final Map<IntegrationProvider, ProviderCircuitBreaker> breakers;

  public CircuitBreakerRegistry(SyncProperties properties, Clock clock) {
    var map = new EnumMap<IntegrationProvider, ProviderCircuitBreaker>(IntegrationProvider.class);
    for (var provider : IntegrationProvider.values()) {
      map.put(provider, new ProviderCircuitBreaker(provider, properties.breaker(), clock));
    }
    this.breakers = Collections.unmodifiableMap(map);
  }

  public ProviderCircuitBreaker forProvider(IntegrationProvider provider) {
    return breakers.get(provider);
  }

  public List<CircuitBreakerSnapshot> snapshots() {
    return breakers.values().stream().map(ProviderCircuitBreaker::snapshot).toList();
  }

  public void reset(IntegrationProvider provider) {
    breakers.get(provider).reset();
  }
}
