package io.restoreassist.sync.integration.resilience;

import io.restoreassist.sync.config.SyncProperties;
import io.restoreassist.sync.integration.IntegrationProvider;
import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Owns one {@link ProviderRateLimiter} per provider, sized from each provider's quota. */
@Component
public class RateLimiterRegistry {

  private final Map<IntegrationProvider, ProviderRateLimiter> limiters;

  public RateLimiterRegistry(SyncProperties properties, Clock clock) {
    var map = new EnumMap<IntegrationProvider, ProviderRateLimiter>(IntegrationProvider.class);
    for (var provider : IntegrationProvider.values()) {
      map.put(
          provider, new ProviderRateLimiter(provider, properties.rateLimitFor(provider), clock));
    }
    this.limiters = Collections.unmodifiableMap(map);
  }

  public ProviderRateLimiter forProvider(IntegrationProvider provider) {
    return limiters.get(provider);
  }

  public List<RateLimiterSnapshot> snapshots() {
    return limiters.values().stream().map(ProviderRateLimiter::snapshot).toList();
  }
}
