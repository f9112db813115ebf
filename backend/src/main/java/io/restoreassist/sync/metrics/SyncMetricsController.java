package io.restoreassist.sync.metrics;

import io.restoreassist.sync.exception.ResourceNotFoundException;
import io.restoreassist.sync.integration.IntegrationProvider;
import io.restoreassist.sync.integration.resilience.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/internal/sync")
public class SyncMetricsController {

  private static final Logger log = LoggerFactory.getLogger(SyncMetricsController.class);

  private final SyncMetricsReporter reporter;
  private final CircuitBreakerRegistry circuitBreakers;

  public SyncMetricsController(
      SyncMetricsReporter reporter, CircuitBreakerRegistry circuitBreakers) {
    this.reporter = reporter;
    this.circuitBreakers = circuitBreakers;
  }

  @GetMapping("/metrics")
  public ResponseEntity<SyncMetricsSnapshot> getMetrics() {
    return ResponseEntity.ok(reporter.snapshot());
  }

  /** Forces a provider's breaker back to CLOSED, for use once an outage is known to be over. */
  @PostMapping("/breakers/{provider}/reset")
  public ResponseEntity<Void> resetBreaker(@PathVariable String provider) {
    var resolved =
        IntegrationProvider.fromSlug(provider)
            .orElseThrow(() -> new ResourceNotFoundException("Provider", provider));
    circuitBreakers.reset(resolved);
    log.info("Circuit breaker for {} reset manually", resolved);
    return ResponseEntity.noContent().build();
  }
}
