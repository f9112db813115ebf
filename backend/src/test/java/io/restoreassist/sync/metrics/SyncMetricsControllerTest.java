package io.restoreassist.sync.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.restoreassist.sync.config.SyncProperties;
import io.restoreassist.sync.integration.IntegrationProvider;
import io.restoreassist.sync.integration.accounting.TransientProviderException;
import io.restoreassist.sync.integration.resilience.CircuitBreakerRegistry;
import io.restoreassist.sync.integration.resilience.CircuitState;
import io.restoreassist.sync.testutil.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class SyncMetricsControllerTest {

  private CircuitBreakerRegistry circuitBreakers;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    circuitBreakers =
        new CircuitBreakerRegistry(
            SyncProperties.defaults(), MutableClock.startingAt("2025-05-01T00:00:00Z"));
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new SyncMetricsController(mock(SyncMetricsReporter.class), circuitBreakers))
            .build();
  }

  @Test
  void resetBreaker_closesAnOpenBreaker() throws Exception {
    var breaker = circuitBreakers.forProvider(IntegrationProvider.QUICKBOOKS);
    for (int i = 0; i < 5; i++) {
      breaker.onFailure(
          breaker.acquirePermission(),
          Duration.ofSeconds(2),
          new TransientProviderException(IntegrationProvider.QUICKBOOKS, "HTTP 502"));
    }
    assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);

    mockMvc
        .perform(post("/api/internal/sync/breakers/quickbooks/reset"))
        .andExpect(status().isNoContent());

    assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
  }

  @Test
  void resetBreaker_unknownProviderIsNotFound() throws Exception {
    mockMvc
        .perform(post("/api/internal/sync/breakers/freshbooks/reset"))
        .andExpect(status().isNotFound());
  }
}
