package io.restoreassist.sync.integration.resilience;

public enum CircuitState {
  CLOSED,
  OPEN,
  HALF_OPEN
}
