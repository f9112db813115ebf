package io.restoreassist.sync.integration;

public enum IntegrationStatus {
  DISCONNECTED,
  CONNECTED,
  ERROR
}
