package io.restoreassist.sync.integration;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "org_integrations",
    uniqueConstraints = @UniqueConstraint(columnNames = {"organization_id", "provider"}))
public class OrgIntegration {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, updatable = false)
  private UUID organizationId;

  @Enumerated(EnumType.STRING)
  @Column(name = "provider", nullable = false, updatable = false, length = 20)
  private IntegrationProvider provider;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private IntegrationStatus status;

  @Column(name = "token_expires_at")
  private Instant tokenExpiresAt;

  @Column(name = "last_sync_at")
  private Instant lastSyncAt;

  @Column(name = "last_error", columnDefinition = "TEXT")
  private String lastError;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected OrgIntegration() {}

  public OrgIntegration(UUID organizationId, IntegrationProvider provider) {
    this.organizationId = organizationId;
    this.provider = provider;
    this.status = IntegrationStatus.DISCONNECTED;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  public void connect(Instant tokenExpiresAt) {
    this.status = IntegrationStatus.CONNECTED;
    this.tokenExpiresAt = tokenExpiresAt;
    this.lastError = null;
  }

  public void disconnect() {
    this.status = IntegrationStatus.DISCONNECTED;
    this.tokenExpiresAt = null;
  }

  public void recordSuccessfulSync(Instant syncedAt) {
    this.lastSyncAt = syncedAt;
    this.lastError = null;
  }

  public void recordSyncError(String error) {
    this.lastError = error;
  }

  /** Credentials were rejected by the provider; the organization has to reconnect. */
  public void markAuthExpired(String error) {
    this.status = IntegrationStatus.ERROR;
    this.lastError = error;
  }

  /** CONNECTED and, when an expiry is known, not yet expired. */
  public boolean isConnected(Instant now) {
    if (status != IntegrationStatus.CONNECTED) {
      return false;
    }
    return tokenExpiresAt == null || tokenExpiresAt.isAfter(now);
  }

  public UUID getId() {
    return id;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public IntegrationProvider getProvider() {
    return provider;
  }

  public IntegrationStatus getStatus() {
    return status;
  }

  public Instant getTokenExpiresAt() {
    return tokenExpiresAt;
  }

  public Instant getLastSyncAt() {
    return lastSyncAt;
  }

  public String getLastError() {
    return lastError;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
