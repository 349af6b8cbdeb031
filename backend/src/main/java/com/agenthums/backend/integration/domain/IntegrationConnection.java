package com.agenthums.backend.integration.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.util.StringUtils;

/** OAuth credentials of one identity for one third-party service. */
@Entity
@Table(
    name = "user_integration",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_user_integration_identity_service",
            columnNames = {"identity_id", "service_kind"}))
public class IntegrationConnection {

  @Id
  @Column(name = "id", nullable = false, updatable = false)
  private UUID id;

  @Column(name = "identity_id", nullable = false, updatable = false)
  private UUID identityId;

  @Column(name = "service_kind", nullable = false, length = 64, updatable = false)
  private String serviceKind;

  @Column(name = "access_token", columnDefinition = "text")
  private String accessToken;

  @Column(name = "refresh_token", columnDefinition = "text")
  private String refreshToken;

  @Column(name = "token_type", length = 32)
  private String tokenType;

  @Column(name = "expires_at")
  private Instant expiresAt;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "scopes", nullable = false, columnDefinition = "jsonb")
  private List<String> scopes = new ArrayList<>();

  @Column(name = "connected", nullable = false)
  private boolean connected;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected IntegrationConnection() {}

  public IntegrationConnection(UUID identityId, String serviceKind) {
    this.id = UUID.randomUUID();
    this.identityId = identityId;
    this.serviceKind = serviceKind;
  }

  public boolean hasAccessToken() {
    return connected && StringUtils.hasText(accessToken);
  }

  public boolean hasRefreshToken() {
    return StringUtils.hasText(refreshToken);
  }

  /** Tokens without a known expiry are treated as valid. */
  public boolean isExpired(Clock clock, Duration skew) {
    return expiresAt != null && !clock.instant().plus(skew).isBefore(expiresAt);
  }

  public IntegrationConnection copy() {
    IntegrationConnection copy = new IntegrationConnection();
    copy.id = id;
    copy.identityId = identityId;
    copy.serviceKind = serviceKind;
    copy.accessToken = accessToken;
    copy.refreshToken = refreshToken;
    copy.tokenType = tokenType;
    copy.expiresAt = expiresAt;
    copy.scopes = new ArrayList<>(scopes);
    copy.connected = connected;
    copy.createdAt = createdAt;
    copy.updatedAt = updatedAt;
    return copy;
  }

  public UUID getId() {
    return id;
  }

  public void setId(UUID id) {
    this.id = id;
  }

  public UUID getIdentityId() {
    return identityId;
  }

  public String getServiceKind() {
    return serviceKind;
  }

  public String getAccessToken() {
    return accessToken;
  }

  public void setAccessToken(String accessToken) {
    this.accessToken = accessToken;
  }

  public String getRefreshToken() {
    return refreshToken;
  }

  public void setRefreshToken(String refreshToken) {
    this.refreshToken = refreshToken;
  }

  public String getTokenType() {
    return tokenType;
  }

  public void setTokenType(String tokenType) {
    this.tokenType = tokenType;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public void setExpiresAt(Instant expiresAt) {
    this.expiresAt = expiresAt;
  }

  public List<String> getScopes() {
    return scopes;
  }

  public void setScopes(List<String> scopes) {
    this.scopes = scopes != null ? new ArrayList<>(scopes) : new ArrayList<>();
  }

  public boolean isConnected() {
    return connected;
  }

  public void setConnected(boolean connected) {
    this.connected = connected;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }
}
