package com.agenthums.backend.profile.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** Durable profile of an identity. The id is the identity id issued by the provider. */
@Entity
@Table(name = "user_profile")
public class ProfileRecord {

  @Id
  @Column(name = "id", nullable = false, updatable = false)
  private UUID id;

  @Size(max = 320)
  @Column(name = "email", length = 320)
  private String email;

  @NotBlank
  @Size(max = 255)
  @Column(name = "display_name", nullable = false, length = 255)
  private String displayName;

  @Size(max = 64)
  @Column(name = "nickname", length = 64)
  private String nickname;

  @Size(max = 2048)
  @Column(name = "avatar_url", length = 2048)
  private String avatarUrl;

  @Size(max = 1000)
  @Column(name = "bio", length = 1000)
  private String bio;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "preferences", nullable = false, columnDefinition = "jsonb")
  private JsonNode preferences = JsonNodeFactory.instance.objectNode();

  @Column(name = "is_active", nullable = false)
  private boolean active = true;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ProfileRecord() {}

  public ProfileRecord(UUID id, String displayName) {
    this.id = id;
    this.displayName = displayName;
  }

  @PreUpdate
  void onUpdate() {
    updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getEmail() {
    return email;
  }

  public void setEmail(String email) {
    this.email = email;
  }

  public String getDisplayName() {
    return displayName;
  }

  public void setDisplayName(String displayName) {
    this.displayName = displayName;
  }

  public String getNickname() {
    return nickname;
  }

  public void setNickname(String nickname) {
    this.nickname = nickname;
  }

  public String getAvatarUrl() {
    return avatarUrl;
  }

  public void setAvatarUrl(String avatarUrl) {
    this.avatarUrl = avatarUrl;
  }

  public String getBio() {
    return bio;
  }

  public void setBio(String bio) {
    this.bio = bio;
  }

  public JsonNode getPreferences() {
    return preferences;
  }

  public void setPreferences(JsonNode preferences) {
    this.preferences = preferences != null ? preferences : JsonNodeFactory.instance.objectNode();
  }

  public boolean isActive() {
    return active;
  }

  public void setActive(boolean active) {
    this.active = active;
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

  /** Detached copy, used by callers that must not mutate a stored instance. */
  public ProfileRecord copy() {
    ProfileRecord copy = new ProfileRecord(id, displayName);
    copy.email = email;
    copy.nickname = nickname;
    copy.avatarUrl = avatarUrl;
    copy.bio = bio;
    copy.preferences = preferences.deepCopy();
    copy.active = active;
    copy.createdAt = createdAt;
    copy.updatedAt = updatedAt;
    return copy;
  }
}
