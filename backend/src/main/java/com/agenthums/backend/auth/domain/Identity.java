package com.agenthums.backend.auth.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import org.springframework.lang.Nullable;

/** The current actor as seen by the rest of the application. */
public record Identity(
    UUID id,
    @Nullable String email,
    boolean emailConfirmed,
    String displayName,
    @Nullable String nickname,
    @Nullable String avatarUrl,
    @Nullable String bio,
    @Nullable Instant createdAt,
    @Nullable Instant lastSignInAt,
    UserPreferences preferences) {

  public Identity {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(displayName, "displayName");
    preferences = preferences != null ? preferences : UserPreferences.defaults();
  }
}
