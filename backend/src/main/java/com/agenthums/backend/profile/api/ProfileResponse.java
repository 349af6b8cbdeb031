package com.agenthums.backend.profile.api;

import com.agenthums.backend.auth.domain.UserPreferences;
import com.agenthums.backend.profile.domain.ProfileRecord;
import java.time.Instant;
import java.util.UUID;

public record ProfileResponse(
    UUID id,
    String email,
    String displayName,
    String nickname,
    String avatarUrl,
    String bio,
    UserPreferences preferences,
    boolean active,
    Instant createdAt,
    Instant updatedAt) {

  public static ProfileResponse from(ProfileRecord profile) {
    return new ProfileResponse(
        profile.getId(),
        profile.getEmail(),
        profile.getDisplayName(),
        profile.getNickname(),
        profile.getAvatarUrl(),
        profile.getBio(),
        UserPreferences.fromJson(profile.getPreferences()),
        profile.isActive(),
        profile.getCreatedAt(),
        profile.getUpdatedAt());
  }
}
