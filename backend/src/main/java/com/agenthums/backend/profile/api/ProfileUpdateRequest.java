package com.agenthums.backend.profile.api;

import com.agenthums.backend.profile.service.ProfileUpdateCommand;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Size;

public record ProfileUpdateRequest(
    @Size(max = 255) String displayName,
    @Size(max = 64) String nickname,
    @Size(max = 2048) String avatarUrl,
    @Size(max = 1000) String bio,
    JsonNode preferences) {

  public ProfileUpdateCommand toCommand() {
    return new ProfileUpdateCommand(displayName, nickname, avatarUrl, bio, preferences);
  }
}
