package com.agenthums.backend.profile.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.Nullable;

/** Fields left null are not changed. */
public record ProfileUpdateCommand(
    @Nullable String displayName,
    @Nullable String nickname,
    @Nullable String avatarUrl,
    @Nullable String bio,
    @Nullable JsonNode preferences) {}
