package com.agenthums.backend.integration.service;

import java.time.Instant;
import java.util.List;
import org.springframework.lang.Nullable;

public record IntegrationStatus(
    String serviceKind,
    boolean connected,
    @Nullable Instant updatedAt,
    @Nullable Instant expiresAt,
    List<String> scopes) {

  public static IntegrationStatus disconnected(String serviceKind) {
    return new IntegrationStatus(serviceKind, false, null, null, List.of());
  }
}
