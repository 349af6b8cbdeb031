package com.agenthums.backend.auth.domain;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

public record Session(
    String accessToken,
    @Nullable String refreshToken,
    String tokenType,
    @Nullable Instant expiresAt,
    ProviderUser user) {

  public Session {
    Objects.requireNonNull(accessToken, "accessToken");
    Objects.requireNonNull(user, "user");
    tokenType = StringUtils.hasText(tokenType) ? tokenType : "bearer";
  }

  public UUID identityId() {
    return user.id();
  }

  public boolean hasRefreshToken() {
    return StringUtils.hasText(refreshToken);
  }

  public boolean isExpired(Clock clock) {
    return expiresAt != null && !clock.instant().isBefore(expiresAt);
  }

  /** Sessions without a known expiry are never considered near expiry. */
  public boolean expiresWithin(Duration threshold, Clock clock) {
    if (expiresAt == null) {
      return false;
    }
    return Duration.between(clock.instant(), expiresAt).compareTo(threshold) < 0;
  }

  public Session withUser(ProviderUser updatedUser) {
    return new Session(accessToken, refreshToken, tokenType, expiresAt, updatedUser);
  }
}
