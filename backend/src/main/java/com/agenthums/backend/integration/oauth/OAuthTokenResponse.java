package com.agenthums.backend.integration.oauth;

import java.util.List;
import org.springframework.lang.Nullable;

/** Token endpoint answer. {@code expiresIn} is in seconds; the refresh token is often omitted. */
public record OAuthTokenResponse(
    String accessToken,
    @Nullable String refreshToken,
    @Nullable String tokenType,
    @Nullable Long expiresIn,
    List<String> scopes) {

  public OAuthTokenResponse {
    scopes = scopes != null ? List.copyOf(scopes) : List.of();
  }
}
