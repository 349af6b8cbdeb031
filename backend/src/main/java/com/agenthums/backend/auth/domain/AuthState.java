package com.agenthums.backend.auth.domain;

import com.agenthums.backend.auth.error.AuthError;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.lang.Nullable;

/**
 * Immutable snapshot of the authentication state. {@link #isAuthenticated()} is derived from the
 * identity, so no snapshot can claim authentication without one.
 */
public record AuthState(
    @Nullable Identity identity,
    @Nullable Session session,
    boolean loading,
    @Nullable AuthError lastError) {

  private static final AuthState INITIAL = new AuthState(null, null, true, null);

  public static AuthState initial() {
    return INITIAL;
  }

  @JsonProperty("authenticated")
  public boolean isAuthenticated() {
    return identity != null;
  }

  public AuthState apply(AuthStatePatch patch) {
    return new AuthState(
        patch.identityOr(identity),
        patch.sessionOr(session),
        patch.loadingOr(loading),
        patch.lastErrorOr(lastError));
  }
}
