package com.agenthums.backend.auth.api;

import com.agenthums.backend.auth.domain.AuthState;
import com.agenthums.backend.auth.domain.Identity;
import com.agenthums.backend.auth.error.AuthError;
import java.time.Instant;

/** Auth state as exposed over HTTP. Tokens are never part of it. */
public record AuthStateResponse(
    boolean authenticated,
    boolean loading,
    Identity identity,
    Instant sessionExpiresAt,
    AuthError lastError) {

  public static AuthStateResponse from(AuthState state) {
    return new AuthStateResponse(
        state.isAuthenticated(),
        state.loading(),
        state.identity(),
        state.session() != null ? state.session().expiresAt() : null,
        state.lastError());
  }
}
