package com.agenthums.backend.auth.domain;

import org.springframework.lang.Nullable;

/** Change pushed by the identity provider. {@code session} is null once signed out. */
public record AuthChangeEvent(Type type, @Nullable Session session) {

  public enum Type {
    SIGNED_IN,
    SIGNED_OUT,
    TOKEN_REFRESHED,
    USER_UPDATED,
    PASSWORD_RECOVERY
  }

  public static AuthChangeEvent signedOut() {
    return new AuthChangeEvent(Type.SIGNED_OUT, null);
  }
}
