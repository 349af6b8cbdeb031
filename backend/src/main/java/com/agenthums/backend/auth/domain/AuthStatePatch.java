package com.agenthums.backend.auth.domain;

import com.agenthums.backend.auth.error.AuthError;
import org.springframework.lang.Nullable;

/**
 * Partial update of {@link AuthState}. Fields that were never set keep their current value; a
 * field explicitly set to {@code null} clears it.
 */
public final class AuthStatePatch {

  private final boolean identitySet;
  @Nullable private final Identity identity;
  private final boolean sessionSet;
  @Nullable private final Session session;
  @Nullable private final Boolean loading;
  private final boolean lastErrorSet;
  @Nullable private final AuthError lastError;

  private AuthStatePatch(Builder builder) {
    this.identitySet = builder.identitySet;
    this.identity = builder.identity;
    this.sessionSet = builder.sessionSet;
    this.session = builder.session;
    this.loading = builder.loading;
    this.lastErrorSet = builder.lastErrorSet;
    this.lastError = builder.lastError;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Start of a state-changing operation. */
  public static AuthStatePatch started() {
    return builder().loading(true).lastError(null).build();
  }

  public static AuthStatePatch idle() {
    return builder().loading(false).build();
  }

  public static AuthStatePatch anonymous() {
    return builder().identity(null).session(null).loading(false).build();
  }

  public static AuthStatePatch authenticated(
      Identity identity, Session session, @Nullable AuthError lastError) {
    return builder()
        .identity(identity)
        .session(session)
        .loading(false)
        .lastError(lastError)
        .build();
  }

  public static AuthStatePatch failure(AuthError error) {
    return builder().lastError(error).loading(false).build();
  }

  /** Records an error without touching the loading flag or the current session. */
  public static AuthStatePatch error(AuthError error) {
    return builder().lastError(error).build();
  }

  @Nullable
  Identity identityOr(@Nullable Identity current) {
    return identitySet ? identity : current;
  }

  @Nullable
  Session sessionOr(@Nullable Session current) {
    return sessionSet ? session : current;
  }

  boolean loadingOr(boolean current) {
    return loading != null ? loading : current;
  }

  @Nullable
  AuthError lastErrorOr(@Nullable AuthError current) {
    return lastErrorSet ? lastError : current;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("AuthStatePatch{");
    if (identitySet) {
      sb.append("identity=").append(identity != null ? identity.id() : null).append(' ');
    }
    if (sessionSet) {
      sb.append("session=").append(session != null ? "present" : null).append(' ');
    }
    if (loading != null) {
      sb.append("loading=").append(loading).append(' ');
    }
    if (lastErrorSet) {
      sb.append("lastError=").append(lastError != null ? lastError.kind() : null);
    }
    return sb.append('}').toString();
  }

  public static final class Builder {
    private boolean identitySet;
    private Identity identity;
    private boolean sessionSet;
    private Session session;
    private Boolean loading;
    private boolean lastErrorSet;
    private AuthError lastError;

    private Builder() {}

    public Builder identity(@Nullable Identity identity) {
      this.identitySet = true;
      this.identity = identity;
      return this;
    }

    public Builder session(@Nullable Session session) {
      this.sessionSet = true;
      this.session = session;
      return this;
    }

    public Builder loading(boolean loading) {
      this.loading = loading;
      return this;
    }

    public Builder lastError(@Nullable AuthError lastError) {
      this.lastErrorSet = true;
      this.lastError = lastError;
      return this;
    }

    public AuthStatePatch build() {
      return new AuthStatePatch(this);
    }
  }
}
