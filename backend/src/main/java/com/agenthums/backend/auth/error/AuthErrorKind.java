package com.agenthums.backend.auth.error;

public enum AuthErrorKind {
  INVALID_CREDENTIALS(false, "Invalid email or password"),
  EMAIL_NOT_CONFIRMED(false, "Email address is not confirmed"),
  NETWORK_UNAVAILABLE(true, "Remote service is unreachable"),
  TIMEOUT(true, "Remote call timed out"),
  PROVIDER_REJECTED(false, "Request rejected by the identity provider"),
  PROFILE_UNAVAILABLE(true, "Profile store is unavailable"),
  TOKEN_EXCHANGE_FAILED(true, "Token exchange failed"),
  TOKEN_EXPIRED_NO_REFRESH(false, "Access token expired and no refresh token is stored"),
  CONFLICT(false, "Record already exists"),
  VALIDATION_FAILED(false, "Invalid input"),
  INTEGRATION_NOT_CONNECTED(false, "Integration is not connected"),
  NOT_AUTHENTICATED(false, "No authenticated actor");

  private final boolean retryable;
  private final String defaultMessage;

  AuthErrorKind(boolean retryable, String defaultMessage) {
    this.retryable = retryable;
    this.defaultMessage = defaultMessage;
  }

  public boolean isRetryable() {
    return retryable;
  }

  public String defaultMessage() {
    return defaultMessage;
  }
}
