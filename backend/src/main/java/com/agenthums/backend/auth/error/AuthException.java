package com.agenthums.backend.auth.error;

public class AuthException extends RuntimeException {

  private final AuthError error;

  public AuthException(AuthError error) {
    super(error.message());
    this.error = error;
  }

  public AuthException(AuthError error, Throwable cause) {
    super(error.message(), cause);
    this.error = error;
  }

  public AuthException(AuthErrorKind kind, String message) {
    this(new AuthError(kind, message));
  }

  public AuthException(AuthErrorKind kind, String message, Throwable cause) {
    this(new AuthError(kind, message), cause);
  }

  public static AuthException of(AuthErrorKind kind) {
    return new AuthException(AuthError.of(kind));
  }

  public AuthError getError() {
    return error;
  }

  public AuthErrorKind getKind() {
    return error.kind();
  }
}
