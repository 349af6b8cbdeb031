package com.agenthums.backend.auth.error;

import java.io.IOException;
import java.util.concurrent.TimeoutException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.web.reactive.function.client.WebClientRequestException;

/** Converts failures raised by collaborators into {@link AuthError}s. */
public final class AuthErrorMapper {

  private AuthErrorMapper() {}

  public static AuthError toError(Throwable failure, AuthErrorKind fallback) {
    Throwable current = failure;
    while (current != null) {
      if (current instanceof AuthException authException) {
        return authException.getError();
      }
      if (current instanceof TimeoutException
          || current instanceof io.netty.handler.timeout.TimeoutException) {
        return new AuthError(AuthErrorKind.TIMEOUT, AuthErrorKind.TIMEOUT.defaultMessage());
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    if (failure instanceof DataIntegrityViolationException) {
      return new AuthError(AuthErrorKind.CONFLICT, AuthErrorKind.CONFLICT.defaultMessage());
    }
    if (failure instanceof DataAccessException) {
      return new AuthError(fallback, failure.getMessage());
    }
    if (failure instanceof WebClientRequestException || failure instanceof IOException) {
      return new AuthError(AuthErrorKind.NETWORK_UNAVAILABLE, failure.getMessage());
    }
    return new AuthError(fallback, failure.getMessage());
  }

  public static AuthException toException(Throwable failure, AuthErrorKind fallback) {
    if (failure instanceof AuthException authException) {
      return authException;
    }
    return new AuthException(toError(failure, fallback), failure);
  }
}
