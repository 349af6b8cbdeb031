package com.agenthums.backend.auth.error;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import org.springframework.util.StringUtils;

public record AuthError(AuthErrorKind kind, String message) {

  public AuthError {
    Objects.requireNonNull(kind, "kind");
    message = StringUtils.hasText(message) ? message : kind.defaultMessage();
  }

  public static AuthError of(AuthErrorKind kind) {
    return new AuthError(kind, kind.defaultMessage());
  }

  @JsonProperty("retryable")
  public boolean retryable() {
    return kind.isRetryable();
  }
}
