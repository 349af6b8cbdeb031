package com.agenthums.backend.common.exception;

import com.agenthums.backend.auth.error.AuthError;
import com.agenthums.backend.auth.error.AuthErrorKind;
import com.agenthums.backend.auth.error.AuthException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final String INVALID_PAYLOAD = "Invalid request payload";

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Unexpected error");
    problem.setDetail("Something went wrong. Please try again later.");
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler(AuthException.class)
  public ResponseEntity<ProblemDetail> handleAuthException(AuthException ex) {
    AuthError error = ex.getError();
    HttpStatus status = statusFor(error.kind());
    if (status.is5xxServerError()) {
      log.warn("Request failed with {}: {}", error.kind(), error.message(), ex);
    } else {
      log.debug("Request rejected with {}: {}", error.kind(), error.message());
    }
    ProblemDetail problem = ProblemDetail.forStatus(status);
    problem.setTitle(status.getReasonPhrase());
    problem.setDetail(error.message());
    problem.setProperty("kind", error.kind().name());
    problem.setProperty("retryable", error.retryable());
    return ResponseEntity.status(status).body(problem);
  }

  // BindException covers MethodArgumentNotValidException too
  @ExceptionHandler(BindException.class)
  public ResponseEntity<ProblemDetail> handleValidationErrors(BindException ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail(resolveValidationMessage(ex));
    problem.setProperty("kind", AuthErrorKind.VALIDATION_FAILED.name());
    problem.setProperty("retryable", false);
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatusException(ResponseStatusException ex) {
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  static HttpStatus statusFor(AuthErrorKind kind) {
    return switch (kind) {
      case VALIDATION_FAILED -> HttpStatus.BAD_REQUEST;
      case INVALID_CREDENTIALS, NOT_AUTHENTICATED -> HttpStatus.UNAUTHORIZED;
      case EMAIL_NOT_CONFIRMED -> HttpStatus.FORBIDDEN;
      case INTEGRATION_NOT_CONNECTED -> HttpStatus.NOT_FOUND;
      case CONFLICT, TOKEN_EXPIRED_NO_REFRESH -> HttpStatus.CONFLICT;
      case PROVIDER_REJECTED -> HttpStatus.UNPROCESSABLE_ENTITY;
      case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
      case NETWORK_UNAVAILABLE, TOKEN_EXCHANGE_FAILED -> HttpStatus.BAD_GATEWAY;
      case PROFILE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
    };
  }

  private String resolveValidationMessage(BindException ex) {
    if (ex instanceof MethodArgumentNotValidException methodArgumentNotValidException) {
      return methodArgumentNotValidException.getBindingResult().getFieldErrors().stream()
          .findFirst()
          .map(error -> error.getField() + ": " + messageOf(error))
          .orElse(INVALID_PAYLOAD);
    }
    return ex.getBindingResult().getAllErrors().stream()
        .findFirst()
        .map(GlobalExceptionHandler::messageOf)
        .orElse(INVALID_PAYLOAD);
  }

  private static String messageOf(ObjectError error) {
    return error.getDefaultMessage() != null ? error.getDefaultMessage() : INVALID_PAYLOAD;
  }
}
