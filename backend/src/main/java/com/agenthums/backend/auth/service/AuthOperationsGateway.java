package com.agenthums.backend.auth.service;

import com.agenthums.backend.auth.config.AuthProperties;
import com.agenthums.backend.auth.domain.AuthState;
import com.agenthums.backend.auth.domain.AuthStatePatch;
import com.agenthums.backend.auth.domain.ProviderUser;
import com.agenthums.backend.auth.error.AuthError;
import com.agenthums.backend.auth.error.AuthErrorKind;
import com.agenthums.backend.auth.error.AuthErrorMapper;
import com.agenthums.backend.auth.error.AuthException;
import com.agenthums.backend.auth.provider.IdentityProviderClient;
import com.agenthums.backend.auth.provider.IdentityProviderClient.OtpType;
import com.agenthums.backend.auth.provider.IdentityProviderClient.ProviderAuthResult;
import com.agenthums.backend.auth.provider.IdentityProviderClient.UserAttributes;
import com.agenthums.backend.auth.session.SessionManager;
import com.agenthums.backend.auth.state.AuthStateStore;
import com.agenthums.backend.auth.telemetry.CredentialMetrics;
import com.agenthums.backend.profile.service.ProfileReconciler;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.net.URI;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

/**
 * Explicit, user-initiated auth operations. Input is validated before any remote call; failures
 * are recorded in the auth state and also returned to the caller.
 */
@Service
public class AuthOperationsGateway {

  private static final Logger log = LoggerFactory.getLogger(AuthOperationsGateway.class);
  private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
  private static final String CALLBACK_PATH = "/auth/callback";
  private static final String RESET_PASSWORD_PATH = "/auth/reset-password";

  private final IdentityProviderClient identityProvider;
  private final AuthStateStore stateStore;
  private final SessionManager sessionManager;
  private final ProfileReconciler profileReconciler;
  private final CredentialMetrics metrics;
  private final AuthProperties properties;

  public AuthOperationsGateway(
      IdentityProviderClient identityProvider,
      AuthStateStore stateStore,
      SessionManager sessionManager,
      ProfileReconciler profileReconciler,
      CredentialMetrics metrics,
      AuthProperties properties) {
    this.identityProvider = identityProvider;
    this.stateStore = stateStore;
    this.sessionManager = sessionManager;
    this.profileReconciler = profileReconciler;
    this.metrics = metrics;
    this.properties = properties;
  }

  /**
   * Creates the identity and its profile row. A profile failure is reported to the caller, the
   * identity stays in place and the profile is repaired on the next session.
   */
  public Mono<ProviderUser> signUp(SignUpCommand command) {
    return execute(
        "sign_up",
        () -> {
          requireEmail(command.email());
          requirePassword(command.password());
        },
        () ->
            identityProvider
                .signUp(
                    normalizeEmail(command.email()),
                    command.password(),
                    signUpMetadata(command.displayName()),
                    redirect(command.redirectTo(), CALLBACK_PATH))
                .flatMap(
                    result ->
                        profileReconciler
                            .createFromSignUp(result.user(), command.displayName())
                            .then(publishResult(result))
                            .thenReturn(result.user())));
  }

  public Mono<AuthState> signIn(String email, String password) {
    return execute(
        "sign_in",
        () -> {
          requireEmail(email);
          require(StringUtils.hasText(password), "Password is required");
        },
        () ->
            identityProvider
                .signInWithPassword(normalizeEmail(email), password)
                .flatMap(this::publishResult));
  }

  public Mono<Void> signOut() {
    return execute(
        "sign_out",
        () -> {},
        () -> identityProvider.signOut().then(Mono.fromRunnable(sessionManager::publishSignedOut)));
  }

  public Mono<Void> signInWithMagicLink(String email, @Nullable String redirectTo) {
    return execute(
        "magic_link",
        () -> requireEmail(email),
        () ->
            identityProvider
                .signInWithOtp(normalizeEmail(email), redirect(redirectTo, CALLBACK_PATH))
                .doOnSuccess(ignored -> stateStore.update(AuthStatePatch.idle())));
  }

  /** Returns the URL the actor has to visit; the session arrives through the callback. */
  public Mono<URI> signInWithProvider(String provider, @Nullable String redirectTo) {
    return execute(
        "provider_sign_in",
        () -> {
          require(StringUtils.hasText(provider), "Provider is required");
          require(
              properties.getSupportedProviders().contains(provider.trim().toLowerCase(Locale.ROOT)),
              "Unsupported provider: " + provider);
        },
        () ->
            identityProvider
                .signInWithOAuth(
                    provider.trim().toLowerCase(Locale.ROOT), redirect(redirectTo, CALLBACK_PATH))
                .doOnSuccess(ignored -> stateStore.update(AuthStatePatch.idle())));
  }

  public Mono<Void> resetPassword(String email, @Nullable String redirectTo) {
    return execute(
        "reset_password",
        () -> requireEmail(email),
        () ->
            identityProvider
                .resetPasswordForEmail(
                    normalizeEmail(email), redirect(redirectTo, RESET_PASSWORD_PATH))
                .doOnSuccess(ignored -> stateStore.update(AuthStatePatch.idle())));
  }

  public Mono<Void> updatePassword(String newPassword) {
    return execute(
        "update_password",
        () -> {
          requireAuthenticated();
          requirePassword(newPassword);
        },
        () ->
            identityProvider
                .updateUser(UserAttributes.password(newPassword))
                .doOnSuccess(ignored -> stateStore.update(AuthStatePatch.idle()))
                .then());
  }

  public Mono<Void> resendConfirmation(String email) {
    return execute(
        "resend_confirmation",
        () -> requireEmail(email),
        () ->
            identityProvider
                .resend(normalizeEmail(email))
                .doOnSuccess(ignored -> stateStore.update(AuthStatePatch.idle())));
  }

  /** Starts an email change; the provider confirms it through a link sent to the new address. */
  public Mono<Void> updateEmail(String newEmail) {
    return execute(
        "update_email",
        () -> {
          requireAuthenticated();
          requireEmail(newEmail);
        },
        () ->
            identityProvider
                .updateUser(UserAttributes.email(normalizeEmail(newEmail)))
                .doOnSuccess(ignored -> stateStore.update(AuthStatePatch.idle()))
                .then());
  }

  public Mono<AuthState> verifyOtp(String email, String token, OtpType type) {
    return execute(
        "verify_otp",
        () -> {
          requireEmail(email);
          require(StringUtils.hasText(token), "Verification code is required");
          require(type != null, "Verification type is required");
        },
        () ->
            identityProvider
                .verifyOtp(normalizeEmail(email), token.trim(), type)
                .flatMap(this::publishResult));
  }

  private <T> Mono<T> execute(String operation, Runnable validation, Supplier<Mono<T>> action) {
    return Mono.defer(
            () -> {
              validation.run();
              stateStore.update(AuthStatePatch.started());
              return action.get();
            })
        .doOnSuccess(ignored -> metrics.recordAuthOperation(operation, "success"))
        .onErrorMap(ex -> fail(operation, ex));
  }

  private Throwable fail(String operation, Throwable failure) {
    AuthError error = AuthErrorMapper.toError(failure, AuthErrorKind.PROVIDER_REJECTED);
    stateStore.update(AuthStatePatch.failure(error));
    metrics.recordAuthOperation(operation, error.kind().name().toLowerCase(Locale.ROOT));
    log.info(
        "auth_operation_failed operation={} kind={} message={}",
        operation,
        error.kind(),
        error.message());
    return failure instanceof AuthException ? failure : new AuthException(error, failure);
  }

  private Mono<AuthState> publishResult(ProviderAuthResult result) {
    // no session yet while the provider waits for email confirmation
    if (result.session() == null) {
      return Mono.fromSupplier(
          () -> {
            stateStore.update(AuthStatePatch.idle());
            return stateStore.snapshot();
          });
    }
    return sessionManager.reconcileAndPublish(result.session());
  }

  private ObjectNode signUpMetadata(@Nullable String displayName) {
    ObjectNode metadata = JsonNodeFactory.instance.objectNode();
    if (StringUtils.hasText(displayName)) {
      metadata.put("display_name", displayName.trim());
    }
    return metadata;
  }

  @Nullable
  private String redirect(@Nullable String requested, String defaultPath) {
    if (StringUtils.hasText(requested)) {
      return requested.trim();
    }
    if (!StringUtils.hasText(properties.getSiteUrl())) {
      return null;
    }
    String site = properties.getSiteUrl();
    return (site.endsWith("/") ? site.substring(0, site.length() - 1) : site) + defaultPath;
  }

  private void requireAuthenticated() {
    if (!stateStore.snapshot().isAuthenticated()) {
      throw AuthException.of(AuthErrorKind.NOT_AUTHENTICATED);
    }
  }

  private void requireEmail(@Nullable String email) {
    require(StringUtils.hasText(email), "Email is required");
    require(EMAIL_PATTERN.matcher(email.trim()).matches(), "Email address is invalid");
  }

  private void requirePassword(@Nullable String password) {
    require(StringUtils.hasText(password), "Password is required");
    require(
        password.length() >= properties.getMinPasswordLength(),
        "Password must be at least " + properties.getMinPasswordLength() + " characters");
  }

  private static void require(boolean condition, String message) {
    if (!condition) {
      throw new AuthException(AuthErrorKind.VALIDATION_FAILED, message);
    }
  }

  private static String normalizeEmail(String email) {
    return email.trim().toLowerCase(Locale.ROOT);
  }
}
