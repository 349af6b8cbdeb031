package com.agenthums.backend.auth.session;

import com.agenthums.backend.auth.config.AuthProperties;
import com.agenthums.backend.auth.config.AuthProperties.ProfileFailurePolicy;
import com.agenthums.backend.auth.domain.AuthChangeEvent;
import com.agenthums.backend.auth.domain.AuthState;
import com.agenthums.backend.auth.domain.AuthStatePatch;
import com.agenthums.backend.auth.domain.ProviderUser;
import com.agenthums.backend.auth.domain.Session;
import com.agenthums.backend.auth.error.AuthError;
import com.agenthums.backend.auth.error.AuthErrorKind;
import com.agenthums.backend.auth.error.AuthErrorMapper;
import com.agenthums.backend.auth.provider.IdentityProviderClient;
import com.agenthums.backend.auth.service.IdentityMapper;
import com.agenthums.backend.auth.state.AuthStateStore;
import com.agenthums.backend.auth.telemetry.CredentialMetrics;
import com.agenthums.backend.profile.service.ProfileReconciler;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Keeps {@link AuthStateStore} in line with the provider session: startup, provider pushed
 * changes and refresh ahead of expiry.
 */
@Service
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

  private final IdentityProviderClient identityProvider;
  private final AuthStateStore stateStore;
  private final ProfileReconciler profileReconciler;
  private final IdentityMapper identityMapper;
  private final CredentialMetrics metrics;
  private final AuthProperties properties;
  private final Clock clock;

  private final AtomicReference<Disposable> providerSubscription = new AtomicReference<>();
  // bumped whenever the actor is signed out, so reconciles started earlier do not resurrect it
  private final AtomicLong signOutGeneration = new AtomicLong();

  public SessionManager(
      IdentityProviderClient identityProvider,
      AuthStateStore stateStore,
      ProfileReconciler profileReconciler,
      IdentityMapper identityMapper,
      CredentialMetrics metrics,
      AuthProperties properties,
      Clock clock) {
    this.identityProvider = identityProvider;
    this.stateStore = stateStore;
    this.profileReconciler = profileReconciler;
    this.identityMapper = identityMapper;
    this.metrics = metrics;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Reads the persisted provider session and publishes the resulting state. The provider change
   * listener is registered on the first call only.
   */
  public Mono<AuthState> initialize() {
    return Mono.defer(
        () -> {
          registerProviderListener();
          return identityProvider
              .getSession()
              .flatMap(this::reconcileAndPublish)
              .switchIfEmpty(Mono.fromSupplier(() -> publish(AuthStatePatch.anonymous())))
              .onErrorResume(
                  ex -> {
                    AuthError error =
                        AuthErrorMapper.toError(ex, AuthErrorKind.NETWORK_UNAVAILABLE);
                    log.warn(
                        "session_initialize_failed kind={} message={}",
                        error.kind(),
                        error.message());
                    return Mono.just(publish(AuthStatePatch.failure(error)));
                  });
        });
  }

  /**
   * Ensures the profile row and then publishes the authenticated state for {@code session}.
   * Never fails: profile store problems are applied according to the configured policy.
   */
  public Mono<AuthState> reconcileAndPublish(Session session) {
    return Mono.defer(
        () -> {
          long generation = signOutGeneration.get();
          ProviderUser user = session.user();
          return profileReconciler
              .ensure(user)
              .map(
                  profile ->
                      AuthStatePatch.authenticated(
                          identityMapper.toIdentity(user, profile), session, null))
              .switchIfEmpty(
                  Mono.fromSupplier(
                      () ->
                          AuthStatePatch.authenticated(
                              identityMapper.toIdentity(user, null), session, null)))
              .doOnNext(patch -> metrics.recordSessionReconcile("ok"))
              .onErrorResume(ex -> Mono.just(profileFailurePatch(session, ex)))
              .map(
                  patch -> {
                    if (generation != signOutGeneration.get()) {
                      log.debug("Discarding reconcile of {} after sign-out", user.id());
                      return publish(AuthStatePatch.idle());
                    }
                    return publish(patch);
                  });
        });
  }

  /** Publishes the signed out state. */
  public AuthState publishSignedOut() {
    signOutGeneration.incrementAndGet();
    return publish(AuthStatePatch.anonymous());
  }

  public boolean isNearExpiry() {
    return isNearExpiry(properties.getSession().getNearExpiryThreshold());
  }

  public boolean isNearExpiry(Duration threshold) {
    Session session = stateStore.snapshot().session();
    return session != null && session.expiresWithin(threshold, clock);
  }

  /**
   * Refreshes the session when it is close to expiry. A failed refresh keeps the current session
   * and only records the error.
   */
  public Mono<AuthState> refreshIfNeeded() {
    return Mono.defer(
        () -> {
          if (!isNearExpiry()) {
            return Mono.just(stateStore.snapshot());
          }
          long started = System.nanoTime();
          return identityProvider
              .refreshSession()
              .flatMap(this::reconcileAndPublish)
              .doOnNext(
                  state -> metrics.recordSessionRefresh("success", System.nanoTime() - started))
              .onErrorResume(
                  ex -> {
                    AuthError error =
                        AuthErrorMapper.toError(ex, AuthErrorKind.NETWORK_UNAVAILABLE);
                    metrics.recordSessionRefresh("failure", System.nanoTime() - started);
                    log.warn(
                        "session_refresh_failed kind={} retryable={} message={}",
                        error.kind(),
                        error.retryable(),
                        error.message());
                    return Mono.just(publish(AuthStatePatch.error(error)));
                  })
              .switchIfEmpty(Mono.fromSupplier(stateStore::snapshot));
        });
  }

  /**
   * Completes a redirect based sign-in. Without a code the current provider session is re-read.
   */
  public Mono<AuthState> handleAuthCallback(@Nullable String code) {
    return Mono.defer(
        () -> {
          publish(AuthStatePatch.started());
          Mono<Session> session =
              StringUtils.hasText(code)
                  ? identityProvider.exchangeCodeForSession(code.trim())
                  : identityProvider.getSession();
          return session
              .flatMap(this::reconcileAndPublish)
              .switchIfEmpty(Mono.fromSupplier(() -> publish(AuthStatePatch.anonymous())))
              .onErrorMap(ex -> failDirect(ex, AuthErrorKind.PROVIDER_REJECTED));
        });
  }

  /** Re-reads the provider user and republishes the identity. */
  public Mono<AuthState> refreshUser() {
    return identityProvider
        .getUser()
        .flatMap(
            user -> {
              Session current = stateStore.snapshot().session();
              if (current == null || !current.identityId().equals(user.id())) {
                return Mono.just(stateStore.snapshot());
              }
              profileReconciler.evict(user.id());
              return reconcileAndPublish(current.withUser(user));
            })
        .switchIfEmpty(Mono.fromSupplier(stateStore::snapshot))
        .onErrorResume(
            ex -> {
              AuthError error = AuthErrorMapper.toError(ex, AuthErrorKind.NETWORK_UNAVAILABLE);
              log.warn("user_refresh_failed kind={} message={}", error.kind(), error.message());
              return Mono.just(publish(AuthStatePatch.error(error)));
            });
  }

  /** True when a session exists and the provider still accepts it. */
  public Mono<Boolean> validateSession() {
    return identityProvider
        .getSession()
        .flatMap(session -> identityProvider.getUser().map(user -> true))
        .defaultIfEmpty(false)
        .onErrorResume(
            ex -> {
              log.debug("Session validation failed: {}", ex.getMessage());
              return Mono.just(false);
            });
  }

  public Optional<String> getAccessToken() {
    return Optional.ofNullable(stateStore.snapshot().session()).map(Session::accessToken);
  }

  public Optional<Instant> getSessionExpiry() {
    return Optional.ofNullable(stateStore.snapshot().session()).map(Session::expiresAt);
  }

  public void shutdown() {
    Disposable registration = providerSubscription.getAndSet(null);
    if (registration != null) {
      registration.dispose();
      log.info("session_manager_stopped");
    }
  }

  private void registerProviderListener() {
    if (providerSubscription.get() != null) {
      return;
    }
    Disposable registration = identityProvider.onAuthStateChange(this::onProviderEvent);
    if (!providerSubscription.compareAndSet(null, registration)) {
      registration.dispose();
    }
  }

  private void onProviderEvent(AuthChangeEvent event) {
    log.debug("Provider auth event {}", event.type());
    if (event.session() == null) {
      publishSignedOut();
      return;
    }
    reconcileAndPublish(event.session())
        .subscribe(
            state ->
                log.debug(
                    "Reconciled after {} authenticated={}", event.type(), state.isAuthenticated()),
            ex -> log.warn("Reconcile after {} failed: {}", event.type(), ex.getMessage(), ex));
  }

  private AuthStatePatch profileFailurePatch(Session session, Throwable failure) {
    AuthError error = AuthErrorMapper.toError(failure, AuthErrorKind.PROFILE_UNAVAILABLE);
    if (error.kind() != AuthErrorKind.PROFILE_UNAVAILABLE) {
      error = new AuthError(AuthErrorKind.PROFILE_UNAVAILABLE, error.message());
    }
    metrics.recordSessionReconcile("profile_unavailable");
    if (properties.getProfileFailurePolicy() == ProfileFailurePolicy.FAIL_CLOSED) {
      log.warn("session_rejected identityId={} reason=profile_unavailable", session.identityId());
      return AuthStatePatch.builder()
          .identity(null)
          .session(null)
          .loading(false)
          .lastError(error)
          .build();
    }
    log.warn("session_degraded identityId={} reason=profile_unavailable", session.identityId());
    return AuthStatePatch.authenticated(
        identityMapper.toIdentity(session.user(), null), session, error);
  }

  private Throwable failDirect(Throwable failure, AuthErrorKind fallback) {
    AuthError error = AuthErrorMapper.toError(failure, fallback);
    publish(AuthStatePatch.failure(error));
    return AuthErrorMapper.toException(failure, fallback);
  }

  private AuthState publish(AuthStatePatch patch) {
    stateStore.update(patch);
    return stateStore.snapshot();
  }
}
