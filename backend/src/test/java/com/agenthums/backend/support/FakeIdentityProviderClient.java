package com.agenthums.backend.support;

import com.agenthums.backend.auth.domain.AuthChangeEvent;
import com.agenthums.backend.auth.domain.ProviderUser;
import com.agenthums.backend.auth.domain.Session;
import com.agenthums.backend.auth.error.AuthErrorKind;
import com.agenthums.backend.auth.error.AuthException;
import com.agenthums.backend.auth.provider.IdentityProviderClient;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.springframework.lang.Nullable;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Scriptable provider. Each operation answers with the configured result or failure; calls are
 * recorded by name.
 */
public class FakeIdentityProviderClient implements IdentityProviderClient {

  private final List<Consumer<AuthChangeEvent>> listeners = new CopyOnWriteArrayList<>();
  private final List<String> calls = new CopyOnWriteArrayList<>();
  private final AtomicInteger registrations = new AtomicInteger();

  @Nullable private volatile Session session;
  @Nullable private volatile RuntimeException failure;
  @Nullable private volatile ProviderAuthResult nextAuthResult;
  @Nullable private volatile Session nextRefresh;
  @Nullable private volatile ProviderUser nextUser;
  @Nullable private volatile ObjectNode lastSignUpMetadata;
  private volatile boolean refreshCompletesEmpty;

  public void holdSession(@Nullable Session session) {
    this.session = session;
  }

  public void failWith(@Nullable RuntimeException failure) {
    this.failure = failure;
  }

  public void answerAuth(ProviderAuthResult result) {
    this.nextAuthResult = result;
  }

  public void answerRefresh(Session refreshed) {
    this.nextRefresh = refreshed;
  }

  /** The next refreshes complete without a session. */
  public void answerRefreshEmpty() {
    this.refreshCompletesEmpty = true;
  }

  public void answerUser(ProviderUser user) {
    this.nextUser = user;
  }

  public void emit(AuthChangeEvent event) {
    listeners.forEach(listener -> listener.accept(event));
  }

  public List<String> calls() {
    return new ArrayList<>(calls);
  }

  public int listenerCount() {
    return listeners.size();
  }

  public int registrations() {
    return registrations.get();
  }

  @Nullable
  public ObjectNode lastSignUpMetadata() {
    return lastSignUpMetadata;
  }

  @Override
  public Mono<ProviderAuthResult> signUp(
      String email, String password, ObjectNode userMetadata, @Nullable String redirectTo) {
    lastSignUpMetadata = userMetadata;
    return authResult("signUp");
  }

  @Override
  public Mono<ProviderAuthResult> signInWithPassword(String email, String password) {
    return authResult("signInWithPassword");
  }

  @Override
  public Mono<Void> signInWithOtp(String email, @Nullable String redirectTo) {
    return call("signInWithOtp").then();
  }

  @Override
  public Mono<URI> signInWithOAuth(String provider, @Nullable String redirectTo) {
    return call("signInWithOAuth")
        .then(
            Mono.fromSupplier(
                () -> URI.create("https://auth.example.com/authorize?provider=" + provider)));
  }

  @Override
  public Mono<Session> exchangeCodeForSession(String authCode) {
    return call("exchangeCodeForSession")
        .then(Mono.defer(() -> Mono.justOrEmpty(nextAuthResult).map(ProviderAuthResult::session)));
  }

  @Override
  public Mono<ProviderAuthResult> verifyOtp(String email, String token, OtpType type) {
    return authResult("verifyOtp");
  }

  @Override
  public Mono<Void> signOut() {
    return call("signOut").then(Mono.fromRunnable(() -> session = null));
  }

  @Override
  public Mono<Session> getSession() {
    return call("getSession").then(Mono.defer(() -> Mono.justOrEmpty(session)));
  }

  @Override
  public Mono<ProviderUser> getUser() {
    return call("getUser")
        .then(
            Mono.defer(
                () ->
                    nextUser != null
                        ? Mono.just(nextUser)
                        : Mono.justOrEmpty(session).map(Session::user)));
  }

  @Override
  public Mono<Session> refreshSession() {
    return call("refreshSession")
        .then(
            Mono.defer(
                () -> {
                  if (refreshCompletesEmpty) {
                    return Mono.<Session>empty();
                  }
                  if (nextRefresh == null) {
                    return Mono.error(AuthException.of(AuthErrorKind.NOT_AUTHENTICATED));
                  }
                  session = nextRefresh;
                  return Mono.just(nextRefresh);
                }));
  }

  @Override
  public Mono<Void> resetPasswordForEmail(String email, @Nullable String redirectTo) {
    return call("resetPasswordForEmail").then();
  }

  @Override
  public Mono<ProviderUser> updateUser(UserAttributes attributes) {
    return call("updateUser").then(Mono.defer(() -> Mono.justOrEmpty(session).map(Session::user)));
  }

  @Override
  public Mono<Void> resend(String email) {
    return call("resend").then();
  }

  @Override
  public Disposable onAuthStateChange(Consumer<AuthChangeEvent> listener) {
    registrations.incrementAndGet();
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  private Mono<ProviderAuthResult> authResult(String name) {
    return call(name)
        .then(
            Mono.defer(
                () -> {
                  ProviderAuthResult result = nextAuthResult;
                  if (result == null) {
                    return Mono.error(AuthException.of(AuthErrorKind.PROVIDER_REJECTED));
                  }
                  if (result.session() != null) {
                    session = result.session();
                  }
                  return Mono.just(result);
                }));
  }

  private Mono<Void> call(String name) {
    return Mono.defer(
        () -> {
          calls.add(name);
          RuntimeException ex = failure;
          return ex != null ? Mono.error(ex) : Mono.empty();
        });
  }
}
