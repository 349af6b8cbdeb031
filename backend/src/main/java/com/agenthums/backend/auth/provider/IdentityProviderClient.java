package com.agenthums.backend.auth.provider;

import com.agenthums.backend.auth.domain.AuthChangeEvent;
import com.agenthums.backend.auth.domain.ProviderUser;
import com.agenthums.backend.auth.domain.Session;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.net.URI;
import java.util.Optional;
import java.util.function.Consumer;
import org.springframework.lang.Nullable;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Port to the hosted identity provider. Failures are signalled as {@code AuthException}s carrying
 * the matching error kind.
 */
public interface IdentityProviderClient {

  Mono<ProviderAuthResult> signUp(
      String email, String password, ObjectNode userMetadata, @Nullable String redirectTo);

  Mono<ProviderAuthResult> signInWithPassword(String email, String password);

  /** Sends a magic link. */
  Mono<Void> signInWithOtp(String email, @Nullable String redirectTo);

  /** Returns the provider's authorize URL for a redirect based sign-in. */
  Mono<URI> signInWithOAuth(String provider, @Nullable String redirectTo);

  Mono<Session> exchangeCodeForSession(String authCode);

  Mono<ProviderAuthResult> verifyOtp(String email, String token, OtpType type);

  Mono<Void> signOut();

  /** Completes empty when no session is held. */
  Mono<Session> getSession();

  /** Re-reads the user of the held session from the provider; empty without a session. */
  Mono<ProviderUser> getUser();

  Mono<Session> refreshSession();

  Mono<Void> resetPasswordForEmail(String email, @Nullable String redirectTo);

  Mono<ProviderUser> updateUser(UserAttributes attributes);

  Mono<Void> resend(String email);

  Disposable onAuthStateChange(Consumer<AuthChangeEvent> listener);

  enum OtpType {
    SIGNUP,
    MAGICLINK,
    RECOVERY,
    EMAIL_CHANGE,
    EMAIL
  }

  record ProviderAuthResult(ProviderUser user, @Nullable Session session) {

    public Optional<Session> optionalSession() {
      return Optional.ofNullable(session);
    }
  }

  record UserAttributes(
      @Nullable String email, @Nullable String password, @Nullable ObjectNode data) {

    public static UserAttributes password(String password) {
      return new UserAttributes(null, password, null);
    }

    public static UserAttributes email(String email) {
      return new UserAttributes(email, null, null);
    }

    public static UserAttributes data(ObjectNode data) {
      return new UserAttributes(null, null, data);
    }
  }
}
