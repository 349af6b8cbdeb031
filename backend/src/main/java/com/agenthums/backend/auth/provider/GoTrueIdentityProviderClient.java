package com.agenthums.backend.auth.provider;

import com.agenthums.backend.auth.domain.AuthChangeEvent;
import com.agenthums.backend.auth.domain.ProviderUser;
import com.agenthums.backend.auth.domain.Session;
import com.agenthums.backend.auth.error.AuthErrorKind;
import com.agenthums.backend.auth.error.AuthErrorMapper;
import com.agenthums.backend.auth.error.AuthException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * {@link IdentityProviderClient} for a GoTrue compatible REST API (Supabase Auth). Keeps the
 * provider-side session in memory and pushes change events to registered listeners.
 */
public class GoTrueIdentityProviderClient implements IdentityProviderClient {

  private static final Logger log = LoggerFactory.getLogger(GoTrueIdentityProviderClient.class);
  private static final Set<String> REFRESH_REJECTION_CODES =
      Set.of(
          "refresh_token_not_found",
          "refresh_token_already_used",
          "invalid_grant",
          "session_not_found",
          "session_expired");

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final String authBaseUrl;
  private final Duration requestTimeout;
  private final Clock clock;

  private final AtomicReference<Session> currentSession = new AtomicReference<>();
  private final AtomicReference<String> pendingCodeVerifier = new AtomicReference<>();
  private final List<Consumer<AuthChangeEvent>> listeners = new CopyOnWriteArrayList<>();

  public GoTrueIdentityProviderClient(
      WebClient webClient,
      ObjectMapper objectMapper,
      String authBaseUrl,
      Duration requestTimeout,
      Clock clock) {
    this.webClient = webClient;
    this.objectMapper = objectMapper;
    this.authBaseUrl = authBaseUrl;
    this.requestTimeout = requestTimeout;
    this.clock = clock;
  }

  @Override
  public Mono<ProviderAuthResult> signUp(
      String email, String password, ObjectNode userMetadata, @Nullable String redirectTo) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("email", email);
    body.put("password", password);
    body.set("data", userMetadata != null ? userMetadata : objectMapper.createObjectNode());
    return post(
            uri ->
                uri.path("/signup")
                    .queryParamIfPresent("redirect_to", optional(redirectTo))
                    .build(),
            body)
        .map(this::toAuthResult)
        .doOnNext(result -> result.optionalSession().ifPresent(this::signedIn));
  }

  @Override
  public Mono<ProviderAuthResult> signInWithPassword(String email, String password) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("email", email);
    body.put("password", password);
    return post(uri -> uri.path("/token").queryParam("grant_type", "password").build(), body)
        .map(node -> GoTrueJson.parseSession(node, clock))
        .doOnNext(this::signedIn)
        .map(session -> new ProviderAuthResult(session.user(), session));
  }

  @Override
  public Mono<Void> signInWithOtp(String email, @Nullable String redirectTo) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("email", email);
    body.put("create_user", true);
    return post(
            uri ->
                uri.path("/otp").queryParamIfPresent("redirect_to", optional(redirectTo)).build(),
            body)
        .then();
  }

  @Override
  public Mono<URI> signInWithOAuth(String provider, @Nullable String redirectTo) {
    return Mono.fromSupplier(
        () -> {
          PkceCodes codes = PkceCodes.generate();
          pendingCodeVerifier.set(codes.verifier());
          UriComponentsBuilder builder =
              UriComponentsBuilder.fromUriString(authBaseUrl)
                  .path("/authorize")
                  .queryParam("provider", provider)
                  .queryParam("code_challenge", codes.challenge())
                  .queryParam("code_challenge_method", "s256");
          if (StringUtils.hasText(redirectTo)) {
            builder.queryParam("redirect_to", redirectTo);
          }
          return builder.encode().build().toUri();
        });
  }

  @Override
  public Mono<Session> exchangeCodeForSession(String authCode) {
    return Mono.defer(
        () -> {
          String verifier = pendingCodeVerifier.getAndSet(null);
          if (verifier == null) {
            return Mono.error(
                new AuthException(
                    AuthErrorKind.VALIDATION_FAILED, "No pending provider sign-in to complete"));
          }
          ObjectNode body = objectMapper.createObjectNode();
          body.put("auth_code", authCode);
          body.put("code_verifier", verifier);
          return post(uri -> uri.path("/token").queryParam("grant_type", "pkce").build(), body)
              .map(node -> GoTrueJson.parseSession(node, clock))
              .doOnNext(this::signedIn);
        });
  }

  @Override
  public Mono<ProviderAuthResult> verifyOtp(String email, String token, OtpType type) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("email", email);
    body.put("token", token);
    body.put("type", type.name().toLowerCase(Locale.ROOT));
    return post(uri -> uri.path("/verify").build(), body)
        .map(this::toAuthResult)
        .doOnNext(
            result ->
                result
                    .optionalSession()
                    .ifPresent(
                        session -> {
                          currentSession.set(session);
                          emit(
                              new AuthChangeEvent(
                                  type == OtpType.RECOVERY
                                      ? AuthChangeEvent.Type.PASSWORD_RECOVERY
                                      : AuthChangeEvent.Type.SIGNED_IN,
                                  session));
                        }));
  }

  @Override
  public Mono<Void> signOut() {
    return Mono.defer(
        () -> {
          Session session = currentSession.get();
          if (session == null) {
            return Mono.fromRunnable(this::signedOut);
          }
          return webClient
              .post()
              .uri(uri -> uri.path("/logout").build())
              .header(HttpHeaders.AUTHORIZATION, bearer(session))
              .retrieve()
              .toBodilessEntity()
              .timeout(requestTimeout)
              .then()
              .onErrorResume(
                  WebClientResponseException.class,
                  ex -> {
                    // token already revoked or expired on the provider side
                    if (ex.getStatusCode().value() == 401 || ex.getStatusCode().value() == 404) {
                      log.debug("Provider session already gone: {}", ex.getStatusCode());
                      return Mono.empty();
                    }
                    return Mono.error(ex);
                  })
              .onErrorMap(this::translate)
              .then(Mono.fromRunnable(this::signedOut));
        });
  }

  @Override
  public Mono<Session> getSession() {
    return Mono.defer(
        () -> {
          Session session = currentSession.get();
          if (session == null) {
            return Mono.empty();
          }
          if (session.isExpired(clock) && session.hasRefreshToken()) {
            return refreshSession();
          }
          return Mono.just(session);
        });
  }

  @Override
  public Mono<ProviderUser> getUser() {
    return Mono.defer(
        () -> {
          Session session = currentSession.get();
          if (session == null) {
            return Mono.empty();
          }
          return webClient
              .get()
              .uri(uri -> uri.path("/user").build())
              .header(HttpHeaders.AUTHORIZATION, bearer(session))
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(requestTimeout)
              .onErrorMap(this::translate)
              .map(GoTrueJson::parseUser)
              .doOnNext(
                  user -> currentSession.compareAndSet(session, session.withUser(user)));
        });
  }

  @Override
  public Mono<Session> refreshSession() {
    return Mono.defer(
        () -> {
          Session session = currentSession.get();
          if (session == null || !session.hasRefreshToken()) {
            return Mono.error(
                new AuthException(AuthErrorKind.NOT_AUTHENTICATED, "No refreshable session"));
          }
          ObjectNode body = objectMapper.createObjectNode();
          body.put("refresh_token", session.refreshToken());
          return webClient
              .post()
              .uri(uri -> uri.path("/token").queryParam("grant_type", "refresh_token").build())
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(body)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(requestTimeout)
              .onErrorResume(
                  WebClientResponseException.class,
                  ex -> {
                    JsonNode errorBody = readBody(ex);
                    if (isRefreshTokenRejection(ex, errorBody)) {
                      log.info(
                          "session_refresh_rejected status={} code={}",
                          ex.getStatusCode().value(),
                          GoTrueJson.errorCode(errorBody));
                      signedOut();
                      return Mono.error(
                          new AuthException(
                              AuthErrorKind.PROVIDER_REJECTED, "Refresh token was rejected", ex));
                    }
                    return Mono.error(ex);
                  })
              .onErrorMap(this::translate)
              .map(node -> GoTrueJson.parseSession(node, clock))
              .doOnNext(
                  refreshed -> {
                    currentSession.set(refreshed);
                    emit(new AuthChangeEvent(AuthChangeEvent.Type.TOKEN_REFRESHED, refreshed));
                  });
        });
  }

  @Override
  public Mono<Void> resetPasswordForEmail(String email, @Nullable String redirectTo) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("email", email);
    return post(
            uri ->
                uri.path("/recover")
                    .queryParamIfPresent("redirect_to", optional(redirectTo))
                    .build(),
            body)
        .then();
  }

  @Override
  public Mono<ProviderUser> updateUser(UserAttributes attributes) {
    return Mono.defer(
        () -> {
          Session session = currentSession.get();
          if (session == null) {
            return Mono.error(AuthException.of(AuthErrorKind.NOT_AUTHENTICATED));
          }
          ObjectNode body = objectMapper.createObjectNode();
          if (attributes.email() != null) {
            body.put("email", attributes.email());
          }
          if (attributes.password() != null) {
            body.put("password", attributes.password());
          }
          if (attributes.data() != null) {
            body.set("data", attributes.data());
          }
          return webClient
              .put()
              .uri(uri -> uri.path("/user").build())
              .header(HttpHeaders.AUTHORIZATION, bearer(session))
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(body)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(requestTimeout)
              .onErrorMap(this::translate)
              .map(GoTrueJson::parseUser)
              .doOnNext(
                  user -> {
                    Session updated = session.withUser(user);
                    currentSession.set(updated);
                    emit(new AuthChangeEvent(AuthChangeEvent.Type.USER_UPDATED, updated));
                  });
        });
  }

  @Override
  public Mono<Void> resend(String email) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("type", "signup");
    body.put("email", email);
    return post(uri -> uri.path("/resend").build(), body).then();
  }

  @Override
  public Disposable onAuthStateChange(Consumer<AuthChangeEvent> listener) {
    Consumer<AuthChangeEvent> registration = event -> listener.accept(event);
    listeners.add(registration);
    return () -> listeners.remove(registration);
  }

  private Mono<JsonNode> post(Function<UriBuilder, URI> uri, JsonNode body) {
    return webClient
        .post()
        .uri(uri)
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(body)
        .retrieve()
        .bodyToMono(JsonNode.class)
        .defaultIfEmpty(objectMapper.createObjectNode())
        .timeout(requestTimeout)
        .onErrorMap(this::translate);
  }

  private ProviderAuthResult toAuthResult(JsonNode node) {
    if (GoTrueJson.hasSession(node)) {
      Session session = GoTrueJson.parseSession(node, clock);
      return new ProviderAuthResult(session.user(), session);
    }
    // confirmation pending: the body is the bare user, or wraps it
    JsonNode userNode = node.has("user") ? node.get("user") : node;
    return new ProviderAuthResult(GoTrueJson.parseUser(userNode), null);
  }

  private void signedIn(Session session) {
    currentSession.set(session);
    emit(new AuthChangeEvent(AuthChangeEvent.Type.SIGNED_IN, session));
  }

  private void signedOut() {
    currentSession.set(null);
    emit(AuthChangeEvent.signedOut());
  }

  private void emit(AuthChangeEvent event) {
    log.debug("provider_auth_event type={}", event.type());
    for (Consumer<AuthChangeEvent> listener : listeners) {
      try {
        listener.accept(event);
      } catch (RuntimeException ex) {
        log.warn("Auth change listener failed on {}: {}", event.type(), ex.getMessage(), ex);
      }
    }
  }

  /** Only a 400/401 naming the refresh token or session as invalid ends the session. */
  private static boolean isRefreshTokenRejection(
      WebClientResponseException ex, @Nullable JsonNode body) {
    int status = ex.getStatusCode().value();
    if (status != HttpStatus.BAD_REQUEST.value() && status != HttpStatus.UNAUTHORIZED.value()) {
      return false;
    }
    String code = GoTrueJson.errorCode(body);
    if (code != null && REFRESH_REJECTION_CODES.contains(code)) {
      return true;
    }
    String message = GoTrueJson.errorMessage(body);
    return message != null && message.toLowerCase(Locale.ROOT).contains("invalid refresh token");
  }

  private Throwable translate(Throwable failure) {
    if (failure instanceof AuthException) {
      return failure;
    }
    if (failure instanceof WebClientResponseException ex) {
      JsonNode body = readBody(ex);
      String code = GoTrueJson.errorCode(body);
      String message =
          Optional.ofNullable(GoTrueJson.errorMessage(body)).orElse(ex.getStatusText());
      String normalizedMessage = message != null ? message.toLowerCase(Locale.ROOT) : "";
      if ("invalid_credentials".equals(code)
          || normalizedMessage.contains("invalid login credentials")) {
        return new AuthException(AuthErrorKind.INVALID_CREDENTIALS, message, ex);
      }
      if ("email_not_confirmed".equals(code) || normalizedMessage.contains("email not confirmed")) {
        return new AuthException(AuthErrorKind.EMAIL_NOT_CONFIRMED, message, ex);
      }
      int status = ex.getStatusCode().value();
      if (ex.getStatusCode().is5xxServerError()
          || status == HttpStatus.TOO_MANY_REQUESTS.value()
          || status == HttpStatus.REQUEST_TIMEOUT.value()) {
        return new AuthException(AuthErrorKind.NETWORK_UNAVAILABLE, message, ex);
      }
      return new AuthException(AuthErrorKind.PROVIDER_REJECTED, message, ex);
    }
    return AuthErrorMapper.toException(failure, AuthErrorKind.NETWORK_UNAVAILABLE);
  }

  @Nullable
  private JsonNode readBody(WebClientResponseException ex) {
    String raw = ex.getResponseBodyAsString();
    if (!StringUtils.hasText(raw)) {
      return null;
    }
    try {
      return objectMapper.readTree(raw);
    } catch (JsonProcessingException parseError) {
      log.debug("Provider error body is not JSON: {}", parseError.getMessage());
      return null;
    }
  }

  private static String bearer(Session session) {
    return "Bearer " + session.accessToken();
  }

  private static Optional<String> optional(@Nullable String value) {
    return StringUtils.hasText(value) ? Optional.of(value) : Optional.empty();
  }
}
