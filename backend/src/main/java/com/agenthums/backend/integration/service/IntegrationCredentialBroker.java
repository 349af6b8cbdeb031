package com.agenthums.backend.integration.service;

import com.agenthums.backend.auth.domain.AuthStatePatch;
import com.agenthums.backend.auth.domain.Identity;
import com.agenthums.backend.auth.error.AuthError;
import com.agenthums.backend.auth.error.AuthErrorKind;
import com.agenthums.backend.auth.error.AuthErrorMapper;
import com.agenthums.backend.auth.error.AuthException;
import com.agenthums.backend.auth.state.AuthStateStore;
import com.agenthums.backend.auth.telemetry.CredentialMetrics;
import com.agenthums.backend.integration.config.IntegrationProperties;
import com.agenthums.backend.integration.domain.IntegrationConnection;
import com.agenthums.backend.integration.oauth.IntegrationService;
import com.agenthums.backend.integration.oauth.IntegrationServiceRegistry;
import com.agenthums.backend.integration.oauth.OAuthAuthorizationRequest;
import com.agenthums.backend.integration.oauth.OAuthTokenResponse;
import com.agenthums.backend.integration.persistence.IntegrationTokenStore;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

/**
 * Owns the OAuth credentials of third-party integrations, one set per identity and service kind.
 * Concurrent refreshes of the same credentials share a single token exchange.
 */
@Service
public class IntegrationCredentialBroker {

  private static final Logger log = LoggerFactory.getLogger(IntegrationCredentialBroker.class);

  private final IntegrationTokenStore tokenStore;
  private final IntegrationServiceRegistry serviceRegistry;
  private final AuthStateStore stateStore;
  private final CredentialMetrics metrics;
  private final Clock clock;
  private final Duration requestTimeout;
  private final Duration expirySkew;

  private final ConcurrentMap<ConnectionKey, Mono<String>> inFlightRefreshes =
      new ConcurrentHashMap<>();

  public IntegrationCredentialBroker(
      IntegrationTokenStore tokenStore,
      IntegrationServiceRegistry serviceRegistry,
      AuthStateStore stateStore,
      CredentialMetrics metrics,
      IntegrationProperties properties,
      Clock clock) {
    this.tokenStore = tokenStore;
    this.serviceRegistry = serviceRegistry;
    this.stateStore = stateStore;
    this.metrics = metrics;
    this.clock = clock;
    this.requestTimeout = properties.getRequestTimeout();
    this.expirySkew = properties.getExpirySkew();
  }

  /**
   * Returns a usable access token, refreshing it first when it has expired. Used by tool
   * execution, so failures are only returned and never recorded in the auth state.
   */
  public Mono<String> getValidAccessToken(UUID identityId, String serviceKind) {
    return Mono.defer(
        () -> {
          IntegrationService service = requireService(serviceKind);
          ConnectionKey key = new ConnectionKey(identityId, service.serviceKind());
          return readConnection(key)
              .switchIfEmpty(Mono.error(() -> notConnected(key.serviceKind())))
              .flatMap(
                  connection -> {
                    if (!connection.hasAccessToken()) {
                      return Mono.error(notConnected(key.serviceKind()));
                    }
                    if (!connection.isExpired(clock, expirySkew)) {
                      return Mono.just(connection.getAccessToken());
                    }
                    if (!connection.hasRefreshToken()) {
                      return Mono.error(expiredWithoutRefresh(key.serviceKind()));
                    }
                    return refreshSingleFlight(key, service);
                  });
        });
  }

  /** Exchanges the authorization code and stores the credentials for the current actor. */
  public Mono<IntegrationConnection> completeAuthorizationCallback(
      String code, String serviceKind) {
    return Mono.defer(
            () -> {
              if (!StringUtils.hasText(code)) {
                throw new AuthException(
                    AuthErrorKind.VALIDATION_FAILED, "Authorization code is required");
              }
              IntegrationService service = requireService(serviceKind);
              UUID identityId = currentIdentityId();
              return service
                  .endpoint()
                  .exchangeCode(code.trim(), service.redirectUri())
                  .flatMap(
                      response ->
                          tokenStore
                              .upsert(connected(identityId, service, response))
                              .timeout(requestTimeout))
                  .doOnNext(
                      connection ->
                          log.info(
                              "integration_connected identityId={} service={} expiresAt={}",
                              identityId,
                              connection.getServiceKind(),
                              connection.getExpiresAt()));
            })
        .onErrorMap(ex -> mirror(ex, AuthErrorKind.TOKEN_EXCHANGE_FAILED));
  }

  /** Forgets the tokens but keeps the row, so the connection history stays visible. */
  public Mono<Void> disconnect(UUID identityId, String serviceKind) {
    return Mono.defer(
            () -> {
              IntegrationService service = requireService(serviceKind);
              ConnectionKey key = new ConnectionKey(identityId, service.serviceKind());
              return readConnection(key)
                  .flatMap(
                      existing -> {
                        IntegrationConnection cleared = existing.copy();
                        cleared.setAccessToken(null);
                        cleared.setRefreshToken(null);
                        cleared.setExpiresAt(null);
                        cleared.setConnected(false);
                        return tokenStore.upsert(cleared).timeout(requestTimeout);
                      })
                  .doOnNext(
                      connection ->
                          log.info(
                              "integration_disconnected identityId={} service={}",
                              identityId,
                              connection.getServiceKind()))
                  .then();
            })
        .onErrorMap(ex -> mirror(ex, AuthErrorKind.NETWORK_UNAVAILABLE));
  }

  /** Consent URL asking for offline access; the state parameter carries the service kind. */
  public URI authorizationUrl(String serviceKind) {
    IntegrationService service = requireService(serviceKind);
    return service
        .endpoint()
        .buildAuthorizationUri(
            new OAuthAuthorizationRequest(
                service.redirectUri(), service.serviceKind(), service.scopes()));
  }

  public Mono<List<IntegrationStatus>> status(UUID identityId) {
    return tokenStore
        .selectByIdentity(identityId)
        .timeout(requestTimeout)
        .onErrorMap(ex -> AuthErrorMapper.toException(ex, AuthErrorKind.NETWORK_UNAVAILABLE))
        .map(
            connections -> {
              Map<String, IntegrationConnection> byKind =
                  connections.stream()
                      .collect(
                          Collectors.toMap(
                              IntegrationConnection::getServiceKind,
                              Function.identity(),
                              (left, right) -> left));
              return serviceRegistry.serviceKinds().stream()
                  .sorted(Comparator.naturalOrder())
                  .map(kind -> toStatus(kind, byKind.get(kind)))
                  .toList();
            });
  }

  private Mono<String> refreshSingleFlight(ConnectionKey key, IntegrationService service) {
    return inFlightRefreshes.computeIfAbsent(
        key, k -> refresh(k, service).doFinally(signal -> inFlightRefreshes.remove(k)).cache());
  }

  /**
   * Re-reads the row before exchanging: a caller may arrive after another refresh already
   * rotated the refresh token it saw.
   */
  private Mono<String> refresh(ConnectionKey key, IntegrationService service) {
    long started = System.nanoTime();
    return readConnection(key)
        .filter(IntegrationConnection::hasAccessToken)
        .switchIfEmpty(Mono.error(() -> notConnected(key.serviceKind())))
        .flatMap(
            current -> {
              if (!current.isExpired(clock, expirySkew)) {
                return Mono.just(current.getAccessToken());
              }
              if (!current.hasRefreshToken()) {
                return Mono.error(expiredWithoutRefresh(key.serviceKind()));
              }
              return exchangeRefreshToken(key, service, current.getRefreshToken(), started);
            });
  }

  private Mono<String> exchangeRefreshToken(
      ConnectionKey key, IntegrationService service, String refreshToken, long started) {
    return service
        .endpoint()
        .exchangeRefreshToken(refreshToken)
        .flatMap(
            response ->
                // a disconnect may have happened while the exchange was running
                readConnection(key)
                    .filter(IntegrationConnection::isConnected)
                    .switchIfEmpty(Mono.error(() -> notConnected(key.serviceKind())))
                    .flatMap(current -> tokenStore.upsert(refreshed(current, response)))
                    .timeout(requestTimeout))
        .map(IntegrationConnection::getAccessToken)
        .doOnNext(
            token -> {
              metrics.recordIntegrationRefresh(
                  key.serviceKind(), "success", System.nanoTime() - started);
              log.info(
                  "integration_token_refreshed identityId={} service={}",
                  key.identityId(),
                  key.serviceKind());
            })
        .onErrorMap(
            ex -> {
              AuthException failure =
                  AuthErrorMapper.toException(ex, AuthErrorKind.TOKEN_EXCHANGE_FAILED);
              metrics.recordIntegrationRefresh(
                  key.serviceKind(), "failure", System.nanoTime() - started);
              log.warn(
                  "integration_token_refresh_failed identityId={} service={} kind={}",
                  key.identityId(),
                  key.serviceKind(),
                  failure.getKind());
              return failure;
            });
  }

  private Mono<IntegrationConnection> readConnection(ConnectionKey key) {
    return tokenStore
        .selectByIdentityAndService(key.identityId(), key.serviceKind())
        .timeout(requestTimeout)
        .onErrorMap(ex -> AuthErrorMapper.toException(ex, AuthErrorKind.NETWORK_UNAVAILABLE));
  }

  private IntegrationConnection connected(
      UUID identityId, IntegrationService service, OAuthTokenResponse response) {
    IntegrationConnection connection = new IntegrationConnection(identityId, service.serviceKind());
    connection.setAccessToken(response.accessToken());
    connection.setRefreshToken(response.refreshToken());
    connection.setTokenType(response.tokenType());
    connection.setExpiresAt(expiresAt(response));
    connection.setScopes(response.scopes().isEmpty() ? service.scopes() : response.scopes());
    connection.setConnected(true);
    return connection;
  }

  private IntegrationConnection refreshed(
      IntegrationConnection current, OAuthTokenResponse response) {
    IntegrationConnection updated = current.copy();
    updated.setAccessToken(response.accessToken());
    // most providers only send a new refresh token when they rotate it
    if (StringUtils.hasText(response.refreshToken())) {
      updated.setRefreshToken(response.refreshToken());
    }
    if (StringUtils.hasText(response.tokenType())) {
      updated.setTokenType(response.tokenType());
    }
    updated.setExpiresAt(expiresAt(response));
    if (!response.scopes().isEmpty()) {
      updated.setScopes(response.scopes());
    }
    updated.setConnected(true);
    return updated;
  }

  private Instant expiresAt(OAuthTokenResponse response) {
    return response.expiresIn() != null ? clock.instant().plusSeconds(response.expiresIn()) : null;
  }

  private IntegrationStatus toStatus(String serviceKind, IntegrationConnection connection) {
    if (connection == null) {
      return IntegrationStatus.disconnected(serviceKind);
    }
    return new IntegrationStatus(
        serviceKind,
        connection.hasAccessToken(),
        connection.getUpdatedAt(),
        connection.getExpiresAt(),
        List.copyOf(connection.getScopes()));
  }

  private IntegrationService requireService(String serviceKind) {
    return serviceRegistry
        .find(serviceKind)
        .orElseThrow(
            () ->
                new AuthException(
                    AuthErrorKind.VALIDATION_FAILED,
                    "Unknown integration service: " + serviceKind));
  }

  /** Identity id of the signed-in actor; fails with {@code NOT_AUTHENTICATED} otherwise. */
  public UUID currentIdentityId() {
    Identity identity = stateStore.snapshot().identity();
    if (identity == null) {
      throw AuthException.of(AuthErrorKind.NOT_AUTHENTICATED);
    }
    return identity.id();
  }

  private AuthException notConnected(String serviceKind) {
    return new AuthException(
        AuthErrorKind.INTEGRATION_NOT_CONNECTED, serviceKind + " is not connected");
  }

  private AuthException expiredWithoutRefresh(String serviceKind) {
    return new AuthException(
        AuthErrorKind.TOKEN_EXPIRED_NO_REFRESH,
        "Access token for " + serviceKind + " expired, reconnect the service");
  }

  private Throwable mirror(Throwable failure, AuthErrorKind fallback) {
    AuthException exception = AuthErrorMapper.toException(failure, fallback);
    AuthError error = exception.getError();
    stateStore.update(AuthStatePatch.error(error));
    return exception;
  }
}
