package com.agenthums.backend.integration.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.agenthums.backend.auth.domain.AuthStatePatch;
import com.agenthums.backend.auth.domain.Identity;
import com.agenthums.backend.auth.domain.ProviderUser;
import com.agenthums.backend.auth.error.AuthErrorKind;
import com.agenthums.backend.auth.error.AuthException;
import com.agenthums.backend.auth.state.AuthStateStore;
import com.agenthums.backend.auth.state.CredentialStore;
import com.agenthums.backend.auth.telemetry.CredentialMetrics;
import com.agenthums.backend.integration.config.IntegrationProperties;
import com.agenthums.backend.integration.domain.IntegrationConnection;
import com.agenthums.backend.integration.oauth.IntegrationService;
import com.agenthums.backend.integration.oauth.IntegrationServiceRegistry;
import com.agenthums.backend.integration.oauth.OAuthTokenResponse;
import com.agenthums.backend.support.AuthFixtures;
import com.agenthums.backend.support.FakeTokenEndpoint;
import com.agenthums.backend.support.InMemoryIntegrationTokenStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

class IntegrationCredentialBrokerTest {

  private static final List<String> CALENDAR_SCOPES =
      List.of("https://www.googleapis.com/auth/calendar");

  private InMemoryIntegrationTokenStore tokenStore;
  private FakeTokenEndpoint endpoint;
  private AuthStateStore stateStore;
  private IntegrationServiceRegistry registry;
  private IntegrationCredentialBroker broker;
  private UUID identityId;

  @BeforeEach
  void setUp() {
    tokenStore = new InMemoryIntegrationTokenStore();
    endpoint = new FakeTokenEndpoint();
    stateStore = new AuthStateStore(new CredentialStore());
    registry = new IntegrationServiceRegistry();
    registry.register(
        new IntegrationService(
            "calendar", endpoint, CALENDAR_SCOPES, "http://localhost:4200/integrations/callback"));
    registry.register(
        new IntegrationService(
            "drive", endpoint, List.of(), "http://localhost:4200/integrations/callback"));
    broker = newBroker(tokenStore);

    identityId = UUID.randomUUID();
    ProviderUser user = AuthFixtures.user(identityId, "ivy@example.com");
    Identity identity = AuthFixtures.identity(identityId, "Ivy");
    stateStore.update(
        AuthStatePatch.authenticated(
            identity, AuthFixtures.session(user, Duration.ofHours(1)), null));
  }

  @Test
  void callbackStoresConnectedCredentials() {
    endpoint.answerCode(
        () -> Mono.just(new OAuthTokenResponse("at-1", "rt-1", "Bearer", 3600L, List.of())));

    StepVerifier.create(broker.completeAuthorizationCallback("code-1", "calendar"))
        .assertNext(
            connection -> {
              assertThat(connection.isConnected()).isTrue();
              assertThat(connection.getExpiresAt())
                  .isEqualTo(AuthFixtures.NOW.plusSeconds(3600));
              assertThat(connection.getScopes()).containsExactlyElementsOf(CALENDAR_SCOPES);
            })
        .verifyComplete();

    assertThat(broker.getValidAccessToken(identityId, "calendar").block()).isEqualTo("at-1");
    assertThat(endpoint.refreshExchanges()).isZero();
  }

  @Test
  void callbackWithoutActorIsRejected() {
    stateStore.update(AuthStatePatch.anonymous());

    StepVerifier.create(broker.completeAuthorizationCallback("code-1", "calendar"))
        .expectErrorSatisfies(
            ex ->
                assertThat(((AuthException) ex).getKind())
                    .isEqualTo(AuthErrorKind.NOT_AUTHENTICATED))
        .verify();

    assertThat(endpoint.codeExchanges()).isZero();
  }

  @Test
  void failedCodeExchangeIsMirroredIntoState() {
    endpoint.answerCode(
        () ->
            Mono.error(
                new AuthException(AuthErrorKind.TOKEN_EXCHANGE_FAILED, "invalid_grant: expired")));

    StepVerifier.create(broker.completeAuthorizationCallback("code-1", "calendar"))
        .expectError(AuthException.class)
        .verify();

    assertThat(stateStore.snapshot().lastError().kind())
        .isEqualTo(AuthErrorKind.TOKEN_EXCHANGE_FAILED);
    assertThat(stateStore.snapshot().isAuthenticated()).isTrue();
    assertThat(tokenStore.size()).isZero();
  }

  @Test
  void unknownServiceKindIsAValidationError() {
    StepVerifier.create(broker.getValidAccessToken(identityId, "fax"))
        .expectErrorSatisfies(
            ex ->
                assertThat(((AuthException) ex).getKind())
                    .isEqualTo(AuthErrorKind.VALIDATION_FAILED))
        .verify();
  }

  @Test
  void missingConnectionIsNotConnected() {
    StepVerifier.create(broker.getValidAccessToken(identityId, "drive"))
        .expectErrorSatisfies(
            ex ->
                assertThat(((AuthException) ex).getKind())
                    .isEqualTo(AuthErrorKind.INTEGRATION_NOT_CONNECTED))
        .verify();
  }

  @Test
  void concurrentCallersShareOneRefresh() {
    tokenStore.put(expired("rt-old"));
    Sinks.One<OAuthTokenResponse> pending = Sinks.one();
    endpoint.answerRefresh(pending::asMono);

    List<Mono<String>> callers =
        List.of(
            broker.getValidAccessToken(identityId, "calendar"),
            broker.getValidAccessToken(identityId, "calendar"),
            broker.getValidAccessToken(identityId, "calendar"));
    List<String> tokens = new CopyOnWriteArrayList<>();
    callers.forEach(caller -> caller.subscribe(tokens::add));
    pending.tryEmitValue(new OAuthTokenResponse("at-new", null, "Bearer", 3600L, List.of()));

    assertThat(tokens).containsExactly("at-new", "at-new", "at-new");
    assertThat(endpoint.refreshExchanges()).isEqualTo(1);
    IntegrationConnection stored = tokenStore.row(identityId, "calendar");
    assertThat(stored.getAccessToken()).isEqualTo("at-new");
    assertThat(stored.getRefreshToken()).isEqualTo("rt-old");
  }

  @Test
  void callerReadingBeforeRotationDoesNotReuseOldRefreshToken() {
    Sinks.Empty<Void> releaseRead = Sinks.empty();
    AtomicBoolean holdNextRead = new AtomicBoolean(true);
    InMemoryIntegrationTokenStore slowStore =
        new InMemoryIntegrationTokenStore() {
          @Override
          public Mono<IntegrationConnection> selectByIdentityAndService(
              UUID identityId, String serviceKind) {
            if (holdNextRead.compareAndSet(true, false)) {
              IntegrationConnection seen = row(identityId, serviceKind);
              return releaseRead.asMono().then(Mono.just(seen));
            }
            return super.selectByIdentityAndService(identityId, serviceKind);
          }
        };
    slowStore.put(expired("rt-old"));
    endpoint.answerRefresh(
        () ->
            Mono.just(
                new OAuthTokenResponse("at-new", "rt-rotated", "Bearer", 3600L, List.of())));
    IntegrationCredentialBroker slowBroker = newBroker(slowStore);

    List<String> tokens = new CopyOnWriteArrayList<>();
    slowBroker.getValidAccessToken(identityId, "calendar").subscribe(tokens::add);
    tokens.add(slowBroker.getValidAccessToken(identityId, "calendar").block());
    releaseRead.tryEmitEmpty();

    assertThat(tokens).containsExactly("at-new", "at-new");
    assertThat(endpoint.refreshExchanges()).isEqualTo(1);
    assertThat(endpoint.refreshTokensSent()).containsExactly("rt-old");
    assertThat(slowStore.row(identityId, "calendar").getRefreshToken()).isEqualTo("rt-rotated");
  }

  @Test
  void failedRefreshKeepsStaleRecordAndStateUntouched() {
    IntegrationConnection stale = expired("rt-old");
    tokenStore.put(stale);
    endpoint.answerRefresh(
        () ->
            Mono.error(new AuthException(AuthErrorKind.TOKEN_EXCHANGE_FAILED, "invalid_grant")));

    StepVerifier.create(broker.getValidAccessToken(identityId, "calendar"))
        .expectErrorSatisfies(
            ex ->
                assertThat(((AuthException) ex).getKind())
                    .isEqualTo(AuthErrorKind.TOKEN_EXCHANGE_FAILED))
        .verify();

    assertThat(tokenStore.row(identityId, "calendar").getAccessToken()).isEqualTo("at-old");
    assertThat(stateStore.snapshot().lastError()).isNull();
  }

  @Test
  void expiredWithoutRefreshTokenNeedsReconnect() {
    tokenStore.put(expired(null));

    StepVerifier.create(broker.getValidAccessToken(identityId, "calendar"))
        .expectErrorSatisfies(
            ex ->
                assertThat(((AuthException) ex).getKind())
                    .isEqualTo(AuthErrorKind.TOKEN_EXPIRED_NO_REFRESH))
        .verify();
    assertThat(endpoint.refreshExchanges()).isZero();
  }

  @Test
  void disconnectClearsTokensWithoutRefreshing() {
    IntegrationConnection connection = new IntegrationConnection(identityId, "calendar");
    connection.setAccessToken("at-1");
    connection.setRefreshToken("rt-1");
    connection.setExpiresAt(AuthFixtures.NOW.plusSeconds(3600));
    connection.setConnected(true);
    tokenStore.put(connection);

    broker.disconnect(identityId, "calendar").block();

    IntegrationConnection stored = tokenStore.row(identityId, "calendar");
    assertThat(stored.isConnected()).isFalse();
    assertThat(stored.getAccessToken()).isNull();
    assertThat(stored.getRefreshToken()).isNull();
    assertThat(endpoint.refreshExchanges()).isZero();
    StepVerifier.create(broker.getValidAccessToken(identityId, "calendar"))
        .expectErrorSatisfies(
            ex ->
                assertThat(((AuthException) ex).getKind())
                    .isEqualTo(AuthErrorKind.INTEGRATION_NOT_CONNECTED))
        .verify();
  }

  @Test
  void statusListsEveryServiceSorted() {
    tokenStore.put(expired("rt-1"));

    List<IntegrationStatus> status = broker.status(identityId).block();

    assertThat(status)
        .extracting(IntegrationStatus::serviceKind)
        .containsExactly("calendar", "drive");
    assertThat(status.get(0).connected()).isTrue();
    assertThat(status.get(1).connected()).isFalse();
  }

  @Test
  void authorizationUrlCarriesServiceKindAsState() {
    URI url = broker.authorizationUrl("Calendar");

    assertThat(url.getQuery()).contains("state=calendar");
  }

  private IntegrationCredentialBroker newBroker(InMemoryIntegrationTokenStore store) {
    return new IntegrationCredentialBroker(
        store,
        registry,
        stateStore,
        new CredentialMetrics(new SimpleMeterRegistry()),
        new IntegrationProperties(),
        AuthFixtures.CLOCK);
  }

  private IntegrationConnection expired(String refreshToken) {
    IntegrationConnection connection = new IntegrationConnection(identityId, "calendar");
    connection.setAccessToken("at-old");
    connection.setRefreshToken(refreshToken);
    connection.setExpiresAt(AuthFixtures.NOW.minusSeconds(60));
    connection.setScopes(CALENDAR_SCOPES);
    connection.setConnected(true);
    return connection;
  }
}
