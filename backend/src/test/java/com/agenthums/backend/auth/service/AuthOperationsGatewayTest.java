package com.agenthums.backend.auth.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.agenthums.backend.auth.config.AuthProperties;
import com.agenthums.backend.auth.domain.AuthState;
import com.agenthums.backend.auth.domain.ProviderUser;
import com.agenthums.backend.auth.error.AuthErrorKind;
import com.agenthums.backend.auth.error.AuthException;
import com.agenthums.backend.auth.provider.IdentityProviderClient.ProviderAuthResult;
import com.agenthums.backend.auth.session.SessionManager;
import com.agenthums.backend.auth.state.AuthStateStore;
import com.agenthums.backend.auth.state.CredentialStore;
import com.agenthums.backend.auth.telemetry.CredentialMetrics;
import com.agenthums.backend.integration.domain.IntegrationConnection;
import com.agenthums.backend.profile.config.ProfileProperties;
import com.agenthums.backend.profile.service.ProfileEventLogger;
import com.agenthums.backend.profile.service.ProfileReconciler;
import com.agenthums.backend.support.AuthFixtures;
import com.agenthums.backend.support.FakeIdentityProviderClient;
import com.agenthums.backend.support.InMemoryIntegrationTokenStore;
import com.agenthums.backend.support.InMemoryProfileStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.URI;
import java.time.Duration;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class AuthOperationsGatewayTest {

  private FakeIdentityProviderClient provider;
  private InMemoryProfileStore profileStore;
  private AuthStateStore stateStore;
  private ProfileReconciler reconciler;
  private SimpleMeterRegistry meterRegistry;
  private AuthOperationsGateway gateway;

  @BeforeEach
  void setUp() {
    provider = new FakeIdentityProviderClient();
    profileStore = new InMemoryProfileStore();
    stateStore = new AuthStateStore(new CredentialStore());
    meterRegistry = new SimpleMeterRegistry();
    CredentialMetrics metrics = new CredentialMetrics(meterRegistry);
    AuthProperties properties = new AuthProperties();
    reconciler =
        new ProfileReconciler(
            profileStore, new ProfileEventLogger(), metrics, new ProfileProperties());
    SessionManager sessionManager =
        new SessionManager(
            provider,
            stateStore,
            reconciler,
            new IdentityMapper(),
            metrics,
            properties,
            AuthFixtures.CLOCK);
    gateway =
        new AuthOperationsGateway(
            provider, stateStore, sessionManager, reconciler, metrics, properties);
  }

  @Test
  void signUpCreatesProfileWithChosenNameAndSignsIn() {
    ProviderUser ann = AuthFixtures.user(UUID.randomUUID(), "ann@example.com");
    provider.answerAuth(
        new ProviderAuthResult(ann, AuthFixtures.session(ann, Duration.ofHours(1))));

    StepVerifier.create(
            gateway.signUp(new SignUpCommand("Ann@Example.com", "secret123", "Ann", null)))
        .assertNext(user -> assertThat(user.id()).isEqualTo(ann.id()))
        .verifyComplete();

    AuthState state = stateStore.snapshot();
    assertThat(state.isAuthenticated()).isTrue();
    assertThat(state.loading()).isFalse();
    assertThat(state.identity().displayName()).isEqualTo("Ann");
    assertThat(profileStore.row(ann.id()).getDisplayName()).isEqualTo("Ann");
    assertThat(provider.lastSignUpMetadata().path("display_name").asText()).isEqualTo("Ann");

    // a later session reconcile finds the row and inserts nothing
    reconciler.evict(ann.id());
    reconciler.ensure(ann).block();
    assertThat(profileStore.insertAttempts()).isEqualTo(1);
  }

  @Test
  void signUpAwaitingConfirmationStaysAnonymous() {
    ProviderUser ann = AuthFixtures.user(UUID.randomUUID(), "ann@example.com");
    provider.answerAuth(new ProviderAuthResult(ann, null));

    gateway.signUp(new SignUpCommand("ann@example.com", "secret123", null, null)).block();

    assertThat(stateStore.snapshot().isAuthenticated()).isFalse();
    assertThat(stateStore.snapshot().loading()).isFalse();
    assertThat(profileStore.row(ann.id()).getDisplayName()).isEqualTo("ann");
  }

  @Test
  void invalidCredentialsAreReturnedAndRecorded() {
    provider.failWith(new AuthException(AuthErrorKind.INVALID_CREDENTIALS, "Invalid login"));

    StepVerifier.create(gateway.signIn("bob@example.com", "wrong-password"))
        .expectErrorSatisfies(
            ex ->
                assertThat(((AuthException) ex).getKind())
                    .isEqualTo(AuthErrorKind.INVALID_CREDENTIALS))
        .verify();

    AuthState state = stateStore.snapshot();
    assertThat(state.loading()).isFalse();
    assertThat(state.lastError().kind()).isEqualTo(AuthErrorKind.INVALID_CREDENTIALS);
    assertThat(state.lastError().retryable()).isFalse();
    assertThat(
            meterRegistry
                .counter("auth.operation", "operation", "sign_in", "result", "invalid_credentials")
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void invalidInputNeverReachesProvider() {
    StepVerifier.create(gateway.signIn("not-an-email", "whatever"))
        .expectErrorSatisfies(
            ex ->
                assertThat(((AuthException) ex).getKind())
                    .isEqualTo(AuthErrorKind.VALIDATION_FAILED))
        .verify();
    StepVerifier.create(
            gateway.signUp(new SignUpCommand("carl@example.com", "123", "Carl", null)))
        .expectError(AuthException.class)
        .verify();

    assertThat(provider.calls()).isEmpty();
    assertThat(stateStore.snapshot().lastError().kind()).isEqualTo(AuthErrorKind.VALIDATION_FAILED);
  }

  @Test
  void passwordUpdateRequiresActor() {
    StepVerifier.create(gateway.updatePassword("new-secret"))
        .expectErrorSatisfies(
            ex ->
                assertThat(((AuthException) ex).getKind())
                    .isEqualTo(AuthErrorKind.NOT_AUTHENTICATED))
        .verify();

    assertThat(provider.calls()).isEmpty();
  }

  @Test
  void signOutClearsActorButNotIntegrations() {
    ProviderUser dana = AuthFixtures.user(UUID.randomUUID(), "dana@example.com");
    provider.answerAuth(
        new ProviderAuthResult(dana, AuthFixtures.session(dana, Duration.ofHours(1))));
    gateway.signIn("dana@example.com", "secret123").block();
    InMemoryIntegrationTokenStore tokens = new InMemoryIntegrationTokenStore();
    IntegrationConnection calendar = new IntegrationConnection(dana.id(), "calendar");
    calendar.setAccessToken("cal-token");
    calendar.setConnected(true);
    tokens.put(calendar);

    gateway.signOut().block();

    assertThat(stateStore.snapshot().isAuthenticated()).isFalse();
    assertThat(stateStore.snapshot().session()).isNull();
    assertThat(tokens.row(dana.id(), "calendar").hasAccessToken()).isTrue();
  }

  @Test
  void providerSignInRejectsUnsupportedProvider() {
    StepVerifier.create(gateway.signInWithProvider("myspace", null))
        .expectError(AuthException.class)
        .verify();

    URI url = gateway.signInWithProvider(" GitHub ", null).block();

    assertThat(url.toString()).contains("provider=github");
    assertThat(stateStore.snapshot().loading()).isFalse();
  }

  @Test
  void magicLinkLeavesStateIdle() {
    gateway.signInWithMagicLink("erin@example.com", null).block();

    assertThat(provider.calls()).containsExactly("signInWithOtp");
    assertThat(stateStore.snapshot().loading()).isFalse();
    assertThat(stateStore.snapshot().lastError()).isNull();
  }
}
