package com.agenthums.backend.profile.service;

import com.agenthums.backend.auth.domain.AuthState;
import com.agenthums.backend.auth.domain.Identity;
import com.agenthums.backend.auth.domain.Session;
import com.agenthums.backend.auth.domain.UserPreferences;
import com.agenthums.backend.auth.error.AuthErrorKind;
import com.agenthums.backend.auth.error.AuthException;
import com.agenthums.backend.auth.provider.IdentityProviderClient;
import com.agenthums.backend.auth.provider.IdentityProviderClient.UserAttributes;
import com.agenthums.backend.auth.session.SessionManager;
import com.agenthums.backend.auth.state.AuthStateStore;
import com.agenthums.backend.profile.config.ProfileProperties;
import com.agenthums.backend.profile.domain.ProfileRecord;
import com.agenthums.backend.profile.persistence.ProfileStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

/** Profile reads and edits for the current actor, plus the admin listing. */
@Service
public class ProfileService {

  private static final Logger log = LoggerFactory.getLogger(ProfileService.class);

  private final ProfileStore profileStore;
  private final ProfileReconciler profileReconciler;
  private final SessionManager sessionManager;
  private final AuthStateStore stateStore;
  private final IdentityProviderClient identityProvider;
  private final ProfileEventLogger eventLogger;
  private final Duration storeTimeout;
  private final int maxPageSize;

  public ProfileService(
      ProfileStore profileStore,
      ProfileReconciler profileReconciler,
      SessionManager sessionManager,
      AuthStateStore stateStore,
      IdentityProviderClient identityProvider,
      ProfileEventLogger eventLogger,
      ProfileProperties properties) {
    this.profileStore = profileStore;
    this.profileReconciler = profileReconciler;
    this.sessionManager = sessionManager;
    this.stateStore = stateStore;
    this.identityProvider = identityProvider;
    this.eventLogger = eventLogger;
    this.storeTimeout = properties.getStoreTimeout();
    this.maxPageSize = properties.getMaxPageSize();
  }

  public Mono<Identity> currentIdentity() {
    return Mono.fromSupplier(() -> requireActor().identity());
  }

  /** Completes empty when the profile does not exist. */
  public Mono<ProfileRecord> getProfile(UUID identityId) {
    return profileStore.selectById(identityId).timeout(storeTimeout).onErrorMap(this::unavailable);
  }

  public Mono<Boolean> profileExists(UUID identityId) {
    return getProfile(identityId).map(profile -> true).defaultIfEmpty(false);
  }

  public Mono<Identity> updateProfile(ProfileUpdateCommand command) {
    return Mono.defer(
        () -> {
          Actor actor = requireActor();
          validate(command);
          return loadOwnProfile(actor)
              .flatMap(
                  profile -> {
                    apply(profile, command);
                    return profileStore.update(profile).timeout(storeTimeout);
                  })
              .onErrorMap(this::unavailable)
              .flatMap(
                  updated -> {
                    profileReconciler.evict(updated.getId());
                    eventLogger.profileUpdated(updated);
                    return syncProviderMetadata(command).then(republish(actor.session()));
                  });
        });
  }

  /** Shallow-merges {@code patch} into the stored preferences. */
  public Mono<Identity> updatePreferences(JsonNode patch) {
    return Mono.defer(
        () -> {
          Actor actor = requireActor();
          if (patch == null || !patch.isObject()) {
            throw new AuthException(
                AuthErrorKind.VALIDATION_FAILED, "Preferences must be a JSON object");
          }
          return loadOwnProfile(actor)
              .flatMap(
                  profile -> {
                    UserPreferences merged =
                        UserPreferences.fromJson(profile.getPreferences()).merge(patch);
                    profile.setPreferences(merged.toJson());
                    return profileStore.update(profile).timeout(storeTimeout);
                  })
              .onErrorMap(this::unavailable)
              .flatMap(
                  updated -> {
                    profileReconciler.evict(updated.getId());
                    eventLogger.profileUpdated(updated);
                    return republish(actor.session());
                  });
        });
  }

  /** Soft delete: the row stays, flagged inactive. */
  public Mono<Void> deactivateCurrentProfile() {
    return Mono.defer(
        () -> {
          Actor actor = requireActor();
          return loadOwnProfile(actor)
              .flatMap(
                  profile -> {
                    profile.setActive(false);
                    return profileStore.update(profile).timeout(storeTimeout);
                  })
              .onErrorMap(this::unavailable)
              .doOnNext(
                  updated -> {
                    profileReconciler.evict(updated.getId());
                    eventLogger.profileDeactivated(updated);
                  })
              .then();
        });
  }

  public Mono<List<ProfileRecord>> listActiveProfiles(int page, int size) {
    if (page < 0 || size < 1 || size > maxPageSize) {
      return Mono.error(
          new AuthException(
              AuthErrorKind.VALIDATION_FAILED,
              "page must be >= 0 and size between 1 and " + maxPageSize));
    }
    return profileStore
        .selectActive(page, size)
        .timeout(storeTimeout)
        .onErrorMap(this::unavailable);
  }

  private Mono<ProfileRecord> loadOwnProfile(Actor actor) {
    return profileStore
        .selectById(actor.identity().id())
        .timeout(storeTimeout)
        .switchIfEmpty(Mono.defer(() -> profileReconciler.ensure(actor.session().user())));
  }

  private Mono<Identity> republish(Session session) {
    return sessionManager
        .reconcileAndPublish(session)
        .map(AuthState::identity)
        .switchIfEmpty(Mono.error(() -> AuthException.of(AuthErrorKind.NOT_AUTHENTICATED)));
  }

  private Mono<Void> syncProviderMetadata(ProfileUpdateCommand command) {
    ObjectNode data = JsonNodeFactory.instance.objectNode();
    if (StringUtils.hasText(command.displayName())) {
      data.put("display_name", command.displayName().trim());
    }
    if (command.avatarUrl() != null) {
      data.put("avatar_url", command.avatarUrl().trim());
    }
    if (command.nickname() != null) {
      data.put("nickname", command.nickname().trim());
    }
    if (data.isEmpty()) {
      return Mono.empty();
    }
    return identityProvider
        .updateUser(UserAttributes.data(data))
        .then()
        .onErrorResume(
            ex -> {
              // the profile row is the source of truth, provider metadata is a mirror
              log.warn("profile_metadata_sync_failed error={}", ex.getMessage());
              return Mono.empty();
            });
  }

  private void apply(ProfileRecord profile, ProfileUpdateCommand command) {
    if (StringUtils.hasText(command.displayName())) {
      profile.setDisplayName(command.displayName().trim());
    }
    if (command.nickname() != null) {
      profile.setNickname(blankToNull(command.nickname()));
    }
    if (command.avatarUrl() != null) {
      profile.setAvatarUrl(blankToNull(command.avatarUrl()));
    }
    if (command.bio() != null) {
      profile.setBio(blankToNull(command.bio()));
    }
    if (command.preferences() != null) {
      profile.setPreferences(
          UserPreferences.fromJson(profile.getPreferences()).merge(command.preferences()).toJson());
    }
  }

  private void validate(ProfileUpdateCommand command) {
    if (command.displayName() != null && !StringUtils.hasText(command.displayName())) {
      throw new AuthException(AuthErrorKind.VALIDATION_FAILED, "Display name must not be blank");
    }
    if (StringUtils.hasText(command.avatarUrl()) && !isHttpUrl(command.avatarUrl().trim())) {
      throw new AuthException(AuthErrorKind.VALIDATION_FAILED, "Avatar URL is not a valid URL");
    }
    if (command.preferences() != null && !command.preferences().isObject()) {
      throw new AuthException(
          AuthErrorKind.VALIDATION_FAILED, "Preferences must be a JSON object");
    }
  }

  private static boolean isHttpUrl(String value) {
    try {
      URI uri = new URI(value);
      String scheme = uri.getScheme();
      return uri.getHost() != null
          && scheme != null
          && ("http".equals(scheme.toLowerCase(Locale.ROOT))
              || "https".equals(scheme.toLowerCase(Locale.ROOT)));
    } catch (URISyntaxException ex) {
      return false;
    }
  }

  @Nullable
  private static String blankToNull(String value) {
    return StringUtils.hasText(value) ? value.trim() : null;
  }

  private Actor requireActor() {
    AuthState state = stateStore.snapshot();
    if (state.identity() == null || state.session() == null) {
      throw AuthException.of(AuthErrorKind.NOT_AUTHENTICATED);
    }
    return new Actor(state.identity(), state.session());
  }

  private Throwable unavailable(Throwable failure) {
    if (failure instanceof AuthException) {
      return failure;
    }
    AuthErrorKind kind =
        failure instanceof TimeoutException
            ? AuthErrorKind.TIMEOUT
            : AuthErrorKind.PROFILE_UNAVAILABLE;
    return new AuthException(kind, kind.defaultMessage(), failure);
  }

  private record Actor(Identity identity, Session session) {}
}
