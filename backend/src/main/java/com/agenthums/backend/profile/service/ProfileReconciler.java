package com.agenthums.backend.profile.service;

import com.agenthums.backend.auth.domain.ProviderUser;
import com.agenthums.backend.auth.domain.UserPreferences;
import com.agenthums.backend.auth.error.AuthErrorKind;
import com.agenthums.backend.auth.error.AuthException;
import com.agenthums.backend.auth.telemetry.CredentialMetrics;
import com.agenthums.backend.profile.config.ProfileProperties;
import com.agenthums.backend.profile.domain.ProfileRecord;
import com.agenthums.backend.profile.persistence.ProfileStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

/**
 * Makes sure a profile row exists for an identity. Safe to call any number of times, from any
 * number of places at once: a lost insert race counts as success.
 */
@Service
public class ProfileReconciler {

  private static final Logger log = LoggerFactory.getLogger(ProfileReconciler.class);

  static final String SOURCE_RECONCILE = "session";
  static final String SOURCE_SIGN_UP = "sign_up";

  private final ProfileStore profileStore;
  private final ProfileEventLogger eventLogger;
  private final CredentialMetrics metrics;
  private final Duration storeTimeout;
  private final Cache<UUID, ProfileRecord> confirmedProfiles;

  public ProfileReconciler(
      ProfileStore profileStore,
      ProfileEventLogger eventLogger,
      CredentialMetrics metrics,
      ProfileProperties properties) {
    this.profileStore = profileStore;
    this.eventLogger = eventLogger;
    this.metrics = metrics;
    this.storeTimeout = properties.getStoreTimeout();
    this.confirmedProfiles =
        Caffeine.newBuilder()
            .expireAfterWrite(properties.getCache().getLocalTtl())
            .maximumSize(properties.getCache().getMaximumSize())
            .build();
  }

  /**
   * Emits the existing or newly created profile. Fails with {@code PROFILE_UNAVAILABLE} when the
   * store cannot be reached.
   */
  public Mono<ProfileRecord> ensure(ProviderUser user) {
    return Mono.defer(
        () -> {
          ProfileRecord cached = confirmedProfiles.getIfPresent(user.id());
          if (cached != null) {
            metrics.recordProfileReconcile("cached");
            return Mono.just(cached.copy());
          }
          return profileStore
              .selectById(user.id())
              .doOnNext(found -> metrics.recordProfileReconcile("found"))
              .switchIfEmpty(Mono.defer(() -> insert(newRecord(user, null), SOURCE_RECONCILE)))
              .timeout(storeTimeout)
              .doOnNext(this::remember)
              .onErrorMap(ex -> unavailable(user.id(), ex));
        });
  }

  /** First-writer insert issued right after sign-up. */
  public Mono<ProfileRecord> createFromSignUp(ProviderUser user, @Nullable String displayName) {
    return Mono.defer(() -> insert(newRecord(user, displayName), SOURCE_SIGN_UP))
        .timeout(storeTimeout)
        .doOnNext(this::remember)
        .onErrorMap(ex -> unavailable(user.id(), ex));
  }

  public void evict(UUID identityId) {
    confirmedProfiles.invalidate(identityId);
  }

  private Mono<ProfileRecord> insert(ProfileRecord candidate, String source) {
    return profileStore
        .insert(candidate)
        .doOnNext(
            created -> {
              metrics.recordProfileReconcile("created");
              eventLogger.profileCreated(created, source);
            })
        .onErrorResume(
            DuplicateKeyException.class,
            ex -> {
              metrics.recordProfileReconcile("conflict");
              eventLogger.profileCreateConflict(candidate, source);
              return profileStore
                  .selectById(candidate.getId())
                  .defaultIfEmpty(candidate)
                  .onErrorResume(
                      readError -> {
                        log.debug(
                            "Profile {} exists but could not be re-read: {}",
                            candidate.getId(),
                            readError.getMessage());
                        return Mono.just(candidate);
                      });
            });
  }

  private ProfileRecord newRecord(ProviderUser user, @Nullable String displayName) {
    String name =
        StringUtils.hasText(displayName)
            ? displayName.trim()
            : ProfileFieldExtractors.displayName(user);
    ProfileRecord record = new ProfileRecord(user.id(), name);
    record.setEmail(user.email());
    ProfileFieldExtractors.avatarUrl(user).ifPresent(record::setAvatarUrl);
    record.setPreferences(UserPreferences.defaults().toJson());
    record.setActive(true);
    return record;
  }

  private void remember(ProfileRecord record) {
    confirmedProfiles.put(record.getId(), record.copy());
  }

  private Throwable unavailable(UUID identityId, Throwable failure) {
    metrics.recordProfileReconcile("failed");
    log.warn("profile_reconcile_failed identityId={} error={}", identityId, failure.toString());
    return new AuthException(
        AuthErrorKind.PROFILE_UNAVAILABLE, "Profile store is unavailable", failure);
  }
}
