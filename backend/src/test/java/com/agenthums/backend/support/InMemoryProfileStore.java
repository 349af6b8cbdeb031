package com.agenthums.backend.support;

import com.agenthums.backend.profile.domain.ProfileRecord;
import com.agenthums.backend.profile.persistence.ProfileStore;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.dao.DuplicateKeyException;
import reactor.core.publisher.Mono;

/** Stores copies, so callers never share instances with the store. */
public class InMemoryProfileStore implements ProfileStore {

  private final ConcurrentMap<UUID, ProfileRecord> rows = new ConcurrentHashMap<>();
  private final AtomicInteger insertAttempts = new AtomicInteger();
  private final AtomicReference<RuntimeException> failure = new AtomicReference<>();

  @Override
  public Mono<ProfileRecord> selectById(UUID id) {
    return Mono.defer(
        () -> {
          failIfBroken();
          ProfileRecord row = rows.get(id);
          return row != null ? Mono.just(row.copy()) : Mono.empty();
        });
  }

  @Override
  public Mono<ProfileRecord> insert(ProfileRecord record) {
    return Mono.fromCallable(
        () -> {
          insertAttempts.incrementAndGet();
          failIfBroken();
          ProfileRecord stored = record.copy();
          Instant now = Instant.now();
          stored.setCreatedAt(now);
          stored.setUpdatedAt(now);
          if (rows.putIfAbsent(stored.getId(), stored) != null) {
            throw new DuplicateKeyException("user_profile_pkey " + stored.getId());
          }
          return stored.copy();
        });
  }

  @Override
  public Mono<ProfileRecord> update(ProfileRecord record) {
    return Mono.fromCallable(
        () -> {
          failIfBroken();
          ProfileRecord stored = record.copy();
          stored.setUpdatedAt(Instant.now());
          rows.put(stored.getId(), stored);
          return stored.copy();
        });
  }

  @Override
  public Mono<List<ProfileRecord>> selectActive(int page, int size) {
    return Mono.fromCallable(
        () ->
            rows.values().stream()
                .filter(ProfileRecord::isActive)
                .sorted(Comparator.comparing(ProfileRecord::getCreatedAt).reversed())
                .skip((long) page * size)
                .limit(size)
                .map(ProfileRecord::copy)
                .toList());
  }

  public void put(ProfileRecord record) {
    ProfileRecord stored = record.copy();
    if (stored.getCreatedAt() == null) {
      stored.setCreatedAt(Instant.now());
      stored.setUpdatedAt(stored.getCreatedAt());
    }
    rows.put(stored.getId(), stored);
  }

  public ProfileRecord row(UUID id) {
    ProfileRecord row = rows.get(id);
    return row != null ? row.copy() : null;
  }

  public int size() {
    return rows.size();
  }

  public int insertAttempts() {
    return insertAttempts.get();
  }

  /** Every later call fails with {@code ex}; pass null to recover. */
  public void failWith(RuntimeException ex) {
    failure.set(ex);
  }

  private void failIfBroken() {
    RuntimeException ex = failure.get();
    if (ex != null) {
      throw ex;
    }
  }
}
