package com.agenthums.backend.profile.persistence;

import com.agenthums.backend.profile.domain.ProfileRecord;
import java.util.List;
import java.util.UUID;
import reactor.core.publisher.Mono;

/**
 * Durable profile storage. {@link #insert} signals {@link
 * org.springframework.dao.DuplicateKeyException} when a row with the same id already exists.
 */
public interface ProfileStore {

  /** Completes empty when no row exists. */
  Mono<ProfileRecord> selectById(UUID id);

  Mono<ProfileRecord> insert(ProfileRecord record);

  Mono<ProfileRecord> update(ProfileRecord record);

  /** Active profiles, newest first. */
  Mono<List<ProfileRecord>> selectActive(int page, int size);
}
