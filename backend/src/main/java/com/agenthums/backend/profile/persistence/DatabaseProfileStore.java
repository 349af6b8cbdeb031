package com.agenthums.backend.profile.persistence;

import com.agenthums.backend.profile.domain.ProfileRecord;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Component
public class DatabaseProfileStore implements ProfileStore {

  private static final String INSERT_SQL =
      """
      INSERT INTO user_profile (
          id, email, display_name, nickname, avatar_url, bio, preferences,
          is_active, created_at, updated_at)
      VALUES (
          :id, :email, :displayName, :nickname, :avatarUrl, :bio, CAST(:preferences AS jsonb),
          :active, :createdAt, :updatedAt)
      """;

  private final ProfileRecordRepository repository;
  private final NamedParameterJdbcTemplate jdbcTemplate;

  public DatabaseProfileStore(
      ProfileRecordRepository repository, NamedParameterJdbcTemplate jdbcTemplate) {
    this.repository = repository;
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public Mono<ProfileRecord> selectById(UUID id) {
    return Mono.fromCallable(() -> repository.findById(id).orElse(null))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @Override
  public Mono<ProfileRecord> insert(ProfileRecord record) {
    return Mono.fromCallable(() -> insertRow(record)).subscribeOn(Schedulers.boundedElastic());
  }

  @Override
  public Mono<ProfileRecord> update(ProfileRecord record) {
    return Mono.fromCallable(() -> repository.saveAndFlush(record))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @Override
  public Mono<List<ProfileRecord>> selectActive(int page, int size) {
    PageRequest request =
        PageRequest.of(
            Math.max(page, 0), Math.max(size, 1), Sort.by(Sort.Direction.DESC, "createdAt"));
    return Mono.fromCallable(() -> repository.findByActiveTrue(request).getContent())
        .subscribeOn(Schedulers.boundedElastic());
  }

  private ProfileRecord insertRow(ProfileRecord record) {
    Instant now = Instant.now();
    ProfileRecord stored = record.copy();
    stored.setCreatedAt(now);
    stored.setUpdatedAt(now);
    MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", stored.getId())
            .addValue("email", stored.getEmail())
            .addValue("displayName", stored.getDisplayName())
            .addValue("nickname", stored.getNickname())
            .addValue("avatarUrl", stored.getAvatarUrl())
            .addValue("bio", stored.getBio())
            .addValue("preferences", stored.getPreferences().toString())
            .addValue("active", stored.isActive())
            .addValue("createdAt", Timestamp.from(now))
            .addValue("updatedAt", Timestamp.from(now));
    jdbcTemplate.update(INSERT_SQL, params);
    return stored;
  }
}
