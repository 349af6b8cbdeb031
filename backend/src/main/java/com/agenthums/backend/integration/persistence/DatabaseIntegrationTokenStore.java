package com.agenthums.backend.integration.persistence;

import com.agenthums.backend.integration.domain.IntegrationConnection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Component
public class DatabaseIntegrationTokenStore implements IntegrationTokenStore {

  private static final String UPSERT_SQL =
      """
      INSERT INTO user_integration (
          id, identity_id, service_kind, access_token, refresh_token, token_type, expires_at,
          scopes, connected, created_at, updated_at)
      VALUES (
          :id, :identityId, :serviceKind, :accessToken, :refreshToken, :tokenType, :expiresAt,
          CAST(:scopes AS jsonb), :connected, :now, :now)
      ON CONFLICT (identity_id, service_kind) DO UPDATE SET
          access_token = EXCLUDED.access_token,
          refresh_token = EXCLUDED.refresh_token,
          token_type = EXCLUDED.token_type,
          expires_at = EXCLUDED.expires_at,
          scopes = EXCLUDED.scopes,
          connected = EXCLUDED.connected,
          updated_at = EXCLUDED.updated_at
      """;

  private final IntegrationConnectionRepository repository;
  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public DatabaseIntegrationTokenStore(
      IntegrationConnectionRepository repository,
      NamedParameterJdbcTemplate jdbcTemplate,
      ObjectMapper objectMapper) {
    this.repository = repository;
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  @Override
  public Mono<IntegrationConnection> selectByIdentityAndService(
      UUID identityId, String serviceKind) {
    return Mono.fromCallable(
            () -> repository.findByIdentityIdAndServiceKind(identityId, serviceKind).orElse(null))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @Override
  public Mono<List<IntegrationConnection>> selectByIdentity(UUID identityId) {
    return Mono.fromCallable(() -> repository.findByIdentityIdOrderByServiceKindAsc(identityId))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @Override
  public Mono<IntegrationConnection> upsert(IntegrationConnection connection) {
    return Mono.fromCallable(() -> upsertRow(connection)).subscribeOn(Schedulers.boundedElastic());
  }

  private IntegrationConnection upsertRow(IntegrationConnection connection) {
    MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", connection.getId() != null ? connection.getId() : UUID.randomUUID())
            .addValue("identityId", connection.getIdentityId())
            .addValue("serviceKind", connection.getServiceKind())
            .addValue("accessToken", connection.getAccessToken())
            .addValue("refreshToken", connection.getRefreshToken())
            .addValue("tokenType", connection.getTokenType())
            .addValue(
                "expiresAt",
                connection.getExpiresAt() != null
                    ? Timestamp.from(connection.getExpiresAt())
                    : null,
                Types.TIMESTAMP)
            .addValue("scopes", writeScopes(connection.getScopes()))
            .addValue("connected", connection.isConnected())
            .addValue("now", Timestamp.from(Instant.now()));
    jdbcTemplate.update(UPSERT_SQL, params);
    return repository
        .findByIdentityIdAndServiceKind(connection.getIdentityId(), connection.getServiceKind())
        .orElseThrow(
            () -> new EmptyResultDataAccessException("Upserted integration row is missing", 1));
  }

  private String writeScopes(List<String> scopes) {
    try {
      return objectMapper.writeValueAsString(scopes != null ? scopes : List.of());
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize integration scopes", ex);
    }
  }
}
