package com.agenthums.backend.integration.persistence;

import com.agenthums.backend.integration.domain.IntegrationConnection;
import java.util.List;
import java.util.UUID;
import reactor.core.publisher.Mono;

/** Storage of integration credentials, keyed by (identity, service kind). */
public interface IntegrationTokenStore {

  /** Completes empty when no row exists. */
  Mono<IntegrationConnection> selectByIdentityAndService(UUID identityId, String serviceKind);

  Mono<List<IntegrationConnection>> selectByIdentity(UUID identityId);

  /** Inserts or replaces the row for the connection's key and emits the stored row. */
  Mono<IntegrationConnection> upsert(IntegrationConnection connection);
}
