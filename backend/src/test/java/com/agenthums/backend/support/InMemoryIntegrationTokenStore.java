package com.agenthums.backend.support;

import com.agenthums.backend.integration.domain.IntegrationConnection;
import com.agenthums.backend.integration.persistence.IntegrationTokenStore;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import reactor.core.publisher.Mono;

public class InMemoryIntegrationTokenStore implements IntegrationTokenStore {

  private record Key(UUID identityId, String serviceKind) {}

  private final ConcurrentMap<Key, IntegrationConnection> rows = new ConcurrentHashMap<>();
  private final AtomicInteger upserts = new AtomicInteger();

  @Override
  public Mono<IntegrationConnection> selectByIdentityAndService(
      UUID identityId, String serviceKind) {
    return Mono.defer(
        () -> {
          IntegrationConnection row = rows.get(new Key(identityId, serviceKind));
          return row != null ? Mono.just(row.copy()) : Mono.empty();
        });
  }

  @Override
  public Mono<List<IntegrationConnection>> selectByIdentity(UUID identityId) {
    return Mono.fromCallable(
        () ->
            rows.values().stream()
                .filter(row -> row.getIdentityId().equals(identityId))
                .sorted(Comparator.comparing(IntegrationConnection::getServiceKind))
                .map(IntegrationConnection::copy)
                .toList());
  }

  @Override
  public Mono<IntegrationConnection> upsert(IntegrationConnection connection) {
    return Mono.fromCallable(
        () -> {
          upserts.incrementAndGet();
          Key key = new Key(connection.getIdentityId(), connection.getServiceKind());
          Instant now = Instant.now();
          IntegrationConnection stored =
              rows.compute(
                  key,
                  (k, existing) -> {
                    IntegrationConnection next = connection.copy();
                    if (existing != null) {
                      next.setId(existing.getId());
                      next.setCreatedAt(existing.getCreatedAt());
                    } else {
                      next.setCreatedAt(now);
                    }
                    next.setUpdatedAt(now);
                    return next;
                  });
          return stored.copy();
        });
  }

  public void put(IntegrationConnection connection) {
    IntegrationConnection stored = connection.copy();
    if (stored.getCreatedAt() == null) {
      stored.setCreatedAt(Instant.now());
      stored.setUpdatedAt(stored.getCreatedAt());
    }
    rows.put(new Key(stored.getIdentityId(), stored.getServiceKind()), stored);
  }

  public IntegrationConnection row(UUID identityId, String serviceKind) {
    IntegrationConnection row = rows.get(new Key(identityId, serviceKind));
    return row != null ? row.copy() : null;
  }

  public int size() {
    return rows.size();
  }

  public int upserts() {
    return upserts.get();
  }
}
