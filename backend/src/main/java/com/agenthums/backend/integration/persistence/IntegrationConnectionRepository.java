package com.agenthums.backend.integration.persistence;

import com.agenthums.backend.integration.domain.IntegrationConnection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface IntegrationConnectionRepository
    extends JpaRepository<IntegrationConnection, UUID> {

  Optional<IntegrationConnection> findByIdentityIdAndServiceKind(
      UUID identityId, String serviceKind);

  List<IntegrationConnection> findByIdentityIdOrderByServiceKindAsc(UUID identityId);
}
