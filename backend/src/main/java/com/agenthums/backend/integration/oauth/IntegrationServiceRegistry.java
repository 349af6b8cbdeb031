package com.agenthums.backend.integration.oauth;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class IntegrationServiceRegistry {

  private final Map<String, IntegrationService> services = new ConcurrentHashMap<>();

  public void register(IntegrationService service) {
    services.put(normalize(service.serviceKind()), service);
  }

  public Optional<IntegrationService> find(String serviceKind) {
    if (serviceKind == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(services.get(normalize(serviceKind)));
  }

  public Collection<String> serviceKinds() {
    return Collections.unmodifiableSet(services.keySet());
  }

  private static String normalize(String serviceKind) {
    return serviceKind.trim().toLowerCase(Locale.ROOT);
  }
}
