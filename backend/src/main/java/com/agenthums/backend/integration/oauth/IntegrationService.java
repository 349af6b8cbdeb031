package com.agenthums.backend.integration.oauth;

import java.util.List;

/** A service kind bound to the token endpoint and scopes used to connect it. */
public record IntegrationService(
    String serviceKind, OAuthTokenEndpoint endpoint, List<String> scopes, String redirectUri) {

  public IntegrationService {
    scopes = scopes != null ? List.copyOf(scopes) : List.of();
  }
}
