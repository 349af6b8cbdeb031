package com.agenthums.backend.integration.oauth;

import java.net.URI;
import reactor.core.publisher.Mono;

public interface OAuthTokenEndpoint {

  String providerId();

  URI buildAuthorizationUri(OAuthAuthorizationRequest request);

  Mono<OAuthTokenResponse> exchangeCode(String code, String redirectUri);

  Mono<OAuthTokenResponse> exchangeRefreshToken(String refreshToken);
}
