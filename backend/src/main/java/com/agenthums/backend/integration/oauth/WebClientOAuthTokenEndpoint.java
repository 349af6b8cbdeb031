package com.agenthums.backend.integration.oauth;

import com.agenthums.backend.auth.error.AuthErrorKind;
import com.agenthums.backend.auth.error.AuthErrorMapper;
import com.agenthums.backend.auth.error.AuthException;
import com.agenthums.backend.integration.config.IntegrationProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

/** RFC 6749 authorization code and refresh token grants against one authorization server. */
public class WebClientOAuthTokenEndpoint implements OAuthTokenEndpoint {

  private static final Logger log = LoggerFactory.getLogger(WebClientOAuthTokenEndpoint.class);

  private final String providerId;
  private final IntegrationProperties.Provider settings;
  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final Duration requestTimeout;

  public WebClientOAuthTokenEndpoint(
      String providerId,
      IntegrationProperties.Provider settings,
      WebClient webClient,
      ObjectMapper objectMapper,
      Duration requestTimeout) {
    this.providerId = providerId;
    this.settings = settings;
    this.webClient = webClient;
    this.objectMapper = objectMapper;
    this.requestTimeout = requestTimeout;
  }

  @Override
  public String providerId() {
    return providerId;
  }

  @Override
  public URI buildAuthorizationUri(OAuthAuthorizationRequest request) {
    UriComponentsBuilder builder =
        UriComponentsBuilder.fromUriString(settings.getAuthorizationUri())
            .queryParam("client_id", settings.getClientId())
            .queryParam("redirect_uri", request.redirectUri())
            .queryParam("response_type", "code")
            .queryParam("scope", String.join(" ", request.scopes()))
            .queryParam("state", request.state());
    settings.getAuthorizationParams().forEach(builder::queryParam);
    return builder.encode().build().toUri();
  }

  @Override
  public Mono<OAuthTokenResponse> exchangeCode(String code, String redirectUri) {
    MultiValueMap<String, String> form = clientCredentials();
    form.add("grant_type", "authorization_code");
    form.add("code", code);
    form.add("redirect_uri", redirectUri);
    return requestToken(form, "authorization_code");
  }

  @Override
  public Mono<OAuthTokenResponse> exchangeRefreshToken(String refreshToken) {
    MultiValueMap<String, String> form = clientCredentials();
    form.add("grant_type", "refresh_token");
    form.add("refresh_token", refreshToken);
    return requestToken(form, "refresh_token");
  }

  private Mono<OAuthTokenResponse> requestToken(MultiValueMap<String, String> form, String grant) {
    return webClient
        .post()
        .uri(settings.getTokenUri())
        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
        .accept(MediaType.APPLICATION_JSON)
        .body(BodyInserters.fromFormData(form))
        .retrieve()
        .bodyToMono(JsonNode.class)
        .timeout(requestTimeout)
        .map(this::parse)
        .onErrorMap(ex -> translate(ex, grant));
  }

  private OAuthTokenResponse parse(JsonNode node) {
    String accessToken = node.path("access_token").asText(null);
    if (!StringUtils.hasText(accessToken)) {
      throw new AuthException(
          AuthErrorKind.TOKEN_EXCHANGE_FAILED, "Token response carries no access token");
    }
    String scope = node.path("scope").asText("");
    List<String> scopes =
        StringUtils.hasText(scope)
            ? Arrays.stream(scope.trim().split("\\s+")).toList()
            : List.of();
    return new OAuthTokenResponse(
        accessToken,
        node.hasNonNull("refresh_token") ? node.get("refresh_token").asText() : null,
        node.hasNonNull("token_type") ? node.get("token_type").asText() : null,
        node.hasNonNull("expires_in") ? node.get("expires_in").asLong() : null,
        scopes);
  }

  private Throwable translate(Throwable failure, String grant) {
    if (failure instanceof AuthException) {
      return failure;
    }
    if (failure instanceof WebClientResponseException ex) {
      String description = describe(ex);
      log.warn(
          "oauth_token_request_failed provider={} grant={} status={} error={}",
          providerId,
          grant,
          ex.getStatusCode().value(),
          description);
      return new AuthException(AuthErrorKind.TOKEN_EXCHANGE_FAILED, description, ex);
    }
    return AuthErrorMapper.toException(failure, AuthErrorKind.TOKEN_EXCHANGE_FAILED);
  }

  private String describe(WebClientResponseException ex) {
    String body = ex.getResponseBodyAsString();
    if (StringUtils.hasText(body)) {
      try {
        JsonNode node = objectMapper.readTree(body);
        String error = node.path("error").asText("");
        String description = node.path("error_description").asText("");
        if (StringUtils.hasText(error) || StringUtils.hasText(description)) {
          return StringUtils.hasText(description) ? error + ": " + description : error;
        }
      } catch (JsonProcessingException parseError) {
        log.debug("Token error body is not JSON: {}", parseError.getMessage());
      }
    }
    return "Token endpoint answered " + ex.getStatusCode().value();
  }

  private MultiValueMap<String, String> clientCredentials() {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("client_id", settings.getClientId());
    form.add("client_secret", settings.getClientSecret());
    return form;
  }
}
