package com.agenthums.backend.integration.config;

import com.agenthums.backend.common.http.ReactorClientHttpConnectorBuilder;
import com.agenthums.backend.integration.oauth.IntegrationService;
import com.agenthums.backend.integration.oauth.IntegrationServiceRegistry;
import com.agenthums.backend.integration.oauth.OAuthTokenEndpoint;
import com.agenthums.backend.integration.oauth.WebClientOAuthTokenEndpoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(IntegrationProperties.class)
public class IntegrationConfiguration {

  private static final Logger log = LoggerFactory.getLogger(IntegrationConfiguration.class);

  @Bean
  public WebClient integrationOAuthWebClient(IntegrationProperties properties) {
    return WebClient.builder()
        .clientConnector(
            new ReactorClientHttpConnectorBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .readTimeout(properties.getRequestTimeout())
                .build())
        .build();
  }

  @Bean
  public IntegrationServiceRegistry integrationServiceRegistry(
      IntegrationProperties properties,
      WebClient integrationOAuthWebClient,
      ObjectMapper objectMapper) {
    IntegrationServiceRegistry registry = new IntegrationServiceRegistry();
    Map<String, OAuthTokenEndpoint> endpoints = new HashMap<>();
    properties
        .getServices()
        .forEach(
            (serviceKind, service) -> {
              IntegrationProperties.Provider provider =
                  properties.getProviders().get(service.getProvider());
              if (provider == null || !StringUtils.hasText(provider.getTokenUri())) {
                log.warn(
                    "Integration service {} references unknown provider {}",
                    serviceKind,
                    service.getProvider());
                return;
              }
              if (!StringUtils.hasText(provider.getClientId())) {
                log.warn(
                    "Integration provider {} has no client id configured", service.getProvider());
              }
              OAuthTokenEndpoint endpoint =
                  endpoints.computeIfAbsent(
                      service.getProvider(),
                      providerId ->
                          new WebClientOAuthTokenEndpoint(
                              providerId,
                              provider,
                              integrationOAuthWebClient,
                              objectMapper,
                              properties.getRequestTimeout()));
              registry.register(
                  new IntegrationService(
                      serviceKind, endpoint, service.getScopes(), provider.getRedirectUri()));
            });
    log.info("Registered integration services {}", registry.serviceKinds());
    return registry;
  }
}
