package com.agenthums.backend.auth.config;

import com.agenthums.backend.auth.provider.GoTrueIdentityProviderClient;
import com.agenthums.backend.auth.provider.IdentityProviderClient;
import com.agenthums.backend.auth.telemetry.CredentialMetrics;
import com.agenthums.backend.common.http.ReactorClientHttpConnectorBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(AuthProperties.class)
public class AuthConfiguration {

  private static final Logger log = LoggerFactory.getLogger(AuthConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public CredentialMetrics credentialMetrics(ObjectProvider<MeterRegistry> meterRegistryProvider) {
    MeterRegistry registry = meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new);
    return new CredentialMetrics(registry);
  }

  @Bean
  public WebClient identityProviderWebClient(AuthProperties properties) {
    AuthProperties.Provider provider = properties.getProvider();
    WebClient.Builder builder =
        WebClient.builder()
            .baseUrl(provider.authBaseUrl())
            .defaultHeader(HttpHeaders.ACCEPT, "application/json")
            .clientConnector(
                new ReactorClientHttpConnectorBuilder()
                    .connectTimeout(provider.getConnectTimeout())
                    .readTimeout(provider.getRequestTimeout())
                    .build());
    if (StringUtils.hasText(provider.getAnonKey())) {
      builder.defaultHeader("apikey", provider.getAnonKey().trim());
    } else {
      log.warn("app.auth.provider.anon-key is not set; identity provider calls will be rejected");
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean(IdentityProviderClient.class)
  public IdentityProviderClient identityProviderClient(
      WebClient identityProviderWebClient,
      ObjectMapper objectMapper,
      AuthProperties properties,
      Clock clock) {
    return new GoTrueIdentityProviderClient(
        identityProviderWebClient,
        objectMapper,
        properties.getProvider().authBaseUrl(),
        properties.getProvider().getRequestTimeout(),
        clock);
  }
}
