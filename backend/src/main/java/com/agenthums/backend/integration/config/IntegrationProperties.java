package com.agenthums.backend.integration.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.integrations")
public class IntegrationProperties {

  private Duration requestTimeout = Duration.ofSeconds(15);
  private Duration connectTimeout = Duration.ofSeconds(5);
  private Duration expirySkew = Duration.ofSeconds(30);
  private Map<String, Provider> providers = new LinkedHashMap<>();
  private Map<String, Service> services = new LinkedHashMap<>();

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public void setRequestTimeout(Duration requestTimeout) {
    this.requestTimeout = requestTimeout;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  public Duration getExpirySkew() {
    return expirySkew;
  }

  public void setExpirySkew(Duration expirySkew) {
    this.expirySkew = expirySkew;
  }

  public Map<String, Provider> getProviders() {
    return providers;
  }

  public void setProviders(Map<String, Provider> providers) {
    this.providers = providers;
  }

  public Map<String, Service> getServices() {
    return services;
  }

  public void setServices(Map<String, Service> services) {
    this.services = services;
  }

  /** OAuth client registration at a third-party authorization server. */
  public static class Provider {
    private String clientId;
    private String clientSecret;
    private String authorizationUri;
    private String tokenUri;
    private String redirectUri;
    private Map<String, String> authorizationParams = new LinkedHashMap<>();

    public String getClientId() {
      return clientId;
    }

    public void setClientId(String clientId) {
      this.clientId = clientId;
    }

    public String getClientSecret() {
      return clientSecret;
    }

    public void setClientSecret(String clientSecret) {
      this.clientSecret = clientSecret;
    }

    public String getAuthorizationUri() {
      return authorizationUri;
    }

    public void setAuthorizationUri(String authorizationUri) {
      this.authorizationUri = authorizationUri;
    }

    public String getTokenUri() {
      return tokenUri;
    }

    public void setTokenUri(String tokenUri) {
      this.tokenUri = tokenUri;
    }

    public String getRedirectUri() {
      return redirectUri;
    }

    public void setRedirectUri(String redirectUri) {
      this.redirectUri = redirectUri;
    }

    public Map<String, String> getAuthorizationParams() {
      return authorizationParams;
    }

    public void setAuthorizationParams(Map<String, String> authorizationParams) {
      this.authorizationParams = authorizationParams;
    }
  }

  /** A connectable service kind and the scopes it asks for. */
  public static class Service {
    private String provider;
    private List<String> scopes = List.of();

    public String getProvider() {
      return provider;
    }

    public void setProvider(String provider) {
      this.provider = provider;
    }

    public List<String> getScopes() {
      return scopes;
    }

    public void setScopes(List<String> scopes) {
      this.scopes = scopes;
    }
  }
}
