package com.agenthums.backend.auth.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.auth")
public class AuthProperties {

  public enum ProfileFailurePolicy {
    FAIL_OPEN,
    FAIL_CLOSED
  }

  private ProfileFailurePolicy profileFailurePolicy = ProfileFailurePolicy.FAIL_OPEN;
  private boolean initializeOnStartup = true;
  private String siteUrl = "http://localhost:4200";
  private int minPasswordLength = 6;
  private List<String> supportedProviders = List.of("github", "google", "discord");
  private Provider provider = new Provider();
  private SessionSettings session = new SessionSettings();

  public ProfileFailurePolicy getProfileFailurePolicy() {
    return profileFailurePolicy;
  }

  public void setProfileFailurePolicy(ProfileFailurePolicy profileFailurePolicy) {
    this.profileFailurePolicy = profileFailurePolicy;
  }

  public boolean isInitializeOnStartup() {
    return initializeOnStartup;
  }

  public void setInitializeOnStartup(boolean initializeOnStartup) {
    this.initializeOnStartup = initializeOnStartup;
  }

  public String getSiteUrl() {
    return siteUrl;
  }

  public void setSiteUrl(String siteUrl) {
    this.siteUrl = siteUrl;
  }

  public int getMinPasswordLength() {
    return minPasswordLength;
  }

  public void setMinPasswordLength(int minPasswordLength) {
    this.minPasswordLength = minPasswordLength;
  }

  public List<String> getSupportedProviders() {
    return supportedProviders;
  }

  public void setSupportedProviders(List<String> supportedProviders) {
    this.supportedProviders = supportedProviders;
  }

  public Provider getProvider() {
    return provider;
  }

  public void setProvider(Provider provider) {
    this.provider = provider;
  }

  public SessionSettings getSession() {
    return session;
  }

  public void setSession(SessionSettings session) {
    this.session = session;
  }

  /** Connection settings for the hosted identity provider. */
  public static class Provider {
    private String url = "http://localhost:54321";
    private String anonKey;
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration requestTimeout = Duration.ofSeconds(15);

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public String getAnonKey() {
      return anonKey;
    }

    public void setAnonKey(String anonKey) {
      this.anonKey = anonKey;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }

    public Duration getRequestTimeout() {
      return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
    }

    public String authBaseUrl() {
      String base = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
      return base + "/auth/v1";
    }
  }

  public static class SessionSettings {
    private Duration nearExpiryThreshold = Duration.ofMinutes(5);
    private Duration refreshCheckInterval = Duration.ofMinutes(1);
    private boolean refreshEnabled = true;

    public Duration getNearExpiryThreshold() {
      return nearExpiryThreshold;
    }

    public void setNearExpiryThreshold(Duration nearExpiryThreshold) {
      this.nearExpiryThreshold = nearExpiryThreshold;
    }

    public Duration getRefreshCheckInterval() {
      return refreshCheckInterval;
    }

    public void setRefreshCheckInterval(Duration refreshCheckInterval) {
      this.refreshCheckInterval = refreshCheckInterval;
    }

    public boolean isRefreshEnabled() {
      return refreshEnabled;
    }

    public void setRefreshEnabled(boolean refreshEnabled) {
      this.refreshEnabled = refreshEnabled;
    }
  }
}
