package com.agenthums.backend.profile.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.profile")
public class ProfileProperties {

  private Duration storeTimeout = Duration.ofSeconds(5);
  private int maxPageSize = 100;
  private Cache cache = new Cache();

  public Duration getStoreTimeout() {
    return storeTimeout;
  }

  public void setStoreTimeout(Duration storeTimeout) {
    this.storeTimeout = storeTimeout;
  }

  public int getMaxPageSize() {
    return maxPageSize;
  }

  public void setMaxPageSize(int maxPageSize) {
    this.maxPageSize = maxPageSize;
  }

  public Cache getCache() {
    return cache;
  }

  public void setCache(Cache cache) {
    this.cache = cache;
  }

  public static class Cache {
    private Duration localTtl = Duration.ofMinutes(5);
    private long maximumSize = 5_000;

    public Duration getLocalTtl() {
      return localTtl;
    }

    public void setLocalTtl(Duration localTtl) {
      this.localTtl = localTtl;
    }

    public long getMaximumSize() {
      return maximumSize;
    }

    public void setMaximumSize(long maximumSize) {
      this.maximumSize = maximumSize;
    }
  }
}
