package com.agenthums.backend.auth.session;

import com.agenthums.backend.auth.config.AuthProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class SessionLifecycle {

  private static final Logger log = LoggerFactory.getLogger(SessionLifecycle.class);

  private final SessionManager sessionManager;
  private final AuthProperties properties;

  public SessionLifecycle(SessionManager sessionManager, AuthProperties properties) {
    this.sessionManager = sessionManager;
    this.properties = properties;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (!properties.isInitializeOnStartup()) {
      log.info("Session initialization on startup is disabled");
      return;
    }
    sessionManager
        .initialize()
        .subscribe(
            state ->
                log.info(
                    "session_initialized authenticated={} error={}",
                    state.isAuthenticated(),
                    state.lastError() != null ? state.lastError().kind() : null),
            ex -> log.error("Session initialization failed", ex));
  }

  @PreDestroy
  public void shutdown() {
    sessionManager.shutdown();
  }
}
