package com.agenthums.backend.auth.session;

import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically refreshes the session ahead of expiry. At most one check runs at a time. */
@Component
@ConditionalOnProperty(
    prefix = "app.auth.session",
    name = "refresh-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SessionRefreshScheduler {

  private static final Logger log = LoggerFactory.getLogger(SessionRefreshScheduler.class);

  private final SessionManager sessionManager;
  private final AtomicBoolean running = new AtomicBoolean();

  public SessionRefreshScheduler(SessionManager sessionManager) {
    this.sessionManager = sessionManager;
  }

  @Scheduled(
      fixedDelayString = "${app.auth.session.refresh-check-interval:PT1M}",
      initialDelayString = "${app.auth.session.refresh-check-interval:PT1M}")
  public void checkSession() {
    if (!sessionManager.isNearExpiry()) {
      return;
    }
    if (!running.compareAndSet(false, true)) {
      log.trace("Session refresh already in progress");
      return;
    }
    sessionManager
        .refreshIfNeeded()
        .doFinally(signal -> running.set(false))
        .subscribe(
            state ->
                log.debug(
                    "Session refresh check done authenticated={} error={}",
                    state.isAuthenticated(),
                    state.lastError() != null ? state.lastError().kind() : null),
            ex -> log.error("Session refresh check failed", ex));
  }
}
