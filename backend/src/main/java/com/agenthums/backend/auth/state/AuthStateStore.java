package com.agenthums.backend.auth.state;

import com.agenthums.backend.auth.domain.AuthState;
import com.agenthums.backend.auth.domain.AuthStatePatch;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

/**
 * Single source of truth for the authentication state.
 *
 * <p>Mutations from different threads are serialized by one lock. Subscribers are notified
 * synchronously on the mutating thread; an update issued from inside a notification is queued
 * and applied once the current notification round has finished, so every subscriber sees the
 * states in the same order.
 */
@Component
public class AuthStateStore {

  private static final Logger log = LoggerFactory.getLogger(AuthStateStore.class);

  private final CredentialStore credentialStore;
  private final List<Consumer<AuthState>> subscribers = new CopyOnWriteArrayList<>();
  private final ReentrantLock mutationLock = new ReentrantLock();
  private final Deque<AuthStatePatch> pendingPatches = new ArrayDeque<>();

  public AuthStateStore(CredentialStore credentialStore) {
    this.credentialStore = credentialStore;
  }

  public AuthState snapshot() {
    return credentialStore.current();
  }

  /** Delivers the current state immediately, then every later state until disposed. */
  public Disposable subscribe(Consumer<AuthState> listener) {
    Objects.requireNonNull(listener, "listener");
    Consumer<AuthState> registration = state -> listener.accept(state);
    runExclusive(
        () -> {
          deliver(registration, credentialStore.current());
          subscribers.add(registration);
        });
    return () -> subscribers.remove(registration);
  }

  public Flux<AuthState> changes() {
    return Flux.create(
        sink -> {
          Disposable registration = subscribe(sink::next);
          sink.onDispose(registration);
        });
  }

  public void update(AuthStatePatch patch) {
    Objects.requireNonNull(patch, "patch");
    if (mutationLock.isHeldByCurrentThread()) {
      pendingPatches.addLast(patch);
      return;
    }
    runExclusive(() -> apply(patch));
  }

  private void runExclusive(Runnable action) {
    mutationLock.lock();
    try {
      action.run();
      if (mutationLock.getHoldCount() == 1) {
        AuthStatePatch pending;
        while ((pending = pendingPatches.pollFirst()) != null) {
          apply(pending);
        }
      }
    } finally {
      mutationLock.unlock();
    }
  }

  private void apply(AuthStatePatch patch) {
    AuthState next = credentialStore.current().apply(patch);
    credentialStore.replace(next);
    log.debug(
        "auth_state_updated authenticated={} loading={} patch={}",
        next.isAuthenticated(),
        next.loading(),
        patch);
    for (Consumer<AuthState> subscriber : subscribers) {
      deliver(subscriber, next);
    }
  }

  private void deliver(Consumer<AuthState> subscriber, AuthState state) {
    try {
      subscriber.accept(state);
    } catch (RuntimeException ex) {
      log.warn("Auth state subscriber failed: {}", ex.getMessage(), ex);
    }
  }
}
