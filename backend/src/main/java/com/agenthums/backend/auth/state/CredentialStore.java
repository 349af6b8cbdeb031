package com.agenthums.backend.auth.state;

import com.agenthums.backend.auth.domain.AuthState;
import com.agenthums.backend.auth.domain.Identity;
import com.agenthums.backend.auth.domain.Session;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/** Holds the latest published {@link AuthState}. Written only by {@link AuthStateStore}. */
@Component
public class CredentialStore {

  private final AtomicReference<AuthState> current = new AtomicReference<>(AuthState.initial());

  public AuthState current() {
    return current.get();
  }

  void replace(AuthState state) {
    current.set(state);
  }

  public Optional<String> accessToken() {
    return Optional.ofNullable(current.get().session()).map(Session::accessToken);
  }

  public Optional<UUID> identityId() {
    return Optional.ofNullable(current.get().identity()).map(Identity::id);
  }
}
