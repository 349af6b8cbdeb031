package com.agenthums.backend.auth.api;

import com.agenthums.backend.auth.domain.ProviderUser;
import java.util.UUID;

public record SignUpResponse(UUID userId, String email, boolean confirmationRequired) {

  public static SignUpResponse from(ProviderUser user) {
    return new SignUpResponse(user.id(), user.email(), !user.emailConfirmed());
  }
}
