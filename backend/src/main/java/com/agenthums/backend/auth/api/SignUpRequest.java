package com.agenthums.backend.auth.api;

import com.agenthums.backend.auth.service.SignUpCommand;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SignUpRequest(
    @NotBlank @Email @Size(max = 320) String email,
    @NotBlank @Size(max = 72) String password,
    @Size(max = 255) String displayName,
    @Size(max = 2048) String redirectTo) {

  public SignUpCommand toCommand() {
    return new SignUpCommand(email, password, displayName, redirectTo);
  }
}
