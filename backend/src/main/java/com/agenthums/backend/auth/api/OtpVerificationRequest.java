package com.agenthums.backend.auth.api;

import com.agenthums.backend.auth.provider.IdentityProviderClient.OtpType;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record OtpVerificationRequest(
    @NotBlank @Email String email, @NotBlank String token, @NotNull OtpType type) {}
