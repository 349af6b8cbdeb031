package com.agenthums.backend.auth.api;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** Email-only operations: magic link, password reset, confirmation resend, email change. */
public record EmailRequest(
    @NotBlank @Email @Size(max = 320) String email, @Size(max = 2048) String redirectTo) {}
