package com.agenthums.backend.integration.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** {@code state} carries the service kind the consent was requested for. */
public record IntegrationCallbackRequest(
    @NotBlank @Size(max = 2048) String code, @NotBlank @Size(max = 64) String state) {}
