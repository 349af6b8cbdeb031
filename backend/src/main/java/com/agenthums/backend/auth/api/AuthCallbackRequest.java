package com.agenthums.backend.auth.api;

import jakarta.validation.constraints.Size;

public record AuthCallbackRequest(@Size(max = 512) String code) {}
