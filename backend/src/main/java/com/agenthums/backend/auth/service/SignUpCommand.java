package com.agenthums.backend.auth.service;

import org.springframework.lang.Nullable;

public record SignUpCommand(
    String email, String password, @Nullable String displayName, @Nullable String redirectTo) {}
