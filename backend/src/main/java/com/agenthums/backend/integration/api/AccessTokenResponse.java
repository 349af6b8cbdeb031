package com.agenthums.backend.integration.api;

public record AccessTokenResponse(String serviceKind, String accessToken) {}
