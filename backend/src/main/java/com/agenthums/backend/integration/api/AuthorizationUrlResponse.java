package com.agenthums.backend.integration.api;

public record AuthorizationUrlResponse(String serviceKind, String url) {}
