package com.agenthums.backend.auth.api;

public record RedirectResponse(String url) {}
