package com.agenthums.backend.integration.oauth;

import java.util.List;

public record OAuthAuthorizationRequest(String redirectUri, String state, List<String> scopes) {}
