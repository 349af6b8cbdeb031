package com.agenthums.backend.integration.service;

import java.util.UUID;

record ConnectionKey(UUID identityId, String serviceKind) {}
