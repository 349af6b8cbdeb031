package com.agenthums.backend.integration.controller;

import com.agenthums.backend.integration.api.AccessTokenResponse;
import com.agenthums.backend.integration.api.AuthorizationUrlResponse;
import com.agenthums.backend.integration.api.IntegrationCallbackRequest;
import com.agenthums.backend.integration.service.IntegrationCredentialBroker;
import com.agenthums.backend.integration.service.IntegrationStatus;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/integrations")
public class IntegrationController {

  private final IntegrationCredentialBroker broker;

  public IntegrationController(IntegrationCredentialBroker broker) {
    this.broker = broker;
  }

  @GetMapping
  public Mono<List<IntegrationStatus>> status() {
    return Mono.defer(() -> broker.status(broker.currentIdentityId()));
  }

  @GetMapping("/{serviceKind}/authorization-url")
  public AuthorizationUrlResponse authorizationUrl(@PathVariable String serviceKind) {
    return new AuthorizationUrlResponse(
        serviceKind, broker.authorizationUrl(serviceKind).toString());
  }

  @PostMapping("/callback")
  public Mono<IntegrationStatus> callback(@Valid @RequestBody IntegrationCallbackRequest request) {
    return broker
        .completeAuthorizationCallback(request.code(), request.state())
        .map(
            connection ->
                new IntegrationStatus(
                    connection.getServiceKind(),
                    connection.hasAccessToken(),
                    connection.getUpdatedAt(),
                    connection.getExpiresAt(),
                    List.copyOf(connection.getScopes())));
  }

  @GetMapping("/{serviceKind}/access-token")
  public Mono<AccessTokenResponse> accessToken(@PathVariable String serviceKind) {
    return Mono.defer(
        () ->
            broker
                .getValidAccessToken(broker.currentIdentityId(), serviceKind)
                .map(token -> new AccessTokenResponse(serviceKind, token)));
  }

  @DeleteMapping("/{serviceKind}")
  public Mono<ResponseEntity<Void>> disconnect(@PathVariable String serviceKind) {
    return Mono.defer(() -> broker.disconnect(broker.currentIdentityId(), serviceKind))
        .thenReturn(ResponseEntity.noContent().<Void>build());
  }
}
