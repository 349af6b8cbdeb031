package com.agenthums.backend.auth.controller;

import com.agenthums.backend.auth.api.AuthCallbackRequest;
import com.agenthums.backend.auth.api.AuthStateResponse;
import com.agenthums.backend.auth.api.EmailRequest;
import com.agenthums.backend.auth.api.OtpVerificationRequest;
import com.agenthums.backend.auth.api.PasswordUpdateRequest;
import com.agenthums.backend.auth.api.RedirectResponse;
import com.agenthums.backend.auth.api.SignInRequest;
import com.agenthums.backend.auth.api.SignUpRequest;
import com.agenthums.backend.auth.api.SignUpResponse;
import com.agenthums.backend.auth.service.AuthOperationsGateway;
import com.agenthums.backend.auth.session.SessionManager;
import com.agenthums.backend.auth.state.AuthStateStore;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

  private final AuthOperationsGateway gateway;
  private final SessionManager sessionManager;
  private final AuthStateStore stateStore;

  public AuthController(
      AuthOperationsGateway gateway, SessionManager sessionManager, AuthStateStore stateStore) {
    this.gateway = gateway;
    this.sessionManager = sessionManager;
    this.stateStore = stateStore;
  }

  @GetMapping("/state")
  public AuthStateResponse state() {
    return AuthStateResponse.from(stateStore.snapshot());
  }

  @PostMapping("/sign-up")
  public Mono<SignUpResponse> signUp(@Valid @RequestBody SignUpRequest request) {
    return gateway.signUp(request.toCommand()).map(SignUpResponse::from);
  }

  @PostMapping("/sign-in")
  public Mono<AuthStateResponse> signIn(@Valid @RequestBody SignInRequest request) {
    return gateway.signIn(request.email(), request.password()).map(AuthStateResponse::from);
  }

  @PostMapping("/sign-out")
  public Mono<ResponseEntity<Void>> signOut() {
    return gateway.signOut().thenReturn(ResponseEntity.noContent().<Void>build());
  }

  @PostMapping("/magic-link")
  public Mono<ResponseEntity<Void>> magicLink(@Valid @RequestBody EmailRequest request) {
    return gateway
        .signInWithMagicLink(request.email(), request.redirectTo())
        .thenReturn(ResponseEntity.accepted().<Void>build());
  }

  @PostMapping("/providers/{provider}")
  public Mono<RedirectResponse> signInWithProvider(
      @PathVariable String provider, @RequestParam(required = false) String redirectTo) {
    return gateway
        .signInWithProvider(provider, redirectTo)
        .map(uri -> new RedirectResponse(uri.toString()));
  }

  @PostMapping("/callback")
  public Mono<AuthStateResponse> callback(@Valid @RequestBody AuthCallbackRequest request) {
    return sessionManager.handleAuthCallback(request.code()).map(AuthStateResponse::from);
  }

  @PostMapping("/password/reset")
  public Mono<ResponseEntity<Void>> resetPassword(@Valid @RequestBody EmailRequest request) {
    return gateway
        .resetPassword(request.email(), request.redirectTo())
        .thenReturn(ResponseEntity.accepted().<Void>build());
  }

  @PutMapping("/password")
  public Mono<ResponseEntity<Void>> updatePassword(
      @Valid @RequestBody PasswordUpdateRequest request) {
    return gateway
        .updatePassword(request.password())
        .thenReturn(ResponseEntity.noContent().<Void>build());
  }

  @PostMapping("/confirmation/resend")
  public Mono<ResponseEntity<Void>> resendConfirmation(@Valid @RequestBody EmailRequest request) {
    return gateway
        .resendConfirmation(request.email())
        .thenReturn(ResponseEntity.accepted().<Void>build());
  }

  @PutMapping("/email")
  public Mono<ResponseEntity<Void>> updateEmail(@Valid @RequestBody EmailRequest request) {
    return gateway.updateEmail(request.email()).thenReturn(ResponseEntity.accepted().<Void>build());
  }

  @PostMapping("/otp/verify")
  public Mono<AuthStateResponse> verifyOtp(@Valid @RequestBody OtpVerificationRequest request) {
    return gateway
        .verifyOtp(request.email(), request.token(), request.type())
        .map(AuthStateResponse::from);
  }

  @PostMapping("/session/refresh")
  public Mono<AuthStateResponse> refreshSession() {
    return sessionManager.refreshIfNeeded().map(AuthStateResponse::from);
  }

  @GetMapping("/session/valid")
  public Mono<Map<String, Boolean>> validateSession() {
    return sessionManager.validateSession().map(valid -> Map.of("valid", valid));
  }
}
