package com.agenthums.backend.profile.controller;

import com.agenthums.backend.auth.domain.Identity;
import com.agenthums.backend.profile.api.ProfileResponse;
import com.agenthums.backend.profile.api.ProfileUpdateRequest;
import com.agenthums.backend.profile.service.ProfileService;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/profile")
public class ProfileController {

  private final ProfileService profileService;

  public ProfileController(ProfileService profileService) {
    this.profileService = profileService;
  }

  @GetMapping("/me")
  public Mono<Identity> currentIdentity() {
    return profileService.currentIdentity();
  }

  @GetMapping("/me/record")
  public Mono<ProfileResponse> currentProfile() {
    return profileService
        .currentIdentity()
        .flatMap(identity -> profileService.getProfile(identity.id()))
        .map(ProfileResponse::from)
        .switchIfEmpty(
            Mono.error(
                () -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Profile not found")));
  }

  @PutMapping("/me")
  public Mono<Identity> updateProfile(@Valid @RequestBody ProfileUpdateRequest request) {
    return profileService.updateProfile(request.toCommand());
  }

  @PatchMapping("/me/preferences")
  public Mono<Identity> updatePreferences(@RequestBody JsonNode preferences) {
    return profileService.updatePreferences(preferences);
  }

  @DeleteMapping("/me")
  public Mono<ResponseEntity<Void>> deactivate() {
    return profileService
        .deactivateCurrentProfile()
        .thenReturn(ResponseEntity.noContent().<Void>build());
  }

  @GetMapping("/{identityId}/exists")
  public Mono<Map<String, Boolean>> exists(@PathVariable UUID identityId) {
    return profileService.profileExists(identityId).map(exists -> Map.of("exists", exists));
  }

  @GetMapping
  public Mono<List<ProfileResponse>> listActive(
      @RequestParam(defaultValue = "0") int page, @RequestParam(defaultValue = "20") int size) {
    return profileService
        .listActiveProfiles(page, size)
        .map(profiles -> profiles.stream().map(ProfileResponse::from).toList());
  }
}
