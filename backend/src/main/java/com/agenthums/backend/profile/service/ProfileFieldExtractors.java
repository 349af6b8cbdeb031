package com.agenthums.backend.profile.service;

import com.agenthums.backend.auth.domain.ProviderUser;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.springframework.util.StringUtils;

/**
 * Ordered lookups for profile fields in provider metadata. Each provider names these fields
 * differently, the first extractor with a value wins.
 */
public final class ProfileFieldExtractors {

  public static final String UNKNOWN_DISPLAY_NAME = "Unknown User";

  private static final List<Function<ProviderUser, Optional<String>>> DISPLAY_NAME =
      List.of(
          user -> user.metadataText("name"),
          user -> user.metadataText("full_name"),
          user -> user.metadataText("user_name"),
          user -> user.metadataText("display_name"),
          ProfileFieldExtractors::emailLocalPart);

  private static final List<Function<ProviderUser, Optional<String>>> AVATAR_URL =
      List.of(
          user -> user.metadataText("avatar_url"),
          user -> user.metadataText("picture"),
          user -> user.metadataText("photo_url"));

  private ProfileFieldExtractors() {}

  public static String displayName(ProviderUser user) {
    return firstPresent(DISPLAY_NAME, user).orElse(UNKNOWN_DISPLAY_NAME);
  }

  public static Optional<String> avatarUrl(ProviderUser user) {
    return firstPresent(AVATAR_URL, user);
  }

  private static Optional<String> emailLocalPart(ProviderUser user) {
    String email = user.email();
    if (!StringUtils.hasText(email)) {
      return Optional.empty();
    }
    int at = email.indexOf('@');
    String local = at >= 0 ? email.substring(0, at) : email;
    return StringUtils.hasText(local) ? Optional.of(local) : Optional.empty();
  }

  private static Optional<String> firstPresent(
      List<Function<ProviderUser, Optional<String>>> extractors, ProviderUser user) {
    for (Function<ProviderUser, Optional<String>> extractor : extractors) {
      Optional<String> value = extractor.apply(user);
      if (value.isPresent()) {
        return value;
      }
    }
    return Optional.empty();
  }
}
