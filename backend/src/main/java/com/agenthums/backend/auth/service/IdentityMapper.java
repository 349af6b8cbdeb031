package com.agenthums.backend.auth.service;

import com.agenthums.backend.auth.domain.Identity;
import com.agenthums.backend.auth.domain.ProviderUser;
import com.agenthums.backend.auth.domain.UserPreferences;
import com.agenthums.backend.profile.domain.ProfileRecord;
import com.agenthums.backend.profile.service.ProfileFieldExtractors;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class IdentityMapper {

  /** Profile values win over provider metadata when a profile row is available. */
  public Identity toIdentity(ProviderUser user, @Nullable ProfileRecord profile) {
    if (profile == null) {
      return new Identity(
          user.id(),
          user.email(),
          user.emailConfirmed(),
          ProfileFieldExtractors.displayName(user),
          null,
          ProfileFieldExtractors.avatarUrl(user).orElse(null),
          null,
          user.createdAt(),
          user.lastSignInAt(),
          UserPreferences.defaults());
    }
    String displayName =
        StringUtils.hasText(profile.getDisplayName())
            ? profile.getDisplayName()
            : ProfileFieldExtractors.displayName(user);
    String avatarUrl =
        StringUtils.hasText(profile.getAvatarUrl())
            ? profile.getAvatarUrl()
            : ProfileFieldExtractors.avatarUrl(user).orElse(null);
    return new Identity(
        user.id(),
        user.email() != null ? user.email() : profile.getEmail(),
        user.emailConfirmed(),
        displayName,
        profile.getNickname(),
        avatarUrl,
        profile.getBio(),
        user.createdAt() != null ? user.createdAt() : profile.getCreatedAt(),
        user.lastSignInAt(),
        UserPreferences.fromJson(profile.getPreferences()));
  }
}
