package com.agenthums.backend.profile.service;

import com.agenthums.backend.profile.domain.ProfileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ProfileEventLogger {

  private static final Logger log = LoggerFactory.getLogger(ProfileEventLogger.class);

  public void profileCreated(ProfileRecord profile, String source) {
    if (profile == null) {
      return;
    }
    log.info("profile_created profileId={} source={}", profile.getId(), source);
  }

  public void profileCreateConflict(ProfileRecord profile, String source) {
    if (profile == null) {
      return;
    }
    log.debug("profile_create_conflict profileId={} source={}", profile.getId(), source);
  }

  public void profileUpdated(ProfileRecord profile) {
    if (profile == null) {
      return;
    }
    log.info("profile_updated profileId={} active={}", profile.getId(), profile.isActive());
  }

  public void profileDeactivated(ProfileRecord profile) {
    if (profile == null) {
      return;
    }
    log.info("profile_deactivated profileId={}", profile.getId());
  }
}
