package com.wifi.insights.health;

import java.util.stream.Collectors;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.wifi.insights.dto.EnvironmentProfile;
import com.wifi.insights.profile.EnvironmentProfileStore;

import lombok.RequiredArgsConstructor;

/**
 * Reports whether the environment profile catalog is usable.
 *
 * <p>Without profiles every insight request fails, so an empty catalog reports DOWN. Details
 * list the loaded profile ids.
 */
@Component("environmentProfiles")
@RequiredArgsConstructor
public class EnvironmentProfilesHealthIndicator implements HealthIndicator {

  private static final String PROFILE_COUNT_KEY = "profileCount";
  private static final String PROFILES_KEY = "profiles";
  private static final String REASON_KEY = "reason";

  private final EnvironmentProfileStore profileStore;

  @Override
  public Health health() {
    if (profileStore.size() == 0) {
      return Health.down()
          .withDetail(PROFILE_COUNT_KEY, 0)
          .withDetail(REASON_KEY, "No environment profiles configured")
          .build();
    }
    return Health.up()
        .withDetail(PROFILE_COUNT_KEY, profileStore.size())
        .withDetail(
            PROFILES_KEY,
            profileStore.listProfiles().stream()
                .map(EnvironmentProfile::id)
                .collect(Collectors.toList()))
        .build();
  }
}
