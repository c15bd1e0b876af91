package com.wifi.insights.profile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.wifi.insights.config.properties.EnvironmentProfilesConfigurationProperties;
import com.wifi.insights.config.properties.EnvironmentProfilesConfigurationProperties.ProfileDefinition;
import com.wifi.insights.dto.EnvironmentProfile;
import com.wifi.insights.exception.UnknownEnvironmentProfileException;

import lombok.extern.slf4j.Slf4j;

/**
 * Read-only catalog of environment profiles.
 *
 * <p>Built once from {@link EnvironmentProfilesConfigurationProperties}. Profile ids are matched
 * case-insensitively. There is no default profile: an unknown id is an error.
 */
@Component
@Slf4j
public class EnvironmentProfileStore {

  private final Map<String, EnvironmentProfile> profiles;

  public EnvironmentProfileStore(EnvironmentProfilesConfigurationProperties properties) {
    Map<String, EnvironmentProfile> loaded = new LinkedHashMap<>();
    if (properties != null && properties.profiles() != null) {
      properties
          .profiles()
          .forEach((id, definition) -> loaded.put(normalize(id), toProfile(id, definition)));
    }
    this.profiles = Collections.unmodifiableMap(loaded);
    log.info("Loaded {} environment profiles: {}", profiles.size(), profiles.keySet());
  }

  /**
   * @throws UnknownEnvironmentProfileException if no profile has this id
   */
  public EnvironmentProfile getProfile(String profileId) {
    return findProfile(profileId)
        .orElseThrow(() -> new UnknownEnvironmentProfileException(profileId));
  }

  public Optional<EnvironmentProfile> findProfile(String profileId) {
    if (profileId == null || profileId.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(profiles.get(normalize(profileId)));
  }

  /** All profiles in configuration order. */
  public List<EnvironmentProfile> listProfiles() {
    return List.copyOf(profiles.values());
  }

  public int size() {
    return profiles.size();
  }

  private static EnvironmentProfile toProfile(String id, ProfileDefinition definition) {
    return new EnvironmentProfile(
        normalize(id), definition.name(), definition.description(), definition.thresholds());
  }

  private static String normalize(String profileId) {
    return profileId.trim().toLowerCase(Locale.ROOT);
  }
}
