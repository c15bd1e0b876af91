package com.wifi.insights.config.properties;

import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.wifi.insights.dto.Thresholds;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties for the environment profile catalog.
 *
 * <p>Each entry under {@code environment.profiles} is keyed by the profile id and selects the
 * thresholds the insight rules evaluate against. The catalog is read once at startup and is
 * immutable afterwards. An empty catalog does not stop startup; it is reported DOWN by the
 * {@code environmentProfiles} health indicator and every insight request fails with an unknown
 * profile.
 */
@ConfigurationProperties(prefix = "environment")
@Validated
public record EnvironmentProfilesConfigurationProperties(
    Map<String, @Valid ProfileDefinition> profiles) {

  /** A single configured profile. */
  public record ProfileDefinition(
      @NotBlank(message = "Profile name is required") String name,
      String description,
      @NotNull(message = "Profile thresholds are required") @Valid Thresholds thresholds) {}
}
