package com.wifi.insights.exception;

/**
 * Thrown when a requested environment profile is not in the catalog. Insight generation fails
 * closed on this error rather than falling back to another profile's thresholds.
 */
public class UnknownEnvironmentProfileException extends RuntimeException {

  private final String profileId;

  public UnknownEnvironmentProfileException(String profileId) {
    super("Unknown environment profile: " + profileId);
    this.profileId = profileId;
  }

  public String getProfileId() {
    return profileId;
  }
}
