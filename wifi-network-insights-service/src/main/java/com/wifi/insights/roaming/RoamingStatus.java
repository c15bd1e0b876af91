package com.wifi.insights.roaming;

import com.fasterxml.jackson.annotation.JsonValue;

/** Qualitative health of a single trail event. */
public enum RoamingStatus {
  GOOD("good"),
  WARNING("warning"),
  BAD("bad");

  private final String code;

  RoamingStatus(String code) {
    this.code = code;
  }

  @JsonValue
  public String getCode() {
    return code;
  }
}
