package com.wifi.insights.insight;

import com.fasterxml.jackson.annotation.JsonValue;

/** How urgently an insight needs attention. */
public enum InsightSeverity {
  CRITICAL("critical"),
  WARNING("warning"),
  INFO("info");

  private final String code;

  InsightSeverity(String code) {
    this.code = code;
  }

  @JsonValue
  public String getCode() {
    return code;
  }
}
