package com.wifi.insights.insight;

import com.fasterxml.jackson.annotation.JsonValue;

/** Problem area an insight belongs to. */
public enum InsightCategory {
  RF_QUALITY("rf_quality"),
  INTERFERENCE("interference"),
  CHANNEL_UTILIZATION("channel_utilization"),
  CLIENT_PERFORMANCE("client_performance"),
  CONNECTIVITY("connectivity"),
  CAPACITY("capacity"),
  ANOMALY("anomaly");

  private final String code;

  InsightCategory(String code) {
    this.code = code;
  }

  @JsonValue
  public String getCode() {
    return code;
  }
}
