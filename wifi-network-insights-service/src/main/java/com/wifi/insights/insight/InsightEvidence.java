package com.wifi.insights.insight;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A labeled fact backing an insight.
 *
 * <p>{@code value} is either a number or preformatted text. When {@code timestamp} is present it
 * is the epoch-millisecond time of the snapshot the value was read from, so a consumer can move
 * its time cursor to that point.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InsightEvidence(
    String label, Object value, String unit, String metric, Long timestamp, String source) {

  /** Evidence read directly from a snapshot metric. */
  public static InsightEvidence measured(
      String label, Object value, String unit, String metric, Long timestamp) {
    return new InsightEvidence(label, value, unit, metric, timestamp, null);
  }

  /** Reference value such as a threshold or target. */
  public static InsightEvidence reference(String label, Object value, String unit) {
    return new InsightEvidence(label, value, unit, null, null, null);
  }

  /** Plain label/value fact. */
  public static InsightEvidence of(String label, Object value) {
    return new InsightEvidence(label, value, null, null, null, null);
  }
}
