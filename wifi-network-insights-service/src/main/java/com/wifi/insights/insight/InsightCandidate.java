package com.wifi.insights.insight;

import java.util.List;

/**
 * An unscored insight produced by a single rule. The ranker turns candidates into
 * {@link InsightCard}s; a candidate has no score, identity or creation time of its own.
 *
 * <p>Impact, confidence and recurrence are all in [0, 1].
 */
public record InsightCandidate(
    String ruleKey,
    String title,
    String rationale,
    List<InsightEvidence> evidence,
    String recommendedAction,
    InsightCategory category,
    InsightSeverity severity,
    InsightScope scope,
    double impact,
    double confidence,
    double recurrence) {

  public InsightCandidate {
    requireUnitInterval("impact", impact);
    requireUnitInterval("confidence", confidence);
    requireUnitInterval("recurrence", recurrence);
    evidence = evidence == null ? List.of() : List.copyOf(evidence);
  }

  private static void requireUnitInterval(String name, double value) {
    if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
      throw new IllegalArgumentException(name + " must be within [0, 1] but was " + value);
    }
  }
}
