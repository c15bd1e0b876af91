package com.wifi.insights.insight;

import java.util.List;

/**
 * Counts per severity over a ranked insight list, plus the highest ranked card.
 *
 * @param topInsight first card of the ranked list, or null when there are none
 */
public record InsightsSummary(
    int total, int critical, int warning, int info, InsightCard topInsight) {

  public static InsightsSummary from(List<InsightCard> rankedInsights) {
    if (rankedInsights == null || rankedInsights.isEmpty()) {
      return new InsightsSummary(0, 0, 0, 0, null);
    }
    return new InsightsSummary(
        rankedInsights.size(),
        count(rankedInsights, InsightSeverity.CRITICAL),
        count(rankedInsights, InsightSeverity.WARNING),
        count(rankedInsights, InsightSeverity.INFO),
        rankedInsights.get(0));
  }

  private static int count(List<InsightCard> insights, InsightSeverity severity) {
    return (int) insights.stream().filter(card -> card.severity() == severity).count();
  }
}
