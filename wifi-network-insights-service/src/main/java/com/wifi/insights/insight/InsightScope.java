package com.wifi.insights.insight;

/**
 * Breadth of an insight. Wider scopes weigh more in the rank score.
 *
 * <ul>
 *   <li>NETWORK: 1.0
 *   <li>SITE: 0.75
 *   <li>AP: 0.5
 *   <li>CLIENT: 0.25
 * </ul>
 */
public enum InsightScope {
  NETWORK(1.0),
  SITE(0.75),
  AP(0.5),
  CLIENT(0.25);

  private final double weight;

  InsightScope(double weight) {
    this.weight = weight;
  }

  public double getWeight() {
    return weight;
  }
}
