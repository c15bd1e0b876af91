package com.wifi.insights.insight;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.wifi.insights.dto.MetricsSnapshot;
import com.wifi.insights.dto.Thresholds;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs the rule catalog over a metrics snapshot.
 *
 * <p>Rules are independent and stateless. Each one that fires contributes exactly one
 * candidate, and candidates come back in catalog order, which is the tie-break order used by
 * {@link InsightRanker}. Missing metrics only mean fewer candidates, never an error. The inputs
 * are not modified.
 */
@Component
@Slf4j
public class InsightRuleEvaluator {

  private final List<InsightRule> rules;

  public InsightRuleEvaluator() {
    this(InsightRuleCatalog.rules());
  }

  InsightRuleEvaluator(List<InsightRule> rules) {
    this.rules = List.copyOf(rules);
  }

  /**
   * Evaluates every rule against the snapshot.
   *
   * @param metrics the snapshot to evaluate; null yields no candidates
   * @param thresholds limits of the selected environment profile
   * @param profileName display name of the profile, used in candidate text
   * @return candidates of the rules that fired, in catalog order
   * @throws IllegalArgumentException if thresholds are null
   */
  public List<InsightCandidate> evaluate(
      MetricsSnapshot metrics, Thresholds thresholds, String profileName) {
    if (thresholds == null) {
      throw new IllegalArgumentException("Thresholds cannot be null");
    }
    if (metrics == null) {
      return List.of();
    }

    RuleContext context = new RuleContext(metrics, thresholds, profileName);
    List<InsightCandidate> candidates = new ArrayList<>();
    for (InsightRule rule : rules) {
      rule.apply(context)
          .ifPresent(
              candidate -> {
                log.debug(
                    "Rule {} fired with severity {} and impact {}",
                    rule.key(),
                    candidate.severity(),
                    candidate.impact());
                candidates.add(candidate);
              });
    }
    return candidates;
  }
}
