package com.wifi.insights.insight;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Component;

import com.wifi.insights.config.properties.InsightsConfigurationProperties;

/**
 * Scores insight candidates and orders them for display.
 *
 * <p>Rank score formula:
 *
 * <pre>
 * score = 0.40 * impact + 0.25 * confidence + 0.15 * recurrence + 0.20 * scopeWeight
 * </pre>
 *
 * where scopeWeight comes from {@link InsightScope}. Ordering is descending by score and stable,
 * so candidates with equal scores keep their evaluation order.
 *
 * <p>Scoring is a pure function of the candidate. Card identity and timestamps come from the
 * injected {@link Clock}, so a fixed clock makes the whole output reproducible.
 */
@Component
public class InsightRanker {

  public static final double IMPACT_WEIGHT = 0.40;
  public static final double CONFIDENCE_WEIGHT = 0.25;
  public static final double RECURRENCE_WEIGHT = 0.15;
  public static final double SCOPE_WEIGHT = 0.20;

  private static final Comparator<InsightCard> BY_RANK_DESCENDING =
      Comparator.comparingDouble(InsightCard::rankScore).reversed();

  private final Clock clock;
  private final Duration cardTtl;

  public InsightRanker(Clock clock, InsightsConfigurationProperties properties) {
    this.clock = clock;
    this.cardTtl = properties == null ? null : properties.cardTtl();
  }

  public static double calculateRankScore(
      double impact, double confidence, double recurrence, InsightScope scope) {
    return IMPACT_WEIGHT * impact
        + CONFIDENCE_WEIGHT * confidence
        + RECURRENCE_WEIGHT * recurrence
        + SCOPE_WEIGHT * scope.getWeight();
  }

  public static double calculateRankScore(InsightCandidate candidate) {
    return calculateRankScore(
        candidate.impact(), candidate.confidence(), candidate.recurrence(), candidate.scope());
  }

  /**
   * Turns candidates into scored cards sorted by rank score, highest first.
   *
   * @param candidates candidates in evaluation order
   * @return a new list of cards; the input list is left untouched
   */
  public List<InsightCard> rank(List<InsightCandidate> candidates) {
    if (candidates == null || candidates.isEmpty()) {
      return List.of();
    }

    Instant createdAt = clock.instant();
    Instant expiresAt = cardTtl == null ? null : createdAt.plus(cardTtl);

    List<InsightCard> cards = new ArrayList<>(candidates.size());
    for (InsightCandidate candidate : candidates) {
      cards.add(toCard(candidate, createdAt, expiresAt));
    }
    // List.sort is a stable merge sort
    cards.sort(BY_RANK_DESCENDING);
    return List.copyOf(cards);
  }

  private InsightCard toCard(InsightCandidate candidate, Instant createdAt, Instant expiresAt) {
    return InsightCard.builder()
        .id(candidate.ruleKey() + "-" + createdAt.toEpochMilli())
        .title(candidate.title())
        .rationale(candidate.rationale())
        .evidence(candidate.evidence())
        .recommendedAction(candidate.recommendedAction())
        .category(candidate.category())
        .severity(candidate.severity())
        .scope(candidate.scope())
        .impact(candidate.impact())
        .confidence(candidate.confidence())
        .recurrence(candidate.recurrence())
        .rankScore(calculateRankScore(candidate))
        .createdAt(createdAt)
        .expiresAt(expiresAt)
        .build();
  }
}
