package com.wifi.insights.service;

import java.time.Clock;
import java.util.List;

import org.springframework.stereotype.Service;

import com.wifi.insights.dto.EnvironmentProfile;
import com.wifi.insights.dto.InsightReport;
import com.wifi.insights.dto.MetricsSnapshot;
import com.wifi.insights.exception.UnknownEnvironmentProfileException;
import com.wifi.insights.insight.InsightCandidate;
import com.wifi.insights.insight.InsightCard;
import com.wifi.insights.insight.InsightRanker;
import com.wifi.insights.insight.InsightRuleEvaluator;
import com.wifi.insights.insight.InsightsSummary;
import com.wifi.insights.profile.EnvironmentProfileStore;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Produces ranked insight reports.
 *
 * <p>Flow: resolve the environment profile, evaluate the rule catalog against the snapshot,
 * rank the candidates, summarize. Each call is an independent recomputation; nothing is cached
 * or kept between calls.
 */
@Service
@Slf4j
public class InsightService {

  private final EnvironmentProfileStore profileStore;
  private final InsightRuleEvaluator ruleEvaluator;
  private final InsightRanker ranker;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final Counter reportsCounter;

  public InsightService(
      EnvironmentProfileStore profileStore,
      InsightRuleEvaluator ruleEvaluator,
      InsightRanker ranker,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.profileStore = profileStore;
    this.ruleEvaluator = ruleEvaluator;
    this.ranker = ranker;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    this.reportsCounter =
        Counter.builder("insights.reports.generated")
            .description("Number of insight reports generated")
            .register(meterRegistry);
  }

  /**
   * Generates the ranked insights for a snapshot.
   *
   * @param profileId environment profile selecting the thresholds
   * @param metrics the snapshot; missing fields skip the rules that need them
   * @throws UnknownEnvironmentProfileException if the profile is not in the catalog
   */
  public InsightReport generateReport(String profileId, MetricsSnapshot metrics) {
    EnvironmentProfile profile = profileStore.getProfile(profileId);

    List<InsightCandidate> candidates =
        ruleEvaluator.evaluate(metrics, profile.thresholds(), profile.name());
    List<InsightCard> insights = ranker.rank(candidates);
    InsightsSummary summary = InsightsSummary.from(insights);

    reportsCounter.increment();
    insights.forEach(
        card ->
            meterRegistry
                .counter("insights.cards.generated", "severity", card.severity().getCode())
                .increment());

    log.info(
        "Generated {} insights for profile {} (critical={}, warning={}, info={})",
        summary.total(),
        profile.id(),
        summary.critical(),
        summary.warning(),
        summary.info());

    return new InsightReport(
        profile.id(), profile.name(), clock.instant(), insights, summary);
  }

  public List<EnvironmentProfile> listProfiles() {
    return profileStore.listProfiles();
  }

  /**
   * @throws UnknownEnvironmentProfileException if the profile is not in the catalog
   */
  public EnvironmentProfile getProfile(String profileId) {
    return profileStore.getProfile(profileId);
  }
}
