package com.wifi.insights.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.wifi.insights.config.properties.EnvironmentProfilesConfigurationProperties;
import com.wifi.insights.config.properties.EnvironmentProfilesConfigurationProperties.ProfileDefinition;
import com.wifi.insights.config.properties.InsightsConfigurationProperties;
import com.wifi.insights.dto.InsightReport;
import com.wifi.insights.dto.MetricsSnapshot;
import com.wifi.insights.dto.Thresholds;
import com.wifi.insights.exception.UnknownEnvironmentProfileException;
import com.wifi.insights.insight.InsightCard;
import com.wifi.insights.insight.InsightRanker;
import com.wifi.insights.insight.InsightRuleEvaluator;
import com.wifi.insights.insight.InsightSeverity;
import com.wifi.insights.profile.EnvironmentProfileStore;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@DisplayName("InsightService Tests")
class InsightServiceTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
  private static final double TOLERANCE = 1e-6;

  private SimpleMeterRegistry meterRegistry;
  private InsightService insightService;

  @BeforeEach
  void setUp() {
    Thresholds office = new Thresholds(70.0, 85.0, 80.0, 0.3, 15.0, 20.0);
    EnvironmentProfileStore store =
        new EnvironmentProfileStore(
            new EnvironmentProfilesConfigurationProperties(
                Map.of("office", new ProfileDefinition("Office", "Open-plan office", office))));
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    meterRegistry = new SimpleMeterRegistry();
    insightService =
        new InsightService(
            store,
            new InsightRuleEvaluator(),
            new InsightRanker(clock, new InsightsConfigurationProperties(Duration.ofMinutes(5))),
            clock,
            meterRegistry);
  }

  @Test
  @DisplayName("should_RankDegradedSnapshot_When_SeveralRulesFire")
  void should_RankDegradedSnapshot_When_SeveralRulesFire() {
    // Given
    MetricsSnapshot metrics =
        MetricsSnapshot.builder()
            .rfqi(50.0)
            .channelUtilization(90.0)
            .apCount(10)
            .apOnlineCount(9)
            .timestamp(NOW.toEpochMilli())
            .build();

    // When
    InsightReport report = insightService.generateReport("OFFICE", metrics);

    // Then
    assertThat(report.profileId()).isEqualTo("office");
    assertThat(report.profileName()).isEqualTo("Office");
    assertThat(report.generatedAt()).isEqualTo(NOW);

    List<InsightCard> insights = report.insights();
    assertThat(insights)
        .extracting(InsightCard::id)
        .containsExactly(
            "channel-util-high-" + NOW.toEpochMilli(),
            "rfqi-low-" + NOW.toEpochMilli(),
            "ap-offline-" + NOW.toEpochMilli());
    assertThat(insights.get(0).rankScore()).isCloseTo(0.6525, within(TOLERANCE));
    assertThat(insights.get(1).rankScore()).isCloseTo(0.65, within(TOLERANCE));
    assertThat(insights.get(2).rankScore()).isCloseTo(0.578333, within(TOLERANCE));
    assertThat(insights).allMatch(card -> card.severity() == InsightSeverity.WARNING);
    assertThat(insights).allMatch(card -> card.expiresAt().equals(NOW.plusSeconds(300)));

    assertThat(report.summary().total()).isEqualTo(3);
    assertThat(report.summary().warning()).isEqualTo(3);
    assertThat(report.summary().critical()).isZero();
    assertThat(report.summary().topInsight()).isEqualTo(insights.get(0));
  }

  @Test
  @DisplayName("should_ReturnEmptyReport_When_SnapshotHealthy")
  void should_ReturnEmptyReport_When_SnapshotHealthy() {
    MetricsSnapshot metrics =
        MetricsSnapshot.builder()
            .rfqi(92.0)
            .channelUtilization(35.0)
            .interference(0.05)
            .retryRate(4.0)
            .apCount(10)
            .apOnlineCount(10)
            .clientCount(120)
            .avgRssi(-58.0)
            .build();

    InsightReport report = insightService.generateReport("office", metrics);

    assertThat(report.insights()).isEmpty();
    assertThat(report.summary().total()).isZero();
    assertThat(report.summary().topInsight()).isNull();
  }

  @Test
  @DisplayName("should_AlwaysReturnNonIncreasingRankScores")
  void should_AlwaysReturnNonIncreasingRankScores() {
    List<MetricsSnapshot> snapshots =
        List.of(
            MetricsSnapshot.builder().rfqi(20.0).avgRssi(-90.0).retryRate(40.0).build(),
            MetricsSnapshot.builder()
                .interference(0.8)
                .clientCount(900)
                .apCount(20)
                .apOnlineCount(12)
                .build(),
            MetricsSnapshot.builder()
                .rfqi(69.0)
                .channelUtilization(81.0)
                .interference(0.31)
                .retryRate(16.0)
                .avgRssi(-76.0)
                .build());

    for (MetricsSnapshot snapshot : snapshots) {
      assertThat(insightService.generateReport("office", snapshot).insights())
          .isNotEmpty()
          .isSortedAccordingTo(Comparator.comparingDouble(InsightCard::rankScore).reversed());
    }
  }

  @Test
  @DisplayName("should_DegradeGracefully_When_MetricsOutsideNominalRange")
  void should_DegradeGracefully_When_MetricsOutsideNominalRange() {
    // Given
    MetricsSnapshot metrics =
        MetricsSnapshot.builder()
            .rfqi(30.0)
            .channelUtilization(120.0)
            .interference(1.05)
            .apCount(10)
            .apOnlineCount(12)
            .clientCount(-5)
            .build();

    // When
    InsightReport report = insightService.generateReport("office", metrics);

    // Then
    assertThat(report.insights())
        .extracting(InsightCard::id)
        .containsExactlyInAnyOrder(
            "rfqi-low-" + NOW.toEpochMilli(),
            "channel-util-high-" + NOW.toEpochMilli(),
            "interference-high-" + NOW.toEpochMilli());
    assertThat(report.insights()).allSatisfy(card -> assertThat(card.impact()).isBetween(0.0, 1.0));
  }

  @Test
  @DisplayName("should_RejectUnknownProfile")
  void should_RejectUnknownProfile() {
    MetricsSnapshot metrics = MetricsSnapshot.builder().rfqi(10.0).build();

    assertThatThrownBy(() -> insightService.generateReport("stadium", metrics))
        .isInstanceOf(UnknownEnvironmentProfileException.class);
    assertThat(meterRegistry.get("insights.reports.generated").counter().count()).isZero();
  }

  @Test
  @DisplayName("should_CountReportsAndCardsBySeverity")
  void should_CountReportsAndCardsBySeverity() {
    // rfqi 40 < 49 is critical, -78 dBm is info
    MetricsSnapshot metrics = MetricsSnapshot.builder().rfqi(40.0).avgRssi(-78.0).build();

    insightService.generateReport("office", metrics);
    insightService.generateReport("office", metrics);

    assertThat(meterRegistry.get("insights.reports.generated").counter().count()).isEqualTo(2.0);
    assertThat(
            meterRegistry
                .get("insights.cards.generated")
                .tag("severity", "critical")
                .counter()
                .count())
        .isEqualTo(2.0);
    assertThat(
            meterRegistry.get("insights.cards.generated").tag("severity", "info").counter().count())
        .isEqualTo(2.0);
  }

  @Test
  @DisplayName("should_ExposeProfileCatalog")
  void should_ExposeProfileCatalog() {
    assertThat(insightService.listProfiles()).hasSize(1);
    assertThat(insightService.getProfile("Office").thresholds().rfqiPoor()).isEqualTo(70.0);
  }
}
