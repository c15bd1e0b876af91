package com.wifi.insights.insight;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InsightsSummary Tests")
class InsightsSummaryTest {

  private static InsightCard card(String id, InsightSeverity severity, double rankScore) {
    return InsightCard.builder()
        .id(id)
        .title(id)
        .severity(severity)
        .scope(InsightScope.SITE)
        .category(InsightCategory.CAPACITY)
        .evidence(List.of())
        .rankScore(rankScore)
        .build();
  }

  @Test
  @DisplayName("should_CountSeveritiesAndPickFirstCard")
  void should_CountSeveritiesAndPickFirstCard() {
    // Given
    InsightCard top = card("a", InsightSeverity.CRITICAL, 0.9);
    List<InsightCard> ranked =
        List.of(
            top,
            card("b", InsightSeverity.WARNING, 0.7),
            card("c", InsightSeverity.WARNING, 0.6),
            card("d", InsightSeverity.INFO, 0.3));

    // When
    InsightsSummary summary = InsightsSummary.from(ranked);

    // Then
    assertThat(summary.total()).isEqualTo(4);
    assertThat(summary.critical()).isEqualTo(1);
    assertThat(summary.warning()).isEqualTo(2);
    assertThat(summary.info()).isEqualTo(1);
    assertThat(summary.topInsight()).isSameAs(top);
  }

  @Test
  @DisplayName("should_ReturnZeroCounts_When_NoInsights")
  void should_ReturnZeroCounts_When_NoInsights() {
    InsightsSummary summary = InsightsSummary.from(List.of());

    assertThat(summary).isEqualTo(new InsightsSummary(0, 0, 0, 0, null));
  }
}
