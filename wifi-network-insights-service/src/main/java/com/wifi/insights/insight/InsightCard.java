package com.wifi.insights.insight;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;

/**
 * A ranked, evidence-backed description of a detected network condition.
 *
 * <p>{@code rankScore} is always derived from impact, confidence, recurrence and scope by
 * {@link InsightRanker#calculateRankScore}. Rules never set it.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InsightCard(
    String id,
    String title,
    String rationale,
    List<InsightEvidence> evidence,
    String recommendedAction,
    InsightCategory category,
    InsightSeverity severity,
    InsightScope scope,
    double impact,
    double confidence,
    double recurrence,
    double rankScore,
    Instant createdAt,
    Instant expiresAt) {}
