package com.wifi.insights.dto;

import java.time.Instant;
import java.util.List;

import com.wifi.insights.insight.InsightCard;
import com.wifi.insights.insight.InsightsSummary;

/** Ranked insights for one snapshot under one environment profile. */
public record InsightReport(
    String profileId,
    String profileName,
    Instant generatedAt,
    List<InsightCard> insights,
    InsightsSummary summary) {}
