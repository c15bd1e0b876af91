package com.wifi.insights.insight;

import com.wifi.insights.dto.MetricsSnapshot;
import com.wifi.insights.dto.Thresholds;

/** Inputs shared by every rule during one evaluation. */
public record RuleContext(MetricsSnapshot metrics, Thresholds thresholds, String profileName) {}
