package com.wifi.insights.roaming;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/** A client's reconstructed trail, ordered by timestamp ascending. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoamingTrail(
    String macAddress, String hostName, List<RoamingEvent> events, RoamingTrailSummary summary) {}
