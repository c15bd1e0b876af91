package com.wifi.insights.dto;

import java.util.List;

import jakarta.validation.constraints.NotNull;

/** A client's raw event log submitted for trail reconstruction. */
public record RoamingTrailRequest(
    String macAddress,
    String hostName,
    @NotNull(message = "events is required") List<RawStationEvent> events) {}
