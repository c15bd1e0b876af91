package com.wifi.insights.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/** A named deployment context and the thresholds it selects. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EnvironmentProfile(
    String id, String name, String description, Thresholds thresholds) {}
