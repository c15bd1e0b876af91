package com.wifi.insights.controller;

import java.util.List;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.wifi.insights.dto.EnvironmentProfile;
import com.wifi.insights.dto.InsightReport;
import com.wifi.insights.dto.MetricsSnapshot;
import com.wifi.insights.service.InsightService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * REST controller for insight generation and the environment profile catalog.
 *
 * <p>An unknown profile id is answered with 404 by {@link GlobalExceptionHandler}; insights are
 * never generated against a substitute profile.
 */
@RestController
@RequestMapping("/api/insights")
@Validated
@RequiredArgsConstructor
@Tag(name = "Network Insights", description = "Ranked insights from network telemetry")
public class InsightsController {

  private final InsightService insightService;

  @GetMapping(value = "/profiles", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "List environment profiles")
  public ResponseEntity<List<EnvironmentProfile>> listProfiles() {
    return ResponseEntity.ok(insightService.listProfiles());
  }

  @GetMapping(value = "/profiles/{profileId}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Get an environment profile and its thresholds")
  public ResponseEntity<EnvironmentProfile> getProfile(@PathVariable String profileId) {
    return ResponseEntity.ok(insightService.getProfile(profileId));
  }

  @PostMapping(
      value = "/{profileId}",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Generate insights",
      description = "Evaluate a metrics snapshot against an environment profile")
  public ResponseEntity<InsightReport> generateInsights(
      @PathVariable String profileId, @RequestBody MetricsSnapshot metrics) {
    return ResponseEntity.ok(insightService.generateReport(profileId, metrics));
  }
}
