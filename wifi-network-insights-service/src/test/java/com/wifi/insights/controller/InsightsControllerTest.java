package com.wifi.insights.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wifi.insights.config.properties.EnvironmentProfilesConfigurationProperties;
import com.wifi.insights.config.properties.EnvironmentProfilesConfigurationProperties.ProfileDefinition;
import com.wifi.insights.config.properties.InsightsConfigurationProperties;
import com.wifi.insights.dto.EnvironmentProfile;
import com.wifi.insights.dto.InsightReport;
import com.wifi.insights.dto.MetricsSnapshot;
import com.wifi.insights.dto.Thresholds;
import com.wifi.insights.exception.UnknownEnvironmentProfileException;
import com.wifi.insights.insight.InsightCard;
import com.wifi.insights.insight.InsightCategory;
import com.wifi.insights.insight.InsightEvidence;
import com.wifi.insights.insight.InsightRanker;
import com.wifi.insights.insight.InsightRuleEvaluator;
import com.wifi.insights.insight.InsightScope;
import com.wifi.insights.insight.InsightSeverity;
import com.wifi.insights.insight.InsightsSummary;
import com.wifi.insights.profile.EnvironmentProfileStore;
import com.wifi.insights.service.InsightService;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Unit tests for the InsightsController class. Tests focus on routing, status codes and the JSON
 * shape of reports and errors.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Insights Controller Tests")
class InsightsControllerTest {

  private static final Thresholds OFFICE_THRESHOLDS =
      new Thresholds(65.0, 80.0, 65.0, 0.25, 12.0, 35.0);
  private static final EnvironmentProfile OFFICE =
      new EnvironmentProfile("office", "Office", "Open-plan office", OFFICE_THRESHOLDS);

  @Mock private InsightService insightService;

  @InjectMocks private InsightsController controller;

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    objectMapper = new ObjectMapper();
  }

  private static InsightReport reportWithOneCard() {
    InsightCard card =
        InsightCard.builder()
            .id("channel-util-high-1714557600000")
            .title("High Channel Utilization Detected")
            .rationale("Channel utilization above 65% in Office environments")
            .evidence(List.of(InsightEvidence.reference("Threshold", 65.0, "%")))
            .recommendedAction("Consider load balancing")
            .category(InsightCategory.CHANNEL_UTILIZATION)
            .severity(InsightSeverity.WARNING)
            .scope(InsightScope.SITE)
            .impact(0.5)
            .confidence(0.85)
            .recurrence(0.6)
            .rankScore(0.6525)
            .build();
    List<InsightCard> insights = List.of(card);
    return new InsightReport(
        "office", "Office", Instant.EPOCH, insights, InsightsSummary.from(insights));
  }

  @Nested
  @DisplayName("Generate insights")
  class GenerateInsights {

    @Test
    @DisplayName("should_ReturnRankedReport")
    void should_ReturnRankedReport() throws Exception {
      // Given
      MetricsSnapshot metrics = MetricsSnapshot.builder().channelUtilization(90.0).build();
      when(insightService.generateReport(eq("office"), any(MetricsSnapshot.class)))
          .thenReturn(reportWithOneCard());

      // When/Then
      mockMvc
          .perform(
              post("/api/insights/office")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(metrics)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.profileId").value("office"))
          .andExpect(jsonPath("$.insights[0].id").value("channel-util-high-1714557600000"))
          .andExpect(jsonPath("$.insights[0].severity").value("warning"))
          .andExpect(jsonPath("$.insights[0].category").value("channel_utilization"))
          .andExpect(jsonPath("$.insights[0].scope").value("SITE"))
          .andExpect(jsonPath("$.insights[0].rankScore").value(0.6525))
          .andExpect(jsonPath("$.insights[0].evidence[0].label").value("Threshold"))
          .andExpect(jsonPath("$.summary.total").value(1))
          .andExpect(jsonPath("$.summary.warning").value(1));
    }

    @Test
    @DisplayName("should_Return404_When_ProfileUnknown")
    void should_Return404_When_ProfileUnknown() throws Exception {
      when(insightService.generateReport(eq("stadium"), any(MetricsSnapshot.class)))
          .thenThrow(new UnknownEnvironmentProfileException("stadium"));

      mockMvc
          .perform(
              post("/api/insights/stadium").contentType(MediaType.APPLICATION_JSON).content("{}"))
          .andExpect(status().isNotFound())
          .andExpect(jsonPath("$.status").value(404))
          .andExpect(jsonPath("$.error").value("Unknown Environment Profile"))
          .andExpect(jsonPath("$.profileId").value("stadium"));
    }

    @Test
    @DisplayName("should_Return400_When_BodyMalformed")
    void should_Return400_When_BodyMalformed() throws Exception {
      mockMvc
          .perform(
              post("/api/insights/office")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"rfqi\": "))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.error").value("Malformed Request"));
    }
  }

  @Nested
  @DisplayName("Out of range metrics")
  class OutOfRangeMetrics {

    private MockMvc realServiceMockMvc;

    @BeforeEach
    void setUp() {
      Thresholds office = new Thresholds(70.0, 85.0, 80.0, 0.3, 15.0, 20.0);
      EnvironmentProfileStore store =
          new EnvironmentProfileStore(
              new EnvironmentProfilesConfigurationProperties(
                  Map.of("office", new ProfileDefinition("Office", null, office))));
      Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
      InsightService realService =
          new InsightService(
              store,
              new InsightRuleEvaluator(),
              new InsightRanker(clock, new InsightsConfigurationProperties(null)),
              clock,
              new SimpleMeterRegistry());
      realServiceMockMvc =
          MockMvcBuilders.standaloneSetup(new InsightsController(realService))
              .setControllerAdvice(new GlobalExceptionHandler())
              .build();
    }

    @Test
    @DisplayName("should_StillReportOtherInsights_When_OneMetricOutOfRange")
    void should_StillReportOtherInsights_When_OneMetricOutOfRange() throws Exception {
      // interference 1.05 is above its nominal 0-1 range; its impact clamps to 1
      realServiceMockMvc
          .perform(
              post("/api/insights/office")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"rfqi\": 30, \"interference\": 1.05}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.insights.length()").value(2))
          .andExpect(jsonPath("$.insights[0].category").value("interference"))
          .andExpect(jsonPath("$.insights[0].impact").value(1.0))
          .andExpect(jsonPath("$.insights[1].category").value("rf_quality"))
          .andExpect(jsonPath("$.insights[1].severity").value("critical"))
          .andExpect(jsonPath("$.summary.critical").value(1));
    }
  }

  @Nested
  @DisplayName("Profiles")
  class Profiles {

    @Test
    @DisplayName("should_ListProfiles")
    void should_ListProfiles() throws Exception {
      when(insightService.listProfiles()).thenReturn(List.of(OFFICE));

      mockMvc
          .perform(get("/api/insights/profiles"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$[0].id").value("office"))
          .andExpect(jsonPath("$[0].thresholds.rfqiPoor").value(65.0));
    }

    @Test
    @DisplayName("should_ReturnSingleProfile")
    void should_ReturnSingleProfile() throws Exception {
      when(insightService.getProfile("Office")).thenReturn(OFFICE);

      mockMvc
          .perform(get("/api/insights/profiles/Office"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.name").value("Office"))
          .andExpect(jsonPath("$.thresholds.clientDensity").value(35.0));
    }

    @Test
    @DisplayName("should_Return404_When_ProfileMissing")
    void should_Return404_When_ProfileMissing() throws Exception {
      when(insightService.getProfile("stadium"))
          .thenThrow(new UnknownEnvironmentProfileException("stadium"));

      mockMvc
          .perform(get("/api/insights/profiles/stadium"))
          .andExpect(status().isNotFound())
          .andExpect(jsonPath("$.message").value("Unknown environment profile: stadium"));
    }
  }
}
