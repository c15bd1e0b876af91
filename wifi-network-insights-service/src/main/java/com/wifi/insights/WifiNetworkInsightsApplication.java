package com.wifi.insights;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the WiFi Network Insights Service.
 *
 * <p>The service turns network telemetry into operator-facing output for the operations
 * dashboard. It has two independent pipelines:
 *
 * <ul>
 *   <li><strong>Insights:</strong> a metrics snapshot is evaluated against the thresholds of an
 *       environment profile, and every triggered rule becomes an insight card ranked by a
 *       weighted score
 *   <li><strong>Roaming trails:</strong> a client's raw controller event log is normalized,
 *       classified and ordered, and same-AP radio transitions are flagged as band steering
 * </ul>
 *
 * <p>Every request is an independent recomputation over the supplied input. Nothing is
 * persisted between calls and nothing runs in the background.
 *
 * @author WiFi Location Data Pipeline Team
 * @version 1.0
 * @since 2024
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.wifi.insights.config.properties")
public class WifiNetworkInsightsApplication {

  public static void main(String[] args) {
    SpringApplication.run(WifiNetworkInsightsApplication.class, args);
  }
}
