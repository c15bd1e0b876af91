package com.wifi.insights.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

/**
 * Per-profile limits used by the insight rules.
 *
 * @param rfqiPoor RF quality index below which RF quality is reported (0-100)
 * @param rfqiTarget RF quality index the profile aims for (0-100)
 * @param channelUtilizationPct channel utilization above which contention is reported (%)
 * @param interferenceHigh interference fraction above which interference is reported (0-1)
 * @param retryRatePct retry rate above which retries are reported (%)
 * @param clientDensity planned clients per online access point
 * @throws IllegalArgumentException if any threshold is null
 */
public record Thresholds(
    @NotNull(message = "rfqiPoor is required")
        @DecimalMin(value = "0.0", message = "rfqiPoor must be at least 0")
        @DecimalMax(value = "100.0", message = "rfqiPoor cannot exceed 100")
        Double rfqiPoor,
    @NotNull(message = "rfqiTarget is required")
        @DecimalMin(value = "0.0", message = "rfqiTarget must be at least 0")
        @DecimalMax(value = "100.0", message = "rfqiTarget cannot exceed 100")
        Double rfqiTarget,
    @NotNull(message = "channelUtilizationPct is required")
        @DecimalMin(value = "0.0", message = "channelUtilizationPct must be at least 0")
        @DecimalMax(
            value = "100.0",
            inclusive = false,
            message = "channelUtilizationPct must be below 100")
        Double channelUtilizationPct,
    @NotNull(message = "interferenceHigh is required")
        @DecimalMin(value = "0.0", message = "interferenceHigh must be at least 0")
        @DecimalMax(value = "1.0", message = "interferenceHigh cannot exceed 1")
        Double interferenceHigh,
    @NotNull(message = "retryRatePct is required")
        @DecimalMin(value = "0.0", message = "retryRatePct must be at least 0")
        @DecimalMax(value = "100.0", message = "retryRatePct cannot exceed 100")
        Double retryRatePct,
    @NotNull(message = "clientDensity is required")
        @DecimalMin(
            value = "0.0",
            inclusive = false,
            message = "clientDensity must be greater than 0")
        Double clientDensity) {

  public Thresholds {
    requirePresent("rfqiPoor", rfqiPoor);
    requirePresent("rfqiTarget", rfqiTarget);
    requirePresent("channelUtilizationPct", channelUtilizationPct);
    requirePresent("interferenceHigh", interferenceHigh);
    requirePresent("retryRatePct", retryRatePct);
    requirePresent("clientDensity", clientDensity);
  }

  private static void requirePresent(String name, Double value) {
    if (value == null) {
      throw new IllegalArgumentException(name + " is required");
    }
  }
}
