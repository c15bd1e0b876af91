package com.wifi.insights.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;

/**
 * Point-in-time network metrics evaluated by the insight rules.
 *
 * <p>Every field is optional. A null field means the metric was not reported, and rules that
 * need it do not fire. It never means zero. Values outside their nominal range are accepted;
 * rule impacts are clamped to [0, 1], so a noisy reading only affects its own rules.
 *
 * @param rfqi RF quality index, 0-100
 * @param channelUtilization channel utilization in percent
 * @param interference interference as a 0-1 fraction
 * @param noiseFloorDbm noise floor in dBm
 * @param retryRate frame retry rate in percent
 * @param clientCount connected clients
 * @param apCount total access points
 * @param apOnlineCount access points currently online
 * @param throughputBps throughput in bits per second
 * @param avgRssi average client RSSI in dBm
 * @param avgSnr average client SNR in dB
 * @param latencyMs latency in milliseconds
 * @param timestamp snapshot time in epoch milliseconds
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetricsSnapshot(
    Double rfqi,
    Double channelUtilization,
    Double interference,
    Double noiseFloorDbm,
    Double retryRate,
    Integer clientCount,
    Integer apCount,
    Integer apOnlineCount,
    Double throughputBps,
    Double avgRssi,
    Double avgSnr,
    Double latencyMs,
    Long timestamp) {}
