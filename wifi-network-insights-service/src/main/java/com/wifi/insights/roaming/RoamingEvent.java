package com.wifi.insights.roaming;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;

/**
 * A normalized station event on a client's roaming trail.
 *
 * <p>Created once per raw event by {@link EventNormalizer}; {@link BandSteeringDetector} is the
 * only step that sets {@code bandSteering}, and it does so on a copy. {@code apName}, {@code
 * apSerial} and {@code ssid} stay null when the controller did not report them.
 *
 * @param timestamp event time in epoch milliseconds
 * @param statusCode value of the {@code Status[...]} token
 * @param status classification computed by {@link RoamingStatusClassifier}
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoamingEvent(
    long timestamp,
    String eventType,
    String apName,
    String apSerial,
    String ssid,
    String details,
    String cause,
    String reason,
    String code,
    String statusCode,
    String channel,
    String band,
    String authMethod,
    Integer rssi,
    String ipAddress,
    String ipv6Address,
    RoamingStatus status,
    @JsonProperty("isBandSteering") boolean bandSteering) {

  public RoamingEvent withBandSteering(boolean bandSteering) {
    return toBuilder().bandSteering(bandSteering).build();
  }
}
