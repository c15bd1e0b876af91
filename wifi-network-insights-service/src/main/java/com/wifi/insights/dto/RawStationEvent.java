package com.wifi.insights.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Builder;

/**
 * A station event record as reported by the wireless controller.
 *
 * <p>Only {@code timestamp} and {@code eventType} are expected on every record. {@code details}
 * is free text carrying {@code Key[Value]} tokens such as {@code Signal[-62] Band[5GHz]}.
 *
 * @param timestamp epoch milliseconds as a string (ISO-8601 instants are also accepted)
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawStationEvent(
    String timestamp,
    String eventType,
    String apName,
    String apSerial,
    String ssid,
    String details,
    String ipAddress,
    String ipv6Address) {}
