package com.wifi.insights.roaming;

import java.util.Map;

/**
 * Typed view of the {@code Key[Value]} tokens found in an event's details text.
 *
 * <p>Every typed field is null when the token was missing or could not be parsed. {@code
 * attributes} keeps all tokens as found, including keys with no typed field.
 */
public record EventDetails(
    Map<String, String> attributes,
    Integer rssi,
    String cause,
    String reason,
    String code,
    String status,
    String channel,
    String band,
    String authMethod) {

  public static final EventDetails EMPTY =
      new EventDetails(Map.of(), null, null, null, null, null, null, null, null);

  public EventDetails {
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }
}
