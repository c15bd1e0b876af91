package com.wifi.insights.roaming;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Parses the free-text details of a controller event into {@link EventDetails}.
 *
 * <p>Tokens have the form {@code Key[Value]} where the key is word characters and the value is
 * anything up to the next {@code ]}. Text outside tokens and unterminated tokens are ignored.
 * A key seen twice keeps its last value. Parsing never fails: bad input gives fewer fields.
 */
@Component
@Slf4j
public class EventDetailsTokenizer {

  private static final Pattern TOKEN_PATTERN = Pattern.compile("(\\w+)\\[([^\\]]+)\\]");

  // Leading signed integer, so "-65" and "-65 dBm" both read as -65
  private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");

  /** Signal keys in precedence order. */
  static final List<String> SIGNAL_KEYS = List.of("Signal", "RSS", "RSSI");

  static final List<String> AUTH_KEYS = List.of("Auth", "AuthMethod");

  public EventDetails parse(String details) {
    if (details == null || details.isBlank()) {
      return EventDetails.EMPTY;
    }

    Map<String, String> attributes = tokenize(details);
    if (attributes.isEmpty()) {
      return EventDetails.EMPTY;
    }

    return new EventDetails(
        attributes,
        parseRssi(firstPresent(attributes, SIGNAL_KEYS)),
        attributes.get("Cause"),
        attributes.get("Reason"),
        attributes.get("Code"),
        attributes.get("Status"),
        attributes.get("Channel"),
        attributes.get("Band"),
        firstPresent(attributes, AUTH_KEYS));
  }

  Map<String, String> tokenize(String details) {
    Map<String, String> attributes = new LinkedHashMap<>();
    Matcher matcher = TOKEN_PATTERN.matcher(details);
    while (matcher.find()) {
      attributes.put(matcher.group(1), matcher.group(2));
    }
    return attributes;
  }

  private static String firstPresent(Map<String, String> attributes, List<String> keys) {
    for (String key : keys) {
      String value = attributes.get(key);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  Integer parseRssi(String value) {
    if (value == null) {
      return null;
    }
    Matcher matcher = LEADING_INTEGER.matcher(value);
    if (!matcher.find()) {
      log.debug("Ignoring non-numeric signal value '{}'", value);
      return null;
    }
    try {
      return Integer.valueOf(matcher.group(1));
    } catch (NumberFormatException e) {
      log.debug("Ignoring out of range signal value '{}'", value);
      return null;
    }
  }
}
