package com.wifi.insights.roaming;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.wifi.insights.dto.RawStationEvent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Converts raw controller events into {@link RoamingEvent}s.
 *
 * <p>Only event types listed in {@link TrailEventType} take part in a trail; callers filter
 * with {@link #isTrailEvent} first. The details text is parsed by {@link EventDetailsTokenizer}
 * and the status is classified here, once, from the event type and parsed RSSI.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventNormalizer {

  private static final Pattern EPOCH_MILLIS = Pattern.compile("-?\\d+");

  private final EventDetailsTokenizer tokenizer;
  private final RoamingStatusClassifier statusClassifier;

  public boolean isTrailEvent(RawStationEvent event) {
    return event != null && TrailEventType.fromLabel(event.eventType()).isPresent();
  }

  /**
   * Normalizes one raw event.
   *
   * @return the roaming event, or empty when the event has no usable timestamp
   */
  public Optional<RoamingEvent> normalize(RawStationEvent event) {
    if (event == null) {
      return Optional.empty();
    }
    Optional<Long> timestamp = parseTimestamp(event.timestamp());
    if (timestamp.isEmpty()) {
      log.debug(
          "Dropping {} event with unparseable timestamp '{}'",
          event.eventType(),
          event.timestamp());
      return Optional.empty();
    }

    EventDetails details = tokenizer.parse(event.details());
    return Optional.of(
        RoamingEvent.builder()
            .timestamp(timestamp.get())
            .eventType(event.eventType())
            .apName(event.apName())
            .apSerial(event.apSerial())
            .ssid(event.ssid())
            .details(event.details())
            .cause(details.cause())
            .reason(details.reason())
            .code(details.code())
            .statusCode(details.status())
            .channel(details.channel())
            .band(details.band())
            .authMethod(details.authMethod())
            .rssi(details.rssi())
            .ipAddress(event.ipAddress())
            .ipv6Address(event.ipv6Address())
            .status(statusClassifier.classify(event.eventType(), details.rssi()))
            .bandSteering(false)
            .build());
  }

  static Optional<Long> parseTimestamp(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String value = raw.trim();
    try {
      if (EPOCH_MILLIS.matcher(value).matches()) {
        return Optional.of(Long.parseLong(value));
      }
      return Optional.of(Instant.parse(value).toEpochMilli());
    } catch (NumberFormatException | DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
