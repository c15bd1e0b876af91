package com.wifi.insights.roaming;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.springframework.stereotype.Component;

/**
 * Flags transitions that stay on one access point but move to another radio.
 *
 * <p>Each event is compared with its immediate predecessor only. Event {@code i} is band
 * steering when both events are on the same AP (equal name, or equal serial) and either both
 * bands are present and differ, or both channels are present and differ. The first event is
 * never flagged, and missing band and channel data never counts as steering.
 *
 * <p>The input must already be sorted by timestamp ascending. It is not modified; annotated
 * copies are returned.
 */
@Component
public class BandSteeringDetector {

  public List<RoamingEvent> detect(List<RoamingEvent> chronologicalEvents) {
    if (chronologicalEvents == null || chronologicalEvents.isEmpty()) {
      return List.of();
    }

    List<RoamingEvent> annotated = new ArrayList<>(chronologicalEvents.size());
    annotated.add(chronologicalEvents.get(0).withBandSteering(false));
    for (int i = 1; i < chronologicalEvents.size(); i++) {
      RoamingEvent previous = chronologicalEvents.get(i - 1);
      RoamingEvent current = chronologicalEvents.get(i);
      annotated.add(current.withBandSteering(isBandSteering(previous, current)));
    }
    return annotated;
  }

  static boolean isBandSteering(RoamingEvent previous, RoamingEvent current) {
    return sameAccessPoint(previous, current)
        && (bothPresentAndDifferent(previous.band(), current.band())
            || bothPresentAndDifferent(previous.channel(), current.channel()));
  }

  static boolean sameAccessPoint(RoamingEvent previous, RoamingEvent current) {
    return bothPresentAndEqual(previous.apName(), current.apName())
        || bothPresentAndEqual(previous.apSerial(), current.apSerial());
  }

  private static boolean bothPresentAndEqual(String a, String b) {
    return a != null && b != null && a.equals(b);
  }

  private static boolean bothPresentAndDifferent(String a, String b) {
    return a != null && b != null && !Objects.equals(a, b);
  }
}
