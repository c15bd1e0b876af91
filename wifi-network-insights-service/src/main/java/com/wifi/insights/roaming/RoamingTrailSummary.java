package com.wifi.insights.roaming;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Aggregates over an ordered trail for the timeline view.
 *
 * <p>Access points are listed in first-seen order. Events without an AP name are grouped under
 * {@value #UNKNOWN_AP}. {@code firstEventAt} and {@code lastEventAt} are absent for an empty
 * trail.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoamingTrailSummary(
    int eventCount,
    int bandSteeringCount,
    int goodCount,
    int warningCount,
    int badCount,
    List<AccessPointVisit> accessPoints,
    Long firstEventAt,
    Long lastEventAt) {

  public static final String UNKNOWN_AP = "Unknown AP";

  public static RoamingTrailSummary from(List<RoamingEvent> chronologicalEvents) {
    if (chronologicalEvents == null || chronologicalEvents.isEmpty()) {
      return new RoamingTrailSummary(0, 0, 0, 0, 0, List.of(), null, null);
    }

    Map<String, Integer> eventsPerAp = new LinkedHashMap<>();
    int bandSteering = 0;
    int good = 0;
    int warning = 0;
    int bad = 0;
    long first = Long.MAX_VALUE;
    long last = Long.MIN_VALUE;

    for (RoamingEvent event : chronologicalEvents) {
      String apName = event.apName() == null ? UNKNOWN_AP : event.apName();
      eventsPerAp.merge(apName, 1, Integer::sum);
      if (event.bandSteering()) {
        bandSteering++;
      }
      if (event.status() != null) {
        switch (event.status()) {
          case GOOD -> good++;
          case WARNING -> warning++;
          case BAD -> bad++;
        }
      }
      first = Math.min(first, event.timestamp());
      last = Math.max(last, event.timestamp());
    }

    List<AccessPointVisit> visits = new ArrayList<>(eventsPerAp.size());
    eventsPerAp.forEach((apName, count) -> visits.add(new AccessPointVisit(apName, count)));

    return new RoamingTrailSummary(
        chronologicalEvents.size(),
        bandSteering,
        good,
        warning,
        bad,
        List.copyOf(visits),
        first,
        last);
  }
}
