package com.wifi.insights.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.wifi.insights.dto.RawStationEvent;
import com.wifi.insights.dto.RoamingTrailRequest;
import com.wifi.insights.roaming.BandSteeringDetector;
import com.wifi.insights.roaming.EventNormalizer;
import com.wifi.insights.roaming.RoamingEvent;
import com.wifi.insights.roaming.RoamingTrail;
import com.wifi.insights.roaming.RoamingTrailSummary;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Reconstructs a client's roaming trail from its raw controller events.
 *
 * <p>Pipeline:
 *
 * <ol>
 *   <li>Drop events whose type does not take part in roaming
 *   <li>Normalize the rest; events without a usable timestamp are dropped
 *   <li>Sort by timestamp ascending (stable, so equal timestamps keep input order)
 *   <li>Flag band steering against each event's immediate predecessor
 *   <li>Summarize the ordered trail
 * </ol>
 *
 * <p>The input list is never modified and every call builds its own event copies, so concurrent
 * calls need no coordination.
 */
@Service
@Slf4j
public class RoamingTrailService {

  private static final Comparator<RoamingEvent> CHRONOLOGICAL =
      Comparator.comparingLong(RoamingEvent::timestamp);

  private final EventNormalizer normalizer;
  private final BandSteeringDetector bandSteeringDetector;

  private final Counter normalizedCounter;
  private final Counter filteredCounter;
  private final Counter droppedCounter;
  private final Counter bandSteeringCounter;

  public RoamingTrailService(
      EventNormalizer normalizer,
      BandSteeringDetector bandSteeringDetector,
      MeterRegistry meterRegistry) {
    this.normalizer = normalizer;
    this.bandSteeringDetector = bandSteeringDetector;
    this.normalizedCounter =
        Counter.builder("roaming.trail.events")
            .tag("outcome", "normalized")
            .description("Events that made it onto a roaming trail")
            .register(meterRegistry);
    this.filteredCounter =
        Counter.builder("roaming.trail.events")
            .tag("outcome", "filtered")
            .description("Events whose type does not take part in roaming")
            .register(meterRegistry);
    this.droppedCounter =
        Counter.builder("roaming.trail.events")
            .tag("outcome", "dropped")
            .description("Roaming events dropped for an unusable timestamp")
            .register(meterRegistry);
    this.bandSteeringCounter =
        Counter.builder("roaming.band_steering.detected")
            .description("Transitions classified as band steering")
            .register(meterRegistry);
  }

  public RoamingTrail buildTrail(RoamingTrailRequest request) {
    List<RoamingEvent> events = buildEvents(request.events());
    return new RoamingTrail(
        request.macAddress(), request.hostName(), events, RoamingTrailSummary.from(events));
  }

  /**
   * Runs the trail pipeline over raw events.
   *
   * @param rawEvents controller events in any order; null is treated as empty
   * @return annotated events ordered by timestamp ascending
   */
  public List<RoamingEvent> buildEvents(List<RawStationEvent> rawEvents) {
    if (rawEvents == null || rawEvents.isEmpty()) {
      return List.of();
    }

    List<RoamingEvent> normalized = new ArrayList<>();
    int filtered = 0;
    int dropped = 0;
    for (RawStationEvent raw : rawEvents) {
      if (!normalizer.isTrailEvent(raw)) {
        filtered++;
        continue;
      }
      Optional<RoamingEvent> event = normalizer.normalize(raw);
      if (event.isPresent()) {
        normalized.add(event.get());
      } else {
        dropped++;
      }
    }

    normalized.sort(CHRONOLOGICAL);
    List<RoamingEvent> trail = bandSteeringDetector.detect(normalized);

    long bandSteering = trail.stream().filter(RoamingEvent::bandSteering).count();
    normalizedCounter.increment(trail.size());
    filteredCounter.increment(filtered);
    droppedCounter.increment(dropped);
    bandSteeringCounter.increment(bandSteering);

    if (dropped > 0) {
      log.warn("Dropped {} roaming events with unusable timestamps", dropped);
    }
    log.debug(
        "Built roaming trail: {} events, {} filtered, {} band steering",
        trail.size(),
        filtered,
        bandSteering);
    return trail;
  }
}
