package com.wifi.insights.roaming;

import java.util.Optional;

/** Controller event types that take part in a roaming trail. */
public enum TrailEventType {
  ROAM("Roam", false),
  REGISTRATION("Registration", false),
  DE_REGISTRATION("De-registration", true),
  ASSOCIATE("Associate", false),
  DISASSOCIATE("Disassociate", true),
  STATE_CHANGE("State Change", false);

  private final String label;
  private final boolean disconnect;

  TrailEventType(String label, boolean disconnect) {
    this.label = label;
    this.disconnect = disconnect;
  }

  /** The event type string as the controller reports it. */
  public String getLabel() {
    return label;
  }

  public boolean isDisconnect() {
    return disconnect;
  }

  /** Exact, case-sensitive match on the controller label. */
  public static Optional<TrailEventType> fromLabel(String label) {
    if (label == null) {
      return Optional.empty();
    }
    for (TrailEventType type : values()) {
      if (type.label.equals(label)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
