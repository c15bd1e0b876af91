package com.wifi.insights.roaming;

import org.springframework.stereotype.Component;

/**
 * Derives the status of a trail event from its type and signal.
 *
 * <ul>
 *   <li>De-registration and Disassociate: always BAD
 *   <li>RSSI &gt;= -60 dBm: GOOD
 *   <li>-70 &lt;= RSSI &lt; -60 dBm: WARNING
 *   <li>RSSI &lt; -70 dBm: BAD
 *   <li>no RSSI: GOOD
 * </ul>
 */
@Component
public class RoamingStatusClassifier {

  static final int GOOD_RSSI_DBM = -60;
  static final int WARNING_RSSI_DBM = -70;

  public RoamingStatus classify(String eventType, Integer rssi) {
    boolean disconnect =
        TrailEventType.fromLabel(eventType).map(TrailEventType::isDisconnect).orElse(false);
    if (disconnect) {
      return RoamingStatus.BAD;
    }
    if (rssi == null) {
      return RoamingStatus.GOOD;
    }
    if (rssi >= GOOD_RSSI_DBM) {
      return RoamingStatus.GOOD;
    }
    if (rssi >= WARNING_RSSI_DBM) {
      return RoamingStatus.WARNING;
    }
    return RoamingStatus.BAD;
  }
}
