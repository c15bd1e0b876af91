package com.wifi.insights.insight;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

import com.wifi.insights.dto.MetricsSnapshot;
import com.wifi.insights.dto.Thresholds;

/**
 * The fixed set of insight rules, in evaluation order.
 *
 * <p>Each rule fires only when every metric it reads is present and its condition holds. Impact
 * is clamped to [0, 1]. Confidence reflects how directly the metric maps to the symptom: an
 * offline AP count is a direct observation (1.0) while interference is inferred (0.8).
 *
 * <table>
 *   <caption>Rules</caption>
 *   <tr><th>Key</th><th>Fires when</th><th>Impact</th><th>Scope</th></tr>
 *   <tr><td>rfqi-low</td><td>rfqi &lt; rfqiPoor</td><td>1 - rfqi/100</td><td>SITE</td></tr>
 *   <tr><td>channel-util-high</td><td>util &gt; channelUtilizationPct</td>
 *       <td>(util - t)/(100 - t)</td><td>SITE</td></tr>
 *   <tr><td>interference-high</td><td>interference &gt; interferenceHigh</td>
 *       <td>(i - t)/0.3</td><td>SITE</td></tr>
 *   <tr><td>retry-rate-high</td><td>retry &gt; retryRatePct</td><td>(r - t)/20</td>
 *       <td>AP</td></tr>
 *   <tr><td>ap-offline</td><td>offline &gt; 0 and offline% &gt; 5</td><td>offline%/30</td>
 *       <td>SITE</td></tr>
 *   <tr><td>client-density</td><td>clients/online AP &gt; 1.2 x clientDensity</td>
 *       <td>(perAp - d)/d</td><td>SITE</td></tr>
 *   <tr><td>rssi-low</td><td>avgRssi &lt; -75</td><td>(-75 - rssi)/15</td><td>CLIENT</td></tr>
 * </table>
 */
public final class InsightRuleCatalog {

  static final double CRITICAL_RFQI_FACTOR = 0.7;
  static final double INTERFERENCE_IMPACT_SPAN = 0.3;
  static final double RETRY_IMPACT_SPAN = 20.0;
  static final double AP_OFFLINE_MIN_PERCENT = 5.0;
  static final double AP_OFFLINE_CRITICAL_PERCENT = 20.0;
  static final double AP_OFFLINE_IMPACT_SPAN = 30.0;
  static final double CLIENT_DENSITY_HEADROOM = 1.2;
  static final double WEAK_RSSI_DBM = -75.0;
  static final double VERY_WEAK_RSSI_DBM = -80.0;
  static final double RSSI_IMPACT_SPAN = 15.0;

  private static final List<InsightRule> RULES =
      List.of(
          new InsightRule("rfqi-low", InsightRuleCatalog::rfqiLow, InsightRuleCatalog::rfqiCandidate),
          new InsightRule(
              "channel-util-high",
              InsightRuleCatalog::channelUtilizationHigh,
              InsightRuleCatalog::channelUtilizationCandidate),
          new InsightRule(
              "interference-high",
              InsightRuleCatalog::interferenceHigh,
              InsightRuleCatalog::interferenceCandidate),
          new InsightRule(
              "retry-rate-high", InsightRuleCatalog::retryRateHigh, InsightRuleCatalog::retryCandidate),
          new InsightRule(
              "ap-offline", InsightRuleCatalog::apOffline, InsightRuleCatalog::apOfflineCandidate),
          new InsightRule(
              "client-density",
              InsightRuleCatalog::clientDensityHigh,
              InsightRuleCatalog::clientDensityCandidate),
          new InsightRule(
              "rssi-low", InsightRuleCatalog::weakClientSignal, InsightRuleCatalog::rssiCandidate));

  private InsightRuleCatalog() {}

  public static List<InsightRule> rules() {
    return RULES;
  }

  // RF quality

  private static boolean rfqiLow(RuleContext ctx) {
    Double rfqi = ctx.metrics().rfqi();
    return rfqi != null && rfqi < ctx.thresholds().rfqiPoor();
  }

  private static InsightCandidate rfqiCandidate(RuleContext ctx) {
    MetricsSnapshot m = ctx.metrics();
    Thresholds t = ctx.thresholds();
    double rfqi = m.rfqi();
    InsightSeverity severity =
        rfqi < t.rfqiPoor() * CRITICAL_RFQI_FACTOR
            ? InsightSeverity.CRITICAL
            : InsightSeverity.WARNING;
    return new InsightCandidate(
        "rfqi-low",
        "RF Quality Below Threshold",
        String.format(
            "In a %s environment, RF quality below %s%% impacts client connectivity and user"
                + " experience.",
            ctx.profileName(), number(t.rfqiPoor())),
        List.of(
            InsightEvidence.measured("Current RFQI", rfqi, "%", "rfqi", m.timestamp()),
            InsightEvidence.reference("Target", t.rfqiTarget(), "%"),
            InsightEvidence.of("Profile", ctx.profileName())),
        "Review RF environment for interference sources. Consider channel optimization or AP"
            + " power adjustments.",
        InsightCategory.RF_QUALITY,
        severity,
        InsightScope.SITE,
        clamp(1.0 - rfqi / 100.0),
        0.9,
        0.5);
  }

  // Channel utilization

  private static boolean channelUtilizationHigh(RuleContext ctx) {
    Double utilization = ctx.metrics().channelUtilization();
    return utilization != null && utilization > ctx.thresholds().channelUtilizationPct();
  }

  private static InsightCandidate channelUtilizationCandidate(RuleContext ctx) {
    MetricsSnapshot m = ctx.metrics();
    double limit = ctx.thresholds().channelUtilizationPct();
    double utilization = m.channelUtilization();
    return new InsightCandidate(
        "channel-util-high",
        "High Channel Utilization Detected",
        String.format(
            "Channel utilization above %s%% in %s environments can cause client contention and"
                + " reduced throughput.",
            number(limit), ctx.profileName()),
        List.of(
            InsightEvidence.measured(
                "Channel Utilization", utilization, "%", "channelUtilization", m.timestamp()),
            InsightEvidence.reference("Threshold", limit, "%")),
        "Consider load balancing clients across APs or adding capacity in high-density areas.",
        InsightCategory.CHANNEL_UTILIZATION,
        InsightSeverity.WARNING,
        InsightScope.SITE,
        clamp((utilization - limit) / (100.0 - limit)),
        0.85,
        0.6);
  }

  // Interference

  private static boolean interferenceHigh(RuleContext ctx) {
    Double interference = ctx.metrics().interference();
    return interference != null && interference > ctx.thresholds().interferenceHigh();
  }

  private static InsightCandidate interferenceCandidate(RuleContext ctx) {
    MetricsSnapshot m = ctx.metrics();
    double limit = ctx.thresholds().interferenceHigh();
    double interference = m.interference();
    String limitPercent = String.format(Locale.ROOT, "%.0f%%", limit * 100.0);
    return new InsightCandidate(
        "interference-high",
        "RF Interference Elevated",
        String.format(
            "Interference above %s degrades signal quality and increases retries in %s"
                + " deployments.",
            limitPercent, ctx.profileName()),
        List.of(
            InsightEvidence.measured(
                "Interference Level",
                String.format(Locale.ROOT, "%.1f%%", interference * 100.0),
                null,
                "interference",
                m.timestamp()),
            InsightEvidence.of("Threshold", limitPercent)),
        "Identify interference sources (microwaves, Bluetooth, neighboring networks). Consider"
            + " dynamic channel selection.",
        InsightCategory.INTERFERENCE,
        InsightSeverity.WARNING,
        InsightScope.SITE,
        clamp((interference - limit) / INTERFERENCE_IMPACT_SPAN),
        0.8,
        0.4);
  }

  // Retry rate

  private static boolean retryRateHigh(RuleContext ctx) {
    Double retryRate = ctx.metrics().retryRate();
    return retryRate != null && retryRate > ctx.thresholds().retryRatePct();
  }

  private static InsightCandidate retryCandidate(RuleContext ctx) {
    MetricsSnapshot m = ctx.metrics();
    double limit = ctx.thresholds().retryRatePct();
    double retryRate = m.retryRate();
    return new InsightCandidate(
        "retry-rate-high",
        "Elevated Wireless Retry Rate",
        String.format(
            "Retry rates above %s%% indicate RF issues or interference affecting %s operations.",
            number(limit), ctx.profileName()),
        List.of(
            InsightEvidence.measured("Retry Rate", retryRate, "%", "retryRate", m.timestamp()),
            InsightEvidence.reference("Acceptable Limit", limit, "%")),
        "Check for co-channel interference, adjust AP transmit power, or relocate affected"
            + " clients.",
        InsightCategory.RF_QUALITY,
        InsightSeverity.WARNING,
        InsightScope.AP,
        clamp((retryRate - limit) / RETRY_IMPACT_SPAN),
        0.75,
        0.5);
  }

  // AP connectivity

  private static boolean apOffline(RuleContext ctx) {
    Integer apCount = ctx.metrics().apCount();
    Integer online = ctx.metrics().apOnlineCount();
    if (apCount == null || online == null || apCount <= 0) {
      return false;
    }
    int offline = apCount - online;
    return offline > 0 && offlinePercent(apCount, online) > AP_OFFLINE_MIN_PERCENT;
  }

  private static InsightCandidate apOfflineCandidate(RuleContext ctx) {
    MetricsSnapshot m = ctx.metrics();
    int offline = m.apCount() - m.apOnlineCount();
    double percent = offlinePercent(m.apCount(), m.apOnlineCount());
    return new InsightCandidate(
        "ap-offline",
        offline + " Access Points Offline",
        String.format(
            Locale.ROOT,
            "%.0f%% of APs offline creates coverage gaps in %s deployment.",
            percent,
            ctx.profileName()),
        List.of(
            InsightEvidence.of("Offline APs", offline),
            InsightEvidence.of("Total APs", m.apCount()),
            InsightEvidence.of("Online", m.apOnlineCount())),
        "Check network connectivity to offline APs. Verify power and physical connections.",
        InsightCategory.CONNECTIVITY,
        percent > AP_OFFLINE_CRITICAL_PERCENT ? InsightSeverity.CRITICAL : InsightSeverity.WARNING,
        InsightScope.SITE,
        clamp(percent / AP_OFFLINE_IMPACT_SPAN),
        1.0,
        0.3);
  }

  private static double offlinePercent(int apCount, int online) {
    return (apCount - online) * 100.0 / apCount;
  }

  // Client density

  private static boolean clientDensityHigh(RuleContext ctx) {
    Integer clients = ctx.metrics().clientCount();
    Integer online = ctx.metrics().apOnlineCount();
    if (clients == null || online == null || online <= 0) {
      return false;
    }
    return (double) clients / online
        > ctx.thresholds().clientDensity() * CLIENT_DENSITY_HEADROOM;
  }

  private static InsightCandidate clientDensityCandidate(RuleContext ctx) {
    MetricsSnapshot m = ctx.metrics();
    double target = ctx.thresholds().clientDensity();
    double perAp = (double) m.clientCount() / m.apOnlineCount();
    return new InsightCandidate(
        "client-density",
        "High Client Density Per AP",
        String.format(
            Locale.ROOT,
            "%.0f clients per AP exceeds %s capacity planning threshold of %s.",
            perAp,
            ctx.profileName(),
            number(target)),
        List.of(
            InsightEvidence.of("Clients/AP", String.format(Locale.ROOT, "%.1f", perAp)),
            InsightEvidence.of("Total Clients", m.clientCount()),
            InsightEvidence.of("Online APs", m.apOnlineCount())),
        "Consider adding access points to high-density areas or enabling band steering.",
        InsightCategory.CAPACITY,
        InsightSeverity.INFO,
        InsightScope.SITE,
        clamp((perAp - target) / target),
        0.9,
        0.7);
  }

  // Client signal

  private static boolean weakClientSignal(RuleContext ctx) {
    Double avgRssi = ctx.metrics().avgRssi();
    return avgRssi != null && avgRssi < WEAK_RSSI_DBM;
  }

  private static InsightCandidate rssiCandidate(RuleContext ctx) {
    MetricsSnapshot m = ctx.metrics();
    double avgRssi = m.avgRssi();
    return new InsightCandidate(
        "rssi-low",
        "Clients Experiencing Weak Signal",
        String.format(
            "Average RSSI of %s dBm is below -75 dBm threshold for reliable connectivity.",
            number(avgRssi)),
        List.of(
            InsightEvidence.measured("Average RSSI", avgRssi, "dBm", "rssi", m.timestamp()),
            InsightEvidence.reference("Recommended", "-65 to -70", "dBm")),
        "Review AP placement. Clients may be too far from access points or experiencing physical"
            + " obstructions.",
        InsightCategory.CLIENT_PERFORMANCE,
        avgRssi < VERY_WEAK_RSSI_DBM ? InsightSeverity.WARNING : InsightSeverity.INFO,
        InsightScope.CLIENT,
        clamp((WEAK_RSSI_DBM - avgRssi) / RSSI_IMPACT_SPAN),
        0.7,
        0.6);
  }

  static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }

  /** Formats without a trailing ".0" so whole thresholds read as "70", not "70.0". */
  private static String number(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
