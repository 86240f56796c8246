package ca.gc.cra.netwatch.application.dashboard;

import ca.gc.cra.netwatch.application.dashboard.DashboardView.BandwidthBar;
import ca.gc.cra.netwatch.application.dashboard.DashboardView.BucketShare;
import ca.gc.cra.netwatch.application.dashboard.DashboardView.RankedEntry;
import ca.gc.cra.netwatch.application.dashboard.DashboardView.SizeDistribution;
import ca.gc.cra.netwatch.application.dashboard.DashboardView.ThreatStatus;
import ca.gc.cra.netwatch.application.report.ByteUnits;
import ca.gc.cra.netwatch.domain.net.PacketRecord;
import ca.gc.cra.netwatch.domain.telemetry.ConnectionFlow;
import ca.gc.cra.netwatch.domain.telemetry.ThreatAlert;
import ca.gc.cra.netwatch.domain.threat.ThreatLevel;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Lays out a {@link DashboardView} as plain terminal text.
 *
 * <p>Sections appear in a fixed order: header, bandwidth graph, security status, protocols, top connections,
 * ports, packet sizes, geography and live activity. Missing addresses render as {@code ?}.</p>
 *
 * @since 0.1.0
 */
public final class DashboardRenderer {
  static final String TITLE = "NETWATCH NETWORK TRAFFIC DASHBOARD";
  private static final DateTimeFormatter CLOCK =
      DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter ACTIVITY_CLOCK =
      DateTimeFormatter.ofPattern("HH:mm:ss.S").withZone(ZoneOffset.UTC);
  private static final int SIZE_BAR_WIDTH = 30;
  private static final String UNKNOWN_ADDRESS = "?";

  /**
   * Formats a frame.
   *
   * @param view selected content
   * @return frame lines
   */
  public List<String> render(DashboardView view) {
    Objects.requireNonNull(view, "view");
    List<String> out = new ArrayList<>(96);
    String rule = "=".repeat(100);
    out.add(TITLE);
    out.add(rule);
    header(view, out);
    out.add("");
    bandwidth(view, out);
    security(view.threats(), out);
    protocols(view.protocols(), out);
    connections(view.topConnections(), out);
    ports(view.topPorts(), out);
    sizes(view.sizes(), out);
    geography(view.countries(), out);
    activity(view.recentActivity(), out);
    out.add(rule);
    out.add("Press Ctrl+C to stop | Last Updated: " + CLOCK.format(view.takenAt()) + " UTC");
    return out;
  }

  private static void header(DashboardView view, List<String> out) {
    out.add(String.format(Locale.ROOT,
        "Duration: %ds | Packets: %d (%.1f/s) | Data: %s (%.1f/s) | Connections: %d",
        view.elapsedSeconds(), view.totalPackets(), view.packetsPerSecond(),
        ByteUnits.format(view.totalBytes()), view.bytesPerSecond(), view.connections()));
    out.add(String.format(Locale.ROOT, "Peak Bandwidth: %s | Peak Packets: %.1f/s",
        ByteUnits.formatRate(view.peakBytesPerSecond()), view.peakPacketsPerSecond()));
  }

  private static void bandwidth(DashboardView view, List<String> out) {
    out.add("REAL-TIME BANDWIDTH GRAPH");
    if (view.bandwidth().isEmpty()) {
      out.add("   No data available yet...");
      out.add("");
      return;
    }
    out.add("   Peak: " + ByteUnits.formatRate(view.bandwidthScale()));
    for (BandwidthBar bar : view.bandwidth()) {
      out.add("   " + CLOCK.format(bar.timestamp()) + " |"
          + pad("#".repeat(bar.barLength()), DashboardViewBuilder.GRAPH_WIDTH) + "| "
          + ByteUnits.format(bar.bytesPerSecond()));
    }
    out.add("");
  }

  private static void security(ThreatStatus status, List<String> out) {
    String verdict = status.threatCount() == 0 ? "SECURE" : "THREATS DETECTED";
    out.add("SECURITY STATUS: " + verdict + " (" + status.alertCount() + " alerts)");
    out.add(String.format(Locale.ROOT, "   Safe:%d Low:%d Med:%d High:%d Crit:%d",
        status.levelCounts().get(ThreatLevel.SAFE),
        status.levelCounts().get(ThreatLevel.LOW),
        status.levelCounts().get(ThreatLevel.MEDIUM),
        status.levelCounts().get(ThreatLevel.HIGH),
        status.levelCounts().get(ThreatLevel.CRITICAL)));
    if (!status.recentAlerts().isEmpty()) {
      out.add("   Recent Alerts:");
      for (ThreatAlert alert : status.recentAlerts()) {
        out.add("   [" + alert.level().label() + "] " + CLOCK.format(alert.timestamp()) + ' ' + alert.message());
      }
    }
    out.add("");
  }

  private static void protocols(List<RankedEntry> protocols, List<String> out) {
    out.add("PROTOCOL ANALYSIS");
    if (protocols.isEmpty()) {
      out.add("   No packets captured yet...");
    }
    for (RankedEntry entry : protocols) {
      out.add(String.format(Locale.ROOT, "   %-12s %8d %6.1f%%", entry.label(), entry.count(), entry.percentage()));
    }
    out.add("");
  }

  private static void connections(List<ConnectionFlow> flows, List<String> out) {
    out.add("TOP CONNECTIONS");
    if (flows.isEmpty()) {
      out.add("   No connections tracked yet...");
    }
    for (ConnectionFlow flow : flows) {
      out.add(String.format(Locale.ROOT, "   [%-8s] %-47s %-5s %8d %10s",
          flow.threatLevel().label(), flow.key().display(), flow.key().protocol(),
          flow.packetCount(), ByteUnits.format(flow.totalBytes())));
    }
    out.add("");
  }

  private static void ports(List<RankedEntry> ports, List<String> out) {
    out.add("TOP PORT ACTIVITY");
    if (ports.isEmpty()) {
      out.add("   No port activity recorded yet...");
      out.add("");
      return;
    }
    StringBuilder sb = new StringBuilder("  ");
    for (RankedEntry entry : ports) {
      sb.append(' ').append(entry.label()).append(':').append(entry.count());
    }
    out.add(sb.toString());
    out.add("");
  }

  private static void sizes(SizeDistribution sizes, List<String> out) {
    out.add("PACKET SIZE DISTRIBUTION");
    if (sizes.samples() == 0) {
      out.add("   No packet size data available...");
      out.add("");
      return;
    }
    out.add(String.format(Locale.ROOT, "   Avg: %dB Range: %d-%dB Samples: %d",
        (long) sizes.average(), sizes.min(), sizes.max(), sizes.samples()));
    for (BucketShare share : sizes.buckets()) {
      int length = (int) Math.min(SIZE_BAR_WIDTH, share.count() * SIZE_BAR_WIDTH / sizes.samples());
      out.add(String.format(Locale.ROOT, "   %-9s|%s| %d (%.1f%%)",
          share.bucket().label(), pad("#".repeat(length), SIZE_BAR_WIDTH), share.count(), share.percentage()));
    }
    out.add("");
  }

  private static void geography(List<RankedEntry> countries, List<String> out) {
    out.add("GEOGRAPHIC DISTRIBUTION");
    if (countries.isEmpty()) {
      out.add("   No geographic data available...");
      out.add("");
      return;
    }
    StringBuilder sb = new StringBuilder("  ");
    for (RankedEntry entry : countries) {
      sb.append(' ').append(entry.label()).append(": ").append(entry.count());
    }
    out.add(sb.toString());
    out.add("");
  }

  private static void activity(List<PacketRecord> records, List<String> out) {
    out.add("LIVE ACTIVITY STREAM");
    if (records.isEmpty()) {
      out.add("   Waiting for network activity...");
      out.add("");
      return;
    }
    for (PacketRecord record : records) {
      StringBuilder sb = new StringBuilder("   [")
          .append(record.threatLevel().label()).append("] ")
          .append(ACTIVITY_CLOCK.format(record.timestamp())).append(' ')
          .append(record.protocol());
      if (record.applicationProtocol() != null) {
        sb.append(" (").append(record.applicationProtocol()).append(')');
      }
      sb.append(' ').append(Objects.requireNonNullElse(record.srcIp(), UNKNOWN_ADDRESS))
          .append(" -> ").append(Objects.requireNonNullElse(record.dstIp(), UNKNOWN_ADDRESS));
      if (record.geo() != null) {
        sb.append(" [").append(record.geo().isLocal() ? "local" : record.geo().country()).append(']');
      }
      sb.append(' ').append(ByteUnits.format(record.size()));
      out.add(sb.toString());
    }
    out.add("");
  }

  private static String pad(String value, int width) {
    return value.length() >= width ? value : value + " ".repeat(width - value.length());
  }
}
