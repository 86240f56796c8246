package ca.gc.cra.netwatch.application.report;

import ca.gc.cra.netwatch.domain.telemetry.TelemetrySnapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the interim and final statistics blocks printed in streaming mode.
 */
public final class CaptureSummaryFormatter {
  private CaptureSummaryFormatter() {}

  /**
   * Periodic statistics: duration, packets and rate, data volume, protocol counts.
   *
   * @param snapshot current telemetry
   * @return lines of the block
   */
  public static List<String> interim(TelemetrySnapshot snapshot) {
    String rule = "=".repeat(50);
    List<String> lines = new ArrayList<>();
    lines.add("");
    lines.add("Interim Statistics");
    lines.add(rule);
    lines.add(String.format(Locale.ROOT, "Duration: %ds | Packets: %d (%.1f/s)",
        snapshot.elapsedSeconds(), snapshot.totalPackets(), snapshot.packetsPerSecond()));
    lines.add("Total Data: " + ByteUnits.format(snapshot.totalBytes()));
    lines.add("Protocols:");
    for (Map.Entry<String, Long> entry : snapshot.protocolCounts().entrySet()) {
      lines.add("   > " + entry.getKey() + ": " + entry.getValue());
    }
    lines.add(rule);
    lines.add("");
    return lines;
  }

  /**
   * End-of-capture summary with protocol and application protocol tables.
   *
   * @param snapshot final telemetry
   * @return lines of the summary
   */
  public static List<String> finalSummary(TelemetrySnapshot snapshot) {
    String rule = "=".repeat(80);
    List<String> lines = new ArrayList<>();
    lines.add("");
    lines.add("Capture Complete - Final Summary");
    lines.add(rule);
    lines.add("Total Duration: " + snapshot.elapsedSeconds() + 's');
    lines.add(String.format(Locale.ROOT, "Total Packets: %d (%.2f packets/second)",
        snapshot.totalPackets(), snapshot.packetsPerSecond()));
    lines.add(String.format(Locale.ROOT, "Total Data: %s (%.2f bytes/second)",
        ByteUnits.format(snapshot.totalBytes()), snapshot.bytesPerSecond()));
    lines.add("");
    lines.add("Protocol Distribution:");
    lines.addAll(distribution("Protocol", snapshot.protocolCounts(), snapshot.totalPackets()).render());
    if (!snapshot.applicationCounts().isEmpty()) {
      lines.add("");
      lines.add("Application Protocols:");
      lines.addAll(
          distribution("Application", snapshot.applicationCounts(), snapshot.totalPackets()).render());
    }
    lines.add(rule);
    return lines;
  }

  static TextTable distribution(String title, Map<String, Long> counts, long total) {
    TextTable table = new TextTable(List.of(title, "Packets", "Percentage"));
    for (Map.Entry<String, Long> entry : counts.entrySet()) {
      table.addRow(List.of(entry.getKey(), Long.toString(entry.getValue()), percent(entry.getValue(), total)));
    }
    return table;
  }

  static String percent(long count, long total) {
    double pct = total > 0 ? count * 100d / total : 0d;
    return String.format(Locale.ROOT, "%.1f%%", pct);
  }
}
