package ca.gc.cra.netwatch.application.report;

import ca.gc.cra.netwatch.domain.net.PacketRecord;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Formats single records for streaming output.
 *
 * <p>The simple form is one line per record; the detailed form is a block ending with a rule line.</p>
 */
public final class PacketLineFormatter {
  static final DateTimeFormatter TIME =
      DateTimeFormatter.ofPattern("HH:mm:ss.SSS").withZone(ZoneOffset.UTC);
  static final DateTimeFormatter FULL_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS 'UTC'").withZone(ZoneOffset.UTC);
  private static final String NOT_AVAILABLE = "N/A";
  private static final String RULE = "-".repeat(80);

  private PacketLineFormatter() {}

  /**
   * One-line summary: time, protocol, application protocol, addresses and description.
   *
   * @param record record to format
   * @return single line
   */
  public static String simple(PacketRecord record) {
    String app = record.applicationProtocol() == null ? "" : record.applicationProtocol();
    return TIME.format(record.timestamp())
        + " | " + record.protocol() + ' ' + app
        + " | " + Objects.requireNonNullElse(record.srcIp(), NOT_AVAILABLE)
        + " -> " + Objects.requireNonNullElse(record.dstIp(), NOT_AVAILABLE)
        + " | " + record.description();
  }

  /**
   * Multi-line block listing every decoded field that is present.
   *
   * @param record record to format
   * @return lines of the block
   */
  public static List<String> detailed(PacketRecord record) {
    List<String> lines = new ArrayList<>(9);
    lines.add("[Packet #" + record.sequence() + ']');
    lines.add("Timestamp: " + FULL_TIME.format(record.timestamp()));
    lines.add("Ethernet: " + record.srcMac() + " -> " + record.dstMac());
    if (record.hasAddresses()) {
      lines.add("IP: " + record.srcIp() + " -> " + record.dstIp() + " (" + record.protocol() + ')');
    }
    if (record.srcPort() != null && record.dstPort() != null) {
      lines.add("Ports: " + record.srcPort() + " -> " + record.dstPort());
    }
    if (record.flags() != null) {
      lines.add("Flags: " + record.flags());
    }
    if (record.applicationProtocol() != null) {
      lines.add("Application: " + record.applicationProtocol());
    }
    lines.add("Size: " + record.size() + " bytes (payload: " + record.payloadSize() + " bytes)");
    lines.add("Threat: " + record.threatLevel().label());
    lines.add("Description: " + record.description());
    lines.add(RULE);
    return lines;
  }
}
