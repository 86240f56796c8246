package ca.gc.cra.netwatch.application.filter;

import ca.gc.cra.netwatch.domain.net.PacketRecord;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Combined protocol and port selection for the capture.
 * <p>Records with IP addresses must satisfy both the protocol and the port selection. Records without addresses
 * are rejected (ARP, IPv6, other ether types) unless the decoder could not read past the link layer at all
 * (protocol {@value PacketRecord#UNKNOWN_PROTOCOL}, e.g. a truncated IPv4 header); those are kept whatever the
 * selection, since there is nothing to match against.</p>
 *
 * @param protocol protocol selection
 * @param port port that must appear as TCP/UDP source or destination, or {@code null} for any port
 * @since 0.1.0
 */
public record CaptureFilter(ProtocolFilter protocol, Integer port) {
  /** Filter accepting every addressed record. */
  public static final CaptureFilter ACCEPT_ALL = new CaptureFilter(ProtocolFilter.ANY, null);

  public CaptureFilter {
    protocol = Objects.requireNonNullElse(protocol, ProtocolFilter.ANY);
    if (port != null && (port < 0 || port > 65_535)) {
      throw new IllegalArgumentException("port must be between 0 and 65535 (was " + port + ')');
    }
  }

  /**
   * Applies the selection.
   *
   * @param record decoded record
   * @return {@code true} when the record should be counted
   */
  public boolean accepts(PacketRecord record) {
    if (!record.hasAddresses()) {
      return PacketRecord.UNKNOWN_PROTOCOL.equals(record.protocol());
    }
    if (!protocol.accepts(record)) {
      return false;
    }
    if (port == null) {
      return true;
    }
    boolean transport = "TCP".equals(record.protocol()) || "UDP".equals(record.protocol());
    return transport && record.usesPort(port);
  }

  /**
   * Describes the active selection for log lines.
   *
   * @return text such as {@code protocol=tcp port=443}
   */
  public String describe() {
    StringBuilder sb = new StringBuilder("protocol=").append(protocol.name().toLowerCase(Locale.ROOT));
    if (port != null) {
      sb.append(" port=").append(port);
    }
    return sb.toString();
  }
}
