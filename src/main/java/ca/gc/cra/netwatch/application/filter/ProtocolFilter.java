package ca.gc.cra.netwatch.application.filter;

import ca.gc.cra.netwatch.domain.net.PacketRecord;
import java.util.Locale;
import java.util.Optional;

/**
 * Protocol selection applied to decoded records before they reach telemetry.
 *
 * <p>{@link #HTTP} matches TCP traffic with port 80 or 8080 on either side; {@link #DNS} matches UDP traffic with
 * port 53 on either side. {@link #ANY} accepts every record and stands in for unrecognized values.</p>
 *
 * @since 0.1.0
 */
public enum ProtocolFilter {
  ANY,
  TCP,
  UDP,
  ICMP,
  HTTP,
  DNS;

  /**
   * Tests whether a record passes the protocol selection.
   *
   * @param record decoded record
   * @return {@code true} when the record is selected
   */
  public boolean accepts(PacketRecord record) {
    String protocol = record.protocol();
    return switch (this) {
      case ANY -> true;
      case TCP -> "TCP".equals(protocol);
      case UDP -> "UDP".equals(protocol);
      case ICMP -> "ICMP".equals(protocol);
      case HTTP -> "TCP".equals(protocol) && (record.usesPort(80) || record.usesPort(8080));
      case DNS -> "UDP".equals(protocol) && record.usesPort(53);
    };
  }

  /**
   * Resolves a user-supplied value, case-insensitively.
   *
   * @param raw filter value; blank means no filter
   * @return matching filter, empty when the value is not recognized
   */
  public static Optional<ProtocolFilter> lookup(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.of(ANY);
    }
    String value = raw.trim().toUpperCase(Locale.ROOT);
    for (ProtocolFilter filter : values()) {
      if (filter != ANY && filter.name().equals(value)) {
        return Optional.of(filter);
      }
    }
    return Optional.empty();
  }

  /**
   * Resolves a value leniently: unrecognized values accept everything.
   *
   * @param raw filter value
   * @return matching filter or {@link #ANY}
   */
  public static ProtocolFilter parse(String raw) {
    return lookup(raw).orElse(ANY);
  }

  /**
   * Indicates whether {@code raw} names a supported filter (blank counts as none).
   *
   * @param raw filter value
   * @return {@code true} when recognized
   */
  public static boolean isRecognized(String raw) {
    return lookup(raw).isPresent();
  }
}
