package ca.gc.cra.netwatch.infrastructure.net;

import java.util.Map;

/** Human-readable one-line summaries for decoded packets. */
final class PacketDescriptions {
  static final String UNKNOWN = "Unknown packet";
  static final String ICMP = "ICMP ping/echo message";
  static final String IPV6 = "IPv6 packet (parsing not fully implemented)";

  private static final Map<String, String> BY_APPLICATION = Map.of(
      "HTTP", "Web browsing (HTTP request/response)",
      "HTTPS", "Secure web browsing (encrypted)",
      "DNS", "Domain name lookup",
      "SSH", "Secure shell connection",
      "FTP", "File transfer",
      "SMTP", "Email sending",
      ApplicationProtocols.WEB_TRAFFIC, "Web-related traffic");

  private PacketDescriptions() {}

  /**
   * Describes a transport-level packet.
   *
   * @param protocol transport protocol name
   * @param applicationProtocol inferred application protocol or {@code null}
   * @param srcPort source port or {@code null}
   * @param dstPort destination port or {@code null}
   * @return description text
   */
  static String describe(String protocol, String applicationProtocol, Integer srcPort, Integer dstPort) {
    if (applicationProtocol != null) {
      return BY_APPLICATION.getOrDefault(applicationProtocol, applicationProtocol + " communication");
    }
    boolean ports = srcPort != null && dstPort != null;
    return switch (protocol) {
      case "TCP" -> ports ? "TCP connection from port " + srcPort + " to port " + dstPort : "TCP connection";
      case "UDP" -> ports ? "UDP communication from port " + srcPort + " to port " + dstPort : "UDP communication";
      case "ICMP" -> "Network diagnostic (ping/traceroute)";
      default -> protocol + " network traffic";
    };
  }
}
