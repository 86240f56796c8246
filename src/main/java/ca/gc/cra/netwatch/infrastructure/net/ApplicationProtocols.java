package ca.gc.cra.netwatch.infrastructure.net;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Port-based application protocol inference.
 *
 * <p>Only the destination port is consulted. Ports 80 and 8080 are reported as {@code HTTP} when the start of the
 * payload looks like an HTTP message, otherwise as {@code Web Traffic}.</p>
 */
final class ApplicationProtocols {
  static final String HTTP = "HTTP";
  static final String WEB_TRAFFIC = "Web Traffic";
  private static final int SNIFF_BYTES = 100;

  private static final Map<Integer, String> WELL_KNOWN = Map.of(
      443, "HTTPS",
      53, "DNS",
      22, "SSH",
      21, "FTP",
      25, "SMTP",
      110, "POP3",
      143, "IMAP",
      993, "IMAPS",
      995, "POP3S");

  private ApplicationProtocols() {}

  /**
   * Infers the application protocol.
   *
   * @param dstPort destination port, or {@code null}
   * @param frame frame bytes
   * @param payloadOffset offset of the transport payload in {@code frame}
   * @param payloadLength payload length in bytes
   * @return protocol label or {@code null} when the port is not recognized
   */
  static String detect(Integer dstPort, byte[] frame, int payloadOffset, int payloadLength) {
    if (dstPort == null) {
      return null;
    }
    if (dstPort == 80 || dstPort == 8080) {
      return looksLikeHttp(frame, payloadOffset, payloadLength) ? HTTP : WEB_TRAFFIC;
    }
    return WELL_KNOWN.get(dstPort);
  }

  static boolean looksLikeHttp(byte[] frame, int payloadOffset, int payloadLength) {
    int available = Math.min(payloadLength, frame.length - payloadOffset);
    if (available <= 0) {
      return false;
    }
    String head = new String(frame, payloadOffset, Math.min(SNIFF_BYTES, available), StandardCharsets.ISO_8859_1);
    return head.startsWith("GET")
        || head.startsWith("POST")
        || head.startsWith("HTTP")
        || head.contains("Host:");
  }
}
