package ca.gc.cra.netwatch.domain.threat;

import java.util.List;
import java.util.Locale;

/**
 * Textual address checks used by threat scoring and the placeholder geo table.
 *
 * <p>Private space is 10/8, 172.16/12, 192.168/16, 127/8, IPv6 loopback and IPv6 link-local. Inputs are the
 * dotted or colon forms produced by the decoder; nothing is resolved.</p>
 *
 * @since 0.1.0
 */
public final class AddressScope {
  private static final List<String> PRIVATE_PREFIXES = List.of("10.", "192.168.", "127.");
  private static final List<String> FLAGGED_PREFIXES = List.of("10.0.0.", "169.254.");

  private AddressScope() {}

  /**
   * Tests whether {@code ip} lies in a private, loopback or link-local range.
   *
   * @param ip textual address; {@code null} is not private
   * @return {@code true} for private addresses
   */
  public static boolean isPrivate(String ip) {
    if (ip == null || ip.isBlank()) {
      return false;
    }
    for (String prefix : PRIVATE_PREFIXES) {
      if (ip.startsWith(prefix)) {
        return true;
      }
    }
    if (ip.startsWith("172.")) {
      return inRfc1918Block172(ip);
    }
    String lower = ip.toLowerCase(Locale.ROOT);
    return lower.equals("::1") || lower.startsWith("fe80:");
  }

  /**
   * Tests the additional {@code 10.0.0.} / {@code 169.254.} prefix heuristic.
   *
   * @param ip textual address
   * @return {@code true} when the address starts with a flagged prefix
   */
  public static boolean hasFlaggedPrefix(String ip) {
    if (ip == null) {
      return false;
    }
    for (String prefix : FLAGGED_PREFIXES) {
      if (ip.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }

  private static boolean inRfc1918Block172(String ip) {
    int start = "172.".length();
    int end = ip.indexOf('.', start);
    if (end <= start) {
      return false;
    }
    try {
      int second = Integer.parseInt(ip.substring(start, end));
      return second >= 16 && second <= 31;
    } catch (NumberFormatException ex) {
      return false;
    }
  }
}
