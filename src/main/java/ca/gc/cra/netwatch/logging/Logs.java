package ca.gc.cra.netwatch.logging;

import java.util.HexFormat;

/**
 * Helpers that keep operator input and frame bytes bounded in log lines.
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final HexFormat HEX = HexFormat.ofDelimiter(" ");

  private Logs() {
    // Utility
  }

  /**
   * Shortens a string to at most {@code maxCodePoints} code points, never splitting a surrogate pair. Control
   * characters are replaced with {@code '?'} so a value cannot forge extra log lines.
   *
   * @param value string to shorten; {@code null} yields {@code "<null>"}
   * @param maxCodePoints code points to keep; must be positive
   * @return the sanitized value, with a {@code "...(+N)"} suffix naming the dropped code points
   * @throws IllegalArgumentException when {@code maxCodePoints} is not positive
   */
  public static String truncate(String value, int maxCodePoints) {
    if (maxCodePoints <= 0) {
      throw new IllegalArgumentException("maxCodePoints must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    int total = value.codePointCount(0, value.length());
    int keep = Math.min(total, maxCodePoints);
    StringBuilder sb = new StringBuilder(keep + 12);
    value.codePoints().limit(keep).forEach(cp -> {
      if (Character.isISOControl(cp)) {
        sb.append('?');
      } else {
        sb.appendCodePoint(cp);
      }
    });
    if (total > keep) {
      sb.append("...(+").append(total - keep).append(')');
    }
    return sb.toString();
  }

  /**
   * Formats the leading bytes of a frame as space-separated hex for debug logging.
   *
   * @param data frame bytes; {@code null} yields {@code "<null>"}
   * @param maxBytes bytes to show
   * @return hex preview, suffixed with {@code " ..."} when bytes were left out
   */
  public static String hexPreview(byte[] data, int maxBytes) {
    if (data == null) {
      return NULL_PLACEHOLDER;
    }
    int shown = Math.max(0, Math.min(data.length, maxBytes));
    String hex = HEX.formatHex(data, 0, shown);
    return shown < data.length ? hex + " ..." : hex;
  }
}
