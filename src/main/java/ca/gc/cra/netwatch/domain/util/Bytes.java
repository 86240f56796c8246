package ca.gc.cra.netwatch.domain.util;

/**
 * <strong>What:</strong> Bounds-tolerant readers for raw frame bytes.
 * <p><strong>Why:</strong> Frame decoding must never fail; short or truncated captures read as zero instead of
 * raising {@link ArrayIndexOutOfBoundsException}.</p>
 * <p><strong>Thread-safety:</strong> Stateless static helpers.</p>
 *
 * @since 0.1.0
 */
public final class Bytes {
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private Bytes() {}

  /**
   * Reads an unsigned 8-bit value.
   *
   * @param a source bytes; may be {@code null}
   * @param off offset to read
   * @return value in {@code [0,255]} or {@code 0} when out of bounds
   */
  public static int u8(byte[] a, int off) {
    if (a == null || off < 0 || off >= a.length) {
      return 0;
    }
    return a[off] & 0xFF;
  }

  /**
   * Reads an unsigned big-endian 16-bit value.
   *
   * @param a source bytes; may be {@code null}
   * @param off offset of the high byte
   * @return value in {@code [0,65535]} or {@code 0} when fewer than two bytes remain
   */
  public static int u16be(byte[] a, int off) {
    if (a == null || off < 0 || off + 1 >= a.length) {
      return 0;
    }
    return ((a[off] & 0xFF) << 8) | (a[off + 1] & 0xFF);
  }

  /**
   * Formats six bytes as a colon separated MAC address.
   *
   * @param a source bytes
   * @param off offset of the first octet
   * @return lower-case {@code aa:bb:cc:dd:ee:ff}, or an empty string when fewer than six bytes remain
   */
  public static String mac(byte[] a, int off) {
    if (a == null || off < 0 || off + 6 > a.length) {
      return "";
    }
    StringBuilder sb = new StringBuilder(17);
    for (int i = 0; i < 6; i++) {
      if (i > 0) {
        sb.append(':');
      }
      int b = a[off + i] & 0xFF;
      sb.append(HEX[b >>> 4]).append(HEX[b & 0x0F]);
    }
    return sb.toString();
  }
}
