package ca.gc.cra.netwatch.application.report;

import java.util.Locale;

/** Human-readable byte quantities using base-1024 units. */
public final class ByteUnits {
  private static final String[] UNITS = {"B", "KB", "MB", "GB"};

  private ByteUnits() {}

  /**
   * Formats a byte count with one decimal, e.g. {@code 1.5 KB}.
   *
   * @param bytes byte count; negative values are treated as zero
   * @return formatted quantity, never larger than GB
   */
  public static String format(double bytes) {
    double size = Math.max(0d, bytes);
    int unit = 0;
    while (size >= 1024d && unit < UNITS.length - 1) {
      size /= 1024d;
      unit++;
    }
    return String.format(Locale.ROOT, "%.1f %s", size, UNITS[unit]);
  }

  /**
   * Formats a rate such as {@code 2.0 KB/s}.
   *
   * @param bytesPerSecond rate in bytes per second
   * @return formatted rate
   */
  public static String formatRate(double bytesPerSecond) {
    return format(bytesPerSecond) + "/s";
  }
}
