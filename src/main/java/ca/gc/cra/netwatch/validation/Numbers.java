package ca.gc.cra.netwatch.validation;

/**
 * <strong>What:</strong> Numeric validation helpers for NETWATCH CLI and configuration parsing.
 * <p><strong>Role:</strong> Guards snap lengths, timeouts, refresh intervals and buffer capacities before the
 * capture and dashboard components are wired.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name parameter name used in diagnostics; {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer and validates its range.
   *
   * @param name parameter name used in diagnostics
   * @param raw text to parse; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if the text is not an integer or is out of range
   */
  public static int parseInt(String name, String raw, int min, int max) {
    try {
      int parsed = Integer.parseInt(Strings.requireNonBlank(name, raw));
      return (int) requireRange(name, parsed, min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer between " + min + " and " + max, ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
