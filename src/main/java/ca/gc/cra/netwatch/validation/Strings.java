package ca.gc.cra.netwatch.validation;

import java.util.Objects;

/**
 * Checks for text that arrives from the command line or YAML.
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final int PRINTABLE_FIRST = 0x20;
  private static final int PRINTABLE_LAST = 0x7E;

  private Strings() {}

  /**
   * Trims a value after checking that it is present, not blank and has no control characters.
   *
   * @param name setting name used in messages
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or holds ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    Objects.requireNonNull(value, label(name));
    if (value.codePoints().anyMatch(Character::isISOControl)) {
      throw invalid(name, "must not contain control characters");
    }
    if (value.isBlank()) {
      throw invalid(name, "must not be blank");
    }
    return value.trim();
  }

  /**
   * Like {@link #requireNonBlank} and additionally limits the value to printable ASCII of bounded length.
   *
   * @param name setting name used in messages
   * @param value candidate text
   * @param maxLength longest accepted trimmed value
   * @return trimmed value
   * @throws IllegalArgumentException if the value is too long or leaves the {@code 0x20-0x7E} range
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw invalid(name, "length must be <= " + maxLength);
    }
    boolean printable = trimmed.chars().allMatch(c -> c >= PRINTABLE_FIRST && c <= PRINTABLE_LAST);
    if (!printable) {
      throw invalid(name, "must contain printable ASCII characters");
    }
    return trimmed;
  }

  /**
   * Maps blank input to {@code null}.
   *
   * @param value candidate text, may be {@code null}
   * @return trimmed value, or {@code null} when nothing is left
   */
  public static String blankToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  private static IllegalArgumentException invalid(String name, String problem) {
    return new IllegalArgumentException(label(name) + ' ' + problem);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
