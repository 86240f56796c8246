package ca.gc.cra.netwatch.application.port;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/** Static dataset formats supported by {@link RecordExporter}. */
public enum ExportFormat {
  JSON("json"),
  CSV("csv");

  private final String extension;

  ExportFormat(String extension) {
    this.extension = extension;
  }

  /**
   * Returns the file extension without the leading dot.
   *
   * @return extension such as {@code json}
   */
  public String extension() {
    return extension;
  }

  /**
   * Parses an {@code exportFormat=} value.
   *
   * @param raw one of {@code none}, {@code json}, {@code csv}, {@code both}; case-insensitive
   * @return formats to write, empty for {@code none}
   * @throws IllegalArgumentException if the value is not recognized
   */
  public static Set<ExportFormat> parseSelection(String raw) {
    String value = raw == null ? "none" : raw.trim().toLowerCase(Locale.ROOT);
    return switch (value) {
      case "", "none" -> EnumSet.noneOf(ExportFormat.class);
      case "json" -> EnumSet.of(JSON);
      case "csv" -> EnumSet.of(CSV);
      case "both" -> EnumSet.allOf(ExportFormat.class);
      default -> throw new IllegalArgumentException(
          "exportFormat must be one of none, json, csv, both (was " + raw + ')');
    };
  }
}
