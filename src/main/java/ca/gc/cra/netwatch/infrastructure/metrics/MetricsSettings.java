package ca.gc.cra.netwatch.infrastructure.metrics;

import java.util.Locale;
import java.util.Objects;

/**
 * Metrics export settings resolved from CLI, YAML and environment.
 *
 * @param exporter {@code none} or {@code otlp}
 * @param endpoint OTLP gRPC endpoint
 * @param resourceAttributes comma separated {@code key=value} resource attributes, possibly empty
 * @since 0.1.0
 */
public record MetricsSettings(String exporter, String endpoint, String resourceAttributes) {
  /** Default OTLP collector endpoint. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  public MetricsSettings {
    exporter = exporter == null || exporter.isBlank() ? "none" : exporter.trim().toLowerCase(Locale.ROOT);
    if (!exporter.equals("none") && !exporter.equals("otlp")) {
      throw new IllegalArgumentException("metricsExporter must be none or otlp (was " + exporter + ')');
    }
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = Objects.requireNonNullElse(resourceAttributes, "").trim();
  }

  /** Settings with export disabled. */
  public static MetricsSettings disabled() {
    return new MetricsSettings("none", null, null);
  }

  /**
   * Indicates whether metrics leave the process.
   *
   * @return {@code true} for the OTLP exporter
   */
  public boolean enabled() {
    return exporter.equals("otlp");
  }
}
