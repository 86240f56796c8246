package ca.gc.cra.netwatch.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class MetricsSettingsTest {

  @Test
  void defaultsToDisabled() {
    MetricsSettings settings = new MetricsSettings(null, " ", null);

    assertEquals("none", settings.exporter());
    assertEquals(MetricsSettings.DEFAULT_ENDPOINT, settings.endpoint());
    assertEquals("", settings.resourceAttributes());
    assertFalse(settings.enabled());
  }

  @Test
  void otlpIsCaseInsensitive() {
    MetricsSettings settings = new MetricsSettings(" OTLP ", "http://collector:4317", "a=b");

    assertTrue(settings.enabled());
    assertEquals("http://collector:4317", settings.endpoint());
  }

  @Test
  void unknownExporterRejected() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> new MetricsSettings("prometheus", null, null));
    assertEquals("metricsExporter must be none or otlp (was prometheus)", ex.getMessage());
  }

  @Test
  void instrumentNamesAreNormalized() {
    assertEquals("netwatch.capture.frames.polled", OpenTelemetryMetricsAdapter.instrumentName("Capture.Frames.Polled"));
    assertEquals("netwatch.export.records", OpenTelemetryMetricsAdapter.instrumentName("netwatch.export.records"));
    assertEquals("netwatch.bad_key_", OpenTelemetryMetricsAdapter.instrumentName("bad key!"));
    assertEquals(OpenTelemetryMetricsAdapter.FALLBACK_METRIC_NAME, OpenTelemetryMetricsAdapter.instrumentName(" "));
    assertEquals(255, OpenTelemetryMetricsAdapter.instrumentName("x".repeat(400)).length());
  }
}
