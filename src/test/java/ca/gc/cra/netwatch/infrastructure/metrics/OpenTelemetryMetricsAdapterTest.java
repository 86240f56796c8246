package ca.gc.cra.netwatch.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY = AttributeKey.stringKey("netwatch.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(MetricsRuntime.withReader(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void countersAccumulatePerKey() {
    adapter.increment("capture.records.accepted");
    adapter.increment("capture.records.accepted");
    adapter.increment("capture.records.filtered");
    adapter.forceFlush();

    MetricData accepted = exported("netwatch.capture.records.accepted");
    assertEquals(MetricDataType.LONG_SUM, accepted.getType());
    LongPointData point = accepted.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("capture.records.accepted", point.getAttributes().get(KEY));
    assertEquals(1L, exported("netwatch.capture.records.filtered").getLongSumData().getPoints().iterator().next()
        .getValue());
  }

  @Test
  void nanosKeysBecomeNanosecondHistograms() {
    for (long sample : new long[] {1_000L, 2_000L, 3_000L}) {
      adapter.observe("dashboard.render.nanos", sample);
    }
    adapter.observe("export.records", 42L);

    MetricData render = exported("netwatch.dashboard.render.nanos");
    assertEquals(MetricDataType.HISTOGRAM, render.getType());
    assertEquals("ns", render.getUnit());
    HistogramPointData point = render.getHistogramData().getPoints().iterator().next();
    assertEquals(3L, point.getCount());
    assertEquals(6_000.0, point.getSum());
    assertEquals("1", exported("netwatch.export.records").getUnit());
  }

  @Test
  void nullKeysAreRejected() {
    assertThrows(NullPointerException.class, () -> adapter.increment(null));
    assertThrows(NullPointerException.class, () -> adapter.observe(null, 1L));
  }

  @Test
  void disabledSettingsSwallowUpdates() {
    try (OpenTelemetryMetricsAdapter quiet = new OpenTelemetryMetricsAdapter(MetricsSettings.disabled())) {
      quiet.increment("capture.frames.polled");
      quiet.observe("export.records", 3L);
      quiet.forceFlush();
    }
  }

  private MetricData exported(String name) {
    return reader.collectAllMetrics().stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("missing metric " + name));
  }
}
