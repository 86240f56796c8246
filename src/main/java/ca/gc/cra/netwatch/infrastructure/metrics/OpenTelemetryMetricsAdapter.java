package ca.gc.cra.netwatch.infrastructure.metrics;

import ca.gc.cra.netwatch.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} that forwards NETWATCH counters and observations to OpenTelemetry.
 * <p>Dotted keys such as {@code capture.records.accepted} become instruments named
 * {@code netwatch.capture.records.accepted}; the original key travels as the {@code netwatch.metric.key}
 * attribute. Keys ending in {@code .nanos} are recorded with unit {@code ns}.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; instruments are created lazily once per key.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("netwatch.metric.key");
  static final String NAME_PREFIX = "netwatch.";
  static final String FALLBACK_METRIC_NAME = "netwatch.metric";

  private final MetricsPort delegate;
  private final MetricsRuntime runtime;

  /**
   * Creates an adapter for the supplied export settings.
   *
   * @param settings exporter selection; {@code none} yields a no-op adapter
   */
  public OpenTelemetryMetricsAdapter(MetricsSettings settings) {
    this(MetricsRuntime.start(settings));
  }

  OpenTelemetryMetricsAdapter(MetricsRuntime runtime) {
    this.runtime = Objects.requireNonNull(runtime, "runtime");
    this.delegate = runtime.exporting() ? new InstrumentRegistry(runtime.meter()) : MetricsPort.NO_OP;
  }

  @Override
  public void increment(String key) {
    delegate.increment(Objects.requireNonNull(key, "key"));
  }

  @Override
  public void observe(String key, long value) {
    delegate.observe(Objects.requireNonNull(key, "key"), value);
  }

  /** Pushes pending measurements to the exporter. */
  public void forceFlush() {
    runtime.flush();
  }

  /** Flushes and shuts down the meter provider. */
  @Override
  public void close() {
    runtime.close();
  }

  static String instrumentName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(NAME_PREFIX.length() + lower.length());
    if (!lower.startsWith(NAME_PREFIX)) {
      result.append(NAME_PREFIX);
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    // Instrument names are limited to 255 characters.
    return result.length() > 255 ? result.substring(0, 255) : result.toString();
  }

  private static final class InstrumentRegistry implements MetricsPort {
    private final Meter meter;
    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

    private InstrumentRegistry(Meter meter) {
      this.meter = Objects.requireNonNull(meter, "meter");
    }

    @Override
    public void increment(String key) {
      Counter counter = counters.computeIfAbsent(key, this::counter);
      counter.instrument().add(1, counter.attributes());
    }

    @Override
    public void observe(String key, long value) {
      Histogram histogram = histograms.computeIfAbsent(key, this::histogram);
      histogram.instrument().record(value, histogram.attributes());
    }

    private Counter counter(String key) {
      String name = instrumentName(key);
      log.debug("Registering counter {} for key {}", name, key);
      LongCounter counter = meter.counterBuilder(name)
          .setUnit("1")
          .setDescription("NETWATCH counter for " + key)
          .build();
      return new Counter(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }

    private Histogram histogram(String key) {
      String name = instrumentName(key);
      log.debug("Registering histogram {} for key {}", name, key);
      LongHistogram histogram = meter.histogramBuilder(name)
          .ofLongs()
          .setUnit(key.endsWith(".nanos") ? "ns" : "1")
          .setDescription("NETWATCH observation for " + key)
          .build();
      return new Histogram(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}
