package ca.gc.cra.netwatch.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Meter provider lifecycle for one NETWATCH run.
 *
 * <p>With {@code metricsExporter=otlp} the provider pushes to the collector every 30 seconds and is also
 * registered as the global instance, which the pcap4j source reads its meter from. Otherwise the runtime
 * hands out a no-op meter and flush/close do nothing.</p>
 */
final class MetricsRuntime implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MetricsRuntime.class);
  static final String SCOPE = "ca.gc.cra.netwatch";
  private static final Duration PUSH_INTERVAL = Duration.ofSeconds(30);
  private static final long SHUTDOWN_WAIT_SECONDS = 5;

  private final SdkMeterProvider provider;
  private final Meter meter;

  private MetricsRuntime(SdkMeterProvider provider, Meter meter) {
    this.provider = provider;
    this.meter = meter;
  }

  /**
   * Starts the runtime selected by the settings. Exporter construction failures are logged and downgrade
   * to a disabled runtime.
   *
   * @param settings export settings
   * @return running runtime
   */
  static MetricsRuntime start(MetricsSettings settings) {
    Objects.requireNonNull(settings, "settings");
    if (!settings.enabled()) {
      log.debug("Metrics export disabled");
      return disabled();
    }
    try {
      OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricsRuntime runtime = withReader(
          PeriodicMetricReader.builder(exporter).setInterval(PUSH_INTERVAL).build(),
          resourceAttributes(settings.resourceAttributes()));
      try {
        OpenTelemetrySdk.builder().setMeterProvider(runtime.provider).buildAndRegisterGlobal();
      } catch (IllegalStateException alreadySet) {
        log.warn("A global OpenTelemetry instance already exists; capture instruments keep using it");
      }
      log.info("Exporting metrics over OTLP to {}", settings.endpoint());
      return runtime;
    } catch (RuntimeException ex) {
      log.error("Metrics exporter for {} could not be created; running without export", settings.endpoint(), ex);
      return disabled();
    }
  }

  /**
   * Runtime collecting into the given reader, without global registration.
   *
   * @param reader metric reader, typically in-memory
   * @return runtime bound to the reader
   */
  static MetricsRuntime withReader(MetricReader reader) {
    return withReader(Objects.requireNonNull(reader, "reader"), Map.of());
  }

  private static MetricsRuntime withReader(MetricReader reader, Map<String, String> extraAttributes) {
    String version = serviceVersion();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource(version, extraAttributes))
        .registerMetricReader(reader)
        .build();
    return new MetricsRuntime(provider, provider.meterBuilder(SCOPE).setInstrumentationVersion(version).build());
  }

  static MetricsRuntime disabled() {
    return new MetricsRuntime(null, MeterProvider.noop().get(SCOPE));
  }

  Meter meter() {
    return meter;
  }

  boolean exporting() {
    return provider != null;
  }

  void flush() {
    if (provider != null) {
      await(provider.forceFlush(), "flush");
    }
  }

  @Override
  public void close() {
    if (provider != null) {
      await(provider.shutdown(), "shutdown");
    }
  }

  private static void await(CompletableResultCode result, String action) {
    if (!result.join(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS).isSuccess()) {
      log.warn("Metrics {} did not complete within {}s", action, SHUTDOWN_WAIT_SECONDS);
    }
  }

  static Resource resource(String version, Map<String, String> extra) {
    AttributesBuilder identity = Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "netwatch")
        .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
        .put(AttributeKey.stringKey("service.version"), version);
    hostName().ifPresent(host -> identity.put(AttributeKey.stringKey("host.name"), host));
    AttributesBuilder user = Attributes.builder();
    extra.forEach((key, value) -> user.put(AttributeKey.stringKey(key), value));
    return Resource.getDefault()
        .merge(Resource.create(identity.build()))
        .merge(Resource.create(user.build()));
  }

  /**
   * Parses {@code key=value} pairs separated by commas. Entries without a key or value are skipped with a
   * warning; a repeated key keeps its last value.
   *
   * @param raw configured attribute list, may be {@code null}
   * @return attributes in declaration order
   */
  static Map<String, String> resourceAttributes(String raw) {
    Map<String, String> out = new LinkedHashMap<>();
    if (raw == null) {
      return out;
    }
    for (String entry : raw.split(",")) {
      if (entry.isBlank()) {
        continue;
      }
      int eq = entry.indexOf('=');
      String key = eq < 0 ? "" : entry.substring(0, eq).trim();
      String value = eq < 0 ? "" : entry.substring(eq + 1).trim();
      if (key.isEmpty() || value.isEmpty()) {
        log.warn("Skipping resource attribute without key or value: '{}'", entry.trim());
        continue;
      }
      out.put(key, value);
    }
    return out;
  }

  private static Optional<String> hostName() {
    try {
      return Optional.of(InetAddress.getLocalHost().getHostName()).filter(name -> !name.isBlank());
    } catch (UnknownHostException ex) {
      log.debug("Host name unavailable for the metrics resource", ex);
      return Optional.empty();
    }
  }

  static String serviceVersion() {
    return Optional.ofNullable(MetricsRuntime.class.getPackage())
        .map(Package::getImplementationVersion)
        .filter(v -> !v.isBlank())
        .orElse("0.1.0-SNAPSHOT");
  }
}
