package ca.gc.cra.netwatch.config;

import ca.gc.cra.netwatch.application.dashboard.DashboardTicker;
import ca.gc.cra.netwatch.application.pipeline.CaptureSessionUseCase;
import ca.gc.cra.netwatch.application.pipeline.ExportUseCase;
import ca.gc.cra.netwatch.application.pipeline.LiveDashboardUseCase;
import ca.gc.cra.netwatch.application.pipeline.PacketRecordListener;
import ca.gc.cra.netwatch.application.port.ClockPort;
import ca.gc.cra.netwatch.application.port.DisplaySink;
import ca.gc.cra.netwatch.application.port.InterfaceCatalog;
import ca.gc.cra.netwatch.application.port.MetricsPort;
import ca.gc.cra.netwatch.application.port.PacketSource;
import ca.gc.cra.netwatch.application.report.ConsoleRecordPrinter;
import ca.gc.cra.netwatch.application.telemetry.RecentRecordBuffer;
import ca.gc.cra.netwatch.application.telemetry.TelemetryAggregator;
import ca.gc.cra.netwatch.domain.threat.ThreatClassifier;
import ca.gc.cra.netwatch.infrastructure.capture.Pcap4jInterfaceCatalog;
import ca.gc.cra.netwatch.infrastructure.capture.Pcap4jPacketSource;
import ca.gc.cra.netwatch.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.netwatch.infrastructure.export.ExportSerializer;
import ca.gc.cra.netwatch.infrastructure.export.FileRecordExporter;
import ca.gc.cra.netwatch.infrastructure.net.EthernetPacketDecoder;
import ca.gc.cra.netwatch.infrastructure.net.PlaceholderGeoLocator;
import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires NETWATCH use cases to concrete adapters for one CLI invocation.
 * <p><strong>Role:</strong> Composition root for the {@code capture} and {@code dashboard} commands.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Own the telemetry aggregator and recent-record buffer shared by ingestion, rendering and export.</li>
 *   <li>Build the pcap4j source for live or offline capture.</li>
 *   <li>Assemble the streaming session, the live dashboard and the export use case.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and call on the CLI thread; the returned use cases manage their own
 * threads.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final UncaughtExceptionHandler UNCAUGHT =
      (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex);

  private final CaptureConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final DisplaySink display;
  private final Supplier<PacketSource> sourceFactory;
  private final TelemetryAggregator aggregator;
  private final RecentRecordBuffer recent;

  /**
   * Creates a root capturing through pcap4j.
   *
   * @param config validated configuration
   * @param metrics metrics port shared by all components
   * @param display terminal sink
   */
  public CompositionRoot(CaptureConfig config, MetricsPort metrics, DisplaySink display) {
    this(config, metrics, ClockPort.SYSTEM, display, null);
  }

  /**
   * Creates a root with an explicit packet source factory, used by tests and replay tooling.
   *
   * @param config validated configuration
   * @param metrics metrics port
   * @param clock time source
   * @param display terminal sink
   * @param sourceFactory packet source factory; {@code null} selects pcap4j
   */
  public CompositionRoot(
      CaptureConfig config,
      MetricsPort metrics,
      ClockPort clock,
      DisplaySink display,
      Supplier<PacketSource> sourceFactory) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.display = Objects.requireNonNull(display, "display");
    this.sourceFactory = sourceFactory != null ? sourceFactory : this::pcapSource;
    this.aggregator = new TelemetryAggregator(clock, metrics);
    this.recent = new RecentRecordBuffer(config.recentCapacity());
  }

  /** Shared telemetry aggregator. */
  public TelemetryAggregator aggregator() {
    return aggregator;
  }

  /** Shared recent-record buffer, also the export source. */
  public RecentRecordBuffer recentRecords() {
    return recent;
  }

  /**
   * Builds a session that prints each accepted record and periodic statistics.
   *
   * @return streaming capture session
   */
  public CaptureSessionUseCase streamingSession() {
    ConsoleRecordPrinter printer = new ConsoleRecordPrinter(
        display, aggregator, clock, config.detailed(), config.statsIntervalSeconds());
    return captureSession(printer);
  }

  /**
   * Builds the live dashboard pipeline.
   *
   * @param holdAfterCapture keep rendering after ingestion ends until the pipeline is stopped
   * @return dashboard use case
   */
  public LiveDashboardUseCase liveDashboard(boolean holdAfterCapture) {
    DashboardTicker ticker = new DashboardTicker(
        aggregator,
        recent,
        display,
        metrics,
        ExecutorFactories.newRenderScheduler(UNCAUGHT),
        Duration.ofMillis(config.refreshMillis()));
    return new LiveDashboardUseCase(
        captureSession(PacketRecordListener.NONE),
        ticker,
        ExecutorFactories.newCaptureExecutor(UNCAUGHT),
        holdAfterCapture);
  }

  /**
   * Builds the export use case writing files through Jackson.
   *
   * @return export use case
   */
  public ExportUseCase exportUseCase() {
    return new ExportUseCase(new FileRecordExporter(new ExportSerializer()), metrics);
  }

  /**
   * Builds the catalog used by the {@code interfaces} command.
   *
   * @return pcap4j device catalog
   */
  public static InterfaceCatalog interfaceCatalog() {
    return new Pcap4jInterfaceCatalog();
  }

  CaptureSessionUseCase captureSession(PacketRecordListener listener) {
    return new CaptureSessionUseCase(
        sourceFactory.get(),
        new EthernetPacketDecoder(clock, new PlaceholderGeoLocator()),
        config.captureFilter(),
        new ThreatClassifier(),
        aggregator,
        recent,
        listener,
        metrics,
        clock,
        new CaptureSessionUseCase.Settings(config.iface(), config.count()));
  }

  private PacketSource pcapSource() {
    if (config.offline()) {
      return Pcap4jPacketSource.replay(config.pcapFile());
    }
    return Pcap4jPacketSource.live(config.iface(), config.snaplen(), config.promiscuous(), config.timeoutMillis());
  }
}
