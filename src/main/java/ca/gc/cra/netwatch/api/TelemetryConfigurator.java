package ca.gc.cra.netwatch.api;

import ca.gc.cra.netwatch.config.CaptureConfig;
import ca.gc.cra.netwatch.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.netwatch.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the logging and metrics settings of a validated {@link CaptureConfig} to the running JVM.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);

  private TelemetryConfigurator() {}

  /**
   * Applies {@code logLevel} and {@code logFile}. {@code --verbose} keeps DEBUG regardless of {@code logLevel}.
   *
   * @param config validated configuration
   * @param verbose whether {@code --verbose} was supplied
   */
  static void configureLogging(CaptureConfig config, boolean verbose) {
    if (!verbose) {
      LoggingConfigurator.applyLevel(config.logLevel());
    }
    if (config.logFile() != null) {
      LoggingConfigurator.attachFileAppender(config.logFile());
    }
  }

  /**
   * Creates the metrics adapter selected by {@code metricsExporter}.
   *
   * @param config validated configuration
   * @return adapter; a no-op delegate when export is disabled
   */
  static OpenTelemetryMetricsAdapter configureMetrics(CaptureConfig config) {
    log.debug("Configuring metrics exporter: {}", config.metrics().exporter());
    return new OpenTelemetryMetricsAdapter(config.metrics());
  }
}
