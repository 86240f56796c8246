/**
 * OpenTelemetry metrics export for NETWATCH.
 *
 * <p>{@link ca.gc.cra.netwatch.infrastructure.metrics.OpenTelemetryMetricsAdapter} implements the metrics port;
 * export is off unless the {@code otlp} exporter is selected.</p>
 */
package ca.gc.cra.netwatch.infrastructure.metrics;
