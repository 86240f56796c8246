/**
 * <strong>Purpose:</strong> Capture, dashboard and export use cases orchestrating ports and telemetry.
 * <p><strong>Concurrency:</strong> The capture session is the single writer of telemetry state; the dashboard ticker
 * only reads snapshots.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netwatch.application.pipeline;
