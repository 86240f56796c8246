/**
 * <strong>Purpose:</strong> Ports connecting the capture, telemetry, dashboard and export workflow to adapters.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure classes implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Capture ports are confined to the ingestion thread; sinks document their own
 * guarantees.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netwatch.application.port;
