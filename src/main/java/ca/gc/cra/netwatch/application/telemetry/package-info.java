/**
 * Thread-safe telemetry state shared by the ingestion and render paths.
 *
 * @since 0.1.0
 */
package ca.gc.cra.netwatch.application.telemetry;
