/**
 * <strong>Purpose:</strong> Live text dashboard: content selection, layout and the periodic render ticker.
 * <p><strong>Concurrency:</strong> Runs on the {@code netwatch-render} thread and only touches telemetry through
 * snapshots.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netwatch.application.dashboard;
