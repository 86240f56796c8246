/**
 * <strong>Purpose:</strong> Logging utilities that tune Logback at runtime and bound logged input.
 * <p><strong>Concurrency:</strong> Configuration helpers run once during CLI startup; {@code Logs} is stateless.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netwatch.logging;
