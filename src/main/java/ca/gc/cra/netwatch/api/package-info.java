/**
 * <strong>Purpose:</strong> Command-line entry points for NETWATCH.
 * <p>{@link ca.gc.cra.netwatch.api.Main} dispatches to the {@code capture}, {@code dashboard},
 * {@code interfaces} and {@code init-config} commands. Commands take {@code key=value} arguments plus
 * {@code --flags} and return an {@link ca.gc.cra.netwatch.api.ExitCode}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netwatch.api;
