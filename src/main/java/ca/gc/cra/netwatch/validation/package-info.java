/**
 * <strong>Purpose:</strong> Input validation shared by the CLI and configuration layers.
 * <p>All helpers throw {@link java.lang.IllegalArgumentException} on invalid input; the CLI maps that to
 * {@code INVALID_ARGS}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netwatch.validation;
