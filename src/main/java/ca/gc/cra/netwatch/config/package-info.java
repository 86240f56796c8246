/**
 * <strong>Purpose:</strong> Configuration loading, merging and validation for NETWATCH commands, plus the
 * composition root wiring use cases to adapters.
 * <p>Precedence is CLI &gt; YAML &gt; defaults.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netwatch.config;
