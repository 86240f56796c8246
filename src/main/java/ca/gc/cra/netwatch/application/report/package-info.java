/**
 * Text formatting for streaming capture output: per-record lines, interim statistics and the final summary.
 */
package ca.gc.cra.netwatch.application.report;
