/**
 * Terminal output adapters for dashboard frames and streamed packet lines.
 */
package ca.gc.cra.netwatch.infrastructure.display;
