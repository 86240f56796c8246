/**
 * JSON and CSV dataset export.
 */
package ca.gc.cra.netwatch.infrastructure.export;
