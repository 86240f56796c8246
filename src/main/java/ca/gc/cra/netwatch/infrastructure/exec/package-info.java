/**
 * Named executor construction for the capture and render threads.
 */
package ca.gc.cra.netwatch.infrastructure.exec;
