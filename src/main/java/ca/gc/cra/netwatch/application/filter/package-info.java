/** Capture-time record selection by protocol and port. */
package ca.gc.cra.netwatch.application.filter;
