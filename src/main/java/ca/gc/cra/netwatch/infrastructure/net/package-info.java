/**
 * Frame decoding: link and network layer parsing, application protocol inference, descriptions and the
 * placeholder geolocation table.
 * <p><strong>Concurrency:</strong> Stateless; safe to share.</p>
 */
package ca.gc.cra.netwatch.infrastructure.net;
