/**
 * pcap4j capture adapters: live and offline packet sources plus device enumeration.
 * <p><strong>Security:</strong> Live capture usually needs elevated privileges or {@code CAP_NET_RAW}.</p>
 */
package ca.gc.cra.netwatch.infrastructure.capture;
