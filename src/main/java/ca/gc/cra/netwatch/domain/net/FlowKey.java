package ca.gc.cra.netwatch.domain.net;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Directional five-tuple identifying a connection flow.
 * <p><strong>Role:</strong> Domain value object used as the key of the aggregator's connection table.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * <p>Absent ports are stored as {@code 0}, so ICMP traffic between two hosts collapses into one flow per
 * direction.</p>
 *
 * @param srcIp source IP address
 * @param srcPort source port or {@code 0}
 * @param dstIp destination IP address
 * @param dstPort destination port or {@code 0}
 * @param protocol protocol label, e.g. {@code "TCP"}
 * @since 0.1.0
 */
public record FlowKey(String srcIp, int srcPort, String dstIp, int dstPort, String protocol) {
  public FlowKey {
    Objects.requireNonNull(srcIp, "srcIp");
    Objects.requireNonNull(dstIp, "dstIp");
    protocol = protocol == null ? PacketRecord.UNKNOWN_PROTOCOL : protocol;
  }

  /**
   * Derives the flow key of a record.
   *
   * @param record decoded packet
   * @return key when both addresses are present, otherwise empty
   */
  public static Optional<FlowKey> of(PacketRecord record) {
    if (record == null || !record.hasAddresses()) {
      return Optional.empty();
    }
    return Optional.of(new FlowKey(
        record.srcIp(),
        record.srcPort() == null ? 0 : record.srcPort(),
        record.dstIp(),
        record.dstPort() == null ? 0 : record.dstPort(),
        record.protocol()));
  }

  /**
   * Formats the key as {@code src:port-dst:port}.
   *
   * @return display form used in logs and dashboard rows
   */
  public String display() {
    return srcIp + ':' + srcPort + '-' + dstIp + ':' + dstPort;
  }
}
