package ca.gc.cra.netwatch.domain.telemetry;

import ca.gc.cra.netwatch.domain.net.FlowKey;
import ca.gc.cra.netwatch.domain.net.PacketRecord;
import ca.gc.cra.netwatch.domain.threat.ThreatLevel;
import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Aggregated view of all records sharing one {@link FlowKey}.
 * <p><strong>Role:</strong> Value stored in the aggregator's connection table and copied into snapshots.</p>
 * <p><strong>Thread-safety:</strong> Immutable; {@link #absorb(PacketRecord)} returns a new instance.</p>
 *
 * <p>Updates are monotonic: counts only grow, {@code lastSeen} never moves backwards and
 * {@code threatLevel} only escalates.</p>
 *
 * @param key flow identity
 * @param packetCount packets mapped to the flow
 * @param totalBytes bytes mapped to the flow
 * @param firstSeen timestamp of the first record
 * @param lastSeen latest record timestamp
 * @param threatLevel highest level observed on the flow
 * @since 0.1.0
 */
public record ConnectionFlow(
    FlowKey key,
    long packetCount,
    long totalBytes,
    Instant firstSeen,
    Instant lastSeen,
    ThreatLevel threatLevel) {

  public ConnectionFlow {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(firstSeen, "firstSeen");
    Objects.requireNonNull(lastSeen, "lastSeen");
    threatLevel = Objects.requireNonNullElse(threatLevel, ThreatLevel.SAFE);
  }

  /**
   * Opens a flow from its first record.
   *
   * @param key flow key derived from {@code first}
   * @param first first record of the flow
   * @return flow with one packet
   */
  public static ConnectionFlow open(FlowKey key, PacketRecord first) {
    return new ConnectionFlow(
        key, 1L, first.size(), first.timestamp(), first.timestamp(), first.threatLevel());
  }

  /**
   * Folds another record into the flow.
   *
   * @param record record mapped to this flow
   * @return updated flow
   */
  public ConnectionFlow absorb(PacketRecord record) {
    Instant seen = record.timestamp().isAfter(lastSeen) ? record.timestamp() : lastSeen;
    return new ConnectionFlow(
        key,
        packetCount + 1,
        totalBytes + record.size(),
        firstSeen,
        seen,
        ThreatLevel.max(threatLevel, record.threatLevel()));
  }
}
