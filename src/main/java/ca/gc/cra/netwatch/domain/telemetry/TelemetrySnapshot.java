package ca.gc.cra.netwatch.domain.telemetry;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Point-in-time, read-only copy of the aggregator state.
 * <p><strong>Why:</strong> Lets the render path format without holding the aggregator lock.</p>
 * <p><strong>Thread-safety:</strong> Immutable; maps keep the aggregator's insertion order so ranked views can
 * break ties by first appearance.</p>
 *
 * @param takenAt wall-clock time the copy was taken
 * @param elapsed time since aggregation started
 * @param totalPackets packets ingested
 * @param totalBytes bytes ingested
 * @param protocolCounts protocol name to packet count
 * @param applicationCounts application protocol to packet count
 * @param topTalkers source address to packet count
 * @param portActivity preferred port to packet count
 * @param packetSizes most recent packet sizes, oldest first
 * @param bandwidthHistory most recent bandwidth samples, oldest first
 * @param threatAlerts most recent alerts, oldest first
 * @param connections connection flows in first-seen order
 * @param peakBytesPerSecond highest sampled bytes per second
 * @param peakPacketsPerSecond highest sampled packets per second
 * @param currentConnections size of the connection table
 * @since 0.1.0
 */
public record TelemetrySnapshot(
    Instant takenAt,
    Duration elapsed,
    long totalPackets,
    long totalBytes,
    Map<String, Long> protocolCounts,
    Map<String, Long> applicationCounts,
    Map<String, Long> topTalkers,
    Map<Integer, Long> portActivity,
    List<Integer> packetSizes,
    List<BandwidthPoint> bandwidthHistory,
    List<ThreatAlert> threatAlerts,
    List<ConnectionFlow> connections,
    double peakBytesPerSecond,
    double peakPacketsPerSecond,
    int currentConnections) {

  public TelemetrySnapshot {
    Objects.requireNonNull(takenAt, "takenAt");
    elapsed = Objects.requireNonNullElse(elapsed, Duration.ZERO);
    protocolCounts = orderedCopy(protocolCounts);
    applicationCounts = orderedCopy(applicationCounts);
    topTalkers = orderedCopy(topTalkers);
    portActivity = orderedCopy(portActivity);
    packetSizes = packetSizes == null ? List.of() : List.copyOf(packetSizes);
    bandwidthHistory = bandwidthHistory == null ? List.of() : List.copyOf(bandwidthHistory);
    threatAlerts = threatAlerts == null ? List.of() : List.copyOf(threatAlerts);
    connections = connections == null ? List.of() : List.copyOf(connections);
  }

  /**
   * Creates the snapshot of an aggregator that has not ingested anything.
   *
   * @param takenAt snapshot time
   * @return empty snapshot
   */
  public static TelemetrySnapshot empty(Instant takenAt) {
    return new TelemetrySnapshot(
        takenAt, Duration.ZERO, 0L, 0L, Map.of(), Map.of(), Map.of(), Map.of(), List.of(), List.of(),
        List.of(), List.of(), 0d, 0d, 0);
  }

  /**
   * Returns whole elapsed seconds, the divisor used for every rate.
   *
   * @return elapsed seconds, never negative
   */
  public long elapsedSeconds() {
    return Math.max(0L, elapsed.getSeconds());
  }

  /**
   * Average packets per second since start.
   *
   * @return rate, {@code 0} before the first full second
   */
  public double packetsPerSecond() {
    long secs = elapsedSeconds();
    return secs > 0 ? (double) totalPackets / secs : 0d;
  }

  /**
   * Average bytes per second since start.
   *
   * @return rate, {@code 0} before the first full second
   */
  public double bytesPerSecond() {
    long secs = elapsedSeconds();
    return secs > 0 ? (double) totalBytes / secs : 0d;
  }

  private static <K> Map<K, Long> orderedCopy(Map<K, Long> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
