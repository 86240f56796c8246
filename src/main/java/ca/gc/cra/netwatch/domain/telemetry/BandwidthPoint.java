package ca.gc.cra.netwatch.domain.telemetry;

import java.time.Instant;
import java.util.Objects;

/**
 * Cumulative throughput sample: totals so far divided by whole elapsed seconds.
 *
 * @param timestamp capture time of the record that triggered the sample
 * @param bytesPerSecond cumulative bytes per second
 * @param packetsPerSecond cumulative packets per second
 * @since 0.1.0
 */
public record BandwidthPoint(Instant timestamp, double bytesPerSecond, double packetsPerSecond) {
  public BandwidthPoint {
    Objects.requireNonNull(timestamp, "timestamp");
  }
}
