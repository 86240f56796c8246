package ca.gc.cra.netwatch.application.dashboard;

import ca.gc.cra.netwatch.domain.net.PacketRecord;
import ca.gc.cra.netwatch.domain.telemetry.ConnectionFlow;
import ca.gc.cra.netwatch.domain.telemetry.ThreatAlert;
import ca.gc.cra.netwatch.domain.threat.ThreatLevel;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> Everything one dashboard frame shows, already selected, sorted and scaled.
 * <p><strong>Role:</strong> Output of {@link DashboardViewBuilder}; input of {@link DashboardRenderer}. Keeping the
 * selection separate from the text layout lets tests assert on panel content without parsing strings.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param takenAt time the underlying snapshot was taken
 * @param elapsedSeconds whole seconds since capture start
 * @param totalPackets packets ingested
 * @param packetsPerSecond average packet rate
 * @param totalBytes bytes ingested
 * @param bytesPerSecond average byte rate
 * @param connections tracked flow count
 * @param peakBytesPerSecond highest sampled byte rate
 * @param peakPacketsPerSecond highest sampled packet rate
 * @param bandwidth newest bandwidth samples, oldest first, with bar lengths
 * @param bandwidthScale divisor used for the bar lengths
 * @param threats security panel content
 * @param protocols protocol counts, highest first
 * @param topConnections busiest flows, highest packet count first
 * @param topPorts busiest ports, highest first
 * @param sizes packet size distribution
 * @param countries most frequent destination countries among recent records
 * @param recentActivity newest records, newest first
 * @since 0.1.0
 */
public record DashboardView(
    Instant takenAt,
    long elapsedSeconds,
    long totalPackets,
    double packetsPerSecond,
    long totalBytes,
    double bytesPerSecond,
    int connections,
    double peakBytesPerSecond,
    double peakPacketsPerSecond,
    List<BandwidthBar> bandwidth,
    double bandwidthScale,
    ThreatStatus threats,
    List<RankedEntry> protocols,
    List<ConnectionFlow> topConnections,
    List<RankedEntry> topPorts,
    SizeDistribution sizes,
    List<RankedEntry> countries,
    List<PacketRecord> recentActivity) {

  public DashboardView {
    bandwidth = List.copyOf(bandwidth);
    protocols = List.copyOf(protocols);
    topConnections = List.copyOf(topConnections);
    topPorts = List.copyOf(topPorts);
    countries = List.copyOf(countries);
    recentActivity = List.copyOf(recentActivity);
  }

  /**
   * A labelled count with its share of a total.
   *
   * @param label display label
   * @param count occurrences
   * @param percentage share of the relevant total, 0 to 100
   */
  public record RankedEntry(String label, long count, double percentage) {}

  /**
   * One bandwidth graph row.
   *
   * @param timestamp sample time
   * @param bytesPerSecond sampled rate
   * @param barLength bar length in cells, 0 to the graph width
   */
  public record BandwidthBar(Instant timestamp, double bytesPerSecond, int barLength) {}

  /**
   * Security panel content.
   *
   * @param levelCounts records per threat level over the recent buffer, every level present
   * @param alertCount retained alert count
   * @param recentAlerts newest alerts, newest first
   */
  public record ThreatStatus(Map<ThreatLevel, Long> levelCounts, int alertCount, List<ThreatAlert> recentAlerts) {
    public ThreatStatus {
      EnumMap<ThreatLevel, Long> counts = new EnumMap<>(ThreatLevel.class);
      for (ThreatLevel level : ThreatLevel.values()) {
        counts.put(level, levelCounts.getOrDefault(level, 0L));
      }
      levelCounts = Collections.unmodifiableMap(counts);
      recentAlerts = List.copyOf(recentAlerts);
    }

    /**
     * Returns the number of recent records above {@link ThreatLevel#SAFE}.
     *
     * @return threat record count
     */
    public long threatCount() {
      return levelCounts.entrySet().stream()
          .filter(e -> e.getKey().isAlerting())
          .mapToLong(Map.Entry::getValue)
          .sum();
    }
  }

  /**
   * Packet size panel content.
   *
   * @param samples number of sizes considered
   * @param average mean size in bytes
   * @param min smallest size
   * @param max largest size
   * @param buckets one entry per {@link SizeBucket}, in bucket order
   */
  public record SizeDistribution(int samples, double average, int min, int max, List<BucketShare> buckets) {
    public SizeDistribution {
      buckets = List.copyOf(buckets);
    }
  }

  /**
   * Count and share of one size bucket.
   *
   * @param bucket size class
   * @param count sizes in the class
   * @param percentage share of all samples
   */
  public record BucketShare(SizeBucket bucket, long count, double percentage) {}
}
