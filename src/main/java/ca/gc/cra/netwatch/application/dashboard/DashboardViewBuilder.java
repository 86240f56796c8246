package ca.gc.cra.netwatch.application.dashboard;

import ca.gc.cra.netwatch.application.dashboard.DashboardView.BandwidthBar;
import ca.gc.cra.netwatch.application.dashboard.DashboardView.BucketShare;
import ca.gc.cra.netwatch.application.dashboard.DashboardView.RankedEntry;
import ca.gc.cra.netwatch.application.dashboard.DashboardView.SizeDistribution;
import ca.gc.cra.netwatch.application.dashboard.DashboardView.ThreatStatus;
import ca.gc.cra.netwatch.domain.net.PacketRecord;
import ca.gc.cra.netwatch.domain.telemetry.BandwidthPoint;
import ca.gc.cra.netwatch.domain.telemetry.ConnectionFlow;
import ca.gc.cra.netwatch.domain.telemetry.TelemetrySnapshot;
import ca.gc.cra.netwatch.domain.telemetry.ThreatAlert;
import ca.gc.cra.netwatch.domain.threat.ThreatLevel;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Selects and scales dashboard content from a telemetry snapshot and the recent records.
 * <p><strong>Role:</strong> Pure function run on the render thread after all locks are released.</p>
 * <p>Rankings sort by count descending; ties keep the snapshot's insertion order.</p>
 *
 * @since 0.1.0
 */
public final class DashboardViewBuilder {
  static final int GRAPH_POINTS = 20;
  static final int GRAPH_WIDTH = 40;
  static final int ALERTS_SHOWN = 3;
  static final int TOP_CONNECTIONS = 8;
  static final int TOP_PORTS = 10;
  static final int GEO_WINDOW = 500;
  static final int TOP_COUNTRIES = 6;
  static final int ACTIVITY_ROWS = 8;

  /**
   * Builds the frame content.
   *
   * @param snapshot aggregator snapshot
   * @param recent recent-record buffer copy, oldest first
   * @return view for the renderer
   */
  public DashboardView build(TelemetrySnapshot snapshot, List<PacketRecord> recent) {
    Objects.requireNonNull(snapshot, "snapshot");
    List<PacketRecord> records = recent == null ? List.of() : recent;
    double scale = bandwidthScale(snapshot.bandwidthHistory());
    return new DashboardView(
        snapshot.takenAt(),
        snapshot.elapsedSeconds(),
        snapshot.totalPackets(),
        snapshot.packetsPerSecond(),
        snapshot.totalBytes(),
        snapshot.bytesPerSecond(),
        snapshot.currentConnections(),
        snapshot.peakBytesPerSecond(),
        snapshot.peakPacketsPerSecond(),
        bandwidthBars(snapshot.bandwidthHistory(), scale),
        scale,
        threatStatus(snapshot.threatAlerts(), records),
        rank(snapshot.protocolCounts(), snapshot.totalPackets(), Integer.MAX_VALUE),
        topConnections(snapshot.connections()),
        rankPorts(snapshot.portActivity()),
        sizeDistribution(snapshot.packetSizes()),
        countries(records),
        newestFirst(records, ACTIVITY_ROWS));
  }

  static double bandwidthScale(List<BandwidthPoint> history) {
    double max = 0d;
    for (BandwidthPoint point : window(history, GRAPH_POINTS)) {
      max = Math.max(max, point.bytesPerSecond());
    }
    return Math.max(max, 1.0d);
  }

  static List<BandwidthBar> bandwidthBars(List<BandwidthPoint> history, double scale) {
    List<BandwidthBar> bars = new ArrayList<>(GRAPH_POINTS);
    for (BandwidthPoint point : window(history, GRAPH_POINTS)) {
      int length = (int) (point.bytesPerSecond() / scale * GRAPH_WIDTH);
      bars.add(new BandwidthBar(point.timestamp(), point.bytesPerSecond(), Math.max(0, Math.min(GRAPH_WIDTH, length))));
    }
    return bars;
  }

  static ThreatStatus threatStatus(List<ThreatAlert> alerts, List<PacketRecord> records) {
    Map<ThreatLevel, Long> counts = new EnumMap<>(ThreatLevel.class);
    for (PacketRecord record : records) {
      counts.merge(record.threatLevel(), 1L, Long::sum);
    }
    List<ThreatAlert> newest = new ArrayList<>(ALERTS_SHOWN);
    for (int i = alerts.size() - 1; i >= 0 && newest.size() < ALERTS_SHOWN; i--) {
      newest.add(alerts.get(i));
    }
    return new ThreatStatus(counts, alerts.size(), newest);
  }

  static List<RankedEntry> rank(Map<String, Long> counts, long total, int limit) {
    List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
    entries.sort(Map.Entry.<String, Long>comparingByValue().reversed());
    List<RankedEntry> out = new ArrayList<>(Math.min(limit, entries.size()));
    for (Map.Entry<String, Long> entry : entries) {
      if (out.size() >= limit) {
        break;
      }
      out.add(new RankedEntry(entry.getKey(), entry.getValue(), share(entry.getValue(), total)));
    }
    return out;
  }

  private static List<RankedEntry> rankPorts(Map<Integer, Long> portActivity) {
    Map<String, Long> labelled = new LinkedHashMap<>();
    long total = 0;
    for (Map.Entry<Integer, Long> entry : portActivity.entrySet()) {
      labelled.put(Integer.toString(entry.getKey()), entry.getValue());
      total += entry.getValue();
    }
    return rank(labelled, total, TOP_PORTS);
  }

  static List<ConnectionFlow> topConnections(List<ConnectionFlow> connections) {
    List<ConnectionFlow> sorted = new ArrayList<>(connections);
    sorted.sort(Comparator.comparingLong(ConnectionFlow::packetCount).reversed());
    return sorted.size() > TOP_CONNECTIONS ? sorted.subList(0, TOP_CONNECTIONS) : sorted;
  }

  static SizeDistribution sizeDistribution(List<Integer> sizes) {
    if (sizes.isEmpty()) {
      List<BucketShare> empty = new ArrayList<>();
      for (SizeBucket bucket : SizeBucket.values()) {
        empty.add(new BucketShare(bucket, 0L, 0d));
      }
      return new SizeDistribution(0, 0d, 0, 0, empty);
    }
    long sum = 0;
    int min = Integer.MAX_VALUE;
    int max = Integer.MIN_VALUE;
    Map<SizeBucket, Long> counts = new EnumMap<>(SizeBucket.class);
    for (int size : sizes) {
      sum += size;
      min = Math.min(min, size);
      max = Math.max(max, size);
      counts.merge(SizeBucket.of(size), 1L, Long::sum);
    }
    List<BucketShare> buckets = new ArrayList<>();
    for (SizeBucket bucket : SizeBucket.values()) {
      long count = counts.getOrDefault(bucket, 0L);
      buckets.add(new BucketShare(bucket, count, share(count, sizes.size())));
    }
    return new SizeDistribution(sizes.size(), (double) sum / sizes.size(), min, max, buckets);
  }

  static List<RankedEntry> countries(List<PacketRecord> records) {
    Map<String, Long> counts = new LinkedHashMap<>();
    long considered = 0;
    for (PacketRecord record : newestFirst(records, GEO_WINDOW)) {
      if (record.geo() != null) {
        counts.merge(record.geo().country(), 1L, Long::sum);
        considered++;
      }
    }
    return rank(counts, considered, TOP_COUNTRIES);
  }

  static List<PacketRecord> newestFirst(List<PacketRecord> records, int limit) {
    List<PacketRecord> out = new ArrayList<>(Math.min(limit, records.size()));
    for (int i = records.size() - 1; i >= 0 && out.size() < limit; i--) {
      out.add(records.get(i));
    }
    return out;
  }

  private static <T> List<T> window(List<T> items, int newest) {
    return items.size() > newest ? items.subList(items.size() - newest, items.size()) : items;
  }

  private static double share(long count, long total) {
    return total > 0 ? count * 100d / total : 0d;
  }
}
