package ca.gc.cra.netwatch.application.telemetry;

import ca.gc.cra.netwatch.application.port.ClockPort;
import ca.gc.cra.netwatch.application.port.MetricsPort;
import ca.gc.cra.netwatch.domain.net.FlowKey;
import ca.gc.cra.netwatch.domain.net.PacketRecord;
import ca.gc.cra.netwatch.domain.telemetry.BandwidthPoint;
import ca.gc.cra.netwatch.domain.telemetry.ConnectionFlow;
import ca.gc.cra.netwatch.domain.telemetry.RingBuffer;
import ca.gc.cra.netwatch.domain.telemetry.TelemetrySnapshot;
import ca.gc.cra.netwatch.domain.telemetry.ThreatAlert;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * <strong>What:</strong> Rolling telemetry state built from accepted packet records.
 * <p><strong>Role:</strong> Shared between the ingestion path (single writer) and the render path (reader).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Maintain totals, per-protocol, per-application, per-port and per-talker counters.</li>
 *   <li>Keep bounded histories of packet sizes, bandwidth samples and threat alerts.</li>
 *   <li>Track one {@link ConnectionFlow} per directional flow key.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Every {@link #ingest(PacketRecord)} applies all updates under the write lock;
 * {@link #snapshot()} copies under the read lock, so readers never observe a partial update.</p>
 *
 * @implNote Counter maps and the connection table are not bounded; long captures across many hosts grow them.
 * @since 0.1.0
 */
public final class TelemetryAggregator {
  /** Packet sizes retained for the size histogram. */
  public static final int PACKET_SIZE_CAPACITY = 1_000;
  /** Bandwidth samples retained for the graph. */
  public static final int BANDWIDTH_CAPACITY = 100;
  /** Threat alerts retained for the security panel. */
  public static final int ALERT_CAPACITY = 100;
  /** A bandwidth sample is taken each time the packet total reaches a multiple of this value. */
  static final int BANDWIDTH_SAMPLE_EVERY = 100;

  private final ClockPort clock;
  private final MetricsPort metrics;
  private long startMillis;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  private long totalPackets;
  private long totalBytes;
  private final Map<String, Long> protocolCounts = new LinkedHashMap<>();
  private final Map<String, Long> applicationCounts = new LinkedHashMap<>();
  private final Map<String, Long> topTalkers = new LinkedHashMap<>();
  private final Map<Integer, Long> portActivity = new LinkedHashMap<>();
  private final RingBuffer<Integer> packetSizes = new RingBuffer<>(PACKET_SIZE_CAPACITY);
  private final RingBuffer<BandwidthPoint> bandwidthHistory = new RingBuffer<>(BANDWIDTH_CAPACITY);
  private final RingBuffer<ThreatAlert> threatAlerts = new RingBuffer<>(ALERT_CAPACITY);
  private final Map<FlowKey, ConnectionFlow> connections = new LinkedHashMap<>();
  private double peakBytesPerSecond;
  private double peakPacketsPerSecond;
  private int currentConnections;

  /**
   * Creates an aggregator whose elapsed time starts now, until {@link #markCaptureStarted()} moves the start.
   *
   * @param clock time source for elapsed time and bandwidth samples
   * @param metrics metrics sink for alert counters
   */
  public TelemetryAggregator(ClockPort clock, MetricsPort metrics) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.startMillis = clock.nowMillis();
  }

  /**
   * Restarts elapsed time at the current clock reading. Called once the capture source is open so rates exclude
   * start-up time.
   */
  public void markCaptureStarted() {
    lock.writeLock().lock();
    try {
      startMillis = clock.nowMillis();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Applies one accepted record to every statistic.
   *
   * @param record classified record; must not be {@code null}
   */
  public void ingest(PacketRecord record) {
    Objects.requireNonNull(record, "record");
    boolean alert = record.threatLevel().isAlerting();
    lock.writeLock().lock();
    try {
      totalPackets++;
      totalBytes += record.size();
      protocolCounts.merge(record.protocol(), 1L, Long::sum);
      if (record.applicationProtocol() != null) {
        applicationCounts.merge(record.applicationProtocol(), 1L, Long::sum);
      }
      packetSizes.add(record.size());
      OptionalInt port = record.preferredPort();
      if (port.isPresent()) {
        portActivity.merge(port.getAsInt(), 1L, Long::sum);
      }
      if (record.srcIp() != null) {
        topTalkers.merge(record.srcIp(), 1L, Long::sum);
      }
      if (alert) {
        threatAlerts.add(ThreatAlert.forRecord(record));
      }
      FlowKey.of(record).ifPresent(key -> connections.merge(
          key, ConnectionFlow.open(key, record), (existing, ignored) -> existing.absorb(record)));
      sampleBandwidth(record.timestamp());
      currentConnections = connections.size();
    } finally {
      lock.writeLock().unlock();
    }
    if (alert) {
      metrics.increment("telemetry.alerts");
    }
  }

  // Caller holds the write lock.
  private void sampleBandwidth(Instant capturedAt) {
    long elapsedSeconds = Math.max(0L, clock.nowMillis() - startMillis) / 1_000L;
    if (elapsedSeconds <= 0 || totalPackets % BANDWIDTH_SAMPLE_EVERY != 0) {
      return;
    }
    double bytesPerSecond = (double) totalBytes / elapsedSeconds;
    double packetsPerSecond = (double) totalPackets / elapsedSeconds;
    bandwidthHistory.add(new BandwidthPoint(capturedAt, bytesPerSecond, packetsPerSecond));
    peakBytesPerSecond = Math.max(peakBytesPerSecond, bytesPerSecond);
    peakPacketsPerSecond = Math.max(peakPacketsPerSecond, packetsPerSecond);
  }

  /**
   * Copies the complete state.
   *
   * @return immutable, internally consistent snapshot
   */
  public TelemetrySnapshot snapshot() {
    lock.readLock().lock();
    try {
      long now = clock.nowMillis();
      return new TelemetrySnapshot(
          Instant.ofEpochMilli(now),
          Duration.ofMillis(Math.max(0L, now - startMillis)),
          totalPackets,
          totalBytes,
          protocolCounts,
          applicationCounts,
          topTalkers,
          portActivity,
          packetSizes.toList(),
          bandwidthHistory.toList(),
          threatAlerts.toList(),
          new ArrayList<>(connections.values()),
          peakBytesPerSecond,
          peakPacketsPerSecond,
          currentConnections);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Returns the number of records ingested so far.
   *
   * @return packet total
   */
  public long totalPackets() {
    lock.readLock().lock();
    try {
      return totalPackets;
    } finally {
      lock.readLock().unlock();
    }
  }
}
