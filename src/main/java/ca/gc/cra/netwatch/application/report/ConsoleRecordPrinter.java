package ca.gc.cra.netwatch.application.report;

import ca.gc.cra.netwatch.application.pipeline.PacketRecordListener;
import ca.gc.cra.netwatch.application.port.ClockPort;
import ca.gc.cra.netwatch.application.port.DisplaySink;
import ca.gc.cra.netwatch.application.telemetry.TelemetryAggregator;
import ca.gc.cra.netwatch.domain.net.PacketRecord;
import java.util.List;
import java.util.Objects;

/**
 * Streaming-mode listener printing each record and periodic interim statistics.
 *
 * <p>Runs on the ingestion thread; interim statistics are printed after the record that crosses the interval.</p>
 */
public final class ConsoleRecordPrinter implements PacketRecordListener {
  private final DisplaySink sink;
  private final TelemetryAggregator aggregator;
  private final ClockPort clock;
  private final boolean detailed;
  private final long statsIntervalMillis;
  private long lastStatsMillis;

  /**
   * Creates a printer.
   *
   * @param sink output sink
   * @param aggregator telemetry used for interim statistics
   * @param clock time source for the statistics interval
   * @param detailed print the multi-line form
   * @param statsIntervalSeconds seconds between interim statistics; 0 disables them
   */
  public ConsoleRecordPrinter(
      DisplaySink sink,
      TelemetryAggregator aggregator,
      ClockPort clock,
      boolean detailed,
      long statsIntervalSeconds) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (statsIntervalSeconds < 0) {
      throw new IllegalArgumentException("statsIntervalSeconds must be >= 0");
    }
    this.detailed = detailed;
    this.statsIntervalMillis = statsIntervalSeconds * 1_000L;
    this.lastStatsMillis = clock.nowMillis();
  }

  @Override
  public void onRecord(PacketRecord record) {
    if (detailed) {
      sink.write(PacketLineFormatter.detailed(record));
    } else {
      sink.write(List.of(PacketLineFormatter.simple(record)));
    }
    if (statsIntervalMillis == 0) {
      return;
    }
    long now = clock.nowMillis();
    if (now - lastStatsMillis >= statsIntervalMillis) {
      sink.write(CaptureSummaryFormatter.interim(aggregator.snapshot()));
      lastStatsMillis = now;
    }
  }
}
