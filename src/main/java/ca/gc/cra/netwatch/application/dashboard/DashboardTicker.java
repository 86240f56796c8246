package ca.gc.cra.netwatch.application.dashboard;

import ca.gc.cra.netwatch.application.port.DisplaySink;
import ca.gc.cra.netwatch.application.port.MetricsPort;
import ca.gc.cra.netwatch.application.telemetry.RecentRecordBuffer;
import ca.gc.cra.netwatch.application.telemetry.TelemetryAggregator;
import ca.gc.cra.netwatch.domain.net.PacketRecord;
import ca.gc.cra.netwatch.domain.telemetry.TelemetrySnapshot;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Periodic render loop of the live dashboard.
 * <p><strong>Role:</strong> Render path. Each tick snapshots the aggregator and the recent buffer, releases their
 * locks, then builds, formats and writes the frame.</p>
 * <p><strong>Failure handling:</strong> A failing tick is logged and counted; the schedule keeps running unless the
 * failure is an {@link Error}.</p>
 * <p><strong>Thread-safety:</strong> {@link #start()} and {@link #stop()} may be called from any thread; ticks run on
 * the supplied scheduler.</p>
 *
 * @since 0.1.0
 */
public final class DashboardTicker implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(DashboardTicker.class);
  private static final long STOP_TIMEOUT_MILLIS = 2_000L;

  private final TelemetryAggregator aggregator;
  private final RecentRecordBuffer recent;
  private final DashboardViewBuilder viewBuilder;
  private final DashboardRenderer renderer;
  private final DisplaySink sink;
  private final MetricsPort metrics;
  private final ScheduledExecutorService scheduler;
  private final Duration interval;
  private final AtomicLong ticks = new AtomicLong();

  private ScheduledFuture<?> schedule;

  /**
   * Creates a ticker.
   *
   * @param aggregator telemetry source
   * @param recent recent-record source
   * @param sink display receiving each frame
   * @param metrics metrics sink for tick counters and render latency
   * @param scheduler scheduler owning the render thread; shut down by {@link #stop()}
   * @param interval time between ticks; must be positive
   */
  public DashboardTicker(
      TelemetryAggregator aggregator,
      RecentRecordBuffer recent,
      DisplaySink sink,
      MetricsPort metrics,
      ScheduledExecutorService scheduler,
      Duration interval) {
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.recent = Objects.requireNonNull(recent, "recent");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.interval = Objects.requireNonNull(interval, "interval");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive (was " + interval + ')');
    }
    this.viewBuilder = new DashboardViewBuilder();
    this.renderer = new DashboardRenderer();
  }

  /** Schedules the first tick immediately and subsequent ticks at the configured interval. */
  public synchronized void start() {
    if (schedule != null) {
      throw new IllegalStateException("Dashboard ticker already started");
    }
    schedule = scheduler.scheduleAtFixedRate(
        this::renderOnce, 0L, interval.toMillis(), TimeUnit.MILLISECONDS);
    log.debug("Dashboard ticker started with {} ms interval", interval.toMillis());
  }

  /**
   * Renders one frame. Exceptions are logged and counted; an {@link Error} is logged and counted, then rethrown,
   * which ends the schedule.
   *
   * @return {@code true} when the frame was written
   */
  public boolean renderOnce() {
    long startNanos = System.nanoTime();
    try {
      TelemetrySnapshot snapshot = aggregator.snapshot();
      List<PacketRecord> records = recent.snapshot();
      List<String> frame = renderer.render(viewBuilder.build(snapshot, records));
      sink.redraw(frame);
      ticks.incrementAndGet();
      metrics.increment("dashboard.render.ticks");
      metrics.observe("dashboard.render.nanos", System.nanoTime() - startNanos);
      return true;
    } catch (RuntimeException ex) {
      metrics.increment("dashboard.render.errors");
      log.error("Dashboard render failed; continuing with next tick", ex);
      return false;
    } catch (Error err) {
      metrics.increment("dashboard.render.errors");
      log.error("Dashboard render hit a fatal error; no further frames will be drawn", err);
      throw err;
    }
  }

  /**
   * Returns the number of frames written so far.
   *
   * @return successful tick count
   */
  public long ticks() {
    return ticks.get();
  }

  /** Cancels the schedule and shuts the scheduler down, waiting briefly for an in-flight tick. */
  public synchronized void stop() {
    if (schedule != null) {
      schedule.cancel(false);
    }
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(STOP_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
        log.warn("Dashboard render thread still active after {} ms; forcing shutdown", STOP_TIMEOUT_MILLIS);
        scheduler.shutdownNow();
      }
    } catch (InterruptedException ie) {
      scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  @Override
  public void close() {
    stop();
  }
}
