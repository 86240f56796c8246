package ca.gc.cra.netwatch.application.dashboard;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netwatch.application.port.DisplaySink;
import ca.gc.cra.netwatch.application.port.MetricsPort;
import ca.gc.cra.netwatch.application.port.MutableClock;
import ca.gc.cra.netwatch.application.port.RecordingDisplaySink;
import ca.gc.cra.netwatch.application.port.RecordingMetricsPort;
import ca.gc.cra.netwatch.application.telemetry.RecentRecordBuffer;
import ca.gc.cra.netwatch.application.telemetry.TelemetryAggregator;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.Test;

class DashboardTickerTest {
  private final TelemetryAggregator aggregator = new TelemetryAggregator(new MutableClock(0L), MetricsPort.NO_OP);
  private final RecentRecordBuffer recent = new RecentRecordBuffer(10);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void renderOnceRedrawsAndRecordsMetrics() {
    RecordingDisplaySink sink = new RecordingDisplaySink();
    ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    try (DashboardTicker ticker = new DashboardTicker(aggregator, recent, sink, metrics, scheduler, Duration.ofSeconds(1))) {
      assertTrue(ticker.renderOnce());

      assertEquals(1, sink.frames().size());
      assertEquals(DashboardRenderer.TITLE, sink.frames().get(0).get(0));
      assertEquals(1, ticker.ticks());
      assertEquals(1, metrics.count("dashboard.render.ticks"));
      assertEquals(1, metrics.observed("dashboard.render.nanos").size());
    }
    assertTrue(scheduler.isShutdown());
  }

  @Test
  void renderFailureIsCountedAndSwallowed() {
    DisplaySink broken = new DisplaySink() {
      @Override
      public void write(List<String> lines) {
        throw new IllegalStateException("terminal gone");
      }
    };
    try (DashboardTicker ticker = new DashboardTicker(
        aggregator, recent, broken, metrics, Executors.newSingleThreadScheduledExecutor(), Duration.ofSeconds(1))) {
      assertFalse(ticker.renderOnce());
      assertEquals(0, ticker.ticks());
      assertEquals(1, metrics.count("dashboard.render.errors"));
    }
  }

  @Test
  void renderErrorIsCountedThenRethrown() {
    DisplaySink fatal = new DisplaySink() {
      @Override
      public void write(List<String> lines) {
        throw new StackOverflowError("renderer recursion");
      }
    };
    try (DashboardTicker ticker = new DashboardTicker(
        aggregator, recent, fatal, metrics, Executors.newSingleThreadScheduledExecutor(), Duration.ofSeconds(1))) {
      assertThrows(StackOverflowError.class, ticker::renderOnce);
      assertEquals(1, metrics.count("dashboard.render.errors"));
    }
  }

  @Test
  void scheduledTicksRenderRepeatedly() throws InterruptedException {
    RecordingDisplaySink sink = new RecordingDisplaySink();
    DashboardTicker ticker = new DashboardTicker(
        aggregator, recent, sink, metrics, Executors.newSingleThreadScheduledExecutor(), Duration.ofMillis(20));
    ticker.start();
    try {
      long deadline = System.currentTimeMillis() + 5_000;
      while (ticker.ticks() < 3 && System.currentTimeMillis() < deadline) {
        Thread.sleep(10);
      }
    } finally {
      ticker.stop();
    }

    assertTrue(ticker.ticks() >= 3);
    long afterStop = ticker.ticks();
    Thread.sleep(60);
    assertEquals(afterStop, ticker.ticks());
  }

  @Test
  void rejectsDoubleStartAndZeroInterval() {
    ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    assertThrows(IllegalArgumentException.class, () ->
        new DashboardTicker(aggregator, recent, new RecordingDisplaySink(), metrics, scheduler, Duration.ZERO));
    try (DashboardTicker ticker = new DashboardTicker(
        aggregator, recent, new RecordingDisplaySink(), metrics, scheduler, Duration.ofSeconds(10))) {
      ticker.start();
      assertThrows(IllegalStateException.class, ticker::start);
    }
  }
}
