package ca.gc.cra.netwatch.application.pipeline;

import ca.gc.cra.netwatch.application.filter.CaptureFilter;
import ca.gc.cra.netwatch.application.pipeline.CaptureOutcome.StopReason;
import ca.gc.cra.netwatch.application.port.ClockPort;
import ca.gc.cra.netwatch.application.port.MetricsPort;
import ca.gc.cra.netwatch.application.port.PacketDecoder;
import ca.gc.cra.netwatch.application.port.PacketSource;
import ca.gc.cra.netwatch.application.telemetry.RecentRecordBuffer;
import ca.gc.cra.netwatch.application.telemetry.TelemetryAggregator;
import ca.gc.cra.netwatch.domain.net.PacketRecord;
import ca.gc.cra.netwatch.domain.net.RawFrame;
import ca.gc.cra.netwatch.domain.threat.ThreatClassifier;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Ingestion path of a capture: poll, decode, filter, classify, then update telemetry.
 * <p><strong>Role:</strong> Single producer for {@link TelemetryAggregator} and {@link RecentRecordBuffer}. Runs on
 * the caller thread in streaming mode and on {@code netwatch-capture} in dashboard mode.</p>
 * <p><strong>Failure handling:</strong> A failure to start the source propagates. A failure while polling is logged
 * once, ends ingestion and is reported in the returned {@link CaptureOutcome}.</p>
 * <p><strong>Thread-safety:</strong> {@link #run()} runs at most once; {@link #stop()} may be called from any
 * thread and takes effect after the current poll returns.</p>
 *
 * @since 0.1.0
 */
public final class CaptureSessionUseCase {
  private static final Logger log = LoggerFactory.getLogger(CaptureSessionUseCase.class);

  private final PacketSource source;
  private final PacketDecoder decoder;
  private final CaptureFilter filter;
  private final ThreatClassifier classifier;
  private final TelemetryAggregator aggregator;
  private final RecentRecordBuffer recent;
  private final PacketRecordListener listener;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Settings settings;
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private volatile boolean used;

  /**
   * Creates a capture session.
   *
   * @param source frame source; started and closed by {@link #run()}
   * @param decoder frame decoder
   * @param filter capture filter
   * @param classifier threat classifier
   * @param aggregator telemetry aggregator
   * @param recent recent-record buffer
   * @param listener per-record callback
   * @param metrics metrics sink
   * @param clock time source for the capture duration
   * @param settings session limits and labels
   */
  public CaptureSessionUseCase(
      PacketSource source,
      PacketDecoder decoder,
      CaptureFilter filter,
      ThreatClassifier classifier,
      TelemetryAggregator aggregator,
      RecentRecordBuffer recent,
      PacketRecordListener listener,
      MetricsPort metrics,
      ClockPort clock,
      Settings settings) {
    this.source = Objects.requireNonNull(source, "source");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.filter = Objects.requireNonNull(filter, "filter");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.recent = Objects.requireNonNull(recent, "recent");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Runs the capture until the count limit, source exhaustion, a read failure, {@link #stop()} or interruption.
   *
   * @return capture outcome
   * @throws Exception if the source cannot be started
   */
  public CaptureOutcome run() throws Exception {
    synchronized (this) {
      if (used) {
        throw new IllegalStateException("Capture session already used");
      }
      used = true;
    }
    MDC.put("pipeline", "capture");
    long startMillis = clock.nowMillis();
    long accepted = 0;
    long polled = 0;
    long filtered = 0;
    Exception readFailure = null;
    StopReason reason = StopReason.STOPPED;
    try {
      log.info("Starting packet capture on interface: {}", settings.sourceLabel());
      log.debug("Capture filter {} with limit {}", filter.describe(), settings.countLimit());
      source.start();
      aggregator.markCaptureStarted();
      try {
        while (true) {
          if (stopRequested.get()) {
            reason = StopReason.STOPPED;
            break;
          }
          if (Thread.currentThread().isInterrupted()) {
            reason = StopReason.INTERRUPTED;
            break;
          }
          if (settings.countLimit() > 0 && accepted >= settings.countLimit()) {
            reason = StopReason.LIMIT_REACHED;
            break;
          }

          Optional<RawFrame> maybeFrame;
          try {
            maybeFrame = source.poll();
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            reason = StopReason.INTERRUPTED;
            break;
          } catch (Exception ex) {
            if (stopRequested.get()) {
              log.debug("Packet source failed after stop was requested", ex);
              reason = StopReason.STOPPED;
              break;
            }
            metrics.increment("capture.poll.error");
            log.error("Failed to read packet: {}", ex.getMessage(), ex);
            readFailure = ex;
            reason = StopReason.READ_FAILURE;
            break;
          }

          if (maybeFrame.isEmpty()) {
            if (source.isExhausted()) {
              reason = StopReason.SOURCE_EXHAUSTED;
              break;
            }
            continue;
          }

          polled++;
          metrics.increment("capture.frames.polled");
          PacketRecord decoded = decoder.decode(maybeFrame.get(), accepted + 1);
          if (!filter.accepts(decoded)) {
            filtered++;
            metrics.increment("capture.frames.filtered");
            continue;
          }
          PacketRecord record = decoded.withThreatLevel(classifier.classify(decoded));
          aggregator.ingest(record);
          recent.add(record);
          accepted++;
          metrics.increment("capture.records.accepted");
          listener.onRecord(record);
        }
      } finally {
        closeSource();
      }
      Duration elapsed = Duration.ofMillis(Math.max(0L, clock.nowMillis() - startMillis));
      log.info("Stopped packet capture. Captured {} packets in {} seconds", accepted, elapsed.getSeconds());
      return new CaptureOutcome(accepted, polled, filtered, elapsed, reason, Optional.ofNullable(readFailure));
    } finally {
      MDC.remove("pipeline");
    }
  }

  /** Requests the capture loop to end after the current poll. */
  public void stop() {
    if (stopRequested.compareAndSet(false, true)) {
      log.debug("Capture stop requested");
    }
  }

  /**
   * Indicates whether {@link #stop()} has been called.
   *
   * @return {@code true} once a stop was requested
   */
  public boolean isStopRequested() {
    return stopRequested.get();
  }

  private void closeSource() {
    try {
      source.close();
    } catch (Exception closeFailure) {
      metrics.increment("capture.close.error");
      log.warn("Failed to close packet source for {}", settings.sourceLabel(), closeFailure);
    }
  }

  /**
   * Session limits and labels.
   *
   * @param sourceLabel interface name or capture file shown in log lines
   * @param countLimit maximum accepted records; 0 means unlimited
   */
  public record Settings(String sourceLabel, long countLimit) {
    public Settings {
      sourceLabel = Objects.requireNonNullElse(sourceLabel, "unknown");
      if (countLimit < 0) {
        throw new IllegalArgumentException("countLimit must be >= 0 (was " + countLimit + ')');
      }
    }
  }
}
