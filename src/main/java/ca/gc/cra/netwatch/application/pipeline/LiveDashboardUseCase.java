package ca.gc.cra.netwatch.application.pipeline;

import ca.gc.cra.netwatch.application.dashboard.DashboardTicker;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Dashboard mode: ingestion on a dedicated thread, rendering on the ticker.
 * <p><strong>Lifecycle:</strong> {@link #run()} starts the ticker, submits the capture session and waits for it.
 * When ingestion ends on its own (limit, end of file, read failure) and {@code holdAfterCapture} is set, the
 * dashboard keeps showing the last state until {@link #stop()} is called.</p>
 * <p><strong>Thread-safety:</strong> {@link #stop()} is safe from any thread, including a shutdown hook.</p>
 *
 * @since 0.1.0
 */
public final class LiveDashboardUseCase {
  private static final Logger log = LoggerFactory.getLogger(LiveDashboardUseCase.class);
  private static final long CAPTURE_SHUTDOWN_MILLIS = 5_000L;

  private final CaptureSessionUseCase session;
  private final DashboardTicker ticker;
  private final ExecutorService captureExecutor;
  private final boolean holdAfterCapture;
  private final CountDownLatch stopLatch = new CountDownLatch(1);

  /**
   * Creates the dashboard pipeline.
   *
   * @param session ingestion session
   * @param ticker render ticker
   * @param captureExecutor single-threaded executor for ingestion; shut down by {@link #run()}
   * @param holdAfterCapture keep rendering after ingestion ends until stopped
   */
  public LiveDashboardUseCase(
      CaptureSessionUseCase session,
      DashboardTicker ticker,
      ExecutorService captureExecutor,
      boolean holdAfterCapture) {
    this.session = Objects.requireNonNull(session, "session");
    this.ticker = Objects.requireNonNull(ticker, "ticker");
    this.captureExecutor = Objects.requireNonNull(captureExecutor, "captureExecutor");
    this.holdAfterCapture = holdAfterCapture;
  }

  /**
   * Runs the dashboard until ingestion ends (and, when holding, until stopped).
   *
   * @return outcome of the capture session
   * @throws Exception if the source cannot be started
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public CaptureOutcome run() throws Exception {
    ticker.start();
    try {
      Future<CaptureOutcome> capture = captureExecutor.submit(session::run);
      CaptureOutcome outcome;
      try {
        outcome = capture.get();
      } catch (ExecutionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof Exception e) {
          throw e;
        }
        throw new IllegalStateException("Capture thread failed", cause);
      } catch (InterruptedException ie) {
        session.stop();
        capture.cancel(true);
        throw ie;
      }
      if (holdAfterCapture && !session.isStopRequested()) {
        if (outcome.failed()) {
          log.warn("Capture ended after a read failure; dashboard keeps showing the last state until stopped");
        } else {
          log.info("Capture ended ({}); dashboard keeps showing the last state until stopped",
              outcome.stopReason());
        }
        stopLatch.await();
      }
      ticker.renderOnce();
      return outcome;
    } finally {
      ticker.stop();
      shutdownCapture();
    }
  }

  /** Ends ingestion and releases a held dashboard. */
  public void stop() {
    session.stop();
    stopLatch.countDown();
  }

  private void shutdownCapture() {
    captureExecutor.shutdown();
    try {
      if (!captureExecutor.awaitTermination(CAPTURE_SHUTDOWN_MILLIS, TimeUnit.MILLISECONDS)) {
        log.warn("Capture thread still active after {} ms; interrupting", CAPTURE_SHUTDOWN_MILLIS);
        captureExecutor.shutdownNow();
      }
    } catch (InterruptedException ie) {
      captureExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
