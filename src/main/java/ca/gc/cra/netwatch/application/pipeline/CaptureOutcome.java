package ca.gc.cra.netwatch.application.pipeline;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one capture session.
 *
 * @param acceptedRecords records that passed the filter and reached telemetry
 * @param framesPolled frames delivered by the source
 * @param framesFiltered frames rejected by the capture filter
 * @param elapsed wall-clock capture duration
 * @param stopReason why ingestion ended
 * @param readFailure mid-stream read failure, when that ended ingestion
 * @since 0.1.0
 */
public record CaptureOutcome(
    long acceptedRecords,
    long framesPolled,
    long framesFiltered,
    Duration elapsed,
    StopReason stopReason,
    Optional<Exception> readFailure) {

  public CaptureOutcome {
    Objects.requireNonNull(elapsed, "elapsed");
    Objects.requireNonNull(stopReason, "stopReason");
    readFailure = Objects.requireNonNullElse(readFailure, Optional.empty());
  }

  /**
   * Indicates whether the session ended because the source failed.
   *
   * @return {@code true} when a read failure is recorded
   */
  public boolean failed() {
    return readFailure.isPresent();
  }

  /** Why a capture session ended. */
  public enum StopReason {
    /** The configured record count was reached. */
    LIMIT_REACHED,
    /** An offline source ran out of frames. */
    SOURCE_EXHAUSTED,
    /** {@code stop()} was requested, typically by the shutdown hook. */
    STOPPED,
    /** The ingestion thread was interrupted. */
    INTERRUPTED,
    /** The source failed mid-stream. */
    READ_FAILURE
  }
}
