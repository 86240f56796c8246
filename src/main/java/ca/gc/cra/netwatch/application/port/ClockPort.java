package ca.gc.cra.netwatch.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to telemetry and reporting.
 * <p>Aggregator elapsed time, interim-report scheduling and fallback record timestamps all read this port so
 * tests can drive time deterministically.</p>
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since the epoch
   */
  long nowMillis();

  /**
   * Returns the current time as an {@link Instant}.
   *
   * @return current instant
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Default clock backed by {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
