package ca.gc.cra.netwatch.infrastructure.capture;

import java.io.IOException;

/** Open libpcap handle as seen by {@link Pcap4jPacketSource}. */
interface CaptureHandle extends AutoCloseable {
  /**
   * Reads the next frame.
   *
   * @return captured bytes, or {@code null} when the read timed out or the file ended
   * @throws IOException if the handle can no longer be read
   */
  byte[] nextFrame() throws IOException;

  /**
   * Capture time of the frame last returned by {@link #nextFrame()}.
   *
   * @return microseconds since the epoch, {@code 0} when unknown
   */
  long lastTimestampMicros();

  /** Data link type name reported by libpcap, for logging. */
  String linkType();

  @Override
  void close();

  /** Opens a handle on first use of the source. */
  @FunctionalInterface
  interface Opener {
    CaptureHandle open() throws IOException;
  }
}
