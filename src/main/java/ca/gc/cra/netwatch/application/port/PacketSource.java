package ca.gc.cra.netwatch.application.port;

import ca.gc.cra.netwatch.domain.net.RawFrame;
import java.util.Optional;

/**
 * <strong>What:</strong> Port that supplies captured frames to the ingestion path.
 * <ul>
 *   <li>Open and close capture resources safely.</li>
 *   <li>Poll for new frames with bounded blocking semantics.</li>
 *   <li>Signal exhaustion so offline replays can end the capture.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations are confined to the ingestion thread.</p>
 *
 * @implNote Callers must invoke {@link #start()} before polling and always call {@link #close()}.
 * @since 0.1.0
 */
public interface PacketSource extends AutoCloseable {
  /**
   * Opens the capture device or file.
   *
   * @throws Exception if the source cannot be opened or configured
   */
  void start() throws Exception;

  /**
   * Retrieves the next frame when available.
   *
   * @return frame, or empty when the read timed out or the source is exhausted
   * @throws Exception if the device fails mid-stream
   */
  Optional<RawFrame> poll() throws Exception;

  /**
   * Indicates whether the source has been fully drained.
   *
   * @return {@code true} when no further frames will be delivered
   */
  default boolean isExhausted() {
    return false;
  }

  /**
   * Releases the capture handle.
   *
   * @throws Exception if native resources cannot be released
   */
  @Override
  void close() throws Exception;
}
