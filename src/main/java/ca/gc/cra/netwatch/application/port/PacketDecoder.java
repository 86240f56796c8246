package ca.gc.cra.netwatch.application.port;

import ca.gc.cra.netwatch.domain.net.PacketRecord;
import ca.gc.cra.netwatch.domain.net.RawFrame;

/**
 * <strong>What:</strong> Port that turns raw link-layer frames into {@link PacketRecord}s.
 * <p><strong>Contract:</strong> Never fails; unparsable input yields a best-effort record with unknown fields left
 * empty. The returned record is classified {@code SAFE}; scoring happens afterwards.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or confined to one thread.</p>
 *
 * @since 0.1.0
 */
public interface PacketDecoder {
  /**
   * Decodes one frame.
   *
   * @param frame captured frame; must not be {@code null}
   * @param sequence accepted-packet number to stamp on the record
   * @return decoded record
   */
  PacketRecord decode(RawFrame frame, long sequence);
}
