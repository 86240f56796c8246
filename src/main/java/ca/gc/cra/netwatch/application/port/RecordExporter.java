package ca.gc.cra.netwatch.application.port;

import ca.gc.cra.netwatch.domain.net.PacketRecord;
import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> Output port writing captured records as a static dataset.
 * <p><strong>Role:</strong> Invoked once at capture end with the contents of the recent-record buffer.</p>
 * <p><strong>Thread-safety:</strong> Implementations are stateless; concurrent exports to distinct targets are safe.</p>
 *
 * @since 0.1.0
 */
public interface RecordExporter {
  /**
   * Writes {@code records} to {@code target} in the requested format, replacing any existing file.
   *
   * @param records records in capture order
   * @param format output format
   * @param target destination file
   * @throws ExportException if serialization or the write fails
   */
  void export(List<PacketRecord> records, ExportFormat format, Path target) throws ExportException;
}
