package ca.gc.cra.netwatch.infrastructure.export;

import ca.gc.cra.netwatch.application.port.ExportException;
import ca.gc.cra.netwatch.application.port.ExportFormat;
import ca.gc.cra.netwatch.application.port.RecordExporter;
import ca.gc.cra.netwatch.domain.net.PacketRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes exports to the local filesystem, creating missing parent directories.
 *
 * @since 0.1.0
 */
public final class FileRecordExporter implements RecordExporter {
  private static final Logger log = LoggerFactory.getLogger(FileRecordExporter.class);

  private final ExportSerializer serializer;

  public FileRecordExporter(ExportSerializer serializer) {
    this.serializer = Objects.requireNonNull(serializer, "serializer");
  }

  @Override
  public void export(List<PacketRecord> records, ExportFormat format, Path target) throws ExportException {
    Objects.requireNonNull(records, "records");
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(target, "target");
    try {
      byte[] bytes = switch (format) {
        case JSON -> serializer.toJson(records);
        case CSV -> serializer.toCsv(records);
      };
      Path parent = target.toAbsolutePath().getParent();
      if (parent != null && !Files.isDirectory(parent)) {
        Files.createDirectories(parent);
      }
      Files.write(target, bytes);
    } catch (IOException ex) {
      throw new ExportException(records.size(), target, ex);
    }
    log.info("Exported {} packets to {} file: {}", records.size(), format.name().toUpperCase(Locale.ROOT), target);
  }
}
