package ca.gc.cra.netwatch.application.pipeline;

import ca.gc.cra.netwatch.application.port.ExportException;
import ca.gc.cra.netwatch.application.port.ExportFormat;
import ca.gc.cra.netwatch.application.port.MetricsPort;
import ca.gc.cra.netwatch.application.port.RecordExporter;
import ca.gc.cra.netwatch.domain.net.PacketRecord;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the captured records to every requested export target.
 *
 * <p>All targets are attempted; when some fail, the first failure is thrown with later ones attached as
 * suppressed exceptions.</p>
 *
 * @since 0.1.0
 */
public final class ExportUseCase {
  private static final Logger log = LoggerFactory.getLogger(ExportUseCase.class);

  private final RecordExporter exporter;
  private final MetricsPort metrics;

  public ExportUseCase(RecordExporter exporter, MetricsPort metrics) {
    this.exporter = Objects.requireNonNull(exporter, "exporter");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Exports {@code records} to each target.
   *
   * @param records records in capture order
   * @param targets destinations; may be empty
   * @throws ExportException if at least one target could not be written
   */
  public void exportAll(List<PacketRecord> records, List<ExportTarget> targets) throws ExportException {
    Objects.requireNonNull(records, "records");
    ExportException first = null;
    for (ExportTarget target : targets) {
      try {
        exporter.export(records, target.format(), target.path());
        metrics.observe("export.records", records.size());
      } catch (ExportException ex) {
        metrics.increment("export.errors");
        log.error("Export to {} failed", target.path(), ex);
        if (first == null) {
          first = ex;
        } else {
          first.addSuppressed(ex);
        }
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * One export destination.
   *
   * @param format output format
   * @param path destination file
   */
  public record ExportTarget(ExportFormat format, Path path) {
    public ExportTarget {
      Objects.requireNonNull(format, "format");
      Objects.requireNonNull(path, "path");
    }
  }
}
