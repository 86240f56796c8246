package ca.gc.cra.netwatch.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Signals that a dataset export could not be written.
 *
 * <p>Carries the number of records that were meant to be written and the target path so callers can report
 * exactly what was lost.</p>
 *
 * @since 0.1.0
 */
public final class ExportException extends IOException {
  private static final long serialVersionUID = 1L;

  private final int recordCount;
  private final transient Path target;

  /**
   * Creates an export failure.
   *
   * @param recordCount number of records in the failed export
   * @param target destination file
   * @param cause underlying I/O failure
   */
  public ExportException(int recordCount, Path target, Throwable cause) {
    super("Failed to export " + recordCount + " packets to " + target, cause);
    this.recordCount = recordCount;
    this.target = target;
  }

  /**
   * Returns the record count of the failed export.
   *
   * @return number of records
   */
  public int recordCount() {
    return recordCount;
  }

  /**
   * Returns the destination that could not be written.
   *
   * @return target path
   */
  public Path target() {
    return target;
  }
}
