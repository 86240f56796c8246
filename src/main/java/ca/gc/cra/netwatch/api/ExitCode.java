package ca.gc.cra.netwatch.api;

/**
 * <strong>What:</strong> Process exit codes shared by NETWATCH commands.
 * <p><strong>Role:</strong> Returned by every CLI entry point and passed to {@link System#exit(int)} by
 * {@link Main}.</p>
 * <p><strong>Thread-safety:</strong> Immutable enum.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** I/O failure while capturing, reading configuration or exporting. */
  IO_ERROR(3),
  /** Capture configuration was rejected at start-up (unknown interface, bad filter). */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g. SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}
