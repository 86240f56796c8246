package ca.gc.cra.netwatch.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Console output for CLI text, dashboard frames and packet lines.
 *
 * <p>Writes UTF-8 to the stdout file descriptor; logs go to stderr so the two never interleave. Tests swap the
 * destination with {@link #setWriterForTesting(PrintWriter)}.</p>
 */
public final class CliPrinter {
  private static final AtomicReference<PrintWriter> OVERRIDE = new AtomicReference<>();

  private CliPrinter() {
    // Utility
  }

  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints lines and flushes once at the end.
   *
   * @param lines lines without trailing newlines; {@code null} prints nothing
   */
  public static void printLines(Iterable<String> lines) {
    if (lines == null) {
      return;
    }
    PrintWriter out = writer();
    lines.forEach(out::println);
    out.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    OVERRIDE.set(writer);
  }

  static void clearTestWriter() {
    OVERRIDE.set(null);
  }

  /**
   * Returns the active writer. Dashboard sinks capture it once at start-up.
   *
   * @return test override, or the shared stdout writer
   */
  static PrintWriter writer() {
    PrintWriter override = OVERRIDE.get();
    return override != null ? override : Stdout.WRITER;
  }

  private static final class Stdout {
    static final PrintWriter WRITER = new PrintWriter(
        new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  }
}
