package ca.gc.cra.netwatch.infrastructure.display;

import ca.gc.cra.netwatch.application.port.DisplaySink;
import java.io.PrintWriter;
import java.util.List;
import java.util.Objects;

/**
 * {@link DisplaySink} writing to a terminal through a {@link PrintWriter}.
 *
 * <p>When screen clearing is enabled, {@link #redraw(List)} homes the cursor and clears the terminal before the
 * frame so the dashboard repaints in place. Writes are serialized on the sink.</p>
 *
 * @since 0.1.0
 */
public final class ConsoleDisplaySink implements DisplaySink {
  static final String CLEAR_SCREEN = "\u001B[2J\u001B[1;1H";

  private final PrintWriter out;
  private final boolean clearScreen;

  /**
   * Creates a console sink.
   *
   * @param out destination writer
   * @param clearScreen emit ANSI clear sequences before each redraw
   */
  public ConsoleDisplaySink(PrintWriter out, boolean clearScreen) {
    this.out = Objects.requireNonNull(out, "out");
    this.clearScreen = clearScreen;
  }

  @Override
  public synchronized void write(List<String> lines) {
    for (String line : lines) {
      out.println(line);
    }
    out.flush();
  }

  @Override
  public synchronized void redraw(List<String> frame) {
    StringBuilder buffer = new StringBuilder(frame.size() * 80 + CLEAR_SCREEN.length());
    if (clearScreen) {
      buffer.append(CLEAR_SCREEN);
    }
    for (String line : frame) {
      buffer.append(line).append(System.lineSeparator());
    }
    out.print(buffer);
    out.flush();
  }
}
