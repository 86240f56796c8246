package ca.gc.cra.netwatch.application.port;

import java.util.List;

/**
 * Port receiving rendered text for the operator's terminal.
 *
 * @since 0.1.0
 */
public interface DisplaySink {
  /**
   * Appends lines to the display.
   *
   * @param lines lines to print, without trailing newlines
   */
  void write(List<String> lines);

  /**
   * Replaces the whole display with a new frame. Sinks without cursor control simply append.
   *
   * @param frame lines of the new frame
   */
  default void redraw(List<String> frame) {
    write(frame);
  }
}
