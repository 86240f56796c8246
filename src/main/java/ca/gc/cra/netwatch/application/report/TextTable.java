package ca.gc.cra.netwatch.application.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Minimal boxed text table for terminal summaries.
 *
 * <p>Column widths follow the widest cell. Rows shorter than the header are padded with blanks.</p>
 */
public final class TextTable {
  private final List<String> header;
  private final List<List<String>> rows = new ArrayList<>();

  /**
   * Creates a table.
   *
   * @param header column titles; at least one
   */
  public TextTable(List<String> header) {
    Objects.requireNonNull(header, "header");
    if (header.isEmpty()) {
      throw new IllegalArgumentException("header must not be empty");
    }
    this.header = List.copyOf(header);
  }

  /**
   * Appends a row.
   *
   * @param cells cell values; extra cells beyond the header are rejected
   * @return this table
   */
  public TextTable addRow(List<String> cells) {
    if (cells.size() > header.size()) {
      throw new IllegalArgumentException(
          "row has " + cells.size() + " cells but table has " + header.size() + " columns");
    }
    List<String> row = new ArrayList<>(header.size());
    for (int i = 0; i < header.size(); i++) {
      row.add(i < cells.size() && cells.get(i) != null ? cells.get(i) : "");
    }
    rows.add(row);
    return this;
  }

  public int rowCount() {
    return rows.size();
  }

  /**
   * Renders the table.
   *
   * @return lines including borders
   */
  public List<String> render() {
    int[] widths = new int[header.size()];
    for (int i = 0; i < widths.length; i++) {
      widths[i] = header.get(i).length();
      for (List<String> row : rows) {
        widths[i] = Math.max(widths[i], row.get(i).length());
      }
    }
    String border = border(widths);
    List<String> out = new ArrayList<>(rows.size() + 4);
    out.add(border);
    out.add(line(header, widths));
    out.add(border);
    for (List<String> row : rows) {
      out.add(line(row, widths));
    }
    out.add(border);
    return out;
  }

  private static String border(int[] widths) {
    StringBuilder sb = new StringBuilder("+");
    for (int w : widths) {
      sb.append("-".repeat(w + 2)).append('+');
    }
    return sb.toString();
  }

  private static String line(List<String> cells, int[] widths) {
    StringBuilder sb = new StringBuilder("|");
    for (int i = 0; i < widths.length; i++) {
      String cell = cells.get(i);
      sb.append(' ').append(cell).append(" ".repeat(widths[i] - cell.length())).append(" |");
    }
    return sb.toString();
  }
}
