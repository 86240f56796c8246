package ca.gc.cra.netwatch.application.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class TextTableTest {

  @Test
  void padsColumnsToWidestCell() {
    List<String> lines = new TextTable(List.of("Name", "N"))
        .addRow(List.of("eth0", "12345"))
        .addRow(Arrays.asList("lo", null))
        .render();

    assertEquals(List.of(
        "+------+-------+",
        "| Name | N     |",
        "+------+-------+",
        "| eth0 | 12345 |",
        "| lo   |       |",
        "+------+-------+"), lines);
  }

  @Test
  void rejectsWideRows() {
    TextTable table = new TextTable(List.of("A"));
    assertThrows(IllegalArgumentException.class, () -> table.addRow(List.of("1", "2")));
    assertThrows(IllegalArgumentException.class, () -> new TextTable(List.of()));
  }
}
