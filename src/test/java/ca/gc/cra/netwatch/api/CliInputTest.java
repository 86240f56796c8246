package ca.gc.cra.netwatch.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"iface=eth0", "--Dry-Run", "-h", "--debug", " ", "count=5"});

    assertArrayEquals(new String[] {"iface=eth0", "count=5"}, input.keyValueArgs());
    assertEquals(Set.of("--dry-run", "--help", "--verbose"), input.flags());
    assertTrue(input.help());
    assertTrue(input.verbose());
    assertTrue(input.hasFlag("--DRY-RUN"));
    assertFalse(input.hasFlag("--force"));
    assertFalse(input.hasFlag(null));
  }

  @Test
  void dashedKeyValueStaysPositional() {
    CliInput input = CliInput.parse(new String[] {"--pcapFile=trace.pcap"});

    assertEquals(List.of("--pcapFile=trace.pcap"), input.positional());
    assertTrue(input.flags().isEmpty());
  }

  @Test
  void doubleDashEndsFlags() {
    CliInput input = CliInput.parse(new String[] {"--force", "--", "--help"});

    assertEquals(List.of("--help"), input.positional());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--force"));
  }

  @Test
  void emptyInput() {
    CliInput input = CliInput.parse(null);

    assertArrayEquals(new String[0], input.keyValueArgs());
    assertFalse(input.help());
    assertTrue(input.flags().isEmpty());
  }
}
