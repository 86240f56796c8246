package ca.gc.cra.netwatch.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {" iface=eth0 ", "otelResourceAttributes=a=b", ""});

    assertEquals(List.of("iface", "otelResourceAttributes"), List.copyOf(map.keySet()));
    assertEquals("eth0", map.get("iface"));
    assertEquals("a=b", map.get("otelResourceAttributes"));
  }

  @Test
  void acceptsDashedKeysAndQuotedValues() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"--pcapFile='my trace.pcap'", "count=1", "count=2"});

    assertEquals("my trace.pcap", map.get("pcapFile"));
    assertEquals("2", map.get("count"));
  }

  @Test
  void nullArgumentsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsMalformedArguments() {
    IllegalArgumentException noEquals = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"iface"}));
    assertEquals("argument must be key=value (was 'iface')", noEquals.getMessage());

    IllegalArgumentException noValue = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"iface=\"\""}));
    assertEquals("argument iface needs a value", noValue.getMessage());

    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=eth0"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"if ace=eth0"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"iface=et\u0007h0"}));
  }
}
