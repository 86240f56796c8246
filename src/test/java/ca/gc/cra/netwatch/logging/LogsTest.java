package ca.gc.cra.netwatch.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesPassThrough() {
    assertEquals("eth0", Logs.truncate("eth0", 32));
    assertEquals("<null>", Logs.truncate(null, 32));
  }

  @Test
  void longValuesKeepWholeCodePoints() {
    assertEquals("hé...(+9)", Logs.truncate("héllo world", 2));
    assertEquals("a😀...(+1)", Logs.truncate("a😀b", 2));
  }

  @Test
  void controlCharactersAreMasked() {
    assertEquals("eth0?INFO fake", Logs.truncate("eth0\nINFO fake", 64));
  }

  @Test
  void maxMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("value", 0));
  }

  @Test
  void hexPreviewShowsLeadingBytes() {
    assertEquals("de ad be ef", Logs.hexPreview(new byte[] {(byte) 0xde, (byte) 0xad, (byte) 0xbe, (byte) 0xef}, 8));
    assertEquals("01 02 ...", Logs.hexPreview(new byte[] {1, 2, 3}, 2));
    assertEquals("", Logs.hexPreview(new byte[0], 8));
  }
}
