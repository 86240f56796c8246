package ca.gc.cra.netwatch.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(0, Numbers.requireRange("port", 0, 0, 65_535));
    assertEquals(65_535, Numbers.requireRange("port", 65_535, 0, 65_535));
  }

  @Test
  void requireRangeReportsValue() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("snaplen", 10, 64, 262_144));
    assertEquals("snaplen must be between 64 and 262144 (was 10)", ex.getMessage());
  }

  @Test
  void parseIntTrimsAndValidates() {
    assertEquals(443, Numbers.parseInt("port", " 443 ", 0, 65_535));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseInt("port", "https", 0, 65_535));
    assertEquals("port must be an integer between 0 and 65535", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt(null, "99", 0, 10));
  }
}
