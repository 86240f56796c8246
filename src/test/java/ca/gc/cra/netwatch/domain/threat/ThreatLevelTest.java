package ca.gc.cra.netwatch.domain.threat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ThreatLevelTest {

  @Test
  void scoreThresholds() {
    assertEquals(ThreatLevel.SAFE, ThreatLevel.fromScore(0));
    assertEquals(ThreatLevel.SAFE, ThreatLevel.fromScore(1));
    assertEquals(ThreatLevel.LOW, ThreatLevel.fromScore(2));
    assertEquals(ThreatLevel.LOW, ThreatLevel.fromScore(3));
    assertEquals(ThreatLevel.MEDIUM, ThreatLevel.fromScore(5));
    assertEquals(ThreatLevel.HIGH, ThreatLevel.fromScore(6));
    assertEquals(ThreatLevel.HIGH, ThreatLevel.fromScore(7));
    assertEquals(ThreatLevel.CRITICAL, ThreatLevel.fromScore(8));
    assertEquals(ThreatLevel.CRITICAL, ThreatLevel.fromScore(40));
  }

  @Test
  void maxPrefersHigherAndToleratesNull() {
    assertEquals(ThreatLevel.HIGH, ThreatLevel.max(ThreatLevel.LOW, ThreatLevel.HIGH));
    assertEquals(ThreatLevel.MEDIUM, ThreatLevel.max(ThreatLevel.MEDIUM, null));
    assertEquals(ThreatLevel.SAFE, ThreatLevel.max(null, null));
  }

  @Test
  void labelsRoundTrip() {
    assertEquals("Critical", ThreatLevel.CRITICAL.label());
    assertEquals(ThreatLevel.MEDIUM, ThreatLevel.fromLabel(" medium "));
    assertThrows(IllegalArgumentException.class, () -> ThreatLevel.fromLabel("severe"));
  }

  @Test
  void onlySafeDoesNotAlert() {
    assertFalse(ThreatLevel.SAFE.isAlerting());
    assertTrue(ThreatLevel.LOW.isAlerting());
  }
}
