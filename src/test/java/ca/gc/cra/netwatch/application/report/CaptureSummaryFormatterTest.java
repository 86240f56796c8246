package ca.gc.cra.netwatch.application.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netwatch.domain.net.PacketRecords;
import ca.gc.cra.netwatch.domain.telemetry.TelemetrySnapshot;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CaptureSummaryFormatterTest {

  private static TelemetrySnapshot snapshot(Map<String, Long> apps) {
    Map<String, Long> protocols = new LinkedHashMap<>();
    protocols.put("TCP", 3L);
    protocols.put("UDP", 1L);
    return new TelemetrySnapshot(
        PacketRecords.T0, Duration.ofSeconds(2), 4, 4096, protocols, apps, Map.of(), Map.of(),
        List.of(), List.of(), List.of(), List.of(), 0d, 0d, 0);
  }

  @Test
  void interimShowsRatesAndProtocols() {
    List<String> lines = CaptureSummaryFormatter.interim(snapshot(Map.of()));

    assertTrue(lines.contains("Interim Statistics"));
    assertTrue(lines.contains("Duration: 2s | Packets: 4 (2.0/s)"));
    assertTrue(lines.contains("Total Data: 4.0 KB"));
    assertTrue(lines.contains("   > TCP: 3"));
  }

  @Test
  void finalSummaryIncludesDistributionTable() {
    List<String> lines = CaptureSummaryFormatter.finalSummary(snapshot(Map.of("HTTPS", 2L)));

    assertTrue(lines.contains("Capture Complete - Final Summary"));
    assertTrue(lines.contains("Total Packets: 4 (2.00 packets/second)"));
    assertTrue(lines.contains("Total Data: 4.0 KB (2048.00 bytes/second)"));
    assertTrue(lines.contains("| TCP      | 3       | 75.0%      |"));
    assertTrue(lines.contains("Application Protocols:"));
    assertTrue(lines.contains("| HTTPS       | 2       | 50.0%      |"));
  }

  @Test
  void applicationSectionOmittedWhenEmpty() {
    List<String> lines = CaptureSummaryFormatter.finalSummary(snapshot(Map.of()));

    assertFalse(lines.contains("Application Protocols:"));
  }

  @Test
  void percentOfZeroTotalIsZero() {
    assertEquals("0.0%", CaptureSummaryFormatter.percent(5, 0));
  }
}
