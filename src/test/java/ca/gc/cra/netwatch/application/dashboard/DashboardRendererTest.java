package ca.gc.cra.netwatch.application.dashboard;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netwatch.application.port.MetricsPort;
import ca.gc.cra.netwatch.application.port.MutableClock;
import ca.gc.cra.netwatch.application.telemetry.TelemetryAggregator;
import ca.gc.cra.netwatch.domain.net.GeoHint;
import ca.gc.cra.netwatch.domain.net.PacketRecord;
import ca.gc.cra.netwatch.domain.net.PacketRecords;
import ca.gc.cra.netwatch.domain.telemetry.TelemetrySnapshot;
import ca.gc.cra.netwatch.domain.threat.ThreatLevel;
import java.util.List;
import org.junit.jupiter.api.Test;

class DashboardRendererTest {
  private final DashboardViewBuilder builder = new DashboardViewBuilder();
  private final DashboardRenderer renderer = new DashboardRenderer();

  @Test
  void emptyDashboardShowsPlaceholders() {
    List<String> frame = renderer.render(builder.build(TelemetrySnapshot.empty(PacketRecords.T0), List.of()));

    assertEquals(DashboardRenderer.TITLE, frame.get(0));
    assertTrue(frame.contains("   No data available yet..."));
    assertTrue(frame.contains("SECURITY STATUS: SECURE (0 alerts)"));
    assertTrue(frame.contains("   No packets captured yet..."));
    assertTrue(frame.contains("   No connections tracked yet..."));
    assertTrue(frame.contains("   No port activity recorded yet..."));
    assertTrue(frame.contains("   No packet size data available..."));
    assertTrue(frame.contains("   No geographic data available..."));
    assertTrue(frame.contains("   Waiting for network activity..."));
    assertEquals("Press Ctrl+C to stop | Last Updated: 12:00:00 UTC", frame.get(frame.size() - 1));
  }

  @Test
  void populatedDashboardRendersEveryPanel() {
    TelemetryAggregator aggregator = new TelemetryAggregator(new MutableClock(0L), MetricsPort.NO_OP);
    PacketRecord web = PacketRecord.Builder.create(PacketRecords.T0, 1)
        .addresses("192.168.1.2", "93.184.216.34").protocol("TCP").ports(50000, 443)
        .applicationProtocol("HTTPS").size(1200)
        .geo(new GeoHint("United States", "Unknown", null, null)).build();
    PacketRecord risky = PacketRecords.tcp("192.168.1.2", 50001, "10.0.0.9", 445, 60)
        .withThreatLevel(ThreatLevel.HIGH);
    aggregator.ingest(web);
    aggregator.ingest(risky);

    List<String> frame = renderer.render(builder.build(aggregator.snapshot(), List.of(web, risky)));
    String text = String.join("\n", frame);

    assertTrue(text.contains("SECURITY STATUS: THREATS DETECTED (1 alerts)"));
    assertTrue(text.contains("   Safe:1 Low:0 Med:0 High:1 Crit:0"));
    assertTrue(text.contains("[High] 12:00:00 Suspicious TCP traffic from 192.168.1.2 to 10.0.0.9"));
    assertTrue(text.contains("   TCP                 2  100.0%"));
    assertTrue(text.contains("192.168.1.2:50000-93.184.216.34:443"));
    assertTrue(text.contains("   443:1 445:1"));
    assertTrue(text.contains("   United States: 1"));
    assertTrue(text.contains("   [Safe] 12:00:00.0 TCP (HTTPS) 192.168.1.2 -> 93.184.216.34 [United States] 1.2 KB"));
    assertTrue(text.contains("   Avg: 630B Range: 60-1200B Samples: 2"));
  }
}
