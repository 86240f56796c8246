package ca.gc.cra.netwatch.application.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netwatch.domain.net.PacketRecord;
import ca.gc.cra.netwatch.domain.net.PacketRecords;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CaptureFilterTest {
  private final PacketRecord http = PacketRecords.tcp("10.1.1.1", 50000, "10.1.1.2", 8080, 300);
  private final PacketRecord dns = PacketRecords.udp("10.1.1.1", 53000, "10.1.1.53", 53, 80);
  private final PacketRecord ping = PacketRecords.icmp("10.1.1.1", "8.8.8.8", 98);

  @Test
  void protocolFiltersMatchByProtocolAndPort() {
    assertTrue(ProtocolFilter.TCP.accepts(http));
    assertTrue(ProtocolFilter.HTTP.accepts(http));
    assertFalse(ProtocolFilter.HTTP.accepts(PacketRecords.tcp("10.1.1.1", 50000, "10.1.1.2", 443, 300)));
    assertTrue(ProtocolFilter.DNS.accepts(dns));
    assertFalse(ProtocolFilter.DNS.accepts(PacketRecords.tcp("10.1.1.1", 50000, "10.1.1.2", 53, 300)));
    assertTrue(ProtocolFilter.ICMP.accepts(ping));
    assertFalse(ProtocolFilter.UDP.accepts(ping));
  }

  @Test
  void lookupIsCaseInsensitiveAndBlankMeansAny() {
    assertEquals(Optional.of(ProtocolFilter.DNS), ProtocolFilter.lookup(" Dns "));
    assertEquals(Optional.of(ProtocolFilter.ANY), ProtocolFilter.lookup(""));
    assertTrue(ProtocolFilter.lookup("sctp").isEmpty());
    assertTrue(ProtocolFilter.lookup("any").isEmpty());
    assertEquals(ProtocolFilter.ANY, ProtocolFilter.parse("sctp"));
    assertFalse(ProtocolFilter.isRecognized("sctp"));
  }

  @Test
  void protocolAndPortCombineWithAnd() {
    CaptureFilter filter = new CaptureFilter(ProtocolFilter.UDP, 53);

    assertTrue(filter.accepts(dns));
    assertFalse(filter.accepts(PacketRecords.udp("10.1.1.1", 5000, "10.1.1.2", 123, 90)));
    assertFalse(filter.accepts(PacketRecords.tcp("10.1.1.1", 5000, "10.1.1.2", 53, 90)));
  }

  @Test
  void portFilterMatchesEitherEndpointOfTransportTraffic() {
    CaptureFilter filter = new CaptureFilter(ProtocolFilter.ANY, 50000);

    assertTrue(filter.accepts(http));
    assertFalse(filter.accepts(ping));
  }

  @Test
  void recordsWithoutAddressesAreDropped() {
    assertFalse(CaptureFilter.ACCEPT_ALL.accepts(PacketRecords.arp(60)));
    assertTrue(CaptureFilter.ACCEPT_ALL.accepts(ping));
  }

  @Test
  void undecodableFramesAreKeptWhateverTheSelection() {
    PacketRecord truncated = PacketRecord.Builder.create(PacketRecords.T0, 1).size(18).build();

    assertTrue(CaptureFilter.ACCEPT_ALL.accepts(truncated));
    assertTrue(new CaptureFilter(ProtocolFilter.DNS, 53).accepts(truncated));
  }

  @Test
  void describeAndValidation() {
    assertEquals("protocol=tcp port=443", new CaptureFilter(ProtocolFilter.TCP, 443).describe());
    assertEquals("protocol=any", CaptureFilter.ACCEPT_ALL.describe());
    assertThrows(IllegalArgumentException.class, () -> new CaptureFilter(ProtocolFilter.ANY, 70_000));
  }
}
