package ca.gc.cra.netwatch.infrastructure.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import ca.gc.cra.netwatch.application.port.ClockPort;
import ca.gc.cra.netwatch.domain.net.PacketRecord;
import ca.gc.cra.netwatch.domain.net.RawFrame;
import ca.gc.cra.netwatch.domain.threat.ThreatLevel;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class EthernetPacketDecoderTest {
  private static final long NOW = 1_700_000_000_123L;
  private final EthernetPacketDecoder decoder =
      new EthernetPacketDecoder(() -> NOW, new PlaceholderGeoLocator());

  @Test
  void decodesTcpHttpRequest() {
    byte[] payload = "GET / HTTP/1.1\r\nHost: example\r\n\r\n".getBytes(StandardCharsets.US_ASCII);
    byte[] frame = ethernet(0x0800, ipv4(6, new int[] {192, 168, 1, 10}, new int[] {8, 8, 8, 8},
        tcp(51000, 80, 0x18, payload)));

    PacketRecord record = decoder.decode(new RawFrame(frame, 1_700_000_000_000_500L), 9);

    assertEquals(9, record.sequence());
    assertEquals(Instant.ofEpochSecond(1_700_000_000L, 500_000L), record.timestamp());
    assertEquals("00:11:22:33:44:55", record.srcMac());
    assertEquals("66:77:88:99:aa:bb", record.dstMac());
    assertEquals("192.168.1.10", record.srcIp());
    assertEquals("8.8.8.8", record.dstIp());
    assertEquals("TCP", record.protocol());
    assertEquals(51000, record.srcPort());
    assertEquals(80, record.dstPort());
    assertEquals("PSH ACK", record.flags());
    assertEquals(payload.length, record.payloadSize());
    assertEquals(frame.length, record.size());
    assertEquals("HTTP", record.applicationProtocol());
    assertEquals("Web browsing (HTTP request/response)", record.description());
    assertEquals("United States", record.geo().country());
    assertEquals(ThreatLevel.SAFE, record.threatLevel());
  }

  @Test
  void port80WithoutHttpPayloadIsWebTraffic() {
    byte[] frame = ethernet(0x0800, ipv4(6, new int[] {10, 0, 0, 1}, new int[] {10, 0, 0, 2},
        tcp(40000, 80, 0x02, new byte[0])));

    PacketRecord record = decoder.decode(new RawFrame(frame, 0L), 1);

    assertEquals("Web Traffic", record.applicationProtocol());
    assertEquals("SYN", record.flags());
    assertEquals(Instant.ofEpochMilli(NOW), record.timestamp());
    assertEquals(PlaceholderGeoLocator.LOCAL, record.geo());
  }

  @Test
  void decodesUdpDnsQuery() {
    byte[] frame = ethernet(0x0800, ipv4(17, new int[] {192, 168, 1, 10}, new int[] {1, 1, 1, 1},
        udp(53000, 53, new byte[12])));

    PacketRecord record = decoder.decode(new RawFrame(frame, 0L), 1);

    assertEquals("UDP", record.protocol());
    assertEquals(53, record.dstPort());
    assertEquals(12, record.payloadSize());
    assertEquals("DNS", record.applicationProtocol());
    assertEquals("Domain name lookup", record.description());
    assertEquals("Australia", record.geo().country());
    assertNull(record.flags());
  }

  @Test
  void udpWithoutKnownServiceDescribesPorts() {
    byte[] frame = ethernet(0x0800, ipv4(17, new int[] {10, 1, 1, 1}, new int[] {10, 1, 1, 2},
        udp(5000, 6000, new byte[4])));

    PacketRecord record = decoder.decode(new RawFrame(frame, 0L), 1);

    assertNull(record.applicationProtocol());
    assertEquals("UDP communication from port 5000 to port 6000", record.description());
  }

  @Test
  void decodesIcmpEcho() {
    byte[] frame = ethernet(0x0800, ipv4(1, new int[] {10, 1, 1, 1}, new int[] {10, 1, 1, 2},
        new byte[] {8, 0, 0, 0, 0, 1, 0, 1}));

    PacketRecord record = decoder.decode(new RawFrame(frame, 0L), 1);

    assertEquals("ICMP", record.protocol());
    assertEquals("ICMP ping/echo message", record.description());
    assertNull(record.srcPort());
  }

  @Test
  void vlanTaggedFrameIsUnwrapped() {
    byte[] inner = ipv4(6, new int[] {10, 1, 1, 1}, new int[] {10, 1, 1, 2}, tcp(1234, 443, 0x10, new byte[0]));
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(macs());
    out.writeBytes(new byte[] {(byte) 0x81, 0x00, 0x00, 0x64, 0x08, 0x00});
    out.writeBytes(inner);

    PacketRecord record = decoder.decode(new RawFrame(out.toByteArray(), 0L), 1);

    assertEquals("TCP", record.protocol());
    assertEquals("HTTPS", record.applicationProtocol());
  }

  @Test
  void nonIpFramesKeepEtherTypeLabels() {
    PacketRecord arp = decoder.decode(new RawFrame(ethernet(0x0806, new byte[28]), 0L), 1);
    PacketRecord ipv6 = decoder.decode(new RawFrame(ethernet(0x86DD, new byte[40]), 0L), 1);
    PacketRecord lldp = decoder.decode(new RawFrame(ethernet(0x88CC, new byte[10]), 0L), 1);

    assertEquals("ARP", arp.protocol());
    assertNull(arp.srcIp());
    assertNull(arp.geo());
    assertEquals("IPv6", ipv6.protocol());
    assertEquals("0x88cc", lldp.protocol());
  }

  @Test
  void otherIpProtocolsAreNamed() {
    byte[] frame = ethernet(0x0800, ipv4(47, new int[] {10, 1, 1, 1}, new int[] {10, 1, 1, 2}, new byte[8]));

    assertEquals("IPv4-GRE", decoder.decode(new RawFrame(frame, 0L), 1).protocol());
  }

  @Test
  void truncatedFramesNeverThrow() {
    PacketRecord tiny = decoder.decode(new RawFrame(new byte[] {1, 2, 3}, 0L), 1);
    byte[] cut = ethernet(0x0800, new byte[] {0x45, 0, 0, 40});

    PacketRecord truncated = decoder.decode(new RawFrame(cut, 0L), 2);

    assertEquals(PacketRecord.UNKNOWN_PROTOCOL, tiny.protocol());
    assertEquals(3, tiny.size());
    assertEquals("", tiny.srcMac());
    assertNull(truncated.srcIp());
    assertEquals(PacketRecord.UNKNOWN_PROTOCOL, truncated.protocol());
  }

  @Test
  void truncatedVlanTagIsLabelledByTagType() {
    byte[] cut = ethernet(0x8100, new byte[] {0, 1});

    assertEquals("0x8100", decoder.decode(new RawFrame(cut, 0L), 1).protocol());
  }

  @Test
  void tcpFlagNames() {
    assertEquals("FIN SYN RST PSH ACK URG", EthernetPacketDecoder.tcpFlags(0x3F));
    assertEquals("", EthernetPacketDecoder.tcpFlags(0));
  }

  @Test
  void usesClockWhenFrameHasNoTimestamp() {
    ClockPort fixed = () -> 42_000L;
    EthernetPacketDecoder local = new EthernetPacketDecoder(fixed, new PlaceholderGeoLocator());

    assertEquals(Instant.ofEpochMilli(42_000L), local.decode(new RawFrame(new byte[0], 0L), 1).timestamp());
  }

  private static byte[] macs() {
    return new byte[] {
      0x66, 0x77, (byte) 0x88, (byte) 0x99, (byte) 0xaa, (byte) 0xbb,
      0x00, 0x11, 0x22, 0x33, 0x44, 0x55
    };
  }

  private static byte[] ethernet(int etherType, byte[] body) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(macs());
    out.write(etherType >>> 8);
    out.write(etherType & 0xFF);
    out.writeBytes(body);
    return out.toByteArray();
  }

  private static byte[] ipv4(int protocol, int[] src, int[] dst, byte[] body) {
    int total = 20 + body.length;
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(new byte[] {0x45, 0, (byte) (total >>> 8), (byte) total, 0, 1, 0, 0, 64, (byte) protocol, 0, 0});
    for (int octet : src) {
      out.write(octet);
    }
    for (int octet : dst) {
      out.write(octet);
    }
    out.writeBytes(body);
    return out.toByteArray();
  }

  private static byte[] tcp(int srcPort, int dstPort, int flags, byte[] payload) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(new byte[] {
      (byte) (srcPort >>> 8), (byte) srcPort, (byte) (dstPort >>> 8), (byte) dstPort,
      0, 0, 0, 1, 0, 0, 0, 0, 0x50, (byte) flags, 0x10, 0, 0, 0, 0, 0
    });
    out.writeBytes(payload);
    return out.toByteArray();
  }

  private static byte[] udp(int srcPort, int dstPort, byte[] payload) {
    int length = 8 + payload.length;
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(new byte[] {
      (byte) (srcPort >>> 8), (byte) srcPort, (byte) (dstPort >>> 8), (byte) dstPort,
      (byte) (length >>> 8), (byte) length, 0, 0
    });
    out.writeBytes(payload);
    return out.toByteArray();
  }
}
