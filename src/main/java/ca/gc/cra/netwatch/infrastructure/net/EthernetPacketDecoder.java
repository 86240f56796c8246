package ca.gc.cra.netwatch.infrastructure.net;

import ca.gc.cra.netwatch.application.port.ClockPort;
import ca.gc.cra.netwatch.application.port.PacketDecoder;
import ca.gc.cra.netwatch.domain.net.PacketRecord;
import ca.gc.cra.netwatch.domain.net.RawFrame;
import ca.gc.cra.netwatch.domain.util.Bytes;
import ca.gc.cra.netwatch.logging.Logs;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes Ethernet II frames (with at most one VLAN tag) into {@link PacketRecord}s.
 *
 * <p>IPv4 TCP, UDP and ICMP are decoded down to ports, flags and payload size. IPv6 and other ether types are
 * labelled only. Truncated headers leave the corresponding fields empty; a frame too short for its Ethernet or
 * IPv4 header keeps protocol {@value PacketRecord#UNKNOWN_PROTOCOL}. Decoding never throws.</p>
 */
public final class EthernetPacketDecoder implements PacketDecoder {
  private static final Logger log = LoggerFactory.getLogger(EthernetPacketDecoder.class);
  private static final int ETHERNET_HEADER = 14;
  private static final int ETHERTYPE_IPV4 = 0x0800;
  private static final int ETHERTYPE_IPV6 = 0x86DD;
  private static final int ETHERTYPE_ARP = 0x0806;
  private static final int ETHERTYPE_VLAN = 0x8100;
  private static final int ETHERTYPE_QINQ = 0x88A8;
  private static final int PROTO_ICMP = 1;
  private static final int PROTO_TCP = 6;
  private static final int PROTO_UDP = 17;
  private static final String[] TCP_FLAG_NAMES = {"FIN", "SYN", "RST", "PSH", "ACK", "URG"};
  private static final Map<Integer, String> IP_PROTOCOL_NAMES = Map.of(
      2, "IGMP",
      4, "IPIP",
      41, "IPv6",
      47, "GRE",
      50, "ESP",
      51, "AH",
      89, "OSPF",
      103, "PIM",
      112, "VRRP",
      132, "SCTP");

  private final ClockPort clock;
  private final PlaceholderGeoLocator geoLocator;

  /**
   * Creates a decoder.
   *
   * @param clock fallback time source when a frame carries no capture timestamp
   * @param geoLocator destination location lookup
   */
  public EthernetPacketDecoder(ClockPort clock, PlaceholderGeoLocator geoLocator) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.geoLocator = Objects.requireNonNull(geoLocator, "geoLocator");
  }

  @Override
  public PacketRecord decode(RawFrame frame, long sequence) {
    Objects.requireNonNull(frame, "frame");
    byte[] pkt = frame.data();
    PacketRecord.Builder builder =
        PacketRecord.Builder.create(timestampOf(frame), sequence).size(pkt.length);
    if (pkt.length < ETHERNET_HEADER) {
      log.debug("Frame #{} shorter than an Ethernet header: {}", sequence, Logs.hexPreview(pkt, ETHERNET_HEADER));
      return builder.build();
    }
    builder.macs(Bytes.mac(pkt, 6), Bytes.mac(pkt, 0));

    int etherType = Bytes.u16be(pkt, 12);
    int offset = ETHERNET_HEADER;
    if (etherType == ETHERTYPE_VLAN || etherType == ETHERTYPE_QINQ) {
      if (pkt.length < offset + 4) {
        return builder.protocol(String.format("0x%04x", etherType)).build();
      }
      etherType = Bytes.u16be(pkt, offset + 2);
      offset += 4;
    }

    switch (etherType) {
      case ETHERTYPE_IPV4 -> decodeIpv4(pkt, offset, builder);
      case ETHERTYPE_IPV6 -> builder.protocol("IPv6").description(PacketDescriptions.IPV6);
      case ETHERTYPE_ARP -> builder.protocol("ARP");
      default -> builder.protocol(String.format("0x%04x", etherType));
    }
    return builder.geo(geoLocator.locate(builder.dstIp())).build();
  }

  private Instant timestampOf(RawFrame frame) {
    long micros = frame.timestampMicros();
    if (micros <= 0) {
      return clock.now();
    }
    return Instant.ofEpochSecond(Math.floorDiv(micros, 1_000_000L), Math.floorMod(micros, 1_000_000L) * 1_000L);
  }

  private static void decodeIpv4(byte[] pkt, int offset, PacketRecord.Builder builder) {
    int caplen = pkt.length;
    if (caplen < offset + 20) {
      return;
    }
    int vihl = Bytes.u8(pkt, offset);
    if ((vihl >>> 4) != 4) {
      return;
    }
    int ihl = Math.max(20, (vihl & 0x0F) * 4);
    if (caplen < offset + ihl) {
      return;
    }
    builder.addresses(ipv4(pkt, offset + 12), ipv4(pkt, offset + 16));

    int proto = Bytes.u8(pkt, offset + 9);
    int totalLen = Bytes.u16be(pkt, offset + 2);
    int transportOffset = offset + ihl;
    int ipPayload = Math.max(0, Math.min(totalLen - ihl, caplen - transportOffset));

    switch (proto) {
      case PROTO_TCP -> decodeTcp(pkt, transportOffset, ipPayload, builder.protocol("TCP"));
      case PROTO_UDP -> decodeUdp(pkt, transportOffset, ipPayload, builder.protocol("UDP"));
      case PROTO_ICMP -> {
        builder.protocol("ICMP");
        if (ipPayload >= 4) {
          builder.description(PacketDescriptions.ICMP);
        }
      }
      default -> builder.protocol("IPv4-" + IP_PROTOCOL_NAMES.getOrDefault(proto, Integer.toString(proto)));
    }
  }

  private static void decodeTcp(byte[] pkt, int offset, int ipPayload, PacketRecord.Builder builder) {
    if (ipPayload < 20) {
      return;
    }
    int srcPort = Bytes.u16be(pkt, offset);
    int dstPort = Bytes.u16be(pkt, offset + 2);
    int dataOffset = Math.max(20, (Bytes.u8(pkt, offset + 12) >>> 4) * 4);
    int payloadLength = Math.max(0, ipPayload - dataOffset);
    builder.ports(srcPort, dstPort).payloadSize(payloadLength).flags(tcpFlags(Bytes.u8(pkt, offset + 13)));
    describeTransport(pkt, offset + dataOffset, payloadLength, builder);
  }

  private static void decodeUdp(byte[] pkt, int offset, int ipPayload, PacketRecord.Builder builder) {
    if (ipPayload < 8) {
      return;
    }
    int payloadLength = ipPayload - 8;
    builder.ports(Bytes.u16be(pkt, offset), Bytes.u16be(pkt, offset + 2)).payloadSize(payloadLength);
    describeTransport(pkt, offset + 8, payloadLength, builder);
  }

  private static void describeTransport(
      byte[] pkt, int payloadOffset, int payloadLength, PacketRecord.Builder builder) {
    String app = ApplicationProtocols.detect(builder.dstPort(), pkt, payloadOffset, payloadLength);
    builder.applicationProtocol(app)
        .description(PacketDescriptions.describe(builder.protocol(), app, builder.srcPort(), builder.dstPort()));
  }

  static String tcpFlags(int flags) {
    StringJoiner joiner = new StringJoiner(" ");
    for (int bit = 0; bit < TCP_FLAG_NAMES.length; bit++) {
      if ((flags & (1 << bit)) != 0) {
        joiner.add(TCP_FLAG_NAMES[bit]);
      }
    }
    return joiner.toString();
  }

  private static String ipv4(byte[] p, int off) {
    return Bytes.u8(p, off)
        + "." + Bytes.u8(p, off + 1)
        + "." + Bytes.u8(p, off + 2)
        + "." + Bytes.u8(p, off + 3);
  }
}
