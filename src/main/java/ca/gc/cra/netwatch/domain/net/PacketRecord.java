package ca.gc.cra.netwatch.domain.net;

import ca.gc.cra.netwatch.domain.threat.ThreatLevel;
import java.time.Instant;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Normalized, immutable view of one captured frame.
 * <p><strong>Why:</strong> Decouples telemetry, threat scoring, rendering and export from raw frame bytes.</p>
 * <p><strong>Role:</strong> Domain value produced by the decoder and classifier; owned afterwards by whichever
 * buffer holds it.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share between the ingestion and render paths.</p>
 *
 * <p>Optional fields are {@code null} when the frame did not carry them (non-IP frames have no addresses,
 * non-TCP frames have no flags, and so on).</p>
 *
 * @param timestamp capture time
 * @param sequence 1-based number of the accepted packet within the capture
 * @param srcMac source MAC address, empty when the frame was too short
 * @param dstMac destination MAC address, empty when the frame was too short
 * @param srcIp source IP address or {@code null}
 * @param dstIp destination IP address or {@code null}
 * @param protocol transport or network protocol name, e.g. {@code "TCP"}
 * @param srcPort source port or {@code null}
 * @param dstPort destination port or {@code null}
 * @param size total captured frame size in bytes
 * @param payloadSize transport payload size in bytes
 * @param flags TCP flag summary such as {@code "SYN ACK"} or {@code null}
 * @param applicationProtocol inferred application protocol or {@code null}
 * @param description human-readable summary
 * @param threatLevel classifier verdict
 * @param geo placeholder location of the destination or {@code null}
 * @since 0.1.0
 */
public record PacketRecord(
    Instant timestamp,
    long sequence,
    String srcMac,
    String dstMac,
    String srcIp,
    String dstIp,
    String protocol,
    Integer srcPort,
    Integer dstPort,
    int size,
    int payloadSize,
    String flags,
    String applicationProtocol,
    String description,
    ThreatLevel threatLevel,
    GeoHint geo) {

  /** Protocol label used when the frame could not be parsed. */
  public static final String UNKNOWN_PROTOCOL = "Unknown";

  public PacketRecord {
    Objects.requireNonNull(timestamp, "timestamp");
    if (sequence < 0) {
      throw new IllegalArgumentException("sequence must be >= 0 (was " + sequence + ')');
    }
    if (size < 0 || payloadSize < 0) {
      throw new IllegalArgumentException("sizes must be >= 0");
    }
    requirePort("srcPort", srcPort);
    requirePort("dstPort", dstPort);
    srcMac = Objects.requireNonNullElse(srcMac, "");
    dstMac = Objects.requireNonNullElse(dstMac, "");
    protocol = protocol == null || protocol.isBlank() ? UNKNOWN_PROTOCOL : protocol;
    description = Objects.requireNonNullElse(description, "Unknown packet");
    threatLevel = Objects.requireNonNullElse(threatLevel, ThreatLevel.SAFE);
  }

  /**
   * Returns the port used for port-based heuristics: destination when present, otherwise source.
   *
   * @return preferred port, empty when the record carries no ports
   */
  public OptionalInt preferredPort() {
    if (dstPort != null) {
      return OptionalInt.of(dstPort);
    }
    return srcPort != null ? OptionalInt.of(srcPort) : OptionalInt.empty();
  }

  /**
   * Indicates whether both network addresses were decoded.
   *
   * @return {@code true} when source and destination IP are present
   */
  public boolean hasAddresses() {
    return srcIp != null && dstIp != null;
  }

  /**
   * Tests whether either port equals {@code port}.
   *
   * @param port port to look for
   * @return {@code true} on a source or destination match
   */
  public boolean usesPort(int port) {
    return (srcPort != null && srcPort == port) || (dstPort != null && dstPort == port);
  }

  /**
   * Returns a copy carrying the supplied threat level.
   *
   * @param level classifier verdict
   * @return new record; {@code this} when the level is unchanged
   */
  public PacketRecord withThreatLevel(ThreatLevel level) {
    if (level == threatLevel) {
      return this;
    }
    return new PacketRecord(
        timestamp, sequence, srcMac, dstMac, srcIp, dstIp, protocol, srcPort, dstPort, size,
        payloadSize, flags, applicationProtocol, description, level, geo);
  }

  private static void requirePort(String name, Integer port) {
    if (port != null && (port < 0 || port > 65_535)) {
      throw new IllegalArgumentException(name + " must be between 0 and 65535 (was " + port + ')');
    }
  }

  /** Builder for {@link PacketRecord}; used by decoders and tests. */
  public static final class Builder {
    private final Instant timestamp;
    private final long sequence;
    private String srcMac = "";
    private String dstMac = "";
    private String srcIp;
    private String dstIp;
    private String protocol = UNKNOWN_PROTOCOL;
    private Integer srcPort;
    private Integer dstPort;
    private int size;
    private int payloadSize;
    private String flags;
    private String applicationProtocol;
    private String description = "Unknown packet";
    private ThreatLevel threatLevel = ThreatLevel.SAFE;
    private GeoHint geo;

    private Builder(Instant timestamp, long sequence) {
      this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
      this.sequence = sequence;
    }

    /**
     * Creates a builder.
     *
     * @param timestamp capture time
     * @param sequence accepted-packet number
     * @return builder instance
     */
    public static Builder create(Instant timestamp, long sequence) {
      return new Builder(timestamp, sequence);
    }

    public Builder macs(String src, String dst) {
      this.srcMac = src;
      this.dstMac = dst;
      return this;
    }

    public Builder addresses(String src, String dst) {
      this.srcIp = src;
      this.dstIp = dst;
      return this;
    }

    public Builder protocol(String protocol) {
      this.protocol = protocol;
      return this;
    }

    public Builder ports(Integer src, Integer dst) {
      this.srcPort = src;
      this.dstPort = dst;
      return this;
    }

    public Builder size(int size) {
      this.size = size;
      return this;
    }

    public Builder payloadSize(int payloadSize) {
      this.payloadSize = payloadSize;
      return this;
    }

    public Builder flags(String flags) {
      this.flags = flags;
      return this;
    }

    public Builder applicationProtocol(String applicationProtocol) {
      this.applicationProtocol = applicationProtocol;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder threatLevel(ThreatLevel threatLevel) {
      this.threatLevel = threatLevel;
      return this;
    }

    public Builder geo(GeoHint geo) {
      this.geo = geo;
      return this;
    }

    /** Returns the protocol set so far. */
    public String protocol() {
      return protocol;
    }

    /** Returns the source port set so far. */
    public Integer srcPort() {
      return srcPort;
    }

    /** Returns the destination port set so far. */
    public Integer dstPort() {
      return dstPort;
    }

    /** Returns the application protocol set so far. */
    public String applicationProtocol() {
      return applicationProtocol;
    }

    /** Returns the destination IP set so far. */
    public String dstIp() {
      return dstIp;
    }

    /**
     * Builds the immutable record.
     *
     * @return packet record
     */
    public PacketRecord build() {
      return new PacketRecord(
          timestamp, sequence, srcMac, dstMac, srcIp, dstIp, protocol, srcPort, dstPort, size,
          payloadSize, flags, applicationProtocol, description, threatLevel, geo);
    }
  }
}
