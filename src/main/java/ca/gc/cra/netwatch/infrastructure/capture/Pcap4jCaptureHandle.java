package ca.gc.cra.netwatch.infrastructure.capture;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Timestamp;
import org.pcap4j.core.NotOpenException;
import org.pcap4j.core.PcapHandle;
import org.pcap4j.core.PcapNativeException;
import org.pcap4j.core.PcapNetworkInterface.PromiscuousMode;
import org.pcap4j.core.Pcaps;

/**
 * {@link CaptureHandle} over a pcap4j {@link PcapHandle}. Frames are read raw; decoding happens in the
 * NETWATCH decoder, not in pcap4j's packet factory.
 */
final class Pcap4jCaptureHandle implements CaptureHandle {
  private final PcapHandle handle;

  private Pcap4jCaptureHandle(PcapHandle handle) {
    this.handle = handle;
  }

  static CaptureHandle.Opener live(LiveSettings settings) {
    return () -> {
      try {
        if (Pcaps.getDevByName(settings.iface()) == null) {
          throw new IllegalArgumentException("Interface not found: " + settings.iface());
        }
        PcapHandle opened = new PcapHandle.Builder(settings.iface())
            .snaplen(settings.snaplen())
            .promiscuousMode(settings.promiscuous() ? PromiscuousMode.PROMISCUOUS : PromiscuousMode.NONPROMISCUOUS)
            .timeoutMillis(settings.timeoutMillis())
            .build();
        return new Pcap4jCaptureHandle(opened);
      } catch (PcapNativeException ex) {
        throw new IOException("Failed to open interface " + settings.iface() + ": " + ex.getMessage(), ex);
      }
    };
  }

  static CaptureHandle.Opener offline(Path file) {
    return () -> {
      if (!Files.isRegularFile(file)) {
        throw new IllegalArgumentException("pcapFile must reference an existing file: " + file);
      }
      if (!Files.isReadable(file)) {
        throw new IOException("pcapFile is not readable: " + file);
      }
      try {
        return new Pcap4jCaptureHandle(Pcaps.openOffline(file.toString()));
      } catch (PcapNativeException ex) {
        throw new IOException("Failed to open capture file " + file + ": " + ex.getMessage(), ex);
      }
    };
  }

  @Override
  public byte[] nextFrame() throws IOException {
    try {
      return handle.getNextRawPacket();
    } catch (NotOpenException ex) {
      throw new IOException("Capture handle is closed", ex);
    }
  }

  @Override
  public long lastTimestampMicros() {
    return toMicros(handle.getTimestamp());
  }

  @Override
  public String linkType() {
    return String.valueOf(handle.getDlt());
  }

  @Override
  public void close() {
    handle.close();
  }

  static long toMicros(Timestamp ts) {
    if (ts == null) {
      return 0L;
    }
    return Math.floorDiv(ts.getTime(), 1_000L) * 1_000_000L + ts.getNanos() / 1_000L;
  }

  /**
   * Live capture parameters.
   *
   * @param iface interface name
   * @param snaplen bytes kept per frame
   * @param promiscuous whether to request promiscuous mode
   * @param timeoutMillis read timeout; negative values are clamped to zero
   */
  record LiveSettings(String iface, int snaplen, boolean promiscuous, int timeoutMillis) {
    LiveSettings {
      timeoutMillis = Math.max(0, timeoutMillis);
    }
  }
}
