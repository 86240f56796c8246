package ca.gc.cra.netwatch.infrastructure.capture;

import ca.gc.cra.netwatch.application.port.PacketSource;
import ca.gc.cra.netwatch.domain.net.RawFrame;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PacketSource} reading a live interface or a capture file through pcap4j.
 *
 * <p>Live polls return empty when the read timeout elapses. A replayed file reports exhaustion at its end and
 * releases the handle straight away.</p>
 */
public final class Pcap4jPacketSource implements PacketSource {
  private static final Logger log = LoggerFactory.getLogger(Pcap4jPacketSource.class);
  private static final String SCOPE = "ca.gc.cra.netwatch.capture";
  private static final AttributeKey<String> SOURCE = AttributeKey.stringKey("netwatch.source");
  private static final AttributeKey<String> FAILURE = AttributeKey.stringKey("netwatch.failure");

  private final String label;
  private final boolean replay;
  private final CaptureHandle.Opener opener;
  private final Instruments instruments;

  private CaptureHandle handle;
  private long frames;
  private boolean exhausted;

  Pcap4jPacketSource(String label, boolean replay, CaptureHandle.Opener opener, OpenTelemetry otel) {
    this.label = Objects.requireNonNull(label, "label");
    this.replay = replay;
    this.opener = Objects.requireNonNull(opener, "opener");
    this.instruments = new Instruments(otel, label);
  }

  /**
   * Source sniffing a network interface.
   *
   * @param iface interface name
   * @param snaplen bytes kept per frame
   * @param promiscuous whether to request promiscuous mode
   * @param timeoutMillis read timeout in milliseconds
   * @return unopened source
   */
  public static Pcap4jPacketSource live(String iface, int snaplen, boolean promiscuous, int timeoutMillis) {
    Objects.requireNonNull(iface, "iface");
    Pcap4jCaptureHandle.LiveSettings settings =
        new Pcap4jCaptureHandle.LiveSettings(iface, snaplen, promiscuous, timeoutMillis);
    return new Pcap4jPacketSource(iface, false, Pcap4jCaptureHandle.live(settings), GlobalOpenTelemetry.get());
  }

  /**
   * Source replaying a capture file.
   *
   * @param pcapFile capture file
   * @return unopened source
   */
  public static Pcap4jPacketSource replay(Path pcapFile) {
    Path file = Objects.requireNonNull(pcapFile, "pcapFile").toAbsolutePath().normalize();
    return new Pcap4jPacketSource(file.toString(), true, Pcap4jCaptureHandle.offline(file), GlobalOpenTelemetry.get());
  }

  /**
   * Opens the handle. Calling it again while open has no effect.
   *
   * @throws IllegalArgumentException if the interface or file does not exist
   * @throws IOException if libpcap refuses the device or file
   */
  @Override
  public void start() throws IOException {
    if (handle != null) {
      return;
    }
    Span span = instruments.tracer.spanBuilder("netwatch.capture.open")
        .setAttribute(SOURCE, label)
        .setAttribute("netwatch.replay", replay)
        .startSpan();
    try {
      handle = opener.open();
      frames = 0L;
      exhausted = false;
      log.info("Capture opened on {} ({}, link type {})", label, replay ? "file" : "live", handle.linkType());
    } catch (IOException | RuntimeException ex) {
      instruments.fail("open");
      span.recordException(ex);
      span.setStatus(StatusCode.ERROR);
      throw ex;
    } finally {
      span.end();
    }
  }

  @Override
  public Optional<RawFrame> poll() throws IOException {
    if (handle == null) {
      return Optional.empty();
    }
    long waitStart = System.nanoTime();
    byte[] data;
    try {
      data = handle.nextFrame();
    } catch (IOException | RuntimeException ex) {
      instruments.fail("read");
      throw ex;
    }
    instruments.waitNanos.record(System.nanoTime() - waitStart, instruments.source);
    if (data == null) {
      if (replay) {
        exhausted = true;
        close();
      }
      return Optional.empty();
    }
    frames++;
    instruments.frames.add(1, instruments.source);
    instruments.bytes.add(data.length, instruments.source);
    return Optional.of(new RawFrame(data, handle.lastTimestampMicros()));
  }

  @Override
  public boolean isExhausted() {
    return exhausted;
  }

  @Override
  public void close() {
    CaptureHandle open = handle;
    if (open == null) {
      return;
    }
    handle = null;
    open.close();
    log.info("Capture closed on {} after {} frames", label, frames);
  }

  private static final class Instruments {
    private final Tracer tracer;
    private final Attributes source;
    private final LongCounter frames;
    private final LongCounter bytes;
    private final LongCounter failures;
    private final LongHistogram waitNanos;

    private Instruments(OpenTelemetry otel, String label) {
      Meter meter = otel.getMeter(SCOPE);
      this.tracer = otel.getTracer(SCOPE);
      this.source = Attributes.of(SOURCE, label);
      this.frames = meter.counterBuilder("netwatch.capture.frames")
          .setDescription("Frames handed to the decoder")
          .build();
      this.bytes = meter.counterBuilder("netwatch.capture.bytes")
          .setUnit("By")
          .setDescription("Captured bytes handed to the decoder")
          .build();
      this.failures = meter.counterBuilder("netwatch.capture.failures")
          .setDescription("Open and read failures on the capture handle")
          .build();
      this.waitNanos = meter.histogramBuilder("netwatch.capture.wait")
          .ofLongs()
          .setUnit("ns")
          .setDescription("Time blocked waiting for the next frame")
          .build();
    }

    private void fail(String stage) {
      failures.add(1, source.toBuilder().put(FAILURE, stage).build());
    }
  }
}
