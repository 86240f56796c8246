package ca.gc.cra.netwatch.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netwatch.application.filter.CaptureFilter;
import ca.gc.cra.netwatch.application.filter.ProtocolFilter;
import ca.gc.cra.netwatch.application.pipeline.CaptureOutcome.StopReason;
import ca.gc.cra.netwatch.application.port.MutableClock;
import ca.gc.cra.netwatch.application.port.PacketDecoder;
import ca.gc.cra.netwatch.application.port.RecordingMetricsPort;
import ca.gc.cra.netwatch.application.port.ScriptedPacketSource;
import ca.gc.cra.netwatch.application.telemetry.RecentRecordBuffer;
import ca.gc.cra.netwatch.application.telemetry.TelemetryAggregator;
import ca.gc.cra.netwatch.domain.net.PacketRecord;
import ca.gc.cra.netwatch.domain.net.PacketRecords;
import ca.gc.cra.netwatch.domain.net.RawFrame;
import ca.gc.cra.netwatch.domain.threat.ThreatClassifier;
import ca.gc.cra.netwatch.domain.threat.ThreatLevel;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class CaptureSessionUseCaseTest {
  private static final List<PacketRecord> TEMPLATES = List.of(
      PacketRecords.tcp("192.168.1.2", 50000, "93.184.216.34", 443, 400),
      PacketRecords.udp("192.168.1.2", 53000, "192.168.1.1", 53, 80),
      PacketRecords.arp(60),
      PacketRecords.tcp("192.168.1.2", 50001, "10.0.0.7", 445, 60));
  private static final PacketDecoder TEMPLATE_DECODER = (frame, sequence) ->
      PacketRecords.at(TEMPLATES.get(frame.data()[0]), PacketRecords.T0, sequence);

  private final MutableClock clock = new MutableClock(0L);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final TelemetryAggregator aggregator = new TelemetryAggregator(clock, metrics);
  private final RecentRecordBuffer recent = new RecentRecordBuffer(100);
  private final List<PacketRecord> seen = new ArrayList<>();
  private Logger logger;
  private Level previousLevel;
  private ListAppender<ILoggingEvent> appender;

  @BeforeEach
  void attachAppender() {
    logger = (Logger) LoggerFactory.getLogger(CaptureSessionUseCase.class);
    previousLevel = logger.getLevel();
    logger.setLevel(Level.INFO);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void detachAppender() {
    logger.detachAppender(appender);
    logger.setLevel(previousLevel);
  }

  private static List<RawFrame> frames(int... templateIndexes) {
    List<RawFrame> frames = new ArrayList<>();
    for (int index : templateIndexes) {
      frames.add(new RawFrame(new byte[] {(byte) index}, 0L));
    }
    return frames;
  }

  private CaptureSessionUseCase session(ScriptedPacketSource source, CaptureFilter filter, long limit) {
    return new CaptureSessionUseCase(
        source, TEMPLATE_DECODER, filter, new ThreatClassifier(), aggregator, recent, seen::add, metrics, clock,
        new CaptureSessionUseCase.Settings("eth-test", limit));
  }

  @Test
  void processesFramesUntilSourceIsExhausted() throws Exception {
    ScriptedPacketSource source = ScriptedPacketSource.of(frames(0, 1, 2, 3));

    CaptureOutcome outcome = session(source, CaptureFilter.ACCEPT_ALL, 0).run();

    assertEquals(StopReason.SOURCE_EXHAUSTED, outcome.stopReason());
    assertEquals(4, outcome.framesPolled());
    assertEquals(1, outcome.framesFiltered());
    assertEquals(3, outcome.acceptedRecords());
    assertFalse(outcome.failed());
    assertTrue(source.started());
    assertTrue(source.closed());
    assertEquals(3, aggregator.totalPackets());
    assertEquals(3, recent.size());
    assertEquals(List.of(1L, 2L, 3L), seen.stream().map(PacketRecord::sequence).toList());
    assertEquals(3, metrics.count("capture.records.accepted"));
    assertEquals(1, metrics.count("capture.frames.filtered"));
  }

  @Test
  void elapsedTimeStartsWhenTheSourceOpens() throws Exception {
    clock.advanceSeconds(12);

    session(ScriptedPacketSource.of(frames(0, 1)), CaptureFilter.ACCEPT_ALL, 0).run();

    assertEquals(0, aggregator.snapshot().elapsedSeconds());
  }

  @Test
  void classifiesAcceptedRecords() throws Exception {
    session(ScriptedPacketSource.of(frames(0, 3)), CaptureFilter.ACCEPT_ALL, 0).run();

    assertEquals(ThreatLevel.SAFE, seen.get(0).threatLevel());
    assertEquals(ThreatLevel.HIGH, seen.get(1).threatLevel());
    assertEquals(1, aggregator.snapshot().threatAlerts().size());
  }

  @Test
  void stopsAtCountLimitCountingOnlyAcceptedRecords() throws Exception {
    ScriptedPacketSource source = ScriptedPacketSource.of(frames(2, 0, 2, 0, 0, 0));

    CaptureOutcome outcome = session(source, CaptureFilter.ACCEPT_ALL, 2).run();

    assertEquals(StopReason.LIMIT_REACHED, outcome.stopReason());
    assertEquals(2, outcome.acceptedRecords());
    assertEquals(2, outcome.framesFiltered());
    assertTrue(source.closed());
  }

  @Test
  void protocolFilterDropsOtherTraffic() throws Exception {
    CaptureFilter dnsOnly = new CaptureFilter(ProtocolFilter.DNS, null);

    CaptureOutcome outcome = session(ScriptedPacketSource.of(frames(0, 1, 1, 3)), dnsOnly, 0).run();

    assertEquals(2, outcome.acceptedRecords());
    assertEquals(List.of("UDP", "UDP"), seen.stream().map(PacketRecord::protocol).toList());
  }

  @Test
  void readFailureEndsCaptureAndKeepsStatistics() throws Exception {
    IOException failure = new IOException("device vanished");
    ScriptedPacketSource source = ScriptedPacketSource.failingAfter(frames(0), failure);

    CaptureOutcome outcome = session(source, CaptureFilter.ACCEPT_ALL, 0).run();

    assertEquals(StopReason.READ_FAILURE, outcome.stopReason());
    assertSame(failure, outcome.readFailure().orElseThrow());
    assertEquals(1, aggregator.totalPackets());
    assertEquals(1, metrics.count("capture.poll.error"));
    assertTrue(source.closed());
    assertTrue(appender.list.stream().anyMatch(e -> e.getFormattedMessage().equals("Failed to read packet: device vanished")));
  }

  @Test
  void stopRequestEndsLoop() throws Exception {
    CaptureSessionUseCase session = session(ScriptedPacketSource.idleAfter(frames(0)), CaptureFilter.ACCEPT_ALL, 0);
    session.stop();

    CaptureOutcome outcome = session.run();

    assertEquals(StopReason.STOPPED, outcome.stopReason());
    assertTrue(session.isStopRequested());
  }

  @Test
  void logsStartAndStop() throws Exception {
    CaptureSessionUseCase session = session(ScriptedPacketSource.of(frames(0)), CaptureFilter.ACCEPT_ALL, 0);

    session.run();

    List<String> messages = appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
    assertTrue(messages.contains("Starting packet capture on interface: eth-test"));
    assertTrue(messages.contains("Stopped packet capture. Captured 1 packets in 0 seconds"));
  }

  @Test
  void sessionRunsOnlyOnce() throws Exception {
    CaptureSessionUseCase session = session(ScriptedPacketSource.of(List.of()), CaptureFilter.ACCEPT_ALL, 0);
    session.run();

    assertThrows(IllegalStateException.class, session::run);
  }
}
