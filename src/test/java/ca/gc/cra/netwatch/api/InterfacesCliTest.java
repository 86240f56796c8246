package ca.gc.cra.netwatch.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netwatch.domain.net.InterfaceInfo;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InterfacesCliTest {
  private StringWriter buffer;

  @BeforeEach
  void captureOutput() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void printsDeviceTable() {
    List<InterfaceInfo> devices = List.of(
        new InterfaceInfo("eth0", "Ethernet adapter", List.of("192.168.1.20", "fe80::1"), true, false),
        new InterfaceInfo("lo", null, List.of(), true, true));

    ExitCode exit = InterfacesCli.run(new String[0], () -> devices);

    assertEquals(ExitCode.SUCCESS, exit);
    List<String> lines = buffer.toString().lines().toList();
    assertEquals(6, lines.size());
    assertTrue(lines.get(1).contains("Name"));
    assertTrue(lines.get(3).contains("192.168.1.20, fe80::1"));
    assertTrue(lines.get(4).contains("UP (loopback)"));
  }

  @Test
  void emptyCatalogIsNotAnError() {
    assertEquals(ExitCode.SUCCESS, InterfacesCli.run(new String[0], List::of));
    assertTrue(buffer.toString().contains("No capture devices found."));
  }

  @Test
  void catalogFailureMapsToIoError() {
    ExitCode exit = InterfacesCli.run(new String[0], () -> {
      throw new IOException("permission denied");
    });

    assertEquals(ExitCode.IO_ERROR, exit);
    assertTrue(buffer.toString().contains("CAP_NET_RAW"));
  }

  @Test
  void unexpectedFailureMapsToRuntimeFailure() {
    ExitCode exit = InterfacesCli.run(new String[0], () -> {
      throw new IllegalStateException("boom");
    });

    assertEquals(ExitCode.RUNTIME_FAILURE, exit);
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, InterfacesCli.run(new String[] {"-h"}, List::of));
    assertTrue(buffer.toString().contains("netwatch interfaces"));
  }
}
