package ca.gc.cra.netwatch.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netwatch.config.CaptureConfig;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CaptureCliTest {
  @TempDir Path tempDir;

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
  void helpDescribesModeSpecificOptions() {
    assertEquals(ExitCode.SUCCESS, CaptureCli.run(new String[] {"--help"}, "capture"));
    assertTrue(buffer.toString().contains("NETWATCH packet capture"));
    assertTrue(buffer.toString().contains("statsInterval=SECONDS"));
    assertFalse(buffer.toString().contains("refreshMillis="));
  }

  @Test
  void dryRunPrintsPlanWithoutCapturing() {
    ExitCode exit = CaptureCli.run(
        new String[] {"iface=eth9", "protocol=TCP", "port=443", "count=20", "logLevel=warn", "--dry-run"},
        "capture");

    assertEquals(ExitCode.SUCCESS, exit);
    List<String> lines = buffer.toString().lines().toList();
    assertEquals("NETWATCH capture dry run", lines.get(0));
    assertTrue(lines.contains("  source        : interface eth9"));
    assertTrue(lines.contains("  filter        : protocol=tcp port=443"));
    assertTrue(lines.contains("  count         : 20"));
    assertTrue(lines.contains("  output        : summary, stats every 10 s"));
    assertTrue(lines.contains("  exports       : none"));
    assertTrue(lines.contains("  metrics       : none"));
  }

  @Test
  void detailedFlagReachesConfiguration() {
    CaptureCli.run(new String[] {"--detailed", "logLevel=warn", "--dry-run"}, "capture");

    assertTrue(buffer.toString().contains("  output        : detailed, stats every 10 s"));
  }

  @Test
  void dashboardDryRunShowsRefreshInterval() {
    ExitCode exit = CaptureCli.run(new String[] {"refreshMillis=250", "logLevel=warn", "--dry-run"}, "dashboard");

    assertEquals(ExitCode.SUCCESS, exit);
    assertTrue(buffer.toString().contains("  refresh       : 250 ms"));
  }

  @Test
  void yamlValuesApplyAndCliWins() throws Exception {
    Path yaml = tempDir.resolve("netwatch.yaml");
    Files.writeString(yaml, """
        common:
          logLevel: WARN
        capture:
          iface: eth3
          count: 5
        """);

    ExitCode exit = CaptureCli.run(new String[] {"config=" + yaml, "count=7", "--dry-run"}, "capture");

    assertEquals(ExitCode.SUCCESS, exit);
    assertTrue(buffer.toString().contains("  source        : interface eth3"));
    assertTrue(buffer.toString().contains("  count         : 7"));
  }

  @Test
  void offlineReplayRequiresReadableFile() throws Exception {
    Path missing = tempDir.resolve("missing.pcap");
    assertEquals(ExitCode.INVALID_ARGS,
        CaptureCli.run(new String[] {"pcapFile=" + missing, "--dry-run"}, "capture"));
    assertTrue(buffer.toString().contains(CaptureCli.SUMMARY_USAGE));

    Path trace = Files.write(tempDir.resolve("trace.pcap"), new byte[] {1, 2, 3});
    buffer.getBuffer().setLength(0);
    assertEquals(ExitCode.SUCCESS,
        CaptureCli.run(new String[] {"pcapFile=" + trace, "logLevel=warn", "--dry-run"}, "capture"));
    assertTrue(buffer.toString().contains("  source        : file " + trace.toAbsolutePath().normalize()));
  }

  @Test
  void invalidInputsReturnInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, CaptureCli.run(new String[] {"protocol=sctp", "--dry-run"}, "capture"));
    assertEquals(ExitCode.INVALID_ARGS, CaptureCli.run(new String[] {"iface"}, "capture"));
    assertEquals(ExitCode.INVALID_ARGS,
        CaptureCli.run(new String[] {"protocol=icmp", "port=80", "--dry-run"}, "capture"));
    assertEquals(ExitCode.INVALID_ARGS, CaptureCli.run(new String[] {"logLevel=loud", "--dry-run"}, "capture"));
    assertEquals(ExitCode.INVALID_ARGS,
        CaptureCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml"), "--dry-run"}, "dashboard"));
  }

  @Test
  void dryRunListsExportTargets() {
    Path json = tempDir.resolve("out.json");
    CaptureConfig config = CaptureConfig.fromMap(Map.of("exportJson", json.toString()));

    List<String> plan = CaptureCli.dryRunPlan("capture", config);

    assertTrue(plan.contains("  export JSON   : " + json));
    assertFalse(plan.contains("  exports       : none"));
  }

  @Test
  void hintsDependOnSource() {
    CaptureCli.printHints(CaptureConfig.fromMap(Map.of("iface", "eth7")));

    String output = buffer.toString();
    assertTrue(output.startsWith("Troubleshooting:"));
    assertTrue(output.contains("Check that interface 'eth7' exists"));
  }
}
