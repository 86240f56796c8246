package ca.gc.cra.netwatch.api;

import ca.gc.cra.netwatch.application.pipeline.CaptureOutcome;
import ca.gc.cra.netwatch.application.pipeline.CaptureSessionUseCase;
import ca.gc.cra.netwatch.application.pipeline.ExportUseCase.ExportTarget;
import ca.gc.cra.netwatch.application.pipeline.LiveDashboardUseCase;
import ca.gc.cra.netwatch.application.port.ClockPort;
import ca.gc.cra.netwatch.application.report.CaptureSummaryFormatter;
import ca.gc.cra.netwatch.config.CaptureConfig;
import ca.gc.cra.netwatch.config.CompositionRoot;
import ca.gc.cra.netwatch.config.ConfigMerger;
import ca.gc.cra.netwatch.config.DefaultsForMode;
import ca.gc.cra.netwatch.config.YamlConfigLoader;
import ca.gc.cra.netwatch.infrastructure.display.ConsoleDisplaySink;
import ca.gc.cra.netwatch.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.netwatch.logging.LoggingConfigurator;
import ca.gc.cra.netwatch.logging.Logs;
import ca.gc.cra.netwatch.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code capture} (streaming) and {@code dashboard} commands.
 *
 * @since 0.1.0
 */
public final class CaptureCli {
  private static final Logger log = LoggerFactory.getLogger(CaptureCli.class);
  private static final long SHUTDOWN_GRACE_SECONDS = 10;
  static final String SUMMARY_USAGE =
      "usage: netwatch <capture|dashboard> [iface=<nic>|pcapFile=<path>] [protocol=tcp|udp|icmp|http|dns] "
          + "[port=0-65535] [count=N] [exportJson=PATH] [exportCsv=PATH] [exportFormat=none|json|csv|both] "
          + "[config=PATH] [--detailed] [--dry-run]";
  private static final String HELP_TEXT = """
      NETWATCH %s

      Usage:
        netwatch %s [iface=<nic>|pcapFile=<path>] [options]

      Source (choose one):
        iface=NAME                  Network interface to capture from (default eth0; see 'netwatch interfaces')
        pcapFile=PATH               Replay a pcap/pcapng file instead of capturing live

      Filters:
        protocol=tcp|udp|icmp|http|dns   Keep only matching packets (http: TCP 80/8080, dns: UDP 53)
        port=0-65535                Keep only TCP/UDP packets using this source or destination port
        count=N                     Stop after N accepted packets (0 = unlimited)

      Capture tuning:
        snaplen=64-262144           Snap length in bytes (default 65535)
        timeout=0-60000             Read timeout in ms (default 1000)
        promisc=true|false          Promiscuous mode (default false)
        recentCapacity=N            Records kept for export (default 1000)

      Output:
        %s
        exportJson=PATH             Write captured packets as JSON at exit
        exportCsv=PATH              Write captured packets as CSV at exit
        exportFormat=none|json|csv|both  Also write timestamped files into exportDir
        exportDir=PATH              Directory for exportFormat files (default ./exports)

      Configuration and telemetry:
        config=PATH                 YAML file (common + %s sections); CLI values win
        logLevel=LEVEL              TRACE|DEBUG|INFO|WARN|ERROR|OFF (default INFO)
        logFile=PATH                Also write logs to PATH
        metricsExporter=otlp|none   Metrics exporter (default none)
        otelEndpoint=URL            OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --dry-run                   Validate inputs and print the plan without capturing
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Packet capture usually requires root privileges or CAP_NET_RAW.
      """;
  private static final String CAPTURE_OUTPUT_HELP =
      "--detailed                  Print a detailed block per packet\n"
          + "  statsInterval=SECONDS       Interim statistics interval (default 10, 0 disables)";
  private static final String DASHBOARD_OUTPUT_HELP =
      "refreshMillis=50-60000      Dashboard refresh interval (default 1000)\n"
          + "  clearScreen=true|false      Clear the terminal before each frame (default true)";

  private CaptureCli() {}

  /**
   * Runs the {@code capture} or {@code dashboard} command.
   *
   * @param args command arguments without the command name
   * @param mode {@link DefaultsForMode#CAPTURE} or {@link DefaultsForMode#DASHBOARD}
   * @return exit code
   */
  static ExitCode run(String[] args, String mode) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(helpText(mode));
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} command", mode);
    }

    Map<String, String> cliKv;
    try {
      cliKv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      return invalid("Invalid argument: {}", ex);
    }
    ConfigCliUtils.applyFlag(input, "--detailed", cliKv, "detailed");
    String configPath = ConfigCliUtils.extractConfigPath(cliKv);

    Optional<Map<String, String>> yaml;
    try {
      yaml = loadYaml(configPath, mode);
    } catch (IllegalArgumentException ex) {
      return invalid("Invalid YAML configuration: {}", ex);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", configPath, ex);
      return ExitCode.IO_ERROR;
    }

    CaptureConfig config;
    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          mode, yaml, cliKv, DefaultsForMode.asFlatMap(mode), log::warn);
      config = CaptureConfig.fromMap(effective);
      validatePaths(config, cliKv, !input.hasFlag("--dry-run"));
    } catch (IllegalArgumentException ex) {
      return invalid("Invalid " + mode + " configuration: {}", ex);
    }

    try {
      TelemetryConfigurator.configureLogging(config, input.verbose());
    } catch (IllegalArgumentException ex) {
      return invalid("Invalid logging configuration: {}", ex);
    }

    if (input.hasFlag("--dry-run")) {
      CliPrinter.printLines(dryRunPlan(mode, config));
      return ExitCode.SUCCESS;
    }

    log.info("Configured {} pipeline: source={}, filter={}, metricsExporter={}",
        mode, config.iface(), config.captureFilter().describe(), config.metrics().exporter());
    try (OpenTelemetryMetricsAdapter metrics = TelemetryConfigurator.configureMetrics(config)) {
      boolean dashboard = DefaultsForMode.DASHBOARD.equals(mode);
      ConsoleDisplaySink display = new ConsoleDisplaySink(CliPrinter.writer(), dashboard && config.clearScreen());
      CompositionRoot root = new CompositionRoot(config, metrics, display);
      return dashboard ? runDashboard(root, config) : runStreaming(root, config);
    }
  }

  private static ExitCode runStreaming(CompositionRoot root, CaptureConfig config) {
    CaptureSessionUseCase session = root.streamingSession();
    CliPrinter.println("Capturing on " + config.iface() + " (" + config.captureFilter().describe()
        + "). Press Ctrl+C to stop.");
    return execute(root, config, session::stop, session::run);
  }

  private static ExitCode runDashboard(CompositionRoot root, CaptureConfig config) {
    LiveDashboardUseCase dashboard = root.liveDashboard(true);
    return execute(root, config, dashboard::stop, dashboard::run);
  }

  private static ExitCode execute(
      CompositionRoot root, CaptureConfig config, Runnable stopAction, CaptureRun run) {
    CountDownLatch finished = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      stopAction.run();
      try {
        if (!finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
          log.warn("Capture did not finish within {}s of shutdown request", SHUTDOWN_GRACE_SECONDS);
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, "netwatch-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);

    try {
      CaptureOutcome outcome = run.execute();
      CliPrinter.printLines(CaptureSummaryFormatter.finalSummary(root.aggregator().snapshot()));
      ExitCode exportResult = exportRecords(root, config);
      if (outcome.failed()) {
        log.error("Capture ended after a read failure on {}", config.iface(), outcome.readFailure().get());
        printHints(config);
        return ExitCode.IO_ERROR;
      }
      return exportResult;
    } catch (IOException ex) {
      log.error("Capture I/O failure on {}: {}", config.iface(), ex.getMessage(), ex);
      printHints(config);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Capture configuration error: {}", ex.getMessage(), ex);
      printHints(config);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Capture interrupted on {}", config.iface(), ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in capture pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in capture pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      finished.countDown();
      removeHook(hook);
    }
  }

  private static ExitCode exportRecords(CompositionRoot root, CaptureConfig config) {
    List<ExportTarget> targets = config.exportTargets(ClockPort.SYSTEM.now());
    if (targets.isEmpty()) {
      return ExitCode.SUCCESS;
    }
    try {
      root.exportUseCase().exportAll(root.recentRecords().snapshot(), targets);
      for (ExportTarget target : targets) {
        CliPrinter.println("Exported " + target.format().name() + " to " + target.path());
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Export failed: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException shuttingDown) {
      log.debug("JVM shutdown in progress; shutdown hook stays registered");
    }
  }

  private static Optional<Map<String, String>> loadYaml(String configPath, String mode) throws IOException {
    if (configPath == null) {
      return Optional.empty();
    }
    Path yamlPath = Path.of(configPath);
    if (!Files.exists(yamlPath)) {
      throw new IllegalArgumentException("configuration file does not exist: " + yamlPath);
    }
    return YamlConfigLoader.load(yamlPath, mode);
  }

  private static void validatePaths(CaptureConfig config, Map<String, String> cliKv, boolean createDirs) {
    if (config.offline()) {
      Paths.requireReadableFile("pcapFile", config.pcapFile());
      String ifaceArg = cliKv.get("iface");
      if (ifaceArg != null && !ifaceArg.isBlank()) {
        log.warn("Replaying {}; iface={} only labels the capture", config.pcapFile(), Logs.truncate(ifaceArg, 32));
      }
    }
    if (!config.exportFormats().isEmpty()) {
      Paths.validateWritableDir(config.exportDirectory(), createDirs);
    }
  }

  static List<String> dryRunPlan(String mode, CaptureConfig config) {
    List<String> lines = new ArrayList<>();
    lines.add("NETWATCH " + mode + " dry run");
    lines.add("  source        : " + (config.offline() ? "file " + config.pcapFile() : "interface " + config.iface()));
    lines.add("  filter        : " + config.captureFilter().describe());
    lines.add("  count         : " + (config.count() == 0 ? "unlimited" : Long.toString(config.count())));
    lines.add("  snaplen       : " + config.snaplen() + " bytes, timeout " + config.timeoutMillis()
        + " ms, promisc " + config.promiscuous());
    if (DefaultsForMode.DASHBOARD.equals(mode)) {
      lines.add("  refresh       : " + config.refreshMillis() + " ms");
    } else {
      lines.add("  output        : " + (config.detailed() ? "detailed" : "summary")
          + ", stats every " + config.statsIntervalSeconds() + " s");
    }
    List<ExportTarget> targets = config.exportTargets(ClockPort.SYSTEM.now());
    if (targets.isEmpty()) {
      lines.add("  exports       : none");
    }
    for (ExportTarget target : targets) {
      lines.add("  export " + String.format("%-7s", target.format().name()) + ": " + target.path());
    }
    lines.add("  metrics       : " + config.metrics().exporter());
    return lines;
  }

  static void printHints(CaptureConfig config) {
    CliPrinter.println("Troubleshooting:");
    if (config.offline()) {
      CliPrinter.println("  - Check that " + config.pcapFile() + " is a valid pcap or pcapng file");
    } else {
      CliPrinter.println("  - Run with root privileges or grant CAP_NET_RAW to the java binary");
      CliPrinter.println("  - Check that interface '" + config.iface() + "' exists (netwatch interfaces)");
    }
    CliPrinter.println("  - Relax protocol= and port= filters if no packets are captured");
  }

  private static String helpText(String mode) {
    String output = DefaultsForMode.DASHBOARD.equals(mode) ? DASHBOARD_OUTPUT_HELP : CAPTURE_OUTPUT_HELP;
    String title = DefaultsForMode.DASHBOARD.equals(mode) ? "live traffic dashboard" : "packet capture";
    return HELP_TEXT.formatted(title, mode, output, mode).stripTrailing();
  }

  private static ExitCode invalid(String message, IllegalArgumentException ex) {
    log.error(message, ex.getMessage());
    CliPrinter.println(SUMMARY_USAGE);
    return ExitCode.INVALID_ARGS;
  }

  @FunctionalInterface
  private interface CaptureRun {
    CaptureOutcome execute() throws Exception;
  }
}
