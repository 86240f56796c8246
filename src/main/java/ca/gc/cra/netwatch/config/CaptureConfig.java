package ca.gc.cra.netwatch.config;

import ca.gc.cra.netwatch.application.filter.CaptureFilter;
import ca.gc.cra.netwatch.application.filter.ProtocolFilter;
import ca.gc.cra.netwatch.application.pipeline.ExportUseCase.ExportTarget;
import ca.gc.cra.netwatch.application.port.ExportFormat;
import ca.gc.cra.netwatch.infrastructure.metrics.MetricsSettings;
import ca.gc.cra.netwatch.validation.Numbers;
import ca.gc.cra.netwatch.validation.Paths;
import ca.gc.cra.netwatch.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration for the {@code capture} and {@code dashboard} commands.
 *
 * @param iface network interface to capture from; a {@code pcap:} label when replaying a file
 * @param pcapFile offline capture file, or {@code null} for live capture
 * @param protocol protocol filter
 * @param port port filter, or {@code null} for any port
 * @param count number of accepted packets after which capture stops; {@code 0} for unlimited
 * @param statsIntervalSeconds interim statistics interval in streaming mode; {@code 0} disables them
 * @param refreshMillis dashboard refresh interval
 * @param recentCapacity capacity of the recent-record buffer (export source)
 * @param snaplen libpcap snap length in bytes
 * @param timeoutMillis libpcap read timeout
 * @param promiscuous enable promiscuous mode
 * @param exportJson explicit JSON export file, or {@code null}
 * @param exportCsv explicit CSV export file, or {@code null}
 * @param exportFormats formats written to {@code exportDirectory} with generated names
 * @param exportDirectory directory for generated export files
 * @param clearScreen clear the terminal before each dashboard frame
 * @param logLevel root log level
 * @param logFile additional log file, or {@code null}
 * @param detailed print detailed per-packet blocks in streaming mode
 * @param metrics metrics export settings
 * @since 0.1.0
 */
public record CaptureConfig(
    String iface,
    Path pcapFile,
    ProtocolFilter protocol,
    Integer port,
    long count,
    int statsIntervalSeconds,
    int refreshMillis,
    int recentCapacity,
    int snaplen,
    int timeoutMillis,
    boolean promiscuous,
    Path exportJson,
    Path exportCsv,
    Set<ExportFormat> exportFormats,
    Path exportDirectory,
    boolean clearScreen,
    String logLevel,
    Path logFile,
    boolean detailed,
    MetricsSettings metrics) {

  static final String DEFAULT_IFACE = "eth0";
  static final int DEFAULT_SNAPLEN = 65_535;
  static final int DEFAULT_TIMEOUT_MILLIS = 1_000;
  static final int DEFAULT_REFRESH_MILLIS = 1_000;
  static final int DEFAULT_STATS_INTERVAL = 10;
  static final int DEFAULT_RECENT_CAPACITY = 1_000;
  static final String DEFAULT_EXPORT_DIR = "./exports";
  static final String DEFAULT_LOG_LEVEL = "INFO";
  private static final int MIN_SNAPLEN = 64;
  private static final int MAX_SNAPLEN = 262_144;
  private static final int MAX_TIMEOUT_MILLIS = 60_000;
  private static final int MIN_REFRESH_MILLIS = 50;
  private static final int MAX_REFRESH_MILLIS = 60_000;
  private static final int MAX_STATS_INTERVAL = 86_400;
  private static final int MAX_RECENT_CAPACITY = 1_000_000;
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;
  private static final DateTimeFormatter EXPORT_STAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss", Locale.ROOT).withZone(ZoneOffset.UTC);

  public CaptureConfig {
    if (pcapFile != null) {
      pcapFile = pcapFile.toAbsolutePath().normalize();
      if (iface == null || iface.isBlank()) {
        iface = "pcap:" + pcapFile.getFileName();
      }
    }
    iface = Strings.requireNonBlank("iface", iface);
    protocol = Objects.requireNonNullElse(protocol, ProtocolFilter.ANY);
    if (port != null) {
      Numbers.requireRange("port", port, 0, 65_535);
    }
    Numbers.requireRange("count", count, 0, Long.MAX_VALUE);
    Numbers.requireRange("statsInterval", statsIntervalSeconds, 0, MAX_STATS_INTERVAL);
    Numbers.requireRange("refreshMillis", refreshMillis, MIN_REFRESH_MILLIS, MAX_REFRESH_MILLIS);
    Numbers.requireRange("recentCapacity", recentCapacity, 1, MAX_RECENT_CAPACITY);
    Numbers.requireRange("snaplen", snaplen, MIN_SNAPLEN, MAX_SNAPLEN);
    Numbers.requireRange("timeout", timeoutMillis, 0, MAX_TIMEOUT_MILLIS);
    exportFormats = exportFormats == null || exportFormats.isEmpty()
        ? Set.of()
        : Set.copyOf(exportFormats);
    exportDirectory = Objects.requireNonNullElse(exportDirectory, Path.of(DEFAULT_EXPORT_DIR))
        .toAbsolutePath().normalize();
    logLevel = Strings.requireNonBlank("logLevel", Objects.requireNonNullElse(logLevel, DEFAULT_LOG_LEVEL))
        .toUpperCase(Locale.ROOT);
    metrics = Objects.requireNonNullElse(metrics, MetricsSettings.disabled());
  }

  /**
   * Default configuration: live capture on {@code eth0}, no filters, no exports.
   *
   * @return defaults
   */
  public static CaptureConfig defaults() {
    return new CaptureConfig(
        DEFAULT_IFACE,
        null,
        ProtocolFilter.ANY,
        null,
        0,
        DEFAULT_STATS_INTERVAL,
        DEFAULT_REFRESH_MILLIS,
        DEFAULT_RECENT_CAPACITY,
        DEFAULT_SNAPLEN,
        DEFAULT_TIMEOUT_MILLIS,
        false,
        null,
        null,
        Set.of(),
        Path.of(DEFAULT_EXPORT_DIR),
        true,
        DEFAULT_LOG_LEVEL,
        null,
        false,
        MetricsSettings.disabled());
  }

  /**
   * Parses an effective {@code key=value} configuration map.
   *
   * @param args merged CLI, YAML and default values; may be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is missing or invalid
   */
  public static CaptureConfig fromMap(Map<String, String> args) {
    Map<String, String> kv = args == null ? Map.of() : new HashMap<>(args);
    CaptureConfig defaults = defaults();

    Path pcapFile = optionalPath(kv, "pcapFile");
    String ifaceRaw = Strings.blankToNull(kv.get("iface"));
    String iface = ifaceRaw != null ? ifaceRaw : (pcapFile == null ? defaults.iface() : null);

    String protocolRaw = kv.get("protocol");
    ProtocolFilter protocol = ProtocolFilter.lookup(protocolRaw).orElseThrow(() -> new IllegalArgumentException(
        "protocol must be one of tcp, udp, icmp, http, dns (was " + protocolRaw + ")"));

    String portRaw = Strings.blankToNull(kv.get("port"));
    Integer port = portRaw == null ? null : Numbers.parseInt("port", portRaw, 0, 65_535);

    long count = parseLong(kv, "count", defaults.count());
    int stats = intOrDefault(kv, "statsInterval", defaults.statsIntervalSeconds(), 0, MAX_STATS_INTERVAL);
    int refresh = intOrDefault(
        kv, "refreshMillis", defaults.refreshMillis(), MIN_REFRESH_MILLIS, MAX_REFRESH_MILLIS);
    int recent = intOrDefault(kv, "recentCapacity", defaults.recentCapacity(), 1, MAX_RECENT_CAPACITY);
    int snap = intOrDefault(kv, "snaplen", defaults.snaplen(), MIN_SNAPLEN, MAX_SNAPLEN);
    int timeout = intOrDefault(kv, "timeout", defaults.timeoutMillis(), 0, MAX_TIMEOUT_MILLIS);
    boolean promisc = parseBoolean(kv, "promisc", defaults.promiscuous());

    Set<ExportFormat> formats = ExportFormat.parseSelection(kv.get("exportFormat"));
    Path exportDir = Objects.requireNonNullElse(optionalPath(kv, "exportDir"), defaults.exportDirectory());

    String otelAttributes = Strings.blankToNull(kv.get("otelResourceAttributes"));
    if (otelAttributes != null) {
      Strings.requirePrintableAscii("otelResourceAttributes", otelAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    MetricsSettings metrics = new MetricsSettings(
        kv.get("metricsExporter"), validateEndpoint(kv.get("otelEndpoint")), otelAttributes);

    return new CaptureConfig(
        iface,
        pcapFile,
        protocol,
        port,
        count,
        stats,
        refresh,
        recent,
        snap,
        timeout,
        promisc,
        optionalPath(kv, "exportJson"),
        optionalPath(kv, "exportCsv"),
        formats,
        exportDir,
        parseBoolean(kv, "clearScreen", defaults.clearScreen()),
        Objects.requireNonNullElse(Strings.blankToNull(kv.get("logLevel")), DEFAULT_LOG_LEVEL),
        optionalPath(kv, "logFile"),
        parseBoolean(kv, "detailed", defaults.detailed()),
        metrics);
  }

  /**
   * Indicates whether packets are replayed from a file.
   *
   * @return {@code true} when {@code pcapFile} is set
   */
  public boolean offline() {
    return pcapFile != null;
  }

  /**
   * Builds the capture filter from the protocol and port selections.
   *
   * @return capture filter
   */
  public CaptureFilter captureFilter() {
    return new CaptureFilter(protocol, port);
  }

  /**
   * Lists the export files to write at capture end: explicit paths first, then generated names under
   * {@code exportDirectory} for each selected format.
   *
   * @param now time used to stamp generated file names
   * @return export targets, possibly empty
   */
  public List<ExportTarget> exportTargets(Instant now) {
    List<ExportTarget> targets = new ArrayList<>();
    if (exportJson != null) {
      targets.add(new ExportTarget(ExportFormat.JSON, exportJson));
    }
    if (exportCsv != null) {
      targets.add(new ExportTarget(ExportFormat.CSV, exportCsv));
    }
    String stamp = EXPORT_STAMP.format(now);
    for (ExportFormat format : ExportFormat.values()) {
      if (exportFormats.contains(format)) {
        targets.add(new ExportTarget(
            format, exportDirectory.resolve("netwatch-export-" + stamp + '.' + format.extension())));
      }
    }
    return List.copyOf(targets);
  }

  private static Path optionalPath(Map<String, String> kv, String key) {
    String raw = Strings.blankToNull(kv.get(key));
    return raw == null ? null : Paths.parse(key, raw);
  }

  private static int intOrDefault(Map<String, String> kv, String key, int fallback, int min, int max) {
    String raw = Strings.blankToNull(kv.get(key));
    return raw == null ? fallback : Numbers.parseInt(key, raw, min, max);
  }

  private static long parseLong(Map<String, String> kv, String key, long fallback) {
    String raw = Strings.blankToNull(kv.get(key));
    if (raw == null) {
      return fallback;
    }
    try {
      return Numbers.requireRange(key, Long.parseLong(raw), 0, Long.MAX_VALUE);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a non-negative integer", ex);
    }
  }

  private static boolean parseBoolean(Map<String, String> kv, String key, boolean fallback) {
    String value = kv.get(key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was " + value + ")");
    };
  }

  private static String validateEndpoint(String raw) {
    String value = Strings.blankToNull(raw);
    if (value == null) {
      return null;
    }
    try {
      URI uri = new URI(value);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
      return value;
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
