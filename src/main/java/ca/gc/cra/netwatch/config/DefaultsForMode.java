package ca.gc.cra.netwatch.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default settings for each NETWATCH command.
 *
 * <p>The key set doubles as the list of keys written by {@link DefaultConfigWriter}.</p>
 */
public final class DefaultsForMode {
  /** Command streaming packet lines to the console. */
  public static final String CAPTURE = "capture";
  /** Command rendering the live dashboard. */
  public static final String DASHBOARD = "dashboard";

  private DefaultsForMode() {}

  /**
   * Returns defaults for {@code mode} merged with the common defaults.
   *
   * @param mode {@code capture} or {@code dashboard}
   * @return unmodifiable map of defaults
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(common());
    defaults.putAll(switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case CAPTURE -> capture();
      case DASHBOARD -> dashboard();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  static Map<String, String> common() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("logLevel", CaptureConfig.DEFAULT_LOG_LEVEL);
    map.put("logFile", "");
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    return map;
  }

  static Map<String, String> capture() {
    CaptureConfig defaults = CaptureConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("iface", defaults.iface());
    map.put("pcapFile", "");
    map.put("protocol", "");
    map.put("port", "");
    map.put("count", Long.toString(defaults.count()));
    map.put("snaplen", Integer.toString(defaults.snaplen()));
    map.put("timeout", Integer.toString(defaults.timeoutMillis()));
    map.put("promisc", Boolean.toString(defaults.promiscuous()));
    map.put("recentCapacity", Integer.toString(defaults.recentCapacity()));
    map.put("statsInterval", Integer.toString(defaults.statsIntervalSeconds()));
    map.put("detailed", Boolean.toString(defaults.detailed()));
    map.put("exportFormat", "none");
    map.put("exportDir", CaptureConfig.DEFAULT_EXPORT_DIR);
    map.put("exportJson", "");
    map.put("exportCsv", "");
    return map;
  }

  static Map<String, String> dashboard() {
    CaptureConfig defaults = CaptureConfig.defaults();
    Map<String, String> map = capture();
    map.remove("statsInterval");
    map.remove("detailed");
    map.put("refreshMillis", Integer.toString(defaults.refreshMillis()));
    map.put("clearScreen", Boolean.toString(defaults.clearScreen()));
    return map;
  }
}
