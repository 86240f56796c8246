package ca.gc.cra.netwatch.api;

import java.util.Map;

/**
 * Helpers shared by commands that mix CLI flags with YAML or map based configuration.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config=} path from the argument map.
   *
   * @param args mutable CLI map
   * @return trimmed path or {@code null}
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Copies a boolean CLI flag into the argument map so it participates in merging.
   *
   * @param input parsed CLI input
   * @param flag flag such as {@code --detailed}
   * @param args mutable CLI map
   * @param key configuration key receiving {@code true}
   */
  static void applyFlag(CliInput input, String flag, Map<String, String> args, String key) {
    if (input.hasFlag(flag)) {
      args.put(key, "true");
    }
  }
}
