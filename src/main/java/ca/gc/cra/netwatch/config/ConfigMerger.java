package ca.gc.cra.netwatch.config;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Layers defaults, YAML and CLI settings; later layers win (CLI &gt; YAML &gt; defaults).
 */
public final class ConfigMerger {
  private static final List<Conflict> CONFLICTS = List.of(
      new Conflict(
          kv -> !value(kv, "port").isEmpty() && value(kv, "protocol").toLowerCase(Locale.ROOT).equals("icmp"),
          "port filter cannot be combined with protocol=icmp"),
      new Conflict(
          kv -> !value(kv, "pcapFile").isEmpty() && Boolean.parseBoolean(value(kv, "promisc")),
          "promisc applies to live capture only; remove it when pcapFile is set"));

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param mode active command
   * @param yaml optional YAML settings for the command
   * @param cli CLI overrides, may be {@code null}
   * @param defaults defaults for the command, may be {@code null}
   * @param warn told about each CLI key that replaces a different YAML value; may be {@code null}
   * @return immutable merged map
   * @throws IllegalArgumentException when the merged settings contradict each other
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> fromYaml = Objects.requireNonNull(yaml, "yaml").orElse(Map.of());
    Consumer<String> warnings = warn != null ? warn : message -> { };

    Map<String, String> merged = new HashMap<>();
    overlay(merged, defaults);
    overlay(merged, fromYaml);
    if (cli != null) {
      cli.forEach((key, value) -> {
        if (key == null || value == null) {
          return;
        }
        String previous = fromYaml.get(key);
        if (previous != null && !previous.equals(value)) {
          warnings.accept("CLI overrides YAML for key: " + key);
        }
        merged.put(key, value);
      });
    }

    for (Conflict conflict : CONFLICTS) {
      if (conflict.test().test(merged)) {
        throw new IllegalArgumentException(conflict.message());
      }
    }
    return Map.copyOf(merged);
  }

  private static void overlay(Map<String, String> target, Map<String, String> layer) {
    if (layer != null) {
      target.putAll(layer);
    }
  }

  private static String value(Map<String, String> kv, String key) {
    String raw = kv.get(key);
    return raw == null ? "" : raw.trim();
  }

  private record Conflict(Predicate<Map<String, String>> test, String message) {}
}
