package ca.gc.cra.netwatch.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads NETWATCH configuration from YAML and flattens the {@code common} section plus the section for the
 * active command into a flat key/value map. Nested mappings become dotted keys, and scalar values may reference
 * environment variables as {@code ${NAME}} or {@code ${NAME:-fallback}}.
 *
 * <pre>
 * common:
 *   logLevel: INFO
 *   logFile: ${NETWATCH_LOG_DIR:-.}/capture.log
 * dashboard:
 *   refreshMillis: 500
 * </pre>
 */
public final class YamlConfigLoader {
  private static final String COMMON = "common";
  private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)(?::-([^}]*))?}");

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and merges {@code common} with the {@code mode} section; mode values win.
   *
   * @param path YAML file
   * @param mode command name ({@code capture} or {@code dashboard})
   * @return flattened settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed, not a mapping, or references an undefined variable
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    return load(path, mode, System.getenv());
  }

  static Optional<Map<String, String>> load(Path path, String mode, Map<String, String> env) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<?, ?> root = mapping(document, "root");
    Map<String, String> flattened = new LinkedHashMap<>();
    for (String section : new String[] {COMMON, mode.trim().toLowerCase(Locale.ROOT)}) {
      Object node = section(root, section);
      if (node != null) {
        flatten(mapping(node, section), null, flattened, env);
      }
    }
    return Optional.of(Map.copyOf(flattened));
  }

  private static Object section(Map<?, ?> root, String name) {
    return root.entrySet().stream()
        .filter(e -> e.getKey() instanceof String key && key.trim().toLowerCase(Locale.ROOT).equals(name))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse(null);
  }

  private static Map<?, ?> mapping(Object node, String context) {
    if (node instanceof Map<?, ?> map) {
      return map;
    }
    throw new IllegalArgumentException(context + " section must be a mapping");
  }

  private static void flatten(Map<?, ?> source, String prefix, Map<String, String> target, Map<String, String> env) {
    source.forEach((rawKey, value) -> {
      if (!(rawKey instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(
            (prefix == null ? "YAML" : prefix) + " contains a blank or non-string key");
      }
      String composite = prefix == null ? key : prefix + '.' + key;
      if (value instanceof Map<?, ?> nested) {
        flatten(nested, composite, target, env);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value == null ? "" : expand(composite, value.toString(), env));
      }
    });
  }

  private static String expand(String key, String value, Map<String, String> env) {
    Matcher matcher = PLACEHOLDER.matcher(value);
    StringBuilder sb = new StringBuilder();
    while (matcher.find()) {
      String resolved = env.get(matcher.group(1));
      if (resolved == null) {
        resolved = matcher.group(2);
      }
      if (resolved == null) {
        throw new IllegalArgumentException(
            "undefined environment variable " + matcher.group(1) + " in key " + key);
      }
      matcher.appendReplacement(sb, Matcher.quoteReplacement(resolved));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }
}
