package ca.gc.cra.netwatch.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Writes a YAML configuration file populated with the built-in defaults.
 *
 * <p>The output has {@code common}, {@code capture} and {@code dashboard} sections and loads back through
 * {@link YamlConfigLoader}.</p>
 */
public final class DefaultConfigWriter {
  static final String HEADER = "# NETWATCH configuration. Command-line key=value arguments override these values.\n";

  private DefaultConfigWriter() {}

  /**
   * Renders the default configuration document.
   *
   * @return YAML text
   */
  public static String render() {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("common", DefaultsForMode.common());
    document.put(DefaultsForMode.CAPTURE, DefaultsForMode.capture());
    document.put(DefaultsForMode.DASHBOARD, DefaultsForMode.dashboard());

    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    options.setPrettyFlow(true);
    return HEADER + new Yaml(options).dump(document);
  }

  /**
   * Writes the default configuration to {@code target}.
   *
   * @param target destination file
   * @param overwrite replace an existing file
   * @return the written path
   * @throws IOException if the file cannot be written
   * @throws IllegalArgumentException if the file exists and {@code overwrite} is {@code false}
   */
  public static Path write(Path target, boolean overwrite) throws IOException {
    Objects.requireNonNull(target, "target");
    Path normalized = target.toAbsolutePath().normalize();
    if (Files.exists(normalized) && !overwrite) {
      throw new IllegalArgumentException("configuration file already exists: " + normalized + " (use --force)");
    }
    Path parent = normalized.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(normalized, render(), StandardCharsets.UTF_8);
    return normalized;
  }
}
