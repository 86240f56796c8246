package ca.gc.cra.netwatch.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  private Path write(String yaml) throws IOException {
    Path file = tempDir.resolve("netwatch.yaml");
    Files.writeString(file, yaml);
    return file;
  }

  @Test
  void missingFileYieldsEmpty() throws Exception {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "capture").isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws Exception {
    assertEquals(Optional.of(Map.of()), YamlConfigLoader.load(write(""), "capture"));
  }

  @Test
  void modeSectionOverridesCommonSection() throws Exception {
    Path file = write("""
        common:
          logLevel: WARN
          iface: eth1
        capture:
          iface: wlan0
          count: 25
        dashboard:
          refreshMillis: 250
        """);

    Map<String, String> capture = YamlConfigLoader.load(file, "capture").orElseThrow();
    Map<String, String> dashboard = YamlConfigLoader.load(file, "dashboard").orElseThrow();

    assertEquals(Map.of("logLevel", "WARN", "iface", "wlan0", "count", "25"), capture);
    assertEquals(Map.of("logLevel", "WARN", "iface", "eth1", "refreshMillis", "250"), dashboard);
  }

  @Test
  void sectionNamesMatchCaseInsensitively() throws Exception {
    Path file = write("""
        Capture:
          protocol: udp
        """);

    assertEquals(Map.of("protocol", "udp"), YamlConfigLoader.load(file, "CAPTURE").orElseThrow());
  }

  @Test
  void nestedKeysAreFlattenedAndNullsBecomeBlank() throws Exception {
    Path file = write("""
        capture:
          otel:
            endpoint: http://localhost:4317
          logFile:
        """);

    Map<String, String> values = YamlConfigLoader.load(file, "capture").orElseThrow();

    assertEquals("http://localhost:4317", values.get("otel.endpoint"));
    assertEquals("", values.get("logFile"));
  }

  @Test
  void environmentPlaceholdersExpand() throws Exception {
    Path file = write("""
        capture:
          iface: ${CAPTURE_IFACE}
          logFile: ${LOG_DIR:-/var/log}/netwatch.log
          exportDir: ${EXPORT_DIR:-exports}
        """);

    Map<String, String> values = YamlConfigLoader.load(
        file, "capture", Map.of("CAPTURE_IFACE", "ens3", "EXPORT_DIR", "/data/exports")).orElseThrow();

    assertEquals("ens3", values.get("iface"));
    assertEquals("/var/log/netwatch.log", values.get("logFile"));
    assertEquals("/data/exports", values.get("exportDir"));
  }

  @Test
  void undefinedPlaceholderIsRejected() throws IOException {
    Path file = write("capture:\n  iface: ${NO_SUCH_VAR}\n");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(file, "capture", Map.of()));
    assertEquals("undefined environment variable NO_SUCH_VAR in key iface", ex.getMessage());
  }

  @Test
  void arraysAreRejected() throws IOException {
    Path file = write("""
        capture:
          iface:
            - eth0
            - eth1
        """);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(file, "capture"));
    assertEquals("YAML arrays are not supported for key iface", ex.getMessage());
  }

  @Test
  void scalarSectionIsRejected() throws IOException {
    Path file = write("capture: eth0\n");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(file, "capture"));
    assertEquals("capture section must be a mapping", ex.getMessage());
  }

  @Test
  void malformedYamlIsReportedWithPath() throws IOException {
    Path file = write("capture:\n  iface: [eth0\n");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(file, "capture"));
    assertTrue(ex.getMessage().startsWith("Failed to parse YAML config at " + file));
  }
}
