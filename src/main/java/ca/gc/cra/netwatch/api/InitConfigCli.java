package ca.gc.cra.netwatch.api;

import ca.gc.cra.netwatch.config.DefaultConfigWriter;
import ca.gc.cra.netwatch.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the default YAML configuration for the {@code init-config} command.
 */
public final class InitConfigCli {
  private static final Logger log = LoggerFactory.getLogger(InitConfigCli.class);
  static final String DEFAULT_PATH = "netwatch.yaml";
  private static final String USAGE = "usage: netwatch init-config [path=FILE] [--force]";

  private InitConfigCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(USAGE);
      CliPrinter.println("Writes the default configuration (default " + DEFAULT_PATH + "); --force overwrites.");
      return ExitCode.SUCCESS;
    }
    Path target;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      target = Paths.parse("path", kv.getOrDefault("path", DEFAULT_PATH));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(USAGE);
      return ExitCode.INVALID_ARGS;
    }
    try {
      Path written = DefaultConfigWriter.write(target, input.hasFlag("--force"));
      CliPrinter.println("Wrote default configuration to " + written);
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("{}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to write configuration to {}", target, ex);
      return ExitCode.IO_ERROR;
    }
  }
}
