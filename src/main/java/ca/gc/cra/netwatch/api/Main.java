package ca.gc.cra.netwatch.api;

import ca.gc.cra.netwatch.config.DefaultsForMode;
import ca.gc.cra.netwatch.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * NETWATCH CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  static final String SUMMARY_USAGE = "usage: netwatch <" + Command.names() + "> [options]";

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first positional token is the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.positional().isEmpty()) {
      if (input.help()) {
        CliPrinter.printLines(helpText());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String token = input.positional().get(0);
    Optional<Command> command = Command.find(token);
    if (command.isEmpty()) {
      log.error("Unknown command: {}", token);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    log.debug("Dispatching to {}", command.get().label);
    return command.get().handler.apply(withoutFirst(args, token));
  }

  private static List<String> helpText() {
    List<String> lines = new ArrayList<>();
    lines.add("NETWATCH network traffic monitor");
    lines.add("");
    lines.add("Usage:");
    lines.add("  netwatch <command> [options]");
    lines.add("");
    lines.add("Commands:");
    for (Command command : Command.values()) {
      lines.add(String.format(Locale.ROOT, "  %-13s%s", command.label, command.summary));
    }
    lines.add("");
    lines.add("Global flags:");
    lines.add("  --help       Show this message (or '<command> --help')");
    lines.add("  --verbose    Enable DEBUG logging");
    return lines;
  }

  /** Arguments handed to the command: everything except the command token itself. */
  private static String[] withoutFirst(String[] args, String token) {
    List<String> rest = new ArrayList<>(Arrays.asList(args));
    rest.removeIf(Objects::isNull);
    for (int i = 0; i < rest.size(); i++) {
      if (rest.get(i).trim().equals(token)) {
        rest.remove(i);
        break;
      }
    }
    return rest.toArray(new String[0]);
  }

  private enum Command {
    CAPTURE(DefaultsForMode.CAPTURE, "Stream captured packets to the console with periodic statistics",
        args -> CaptureCli.run(args, DefaultsForMode.CAPTURE)),
    DASHBOARD(DefaultsForMode.DASHBOARD, "Live dashboard of bandwidth, threats, protocols and connections",
        args -> CaptureCli.run(args, DefaultsForMode.DASHBOARD)),
    INTERFACES("interfaces", "List capture devices", InterfacesCli::run),
    INIT_CONFIG("init-config", "Write the default YAML configuration", InitConfigCli::run);

    private final String label;
    private final String summary;
    private final Function<String[], ExitCode> handler;

    Command(String label, String summary, Function<String[], ExitCode> handler) {
      this.label = label;
      this.summary = summary;
      this.handler = handler;
    }

    static Optional<Command> find(String token) {
      String wanted = token.trim().toLowerCase(Locale.ROOT);
      return Arrays.stream(values()).filter(c -> c.label.equals(wanted)).findFirst();
    }

    static String names() {
      return Arrays.stream(values()).map(c -> c.label).collect(Collectors.joining("|"));
    }
  }
}
