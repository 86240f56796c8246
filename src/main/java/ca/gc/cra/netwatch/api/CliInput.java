package ca.gc.cra.netwatch.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parsed CLI arguments: lower-cased flags plus the remaining tokens in order.
 *
 * <p>Tokens starting with {@code -} and lacking {@code '='} are flags; aliases fold onto one canonical name
 * ({@code -h} and {@code help} become {@code --help}, {@code -v} and {@code --debug} become {@code --verbose}).
 * A bare {@code --} ends flag parsing.</p>
 *
 * @param positional non-flag tokens ({@code key=value} pairs or a leading subcommand)
 * @param flags canonical flag names
 */
public record CliInput(List<String> positional, Set<String> flags) {
  private static final Map<String, String> ALIASES = Map.of(
      "-h", "--help",
      "help", "--help",
      "-v", "--verbose",
      "--debug", "--verbose");

  public CliInput {
    positional = List.copyOf(positional);
    flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments; {@code null} and blank tokens are skipped.
   *
   * @param args raw arguments; may be {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> positional = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean flagsEnded = false;
    for (String raw : args == null ? new String[0] : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      if (flagsEnded) {
        positional.add(arg);
        continue;
      }
      if (arg.equals("--")) {
        flagsEnded = true;
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      String canonical = ALIASES.getOrDefault(lower, lower);
      if (canonical.startsWith("-") && !canonical.contains("=")) {
        flags.add(canonical);
      } else {
        positional.add(arg);
      }
    }
    return new CliInput(positional, flags);
  }

  /**
   * Returns the non-flag tokens as an array for {@link CliArgsParser#toMap(String[])}.
   *
   * @return new array of positional tokens
   */
  public String[] keyValueArgs() {
    return positional.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Tests for a flag, case-insensitively.
   *
   * @param flag flag such as {@code --dry-run}
   * @return {@code true} when present
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
