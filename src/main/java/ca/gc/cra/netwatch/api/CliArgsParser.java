package ca.gc.cra.netwatch.api;

import ca.gc.cra.netwatch.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a lookup map. Keys may carry a leading {@code --}
 * ({@code --pcapFile=trace.pcap}); values may be wrapped in matching single or double quotes.
 */
public final class CliArgsParser {
  private static final Pattern ARGUMENT = Pattern.compile("^(?:--)?([A-Za-z][A-Za-z0-9._-]*)=(.*)$");

  private CliArgsParser() {}

  /**
   * Parses arguments in order.
   *
   * @param args raw arguments; {@code null} yields an empty map
   * @return mutable map in argument order; a repeated key keeps its last value
   * @throws IllegalArgumentException for arguments without a valid key or without a value
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      Matcher matcher = ARGUMENT.matcher(raw.trim());
      if (!matcher.matches()) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = matcher.group(1);
      String value = unquote(matcher.group(2).trim());
      if (value.isEmpty()) {
        throw new IllegalArgumentException("argument " + key + " needs a value");
      }
      map.put(key, Strings.requireNonBlank(key, value));
    }
    return map;
  }

  private static String unquote(String value) {
    if (value.length() >= 2) {
      char first = value.charAt(0);
      if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
        return value.substring(1, value.length() - 1);
      }
    }
    return value;
  }
}
