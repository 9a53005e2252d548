package ca.gc.cra.rackd.api;

import ca.gc.cra.rackd.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code key=value} scan options into a map.
 *
 * <p>Keys are config names such as {@code subnet} or {@code hostConcurrency}. An empty value is kept so that
 * {@code excludeIps=} can clear a list set in YAML. When a key repeats, the last occurrence wins.</p>
 */
public final class CliArgsParser {
  private static final Pattern OPTION = Pattern.compile("([A-Za-z0-9._-]+)\\s*=(.*)", Pattern.DOTALL);
  private static final Pattern LEADING_NAME = Pattern.compile("([^=]+)=.*", Pattern.DOTALL);

  private CliArgsParser() {}

  /**
   * @param args option words; {@code null} and blank entries are skipped
   * @return mutable map in command-line order
   * @throws IllegalArgumentException when a word is not {@code key=value}, the key has characters outside
   *     {@code [A-Za-z0-9._-]}, or the value holds control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> options = new LinkedHashMap<>();
    if (args == null) {
      return options;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      Matcher option = OPTION.matcher(arg);
      if (!option.matches()) {
        throw rejection(raw, arg);
      }
      String key = option.group(1);
      String value = option.group(2).trim();
      if (value.chars().anyMatch(Character::isISOControl)) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
      options.put(key, value.isEmpty() ? value : Strings.requireNonBlank(key, value));
    }
    return options;
  }

  private static IllegalArgumentException rejection(String raw, String arg) {
    Matcher named = LEADING_NAME.matcher(arg);
    if (named.matches() && !named.group(1).isBlank()) {
      return new IllegalArgumentException("invalid argument name: " + named.group(1).trim());
    }
    return new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
  }
}
