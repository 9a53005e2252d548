package ca.gc.cra.rackd.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command line of one {@code rackd} invocation, split into switches and everything else.
 *
 * <p>Switches are words that start with {@code -} and carry no {@code '='}; they are stored lower-cased, with the
 * help and verbose aliases folded to {@code --help} and {@code --verbose}. The remaining words (the subcommand,
 * {@code key=value} pairs, {@code --config=path}) keep their order.</p>
 *
 * @param positional words that are not switches
 * @param flags normalized switches
 */
public record CliInput(List<String> positional, Set<String> flags) {
  private static final String HELP = "--help";
  private static final String VERBOSE = "--verbose";

  public CliInput {
    positional = List.copyOf(positional);
    flags = Set.copyOf(flags);
  }

  /**
   * Splits raw arguments. Blank and {@code null} entries are skipped.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed command line
   */
  public static CliInput parse(String[] args) {
    List<String> positional = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String normalized = normalizeSwitch(arg);
        if (normalized != null) {
          flags.add(normalized);
        } else {
          positional.add(arg);
        }
      }
    }
    return new CliInput(positional, flags);
  }

  private static String normalizeSwitch(String arg) {
    String lower = arg.toLowerCase(Locale.ROOT);
    switch (lower) {
      case "help":
      case "-h":
      case HELP:
        return HELP;
      case "-v":
      case "--debug":
      case VERBOSE:
        return VERBOSE;
      default:
        return lower.startsWith("-") && lower.indexOf('=') < 0 ? lower : null;
    }
  }

  /** @return positional words as a fresh array, ready for {@link CliArgsParser#toMap(String[])} */
  public String[] keyValueArgs() {
    return positional.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains(HELP);
  }

  public boolean verbose() {
    return flags.contains(VERBOSE);
  }

  /**
   * @param flag switch such as {@code --dry-run}; matched case-insensitively
   * @return {@code true} if it was on the command line
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
