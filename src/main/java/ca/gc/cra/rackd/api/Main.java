package ca.gc.cra.rackd.api;

import ca.gc.cra.rackd.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the {@code rackd} executable; picks the subcommand and hands it the remaining arguments.
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final Map<String, Function<String[], ExitCode>> COMMANDS = Map.of("scan", ScanCli::run);
  private static final String SUMMARY_USAGE = "usage: rackd <scan> [options]";
  private static final String HELP_TEXT = """
      rackd - network device discovery

      Usage:
        rackd <command> [options]

      Commands:
        scan        Discover devices on a subnet (scan --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before the command runs
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs one command without exiting the JVM.
   *
   * @param args full command line; the first word that is not a switch names the command
   * @return the command's exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.positional().isEmpty()) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String word = input.positional().get(0);
    Function<String[], ExitCode> command = COMMANDS.get(word.toLowerCase(Locale.ROOT));
    if (command == null) {
      log.error("Unknown command: {}", word);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    log.debug("Dispatching to {}", word);
    // Switches stay on the argument list; --dry-run and --help belong to the command.
    return command.apply(dropFirst(args, word));
  }

  private static String[] dropFirst(String[] args, String word) {
    int index = 0;
    while (args[index] == null || !args[index].trim().equals(word)) {
      index++;
    }
    String[] rest = Arrays.copyOf(args, args.length - 1);
    System.arraycopy(args, index + 1, rest, index, args.length - index - 1);
    return rest;
  }
}
