package ca.gc.cra.sconv.api;

import ca.gc.cra.sconv.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * sconv CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: sconv <convert|inspect> [options]";
  private static final String HELP_TEXT = """
      sconv command dispatcher

      Usage:
        sconv <command> [options]

      Commands:
        convert     Convert a file's text between charsets (convert --help for details)
        inspect     Show the flags and stages chosen for a charset pair

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM. Flags are
   * forwarded to the subcommand wherever they appear.
   *
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String command = null;
    List<String> delegateArgs = new ArrayList<>();
    for (String arg : args == null ? new String[0] : args) {
      if (arg == null || arg.isBlank()) {
        continue;
      }
      if (command == null && !arg.trim().startsWith("-")) {
        command = arg.trim().toLowerCase(Locale.ROOT);
      } else {
        delegateArgs.add(arg);
      }
    }
    if (command == null || command.equals("help")) {
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
      log.debug("Verbose logging enabled for dispatcher");
    }

    String[] forwarded = delegateArgs.toArray(String[]::new);
    return switch (command) {
      case "convert" -> ConvertCli.run(forwarded);
      case "inspect" -> InspectCli.run(forwarded);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
