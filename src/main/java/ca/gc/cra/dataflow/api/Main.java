package ca.gc.cra.dataflow.api;

import ca.gc.cra.dataflow.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dataflow CLI dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: dataflow <run|help> [options]";
  private static final String HELP_TEXT = """
      Dataflow pipeline runner

      Usage:
        dataflow <command> [options]

      Commands:
        run     Run the word-count sample pipeline (run --help for details)
        help    Show this message

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    if (safeArgs.length == 0) {
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = safeArgs[0] == null ? "" : safeArgs[0].trim().toLowerCase(Locale.ROOT);
    String[] rest = Arrays.copyOfRange(safeArgs, 1, safeArgs.length);
    return switch (command) {
      case "run" -> RunCli.run(rest);
      case "help", "--help", "-h" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      case "--verbose", "-v" -> {
        LoggingConfigurator.enableVerboseLogging();
        yield run(rest);
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
