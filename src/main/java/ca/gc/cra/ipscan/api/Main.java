package ca.gc.cra.ipscan.api;

import ca.gc.cra.ipscan.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher for the scanner; routes to {@code run} or {@code scan}.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: ipscan <run|scan> [options]";
  private static final String HELP_TEXT = """
      IP address log scanner

      Usage:
        ipscan <command> [options]

      Commands:
        run    Scan the log file and replace the stored address lists every interval (default command)
        scan   Run a single scan cycle and print the counts

      Global flags:
        --help      Show this message, or the command's help when given after a command
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM. With no arguments the service loop starts.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args == null || args.length == 0 ? new String[] {"run"} : args);
    RunCli.exitUnlessShuttingDown(exit);
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token is the command
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] positional = input.keyValueArgs();
    if (positional.length == 0) {
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

    String command = positional[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = withoutFirst(args, positional[0]);
    return switch (command) {
      case "run" -> RunCli.run(delegateArgs);
      case "scan" -> ScanCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] withoutFirst(String[] args, String token) {
    List<String> rest = new ArrayList<>(args.length);
    boolean removed = false;
    for (String arg : args) {
      if (!removed && arg != null && arg.trim().equals(token)) {
        removed = true;
        continue;
      }
      rest.add(arg);
    }
    return rest.toArray(String[]::new);
  }
}
