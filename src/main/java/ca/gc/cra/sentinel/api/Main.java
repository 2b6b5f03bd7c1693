package ca.gc.cra.sentinel.api;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SENTINEL CLI dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: sentinel analyze [options]";
  private static final String HELP_TEXT = """
      SENTINEL parallel code analysis

      Usage:
        sentinel <command> [options]

      Commands:
        analyze     Run analyzers over a directory (analyze --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches to a command without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token names the command
   * @return exit code of the command
   */
  static ExitCode run(String[] args) {
    String[] raw = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < raw.length; i++) {
      if (raw[i] != null && !raw[i].isBlank() && !raw[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(raw);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = raw[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = new String[raw.length - 1];
    System.arraycopy(raw, 0, delegateArgs, 0, commandIndex);
    System.arraycopy(raw, commandIndex + 1, delegateArgs, commandIndex, raw.length - commandIndex - 1);

    if (command.equals("analyze")) {
      return AnalyzeCli.run(delegateArgs);
    }
    log.error("Unknown command: {}", command);
    CliPrinter.println(SUMMARY_USAGE);
    return ExitCode.INVALID_ARGS;
  }
}
