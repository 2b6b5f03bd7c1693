package ca.gc.cra.sentinel.api;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Helpers shared by CLI commands that mix flags with {@code key=value} configuration.
 */
final class ConfigCliUtils {
  private static final Map<String, String> FLAG_KEYS = Map.of(
      "--dry-run", "dryRun",
      "--sequential", "sequential",
      "--reduce-false-positives", "reduceFalsePositives");

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} path argument.
   *
   * @param args mutable CLI map
   * @return trimmed path or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Maps boolean flags onto their configuration keys, overriding any merged value.
   *
   * @param input parsed CLI input
   * @param target mutable configuration map
   */
  static void applyFlags(CliInput input, Map<String, String> target) {
    for (Map.Entry<String, String> entry : FLAG_KEYS.entrySet()) {
      if (input.hasFlag(entry.getKey())) {
        target.put(entry.getValue(), "true");
      }
    }
  }

  /**
   * Resolves the report format.
   *
   * @param raw {@code text}, {@code json} or blank
   * @return {@code true} for JSON output
   * @throws IllegalArgumentException for other values
   */
  static boolean parseFormat(String raw) {
    String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    return switch (value) {
      case "", "text" -> false;
      case "json" -> true;
      default -> throw new IllegalArgumentException("format must be 'text' or 'json' (was '" + raw + "')");
    };
  }

  /**
   * Lists flags that no command understands.
   *
   * @param input parsed CLI input
   * @return unknown flags, empty when all are recognized
   */
  static List<String> unknownFlags(CliInput input) {
    return input.flags().stream()
        .filter(flag -> !FLAG_KEYS.containsKey(flag) && !flag.equals("--help") && !flag.equals("--verbose"))
        .sorted()
        .toList();
  }
}
