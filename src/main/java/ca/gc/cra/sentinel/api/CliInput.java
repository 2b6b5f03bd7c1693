package ca.gc.cra.sentinel.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command-line arguments split into normalized flags and {@code key=value} tokens.
 */
public final class CliInput {
  private static final Map<String, String> ALIASES = Map.of(
      "-h", "--help",
      "help", "--help",
      "-v", "--verbose",
      "--debug", "--verbose",
      "-n", "--dry-run",
      "-s", "--sequential");

  private final String[] keyValueArgs;
  private final Set<String> flags;

  private CliInput(String[] keyValueArgs, Set<String> flags) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  /**
   * Parses raw arguments; anything starting with {@code -} and lacking {@code =} is a flag.
   *
   * @param args raw arguments; may be {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        if (ALIASES.containsKey(lower)) {
          flags.add(ALIASES.get(lower));
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          flags.add(lower);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(kv.toArray(String[]::new), Set.copyOf(flags));
  }

  /**
   * Returns a copy of the non-flag arguments in their original order.
   *
   * @return positional and {@code key=value} arguments
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks for a normalized flag such as {@code --dry-run}.
   *
   * @param flag flag name, case-insensitive
   * @return {@code true} if supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  public Set<String> flags() {
    return flags;
  }
}
