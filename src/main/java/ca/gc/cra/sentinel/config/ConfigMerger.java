package ca.gc.cra.sentinel.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective flat configuration.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML settings for the mode
   * @param cli CLI overrides; may be empty
   * @param defaults embedded defaults for the mode
   * @param warn receives override and consistency warnings; may be {@code null}
   * @return immutable merged map
   * @throws IllegalArgumentException when YAML names keys the mode does not know
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Consumer<String> warnings = warn == null ? message -> {} : warn;
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());

    for (String key : yamlCopy.keySet()) {
      if (!defaultsCopy.isEmpty() && !defaultsCopy.containsKey(key)) {
        throw new IllegalArgumentException("Unknown " + mode + " configuration key in YAML: " + key);
      }
    }

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        if (entry.getKey() == null || entry.getValue() == null) {
          continue;
        }
        if (yamlCopy.containsKey(entry.getKey())) {
          warnings.accept("CLI overrides YAML for key: " + entry.getKey());
        }
        merged.put(entry.getKey(), entry.getValue());
      }
    }

    checkTimeouts(merged, warnings);
    return Map.copyOf(merged);
  }

  private static void checkTimeouts(Map<String, String> effective, Consumer<String> warn) {
    Long perTask = parseOrNull(effective.get("perTaskTimeoutMs"));
    Long batch = parseOrNull(effective.get("batchTimeoutMs"));
    if (perTask != null && batch != null && batch < perTask) {
      warn.accept("batchTimeoutMs (" + batch + ") is shorter than perTaskTimeoutMs (" + perTask
          + "); slow tasks will be reported as batch timeouts");
    }
  }

  private static Long parseOrNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      return null;
    }
  }
}
