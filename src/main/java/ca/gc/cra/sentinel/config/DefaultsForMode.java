package ca.gc.cra.sentinel.config;

import ca.gc.cra.sentinel.application.engine.PoolSettings;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Flattened default configuration for each CLI mode; the single source of truth for optional keys.
 */
public final class DefaultsForMode {
  private DefaultsForMode() {}

  /**
   * Returns defaults for {@code mode} merged over the common defaults.
   *
   * @param mode CLI mode ({@code analyze})
   * @return unmodifiable key/value map
   * @throws IllegalArgumentException for unknown modes
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(common());
    defaults.putAll(switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "analyze" -> analyze();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> common() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return map;
  }

  private static Map<String, String> analyze() {
    EngineConfig defaults = EngineConfig.defaults();
    PoolSettings pool = defaults.pool();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("root", ".");
    map.put("analyzers", String.join(",", defaults.analyzers()));
    map.put("maxWorkers", Integer.toString(pool.maxWorkers()));
    map.put("perTaskTimeoutMs", Long.toString(pool.perTaskTimeoutMs()));
    map.put("queueCapacity", Integer.toString(pool.queueCapacity()));
    map.put("shutdownGraceMs", Long.toString(pool.shutdownGraceMs()));
    map.put("workerRespawnRetryBudget", Integer.toString(pool.workerRespawnRetryBudget()));
    map.put("startupTimeoutMs", Long.toString(pool.startupTimeoutMs()));
    map.put("batchTimeoutMs", Long.toString(defaults.batchTimeoutMs()));
    map.put("failOn", "none");
    map.put("sequential", "false");
    map.put("reduceFalsePositives", "false");
    map.put("maxFileBytes", Long.toString(defaults.maxFileBytes()));
    map.put("maxLineLength", Integer.toString(defaults.maxLineLength()));
    map.put("dryRun", "false");
    map.put("format", "text");
    return map;
  }
}
