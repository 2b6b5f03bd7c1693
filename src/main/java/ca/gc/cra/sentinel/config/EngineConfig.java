package ca.gc.cra.sentinel.config;

import ca.gc.cra.sentinel.application.engine.PoolSettings;
import ca.gc.cra.sentinel.application.pipeline.AnalysisOptions;
import ca.gc.cra.sentinel.domain.issue.Severity;
import ca.gc.cra.sentinel.validation.Numbers;
import ca.gc.cra.sentinel.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Effective configuration for one {@code analyze} run.
 * <p><strong>Why:</strong> Gathers pool tuning, batch options and CLI-only switches into one validated
 * value so the composition root never parses strings.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param root directory scanned for source files
 * @param analyzers analyzer names run against every file
 * @param pool worker pool settings
 * @param batchTimeoutMs deadline for the whole batch
 * @param failOn lowest severity that makes the CLI exit with findings; empty disables the check
 * @param sequential submit one task at a time
 * @param reduceFalsePositives run the issue post-processor on merged results
 * @param maxFileBytes files above this size are not scanned
 * @param maxLineLength line length threshold for the quality analyzer
 * @param dryRun list the planned work without starting workers
 * @since 0.1.0
 */
public record EngineConfig(
    Path root,
    List<String> analyzers,
    PoolSettings pool,
    long batchTimeoutMs,
    Optional<Severity> failOn,
    boolean sequential,
    boolean reduceFalsePositives,
    long maxFileBytes,
    int maxLineLength,
    boolean dryRun) {

  public static final long DEFAULT_BATCH_TIMEOUT_MS = 300_000L;
  public static final long DEFAULT_MAX_FILE_BYTES = 1_000_000L;
  public static final int DEFAULT_MAX_LINE_LENGTH = 120;

  private static final long MAX_TIMEOUT_MS = 86_400_000L;

  /**
   * Normalizes optional values and validates ranges.
   *
   * @throws IllegalArgumentException if a value lies outside its supported range
   */
  public EngineConfig {
    root = Objects.requireNonNullElse(root, Path.of(".")).toAbsolutePath().normalize();
    analyzers = analyzers == null || analyzers.isEmpty() ? AnalysisOptions.DEFAULT_ANALYZERS : List.copyOf(analyzers);
    pool = Objects.requireNonNullElse(pool, PoolSettings.defaults());
    failOn = Objects.requireNonNullElse(failOn, Optional.empty());
    Numbers.requireRange("batchTimeoutMs", batchTimeoutMs, 1, MAX_TIMEOUT_MS);
    Numbers.requireRange("maxFileBytes", maxFileBytes, 1, Integer.MAX_VALUE);
    Numbers.requireRange("maxLineLength", maxLineLength, 1, 10_000);
  }

  /**
   * Returns the configuration used when no option is supplied.
   *
   * @return defaults scanning the working directory
   */
  public static EngineConfig defaults() {
    return new EngineConfig(
        Path.of("."),
        AnalysisOptions.DEFAULT_ANALYZERS,
        PoolSettings.defaults(),
        DEFAULT_BATCH_TIMEOUT_MS,
        Optional.empty(),
        false,
        false,
        DEFAULT_MAX_FILE_BYTES,
        DEFAULT_MAX_LINE_LENGTH,
        false);
  }

  /**
   * Builds a configuration from flattened key/value pairs; absent keys keep their defaults.
   *
   * @param options keys such as {@code root}, {@code maxWorkers}, {@code failOn}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static EngineConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    EngineConfig defaults = defaults();
    PoolSettings pool = defaults.pool();

    Path root = defaults.root();
    String rootRaw = trimToNull(options.get("root"));
    if (rootRaw != null) {
      try {
        root = Path.of(rootRaw);
      } catch (InvalidPathException ex) {
        throw new IllegalArgumentException("root is not a valid path: " + rootRaw, ex);
      }
    }

    List<String> analyzers = defaults.analyzers();
    String analyzersRaw = trimToNull(options.get("analyzers"));
    if (analyzersRaw != null) {
      analyzers = Strings.splitIdentifiers("analyzers", analyzersRaw);
    }

    PoolSettings settings = new PoolSettings(
        (int) longValue(options, "maxWorkers", pool.maxWorkers(), 1, 256),
        longValue(options, "perTaskTimeoutMs", pool.perTaskTimeoutMs(), 1, MAX_TIMEOUT_MS),
        (int) longValue(options, "queueCapacity", pool.queueCapacity(), 0, 1_000_000),
        longValue(options, "shutdownGraceMs", pool.shutdownGraceMs(), 0, MAX_TIMEOUT_MS),
        (int) longValue(options, "workerRespawnRetryBudget", pool.workerRespawnRetryBudget(), 0, 10_000),
        longValue(options, "startupTimeoutMs", pool.startupTimeoutMs(), 1, MAX_TIMEOUT_MS));

    return new EngineConfig(
        root,
        analyzers,
        settings,
        longValue(options, "batchTimeoutMs", defaults.batchTimeoutMs(), 1, MAX_TIMEOUT_MS),
        parseFailOn(options.get("failOn")),
        booleanValue(options, "sequential", defaults.sequential()),
        booleanValue(options, "reduceFalsePositives", defaults.reduceFalsePositives()),
        longValue(options, "maxFileBytes", defaults.maxFileBytes(), 1, Integer.MAX_VALUE),
        (int) longValue(options, "maxLineLength", defaults.maxLineLength(), 1, 10_000),
        booleanValue(options, "dryRun", defaults.dryRun()));
  }

  /**
   * Batch options derived from this configuration.
   *
   * @return orchestrator options
   */
  public AnalysisOptions analysisOptions() {
    return new AnalysisOptions(
        analyzers, sequential, reduceFalsePositives, Map.of("maxLineLength", Integer.toString(maxLineLength)));
  }

  private static Optional<Severity> parseFailOn(String raw) {
    String value = trimToNull(raw);
    if (value == null || value.toLowerCase(Locale.ROOT).equals("none")) {
      return Optional.empty();
    }
    return Optional.of(Severity.parse(value));
  }

  private static long longValue(Map<String, String> options, String key, long fallback, long min, long max) {
    String raw = trimToNull(options.get(key));
    return raw == null ? fallback : Numbers.parseRange(key, raw, min, max);
  }

  private static boolean booleanValue(Map<String, String> options, String key, boolean fallback) {
    String raw = trimToNull(options.get(key));
    if (raw == null) {
      return fallback;
    }
    return switch (raw.toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + raw + "')");
    };
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
