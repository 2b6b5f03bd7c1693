package ca.gc.cra.sentinel.application.pipeline;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Per-batch options for {@link AnalysisOrchestrator#process}.
 *
 * @param analyzers analyzer names run against every file, in reporting order
 * @param sequential submit one task at a time instead of the whole batch at once
 * @param reduceFalsePositives hand each file's merged issues to the configured post-processor
 * @param taskOptions analyzer options copied into every task payload
 * @since 0.1.0
 */
public record AnalysisOptions(
    List<String> analyzers,
    boolean sequential,
    boolean reduceFalsePositives,
    Map<String, String> taskOptions) {

  /** Analyzers run when none are requested. */
  public static final List<String> DEFAULT_ANALYZERS = List.of("security", "quality", "bugs", "performance");

  /**
   * Normalizes analyzer names to lower case and falls back to {@link #DEFAULT_ANALYZERS}.
   */
  public AnalysisOptions {
    if (analyzers == null || analyzers.isEmpty()) {
      analyzers = DEFAULT_ANALYZERS;
    } else {
      analyzers = analyzers.stream()
          .map(name -> Objects.requireNonNull(name, "analyzer").trim().toLowerCase(Locale.ROOT))
          .filter(name -> !name.isEmpty())
          .distinct()
          .toList();
      if (analyzers.isEmpty()) {
        analyzers = DEFAULT_ANALYZERS;
      }
    }
    taskOptions = taskOptions == null ? Map.of() : Map.copyOf(taskOptions);
  }

  /**
   * Default options: the four core analyzers, parallel submission, no post-processing.
   *
   * @return default options
   */
  public static AnalysisOptions defaults() {
    return new AnalysisOptions(DEFAULT_ANALYZERS, false, false, Map.of());
  }

  public AnalysisOptions withAnalyzers(List<String> names) {
    return new AnalysisOptions(names, sequential, reduceFalsePositives, taskOptions);
  }

  public AnalysisOptions withSequential(boolean value) {
    return new AnalysisOptions(analyzers, value, reduceFalsePositives, taskOptions);
  }

  public AnalysisOptions withReduceFalsePositives(boolean value) {
    return new AnalysisOptions(analyzers, sequential, value, taskOptions);
  }
}
