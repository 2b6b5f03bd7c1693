package ca.gc.cra.sentinel.application.analysis;

import ca.gc.cra.sentinel.domain.task.AnalysisTask;
import ca.gc.cra.sentinel.domain.task.TaskPayload;
import ca.gc.cra.sentinel.domain.task.TaskResult;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Table of named analysis functions owned by a single worker.
 * <p><strong>Why:</strong> Each worker builds its own registry during startup, so analyzers never
 * share mutable state across workers.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; intended for one worker thread.</p>
 *
 * @since 0.1.0
 */
public final class AnalyzerRegistry {
  private final Map<AnalyzerId, AnalysisFunction> functions;

  private AnalyzerRegistry(Map<AnalyzerId, AnalysisFunction> functions) {
    this.functions = functions;
  }

  /**
   * Builds the registry of built-in analyzers.
   *
   * @return registry covering every {@link AnalyzerId}
   */
  public static AnalyzerRegistry defaults() {
    return builder().build();
  }

  /**
   * Starts a registry pre-populated with the built-in analyzers; individual entries may be replaced.
   *
   * @return builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs the analyzer named by the task.
   *
   * @param task task to execute
   * @return analysis result; unknown analyzer names yield an empty result
   * @throws Exception if the analyzer fails
   */
  public TaskResult run(AnalysisTask task) throws Exception {
    AnalyzerId id = AnalyzerId.fromName(task.analyzerName());
    TaskResult result = functions.get(id).analyze(task.analyzerName(), task.payload());
    return Objects.requireNonNull(result, "analyzer " + id + " returned null");
  }

  static AnalysisFunction builtIn(AnalyzerId id) {
    return switch (id) {
      case SECURITY -> SecurityRules::analyze;
      case QUALITY -> QualityRules::analyze;
      case BUGS -> BugRules::analyze;
      case PERFORMANCE -> PerformanceRules::analyze;
      case SECRETS -> SecretRules::analyze;
      case UNKNOWN -> AnalyzerRegistry::empty;
    };
  }

  private static TaskResult empty(String analyzerName, TaskPayload payload) {
    return TaskResult.empty(analyzerName, payload.filePath(), LineRuleScanner.lines(payload.content()).length);
  }

  /**
   * Builder seeded with the built-in analyzers.
   */
  public static final class Builder {
    private final EnumMap<AnalyzerId, AnalysisFunction> functions = new EnumMap<>(AnalyzerId.class);

    private Builder() {
      for (AnalyzerId id : AnalyzerId.values()) {
        functions.put(id, builtIn(id));
      }
    }

    /**
     * Replaces the function registered for {@code id}.
     *
     * @param id analyzer to replace
     * @param function replacement function
     * @return this builder
     */
    public Builder register(AnalyzerId id, AnalysisFunction function) {
      functions.put(Objects.requireNonNull(id, "id"), Objects.requireNonNull(function, "function"));
      return this;
    }

    public AnalyzerRegistry build() {
      return new AnalyzerRegistry(new EnumMap<>(functions));
    }
  }
}
