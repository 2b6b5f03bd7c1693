package ca.gc.cra.sentinel.domain.task;

import java.util.Objects;

/**
 * <strong>What:</strong> One unit of analysis work: a single file run through a single analyzer.
 * <p><strong>Role:</strong> Created by the orchestrator, routed by the worker pool and executed by
 * exactly one worker.</p>
 * <p><strong>Thread-safety:</strong> Immutable once created; crosses the worker message channel by
 * reference without copying.</p>
 *
 * @param id unique task identifier
 * @param analyzerName operation name resolved by the worker; unknown names yield empty results
 * @param payload file content and options
 * @since 0.1.0
 */
public record AnalysisTask(TaskId id, String analyzerName, TaskPayload payload) {

  /**
   * Validates required components.
   */
  public AnalysisTask {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(analyzerName, "analyzerName");
    Objects.requireNonNull(payload, "payload");
  }

  /**
   * Convenience accessor for the analysed file path.
   *
   * @return file path from the payload
   */
  public String filePath() {
    return payload.filePath();
  }
}
