package ca.gc.cra.sentinel.application.analysis;

import ca.gc.cra.sentinel.domain.task.TaskPayload;
import ca.gc.cra.sentinel.domain.task.TaskResult;

/**
 * Pure analysis pass over one file.
 *
 * <p>Implementations run on a worker thread and must not share mutable state with other workers.
 * Throwing an {@link Exception} fails only the current task; throwing an {@link Error} ends the
 * worker.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface AnalysisFunction {
  /**
   * Analyses a file.
   *
   * @param analyzerName analyzer name as requested by the task; echoed into the result
   * @param payload file path, content and options
   * @return analysis result; never {@code null}
   * @throws Exception if analysis fails for this file
   */
  TaskResult analyze(String analyzerName, TaskPayload payload) throws Exception;
}
