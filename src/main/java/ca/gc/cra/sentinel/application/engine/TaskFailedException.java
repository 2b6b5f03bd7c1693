package ca.gc.cra.sentinel.application.engine;

import ca.gc.cra.sentinel.domain.task.TaskId;
import java.util.Objects;

/**
 * <strong>What:</strong> Base type for per-task failures delivered through a task's future.
 * <p><strong>Why:</strong> A failed task degrades only its own file's result; callers switch on the
 * subtype and surface {@link #reason()} in partial-result notices.</p>
 *
 * @since 0.1.0
 */
public abstract class TaskFailedException extends Exception {
  private final TaskId taskId;
  private final String reason;

  /**
   * Creates a failure for the given task.
   *
   * @param taskId failed task
   * @param reason short reason rendered in notices
   * @param cause optional underlying cause
   */
  protected TaskFailedException(TaskId taskId, String reason, Throwable cause) {
    super("Task " + taskId + " failed: " + reason, cause);
    this.taskId = Objects.requireNonNull(taskId, "taskId");
    this.reason = reason == null || reason.isBlank() ? "unknown" : reason;
  }

  /**
   * @return id of the failed task
   */
  public TaskId taskId() {
    return taskId;
  }

  /**
   * @return short human-readable reason
   */
  public String reason() {
    return reason;
  }
}
