package ca.gc.cra.sentinel.application.engine;

import ca.gc.cra.sentinel.domain.task.TaskId;

/**
 * Raised when a task's deadline passes before its worker replied.
 *
 * @since 0.1.0
 */
public final class TaskTimeoutException extends TaskFailedException {
  private final long timeoutMillis;

  /**
   * Creates a timeout failure.
   *
   * @param taskId expired task
   * @param timeoutMillis deadline that elapsed, measured from submission
   */
  public TaskTimeoutException(TaskId taskId, long timeoutMillis) {
    super(taskId, "timed out after " + timeoutMillis + " ms", null);
    this.timeoutMillis = timeoutMillis;
  }

  public long timeoutMillis() {
    return timeoutMillis;
  }
}
