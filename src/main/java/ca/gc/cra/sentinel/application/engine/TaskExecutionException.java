package ca.gc.cra.sentinel.application.engine;

import ca.gc.cra.sentinel.domain.task.TaskId;

/**
 * Raised when an analyzer threw an exception that its worker reported as an ERROR reply.
 *
 * @since 0.1.0
 */
public final class TaskExecutionException extends TaskFailedException {
  /**
   * Creates an execution failure.
   *
   * @param taskId failed task
   * @param message error message reported by the worker
   */
  public TaskExecutionException(TaskId taskId, String message) {
    super(taskId, message, null);
  }
}
