package ca.gc.cra.sentinel.application.engine;

import ca.gc.cra.sentinel.domain.task.TaskId;

/**
 * Raised when the worker executing a task terminated without replying.
 *
 * @since 0.1.0
 */
public final class WorkerCrashedException extends TaskFailedException {
  private final int workerId;

  /**
   * Creates a crash failure.
   *
   * @param taskId task that was in flight
   * @param workerId crashed worker
   * @param cause error that ended the worker, or {@code null} when unknown
   */
  public WorkerCrashedException(TaskId taskId, int workerId, Throwable cause) {
    super(taskId, "worker " + workerId + " crashed" + describe(cause), cause);
    this.workerId = workerId;
  }

  public int workerId() {
    return workerId;
  }

  private static String describe(Throwable cause) {
    if (cause == null) {
      return "";
    }
    String message = cause.getMessage();
    return message == null || message.isBlank()
        ? " (" + cause.getClass().getSimpleName() + ")"
        : " (" + cause.getClass().getSimpleName() + ": " + message + ")";
  }
}
