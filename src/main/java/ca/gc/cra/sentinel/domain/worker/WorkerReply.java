package ca.gc.cra.sentinel.domain.worker;

import ca.gc.cra.sentinel.domain.task.TaskId;
import ca.gc.cra.sentinel.domain.task.TaskResult;
import java.util.Objects;

/**
 * <strong>What:</strong> Outbound message emitted by a worker to the pool coordinator.
 * <p><strong>Role:</strong> The only way a worker reports readiness, results, failures and exit.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; created on the worker thread and consumed on
 * the coordinator thread.</p>
 *
 * @param type reply discriminator
 * @param workerId id of the emitting worker
 * @param taskId task the reply refers to; present for RESULT and ERROR
 * @param result analysis result for RESULT
 * @param error failure message for ERROR
 * @since 0.1.0
 */
public record WorkerReply(Type type, int workerId, TaskId taskId, TaskResult result, String error) {

  /** Reply discriminator. */
  public enum Type {
    /** One-time setup finished. */
    READY,
    /** Task completed with a result. */
    RESULT,
    /** Task failed with an exception. */
    ERROR,
    /** Shutdown acknowledged; the worker exits next. */
    SHUTDOWN_COMPLETE
  }

  /**
   * Validates per-type required fields.
   */
  public WorkerReply {
    Objects.requireNonNull(type, "type");
    switch (type) {
      case RESULT -> {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(result, "result");
      }
      case ERROR -> {
        Objects.requireNonNull(taskId, "taskId");
        error = error == null || error.isBlank() ? "unknown error" : error;
      }
      default -> {
        // READY and SHUTDOWN_COMPLETE carry only the worker id
      }
    }
  }

  public static WorkerReply ready(int workerId) {
    return new WorkerReply(Type.READY, workerId, null, null, null);
  }

  public static WorkerReply result(int workerId, TaskId taskId, TaskResult result) {
    return new WorkerReply(Type.RESULT, workerId, taskId, result, null);
  }

  public static WorkerReply error(int workerId, TaskId taskId, String error) {
    return new WorkerReply(Type.ERROR, workerId, taskId, null, error);
  }

  public static WorkerReply shutdownComplete(int workerId) {
    return new WorkerReply(Type.SHUTDOWN_COMPLETE, workerId, null, null, null);
  }
}
