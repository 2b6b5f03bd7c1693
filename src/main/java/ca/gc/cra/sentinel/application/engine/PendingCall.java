package ca.gc.cra.sentinel.application.engine;

import ca.gc.cra.sentinel.domain.task.TaskId;
import ca.gc.cra.sentinel.domain.task.TaskResult;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Outstanding call tracked by {@link ResultCorrelator} from {@code track()} until it settles.
 */
final class PendingCall {
  private final TaskId taskId;
  private final CompletableFuture<TaskResult> future = new CompletableFuture<>();
  private volatile ScheduledFuture<?> timer;

  PendingCall(TaskId taskId) {
    this.taskId = taskId;
  }

  TaskId taskId() {
    return taskId;
  }

  CompletableFuture<TaskResult> future() {
    return future;
  }

  void attachTimer(ScheduledFuture<?> timer) {
    this.timer = timer;
  }

  void cancelTimer() {
    ScheduledFuture<?> current = timer;
    if (current != null) {
      current.cancel(false);
    }
  }
}
