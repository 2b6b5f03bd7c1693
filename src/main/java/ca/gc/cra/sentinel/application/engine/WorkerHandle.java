package ca.gc.cra.sentinel.application.engine;

import ca.gc.cra.sentinel.domain.task.AnalysisTask;
import ca.gc.cra.sentinel.domain.task.TaskId;
import ca.gc.cra.sentinel.domain.worker.WorkerCommand;
import ca.gc.cra.sentinel.domain.worker.WorkerState;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Coordinator-side view of one worker. Confined to the coordinator thread.
 */
final class WorkerHandle {
  private final int workerId;
  private final AnalysisWorker worker;
  private final Thread thread;
  private final boolean replacement;

  private WorkerState state = WorkerState.STARTING;
  private TaskId currentTask;
  private long dispatchedAtNanos;

  WorkerHandle(AnalysisWorker worker, Thread thread, boolean replacement) {
    this.worker = Objects.requireNonNull(worker, "worker");
    this.thread = Objects.requireNonNull(thread, "thread");
    this.workerId = worker.workerId();
    this.replacement = replacement;
  }

  int workerId() {
    return workerId;
  }

  WorkerState state() {
    return state;
  }

  TaskId currentTask() {
    return currentTask;
  }

  boolean isReplacement() {
    return replacement;
  }

  boolean isLive() {
    return state.isLive();
  }

  void start() {
    thread.start();
  }

  void markIdle() {
    state = WorkerState.IDLE;
  }

  void assign(AnalysisTask task, long nowNanos) {
    if (state != WorkerState.IDLE) {
      throw new IllegalStateException("worker " + workerId + " is " + state + ", cannot take " + task.id());
    }
    state = WorkerState.BUSY;
    currentTask = task.id();
    dispatchedAtNanos = nowNanos;
    worker.deliver(WorkerCommand.task(task));
  }

  /**
   * Clears the in-flight task.
   *
   * @return milliseconds the task spent on this worker
   */
  long release() {
    long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - dispatchedAtNanos);
    currentTask = null;
    dispatchedAtNanos = 0L;
    return elapsed;
  }

  void requestShutdown() {
    if (state == WorkerState.SHUTTING_DOWN || state == WorkerState.TERMINATED) {
      return;
    }
    state = WorkerState.SHUTTING_DOWN;
    worker.deliver(WorkerCommand.shutdown());
  }

  void markTerminated() {
    state = WorkerState.TERMINATED;
  }

  void forceTerminate() {
    state = WorkerState.TERMINATED;
    thread.interrupt();
  }
}
