package ca.gc.cra.sentinel.application.engine;

import ca.gc.cra.sentinel.domain.task.AnalysisTask;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Bounded FIFO buffer of tasks waiting for an idle worker.
 * <p><strong>Why:</strong> Bounds memory under bursty submission and lets the pool reject work
 * explicitly instead of blocking callers.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the pool coordinator thread.</p>
 *
 * @since 0.1.0
 */
public final class TaskQueue {
  private final ArrayDeque<AnalysisTask> tasks = new ArrayDeque<>();
  private final int capacity;

  /**
   * Creates an empty queue.
   *
   * @param capacity maximum number of buffered tasks; {@code 0} disables buffering
   * @throws IllegalArgumentException if {@code capacity} is negative
   */
  public TaskQueue(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("capacity must be >= 0 (was " + capacity + ")");
    }
    this.capacity = capacity;
  }

  /**
   * Appends a task at the tail.
   *
   * @param task task to buffer
   * @return {@code false} when the queue is full and the task was not added
   */
  public boolean offer(AnalysisTask task) {
    Objects.requireNonNull(task, "task");
    if (tasks.size() >= capacity) {
      return false;
    }
    tasks.addLast(task);
    return true;
  }

  /**
   * Removes the oldest task.
   *
   * @return head of the queue, or empty when no task is waiting
   */
  public Optional<AnalysisTask> poll() {
    return Optional.ofNullable(tasks.pollFirst());
  }

  /**
   * Removes every waiting task in FIFO order.
   *
   * @return drained tasks, oldest first
   */
  public List<AnalysisTask> drain() {
    List<AnalysisTask> drained = new ArrayList<>(tasks);
    tasks.clear();
    return drained;
  }

  public int size() {
    return tasks.size();
  }

  public int capacity() {
    return capacity;
  }

  public boolean isEmpty() {
    return tasks.isEmpty();
  }

  public boolean isFull() {
    return tasks.size() >= capacity;
  }
}
