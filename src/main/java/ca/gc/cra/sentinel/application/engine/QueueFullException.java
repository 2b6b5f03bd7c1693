package ca.gc.cra.sentinel.application.engine;

/**
 * Raised when every worker is busy and the task queue is at capacity.
 *
 * @since 0.1.0
 */
public final class QueueFullException extends SubmissionRejectedException {
  private final int capacity;

  /**
   * Creates an exception for a saturated queue.
   *
   * @param capacity configured queue capacity
   */
  public QueueFullException(int capacity) {
    super("Task queue full (capacity=" + capacity + ")");
    this.capacity = capacity;
  }

  /**
   * @return configured queue capacity at the time of rejection
   */
  public int capacity() {
    return capacity;
  }
}
