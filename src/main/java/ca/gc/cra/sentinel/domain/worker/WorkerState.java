package ca.gc.cra.sentinel.domain.worker;

/**
 * Lifecycle state of a worker as tracked by the pool coordinator.
 *
 * @since 0.1.0
 */
public enum WorkerState {
  /** Thread started, one-time setup not yet acknowledged. */
  STARTING,
  /** Ready and waiting for a task. */
  IDLE,
  /** Executing exactly one task. */
  BUSY,
  /** SHUTDOWN sent, waiting for acknowledgement. */
  SHUTTING_DOWN,
  /** Exited, crashed or force-terminated; replies are ignored. */
  TERMINATED;

  /**
   * Indicates whether the worker may still send meaningful replies.
   *
   * @return {@code true} unless terminated
   */
  public boolean isLive() {
    return this != TERMINATED;
  }
}
