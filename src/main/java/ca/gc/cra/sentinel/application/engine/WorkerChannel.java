package ca.gc.cra.sentinel.application.engine;

import ca.gc.cra.sentinel.domain.worker.WorkerReply;

/**
 * Outbound channel from a worker to the coordinator that owns it.
 *
 * <p>Implementations hand messages over without blocking; the worker never observes coordinator
 * state.</p>
 *
 * @since 0.1.0
 */
public interface WorkerChannel {
  /**
   * Delivers a protocol reply.
   *
   * @param reply reply emitted by the worker
   */
  void onReply(WorkerReply reply);

  /**
   * Signals that the worker thread is exiting.
   *
   * @param workerId exiting worker
   * @param cause error that ended the worker, or {@code null} for a normal or interrupted exit
   */
  void onExit(int workerId, Throwable cause);
}
