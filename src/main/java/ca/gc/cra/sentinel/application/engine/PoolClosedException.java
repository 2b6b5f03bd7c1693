package ca.gc.cra.sentinel.application.engine;

/**
 * Raised when the pool is not accepting work: never initialized, shutting down, closed or out of
 * live workers. Also completes calls abandoned by a forced shutdown.
 *
 * @since 0.1.0
 */
public final class PoolClosedException extends SubmissionRejectedException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public PoolClosedException(String msg) { super(msg); }
}
