package ca.gc.cra.sentinel.application.engine;

/**
 * Checked exception thrown when the worker pool cannot bring every worker to READY.
 *
 * @since 0.1.0
 */
public final class PoolInitException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public PoolInitException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause worker failure or interruption that aborted startup
   */
  public PoolInitException(String msg, Throwable cause) { super(msg, cause); }
}
