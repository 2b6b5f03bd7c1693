package ca.gc.cra.sentinel.application.engine;

/**
 * Checked exception signalling that {@link WorkerPool#submit} did not accept a task.
 *
 * @since 0.1.0
 */
public abstract class SubmissionRejectedException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  protected SubmissionRejectedException(String msg) { super(msg); }
}
