package ca.gc.cra.sentinel.application.engine;

/**
 * Outcome of {@link WorkerPool#shutdown()}.
 *
 * @param workersStopped workers that acknowledged SHUTDOWN
 * @param workersForceTerminated workers interrupted after the grace period
 * @param inFlightRejected in-flight calls rejected because their worker was force-terminated
 * @param queuedRejected queued calls rejected because no worker remained to run them
 * @param durationMillis time from the start of shutdown until every worker was gone
 * @since 0.1.0
 */
public record ShutdownSummary(
    int workersStopped,
    int workersForceTerminated,
    int inFlightRejected,
    int queuedRejected,
    long durationMillis) {

  /**
   * @return {@code true} when every worker exited on its own
   */
  public boolean graceful() {
    return workersForceTerminated == 0;
  }
}
