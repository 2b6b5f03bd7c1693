package ca.gc.cra.sentinel.application.port;

/**
 * <strong>What:</strong> Counters and observations emitted by the worker pool and the batch orchestrator.
 * <p><strong>Role:</strong> Port implemented by {@code OpenTelemetryMetricsAdapter}; tests substitute a
 * recording double.</p>
 * <p><strong>Names:</strong>
 * <ul>
 *   <li>{@code engine.task.*}: submitted, dispatched, completed, failed, timeout, crashed, late,
 *   skipped.expired and {@code latencyMs}.</li>
 *   <li>{@code engine.queue.*} and {@code engine.workers.*}: queue depth, busy and total workers.</li>
 *   <li>{@code engine.worker.*}: crashed, respawned, uncaught and retired.timedOut.</li>
 *   <li>{@code pipeline.*}: batch duration, degraded files, submit retries, suppressed issues.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Called from the coordinator, from worker threads and from batch
 * callers at once; implementations must tolerate concurrent updates.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Adds one to a counter.
   *
   * @param key dotted metric name such as {@code engine.task.completed}; never {@code null}
   */
  void increment(String key);

  /**
   * Records a sample; the unit is carried by the name suffix ({@code Ms}) or is a plain count.
   *
   * @param key dotted metric name; never {@code null}
   * @param value sample value
   */
  void observe(String key, long value);

  /** Discards every update; the default for pools built without telemetry. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
