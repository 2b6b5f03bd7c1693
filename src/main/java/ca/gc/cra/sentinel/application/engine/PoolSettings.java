package ca.gc.cra.sentinel.application.engine;

/**
 * Worker pool tuning parameters.
 *
 * @param maxWorkers number of workers kept alive
 * @param perTaskTimeoutMs default deadline per task, measured from submission
 * @param queueCapacity maximum tasks buffered while every worker is busy
 * @param shutdownGraceMs time {@link WorkerPool#shutdown()} waits before force-terminating workers
 * @param workerRespawnRetryBudget replacements spawned for crashed workers over the pool's lifetime
 * @param startupTimeoutMs time {@link WorkerPool#initialize()} waits for every worker to report READY
 * @since 0.1.0
 */
public record PoolSettings(
    int maxWorkers,
    long perTaskTimeoutMs,
    int queueCapacity,
    long shutdownGraceMs,
    int workerRespawnRetryBudget,
    long startupTimeoutMs) {

  public static final int DEFAULT_MAX_WORKERS = 4;
  public static final long DEFAULT_TASK_TIMEOUT_MS = 60_000L;
  public static final int DEFAULT_QUEUE_CAPACITY = 256;
  public static final long DEFAULT_SHUTDOWN_GRACE_MS = 10_000L;
  public static final int DEFAULT_RESPAWN_BUDGET = 3;
  public static final long DEFAULT_STARTUP_TIMEOUT_MS = 10_000L;

  /**
   * Normalizes settings by clamping counts and timeouts to their minimums.
   */
  public PoolSettings {
    maxWorkers = Math.max(1, maxWorkers);
    perTaskTimeoutMs = Math.max(1L, perTaskTimeoutMs);
    queueCapacity = Math.max(0, queueCapacity);
    shutdownGraceMs = Math.max(0L, shutdownGraceMs);
    workerRespawnRetryBudget = Math.max(0, workerRespawnRetryBudget);
    startupTimeoutMs = Math.max(1L, startupTimeoutMs);
  }

  /**
   * Derives settings using the engine defaults.
   *
   * @return default settings
   */
  public static PoolSettings defaults() {
    return new PoolSettings(
        DEFAULT_MAX_WORKERS,
        DEFAULT_TASK_TIMEOUT_MS,
        DEFAULT_QUEUE_CAPACITY,
        DEFAULT_SHUTDOWN_GRACE_MS,
        DEFAULT_RESPAWN_BUDGET,
        DEFAULT_STARTUP_TIMEOUT_MS);
  }
}
