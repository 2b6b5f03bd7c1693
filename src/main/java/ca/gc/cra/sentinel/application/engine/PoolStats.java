package ca.gc.cra.sentinel.application.engine;

/**
 * Point-in-time snapshot of worker pool counters.
 *
 * @param submitted tasks accepted by {@code submit}
 * @param completed tasks resolved with a result
 * @param failed tasks rejected with {@link TaskExecutionException}
 * @param timedOut tasks whose deadline expired
 * @param crashed workers that terminated unexpectedly
 * @param respawns replacement workers spawned
 * @param rejected submissions refused with {@link QueueFullException}
 * @param lateReplies results or failures discarded because their call had already settled
 * @param liveWorkers workers not yet terminated
 * @param busyWorkers workers running a task
 * @param idleWorkers workers waiting for a task
 * @param queuedTasks tasks waiting in the queue
 * @param pendingCalls calls tracked by the correlator
 * @param busyHighWater highest number of simultaneously busy workers
 * @param averageProcessingMillis mean time a task spent on its worker
 * @since 0.1.0
 */
public record PoolStats(
    long submitted,
    long completed,
    long failed,
    long timedOut,
    long crashed,
    long respawns,
    long rejected,
    long lateReplies,
    int liveWorkers,
    int busyWorkers,
    int idleWorkers,
    int queuedTasks,
    int pendingCalls,
    int busyHighWater,
    long averageProcessingMillis) {}
