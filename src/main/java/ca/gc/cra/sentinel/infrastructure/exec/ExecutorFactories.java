package ca.gc.cra.sentinel.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;

/**
 * Factory helpers for the threads backing the analysis engine.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds the single-threaded scheduler that owns all pool, queue and correlator state.
   *
   * <p>Cancelled timers are removed eagerly and delayed tasks are dropped once the executor shuts down,
   * so outstanding task timeouts never keep a closed pool alive.</p>
   *
   * @param name thread name
   * @param handler uncaught exception handler installed on the thread
   * @return configured scheduler
   */
  public static ScheduledExecutorService newCoordinator(String name, UncaughtExceptionHandler handler) {
    String threadName = (name == null || name.isBlank()) ? "sentinel-coordinator" : name;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadName);
          thread.setDaemon(false);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };
    ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, factory);
    executor.setRemoveOnCancelPolicy(true);
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    return executor;
  }

  /**
   * Creates (but does not start) a dedicated worker thread.
   *
   * <p>Worker threads are daemons: a worker stuck inside an analyzer after force-termination must not
   * keep the JVM alive.</p>
   *
   * @param prefix thread-name prefix used to tag worker threads
   * @param workerId worker identifier appended to the name
   * @param body worker loop
   * @param handler uncaught exception handler installed on the thread
   * @return unstarted thread
   */
  public static Thread newWorkerThread(String prefix, int workerId, Runnable body, UncaughtExceptionHandler handler) {
    Objects.requireNonNull(body, "body");
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "sentinel-worker" : prefix;
    Thread thread = new Thread(body, threadPrefix + "-" + workerId);
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler(Objects.requireNonNullElse(handler, (t, ex) -> {}));
    return thread;
  }
}
