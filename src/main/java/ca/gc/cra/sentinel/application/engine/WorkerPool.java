package ca.gc.cra.sentinel.application.engine;

import ca.gc.cra.sentinel.application.analysis.AnalyzerRegistry;
import ca.gc.cra.sentinel.application.port.EngineEventSink;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.domain.events.EngineEvent;
import ca.gc.cra.sentinel.domain.task.AnalysisTask;
import ca.gc.cra.sentinel.domain.task.TaskId;
import ca.gc.cra.sentinel.domain.task.TaskResult;
import ca.gc.cra.sentinel.domain.worker.WorkerReply;
import ca.gc.cra.sentinel.domain.worker.WorkerState;
import ca.gc.cra.sentinel.infrastructure.exec.ExecutorFactories;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fixed pool of {@link AnalysisWorker}s fed through a bounded {@link TaskQueue}.
 * <p><strong>Why:</strong> Runs independent analysis tasks in parallel while keeping crashes, hangs and
 * shutdown under the control of a single coordinator.</p>
 * <p><strong>Concurrency:</strong> Worker handles, the queue and all counters are owned by one
 * coordinator thread. {@link #submit}, {@link #shutdown} and {@link #stats} hop onto it; worker
 * replies, worker exits and timeout timers arrive there as tasks. Workers share nothing with the
 * coordinator except their inbox and the {@link WorkerChannel}.</p>
 * <p><strong>Lifecycle:</strong> {@link #initialize()} once, any number of {@link #submit} calls, then
 * {@link #shutdown()}. Instances are not reusable.</p>
 * <p><strong>Metrics:</strong> {@code engine.task.*}, {@code engine.queue.*}, {@code engine.worker.*},
 * {@code engine.workers.busy} and {@code engine.shutdown.forced}.</p>
 *
 * @since 0.1.0
 */
public final class WorkerPool implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
  private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();
  private static final long COORDINATOR_STOP_TIMEOUT_MS = 1_000L;

  private enum Phase {
    NEW,
    STARTING,
    RUNNING,
    DRAINING,
    CLOSED
  }

  private final PoolSettings settings;
  private final Callable<AnalyzerRegistry> workerSetup;
  private final MetricsPort metrics;
  private final EngineEventSink events;
  private final String name;
  private final ScheduledExecutorService coordinator;
  private final TaskQueue queue;
  private final ResultCorrelator correlator;
  private final WorkerChannel channel = new CoordinatorChannel();
  private final Map<Integer, WorkerHandle> workers = new LinkedHashMap<>();
  private final CompletableFuture<Void> startup = new CompletableFuture<>();
  private final CompletableFuture<ShutdownSummary> shutdownDone = new CompletableFuture<>();

  private volatile Thread coordinatorThread;
  private volatile PoolStats finalStats;

  // Coordinator-confined state.
  private Phase phase = Phase.NEW;
  private int nextWorkerId;
  private int respawnsUsed;
  private long submitted;
  private long completed;
  private long failed;
  private long timedOut;
  private long crashed;
  private long rejected;
  private long processingMillisTotal;
  private long processingSamples;
  private int busyHighWater;
  private long shutdownStartedNanos;
  private int workersStopped;
  private int workersForced;
  private int inFlightRejected;
  private int queuedRejected;
  private ScheduledFuture<?> graceTimer;

  /**
   * Creates a pool running the built-in analyzers without metrics or events.
   *
   * @param settings pool tuning
   */
  public WorkerPool(PoolSettings settings) {
    this(settings, AnalyzerRegistry::defaults, MetricsPort.NO_OP, EngineEventSink.NO_OP);
  }

  /**
   * Creates a pool.
   *
   * @param settings pool tuning
   * @param workerSetup one-time setup run on each worker thread; builds that worker's analyzers
   * @param metrics metrics sink
   * @param events lifecycle event sink private to this pool
   */
  public WorkerPool(
      PoolSettings settings,
      Callable<AnalyzerRegistry> workerSetup,
      MetricsPort metrics,
      EngineEventSink events) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.workerSetup = Objects.requireNonNull(workerSetup, "workerSetup");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.events = Objects.requireNonNull(events, "events");
    this.name = "sentinel-pool-" + POOL_SEQUENCE.incrementAndGet();
    this.coordinator = ExecutorFactories.newCoordinator(name + "-coordinator", this::handleCoordinatorCrash);
    this.coordinator.execute(() -> coordinatorThread = Thread.currentThread());
    this.queue = new TaskQueue(settings.queueCapacity());
    this.correlator = new ResultCorrelator(coordinator, this::onTaskTimeout);
  }

  public PoolSettings settings() {
    return settings;
  }

  /**
   * Starts every worker and waits until all of them reported READY.
   *
   * @throws PoolInitException if a worker dies during setup or is not ready within
   *     {@code startupTimeoutMs}; every started worker is terminated first
   * @throws IllegalStateException if the pool was already initialized or shut down
   */
  public void initialize() throws PoolInitException {
    ensureNotCoordinatorThread("initialize");
    try {
      call(() -> {
        beginStartup();
        return null;
      });
    } catch (RejectedExecutionException ex) {
      throw new IllegalStateException("Pool " + name + " is closed", ex);
    } catch (ExecutionException ex) {
      throw propagate(ex.getCause());
    }

    try {
      startup.get(settings.startupTimeoutMs(), TimeUnit.MILLISECONDS);
      log.info("Worker pool {} started {} workers (queue capacity {})",
          name, settings.maxWorkers(), settings.queueCapacity());
    } catch (TimeoutException ex) {
      abortStartup();
      throw new PoolInitException(
          "Workers not ready within " + settings.startupTimeoutMs() + " ms", ex);
    } catch (ExecutionException ex) {
      abortStartup();
      Throwable cause = ex.getCause();
      throw cause instanceof PoolInitException init
          ? init
          : new PoolInitException("Worker pool startup failed", cause);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      abortStartup();
      throw new PoolInitException("Interrupted while waiting for workers", ex);
    }
  }

  /**
   * Submits a task with the default per-task timeout.
   *
   * @param task task to run
   * @return future settled with the result, or with a {@link TaskFailedException}
   * @throws QueueFullException if every worker is busy and the queue is full
   * @throws PoolClosedException if the pool is not running
   * @see #submit(AnalysisTask, long)
   */
  public CompletableFuture<TaskResult> submit(AnalysisTask task) throws SubmissionRejectedException {
    return submit(task, settings.perTaskTimeoutMs());
  }

  /**
   * Dispatches a task to an idle worker or appends it to the queue. Never blocks on worker progress.
   *
   * <p>The deadline runs from submission, so time spent queued counts against {@code timeoutMs}.
   * The returned future completes on the coordinator thread; callers should keep dependent stages
   * short or use async variants.</p>
   *
   * @param task task to run; its id must not be in flight already
   * @param timeoutMs deadline in milliseconds; must be positive
   * @return future settled with the result, or with a {@link TaskFailedException}
   * @throws QueueFullException if every worker is busy and the queue is full
   * @throws PoolClosedException if the pool was never initialized, is shutting down, or has no live
   *     workers left
   */
  public CompletableFuture<TaskResult> submit(AnalysisTask task, long timeoutMs)
      throws SubmissionRejectedException {
    Objects.requireNonNull(task, "task");
    if (timeoutMs <= 0) {
      throw new IllegalArgumentException("timeoutMs must be positive (was " + timeoutMs + ")");
    }
    try {
      return call(() -> enqueueOrDispatch(task, timeoutMs));
    } catch (RejectedExecutionException ex) {
      throw new PoolClosedException("Pool " + name + " is closed");
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof SubmissionRejectedException rejection) {
        throw rejection;
      }
      throw propagate(cause);
    }
  }

  /**
   * Stops accepting work, drains queued and in-flight tasks, then stops every worker. Workers still
   * alive after {@code shutdownGraceMs} are force-terminated and their calls rejected with
   * {@link PoolClosedException}. Idempotent.
   *
   * @return summary of how the workers stopped
   */
  public ShutdownSummary shutdown() {
    ensureNotCoordinatorThread("shutdown");
    try {
      call(() -> {
        beginShutdown();
        return null;
      });
    } catch (RejectedExecutionException ex) {
      log.debug("Pool {} coordinator already stopped", name);
    } catch (ExecutionException ex) {
      throw propagate(ex.getCause());
    }
    ShutdownSummary summary;
    try {
      summary = awaitUninterruptibly(shutdownDone);
    } catch (ExecutionException ex) {
      throw propagate(ex.getCause());
    }
    stopCoordinator();
    return summary;
  }

  @Override
  public void close() {
    shutdown();
  }

  /**
   * Returns a snapshot of the pool counters. After shutdown the final snapshot is returned.
   *
   * @return current statistics
   */
  public PoolStats stats() {
    PoolStats closed = finalStats;
    if (closed != null) {
      return closed;
    }
    try {
      return call(this::snapshot);
    } catch (RejectedExecutionException ex) {
      PoolStats last = finalStats;
      if (last == null) {
        throw new IllegalStateException("Pool " + name + " stopped without final statistics", ex);
      }
      return last;
    } catch (ExecutionException ex) {
      throw propagate(ex.getCause());
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Coordinator-side operations

  private void beginStartup() {
    if (phase != Phase.NEW) {
      throw new IllegalStateException("Pool " + name + " already initialized");
    }
    phase = Phase.STARTING;
    for (int i = 0; i < settings.maxWorkers(); i++) {
      spawnWorker(false);
    }
    metrics.observe("engine.workers.total", settings.maxWorkers());
  }

  private void abortStartup() {
    try {
      call(() -> {
        if (phase == Phase.CLOSED) {
          return null;
        }
        log.error("Aborting startup of {}; terminating {} workers", name, liveWorkerCount());
        phase = Phase.DRAINING;
        shutdownStartedNanos = System.nanoTime();
        forceShutdown();
        return null;
      });
    } catch (RejectedExecutionException ex) {
      log.debug("Pool {} coordinator already stopped during startup abort", name);
    } catch (ExecutionException ex) {
      log.error("Failed to abort startup of {}", name, ex.getCause());
    }
    stopCoordinator();
  }

  private WorkerHandle spawnWorker(boolean replacement) {
    int workerId = ++nextWorkerId;
    AnalysisWorker worker = new AnalysisWorker(workerId, workerSetup, channel);
    Thread thread = ExecutorFactories.newWorkerThread(name + "-worker", workerId, worker, this::handleWorkerUncaught);
    WorkerHandle handle = new WorkerHandle(worker, thread, replacement);
    workers.put(workerId, handle);
    handle.start();
    log.debug("Spawned worker {}{}", workerId, replacement ? " (replacement)" : "");
    return handle;
  }

  private CompletableFuture<TaskResult> enqueueOrDispatch(AnalysisTask task, long timeoutMs)
      throws SubmissionRejectedException {
    if (phase != Phase.RUNNING) {
      throw new PoolClosedException(switch (phase) {
        case NEW, STARTING -> "Pool " + name + " is not initialized";
        case DRAINING -> "Pool " + name + " is shutting down";
        default -> "Pool " + name + " is closed";
      });
    }
    if (liveWorkerCount() == 0) {
      throw new PoolClosedException("Pool " + name + " has no live workers left");
    }
    WorkerHandle idle = queue.isEmpty() ? findIdle() : null;
    if (idle == null && queue.isFull()) {
      rejected++;
      metrics.increment("engine.queue.full");
      publish(EngineEvent.Type.QUEUE_FULL, Map.of(
          "taskId", task.id().value(),
          "capacity", Integer.toString(queue.capacity())));
      throw new QueueFullException(queue.capacity());
    }
    CompletableFuture<TaskResult> future = correlator.track(task.id(), timeoutMs);
    submitted++;
    metrics.increment("engine.task.submitted");
    if (idle != null) {
      assign(idle, task);
    } else {
      queue.offer(task);
      metrics.observe("engine.queue.depth", queue.size());
      log.debug("Queued task {} ({} waiting)", task.id(), queue.size());
    }
    return future;
  }

  private void assign(WorkerHandle handle, AnalysisTask task) {
    handle.assign(task, System.nanoTime());
    int busy = busyCount();
    busyHighWater = Math.max(busyHighWater, busy);
    metrics.increment("engine.task.dispatched");
    metrics.observe("engine.workers.busy", busy);
    publish(EngineEvent.Type.TASK_ASSIGNED, Map.of(
        "taskId", task.id().value(),
        "workerId", Integer.toString(handle.workerId()),
        "analyzer", task.analyzerName(),
        "file", task.filePath()));
  }

  private void dispatchNext() {
    while (!queue.isEmpty()) {
      WorkerHandle idle = findIdle();
      if (idle == null) {
        break;
      }
      AnalysisTask task = queue.poll().orElseThrow();
      if (!correlator.isPending(task.id())) {
        metrics.increment("engine.task.skipped.expired");
        log.debug("Skipping task {} whose deadline passed while queued", task.id());
        continue;
      }
      assign(idle, task);
    }
    metrics.observe("engine.queue.depth", queue.size());
    if (phase == Phase.DRAINING) {
      retireIdleWorkers();
    }
  }

  private void handleReply(WorkerReply reply) {
    WorkerHandle handle = workers.get(reply.workerId());
    if (handle == null || !handle.isLive()) {
      metrics.increment("engine.reply.discarded");
      log.debug("Discarding {} from unknown or terminated worker {}", reply.type(), reply.workerId());
      return;
    }
    switch (reply.type()) {
      case READY -> onReady(handle);
      case RESULT, ERROR -> onTaskReply(handle, reply);
      case SHUTDOWN_COMPLETE -> onShutdownComplete(handle);
    }
  }

  private void onReady(WorkerHandle handle) {
    if (handle.state() != WorkerState.STARTING) {
      log.debug("Ignoring READY from worker {} in state {}", handle.workerId(), handle.state());
      return;
    }
    handle.markIdle();
    if (phase == Phase.STARTING) {
      if (countInState(WorkerState.IDLE) == settings.maxWorkers()) {
        phase = Phase.RUNNING;
        startup.complete(null);
      }
      return;
    }
    if (handle.isReplacement()) {
      log.info("Replacement worker {} ready", handle.workerId());
    }
    dispatchNext();
  }

  private void onTaskReply(WorkerHandle handle, WorkerReply reply) {
    TaskId taskId = reply.taskId();
    if (!taskId.equals(handle.currentTask())) {
      metrics.increment("engine.reply.discarded");
      log.warn("Discarding {} for task {} from worker {} (current task {})",
          reply.type(), taskId, handle.workerId(), handle.currentTask());
      return;
    }
    long elapsedMs = handle.release();
    processingMillisTotal += elapsedMs;
    processingSamples++;
    metrics.observe("engine.task.latencyMs", elapsedMs);

    if (reply.type() == WorkerReply.Type.RESULT) {
      if (correlator.resolve(taskId, reply.result())) {
        completed++;
        metrics.increment("engine.task.completed");
        publish(EngineEvent.Type.TASK_COMPLETED, Map.of(
            "taskId", taskId.value(),
            "workerId", Integer.toString(handle.workerId()),
            "durationMs", Long.toString(elapsedMs)));
      } else {
        metrics.increment("engine.task.late");
        log.debug("Discarded late result for task {} from worker {}", taskId, handle.workerId());
      }
    } else {
      if (correlator.reject(taskId, new TaskExecutionException(taskId, reply.error()))) {
        failed++;
        metrics.increment("engine.task.failed");
        publish(EngineEvent.Type.TASK_FAILED, Map.of(
            "taskId", taskId.value(),
            "workerId", Integer.toString(handle.workerId()),
            "error", reply.error()));
      } else {
        metrics.increment("engine.task.late");
        log.debug("Discarded late failure for task {} from worker {}", taskId, handle.workerId());
      }
    }

    if (handle.state() == WorkerState.SHUTTING_DOWN) {
      return;
    }
    handle.markIdle();
    dispatchNext();
  }

  private void onShutdownComplete(WorkerHandle handle) {
    handle.markTerminated();
    workersStopped++;
    log.debug("Worker {} acknowledged shutdown", handle.workerId());
    checkShutdownComplete();
  }

  private void handleExit(int workerId, Throwable cause) {
    WorkerHandle handle = workers.get(workerId);
    if (handle == null || !handle.isLive()) {
      return;
    }
    TaskId inFlight = handle.currentTask();
    handle.markTerminated();
    crashed++;
    metrics.increment("engine.worker.crashed");
    if (inFlight == null) {
      log.error("Worker {} terminated unexpectedly", workerId, cause);
    } else {
      log.error("Worker {} terminated unexpectedly while running task {}", workerId, inFlight, cause);
    }
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("workerId", Integer.toString(workerId));
    if (inFlight != null) {
      attributes.put("taskId", inFlight.value());
    }
    if (cause != null) {
      attributes.put("cause", cause.getClass().getSimpleName());
    }
    publish(EngineEvent.Type.WORKER_CRASHED, attributes);

    if (inFlight != null) {
      handle.release();
      if (correlator.reject(inFlight, new WorkerCrashedException(inFlight, workerId, cause))) {
        metrics.increment("engine.task.crashed");
      }
    }

    if (phase == Phase.STARTING) {
      startup.completeExceptionally(
          new PoolInitException("Worker " + workerId + " died during startup", cause));
      return;
    }
    if (phase == Phase.RUNNING || (phase == Phase.DRAINING && !queue.isEmpty())) {
      maybeRespawn(workerId);
    }
    if (liveWorkerCount() == 0) {
      rejectQueued("Pool " + name + " has no live workers left");
    }
    checkShutdownComplete();
  }

  private void maybeRespawn(int crashedWorkerId) {
    if (respawnsUsed >= settings.workerRespawnRetryBudget()) {
      log.warn("Respawn budget of {} exhausted; {} continues with {} workers",
          settings.workerRespawnRetryBudget(), name, liveWorkerCount());
      return;
    }
    respawnsUsed++;
    WorkerHandle replacement = spawnWorker(true);
    metrics.increment("engine.worker.respawned");
    publish(EngineEvent.Type.WORKER_RESPAWNED, Map.of(
        "workerId", Integer.toString(replacement.workerId()),
        "replaces", Integer.toString(crashedWorkerId)));
  }

  private void onTaskTimeout(TaskId taskId) {
    timedOut++;
    metrics.increment("engine.task.timeout");
    log.warn("Task {} timed out", taskId);
    publish(EngineEvent.Type.TASK_TIMEOUT, Map.of("taskId", taskId.value()));
    if (phase == Phase.DRAINING) {
      retireIdleWorkers();
    }
  }

  private void beginShutdown() {
    switch (phase) {
      case DRAINING, CLOSED -> {
        return;
      }
      case NEW -> {
        shutdownStartedNanos = System.nanoTime();
        completeShutdown();
        return;
      }
      case STARTING -> startup.completeExceptionally(
          new PoolInitException("Pool " + name + " shut down during startup"));
      default -> {
        // RUNNING drains below
      }
    }
    phase = Phase.DRAINING;
    shutdownStartedNanos = System.nanoTime();
    log.info("Shutting down {}: {} in flight, {} queued", name, busyCount(), queue.size());
    graceTimer = coordinator.schedule(
        guarded(this::forceShutdown), settings.shutdownGraceMs(), TimeUnit.MILLISECONDS);
    for (WorkerHandle handle : workers.values()) {
      if (handle.state() == WorkerState.STARTING) {
        handle.requestShutdown();
      }
    }
    dispatchNext();
    checkShutdownComplete();
  }

  /**
   * Signals idle workers, and busy workers whose task already timed out, once nothing is left to drain.
   * While tasks remain queued every worker stays available to take them.
   */
  private void retireIdleWorkers() {
    if (!queue.isEmpty()) {
      return;
    }
    for (WorkerHandle handle : workers.values()) {
      if (handle.state() == WorkerState.IDLE) {
        handle.requestShutdown();
      } else if (handle.state() == WorkerState.BUSY && handle.currentTask() != null
          && !correlator.isPending(handle.currentTask())) {
        log.debug("Worker {} still runs abandoned task {}; requesting exit after it", handle.workerId(),
            handle.currentTask());
        metrics.increment("engine.worker.retired.timedOut");
        handle.requestShutdown();
      }
    }
  }

  private void checkShutdownComplete() {
    if (phase != Phase.DRAINING || liveWorkerCount() > 0) {
      return;
    }
    rejectQueued("Pool " + name + " stopped before the task was dispatched");
    correlator.rejectAll(id -> new PoolClosedException("Pool " + name + " shut down before task " + id + " completed"));
    completeShutdown();
  }

  private void forceShutdown() {
    if (phase != Phase.DRAINING) {
      return;
    }
    List<WorkerHandle> live = new ArrayList<>();
    for (WorkerHandle handle : workers.values()) {
      if (handle.isLive()) {
        live.add(handle);
      }
    }
    if (!live.isEmpty()) {
      metrics.increment("engine.shutdown.forced");
      log.warn("Grace period of {} ms elapsed; force-terminating {} workers", settings.shutdownGraceMs(), live.size());
    }
    for (WorkerHandle handle : live) {
      TaskId inFlight = handle.currentTask();
      handle.forceTerminate();
      workersForced++;
      if (inFlight != null) {
        handle.release();
        if (correlator.reject(inFlight, new PoolClosedException(
            "Worker " + handle.workerId() + " force-terminated during shutdown"))) {
          inFlightRejected++;
        }
      }
    }
    rejectQueued("Pool " + name + " stopped before the task was dispatched");
    correlator.rejectAll(id -> new PoolClosedException("Pool " + name + " shut down before task " + id + " completed"));
    completeShutdown();
  }

  private void rejectQueued(String reason) {
    for (AnalysisTask task : queue.drain()) {
      if (correlator.reject(task.id(), new PoolClosedException(reason))) {
        queuedRejected++;
      }
    }
  }

  private void completeShutdown() {
    phase = Phase.CLOSED;
    if (graceTimer != null) {
      graceTimer.cancel(false);
    }
    long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - shutdownStartedNanos);
    ShutdownSummary summary =
        new ShutdownSummary(workersStopped, workersForced, inFlightRejected, queuedRejected, durationMs);
    finalStats = snapshot();
    publish(EngineEvent.Type.SHUTDOWN_COMPLETE, Map.of(
        "workersStopped", Integer.toString(workersStopped),
        "workersForceTerminated", Integer.toString(workersForced),
        "durationMs", Long.toString(durationMs)));
    log.info("Worker pool {} stopped in {} ms ({} stopped, {} force-terminated)",
        name, durationMs, workersStopped, workersForced);
    shutdownDone.complete(summary);
  }

  private PoolStats snapshot() {
    long average = processingSamples == 0 ? 0L : processingMillisTotal / processingSamples;
    return new PoolStats(
        submitted,
        completed,
        failed,
        timedOut,
        crashed,
        respawnsUsed,
        rejected,
        correlator.lateCompletions(),
        liveWorkerCount(),
        busyCount(),
        countInState(WorkerState.IDLE),
        queue.size(),
        correlator.pendingCount(),
        busyHighWater,
        average);
  }

  private WorkerHandle findIdle() {
    for (WorkerHandle handle : workers.values()) {
      if (handle.state() == WorkerState.IDLE) {
        return handle;
      }
    }
    return null;
  }

  private int busyCount() {
    int busy = 0;
    for (WorkerHandle handle : workers.values()) {
      if (handle.isLive() && handle.currentTask() != null) {
        busy++;
      }
    }
    return busy;
  }

  private int countInState(WorkerState state) {
    int count = 0;
    for (WorkerHandle handle : workers.values()) {
      if (handle.state() == state) {
        count++;
      }
    }
    return count;
  }

  private int liveWorkerCount() {
    int live = 0;
    for (WorkerHandle handle : workers.values()) {
      if (handle.isLive()) {
        live++;
      }
    }
    return live;
  }

  private void publish(EngineEvent.Type type, Map<String, String> attributes) {
    try {
      events.publish(EngineEvent.of(type, attributes));
    } catch (RuntimeException ex) {
      log.warn("Engine event sink failed for {}", type.key(), ex);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Thread plumbing

  private <T> T call(Callable<T> action) throws ExecutionException {
    if (Thread.currentThread() == coordinatorThread) {
      try {
        return action.call();
      } catch (Exception ex) {
        throw new ExecutionException(ex);
      }
    }
    return awaitUninterruptibly(coordinator.submit(action));
  }

  private void post(Runnable action) {
    try {
      coordinator.execute(guarded(action));
    } catch (RejectedExecutionException ex) {
      log.debug("Pool {} closed; dropping worker message", name);
    }
  }

  private Runnable guarded(Runnable action) {
    return () -> {
      try {
        action.run();
      } catch (RuntimeException ex) {
        metrics.increment("engine.coordinator.error");
        log.error("Coordinator task failed in {}", name, ex);
      }
    };
  }

  private void stopCoordinator() {
    coordinator.shutdown();
    try {
      if (!coordinator.awaitTermination(COORDINATOR_STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
        log.warn("Coordinator of {} still busy after {} ms; forcing stop", name, COORDINATOR_STOP_TIMEOUT_MS);
        coordinator.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      coordinator.shutdownNow();
    }
  }

  private void ensureNotCoordinatorThread(String operation) {
    if (Thread.currentThread() == coordinatorThread) {
      throw new IllegalStateException(operation + " must not be called from the pool coordinator thread");
    }
  }

  private void handleWorkerUncaught(Thread thread, Throwable throwable) {
    metrics.increment("engine.worker.uncaught");
    log.debug("Worker thread {} ended with {}", thread.getName(), throwable.toString());
  }

  private void handleCoordinatorCrash(Thread thread, Throwable throwable) {
    log.error("Coordinator thread {} threw an uncaught exception", thread.getName(), throwable);
  }

  private static <T> T awaitUninterruptibly(Future<T> future) throws ExecutionException {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          return future.get();
        } catch (InterruptedException ex) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private static RuntimeException propagate(Throwable cause) {
    if (cause instanceof RuntimeException runtime) {
      return runtime;
    }
    if (cause instanceof Error error) {
      throw error;
    }
    return new IllegalStateException(cause);
  }

  private final class CoordinatorChannel implements WorkerChannel {
    @Override
    public void onReply(WorkerReply reply) {
      post(() -> handleReply(reply));
    }

    @Override
    public void onExit(int workerId, Throwable cause) {
      post(() -> handleExit(workerId, cause));
    }
  }
}
