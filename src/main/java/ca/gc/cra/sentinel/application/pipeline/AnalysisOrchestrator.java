package ca.gc.cra.sentinel.application.pipeline;

import ca.gc.cra.sentinel.application.engine.PoolInitException;
import ca.gc.cra.sentinel.application.engine.QueueFullException;
import ca.gc.cra.sentinel.application.engine.SubmissionRejectedException;
import ca.gc.cra.sentinel.application.engine.TaskExecutionException;
import ca.gc.cra.sentinel.application.engine.TaskFailedException;
import ca.gc.cra.sentinel.application.engine.TaskTimeoutException;
import ca.gc.cra.sentinel.application.engine.WorkerCrashedException;
import ca.gc.cra.sentinel.application.engine.WorkerPool;
import ca.gc.cra.sentinel.application.port.EngineEventSink;
import ca.gc.cra.sentinel.application.port.IssuePostProcessor;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.domain.events.EngineEvent;
import ca.gc.cra.sentinel.domain.issue.Issue;
import ca.gc.cra.sentinel.domain.source.SourceFile;
import ca.gc.cra.sentinel.domain.task.AnalysisTask;
import ca.gc.cra.sentinel.domain.task.TaskId;
import ca.gc.cra.sentinel.domain.task.TaskPayload;
import ca.gc.cra.sentinel.domain.task.TaskResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Public entry point that turns files x analyzers into tasks, runs them on the
 * {@link WorkerPool} and merges the results per file.
 * <p><strong>Failure semantics:</strong> a failed, crashed, timed-out or rejected task degrades only
 * its own file's entry; the batch always completes. {@link PoolInitException} is the one fatal error.</p>
 * <p><strong>Backpressure:</strong> on {@link QueueFullException} the orchestrator waits briefly for an
 * outstanding task to settle and retries until the batch deadline.</p>
 * <p><strong>Thread-safety:</strong> {@link #process} may be called from several threads; batches
 * share the pool.</p>
 *
 * @since 0.1.0
 */
public final class AnalysisOrchestrator implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);
  private static final String MDC_BATCH = "batch";
  private static final long QUEUE_FULL_BACKOFF_MS = 25L;
  private static final AtomicInteger BATCH_SEQUENCE = new AtomicInteger();

  private final WorkerPool pool;
  private final long batchTimeoutMs;
  private final IssuePostProcessor postProcessor;
  private final MetricsPort metrics;
  private final EngineEventSink events;
  private final TaskId.Generator taskIds = TaskId.generator();
  private final Object lifecycleLock = new Object();
  private boolean started;

  /**
   * Creates an orchestrator with identity post-processing and no metrics or events.
   *
   * @param pool worker pool; initialized on first use
   * @param batchTimeoutMs deadline for a whole batch
   */
  public AnalysisOrchestrator(WorkerPool pool, long batchTimeoutMs) {
    this(pool, batchTimeoutMs, IssuePostProcessor.IDENTITY, MetricsPort.NO_OP, EngineEventSink.NO_OP);
  }

  /**
   * Creates an orchestrator.
   *
   * @param pool worker pool; initialized on first use
   * @param batchTimeoutMs deadline for a whole batch; must be positive
   * @param postProcessor applied to merged issues when a batch asks for false-positive reduction
   * @param metrics metrics sink ({@code pipeline.*})
   * @param events lifecycle event sink
   */
  public AnalysisOrchestrator(
      WorkerPool pool,
      long batchTimeoutMs,
      IssuePostProcessor postProcessor,
      MetricsPort metrics,
      EngineEventSink events) {
    this.pool = Objects.requireNonNull(pool, "pool");
    if (batchTimeoutMs <= 0) {
      throw new IllegalArgumentException("batchTimeoutMs must be positive (was " + batchTimeoutMs + ")");
    }
    this.batchTimeoutMs = batchTimeoutMs;
    this.postProcessor = Objects.requireNonNull(postProcessor, "postProcessor");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.events = Objects.requireNonNull(events, "events");
  }

  /**
   * Initializes the pool if this orchestrator has not done so yet.
   *
   * @throws PoolInitException if the workers cannot be started
   */
  public void start() throws PoolInitException {
    synchronized (lifecycleLock) {
      if (started) {
        return;
      }
      pool.initialize();
      started = true;
    }
  }

  /**
   * Analyses a batch of files.
   *
   * @param files files to analyse; duplicates are analysed twice
   * @param options analyzers and submission mode
   * @return per-file results in input order plus task statistics
   * @throws PoolInitException if the pool could not be started
   * @throws InterruptedException if the calling thread is interrupted while waiting for results
   */
  public BatchResult process(List<SourceFile> files, AnalysisOptions options)
      throws PoolInitException, InterruptedException {
    Objects.requireNonNull(files, "files");
    AnalysisOptions effective = options == null ? AnalysisOptions.defaults() : options;
    start();

    String batchId = "batch-" + BATCH_SEQUENCE.incrementAndGet();
    MDC.put(MDC_BATCH, batchId);
    try {
      long startNanos = System.nanoTime();
      long deadlineNanos = startNanos + TimeUnit.MILLISECONDS.toNanos(batchTimeoutMs);
      List<PendingTask> tasks = buildTasks(files, effective);
      log.info("Processing {} files with analyzers {} ({} tasks, {})",
          files.size(), effective.analyzers(), tasks.size(), effective.sequential() ? "sequential" : "parallel");
      metrics.increment("pipeline.batch.started");
      metrics.observe("pipeline.batch.files", files.size());
      publish(EngineEvent.Type.PROCESSING_START, Map.of(
          "batch", batchId,
          "files", Integer.toString(files.size()),
          "tasks", Integer.toString(tasks.size())));

      if (effective.sequential()) {
        for (PendingTask task : tasks) {
          submitWithBackpressure(task, tasks, deadlineNanos);
          awaitSettled(task, deadlineNanos);
        }
      } else {
        for (PendingTask task : tasks) {
          submitWithBackpressure(task, tasks, deadlineNanos);
        }
        for (PendingTask task : tasks) {
          awaitSettled(task, deadlineNanos);
        }
      }

      List<FileAnalysisResult> results = merge(files, tasks, effective);
      List<TaskOutcome> outcomes = new ArrayList<>(tasks.size());
      for (PendingTask task : tasks) {
        outcomes.add(task.outcome);
      }
      long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
      BatchStatistics statistics = BatchStatistics.of(outcomes, durationMs);
      metrics.observe("pipeline.batch.durationMs", durationMs);
      log.info("Batch {} finished in {} ms: {} passed, {} failed, {} timed out, {} crashed, {} rejected",
          batchId, durationMs, statistics.passed(), statistics.failed(), statistics.timedOut(),
          statistics.crashed(), statistics.rejected());
      return new BatchResult(batchId, results, statistics);
    } finally {
      MDC.remove(MDC_BATCH);
    }
  }

  /**
   * Shuts down the underlying pool.
   */
  @Override
  public void close() {
    pool.shutdown();
  }

  private List<PendingTask> buildTasks(List<SourceFile> files, AnalysisOptions options) {
    List<PendingTask> tasks = new ArrayList<>(files.size() * options.analyzers().size());
    for (SourceFile file : files) {
      TaskPayload payload = new TaskPayload(file.path(), file.content(), options.taskOptions());
      for (String analyzer : options.analyzers()) {
        tasks.add(new PendingTask(new AnalysisTask(taskIds.next(), analyzer, payload)));
      }
    }
    return tasks;
  }

  private void submitWithBackpressure(PendingTask task, List<PendingTask> batch, long deadlineNanos)
      throws InterruptedException {
    while (true) {
      long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
      if (remainingMs <= 0) {
        task.settle(TaskOutcome.Status.TIMED_OUT, "batch deadline passed before submission");
        return;
      }
      try {
        task.submittedNanos = System.nanoTime();
        task.future = pool.submit(task.task, Math.min(remainingMs, pool.settings().perTaskTimeoutMs()));
        task.future.whenComplete((result, error) -> task.settledNanos = System.nanoTime());
        return;
      } catch (QueueFullException full) {
        metrics.increment("pipeline.submit.retry");
        log.debug("Queue full submitting {}; waiting for capacity", task.task.id());
        waitForCapacity(batch, Math.min(remainingMs, QUEUE_FULL_BACKOFF_MS));
      } catch (SubmissionRejectedException rejected) {
        task.settle(TaskOutcome.Status.REJECTED, rejected.getMessage());
        return;
      }
    }
  }

  private void waitForCapacity(List<PendingTask> batch, long waitMs) throws InterruptedException {
    List<CompletableFuture<TaskResult>> outstanding = new ArrayList<>();
    for (PendingTask pending : batch) {
      if (pending.future != null && !pending.future.isDone()) {
        outstanding.add(pending.future);
      }
    }
    if (outstanding.isEmpty()) {
      TimeUnit.MILLISECONDS.sleep(waitMs);
      return;
    }
    try {
      CompletableFuture.anyOf(outstanding.toArray(new CompletableFuture<?>[0])).get(waitMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException | ExecutionException settledOrSlow) {
      log.trace("Capacity wait ended: {}", settledOrSlow.toString());
    }
  }

  private void awaitSettled(PendingTask task, long deadlineNanos) throws InterruptedException {
    if (task.outcome != null) {
      return;
    }
    long remainingNanos = deadlineNanos - System.nanoTime();
    try {
      task.result = task.future.get(Math.max(0L, remainingNanos), TimeUnit.NANOSECONDS);
      task.settle(TaskOutcome.Status.PASSED, "");
      metrics.increment("pipeline.task.passed");
    } catch (TimeoutException ex) {
      task.settle(TaskOutcome.Status.TIMED_OUT, "batch deadline of " + batchTimeoutMs + " ms exceeded");
      metrics.increment("pipeline.task.batchTimeout");
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      TaskOutcome.Status status = classify(cause);
      String reason = cause instanceof TaskFailedException failure ? failure.reason() : String.valueOf(cause.getMessage());
      task.settle(status, reason);
      metrics.increment("pipeline.task." + status.name().toLowerCase(Locale.ROOT));
      log.warn("Task {} ({} on {}) {}: {}", task.task.id(), task.task.analyzerName(), task.task.filePath(),
          status, reason);
    }
  }

  private static TaskOutcome.Status classify(Throwable cause) {
    if (cause instanceof TaskTimeoutException) {
      return TaskOutcome.Status.TIMED_OUT;
    }
    if (cause instanceof WorkerCrashedException) {
      return TaskOutcome.Status.CRASHED;
    }
    if (cause instanceof TaskExecutionException) {
      return TaskOutcome.Status.FAILED;
    }
    if (cause instanceof SubmissionRejectedException) {
      return TaskOutcome.Status.REJECTED;
    }
    return TaskOutcome.Status.FAILED;
  }

  private List<FileAnalysisResult> merge(List<SourceFile> files, List<PendingTask> tasks, AnalysisOptions options) {
    int perFile = options.analyzers().size();
    List<FileAnalysisResult> results = new ArrayList<>(files.size());
    for (int fileIndex = 0; fileIndex < files.size(); fileIndex++) {
      String path = files.get(fileIndex).path();
      List<PendingTask> fileTasks = tasks.subList(fileIndex * perFile, (fileIndex + 1) * perFile);
      StringJoiner errors = new StringJoiner("; ");
      List<Issue> issues = new ArrayList<>();
      Map<String, Map<String, Long>> stats = new LinkedHashMap<>();
      for (PendingTask task : fileTasks) {
        if (task.outcome.passed()) {
          issues.addAll(task.result.issues());
          stats.put(task.task.analyzerName(), task.result.stats());
        } else {
          errors.add(task.task.analyzerName() + " " + task.outcome.reason());
        }
      }
      if (errors.length() > 0) {
        metrics.increment("pipeline.file.degraded");
        results.add(FileAnalysisResult.degraded(path, errors.toString()));
        continue;
      }
      results.add(new FileAnalysisResult(path, postProcess(path, issues, options), stats, null));
    }
    return results;
  }

  private List<Issue> postProcess(String path, List<Issue> issues, AnalysisOptions options) {
    if (!options.reduceFalsePositives()) {
      return issues;
    }
    try {
      List<Issue> reduced = Objects.requireNonNull(postProcessor.process(path, List.copyOf(issues)), "reduced issues");
      metrics.observe("pipeline.issues.suppressed", Math.max(0, issues.size() - reduced.size()));
      return reduced;
    } catch (RuntimeException ex) {
      log.warn("Issue post-processing failed for {}; reporting unfiltered issues", path, ex);
      return issues;
    }
  }

  private void publish(EngineEvent.Type type, Map<String, String> attributes) {
    try {
      events.publish(EngineEvent.of(type, attributes));
    } catch (RuntimeException ex) {
      log.warn("Engine event sink failed for {}", type.key(), ex);
    }
  }

  private static final class PendingTask {
    private final AnalysisTask task;
    private CompletableFuture<TaskResult> future;
    private volatile long submittedNanos;
    private volatile long settledNanos;
    private TaskResult result;
    private TaskOutcome outcome;

    private PendingTask(AnalysisTask task) {
      this.task = task;
    }

    private void settle(TaskOutcome.Status status, String reason) {
      long end = settledNanos != 0L ? settledNanos : System.nanoTime();
      long duration = submittedNanos == 0L ? 0L : TimeUnit.NANOSECONDS.toMillis(end - submittedNanos);
      outcome = new TaskOutcome(task.id().value(), task.filePath(), task.analyzerName(), status, duration, reason);
    }
  }
}
