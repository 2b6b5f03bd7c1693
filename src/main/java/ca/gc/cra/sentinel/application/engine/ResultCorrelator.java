package ca.gc.cra.sentinel.application.engine;

import ca.gc.cra.sentinel.domain.task.TaskId;
import ca.gc.cra.sentinel.domain.task.TaskResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Maps outstanding task ids to the futures their callers await.
 * <p><strong>Why:</strong> Workers finish in any order; the correlator completes each call exactly
 * once, whether by result, failure or deadline, and discards anything that arrives afterwards.</p>
 * <p><strong>Timeouts:</strong> every tracked call gets a timer on the supplied scheduler, measured
 * from {@link #track}. Expiry rejects the call with {@link TaskTimeoutException} and notifies the
 * timeout listener on the scheduler thread.</p>
 * <p><strong>Thread-safety:</strong> Completion is decided by an atomic removal, so concurrent
 * resolve/reject/expiry attempts settle a call at most once. The pool drives it from its
 * coordinator thread.</p>
 *
 * @since 0.1.0
 */
public final class ResultCorrelator {
  private static final Logger log = LoggerFactory.getLogger(ResultCorrelator.class);

  private final ScheduledExecutorService scheduler;
  private final Consumer<TaskId> timeoutListener;
  private final ConcurrentMap<TaskId, PendingCall> pending = new ConcurrentHashMap<>();
  private final LongAdder lateCompletions = new LongAdder();
  private final LongAdder timeouts = new LongAdder();

  /**
   * Creates a correlator.
   *
   * @param scheduler scheduler running timeout timers; normally the pool coordinator
   * @param timeoutListener invoked with the task id after a call expired; may be {@code null}
   */
  public ResultCorrelator(ScheduledExecutorService scheduler, Consumer<TaskId> timeoutListener) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.timeoutListener = timeoutListener == null ? id -> {} : timeoutListener;
  }

  /**
   * Registers a call and arms its timeout.
   *
   * @param taskId task to track
   * @param timeoutMs deadline relative to now, in milliseconds; must be positive
   * @return future settled by {@link #resolve}, {@link #reject} or expiry
   * @throws IllegalStateException if {@code taskId} already has a live call
   */
  public CompletableFuture<TaskResult> track(TaskId taskId, long timeoutMs) {
    Objects.requireNonNull(taskId, "taskId");
    if (timeoutMs <= 0) {
      throw new IllegalArgumentException("timeoutMs must be positive (was " + timeoutMs + ")");
    }
    PendingCall call = new PendingCall(taskId);
    if (pending.putIfAbsent(taskId, call) != null) {
      throw new IllegalStateException("Task " + taskId + " is already being tracked");
    }
    try {
      call.attachTimer(scheduler.schedule(() -> expire(call, timeoutMs), timeoutMs, TimeUnit.MILLISECONDS));
    } catch (RejectedExecutionException ex) {
      pending.remove(taskId, call);
      throw ex;
    }
    return call.future();
  }

  /**
   * Completes a call successfully.
   *
   * @param taskId task the result belongs to
   * @param result analysis result
   * @return {@code true} if a live call was completed; {@code false} for unknown, expired or
   *     already-settled ids
   */
  public boolean resolve(TaskId taskId, TaskResult result) {
    PendingCall call = pending.remove(taskId);
    if (call == null) {
      lateCompletions.increment();
      log.debug("Discarding result for task {} with no pending call", taskId);
      return false;
    }
    call.cancelTimer();
    call.future().complete(result);
    return true;
  }

  /**
   * Completes a call exceptionally.
   *
   * @param taskId task that failed
   * @param error failure delivered to the caller
   * @return {@code true} if a live call was rejected; {@code false} for unknown, expired or
   *     already-settled ids
   */
  public boolean reject(TaskId taskId, Throwable error) {
    PendingCall call = pending.remove(taskId);
    if (call == null) {
      lateCompletions.increment();
      log.debug("Discarding failure for task {} with no pending call", taskId);
      return false;
    }
    call.cancelTimer();
    call.future().completeExceptionally(error);
    return true;
  }

  public boolean isPending(TaskId taskId) {
    return pending.containsKey(taskId);
  }

  public int pendingCount() {
    return pending.size();
  }

  /**
   * Rejects every live call.
   *
   * @param causeFactory builds the failure for each task id
   * @return number of calls rejected
   */
  public int rejectAll(Function<TaskId, ? extends Throwable> causeFactory) {
    List<TaskId> ids = new ArrayList<>(pending.keySet());
    int rejected = 0;
    for (TaskId id : ids) {
      PendingCall call = pending.remove(id);
      if (call != null) {
        call.cancelTimer();
        call.future().completeExceptionally(causeFactory.apply(id));
        rejected++;
      }
    }
    return rejected;
  }

  /**
   * @return number of resolve/reject attempts that found no live call
   */
  public long lateCompletions() {
    return lateCompletions.sum();
  }

  /**
   * @return number of calls that expired
   */
  public long timeouts() {
    return timeouts.sum();
  }

  private void expire(PendingCall call, long timeoutMs) {
    if (!pending.remove(call.taskId(), call)) {
      return;
    }
    timeouts.increment();
    log.debug("Task {} expired after {} ms", call.taskId(), timeoutMs);
    call.future().completeExceptionally(new TaskTimeoutException(call.taskId(), timeoutMs));
    try {
      timeoutListener.accept(call.taskId());
    } catch (RuntimeException ex) {
      log.error("Timeout listener failed for task {}", call.taskId(), ex);
    }
  }
}
