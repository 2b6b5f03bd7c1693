package ca.gc.cra.sentinel.application.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.domain.task.TaskId;
import ca.gc.cra.sentinel.domain.task.TaskResult;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResultCorrelatorTest {
  private ScheduledExecutorService scheduler;
  private List<TaskId> expired;
  private ResultCorrelator correlator;

  @BeforeEach
  void setUp() {
    scheduler = Executors.newSingleThreadScheduledExecutor();
    expired = new CopyOnWriteArrayList<>();
    correlator = new ResultCorrelator(scheduler, expired::add);
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdownNow();
  }

  @Test
  void resolveCompletesTrackedCall() throws Exception {
    TaskId id = new TaskId("t-1");
    CompletableFuture<TaskResult> future = correlator.track(id, 5_000);
    TaskResult result = TaskResult.empty("security", "a.js", 3);

    assertTrue(correlator.resolve(id, result));

    assertSame(result, future.get(1, TimeUnit.SECONDS));
    assertFalse(correlator.isPending(id));
    assertEquals(0, correlator.pendingCount());
  }

  @Test
  void secondCompletionIsCountedAsLate() {
    TaskId id = new TaskId("t-2");
    CompletableFuture<TaskResult> future = correlator.track(id, 5_000);

    assertTrue(correlator.reject(id, new TaskExecutionException(id, "boom")));
    assertFalse(correlator.resolve(id, TaskResult.empty("security", "a.js", 1)));
    assertFalse(correlator.reject(id, new TaskExecutionException(id, "again")));

    assertTrue(future.isCompletedExceptionally());
    assertEquals(2L, correlator.lateCompletions());
  }

  @Test
  void outOfOrderResolutionRoutesEachResultToItsOwnCaller() throws Exception {
    TaskId first = new TaskId("t-a");
    TaskId second = new TaskId("t-b");
    CompletableFuture<TaskResult> firstFuture = correlator.track(first, 5_000);
    CompletableFuture<TaskResult> secondFuture = correlator.track(second, 5_000);
    TaskResult firstResult = TaskResult.empty("security", "a.js", 4);
    TaskResult secondResult = TaskResult.empty("bugs", "b.js", 2);

    assertTrue(correlator.resolve(second, secondResult));

    assertTrue(correlator.isPending(first));
    assertFalse(firstFuture.isDone());
    assertSame(secondResult, secondFuture.get(1, TimeUnit.SECONDS));

    assertTrue(correlator.resolve(first, firstResult));

    assertSame(firstResult, firstFuture.get(1, TimeUnit.SECONDS));
    assertEquals(0, correlator.pendingCount());
    assertEquals(0L, correlator.lateCompletions());
  }

  @Test
  void unknownIdIsDiscarded() {
    assertFalse(correlator.resolve(new TaskId("never-tracked"), TaskResult.empty("bugs", "b.js", 1)));
    assertEquals(1L, correlator.lateCompletions());
  }

  @Test
  void duplicateTrackIsRejected() {
    TaskId id = new TaskId("t-3");
    correlator.track(id, 5_000);

    assertThrows(IllegalStateException.class, () -> correlator.track(id, 5_000));
    assertEquals(1, correlator.pendingCount());
  }

  @Test
  void idCanBeTrackedAgainAfterSettling() {
    TaskId id = new TaskId("t-4");
    correlator.track(id, 5_000);
    correlator.resolve(id, TaskResult.empty("bugs", "b.js", 1));

    CompletableFuture<TaskResult> again = correlator.track(id, 5_000);

    assertFalse(again.isDone());
    assertTrue(correlator.isPending(id));
  }

  @Test
  void nonPositiveTimeoutIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> correlator.track(new TaskId("t-5"), 0));
  }

  @Test
  void expiryRejectsWithTimeoutAndNotifiesListener() throws Exception {
    TaskId id = new TaskId("t-6");
    CompletableFuture<TaskResult> future = correlator.track(id, 30);

    ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));

    TaskTimeoutException timeout = assertInstanceOf(TaskTimeoutException.class, ex.getCause());
    assertEquals(id, timeout.taskId());
    assertEquals(30L, timeout.timeoutMillis());
    scheduler.submit(() -> { }).get(1, TimeUnit.SECONDS);
    assertEquals(List.of(id), expired);
    assertEquals(1L, correlator.timeouts());
    assertFalse(correlator.resolve(id, TaskResult.empty("security", "a.js", 1)));
    assertEquals(1L, correlator.lateCompletions());
  }

  @Test
  void resolvedCallNeverTimesOut() throws Exception {
    TaskId id = new TaskId("t-7");
    correlator.track(id, 40);
    correlator.resolve(id, TaskResult.empty("security", "a.js", 1));

    Thread.sleep(120);

    assertEquals(0L, correlator.timeouts());
    assertTrue(expired.isEmpty());
  }

  @Test
  void rejectAllSettlesEveryPendingCall() {
    CompletableFuture<TaskResult> first = correlator.track(new TaskId("a"), 5_000);
    CompletableFuture<TaskResult> second = correlator.track(new TaskId("b"), 5_000);

    int rejected = correlator.rejectAll(id -> new PoolClosedException("closed " + id));

    assertEquals(2, rejected);
    assertTrue(first.isCompletedExceptionally());
    assertTrue(second.isCompletedExceptionally());
    assertEquals(0, correlator.pendingCount());
    ExecutionException ex = assertThrows(ExecutionException.class, first::get);
    assertInstanceOf(PoolClosedException.class, ex.getCause());
  }
}
