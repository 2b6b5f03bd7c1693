package ca.gc.cra.sentinel.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.application.engine.PoolInitException;
import ca.gc.cra.sentinel.application.engine.PoolSettings;
import ca.gc.cra.sentinel.application.engine.WorkerPool;
import ca.gc.cra.sentinel.application.port.IssuePostProcessor;
import ca.gc.cra.sentinel.domain.events.EngineEvent;
import ca.gc.cra.sentinel.domain.issue.Issue;
import ca.gc.cra.sentinel.domain.source.SourceFile;
import ca.gc.cra.sentinel.infrastructure.events.InMemoryEngineEventSink;
import ca.gc.cra.sentinel.testutil.RecordingMetricsPort;
import ca.gc.cra.sentinel.testutil.ScriptedAnalysis;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class AnalysisOrchestratorTest {
  private static final AnalysisOptions SCRIPTED = AnalysisOptions.defaults().withAnalyzers(List.of("security"));

  private final ScriptedAnalysis analysis = new ScriptedAnalysis();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final InMemoryEngineEventSink events = new InMemoryEngineEventSink();
  private AnalysisOrchestrator orchestrator;

  @AfterEach
  void tearDown() {
    analysis.release();
    if (orchestrator != null) {
      orchestrator.close();
    }
  }

  @Test
  void failingAnalyzerDegradesOnlyItsFile() throws Exception {
    orchestrator = orchestrator(settings(3, 5_000, 16), 10_000, IssuePostProcessor.IDENTITY);

    BatchResult result = orchestrator.process(List.of(
        new SourceFile("a.js", "quick"),
        new SourceFile("b.js", "fail:kaboom"),
        new SourceFile("c.js", "quick")), SCRIPTED);

    assertEquals(List.of("a.js", "b.js", "c.js"), result.files().stream().map(FileAnalysisResult::filePath).toList());
    FileAnalysisResult degraded = result.files().get(1);
    assertTrue(degraded.isDegraded());
    assertEquals("security kaboom", degraded.error());
    assertTrue(degraded.issues().isEmpty());
    assertEquals(1, result.files().get(0).issues().size());
    assertEquals(1, result.files().get(2).issues().size());
    assertNull(result.files().get(0).error());

    assertFalse(result.complete());
    assertEquals(List.of("analysis incomplete for file b.js: security kaboom"), result.incompleteNotices());
    BatchStatistics stats = result.statistics();
    assertEquals(3, stats.totalTasks());
    assertEquals(2, stats.passed());
    assertEquals(1, stats.failed());
    assertEquals(1L, metrics.counter("pipeline.file.degraded"));
  }

  @Test
  void failureInOneAnalyzerDiscardsOtherAnalyzersIssuesForThatFile() throws Exception {
    orchestrator = orchestrator(settings(2, 5_000, 16), 10_000, IssuePostProcessor.IDENTITY);
    AnalysisOptions options = AnalysisOptions.defaults().withAnalyzers(List.of("security", "bugs"));

    BatchResult result = orchestrator.process(List.of(
        new SourceFile("ok.js", "if (a == b) {}"),
        new SourceFile("bad.js", "fail:parse error")), options);

    FileAnalysisResult ok = result.files().get(0);
    assertFalse(ok.isDegraded());
    assertEquals(List.of("scripted", "loose-equality"), ok.issues().stream().map(Issue::type).toList());
    assertEquals(List.of("security", "bugs"), List.copyOf(ok.stats().keySet()));
    FileAnalysisResult bad = result.files().get(1);
    assertEquals("security parse error", bad.error());
    assertTrue(bad.issues().isEmpty());
    assertEquals(3, result.statistics().passed());
  }

  @Test
  void crashedAndTimedOutTasksAreClassified() throws Exception {
    orchestrator = orchestrator(settings(3, 150, 16), 10_000, IssuePostProcessor.IDENTITY);

    BatchResult result = orchestrator.process(List.of(
        new SourceFile("crash.js", "crash"),
        new SourceFile("slow.js", "sleep:1000"),
        new SourceFile("fine.js", "quick")), SCRIPTED);

    Map<String, TaskOutcome.Status> byFile = statusByFile(result);
    assertEquals(TaskOutcome.Status.CRASHED, byFile.get("crash.js"));
    assertEquals(TaskOutcome.Status.TIMED_OUT, byFile.get("slow.js"));
    assertEquals(TaskOutcome.Status.PASSED, byFile.get("fine.js"));
    assertTrue(result.files().get(0).error().startsWith("security worker "), result.files().get(0).error());
    assertEquals("security timed out after 150 ms", result.files().get(1).error());
    assertEquals(1, result.statistics().crashed());
    assertEquals(1, result.statistics().timedOut());
  }

  @Test
  void batchDeadlineTimesOutOutstandingTasks() throws Exception {
    orchestrator = orchestrator(settings(1, 10_000, 16), 200, IssuePostProcessor.IDENTITY);

    BatchResult result = orchestrator.process(List.of(
        new SourceFile("first.js", "sleep:600"),
        new SourceFile("second.js", "quick")), SCRIPTED);

    assertEquals(2, result.statistics().timedOut());
    assertTrue(result.statistics().totalDurationMillis() < 600L, "batch waited for slow task");
    assertEquals(2, result.incompleteNotices().size());
  }

  @Test
  void sequentialModeRunsOneTaskAtATime() throws Exception {
    orchestrator = orchestrator(settings(3, 5_000, 16), 10_000, IssuePostProcessor.IDENTITY);

    BatchResult result = orchestrator.process(List.of(
        new SourceFile("a.js", "sleep:20"),
        new SourceFile("b.js", "sleep:20"),
        new SourceFile("c.js", "sleep:20"),
        new SourceFile("d.js", "sleep:20")), SCRIPTED.withSequential(true));

    assertTrue(result.complete());
    assertEquals(4, result.statistics().passed());
    assertEquals(1, analysis.maxRunning());
  }

  @Test
  void queueFullIsRetriedUntilCapacityFrees() throws Exception {
    orchestrator = orchestrator(settings(1, 5_000, 0), 10_000, IssuePostProcessor.IDENTITY);

    BatchResult result = orchestrator.process(List.of(
        new SourceFile("a.js", "sleep:30"),
        new SourceFile("b.js", "sleep:30"),
        new SourceFile("c.js", "sleep:30")), SCRIPTED);

    assertTrue(result.complete());
    assertEquals(3, result.statistics().passed());
    assertTrue(metrics.counter("pipeline.submit.retry") >= 1L);
  }

  @Test
  void closedPoolRejectsEveryTask() throws Exception {
    orchestrator = orchestrator(settings(1, 5_000, 4), 10_000, IssuePostProcessor.IDENTITY);
    orchestrator.start();
    orchestrator.close();

    BatchResult result = orchestrator.process(List.of(new SourceFile("a.js", "quick")), SCRIPTED);

    assertEquals(1, result.statistics().rejected());
    assertTrue(result.files().get(0).isDegraded());
  }

  @Test
  void poolStartupFailureIsFatal() {
    WorkerPool broken = new WorkerPool(settings(1, 5_000, 4), () -> {
      throw new IllegalStateException("no analyzers");
    }, metrics, events);
    orchestrator = new AnalysisOrchestrator(broken, 10_000);

    assertThrows(PoolInitException.class,
        () -> orchestrator.process(List.of(new SourceFile("a.js", "quick")), SCRIPTED));
  }

  @Test
  void postProcessorFiltersIssuesWhenRequested() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    IssuePostProcessor dropAll = (path, issues) -> {
      calls.incrementAndGet();
      return List.of();
    };
    orchestrator = orchestrator(settings(2, 5_000, 16), 10_000, dropAll);
    List<SourceFile> files = List.of(new SourceFile("a.js", "quick"));

    BatchResult unfiltered = orchestrator.process(files, SCRIPTED);
    BatchResult filtered = orchestrator.process(files, SCRIPTED.withReduceFalsePositives(true));

    assertEquals(1, unfiltered.allIssues().size());
    assertTrue(filtered.allIssues().isEmpty());
    assertEquals(1, calls.get());
    assertEquals(1L, metrics.observation("pipeline.issues.suppressed"));
  }

  @Test
  void postProcessorFailureKeepsUnfilteredIssues() throws Exception {
    IssuePostProcessor broken = (path, issues) -> {
      throw new IllegalStateException("model unavailable");
    };
    orchestrator = orchestrator(settings(1, 5_000, 16), 10_000, broken);

    BatchResult result = orchestrator.process(
        List.of(new SourceFile("a.js", "quick")), SCRIPTED.withReduceFalsePositives(true));

    assertTrue(result.complete());
    assertEquals(1, result.allIssues().size());
  }

  @Test
  void emptyBatchCompletesAndPublishesStart() throws Exception {
    orchestrator = orchestrator(settings(1, 5_000, 4), 10_000, IssuePostProcessor.IDENTITY);

    BatchResult result = orchestrator.process(List.of(), SCRIPTED);

    assertTrue(result.files().isEmpty());
    assertTrue(result.complete());
    assertEquals(0, result.statistics().totalTasks());
    EngineEvent start = events.ofType(EngineEvent.Type.PROCESSING_START).get(0);
    assertEquals("0", start.attribute("files"));
    assertEquals(result.batchId(), start.attribute("batch"));
  }

  @Test
  void unknownAnalyzerProducesEmptyResult() throws Exception {
    orchestrator = orchestrator(settings(1, 5_000, 4), 10_000, IssuePostProcessor.IDENTITY);

    BatchResult result = orchestrator.process(
        List.of(new SourceFile("a.rb", "puts 1")), AnalysisOptions.defaults().withAnalyzers(List.of("ruby")));

    assertTrue(result.complete());
    assertTrue(result.allIssues().isEmpty());
    assertEquals(1L, result.files().get(0).stats().get("ruby").get("linesAnalyzed"));
  }

  private AnalysisOrchestrator orchestrator(PoolSettings settings, long batchTimeoutMs, IssuePostProcessor post) {
    WorkerPool pool = new WorkerPool(settings, analysis.setup(), metrics, events);
    return new AnalysisOrchestrator(pool, batchTimeoutMs, post, metrics, events);
  }

  private static PoolSettings settings(int workers, long timeoutMs, int capacity) {
    return new PoolSettings(workers, timeoutMs, capacity, 2_000, 3, 5_000);
  }

  private static Map<String, TaskOutcome.Status> statusByFile(BatchResult result) {
    Map<String, TaskOutcome.Status> statuses = new HashMap<>();
    for (TaskOutcome outcome : result.statistics().tasks()) {
      statuses.put(outcome.filePath(), outcome.status());
    }
    return statuses;
  }
}
