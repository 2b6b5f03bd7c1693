package ca.gc.cra.sentinel.testutil;

import ca.gc.cra.sentinel.application.analysis.AnalysisFunction;
import ca.gc.cra.sentinel.application.analysis.AnalyzerId;
import ca.gc.cra.sentinel.application.analysis.AnalyzerRegistry;
import ca.gc.cra.sentinel.domain.issue.Issue;
import ca.gc.cra.sentinel.domain.issue.Severity;
import ca.gc.cra.sentinel.domain.task.AnalysisTask;
import ca.gc.cra.sentinel.domain.task.TaskId;
import ca.gc.cra.sentinel.domain.task.TaskPayload;
import ca.gc.cra.sentinel.domain.task.TaskResult;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Analyzer whose behaviour is driven by the payload content, registered under
 * {@link AnalyzerId#SECURITY}.
 *
 * <ul>
 *   <li>{@code sleep:N} sleeps N milliseconds, then reports one issue</li>
 *   <li>{@code block} waits until {@link #release()} is called</li>
 *   <li>{@code fail:msg} throws an {@link IllegalStateException} with {@code msg}</li>
 *   <li>{@code crash} throws an {@link Error}, ending the worker</li>
 *   <li>{@code crash-after:N} sleeps N milliseconds, then crashes</li>
 *   <li>anything else reports one issue immediately</li>
 * </ul>
 */
public final class ScriptedAnalysis implements AnalysisFunction {
  public static final String ANALYZER = AnalyzerId.SECURITY.wireName();

  private final CountDownLatch gate = new CountDownLatch(1);
  private final AtomicInteger running = new AtomicInteger();
  private final AtomicInteger maxRunning = new AtomicInteger();
  private final AtomicInteger invocations = new AtomicInteger();

  @Override
  public TaskResult analyze(String analyzerName, TaskPayload payload) throws Exception {
    invocations.incrementAndGet();
    int now = running.incrementAndGet();
    maxRunning.accumulateAndGet(now, Math::max);
    try {
      String script = payload.content();
      if (script.startsWith("sleep:")) {
        Thread.sleep(Long.parseLong(script.substring("sleep:".length())));
      } else if (script.equals("block")) {
        gate.await();
      } else if (script.startsWith("fail:")) {
        throw new IllegalStateException(script.substring("fail:".length()));
      } else if (script.equals("crash")) {
        throw new InternalError("simulated worker crash");
      } else if (script.startsWith("crash-after:")) {
        Thread.sleep(Long.parseLong(script.substring("crash-after:".length())));
        throw new InternalError("simulated worker crash");
      }
      Issue issue = new Issue(Severity.MEDIUM, "scripted", "Scripted", script, payload.filePath(), 1, 1,
          script, "", analyzerName);
      return new TaskResult(analyzerName, payload.filePath(), List.of(issue), Map.of("linesAnalyzed", 1L));
    } finally {
      running.decrementAndGet();
    }
  }

  /** Worker setup building a registry that routes {@link #ANALYZER} to this function. */
  public Callable<AnalyzerRegistry> setup() {
    return () -> AnalyzerRegistry.builder().register(AnalyzerId.SECURITY, this).build();
  }

  public void release() {
    gate.countDown();
  }

  public int maxRunning() {
    return maxRunning.get();
  }

  public int invocations() {
    return invocations.get();
  }

  public static AnalysisTask task(String id, String script) {
    return new AnalysisTask(new TaskId(id), ANALYZER, TaskPayload.of(id + ".js", script));
  }
}
