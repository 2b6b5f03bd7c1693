package ca.gc.cra.sentinel.application.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.domain.task.AnalysisTask;
import ca.gc.cra.sentinel.domain.task.TaskId;
import ca.gc.cra.sentinel.domain.task.TaskPayload;
import ca.gc.cra.sentinel.domain.task.TaskResult;
import org.junit.jupiter.api.Test;

class AnalyzerRegistryTest {

  @Test
  void namesResolveCaseInsensitively() {
    assertEquals(AnalyzerId.SECURITY, AnalyzerId.fromName(" Security "));
    assertEquals(AnalyzerId.SECRETS, AnalyzerId.fromName("secrets"));
    assertEquals(AnalyzerId.UNKNOWN, AnalyzerId.fromName("unknown"));
    assertEquals(AnalyzerId.UNKNOWN, AnalyzerId.fromName("style"));
    assertEquals(AnalyzerId.UNKNOWN, AnalyzerId.fromName(null));
  }

  @Test
  void unknownAnalyzerReturnsEmptyResultWithLineCount() throws Exception {
    TaskResult result = AnalyzerRegistry.defaults().run(task("style", "a\nb\nc"));

    assertTrue(result.issues().isEmpty());
    assertEquals("style", result.analyzer());
    assertEquals(3L, result.stats().get("linesAnalyzed"));
  }

  @Test
  void registeredFunctionReplacesBuiltIn() throws Exception {
    TaskResult canned = TaskResult.empty("bugs", "x.js", 0);
    AnalyzerRegistry registry = AnalyzerRegistry.builder()
        .register(AnalyzerId.BUGS, (name, payload) -> canned)
        .build();

    assertSame(canned, registry.run(task("bugs", "if (a == b) {}")));
    assertEquals(1, registry.run(task("performance", "for (i = 0; i < n; i++)")).issues().size());
  }

  @Test
  void nullResultIsRejected() {
    AnalyzerRegistry registry = AnalyzerRegistry.builder()
        .register(AnalyzerId.QUALITY, (name, payload) -> null)
        .build();

    assertThrows(NullPointerException.class, () -> registry.run(task("quality", "x")));
  }

  @Test
  void analyzerExceptionsPropagate() {
    AnalyzerRegistry registry = AnalyzerRegistry.builder()
        .register(AnalyzerId.SECURITY, (name, payload) -> {
          throw new IllegalStateException("rules corrupt");
        })
        .build();

    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> registry.run(task("security", "x")));
    assertEquals("rules corrupt", ex.getMessage());
  }

  private static AnalysisTask task(String analyzer, String content) {
    return new AnalysisTask(new TaskId("t-" + analyzer), analyzer, TaskPayload.of("x.js", content));
  }
}
