package ca.gc.cra.sentinel.application.analysis;

import ca.gc.cra.sentinel.domain.issue.Issue;
import ca.gc.cra.sentinel.domain.issue.Severity;
import ca.gc.cra.sentinel.domain.task.TaskPayload;
import ca.gc.cra.sentinel.domain.task.TaskResult;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Performance analyzer: counting loops and nested array pushes.
 *
 * @since 0.1.0
 */
public final class PerformanceRules {
  static final List<LineRule> RULES = List.of(
      new LineRule(
          "inefficient-loop",
          "Inefficient Loop",
          Pattern.compile("for\\s*\\([^)]*\\+\\+\\s*\\)"),
          Severity.LOW,
          "Consider using reverse loop for better performance",
          "Cache the loop bound or iterate in reverse",
          false),
      new LineRule(
          "nested-push",
          "Nested Push",
          Pattern.compile("\\.push\\s*\\(.*\\.push\\s*\\("),
          Severity.LOW,
          "Nested array push detected",
          "Build the inner array first, then push once",
          false));

  private PerformanceRules() {
    // Utility
  }

  public static TaskResult analyze(String analyzerName, TaskPayload payload) {
    String[] lines = LineRuleScanner.lines(payload.content());
    List<Issue> issues = LineRuleScanner.scan(analyzerName, payload.filePath(), lines, RULES);
    return new TaskResult(analyzerName, payload.filePath(), issues, Map.of("linesAnalyzed", (long) lines.length));
  }
}
