package ca.gc.cra.sentinel.application.analysis;

import ca.gc.cra.sentinel.domain.issue.Issue;
import ca.gc.cra.sentinel.domain.issue.Severity;
import ca.gc.cra.sentinel.domain.task.TaskPayload;
import ca.gc.cra.sentinel.domain.task.TaskResult;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Bug analyzer: assignments inside conditions and loose equality comparisons.
 *
 * @since 0.1.0
 */
public final class BugRules {
  static final List<LineRule> RULES = List.of(
      new LineRule(
          "assignment-in-condition",
          "Assignment In Condition",
          Pattern.compile("\\bif\\s*\\([^=)]*[^=!<>]=[^=]"),
          Severity.HIGH,
          "Assignment used instead of comparison",
          "Use === or == for comparison",
          false),
      new LineRule(
          "loose-equality",
          "Loose Equality",
          Pattern.compile("[^=!]==[^=]"),
          Severity.MEDIUM,
          "Use strict equality (===) instead of (==)",
          "Replace == with ===",
          false));

  private BugRules() {
    // Utility
  }

  /**
   * Runs the bug rule table.
   *
   * @param analyzerName requested analyzer name
   * @param payload file to analyse
   * @return findings plus {@code linesAnalyzed} and {@code issuesFound}
   */
  public static TaskResult analyze(String analyzerName, TaskPayload payload) {
    String[] lines = LineRuleScanner.lines(payload.content());
    List<Issue> issues = LineRuleScanner.scan(analyzerName, payload.filePath(), lines, RULES);
    return new TaskResult(analyzerName, payload.filePath(), issues, Map.of(
        "linesAnalyzed", (long) lines.length,
        "issuesFound", (long) issues.size()));
  }
}
