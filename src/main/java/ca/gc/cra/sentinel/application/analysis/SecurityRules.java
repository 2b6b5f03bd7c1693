package ca.gc.cra.sentinel.application.analysis;

import ca.gc.cra.sentinel.domain.issue.Issue;
import ca.gc.cra.sentinel.domain.issue.Severity;
import ca.gc.cra.sentinel.domain.task.TaskPayload;
import ca.gc.cra.sentinel.domain.task.TaskResult;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Security analyzer: hardcoded credentials, injection-prone string building and unsafe DOM/eval use.
 *
 * @since 0.1.0
 */
public final class SecurityRules {
  static final List<LineRule> RULES = List.of(
      LineRule.titled(
          "Hardcoded Password",
          "(password|passwd|pwd)\\s*[:=]\\s*['\"][^'\"]{4,}['\"]",
          Pattern.CASE_INSENSITIVE,
          Severity.HIGH,
          "Potential Hardcoded Password vulnerability",
          "Load credentials from the environment or a secrets manager"),
      LineRule.titled(
          "SQL Injection",
          "(SELECT|INSERT|UPDATE|DELETE).*\\+",
          Pattern.CASE_INSENSITIVE,
          Severity.CRITICAL,
          "Potential SQL Injection vulnerability",
          "Use parameterized queries instead of string concatenation"),
      LineRule.titled(
          "Eval Usage",
          "\\beval\\s*\\(",
          0,
          Severity.HIGH,
          "Potential Eval Usage vulnerability",
          "Avoid eval; parse data explicitly"),
      LineRule.titled(
          "InnerHTML",
          "\\.innerHTML\\s*=",
          0,
          Severity.MEDIUM,
          "Potential InnerHTML vulnerability",
          "Use textContent or sanitize HTML before assignment"),
      LineRule.titled(
          "API Key",
          "api[_-]?key\\s*[:=]\\s*['\"][A-Za-z0-9]{20,}['\"]",
          Pattern.CASE_INSENSITIVE,
          Severity.HIGH,
          "Potential API Key vulnerability",
          "Move the key out of source control and rotate it"));

  private SecurityRules() {
    // Utility
  }

  /**
   * Runs the security rule table.
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
