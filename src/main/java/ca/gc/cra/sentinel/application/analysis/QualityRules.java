package ca.gc.cra.sentinel.application.analysis;

import ca.gc.cra.sentinel.domain.issue.Issue;
import ca.gc.cra.sentinel.domain.issue.Severity;
import ca.gc.cra.sentinel.domain.task.TaskPayload;
import ca.gc.cra.sentinel.domain.task.TaskResult;
import ca.gc.cra.sentinel.logging.Logs;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Quality analyzer: leftover console statements, overlong lines and a cyclomatic complexity estimate.
 *
 * <p>The maximum line length can be overridden with the {@code maxLineLength} task option.</p>
 *
 * @since 0.1.0
 */
public final class QualityRules {
  static final int DEFAULT_MAX_LINE_LENGTH = 120;
  static final String MAX_LINE_LENGTH_OPTION = "maxLineLength";

  private static final Pattern CONSOLE = Pattern.compile("\\bconsole\\.(log|warn|error|info)\\s*\\(");
  private static final Pattern BRANCH_KEYWORDS =
      Pattern.compile("\\b(if|else|for|while|case|catch)\\b|\\?|&&|\\|\\|");

  private QualityRules() {
    // Utility
  }

  /**
   * Runs the quality checks.
   *
   * @param analyzerName requested analyzer name
   * @param payload file to analyse
   * @return findings plus {@code linesAnalyzed}, {@code consoleStatements}, {@code longLines} and
   *     {@code complexity}
   */
  public static TaskResult analyze(String analyzerName, TaskPayload payload) {
    int maxLength = maxLineLength(payload.options());
    String[] lines = LineRuleScanner.lines(payload.content());
    List<Issue> issues = new ArrayList<>();
    long consoleCount = 0;
    long longLineCount = 0;
    for (int index = 0; index < lines.length; index++) {
      String line = LineRuleScanner.stripCarriageReturn(lines[index]);
      Matcher console = CONSOLE.matcher(line);
      if (console.find()) {
        consoleCount++;
        issues.add(new Issue(Severity.LOW, "console-statement", "Console Statement",
            "Console statement found", payload.filePath(), index + 1, console.start() + 1,
            Logs.truncate(line.trim(), 200), "Remove debug output or use a logger", analyzerName));
      }
      if (line.length() > maxLength) {
        longLineCount++;
        issues.add(new Issue(Severity.LOW, "line-too-long", "Line Too Long",
            "Line exceeds " + maxLength + " characters (" + line.length() + ")", payload.filePath(),
            index + 1, maxLength + 1, "", "Wrap the line", analyzerName));
      }
    }
    Map<String, Long> stats = new LinkedHashMap<>();
    stats.put("linesAnalyzed", (long) lines.length);
    stats.put("consoleStatements", consoleCount);
    stats.put("longLines", longLineCount);
    stats.put("complexity", complexity(payload.content()));
    return new TaskResult(analyzerName, payload.filePath(), issues, stats);
  }

  /**
   * Estimates cyclomatic complexity as one plus the number of branch keywords and operators.
   *
   * @param content source text
   * @return complexity, at least {@code 1}
   */
  static long complexity(String content) {
    long complexity = 1;
    Matcher matcher = BRANCH_KEYWORDS.matcher(content);
    while (matcher.find()) {
      complexity++;
    }
    return complexity;
  }

  private static int maxLineLength(Map<String, String> options) {
    String raw = options.get(MAX_LINE_LENGTH_OPTION);
    if (raw == null || raw.isBlank()) {
      return DEFAULT_MAX_LINE_LENGTH;
    }
    try {
      return Math.max(1, Integer.parseInt(raw.trim()));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(MAX_LINE_LENGTH_OPTION + " must be a whole number (was '" + raw + "')", ex);
    }
  }
}
