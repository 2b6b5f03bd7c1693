package ca.gc.cra.sentinel.application.analysis;

import ca.gc.cra.sentinel.domain.issue.Issue;
import ca.gc.cra.sentinel.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Applies {@link LineRule} tables to file content. Each rule reports at most one finding per line, at
 * the column of its first match.
 *
 * @since 0.1.0
 */
final class LineRuleScanner {
  private static final int SNIPPET_MAX_BYTES = 200;

  private LineRuleScanner() {
    // Utility
  }

  static String[] lines(String content) {
    return content.split("\n", -1);
  }

  static List<Issue> scan(String analyzerName, String filePath, String[] lines, List<LineRule> rules) {
    List<Issue> issues = new ArrayList<>();
    for (int index = 0; index < lines.length; index++) {
      String line = stripCarriageReturn(lines[index]);
      for (LineRule rule : rules) {
        Matcher matcher = rule.pattern().matcher(line);
        if (!matcher.find()) {
          continue;
        }
        String snippet = rule.maskMatch() ? Logs.mask(line.trim(), matcher.group()) : line.trim();
        issues.add(new Issue(
            rule.severity(),
            rule.type(),
            rule.title(),
            rule.message(),
            filePath,
            index + 1,
            matcher.start() + 1,
            Logs.truncate(snippet, SNIPPET_MAX_BYTES),
            rule.suggestion(),
            analyzerName));
      }
    }
    return issues;
  }

  static String stripCarriageReturn(String line) {
    return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
  }
}
