package ca.gc.cra.sentinel.domain.issue;

import java.util.Objects;

/**
 * <strong>What:</strong> Finding produced by an analyzer for a single source location.
 * <p><strong>Role:</strong> Record handed downstream to false-positive reduction and reporting.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param severity finding severity; never {@code null}
 * @param type kebab-case rule identifier (e.g., {@code sql-injection})
 * @param title short human-readable rule name
 * @param message finding description
 * @param file analysed file path
 * @param line one-based line number
 * @param column one-based column, or {@code 0} when unknown
 * @param snippet trimmed source line; may be empty
 * @param suggestion remediation hint; may be empty
 * @param analyzer name of the analyzer that produced the finding
 * @since 0.1.0
 */
public record Issue(
    Severity severity,
    String type,
    String title,
    String message,
    String file,
    int line,
    int column,
    String snippet,
    String suggestion,
    String analyzer) {

  /**
   * Validates mandatory fields and normalizes optional text.
   */
  public Issue {
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(file, "file");
    title = title == null ? type : title;
    message = message == null ? "" : message;
    snippet = snippet == null ? "" : snippet;
    suggestion = suggestion == null ? "" : suggestion;
    analyzer = analyzer == null ? "" : analyzer;
    if (line < 1) {
      throw new IllegalArgumentException("line must be >= 1 (was " + line + ")");
    }
    column = Math.max(0, column);
  }
}
