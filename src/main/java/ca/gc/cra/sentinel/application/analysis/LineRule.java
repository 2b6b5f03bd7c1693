package ca.gc.cra.sentinel.application.analysis;

import ca.gc.cra.sentinel.domain.issue.Severity;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Line-oriented regex rule: a finding is emitted for every line the pattern matches.
 *
 * @param type kebab-case rule identifier reported as {@code Issue.type}
 * @param title human-readable rule name
 * @param pattern compiled pattern searched within each line
 * @param severity severity of a finding
 * @param message finding message
 * @param suggestion remediation hint; may be empty
 * @param maskMatch whether the matched text is masked in the reported snippet
 * @since 0.1.0
 */
public record LineRule(
    String type,
    String title,
    Pattern pattern,
    Severity severity,
    String message,
    String suggestion,
    boolean maskMatch) {

  public LineRule {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(severity, "severity");
    message = message == null ? title : message;
    suggestion = suggestion == null ? "" : suggestion;
  }

  /**
   * Builds a rule whose type is derived from its title, e.g. {@code SQL Injection -> sql-injection}.
   *
   * @param title rule name
   * @param regex pattern source
   * @param flags {@link Pattern} flags
   * @param severity finding severity
   * @param message finding message
   * @param suggestion remediation hint
   * @return compiled rule
   */
  static LineRule titled(String title, String regex, int flags, Severity severity, String message, String suggestion) {
    String type = title.toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
    return new LineRule(type, title, Pattern.compile(regex, flags), severity, message, suggestion, false);
  }
}
