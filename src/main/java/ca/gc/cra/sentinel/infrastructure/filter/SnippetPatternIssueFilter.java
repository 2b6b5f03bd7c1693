package ca.gc.cra.sentinel.infrastructure.filter;

import ca.gc.cra.sentinel.application.port.IssuePostProcessor;
import ca.gc.cra.sentinel.domain.issue.Issue;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link IssuePostProcessor} that drops issues whose message or snippet matches
 * a known-benign pattern for the reporting analyzer.
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class SnippetPatternIssueFilter implements IssuePostProcessor {
  private static final Logger log = LoggerFactory.getLogger(SnippetPatternIssueFilter.class);

  /**
   * Pattern scoped to a set of analyzers.
   *
   * @param pattern matched against issue message and snippet
   * @param analyzers analyzers whose issues the pattern applies to
   * @param reason logged when an issue is dropped
   */
  public record Suppression(Pattern pattern, Set<String> analyzers, String reason) {
    public Suppression {
      Objects.requireNonNull(pattern, "pattern");
      analyzers = Set.copyOf(analyzers);
      reason = reason == null ? "" : reason;
    }

    boolean matches(Issue issue) {
      if (!analyzers.contains(issue.analyzer())) {
        return false;
      }
      return pattern.matcher(issue.message()).find() || pattern.matcher(issue.snippet()).find();
    }
  }

  static final List<Suppression> DEFAULT_SUPPRESSIONS = List.of(
      new Suppression(Pattern.compile("process\\.env\\."), Set.of("security"),
          "environment variable access"),
      new Suppression(Pattern.compile("mock|test|dummy|sample|example", Pattern.CASE_INSENSITIVE),
          Set.of("security", "bugs"), "test or sample code"),
      new Suppression(Pattern.compile("//\\s*eslint-disable"), Set.of("quality"),
          "lint rule intentionally disabled"));

  private final List<Suppression> suppressions;

  public SnippetPatternIssueFilter() {
    this(DEFAULT_SUPPRESSIONS);
  }

  public SnippetPatternIssueFilter(List<Suppression> suppressions) {
    this.suppressions = List.copyOf(suppressions);
  }

  @Override
  public List<Issue> process(String filePath, List<Issue> issues) {
    List<Issue> kept = new ArrayList<>(issues.size());
    for (Issue issue : issues) {
      Suppression hit = firstMatch(issue);
      if (hit == null) {
        kept.add(issue);
      } else {
        log.debug("Suppressed {} at {}:{} ({})", issue.type(), filePath, issue.line(), hit.reason());
      }
    }
    return kept;
  }

  private Suppression firstMatch(Issue issue) {
    for (Suppression suppression : suppressions) {
      if (suppression.matches(issue)) {
        return suppression;
      }
    }
    return null;
  }
}
