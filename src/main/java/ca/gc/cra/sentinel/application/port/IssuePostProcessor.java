package ca.gc.cra.sentinel.application.port;

import ca.gc.cra.sentinel.domain.issue.Issue;
import java.util.List;

/**
 * <strong>What:</strong> Port applied to the merged findings of one file before they are reported.
 * <p><strong>Why:</strong> False-positive reduction depends on project context the engine does not
 * own; the orchestrator only hands issues over when the batch asks for it.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface IssuePostProcessor {
  /**
   * Filters or rewrites findings for one file.
   *
   * @param filePath analysed file path
   * @param issues merged findings from every analyzer for that file
   * @return findings to report; never {@code null}
   */
  List<Issue> process(String filePath, List<Issue> issues);

  /**
   * Post-processor returning issues unchanged.
   */
  IssuePostProcessor IDENTITY = (filePath, issues) -> issues;
}
