package ca.gc.cra.sentinel.domain.task;

import ca.gc.cra.sentinel.domain.issue.Issue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Successful analysis outcome emitted by a worker.
 *
 * @param analyzer analyzer name as requested by the task
 * @param file analysed file path
 * @param issues findings, possibly empty
 * @param stats analyzer counters such as {@code linesAnalyzed}
 * @since 0.1.0
 */
public record TaskResult(String analyzer, String file, List<Issue> issues, Map<String, Long> stats) {

  /**
   * Copies collections so results stay immutable after crossing the worker boundary.
   */
  public TaskResult {
    Objects.requireNonNull(analyzer, "analyzer");
    Objects.requireNonNull(file, "file");
    issues = issues == null ? List.of() : List.copyOf(issues);
    stats = stats == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stats));
  }

  /**
   * Creates an empty result carrying only the analysed line count.
   *
   * @param analyzer analyzer name
   * @param file analysed file path
   * @param linesAnalyzed number of lines in the file
   * @return result without issues
   */
  public static TaskResult empty(String analyzer, String file, long linesAnalyzed) {
    return new TaskResult(analyzer, file, List.of(), Map.of("linesAnalyzed", linesAnalyzed));
  }
}
