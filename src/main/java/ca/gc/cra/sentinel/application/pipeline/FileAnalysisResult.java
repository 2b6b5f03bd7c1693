package ca.gc.cra.sentinel.application.pipeline;

import ca.gc.cra.sentinel.domain.issue.Issue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Merged analysis outcome for one file.
 *
 * <p>When any task for the file failed, the entry is degraded: {@code issues} is empty and
 * {@code error} names every failed analyzer with its reason.</p>
 *
 * @param filePath analysed file
 * @param issues findings merged across analyzers; empty for degraded entries
 * @param stats analyzer statistics keyed by analyzer name
 * @param error failure summary, or {@code null} when every task passed
 * @since 0.1.0
 */
public record FileAnalysisResult(
    String filePath,
    List<Issue> issues,
    Map<String, Map<String, Long>> stats,
    String error) {

  public FileAnalysisResult {
    Objects.requireNonNull(filePath, "filePath");
    issues = issues == null ? List.of() : List.copyOf(issues);
    stats = stats == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stats));
  }

  /**
   * Creates a degraded entry.
   *
   * @param filePath analysed file
   * @param error failure summary
   * @return entry without issues
   */
  public static FileAnalysisResult degraded(String filePath, String error) {
    return new FileAnalysisResult(filePath, List.of(), Map.of(), Objects.requireNonNull(error, "error"));
  }

  public boolean isDegraded() {
    return error != null;
  }

  public Optional<String> errorMessage() {
    return Optional.ofNullable(error);
  }
}
