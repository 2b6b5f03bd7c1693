package ca.gc.cra.sentinel.application.pipeline;

import ca.gc.cra.sentinel.domain.issue.Issue;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link AnalysisOrchestrator#process}: one entry per input file plus task statistics.
 *
 * @param batchId identifier used in logs ({@code batch} MDC key)
 * @param files per-file results, in input order
 * @param statistics task statistics
 * @since 0.1.0
 */
public record BatchResult(String batchId, List<FileAnalysisResult> files, BatchStatistics statistics) {

  public BatchResult {
    Objects.requireNonNull(batchId, "batchId");
    Objects.requireNonNull(statistics, "statistics");
    files = files == null ? List.of() : List.copyOf(files);
  }

  /**
   * @return every issue from non-degraded files, in file order
   */
  public List<Issue> allIssues() {
    List<Issue> issues = new ArrayList<>();
    for (FileAnalysisResult file : files) {
      issues.addAll(file.issues());
    }
    return issues;
  }

  public boolean complete() {
    return files.stream().noneMatch(FileAnalysisResult::isDegraded);
  }

  /**
   * Renders partial-result notices for the reporting layer.
   *
   * @return one {@code analysis incomplete for file X: reason} line per degraded file
   */
  public List<String> incompleteNotices() {
    List<String> notices = new ArrayList<>();
    for (FileAnalysisResult file : files) {
      if (file.isDegraded()) {
        notices.add("analysis incomplete for file " + file.filePath() + ": " + file.error());
      }
    }
    return notices;
  }
}
