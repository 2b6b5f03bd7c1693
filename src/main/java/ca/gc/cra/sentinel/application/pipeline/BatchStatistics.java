package ca.gc.cra.sentinel.application.pipeline;

import java.util.List;

/**
 * Per-task statistics of a processed batch.
 *
 * @param tasks outcome of every task, in submission order
 * @param passed tasks that delivered a result
 * @param failed tasks whose analyzer threw
 * @param timedOut tasks that missed their task or batch deadline
 * @param crashed tasks lost to a worker crash
 * @param rejected tasks the pool refused or abandoned
 * @param totalDurationMillis wall-clock duration of the batch
 * @since 0.1.0
 */
public record BatchStatistics(
    List<TaskOutcome> tasks,
    int passed,
    int failed,
    int timedOut,
    int crashed,
    int rejected,
    long totalDurationMillis) {

  public BatchStatistics {
    tasks = tasks == null ? List.of() : List.copyOf(tasks);
  }

  /**
   * Tallies outcomes.
   *
   * @param tasks task outcomes
   * @param totalDurationMillis batch duration
   * @return statistics with counts derived from {@code tasks}
   */
  public static BatchStatistics of(List<TaskOutcome> tasks, long totalDurationMillis) {
    int passed = 0;
    int failed = 0;
    int timedOut = 0;
    int crashed = 0;
    int rejected = 0;
    for (TaskOutcome outcome : tasks) {
      switch (outcome.status()) {
        case PASSED -> passed++;
        case FAILED -> failed++;
        case TIMED_OUT -> timedOut++;
        case CRASHED -> crashed++;
        case REJECTED -> rejected++;
      }
    }
    return new BatchStatistics(tasks, passed, failed, timedOut, crashed, rejected, totalDurationMillis);
  }

  public int totalTasks() {
    return tasks.size();
  }

  /**
   * @return mean duration of settled tasks, or {@code 0} for an empty batch
   */
  public long averageTaskMillis() {
    if (tasks.isEmpty()) {
      return 0L;
    }
    long total = 0L;
    for (TaskOutcome outcome : tasks) {
      total += outcome.durationMillis();
    }
    return total / tasks.size();
  }
}
