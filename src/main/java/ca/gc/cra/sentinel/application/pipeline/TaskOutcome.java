package ca.gc.cra.sentinel.application.pipeline;

import java.util.Objects;

/**
 * Settled state of one task within a batch.
 *
 * @param taskId task identifier
 * @param filePath analysed file
 * @param analyzer analyzer name
 * @param status how the task settled
 * @param durationMillis time from submission until the task settled
 * @param reason failure reason; empty for {@link Status#PASSED}
 * @since 0.1.0
 */
public record TaskOutcome(
    String taskId,
    String filePath,
    String analyzer,
    Status status,
    long durationMillis,
    String reason) {

  /** Task settlement status. */
  public enum Status {
    /** Result delivered. */
    PASSED,
    /** Analyzer threw an exception. */
    FAILED,
    /** Task or batch deadline expired. */
    TIMED_OUT,
    /** Worker died while running the task. */
    CRASHED,
    /** Pool refused or abandoned the task. */
    REJECTED
  }

  public TaskOutcome {
    Objects.requireNonNull(taskId, "taskId");
    Objects.requireNonNull(filePath, "filePath");
    Objects.requireNonNull(analyzer, "analyzer");
    Objects.requireNonNull(status, "status");
    durationMillis = Math.max(0L, durationMillis);
    reason = reason == null ? "" : reason;
  }

  public boolean passed() {
    return status == Status.PASSED;
  }
}
