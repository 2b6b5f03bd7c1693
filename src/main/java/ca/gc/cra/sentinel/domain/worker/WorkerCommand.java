package ca.gc.cra.sentinel.domain.worker;

import ca.gc.cra.sentinel.domain.task.AnalysisTask;
import java.util.Objects;

/**
 * <strong>What:</strong> Inbound message delivered to a worker inbox.
 * <p><strong>Why:</strong> Workers share no state with the coordinator; every instruction travels as
 * an immutable command processed in FIFO order.</p>
 *
 * @param type command discriminator
 * @param task task to execute for {@link Type#TASK}; {@code null} for {@link Type#SHUTDOWN}
 * @since 0.1.0
 */
public record WorkerCommand(Type type, AnalysisTask task) {

  /** Command discriminator. */
  public enum Type {
    /** Execute the attached task. */
    TASK,
    /** Acknowledge and exit; later commands are never processed. */
    SHUTDOWN
  }

  private static final WorkerCommand SHUTDOWN_COMMAND = new WorkerCommand(Type.SHUTDOWN, null);

  /**
   * Validates that TASK commands carry a task.
   */
  public WorkerCommand {
    Objects.requireNonNull(type, "type");
    if (type == Type.TASK && task == null) {
      throw new IllegalArgumentException("TASK command requires a task");
    }
  }

  /**
   * Wraps a task for execution.
   *
   * @param task task to run
   * @return task command
   */
  public static WorkerCommand task(AnalysisTask task) {
    return new WorkerCommand(Type.TASK, Objects.requireNonNull(task, "task"));
  }

  /**
   * Returns the shared shutdown command.
   *
   * @return shutdown command
   */
  public static WorkerCommand shutdown() {
    return SHUTDOWN_COMMAND;
  }
}
