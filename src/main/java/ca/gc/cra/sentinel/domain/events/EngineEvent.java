package ca.gc.cra.sentinel.domain.events;

import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Lifecycle notification emitted by the analysis engine.
 * <p><strong>Why:</strong> Lets observers (logs, dashboards, tests) follow dispatch, completion,
 * crashes and shutdown without coupling to the pool internals.</p>
 * <p><strong>Thread-safety:</strong> Immutable; attributes are copied.</p>
 *
 * @param type event discriminator
 * @param timestampMillis wall-clock time the event was created
 * @param attributes event details such as {@code taskId} or {@code workerId}
 * @since 0.1.0
 */
public record EngineEvent(Type type, long timestampMillis, Map<String, String> attributes) {

  /** Event discriminator; names mirror the dotted wire form returned by {@link #key()}. */
  public enum Type {
    PROCESSING_START("processing.start"),
    TASK_ASSIGNED("task.assigned"),
    TASK_COMPLETED("task.completed"),
    TASK_FAILED("task.failed"),
    TASK_TIMEOUT("task.timeout"),
    WORKER_CRASHED("worker.crashed"),
    WORKER_RESPAWNED("worker.respawned"),
    QUEUE_FULL("queue.full"),
    SHUTDOWN_COMPLETE("shutdown.complete");

    private final String key;

    Type(String key) {
      this.key = key;
    }

    public String key() {
      return key;
    }
  }

  public EngineEvent {
    Objects.requireNonNull(type, "type");
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  /**
   * Creates an event stamped with the current time.
   *
   * @param type event type
   * @param attributes event details; {@code null} values are not permitted
   * @return new event
   */
  public static EngineEvent of(Type type, Map<String, String> attributes) {
    return new EngineEvent(type, System.currentTimeMillis(), attributes);
  }

  /**
   * Dotted event name, e.g. {@code task.completed}.
   *
   * @return event key
   */
  public String key() {
    return type.key();
  }

  /**
   * Looks up an attribute.
   *
   * @param name attribute name
   * @return value or {@code null} when absent
   */
  public String attribute(String name) {
    return attributes.get(name);
  }
}
