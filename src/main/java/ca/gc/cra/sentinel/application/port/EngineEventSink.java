package ca.gc.cra.sentinel.application.port;

import ca.gc.cra.sentinel.domain.events.EngineEvent;

/**
 * <strong>What:</strong> Outbound port receiving engine lifecycle events.
 * <p><strong>Why:</strong> Each engine instance publishes to its own sink, so two pools in one JVM
 * never observe each other's events.</p>
 * <p><strong>Thread-safety:</strong> Called from the coordinator thread and from orchestrator callers;
 * implementations must tolerate concurrent invocations and must not block.</p>
 *
 * @since 0.1.0
 */
public interface EngineEventSink extends AutoCloseable {
  /**
   * Publishes an event.
   *
   * @param event immutable event; never {@code null}
   */
  void publish(EngineEvent event);

  /**
   * Sink that discards every event.
   */
  EngineEventSink NO_OP = new EngineEventSink() {
    @Override public void publish(EngineEvent event) {}

    @Override public void close() {}
  };

  @Override
  default void close() {}
}
