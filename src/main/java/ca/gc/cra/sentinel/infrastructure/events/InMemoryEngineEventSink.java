package ca.gc.cra.sentinel.infrastructure.events;

import ca.gc.cra.sentinel.application.port.EngineEventSink;
import ca.gc.cra.sentinel.domain.events.EngineEvent;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Bounded in-memory sink used for tests and diagnostics; the oldest events are evicted first.
 *
 * @since 0.1.0
 */
public final class InMemoryEngineEventSink implements EngineEventSink {
  /** History size used by the no-arg constructor. */
  public static final int DEFAULT_MAX_HISTORY = 10_000;

  private final int maxHistorySize;
  private final Deque<EngineEvent> events = new ArrayDeque<>();

  public InMemoryEngineEventSink() {
    this(DEFAULT_MAX_HISTORY);
  }

  /**
   * Creates a sink retaining at most {@code maxHistorySize} events.
   *
   * @param maxHistorySize history bound; must be positive
   */
  public InMemoryEngineEventSink(int maxHistorySize) {
    if (maxHistorySize <= 0) {
      throw new IllegalArgumentException("maxHistorySize must be positive");
    }
    this.maxHistorySize = maxHistorySize;
  }

  @Override
  public synchronized void publish(EngineEvent event) {
    events.addLast(Objects.requireNonNull(event, "event"));
    while (events.size() > maxHistorySize) {
      events.removeFirst();
    }
  }

  /**
   * Returns a snapshot of retained events, oldest first.
   *
   * @return immutable list
   */
  public synchronized List<EngineEvent> snapshot() {
    return List.copyOf(events);
  }

  /**
   * Returns the retained events of one type.
   *
   * @param type event type
   * @return immutable list, oldest first
   */
  public synchronized List<EngineEvent> ofType(EngineEvent.Type type) {
    return events.stream().filter(e -> e.type() == type).toList();
  }

  public synchronized void clear() {
    events.clear();
  }
}
