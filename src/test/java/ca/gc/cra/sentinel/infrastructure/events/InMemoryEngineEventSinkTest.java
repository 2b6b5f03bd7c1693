package ca.gc.cra.sentinel.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.domain.events.EngineEvent;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryEngineEventSinkTest {

  @Test
  void keepsOnlyMostRecentEvents() {
    InMemoryEngineEventSink sink = new InMemoryEngineEventSink(2);

    sink.publish(EngineEvent.of(EngineEvent.Type.TASK_ASSIGNED, Map.of("taskId", "1")));
    sink.publish(EngineEvent.of(EngineEvent.Type.TASK_COMPLETED, Map.of("taskId", "1")));
    sink.publish(EngineEvent.of(EngineEvent.Type.TASK_ASSIGNED, Map.of("taskId", "2")));

    List<EngineEvent> history = sink.snapshot();
    assertEquals(2, history.size());
    assertEquals(EngineEvent.Type.TASK_COMPLETED, history.get(0).type());
    assertEquals("2", sink.ofType(EngineEvent.Type.TASK_ASSIGNED).get(0).attribute("taskId"));
  }

  @Test
  void clearEmptiesHistory() {
    InMemoryEngineEventSink sink = new InMemoryEngineEventSink();
    sink.publish(EngineEvent.of(EngineEvent.Type.QUEUE_FULL, Map.of()));

    sink.clear();

    assertTrue(sink.snapshot().isEmpty());
  }

  @Test
  void nonPositiveBoundIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new InMemoryEngineEventSink(0));
  }
}
