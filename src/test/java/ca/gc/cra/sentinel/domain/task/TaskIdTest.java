package ca.gc.cra.sentinel.domain.task;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TaskIdTest {

  @Test
  void generatorProducesUniqueSequencedIds() {
    TaskId.Generator generator = TaskId.generator();
    Set<TaskId> seen = new HashSet<>();
    for (int i = 0; i < 1_000; i++) {
      seen.add(generator.next());
    }

    assertEquals(1_000, seen.size());
    assertTrue(TaskId.generator().next().value().startsWith("task-1-"));
  }

  @Test
  void blankIdsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> new TaskId(" "));
    assertThrows(NullPointerException.class, () -> new TaskId(null));
  }

  @Test
  void payloadOptionsAreCopied() {
    Map<String, String> options = new HashMap<>(Map.of("maxLineLength", "80"));
    TaskPayload payload = new TaskPayload("a.js", "x", options);
    options.clear();

    AnalysisTask task = new AnalysisTask(new TaskId("t-1"), "quality", payload);

    assertEquals("a.js", task.filePath());
    assertEquals("80", task.payload().options().get("maxLineLength"));
    assertTrue(TaskPayload.of("b.js", "").options().isEmpty());
  }
}
