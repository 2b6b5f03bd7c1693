package ca.gc.cra.sentinel.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.domain.events.EngineEvent;
import ca.gc.cra.sentinel.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingEngineEventSinkTest {
  private final Logger logger = (Logger) LoggerFactory.getLogger(LoggingEngineEventSink.class);
  private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
  private Level originalLevel;
  private boolean originalAdditive;

  @BeforeEach
  void attach() {
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setLevel(Level.DEBUG);
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void detach() {
    logger.detachAppender(appender);
    logger.setLevel(originalLevel);
    logger.setAdditive(originalAdditive);
    appender.stop();
  }

  @Test
  void publishLogsSortedAttributesAndCountsByType() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    LoggingEngineEventSink sink = new LoggingEngineEventSink(metrics, "testEvents");

    sink.publish(new EngineEvent(EngineEvent.Type.WORKER_CRASHED, 1_700_000_000_000L,
        Map.of("workerId", "2", "cause", "InternalError")));

    assertEquals(1L, metrics.counter("testEvents.worker.crashed"));
    List<ILoggingEvent> events = appender.list;
    assertEquals(1, events.size());
    assertEquals(Level.WARN, events.get(0).getLevel());
    assertEquals("engine.event type=worker.crashed, timestamp=1700000000000, cause=InternalError, workerId=2",
        events.get(0).getFormattedMessage());
  }

  @Test
  void levelsFollowEventSeverity() {
    LoggingEngineEventSink sink = new LoggingEngineEventSink(null);

    sink.publish(EngineEvent.of(EngineEvent.Type.TASK_ASSIGNED, Map.of()));
    sink.publish(EngineEvent.of(EngineEvent.Type.SHUTDOWN_COMPLETE, Map.of()));
    sink.publish(EngineEvent.of(EngineEvent.Type.QUEUE_FULL, Map.of()));

    assertEquals(List.of(Level.DEBUG, Level.INFO, Level.WARN),
        appender.list.stream().map(ILoggingEvent::getLevel).toList());
  }

  @Test
  void defaultPrefixIsEngineEvents() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    new LoggingEngineEventSink(metrics).publish(EngineEvent.of(EngineEvent.Type.TASK_TIMEOUT, Map.of("taskId", "t")));

    assertEquals(1L, metrics.counter("engineEvents.task.timeout"));
    assertTrue(appender.list.get(0).getFormattedMessage().contains("taskId=t"));
  }

  @Test
  void nullEventIsRejected() {
    LoggingEngineEventSink sink = new LoggingEngineEventSink(new RecordingMetricsPort());

    assertThrows(NullPointerException.class, () -> sink.publish(null));
  }
}
