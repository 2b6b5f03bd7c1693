package ca.gc.cra.sentinel.infrastructure.events;

import ca.gc.cra.sentinel.application.port.EngineEventSink;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.domain.events.EngineEvent;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes engine events as single-line structured logs and counts them per type.
 * <p>Task-level events log at DEBUG; crashes, timeouts, queue saturation and shutdown log at INFO
 * or WARN.</p>
 *
 * @since 0.1.0
 */
public final class LoggingEngineEventSink implements EngineEventSink {
  private static final Logger log = LoggerFactory.getLogger(LoggingEngineEventSink.class);
  private static final String DEFAULT_PREFIX = "engineEvents";

  private final MetricsPort metrics;
  private final String metricPrefix;

  /**
   * Creates a sink.
   *
   * @param metrics metrics adapter; {@link MetricsPort#NO_OP} when {@code null}
   * @param metricPrefix counter prefix; {@code engineEvents} when blank
   */
  public LoggingEngineEventSink(MetricsPort metrics, String metricPrefix) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix = metricPrefix == null || metricPrefix.isBlank() ? DEFAULT_PREFIX : metricPrefix.trim();
  }

  public LoggingEngineEventSink(MetricsPort metrics) {
    this(metrics, DEFAULT_PREFIX);
  }

  @Override
  public void publish(EngineEvent event) {
    Objects.requireNonNull(event, "event");
    metrics.increment(metricPrefix + "." + event.key());

    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("type=" + event.key());
    joiner.add("timestamp=" + event.timestampMillis());
    for (Map.Entry<String, String> entry : new TreeMap<>(event.attributes()).entrySet()) {
      joiner.add(entry.getKey() + "=" + entry.getValue());
    }

    switch (event.type()) {
      case WORKER_CRASHED, TASK_TIMEOUT, QUEUE_FULL -> log.warn("engine.event {}", joiner);
      case PROCESSING_START, WORKER_RESPAWNED, SHUTDOWN_COMPLETE -> log.info("engine.event {}", joiner);
      default -> log.debug("engine.event {}", joiner);
    }
  }
}
