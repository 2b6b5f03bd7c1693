package ca.gc.cra.sentinel.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("sentinel.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithKeyAndResource() {
    adapter.increment("engine.task.completed");
    adapter.increment("engine.task.completed");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "engine.task.completed");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("engine.task.completed", point.getAttributes().get(METRIC_KEY));
    assertEquals("sentinel", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    assertFalse(adapter.isNoop());
  }

  @Test
  void observeRecordsHistogramUnderSanitizedName() {
    adapter.observe("engine.task.latencyMs", 10L);
    adapter.observe("engine.task.latencyMs", 30L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "engine.task.latencyms");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(40.0, point.getSum());
    assertEquals("engine.task.latencyMs", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void sanitizeNameProducesValidInstrumentNames() {
    assertEquals("engineevents.task.timeout", OpenTelemetryMetricsAdapter.sanitizeName("engineEvents.task.timeout"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("a_b_c", OpenTelemetryMetricsAdapter.sanitizeName("a b/c"));
    assertEquals("sentinel.metric", OpenTelemetryMetricsAdapter.sanitizeName("  "));
    assertEquals(255, OpenTelemetryMetricsAdapter.sanitizeName("x".repeat(400)).length());
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("env=prod, broken, team = sec ,=x");

    assertEquals(2, attributes.size());
    assertEquals("prod", attributes.get(AttributeKey.stringKey("env")));
    assertEquals("sec", attributes.get(AttributeKey.stringKey("team")));
    assertTrue(OpenTelemetryBootstrap.parseResourceAttributes(null).isEmpty());
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " not exported"));
  }
}
