package ca.gc.cra.sentinel.infrastructure.metrics;

import ca.gc.cra.sentinel.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} backed by OpenTelemetry counters and histograms.
 * <p><strong>Naming:</strong> each dotted key ({@code engine.task.completed}) maps to one lazily created
 * instrument; the original key travels as the {@code sentinel.metric.key} attribute.</p>
 * <p><strong>Thread-safety:</strong> instruments are cached in concurrent maps; safe from any thread.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("sentinel.metric.key");
  private static final String FALLBACK_NAME = "sentinel.metric";
  private static final int MAX_NAME_LENGTH = 255;

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter configured from {@code otel.*} system properties or {@code OTEL_*} variables.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
  }

  /**
   * Reports whether metrics are discarded because no exporter is configured.
   *
   * @return {@code true} when running without an exporter
   */
  public boolean isNoop() {
    return bootstrap.isNoop();
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    Instrument<LongCounter> counter = counters.computeIfAbsent(key, k -> new Instrument<>(
        meter.counterBuilder(sanitizeName(k)).setUnit("1").setDescription("SENTINEL counter " + k).build(),
        Attributes.of(METRIC_KEY, k)));
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    Instrument<LongHistogram> histogram = histograms.computeIfAbsent(key, k -> new Instrument<>(
        meter.histogramBuilder(sanitizeName(k)).ofLongs().setDescription("SENTINEL observation " + k).build(),
        Attributes.of(METRIC_KEY, k)));
    histogram.instrument().record(value, histogram.attributes());
  }

  /**
   * Pushes buffered measurements to the exporter.
   */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  /**
   * Flushes and shuts down the meter provider.
   */
  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  static String sanitizeName(String key) {
    String trimmed = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return FALLBACK_NAME;
    }
    StringBuilder name = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < trimmed.length() && name.length() < MAX_NAME_LENGTH; i++) {
      char c = trimmed.charAt(i);
      boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-' || c == '.';
      name.append(allowed ? c : '_');
    }
    String sanitized = name.toString();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }

  private record Instrument<T>(T instrument, Attributes attributes) {}
}
