package ca.gc.cra.sentinel.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider used by {@link OpenTelemetryMetricsAdapter}.
 * <p>Reads {@code otel.metrics.exporter}, {@code otel.exporter.otlp.endpoint},
 * {@code otel.metric.export.interval} and {@code otel.resource.attributes} from system properties,
 * falling back to the matching {@code OTEL_*} environment variables. The exporter defaults to
 * {@code none} because one-shot analysis runs rarely have a collector nearby.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.sentinel";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(10);
  private static final String SERVICE_VERSION = "0.1.0";
  private static final long FLUSH_TIMEOUT_SECONDS = 5;

  private OpenTelemetryBootstrap() {
    // Utility
  }

  static BootstrapResult initialize() {
    try {
      Settings settings = Settings.fromEnvironment();
      if (settings.exporter() == ExporterMode.NONE) {
        log.debug("OpenTelemetry metrics exporter disabled");
        return BootstrapResult.noop();
      }
      OtlpGrpcMetricExporter exporter =
          OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(settings.interval()).build();
      BootstrapResult result = withReader(reader, settings.resourceAttributes());
      log.info("OpenTelemetry metrics exporting to {} every {} s",
          settings.endpoint(), settings.interval().toSeconds());
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; metrics disabled", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return withReader(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult withReader(MetricReader reader, Attributes extraResource) {
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource(extraResource))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(SERVICE_VERSION)
        .build();
    return new BootstrapResult(meter, provider);
  }

  private static Resource resource(Attributes extra) {
    Attributes base = Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "sentinel")
        .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
        .put(AttributeKey.stringKey("service.version"), SERVICE_VERSION)
        .build();
    Resource merged = Resource.getDefault().merge(Resource.create(base));
    return extra.isEmpty() ? merged : merged.merge(Resource.create(extra));
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String entry = token.trim();
      int idx = entry.indexOf('=');
      if (idx <= 0 || idx == entry.length() - 1) {
        if (!entry.isEmpty()) {
          log.warn("Ignoring malformed resource attribute '{}'", entry);
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(entry.substring(0, idx).trim()), entry.substring(idx + 1).trim());
    }
    return builder.build();
  }

  private static String setting(String property, String env) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(env);
    }
    return value == null || value.isBlank() ? null : value.trim();
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      if (raw == null) {
        return NONE;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "otlp" -> OTLP;
        case "none", "" -> NONE;
        default -> {
          log.warn("Unknown metrics exporter '{}'; metrics disabled", raw);
          yield NONE;
        }
      };
    }
  }

  record Settings(ExporterMode exporter, String endpoint, Duration interval, Attributes resourceAttributes) {
    static Settings fromEnvironment() {
      ExporterMode exporter = ExporterMode.from(setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER"));
      String endpoint = setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT");
      String interval = setting("otel.metric.export.interval", "OTEL_METRIC_EXPORT_INTERVAL");
      Duration period = DEFAULT_INTERVAL;
      if (interval != null) {
        try {
          period = Duration.ofMillis(Math.max(1_000L, Long.parseLong(interval)));
        } catch (NumberFormatException ex) {
          log.warn("Ignoring non-numeric metric export interval '{}'", interval);
        }
      }
      return new Settings(
          exporter,
          endpoint == null ? DEFAULT_ENDPOINT : endpoint,
          period,
          parseResourceAttributes(setting("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES")));
    }
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        CompletableResultCode flush = provider.forceFlush().join(FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (!flush.isSuccess()) {
          log.warn("OpenTelemetry metrics flush did not complete within {} s", FLUSH_TIMEOUT_SECONDS);
        }
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        CompletableResultCode shutdown = provider.shutdown().join(FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out shutting down the OpenTelemetry meter provider");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
