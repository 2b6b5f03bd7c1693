package ca.gc.cra.sentinel.api;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies telemetry CLI options into the {@code otel.*} system properties read by the metrics bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private record Option(String property, UnaryOperator<String> validator) {}

  private static final Map<String, Option> OPTIONS = options();

  private TelemetryConfigurator() {}

  /**
   * Consumes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}; blank
   * values leave the corresponding property untouched.
   *
   * @param args mutable effective configuration; telemetry keys are removed
   * @throws IllegalArgumentException if a value is invalid
   */
  static void configureMetrics(Map<String, String> args) {
    for (Map.Entry<String, Option> entry : OPTIONS.entrySet()) {
      String raw = args.remove(entry.getKey());
      if (raw == null || raw.isBlank()) {
        continue;
      }
      Option option = entry.getValue();
      String value = option.validator().apply(raw.trim());
      log.debug("Setting {} from {}", option.property(), entry.getKey());
      System.setProperty(option.property(), value);
    }
  }

  private static Map<String, Option> options() {
    Map<String, Option> options = new LinkedHashMap<>();
    options.put("metricsExporter", new Option("otel.metrics.exporter", TelemetryConfigurator::exporter));
    options.put("otelEndpoint", new Option("otel.exporter.otlp.endpoint", TelemetryConfigurator::endpoint));
    options.put("otelResourceAttributes", new Option("otel.resource.attributes", TelemetryConfigurator::attributes));
    return Collections.unmodifiableMap(options);
  }

  private static String exporter(String raw) {
    String normalized = raw.toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    return normalized;
  }

  private static String endpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
    return raw;
  }

  private static String attributes(String raw) {
    if (raw.length() > MAX_RESOURCE_ATTRIBUTES_LENGTH || !raw.chars().allMatch(c -> c >= 0x20 && c < 0x7f)) {
      throw new IllegalArgumentException(
          "otelResourceAttributes must be printable ASCII up to " + MAX_RESOURCE_ATTRIBUTES_LENGTH + " chars");
    }
    return raw;
  }
}
