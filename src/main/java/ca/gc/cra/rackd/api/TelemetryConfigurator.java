package ca.gc.cra.rackd.api;

import ca.gc.cra.rackd.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the metrics settings out of the scan config and into the {@code otel.*} system properties that the
 * OpenTelemetry bootstrap reads.
 *
 * <table>
 *   <caption>Config keys</caption>
 *   <tr><th>Key</th><th>Property</th></tr>
 *   <tr><td>{@code metricsExporter}</td><td>{@code otel.metrics.exporter}</td></tr>
 *   <tr><td>{@code otelEndpoint}</td><td>{@code otel.exporter.otlp.endpoint}</td></tr>
 *   <tr><td>{@code otelResourceAttributes}</td><td>{@code otel.resource.attributes}</td></tr>
 * </table>
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * @param settings mutable effective configuration; the three keys are removed from it
   * @return {@code true} when {@code metricsExporter=otlp}
   * @throws IllegalArgumentException when a value is malformed
   */
  static boolean configureMetrics(Map<String, String> settings) {
    if (settings == null) {
      return false;
    }
    String exporter = take(settings, "metricsExporter");
    String endpoint = take(settings, "otelEndpoint");
    String resource = take(settings, "otelResourceAttributes");

    if (exporter != null) {
      exporter = exporter.toLowerCase(Locale.ROOT);
      if (!"otlp".equals(exporter) && !"none".equals(exporter)) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      publish("otel.metrics.exporter", exporter);
    }
    if (endpoint != null) {
      publish("otel.exporter.otlp.endpoint", requireHttpEndpoint(endpoint));
    }
    if (resource != null) {
      Strings.requirePrintableAscii("otelResourceAttributes", resource, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      publish("otel.resource.attributes", resource);
    }
    return "otlp".equals(exporter);
  }

  /** Removes {@code key}; blank values count as absent. */
  private static String take(Map<String, String> settings, String key) {
    String value = settings.remove(key);
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static void publish(String property, String value) {
    log.debug("Setting {}={}", property, value);
    System.setProperty(property, value);
  }

  private static String requireHttpEndpoint(String endpoint) {
    URI uri;
    try {
      uri = new URI(endpoint);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
    return endpoint;
  }
}
