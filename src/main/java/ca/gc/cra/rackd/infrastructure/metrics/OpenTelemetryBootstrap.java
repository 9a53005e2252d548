package ca.gc.cra.rackd.infrastructure.metrics;

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
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for one CLI run.
 *
 * <p>Each setting is read from its {@code otel.*} system property (the CLI copies config keys there) and then
 * from the matching {@code OTEL_*} environment variable.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String SCOPE = "ca.gc.cra.rackd";
  private static final String SERVICE = "rackd-discovery";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  private OpenTelemetryBootstrap() {}

  static BootstrapResult initialize() {
    try {
      ExporterMode mode = ExporterMode.from(setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER"));
      if (mode == ExporterMode.NONE) {
        log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
        return BootstrapResult.noop();
      }
      String endpoint = Objects.requireNonNullElse(
          setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT"), DEFAULT_ENDPOINT);
      Duration interval = parseInterval(setting("otel.metric.export.interval", "OTEL_METRIC_EXPORT_INTERVAL"));
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build())
          .setInterval(interval)
          .build();
      Attributes extra = parseResourceAttributes(setting("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES"));
      log.info("Discovery metrics exporting via OTLP to {} every {} s", endpoint, interval.toSeconds());
      return BootstrapResult.active(reader, extra);
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; metrics are dropped", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return BootstrapResult.active(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  static Duration parseInterval(String raw) {
    if (raw == null || raw.isBlank()) {
      return DEFAULT_INTERVAL;
    }
    long millis;
    try {
      millis = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      log.warn("Ignoring malformed metric export interval '{}'", raw);
      return DEFAULT_INTERVAL;
    }
    if (millis <= 0) {
      log.warn("Ignoring non-positive metric export interval {} ms", millis);
      return DEFAULT_INTERVAL;
    }
    return Duration.ofMillis(millis);
  }

  private static String setting(String property, String environment) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(environment);
    }
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null) {
      return builder.build();
    }
    for (String token : raw.split(",")) {
      int idx = token.indexOf('=');
      String key = idx > 0 ? token.substring(0, idx).trim() : "";
      String value = idx > 0 ? token.substring(idx + 1).trim() : "";
      if (key.isEmpty() || value.isEmpty()) {
        if (!token.isBlank()) {
          log.warn("Ignoring malformed resource attribute '{}'", token.trim());
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static Resource resource(Attributes extra) {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    Attributes service = Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), SERVICE)
        .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
        .put(AttributeKey.stringKey("service.version"), version == null ? "dev" : version)
        .put(AttributeKey.stringKey("service.instance.id"), hostName())
        .build();
    return Resource.getDefault().merge(Resource.create(service)).merge(Resource.create(extra));
  }

  private static String hostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Local host name unavailable for service.instance.id", ex);
      return "unknown";
    }
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      if (raw == null) {
        return OTLP;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> {
          log.warn("Unknown metrics exporter '{}'; using otlp", raw);
          yield OTLP;
        }
      };
    }
  }

  /** Meter plus the provider that owns it; the provider is absent in noop mode. */
  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(SCOPE), null);
    }

    static BootstrapResult active(MetricReader reader, Attributes extraResource) {
      SdkMeterProvider provider = SdkMeterProvider.builder()
          .setResource(resource(extraResource))
          .registerMetricReader(reader)
          .build();
      return new BootstrapResult(provider.get(SCOPE), provider);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode result, String action) {
      result.join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry meter provider {} did not complete within {} s", action, SHUTDOWN_TIMEOUT_SECONDS);
      }
    }
  }
}
