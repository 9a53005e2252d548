package ca.gc.cra.rackd.infrastructure.metrics;

import ca.gc.cra.rackd.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} backed by an OpenTelemetry {@link Meter}.
 * <p><strong>Why:</strong> Scan counters and host latencies reach the same OTLP collector as the rest of the
 * inventory stack.</p>
 * <p><strong>How:</strong> Each key becomes one instrument named after the lower-cased key, created on first
 * use and tagged with the original key as {@code rackd.metric.key}. Keys ending in {@code Nanos} are histograms
 * in {@code ns}. A noop bootstrap hands out a noop meter, so updates are dropped without branching here.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent host tasks.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("rackd.metric.key");
  private static final String UNNAMED = "rackd.metric";
  private static final Map<String, String> DESCRIPTIONS = Map.ofEntries(
      Map.entry("discovery.scan.started", "Scans started"),
      Map.entry("discovery.scan.completed", "Scans that reached completed"),
      Map.entry("discovery.scan.failed", "Scans aborted before host work"),
      Map.entry("discovery.host.scanned", "Hosts accounted for in a scan"),
      Map.entry("discovery.host.found", "Hosts that produced a device record"),
      Map.entry("discovery.host.excluded", "Hosts skipped by exclusion rules"),
      Map.entry("discovery.host.dropped", "Hosts dropped by quick-scan liveness"),
      Map.entry("discovery.host.cancelled", "Hosts skipped after cancellation"),
      Map.entry("discovery.host.failed", "Host pipelines that raised"),
      Map.entry("discovery.host.latencyNanos", "Per-host pipeline latency"),
      Map.entry("discovery.port.open", "Open TCP ports observed"),
      Map.entry("discovery.persist.failure", "Store writes that failed"));

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final Map<String, Counter> counters = new ConcurrentHashMap<>();
  private final Map<String, Histogram> histograms = new ConcurrentHashMap<>();

  /** Creates an adapter configured from {@code otel.*} properties and {@code OTEL_*} variables. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry exporter disabled; discovery metrics are dropped");
    }
  }

  @Override
  public void increment(String key) {
    Counter counter = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newCounter);
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Histogram histogram = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newHistogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Flushes pending points and shuts the meter provider down; call once the scan has finished. */
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  private Counter newCounter(String key) {
    LongCounter counter = meter.counterBuilder(instrumentName(key))
        .setUnit("1")
        .setDescription(describe(key))
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY, key));
  }

  private Histogram newHistogram(String key) {
    LongHistogram histogram = meter.histogramBuilder(instrumentName(key))
        .ofLongs()
        .setUnit(key.endsWith("Nanos") ? "ns" : "1")
        .setDescription(describe(key))
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY, key));
  }

  private static String describe(String key) {
    return DESCRIPTIONS.getOrDefault(key, "Discovery metric " + key);
  }

  static String instrumentName(String key) {
    String trimmed = key.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return UNNAMED;
    }
    StringBuilder name = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      boolean allowed = Character.isLetterOrDigit(c) || c == '.' || c == '_' || c == '-';
      name.append(allowed ? c : '_');
    }
    String result = name.toString();
    if (!result.equals(key)) {
      log.debug("Metric key '{}' exported as '{}'", key, result);
    }
    return result;
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}
