package ca.gc.cra.rackd.infrastructure.metrics;

import ca.gc.cra.rackd.application.port.MetricsPort;

/**
 * Metrics adapter that discards discovery counters.
 * <p>Selected when {@code metricsExporter=none}; thread-safe and stateless.</p>
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  /** Creates a no-op metrics adapter. */
  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
