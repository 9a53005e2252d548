package ca.gc.cra.rackd.infrastructure.persistence;

import ca.gc.cra.rackd.application.port.DiscoveryStorePort;
import ca.gc.cra.rackd.application.port.MetricsPort;
import ca.gc.cra.rackd.application.port.ScanUpdateListener;
import ca.gc.cra.rackd.domain.discovery.DiscoveryScan;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every reported scan snapshot to the store, then forwards it to an optional downstream listener.
 *
 * <p>Store failures are logged at ERROR and counted as {@code discovery.persist.failure}; they never abort the
 * scan.</p>
 *
 * @since 0.1.0
 */
public final class PersistingScanUpdateListener implements ScanUpdateListener {
  private static final Logger log = LoggerFactory.getLogger(PersistingScanUpdateListener.class);

  private final DiscoveryStorePort store;
  private final MetricsPort metrics;
  private final ScanUpdateListener downstream;

  /**
   * Creates a listener.
   *
   * @param store destination of scan snapshots
   * @param metrics metrics sink for store failures
   * @param downstream listener called after each write attempt; may be {@code null}
   */
  public PersistingScanUpdateListener(DiscoveryStorePort store, MetricsPort metrics, ScanUpdateListener downstream) {
    this.store = Objects.requireNonNull(store, "store");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.downstream = downstream == null ? ScanUpdateListener.NO_OP : downstream;
  }

  @Override
  public void onUpdate(DiscoveryScan scan) {
    try {
      store.updateDiscoveryScan(scan);
    } catch (Exception ex) {
      if (ex instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      metrics.increment("discovery.persist.failure");
      log.error("Failed to persist scan {} ({})", scan.id(), scan.status().wireName(), ex);
    }
    downstream.onUpdate(scan);
  }
}
