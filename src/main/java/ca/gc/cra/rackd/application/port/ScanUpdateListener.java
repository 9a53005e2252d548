package ca.gc.cra.rackd.application.port;

import ca.gc.cra.rackd.domain.discovery.DiscoveryScan;

/**
 * Receives scan snapshots at each reporting point: creation, failure, milestone progress and completion.
 *
 * <p>Snapshots arrive in order of non-decreasing {@code scannedHosts}. Calls may come from any host task
 * thread but never concurrently.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ScanUpdateListener {
  /**
   * Handles a snapshot.
   *
   * @param scan current aggregate
   */
  void onUpdate(DiscoveryScan scan);

  /** Listener that ignores every update. */
  ScanUpdateListener NO_OP = scan -> {};
}
