package ca.gc.cra.rackd.application.port;

import ca.gc.cra.rackd.domain.discovery.DiscoveredDevice;
import ca.gc.cra.rackd.domain.discovery.DiscoveryScan;
import ca.gc.cra.rackd.domain.discovery.Network;

/**
 * <strong>What:</strong> Port to the persistent inventory store used by discovery.
 * <p><strong>Why:</strong> The scanner reads the network being scanned and writes per-host results and scan
 * aggregates without knowing the storage technology.</p>
 * <p><strong>Role:</strong> Secondary port implemented by store adapters.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent device upserts; up to the host pool
 * size may be in flight at once.</p>
 * <p><strong>Observability:</strong> Failures are logged by callers and counted as {@code discovery.persist.failure}.</p>
 *
 * @since 0.1.0
 */
public interface DiscoveryStorePort {
  /**
   * Resolves the network that owns a scan.
   *
   * @param networkId network identifier
   * @return network with its subnet
   * @throws NetworkNotFoundException when the id is unknown
   * @throws Exception when the store cannot be read
   */
  Network getNetwork(String networkId) throws Exception;

  /**
   * Inserts or replaces the record for {@code device.ip()}; the latest write wins.
   *
   * @param device discovered device
   * @throws Exception when the store rejects the write
   */
  void createOrUpdateDiscoveredDevice(DiscoveredDevice device) throws Exception;

  /**
   * Persists the current aggregate of a scan.
   *
   * @param scan scan snapshot
   * @throws Exception when the store rejects the write
   */
  void updateDiscoveryScan(DiscoveryScan scan) throws Exception;
}
