package ca.gc.cra.rackd.application.port;

import ca.gc.cra.rackd.application.util.CancellationToken;
import ca.gc.cra.rackd.domain.discovery.DiscoveryRule;
import ca.gc.cra.rackd.domain.discovery.DiscoveryScan;

/**
 * <strong>What:</strong> Primary port for discovering the hosts of one network.
 * <p><strong>Why:</strong> Schedulers, API handlers and the CLI depend on this contract only, so an alternative
 * scanner can replace the built-in one without caller changes.</p>
 * <p><strong>Role:</strong> Implemented by {@code NetworkDiscoveryUseCase}; alternatives are published through
 * {@code NetworkScannerProvider}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must support concurrent scans of different networks.</p>
 *
 * @since 0.1.0
 */
public interface NetworkScanner {
  /**
   * Scans a network and blocks until the run is terminal.
   *
   * @param cancellation stops new host work from starting once cancelled
   * @param networkId network to scan
   * @param rule discovery policy, fixed for the run
   * @param onUpdate receives snapshots at creation, failure, milestone progress and completion
   * @return terminal snapshot with status {@code completed}
   * @throws ScanFailedException when the network cannot be resolved or its subnet cannot be enumerated; the
   *     failed snapshot has already been delivered to {@code onUpdate}
   */
  DiscoveryScan scanNetwork(
      CancellationToken cancellation, String networkId, DiscoveryRule rule, ScanUpdateListener onUpdate)
      throws ScanFailedException;
}
