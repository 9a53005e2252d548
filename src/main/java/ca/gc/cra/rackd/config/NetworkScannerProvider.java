package ca.gc.cra.rackd.config;

import ca.gc.cra.rackd.application.port.NetworkScanner;

/**
 * Service-provider interface for alternative {@link NetworkScanner} implementations.
 *
 * <p>Providers are discovered with {@link java.util.ServiceLoader} from
 * {@code META-INF/services/ca.gc.cra.rackd.config.NetworkScannerProvider} and selected by
 * {@link #name()} through the {@code scanner} configuration key.</p>
 *
 * @since 0.1.0
 */
public interface NetworkScannerProvider {
  /**
   * Returns the name operators use to select this provider.
   *
   * @return lower-case identifier, unique among providers
   */
  String name();

  /**
   * Builds a scanner wired to the shared collaborators.
   *
   * @param environment store, metrics, clock and tuning for the scanner
   * @return ready scanner
   */
  NetworkScanner create(ScannerEnvironment environment);
}
