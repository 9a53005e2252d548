package ca.gc.cra.rackd.config;

import ca.gc.cra.rackd.application.port.ClockPort;
import ca.gc.cra.rackd.application.port.DiscoveryStorePort;
import ca.gc.cra.rackd.application.port.MetricsPort;
import ca.gc.cra.rackd.application.port.NetworkScanner;
import ca.gc.cra.rackd.infrastructure.probe.RawSocketPrivilegeProbe;
import ca.gc.cra.rackd.infrastructure.time.SystemClockAdapter;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * <strong>What:</strong> Wires a {@link NetworkScanner} from configuration and shared adapters.
 * <p><strong>Why:</strong> Keeps adapter selection (scanner provider, privilege detection, clock) in one place so
 * the CLI only deals with configuration and results.</p>
 * <p><strong>Thread-safety:</strong> Not synchronized; build the graph during startup.</p>
 *
 * @since 0.1.0
 * @see NetworkScannerRegistry
 */
public final class CompositionRoot {
  private final DiscoveryConfig config;
  private final DiscoveryStorePort store;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final NetworkScannerRegistry registry;
  private final BooleanSupplier privilegeCheck;

  /**
   * Creates a composition root using ServiceLoader-discovered providers and live privilege detection.
   *
   * @param config validated scan configuration
   * @param store inventory store the scanner writes to
   * @param metrics metrics sink
   */
  public CompositionRoot(DiscoveryConfig config, DiscoveryStorePort store, MetricsPort metrics) {
    this(config, store, metrics, new SystemClockAdapter(), NetworkScannerRegistry.load(),
        RawSocketPrivilegeProbe::detect);
  }

  CompositionRoot(
      DiscoveryConfig config,
      DiscoveryStorePort store,
      MetricsPort metrics,
      ClockPort clock,
      NetworkScannerRegistry registry,
      BooleanSupplier privilegeCheck) {
    this.config = Objects.requireNonNull(config, "config");
    this.store = Objects.requireNonNull(store, "store");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.privilegeCheck = Objects.requireNonNull(privilegeCheck, "privilegeCheck");
  }

  /**
   * Builds the configured scanner; raw socket privilege is probed here, once.
   *
   * @return scanner selected by {@code scanner}
   * @throws IllegalArgumentException when the configured provider is unknown
   */
  public NetworkScanner networkScanner() {
    NetworkScannerProvider provider = registry.lookup(config.scanner());
    ScannerEnvironment environment = new ScannerEnvironment(
        store,
        metrics,
        clock,
        config.settings(),
        config.serviceConnectTimeout(),
        config.bannerReadTimeout(),
        privilegeCheck.getAsBoolean());
    return provider.create(environment);
  }

  /** @return metrics sink shared by the scanner and listeners */
  public MetricsPort metrics() {
    return metrics;
  }
}
