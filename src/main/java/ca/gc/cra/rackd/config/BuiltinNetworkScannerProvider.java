package ca.gc.cra.rackd.config;

import ca.gc.cra.rackd.application.pipeline.NetworkDiscoveryUseCase;
import ca.gc.cra.rackd.application.port.NetworkScanner;
import ca.gc.cra.rackd.infrastructure.probe.ArpTableMacResolver;
import ca.gc.cra.rackd.infrastructure.probe.BannerServiceProber;
import ca.gc.cra.rackd.infrastructure.probe.IcmpReachabilityProber;
import ca.gc.cra.rackd.infrastructure.probe.ReverseDnsHostnameResolver;
import ca.gc.cra.rackd.infrastructure.probe.TcpConnectPortProber;

/**
 * Provides the reference scanner: ICMP reachability, neighbour-table MAC lookup, reverse DNS, TCP connect scan
 * and banner grabbing.
 *
 * @since 0.1.0
 */
public final class BuiltinNetworkScannerProvider implements NetworkScannerProvider {
  /** Name selecting this provider. */
  public static final String NAME = "builtin";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public NetworkScanner create(ScannerEnvironment environment) {
    return new NetworkDiscoveryUseCase(
        environment.store(),
        new IcmpReachabilityProber(environment.rawSocketPrivileged()),
        new ArpTableMacResolver(),
        new ReverseDnsHostnameResolver(),
        new TcpConnectPortProber(),
        new BannerServiceProber(environment.serviceConnectTimeout(), environment.bannerReadTimeout()),
        environment.settings(),
        environment.clock(),
        environment.metrics());
  }
}
