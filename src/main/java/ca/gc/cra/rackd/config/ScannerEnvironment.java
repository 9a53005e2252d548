package ca.gc.cra.rackd.config;

import ca.gc.cra.rackd.application.pipeline.ScanSettings;
import ca.gc.cra.rackd.application.port.ClockPort;
import ca.gc.cra.rackd.application.port.DiscoveryStorePort;
import ca.gc.cra.rackd.application.port.MetricsPort;
import java.time.Duration;
import java.util.Objects;

/**
 * Collaborators handed to a {@link NetworkScannerProvider}.
 *
 * @param store inventory store
 * @param metrics metrics sink
 * @param clock time source
 * @param settings host pool size, reporting interval and subnet limit
 * @param serviceConnectTimeout connect deadline for banner grabbing
 * @param bannerReadTimeout read deadline for banner grabbing
 * @param rawSocketPrivileged whether ICMP echo requests can be sent
 * @since 0.1.0
 */
public record ScannerEnvironment(
    DiscoveryStorePort store,
    MetricsPort metrics,
    ClockPort clock,
    ScanSettings settings,
    Duration serviceConnectTimeout,
    Duration bannerReadTimeout,
    boolean rawSocketPrivileged) {

  public ScannerEnvironment {
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(serviceConnectTimeout, "serviceConnectTimeout");
    Objects.requireNonNull(bannerReadTimeout, "bannerReadTimeout");
  }
}
