package ca.gc.cra.rackd.application.pipeline;

import ca.gc.cra.rackd.application.discovery.DeviceHeuristics;
import ca.gc.cra.rackd.application.discovery.ExclusionMatcher;
import ca.gc.cra.rackd.application.port.ClockPort;
import ca.gc.cra.rackd.application.port.HostnameResolver;
import ca.gc.cra.rackd.application.port.MacAddressResolver;
import ca.gc.cra.rackd.application.port.MetricsPort;
import ca.gc.cra.rackd.application.port.PortProber;
import ca.gc.cra.rackd.application.port.ReachabilityProber;
import ca.gc.cra.rackd.application.port.ServiceProber;
import ca.gc.cra.rackd.application.util.CancellationToken;
import ca.gc.cra.rackd.domain.discovery.DeviceStatus;
import ca.gc.cra.rackd.domain.discovery.DiscoveredDevice;
import ca.gc.cra.rackd.domain.discovery.DiscoveryRule;
import ca.gc.cra.rackd.domain.discovery.ScanType;
import ca.gc.cra.rackd.domain.discovery.ServiceCatalog;
import ca.gc.cra.rackd.domain.discovery.ServiceInfo;
import ca.gc.cra.rackd.domain.net.Reachability;
import ca.gc.cra.rackd.domain.util.Ulids;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Sequential probing stages for one candidate host.
 * <p><strong>Why:</strong> Each stage contributes optional evidence; a failing stage is logged and skipped so
 * the host still yields whatever was gathered.</p>
 * <p><strong>Role:</strong> Collaborator of {@link NetworkDiscoveryUseCase}; one call per host task.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from injected ports; evidence lives in a builder confined to
 * the calling thread.</p>
 * <p><strong>Observability:</strong> Stage failures at DEBUG; {@code discovery.port.open} per open port.</p>
 *
 * @since 0.1.0
 */
final class HostProbePipeline {
  private static final Logger log = LoggerFactory.getLogger(HostProbePipeline.class);

  private final ReachabilityProber reachability;
  private final MacAddressResolver macResolver;
  private final HostnameResolver hostnameResolver;
  private final PortProber portProber;
  private final ServiceProber serviceProber;
  private final ClockPort clock;
  private final MetricsPort metrics;

  HostProbePipeline(
      ReachabilityProber reachability,
      MacAddressResolver macResolver,
      HostnameResolver hostnameResolver,
      PortProber portProber,
      ServiceProber serviceProber,
      ClockPort clock,
      MetricsPort metrics) {
    this.reachability = Objects.requireNonNull(reachability, "reachability");
    this.macResolver = Objects.requireNonNull(macResolver, "macResolver");
    this.hostnameResolver = Objects.requireNonNull(hostnameResolver, "hostnameResolver");
    this.portProber = Objects.requireNonNull(portProber, "portProber");
    this.serviceProber = Objects.requireNonNull(serviceProber, "serviceProber");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Logs probe limits that shape a run's results, once before hosts are dispatched.
   *
   * @param context run-wide inputs
   */
  void logLimitations(ScanContext context) {
    if (reachability.privileged()) {
      return;
    }
    if (context.rule().scanType() == ScanType.QUICK) {
      log.warn("Echo requests need raw-socket privilege; quick scan of {} will drop every host",
          context.networkId());
    } else {
      log.info("Echo requests need raw-socket privilege; hosts in {} are judged by open ports only",
          context.networkId());
    }
  }

  /**
   * Runs every applicable stage for {@code ip}.
   *
   * @param ip candidate address
   * @param context run-wide inputs
   * @return outcome carrying the device when one was produced
   * @throws InterruptedException when the host task is interrupted while waiting on port attempts
   */
  HostOutcome probe(String ip, ScanContext context) throws InterruptedException {
    DiscoveryRule rule = context.rule();
    CancellationToken cancellation = context.cancellation();
    if (cancellation.isCancelled()) {
      return HostOutcome.CANCELLED;
    }

    Reachability reach = checkReachability(ip, rule, cancellation);
    if (rule.scanType() == ScanType.QUICK && !reach.isAlive()) {
      log.debug("Quick scan dropped unresponsive host {} ({})", ip, reach);
      return HostOutcome.DROPPED;
    }

    long now = clock.nowMillis();
    DiscoveredDevice.Builder device = DiscoveredDevice.builder(Ulids.newUlid(now), ip)
        .networkId(context.networkId())
        .lastScanId(context.scanId())
        .lastSeen(Instant.ofEpochMilli(now));

    if (reach.isAlive()) {
      device.status(DeviceStatus.ONLINE);
      resolveMac(ip, cancellation).ifPresent(device::macAddress);
      Optional<String> hostname = resolveHostname(ip, cancellation);
      if (hostname.isPresent() && context.exclusions().hasHostnameExclusions()
          && context.exclusions().isExcludedHostname(hostname.get())) {
        log.debug("Host {} excluded by hostname {}", ip, hostname.get());
        return HostOutcome.EXCLUDED;
      }
      hostname.ifPresent(device::hostname);
    }

    if (rule.scanType() != ScanType.QUICK && rule.scanPorts()) {
      if (cancellation.isCancelled()) {
        return HostOutcome.CANCELLED;
      }
      List<Integer> open = scanPorts(ip, rule, cancellation);
      if (!open.isEmpty()) {
        device.openPorts(open);
        if (device.status() == DeviceStatus.UNKNOWN) {
          device.status(DeviceStatus.ONLINE);
        }
      }
    }

    if (rule.serviceDetection() && !device.openPorts().isEmpty()) {
      if (cancellation.isCancelled()) {
        return HostOutcome.CANCELLED;
      }
      device.services(detectServices(ip, device.openPorts(), cancellation));
    }

    if (rule.osDetection()) {
      device.osGuess(DeviceHeuristics.guessOs(device.openPorts(), device.services()));
    }
    device.confidence(DeviceHeuristics.confidence(
        device.macAddress(), device.hostname(), device.openPorts(), device.osGuess()));

    DiscoveredDevice result = device.build();
    log.debug("Device discovered: status={}, ports={}, confidence={}",
        result.status().wireName(), result.openPorts().size(), result.confidence());
    return HostOutcome.found(result);
  }

  private Reachability checkReachability(String ip, DiscoveryRule rule, CancellationToken cancellation) {
    try {
      return Objects.requireNonNullElse(reachability.probe(ip, rule.timeout(), cancellation), Reachability.UNKNOWN);
    } catch (RuntimeException ex) {
      log.debug("Reachability probe failed for {}", ip, ex);
      return Reachability.UNKNOWN;
    }
  }

  private Optional<String> resolveMac(String ip, CancellationToken cancellation) {
    try {
      return macResolver.resolve(ip, cancellation);
    } catch (RuntimeException ex) {
      log.debug("MAC resolution failed for {}", ip, ex);
      return Optional.empty();
    }
  }

  private Optional<String> resolveHostname(String ip, CancellationToken cancellation) {
    try {
      return hostnameResolver.resolve(ip, cancellation);
    } catch (RuntimeException ex) {
      log.debug("Reverse lookup failed for {}", ip, ex);
      return Optional.empty();
    }
  }

  private List<Integer> scanPorts(String ip, DiscoveryRule rule, CancellationToken cancellation)
      throws InterruptedException {
    List<Integer> candidates = ServiceCatalog.portsFor(rule);
    try {
      List<Integer> open = portProber.probe(ip, candidates, rule.timeout(), cancellation);
      for (int i = 0; i < open.size(); i++) {
        metrics.increment("discovery.port.open");
      }
      return open;
    } catch (RuntimeException ex) {
      log.debug("Port scan failed for {}", ip, ex);
      return List.of();
    }
  }

  private List<ServiceInfo> detectServices(String ip, List<Integer> openPorts, CancellationToken cancellation) {
    try {
      return serviceProber.probe(ip, openPorts, cancellation);
    } catch (RuntimeException ex) {
      log.debug("Service detection failed for {}", ip, ex);
      return List.of();
    }
  }

  /**
   * Run-wide inputs shared by every host of a scan.
   *
   * @param scanId scan identifier stamped on each device
   * @param networkId network identifier stamped on each device
   * @param rule discovery policy
   * @param exclusions compiled exclusion lists
   * @param cancellation run cancellation
   */
  record ScanContext(
      String scanId,
      String networkId,
      DiscoveryRule rule,
      ExclusionMatcher exclusions,
      CancellationToken cancellation) {}

  /**
   * What happened to one host.
   *
   * @param kind outcome category
   * @param device produced record, present only for {@link Kind#FOUND}
   */
  record HostOutcome(Kind kind, Optional<DiscoveredDevice> device) {
    static final HostOutcome DROPPED = new HostOutcome(Kind.DROPPED, Optional.empty());
    static final HostOutcome EXCLUDED = new HostOutcome(Kind.EXCLUDED, Optional.empty());
    static final HostOutcome CANCELLED = new HostOutcome(Kind.CANCELLED, Optional.empty());

    static HostOutcome found(DiscoveredDevice device) {
      return new HostOutcome(Kind.FOUND, Optional.of(device));
    }

    enum Kind {
      FOUND,
      DROPPED,
      EXCLUDED,
      CANCELLED
    }
  }
}
