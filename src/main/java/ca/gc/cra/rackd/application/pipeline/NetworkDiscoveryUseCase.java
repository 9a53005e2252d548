package ca.gc.cra.rackd.application.pipeline;

import ca.gc.cra.rackd.application.discovery.ExclusionMatcher;
import ca.gc.cra.rackd.application.discovery.HostRangeEnumerator;
import ca.gc.cra.rackd.application.pipeline.HostProbePipeline.HostOutcome;
import ca.gc.cra.rackd.application.pipeline.HostProbePipeline.ScanContext;
import ca.gc.cra.rackd.application.port.ClockPort;
import ca.gc.cra.rackd.application.port.DiscoveryStorePort;
import ca.gc.cra.rackd.application.port.HostnameResolver;
import ca.gc.cra.rackd.application.port.MacAddressResolver;
import ca.gc.cra.rackd.application.port.MetricsPort;
import ca.gc.cra.rackd.application.port.NetworkNotFoundException;
import ca.gc.cra.rackd.application.port.NetworkScanner;
import ca.gc.cra.rackd.application.port.PortProber;
import ca.gc.cra.rackd.application.port.ReachabilityProber;
import ca.gc.cra.rackd.application.port.ScanFailedException;
import ca.gc.cra.rackd.application.port.ScanUpdateListener;
import ca.gc.cra.rackd.application.port.ServiceProber;
import ca.gc.cra.rackd.application.util.CancellationToken;
import ca.gc.cra.rackd.domain.discovery.DiscoveredDevice;
import ca.gc.cra.rackd.domain.discovery.DiscoveryRule;
import ca.gc.cra.rackd.domain.discovery.DiscoveryScan;
import ca.gc.cra.rackd.domain.discovery.Network;
import ca.gc.cra.rackd.domain.net.InvalidSubnetException;
import ca.gc.cra.rackd.domain.util.Ulids;
import ca.gc.cra.rackd.infrastructure.exec.ExecutorFactories;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Built-in {@link NetworkScanner} that expands a network's subnet and probes every
 * candidate host on a bounded worker pool.
 * <p><strong>Why:</strong> Keeps the run lifecycle (creation, milestone reporting, failure, completion) in one
 * place while probing strategies stay behind ports.</p>
 * <p><strong>Role:</strong> Application-layer use case; wired by {@code CompositionRoot} and published through the
 * {@code builtin} scanner provider.</p>
 * <p><strong>Thread-safety:</strong> Each call owns its worker pool and progress aggregate, so concurrent scans of
 * different networks do not share mutable state.</p>
 * <p><strong>Performance:</strong> At most {@link ScanSettings#hostConcurrency()} hosts are probed at once; port
 * attempts within a host fan out through the {@link PortProber}.</p>
 * <p><strong>Observability:</strong> Emits {@code discovery.scan.*}, {@code discovery.host.*} and
 * {@code discovery.persist.failure}; tags log lines with {@code scanId} and {@code hostIp} MDC keys.</p>
 *
 * @since 0.1.0
 */
public final class NetworkDiscoveryUseCase implements NetworkScanner {
  private static final Logger log = LoggerFactory.getLogger(NetworkDiscoveryUseCase.class);
  private static final long POOL_SHUTDOWN_TIMEOUT_SECONDS = 30L;

  private final DiscoveryStorePort store;
  private final HostProbePipeline pipeline;
  private final HostRangeEnumerator enumerator;
  private final ScanSettings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates the scanner.
   *
   * @param store inventory store for networks, devices and scan aggregates
   * @param reachability liveness probe
   * @param macResolver hardware address lookup
   * @param hostnameResolver reverse name lookup
   * @param portProber TCP port prober
   * @param serviceProber banner grabber
   * @param settings pool size, reporting interval and subnet limit
   * @param clock time source
   * @param metrics metrics sink
   */
  public NetworkDiscoveryUseCase(
      DiscoveryStorePort store,
      ReachabilityProber reachability,
      MacAddressResolver macResolver,
      HostnameResolver hostnameResolver,
      PortProber portProber,
      ServiceProber serviceProber,
      ScanSettings settings,
      ClockPort clock,
      MetricsPort metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.pipeline = new HostProbePipeline(
        reachability, macResolver, hostnameResolver, portProber, serviceProber, clock, metrics);
    this.enumerator = new HostRangeEnumerator(settings.maxHosts());
  }

  @Override
  public DiscoveryScan scanNetwork(
      CancellationToken cancellation, String networkId, DiscoveryRule rule, ScanUpdateListener onUpdate)
      throws ScanFailedException {
    Objects.requireNonNull(networkId, "networkId");
    Objects.requireNonNull(rule, "rule");
    CancellationToken runToken = (cancellation == null ? CancellationToken.none() : cancellation).newChild();
    long startMillis = clock.nowMillis();
    String scanId = Ulids.newUlid(startMillis);

    ScanProgress progress = new ScanProgress(
        scanId,
        networkId,
        rule.scanType(),
        Instant.ofEpochMilli(startMillis),
        settings.progressInterval(),
        onUpdate);

    String previousScanId = MDC.get("scanId");
    MDC.put("scanId", scanId);
    try {
      progress.start();
      metrics.increment("discovery.scan.started");
      log.info("Starting {} scan of network {}", rule.scanType().wireName(), networkId);

      Network network;
      try {
        network = store.getNetwork(networkId);
      } catch (Exception ex) {
        if (ex instanceof InterruptedException) {
          Thread.currentThread().interrupt();
        }
        throw fail(progress, "getting network: " + describe(ex), ex);
      }
      if (network == null) {
        NetworkNotFoundException missing = new NetworkNotFoundException(networkId);
        throw fail(progress, "getting network: " + describe(missing), missing);
      }

      List<String> hosts;
      try {
        hosts = enumerator.enumerate(network.subnet());
      } catch (InvalidSubnetException ex) {
        throw fail(progress, "generating IP list: " + describe(ex), ex);
      }

      progress.setTotalHosts(hosts.size());
      log.info("Scanning {} candidate hosts in {}", hosts.size(), network.subnet());

      ScanContext context = new ScanContext(
          scanId, networkId, rule, ExclusionMatcher.forRule(rule), runToken);
      pipeline.logLimitations(context);
      runHosts(hosts, context, progress);

      DiscoveryScan completed = progress.complete(Instant.ofEpochMilli(clock.nowMillis()));
      metrics.increment("discovery.scan.completed");
      log.info("Scan completed: {}/{} hosts scanned, {} found in {}s",
          completed.scannedHosts(), completed.totalHosts(), completed.foundHosts(), completed.durationSeconds());
      return completed;
    } finally {
      if (previousScanId == null) {
        MDC.remove("scanId");
      } else {
        MDC.put("scanId", previousScanId);
      }
    }
  }

  private ScanFailedException fail(ScanProgress progress, String message, Exception cause) {
    DiscoveryScan failed = progress.fail(message, Instant.ofEpochMilli(clock.nowMillis()));
    metrics.increment("discovery.scan.failed");
    log.error("Scan failed: {}", message);
    return new ScanFailedException(failed, cause);
  }

  private void runHosts(List<String> hosts, ScanContext context, ScanProgress progress) {
    if (hosts.isEmpty()) {
      return;
    }
    int poolSize = Math.min(settings.hostConcurrency(), hosts.size());
    ExecutorService pool = ExecutorFactories.newHostPool(
        poolSize,
        "rackd-scan-" + context.scanId(),
        (thread, ex) -> log.error("Uncaught exception in {}", thread.getName(), ex));

    List<Future<?>> futures = new ArrayList<>(hosts.size());
    try {
      for (String ip : hosts) {
        futures.add(pool.submit(() -> scanHost(ip, context, progress)));
      }
    } finally {
      pool.shutdown();
    }

    boolean interrupted = false;
    for (Future<?> future : futures) {
      while (true) {
        try {
          future.get();
          break;
        } catch (InterruptedException ex) {
          // Stop new host work and keep draining so every host is accounted for.
          interrupted = true;
          context.cancellation().cancel();
        } catch (ExecutionException ex) {
          log.error("Host task failed", ex.getCause());
          break;
        }
      }
    }
    awaitPool(pool);
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private void awaitPool(ExecutorService pool) {
    try {
      if (!pool.awaitTermination(POOL_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        log.warn("Host workers active after {} s; forcing shutdown", POOL_SHUTDOWN_TIMEOUT_SECONDS);
        pool.shutdownNow();
      }
    } catch (InterruptedException ex) {
      pool.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private void scanHost(String ip, ScanContext context, ScanProgress progress) {
    long startNanos = System.nanoTime();
    boolean found = false;
    MDC.put("scanId", context.scanId());
    MDC.put("hostIp", ip);
    try {
      if (context.exclusions().isExcluded(ip)) {
        metrics.increment("discovery.host.excluded");
        log.debug("Host excluded by address rule");
        return;
      }
      HostOutcome outcome = pipeline.probe(ip, context);
      switch (outcome.kind()) {
        case FOUND -> {
          found = true;
          metrics.increment("discovery.host.found");
          persist(outcome.device().orElseThrow());
        }
        case EXCLUDED -> metrics.increment("discovery.host.excluded");
        case CANCELLED -> metrics.increment("discovery.host.cancelled");
        case DROPPED -> metrics.increment("discovery.host.dropped");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      metrics.increment("discovery.host.failed");
      log.debug("Host probe interrupted");
    } catch (RuntimeException ex) {
      metrics.increment("discovery.host.failed");
      log.debug("Host probe failed", ex);
    } finally {
      progress.recordHost(found);
      metrics.increment("discovery.host.scanned");
      metrics.observe("discovery.host.latencyNanos", System.nanoTime() - startNanos);
      MDC.remove("hostIp");
      MDC.remove("scanId");
    }
  }

  private void persist(DiscoveredDevice device) {
    try {
      store.createOrUpdateDiscoveredDevice(device);
    } catch (Exception ex) {
      if (ex instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      metrics.increment("discovery.persist.failure");
      log.error("Failed to persist discovered device {}", device.ip(), ex);
    }
  }

  private static String describe(Exception ex) {
    String message = ex.getMessage();
    return (message == null || message.isBlank()) ? ex.getClass().getSimpleName() : message;
  }
}
