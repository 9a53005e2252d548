package ca.gc.cra.rackd.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rackd.application.port.ClockPort;
import ca.gc.cra.rackd.application.port.DiscoveryStorePort;
import ca.gc.cra.rackd.application.port.HostnameResolver;
import ca.gc.cra.rackd.application.port.MacAddressResolver;
import ca.gc.cra.rackd.application.port.NetworkNotFoundException;
import ca.gc.cra.rackd.application.port.PortProber;
import ca.gc.cra.rackd.application.port.ReachabilityProber;
import ca.gc.cra.rackd.application.port.ScanFailedException;
import ca.gc.cra.rackd.application.port.ServiceProber;
import ca.gc.cra.rackd.application.util.CancellationToken;
import ca.gc.cra.rackd.domain.discovery.DeviceStatus;
import ca.gc.cra.rackd.domain.discovery.DiscoveredDevice;
import ca.gc.cra.rackd.domain.discovery.DiscoveryRule;
import ca.gc.cra.rackd.domain.discovery.DiscoveryScan;
import ca.gc.cra.rackd.domain.discovery.Network;
import ca.gc.cra.rackd.domain.discovery.ScanStatus;
import ca.gc.cra.rackd.domain.discovery.ScanType;
import ca.gc.cra.rackd.domain.discovery.ServiceInfo;
import ca.gc.cra.rackd.domain.net.Reachability;
import ca.gc.cra.rackd.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class NetworkDiscoveryUseCaseTest {
  private static final String NETWORK_ID = "lab";

  private FakeStore store;
  private FakeReachability reachability;
  private FakePortProber portProber;
  private RecordingMetricsPort metrics;
  private List<DiscoveryScan> updates;
  private MacAddressResolver macResolver;
  private HostnameResolver hostnameResolver;
  private ServiceProber serviceProber;
  private ScanSettings settings;

  @BeforeEach
  void setUp() {
    store = new FakeStore();
    store.networks.put(NETWORK_ID, Network.of(NETWORK_ID, "Lab", "10.0.0.0/29"));
    reachability = new FakeReachability(Set.of());
    portProber = new FakePortProber(Map.of());
    metrics = new RecordingMetricsPort();
    updates = new CopyOnWriteArrayList<>();
    macResolver = (ip, token) -> Optional.empty();
    hostnameResolver = (ip, token) -> Optional.empty();
    serviceProber = (ip, ports, token) -> List.of();
    settings = ScanSettings.defaults();
  }

  private NetworkDiscoveryUseCase useCase() {
    return new NetworkDiscoveryUseCase(
        store, reachability, macResolver, hostnameResolver, portProber, serviceProber, settings,
        new SteppingClock(), metrics);
  }

  private DiscoveryScan scan(DiscoveryRule rule) throws ScanFailedException {
    return useCase().scanNetwork(CancellationToken.create(), NETWORK_ID, rule, updates::add);
  }

  @Test
  void quickScanKeepsOnlyAliveHosts() throws Exception {
    reachability = new FakeReachability(Set.of("10.0.0.1", "10.0.0.3"));
    macResolver = (ip, token) -> Optional.of("aa:bb:cc:00:00:0" + ip.charAt(ip.length() - 1));

    DiscoveryScan result = scan(DiscoveryRule.builder().scanType(ScanType.QUICK).build());

    assertEquals(ScanStatus.COMPLETED, result.status());
    assertEquals(6, result.totalHosts());
    assertEquals(6, result.scannedHosts());
    assertEquals(2, result.foundHosts());
    assertEquals(100d, result.progressPercent());
    assertEquals(1, result.scanDepth());
    assertEquals(Set.of("10.0.0.1", "10.0.0.3"), store.devices.keySet());

    DiscoveredDevice device = store.devices.get("10.0.0.1");
    assertEquals(DeviceStatus.ONLINE, device.status());
    assertEquals("aa:bb:cc:00:00:01", device.macAddress());
    assertEquals(result.id(), device.lastScanId());
    assertEquals(NETWORK_ID, device.networkId());
    assertTrue(device.openPorts().isEmpty(), "quick scans never probe ports");
    assertEquals(0, portProber.calls.get());
    assertEquals(4, metrics.count("discovery.host.dropped"));
  }

  @Test
  void fullScanRecordsPortsServicesAndOsGuess() throws Exception {
    reachability = new FakeReachability(Set.of("10.0.0.2"));
    portProber = new FakePortProber(Map.of("10.0.0.2", List.of(80, 22)));
    hostnameResolver = (ip, token) -> ip.equals("10.0.0.2") ? Optional.of("web01.lab") : Optional.empty();
    serviceProber = (ip, ports, token) -> List.of(ServiceInfo.tcp(22, "SSH-2.0-OpenSSH_9.6", "SSH", ""));

    DiscoveryScan result = scan(DiscoveryRule.defaults());

    assertEquals(ScanStatus.COMPLETED, result.status());
    assertEquals(6, result.foundHosts(), "full scans record hosts of unknown liveness");
    DiscoveredDevice web = store.devices.get("10.0.0.2");
    assertEquals(List.of(22, 80), web.openPorts());
    assertEquals("web01.lab", web.hostname());
    assertEquals("Linux", web.osGuess());
    assertEquals("Unix", web.osFamily());
    assertEquals(1, web.services().size());
    assertEquals(80, web.confidence());

    DiscoveredDevice silent = store.devices.get("10.0.0.5");
    assertEquals(DeviceStatus.UNKNOWN, silent.status());
    assertEquals("Unknown", silent.osGuess());
    assertEquals(55, silent.confidence());
    assertEquals(2, metrics.count("discovery.port.open"));
  }

  @Test
  void openPortPromotesUnknownHostToOnline() throws Exception {
    portProber = new FakePortProber(Map.of("10.0.0.4", List.of(443)));

    scan(DiscoveryRule.builder().serviceDetection(false).osDetection(false).build());

    DiscoveredDevice device = store.devices.get("10.0.0.4");
    assertEquals(DeviceStatus.ONLINE, device.status());
    assertEquals("", device.osGuess());
    assertEquals(60, device.confidence());
  }

  @Test
  void missingNetworkFailsTheScan() {
    ScanFailedException ex = assertThrows(ScanFailedException.class,
        () -> useCase().scanNetwork(CancellationToken.create(), "nowhere", DiscoveryRule.defaults(), updates::add));

    DiscoveryScan failed = ex.scan();
    assertEquals(ScanStatus.FAILED, failed.status());
    assertEquals("getting network: network not found: nowhere", failed.errorMessage());
    assertEquals(0, failed.scannedHosts());
    assertTrue(failed.completedAt().isPresent());
    assertTrue(ex.getCause() instanceof NetworkNotFoundException);
    assertEquals(ScanStatus.FAILED, updates.get(updates.size() - 1).status());
    assertEquals(1, metrics.count("discovery.scan.failed"));
    assertEquals(0, metrics.count("discovery.scan.completed"));
  }

  @Test
  void nullNetworkFromStoreFailsTheScan() {
    store.networks.remove(NETWORK_ID);
    store.nullForMissing = true;

    ScanFailedException ex = assertThrows(ScanFailedException.class, () -> scan(DiscoveryRule.defaults()));

    assertEquals(ScanStatus.FAILED, ex.scan().status());
    assertEquals("getting network: network not found: lab", ex.scan().errorMessage());
    assertTrue(ex.getCause() instanceof NetworkNotFoundException);
    assertEquals(ScanStatus.FAILED, updates.get(updates.size() - 1).status());
  }

  @Test
  void unprivilegedQuickScanWarnsBeforeDroppingHosts() throws Exception {
    reachability.privileged = false;
    Logger logger = (Logger) LoggerFactory.getLogger(HostProbePipeline.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);

    DiscoveryScan result;
    try {
      result = scan(DiscoveryRule.builder().scanType(ScanType.QUICK).build());
    } finally {
      logger.detachAppender(appender);
      appender.stop();
    }

    assertEquals(0, result.foundHosts());
    List<ILoggingEvent> warnings = appender.list.stream()
        .filter(event -> event.getLevel() == Level.WARN)
        .toList();
    assertEquals(1, warnings.size());
    assertTrue(warnings.get(0).getFormattedMessage().contains("quick scan of lab will drop every host"));
  }

  @Test
  void privilegedScanLogsNoLimitation() throws Exception {
    Logger logger = (Logger) LoggerFactory.getLogger(HostProbePipeline.class);
    Level previous = logger.getLevel();
    logger.setLevel(Level.INFO);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    try {
      scan(DiscoveryRule.defaults());
    } finally {
      logger.detachAppender(appender);
      logger.setLevel(previous);
      appender.stop();
    }

    assertTrue(appender.list.stream().noneMatch(event -> event.getFormattedMessage().contains("raw-socket")));
  }

  @Test
  void malformedSubnetFailsTheScan() {
    store.networks.put(NETWORK_ID, Network.of(NETWORK_ID, "Lab", "10.0.0.0"));

    ScanFailedException ex = assertThrows(ScanFailedException.class, () -> scan(DiscoveryRule.defaults()));

    assertTrue(ex.scan().errorMessage().startsWith("generating IP list: "), ex.scan().errorMessage());
    assertEquals(0, ex.scan().totalHosts());
  }

  @Test
  void oversizedSubnetFailsTheScan() {
    settings = new ScanSettings(5, 50, 4);

    ScanFailedException ex = assertThrows(ScanFailedException.class, () -> scan(DiscoveryRule.defaults()));

    assertTrue(ex.scan().errorMessage().contains("maxHosts 4"), ex.scan().errorMessage());
  }

  @Test
  void excludedAddressesAreNeverProbedButCountAsScanned() throws Exception {
    DiscoveryRule rule = DiscoveryRule.builder().excludeIps(List.of("10.0.0.2", "10.0.0.4/31")).build();

    DiscoveryScan result = scan(rule);

    assertEquals(6, result.scannedHosts());
    assertEquals(3, result.foundHosts());
    assertFalse(reachability.probed.contains("10.0.0.2"));
    assertFalse(reachability.probed.contains("10.0.0.5"));
    assertFalse(store.devices.containsKey("10.0.0.4"));
    assertEquals(3, metrics.count("discovery.host.excluded"));
  }

  @Test
  void excludedHostnamesDropTheDevice() throws Exception {
    reachability = new FakeReachability(Set.of("10.0.0.1", "10.0.0.2"));
    hostnameResolver = (ip, token) -> ip.equals("10.0.0.2") ? Optional.of("PRINTER.lab.") : Optional.empty();
    DiscoveryRule rule = DiscoveryRule.builder()
        .scanType(ScanType.QUICK)
        .excludeHosts(List.of("printer.lab"))
        .build();

    DiscoveryScan result = scan(rule);

    assertEquals(1, result.foundHosts());
    assertEquals(Set.of("10.0.0.1"), store.devices.keySet());
    assertEquals(1, metrics.count("discovery.host.excluded"));
  }

  @Test
  void probeFailuresDegradeInsteadOfAbortingTheHost() throws Exception {
    reachability = new FakeReachability(Set.of("10.0.0.1"));
    macResolver = (ip, token) -> {
      throw new IllegalStateException("arp unavailable");
    };
    hostnameResolver = (ip, token) -> {
      throw new IllegalStateException("dns down");
    };

    DiscoveryScan result = scan(DiscoveryRule.builder().scanType(ScanType.QUICK).build());

    assertEquals(1, result.foundHosts());
    DiscoveredDevice device = store.devices.get("10.0.0.1");
    assertEquals("", device.macAddress());
    assertEquals("", device.hostname());
  }

  @Test
  void storeFailuresAreCountedAndNeverFatal() throws Exception {
    reachability = new FakeReachability(Set.of("10.0.0.1", "10.0.0.2"));
    store.failDeviceWrites = true;

    DiscoveryScan result = scan(DiscoveryRule.builder().scanType(ScanType.QUICK).build());

    assertEquals(ScanStatus.COMPLETED, result.status());
    assertEquals(6, result.scannedHosts());
    assertEquals(2, metrics.count("discovery.persist.failure"));
    assertTrue(store.devices.isEmpty());
  }

  @Test
  void hostConcurrencyIsBounded() throws Exception {
    store.networks.put(NETWORK_ID, Network.of(NETWORK_ID, "Lab", "10.0.0.0/27"));
    portProber = new FakePortProber(Map.of(), 20L);

    DiscoveryScan result = scan(DiscoveryRule.builder().serviceDetection(false).build());

    assertEquals(30, result.scannedHosts());
    assertTrue(portProber.maxInFlight.get() <= ScanSettings.DEFAULT_HOST_CONCURRENCY,
        "max in flight was " + portProber.maxInFlight.get());
    assertTrue(portProber.maxInFlight.get() > 1, "hosts were not probed concurrently");
  }

  @Test
  void preCancelledRunSkipsProbingButStillCompletes() throws Exception {
    CancellationToken token = CancellationToken.create();
    token.cancel();

    DiscoveryScan result = useCase().scanNetwork(token, NETWORK_ID, DiscoveryRule.defaults(), updates::add);

    assertEquals(ScanStatus.COMPLETED, result.status());
    assertEquals(6, result.scannedHosts());
    assertEquals(0, result.foundHosts());
    assertTrue(reachability.probed.isEmpty());
    assertEquals(6, metrics.count("discovery.host.cancelled"));
  }

  @Test
  void progressSnapshotsFollowTheInterval() throws Exception {
    settings = new ScanSettings(1, 2, 1_000);

    scan(DiscoveryRule.builder().scanType(ScanType.QUICK).build());

    List<Integer> scanned = new ArrayList<>();
    for (DiscoveryScan update : updates) {
      if (update.status() == ScanStatus.RUNNING && update.scannedHosts() > 0) {
        scanned.add(update.scannedHosts());
      }
    }
    assertEquals(List.of(2, 4, 6), scanned);
    assertEquals(ScanStatus.RUNNING, updates.get(0).status());
    assertEquals(ScanStatus.COMPLETED, updates.get(updates.size() - 1).status());
  }

  @Test
  void emitsLifecycleAndPerHostMetrics() throws Exception {
    DiscoveryScan result = scan(DiscoveryRule.builder().scanPorts(false).build());

    assertEquals(1, metrics.count("discovery.scan.started"));
    assertEquals(1, metrics.count("discovery.scan.completed"));
    assertEquals(6, metrics.count("discovery.host.scanned"));
    assertEquals(result.foundHosts(), metrics.count("discovery.host.found"));
    assertEquals(6, metrics.observed("discovery.host.latencyNanos").size());
    assertTrue(result.durationSeconds() >= 0L);
  }

  /** Clock advancing one millisecond per reading. */
  private static final class SteppingClock implements ClockPort {
    private final AtomicLong millis = new AtomicLong(1_714_557_600_000L);

    @Override
    public long nowMillis() {
      return millis.getAndAdd(1);
    }
  }

  private static final class FakeStore implements DiscoveryStorePort {
    final Map<String, Network> networks = new ConcurrentHashMap<>();
    final Map<String, DiscoveredDevice> devices = new ConcurrentHashMap<>();
    volatile boolean failDeviceWrites;
    volatile boolean nullForMissing;

    @Override
    public Network getNetwork(String networkId) throws NetworkNotFoundException {
      Network network = networks.get(networkId);
      if (network == null && !nullForMissing) {
        throw new NetworkNotFoundException(networkId);
      }
      return network;
    }

    @Override
    public void createOrUpdateDiscoveredDevice(DiscoveredDevice device) {
      if (failDeviceWrites) {
        throw new IllegalStateException("database unavailable");
      }
      devices.put(device.ip(), device);
    }

    @Override
    public void updateDiscoveryScan(DiscoveryScan scan) {}
  }

  private static final class FakeReachability implements ReachabilityProber {
    private final Set<String> alive;
    final Set<String> probed = ConcurrentHashMap.newKeySet();
    volatile boolean privileged = true;

    FakeReachability(Set<String> alive) {
      this.alive = alive;
    }

    @Override
    public Reachability probe(String ip, Duration timeout, CancellationToken cancellation) {
      probed.add(ip);
      return alive.contains(ip) ? Reachability.ALIVE : Reachability.UNKNOWN;
    }

    @Override
    public boolean privileged() {
      return privileged;
    }
  }

  private static final class FakePortProber implements PortProber {
    private final Map<String, List<Integer>> openPorts;
    private final long delayMillis;
    final AtomicInteger calls = new AtomicInteger();
    final AtomicInteger inFlight = new AtomicInteger();
    final AtomicInteger maxInFlight = new AtomicInteger();

    FakePortProber(Map<String, List<Integer>> openPorts) {
      this(openPorts, 0L);
    }

    FakePortProber(Map<String, List<Integer>> openPorts, long delayMillis) {
      this.openPorts = openPorts;
      this.delayMillis = delayMillis;
    }

    @Override
    public List<Integer> probe(String ip, List<Integer> ports, Duration timeout, CancellationToken cancellation)
        throws InterruptedException {
      calls.incrementAndGet();
      int current = inFlight.incrementAndGet();
      maxInFlight.accumulateAndGet(current, Math::max);
      try {
        if (delayMillis > 0) {
          Thread.sleep(delayMillis);
        }
        return openPorts.getOrDefault(ip, List.of());
      } finally {
        inFlight.decrementAndGet();
      }
    }
  }
}
