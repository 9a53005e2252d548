package ca.gc.cra.rackd.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rackd.application.pipeline.NetworkDiscoveryUseCase;
import ca.gc.cra.rackd.application.port.ClockPort;
import ca.gc.cra.rackd.application.port.MetricsPort;
import ca.gc.cra.rackd.infrastructure.persistence.InMemoryDiscoveryStore;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  @Test
  void passesConfiguredEnvironmentToSelectedProvider() {
    DiscoveryConfig config = DiscoveryConfig.fromMap(Map.of(
        "subnet", "10.0.0.0/24",
        "scanner", "stub",
        "hostConcurrency", "3",
        "bannerReadTimeoutMillis", "250"));
    InMemoryDiscoveryStore store = new InMemoryDiscoveryStore();
    NetworkScannerRegistryTest.StubProvider stub = new NetworkScannerRegistryTest.StubProvider("stub");
    AtomicInteger privilegeChecks = new AtomicInteger();

    CompositionRoot root = new CompositionRoot(config, store, MetricsPort.NO_OP, ClockPort.SYSTEM,
        new NetworkScannerRegistry(List.of(stub)), () -> privilegeChecks.incrementAndGet() > 0);

    assertNotNull(root.networkScanner());
    ScannerEnvironment environment = stub.lastEnvironment;
    assertSame(store, environment.store());
    assertSame(MetricsPort.NO_OP, environment.metrics());
    assertSame(ClockPort.SYSTEM, environment.clock());
    assertEquals(3, environment.settings().hostConcurrency());
    assertEquals(Duration.ofMillis(250), environment.bannerReadTimeout());
    assertTrue(environment.rawSocketPrivileged());
    assertEquals(1, privilegeChecks.get());
    assertSame(MetricsPort.NO_OP, root.metrics());
  }

  @Test
  void builtinProviderWiresDiscoveryUseCase() {
    DiscoveryConfig config = DiscoveryConfig.fromMap(Map.of("subnet", "10.0.0.0/24"));

    CompositionRoot root = new CompositionRoot(config, new InMemoryDiscoveryStore(), MetricsPort.NO_OP,
        ClockPort.SYSTEM, new NetworkScannerRegistry(List.of(new BuiltinNetworkScannerProvider())), () -> false);

    assertInstanceOf(NetworkDiscoveryUseCase.class, root.networkScanner());
  }

  @Test
  void unknownScannerFailsWhenBuilding() {
    DiscoveryConfig config = DiscoveryConfig.fromMap(Map.of("subnet", "10.0.0.0/24", "scanner", "missing"));

    CompositionRoot root = new CompositionRoot(config, new InMemoryDiscoveryStore(), MetricsPort.NO_OP,
        ClockPort.SYSTEM, new NetworkScannerRegistry(List.of(new BuiltinNetworkScannerProvider())), () -> false);

    assertThrows(IllegalArgumentException.class, root::networkScanner);
  }
}
