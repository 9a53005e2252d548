package ca.gc.cra.rackd.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rackd.application.port.DiscoveryStorePort;
import ca.gc.cra.rackd.domain.discovery.DiscoveredDevice;
import ca.gc.cra.rackd.domain.discovery.DiscoveryScan;
import ca.gc.cra.rackd.domain.discovery.Network;
import ca.gc.cra.rackd.domain.discovery.ScanStatus;
import ca.gc.cra.rackd.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PersistingScanUpdateListenerTest {

  @Test
  void storesSnapshotThenForwards() {
    InMemoryDiscoveryStore store = new InMemoryDiscoveryStore();
    List<DiscoveryScan> forwarded = new ArrayList<>();
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    PersistingScanUpdateListener listener = new PersistingScanUpdateListener(store, metrics, forwarded::add);

    DiscoveryScan snapshot = InMemoryDiscoveryStoreTest.scan(ScanStatus.RUNNING, 2);
    listener.onUpdate(snapshot);

    assertEquals(snapshot, store.scan("scan-1").orElseThrow());
    assertEquals(List.of(snapshot), forwarded);
    assertEquals(0, metrics.count("discovery.persist.failure"));
  }

  @Test
  void storeFailureIsCountedAndStillForwarded() {
    List<DiscoveryScan> forwarded = new ArrayList<>();
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    PersistingScanUpdateListener listener =
        new PersistingScanUpdateListener(new FailingStore(), metrics, forwarded::add);

    listener.onUpdate(InMemoryDiscoveryStoreTest.scan(ScanStatus.COMPLETED, 4));

    assertEquals(1, metrics.count("discovery.persist.failure"));
    assertEquals(1, forwarded.size());
    assertTrue(forwarded.get(0).isTerminal());
  }

  private static final class FailingStore implements DiscoveryStorePort {
    @Override
    public Network getNetwork(String networkId) {
      throw new UnsupportedOperationException();
    }

    @Override
    public void createOrUpdateDiscoveredDevice(DiscoveredDevice device) {
      throw new UnsupportedOperationException();
    }

    @Override
    public void updateDiscoveryScan(DiscoveryScan scan) throws Exception {
      throw new IOException("disk full");
    }
  }
}
