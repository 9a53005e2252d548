package ca.gc.cra.rackd.infrastructure.persistence;

import ca.gc.cra.rackd.application.port.DiscoveryStorePort;
import ca.gc.cra.rackd.application.port.NetworkNotFoundException;
import ca.gc.cra.rackd.domain.discovery.DiscoveredDevice;
import ca.gc.cra.rackd.domain.discovery.DiscoveryScan;
import ca.gc.cra.rackd.domain.discovery.Network;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * <strong>What:</strong> Heap-backed {@link DiscoveryStorePort} for the CLI and tests.
 * <p><strong>Semantics:</strong> Devices are keyed by IP and replaced on every upsert except for
 * {@code firstSeen}, which is kept from the first record of the address. Scans are keyed by id; each update
 * replaces the stored snapshot.</p>
 * <p><strong>Thread-safety:</strong> Backed by {@link ConcurrentHashMap}; device upserts are atomic per IP.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryDiscoveryStore implements DiscoveryStorePort {
  private final ConcurrentMap<String, Network> networks = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, DiscoveredDevice> devices = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, DiscoveryScan> scans = new ConcurrentHashMap<>();

  /**
   * Adds or replaces a network.
   *
   * @param network network to register
   */
  public void registerNetwork(Network network) {
    Objects.requireNonNull(network, "network");
    networks.put(network.id(), network);
  }

  @Override
  public Network getNetwork(String networkId) throws NetworkNotFoundException {
    Network network = networkId == null ? null : networks.get(networkId);
    if (network == null) {
      throw new NetworkNotFoundException(networkId);
    }
    return network;
  }

  @Override
  public void createOrUpdateDiscoveredDevice(DiscoveredDevice device) {
    Objects.requireNonNull(device, "device");
    devices.merge(device.ip(), device, (existing, incoming) -> incoming.withFirstSeen(existing.firstSeen()));
  }

  @Override
  public void updateDiscoveryScan(DiscoveryScan scan) {
    Objects.requireNonNull(scan, "scan");
    scans.put(scan.id(), scan);
  }

  /**
   * Looks up the current record of an address.
   *
   * @param ip device address
   * @return latest record, if any
   */
  public Optional<DiscoveredDevice> device(String ip) {
    return Optional.ofNullable(devices.get(ip));
  }

  /**
   * Lists the devices of a network ordered by address text.
   *
   * @param networkId network identifier
   * @return matching devices
   */
  public List<DiscoveredDevice> devicesForNetwork(String networkId) {
    List<DiscoveredDevice> result = new ArrayList<>();
    for (DiscoveredDevice device : devices.values()) {
      if (device.networkId().equals(networkId)) {
        result.add(device);
      }
    }
    result.sort(Comparator.comparing(DiscoveredDevice::ip));
    return result;
  }

  /**
   * Looks up the latest snapshot of a scan.
   *
   * @param scanId scan identifier
   * @return stored snapshot, if any
   */
  public Optional<DiscoveryScan> scan(String scanId) {
    return Optional.ofNullable(scans.get(scanId));
  }

  /** @return number of stored device records */
  public int deviceCount() {
    return devices.size();
  }
}
