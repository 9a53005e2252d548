package ca.gc.cra.rackd.domain.discovery;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Host-level discovery result, keyed by IP address.
 * <p><strong>Why:</strong> Stores upsert this record so that the latest scan of an address wins.</p>
 * <p><strong>Role:</strong> Domain value frozen once by {@link Builder#build()} at the end of the per-host pipeline.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the builder is confined to the host task that owns it.</p>
 *
 * @param id record identifier
 * @param ip textual address; unique key
 * @param macAddress lower-case colon separated MAC, empty when unresolved
 * @param hostname reverse-resolved name, empty when unresolved
 * @param networkId owning network
 * @param status liveness verdict
 * @param confidence evidence score within {@code [0,100]}
 * @param osGuess operating system guess, empty when OS detection was disabled
 * @param osFamily operating system family, empty when OS detection was disabled
 * @param openPorts ascending open TCP ports
 * @param services fingerprints ordered by port
 * @param lastScanId scan that produced this record
 * @param lastSeen time the record was produced
 * @param firstSeen first time the address was recorded; stores preserve it across upserts
 * @since 0.1.0
 */
public record DiscoveredDevice(
    String id,
    String ip,
    String macAddress,
    String hostname,
    String networkId,
    DeviceStatus status,
    int confidence,
    String osGuess,
    String osFamily,
    List<Integer> openPorts,
    List<ServiceInfo> services,
    String lastScanId,
    Instant lastSeen,
    Instant firstSeen) {

  public DiscoveredDevice {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(ip, "ip");
    Objects.requireNonNull(lastSeen, "lastSeen");
    macAddress = Objects.requireNonNullElse(macAddress, "");
    hostname = Objects.requireNonNullElse(hostname, "");
    networkId = Objects.requireNonNullElse(networkId, "");
    status = Objects.requireNonNullElse(status, DeviceStatus.UNKNOWN);
    osGuess = Objects.requireNonNullElse(osGuess, "");
    osFamily = Objects.requireNonNullElse(osFamily, "");
    openPorts = openPorts == null ? List.of() : List.copyOf(new TreeSet<>(openPorts));
    services = services == null ? List.of() : List.copyOf(services);
    lastScanId = Objects.requireNonNullElse(lastScanId, "");
    firstSeen = Objects.requireNonNullElse(firstSeen, lastSeen);
    if (confidence < 0 || confidence > 100) {
      throw new IllegalArgumentException("confidence must be within [0,100] (was " + confidence + ")");
    }
  }

  /**
   * Returns a copy carrying an earlier first-seen timestamp.
   *
   * @param value first time the address was recorded
   * @return copy with {@code firstSeen} replaced
   */
  public DiscoveredDevice withFirstSeen(Instant value) {
    return new DiscoveredDevice(id, ip, macAddress, hostname, networkId, status, confidence, osGuess, osFamily,
        openPorts, services, lastScanId, lastSeen, value);
  }

  /**
   * Starts an evidence accumulator for one host.
   *
   * @param id record identifier
   * @param ip host address
   * @return builder with status {@link DeviceStatus#UNKNOWN}
   */
  public static Builder builder(String id, String ip) {
    return new Builder(id, ip);
  }

  /**
   * Evidence accumulator passed through the per-host probing stages.
   *
   * <p>Not thread-safe.</p>
   */
  public static final class Builder {
    private final String id;
    private final String ip;
    private String macAddress = "";
    private String hostname = "";
    private String networkId = "";
    private DeviceStatus status = DeviceStatus.UNKNOWN;
    private int confidence;
    private String osGuess = "";
    private String osFamily = "";
    private List<Integer> openPorts = List.of();
    private final List<ServiceInfo> services = new ArrayList<>();
    private String lastScanId = "";
    private Instant lastSeen;
    private Instant firstSeen;

    private Builder(String id, String ip) {
      this.id = Objects.requireNonNull(id, "id");
      this.ip = Objects.requireNonNull(ip, "ip");
    }

    public Builder macAddress(String value) {
      this.macAddress = value;
      return this;
    }

    public Builder hostname(String value) {
      this.hostname = value;
      return this;
    }

    public Builder networkId(String value) {
      this.networkId = value;
      return this;
    }

    public Builder status(DeviceStatus value) {
      this.status = value;
      return this;
    }

    public Builder confidence(int value) {
      this.confidence = value;
      return this;
    }

    public Builder osGuess(OsGuess guess) {
      this.osGuess = guess.os();
      this.osFamily = guess.family();
      return this;
    }

    public Builder openPorts(List<Integer> value) {
      this.openPorts = value == null ? List.of() : List.copyOf(value);
      return this;
    }

    public Builder services(List<ServiceInfo> value) {
      this.services.clear();
      if (value != null) {
        this.services.addAll(value);
      }
      return this;
    }

    public Builder lastScanId(String value) {
      this.lastScanId = value;
      return this;
    }

    public Builder lastSeen(Instant value) {
      this.lastSeen = value;
      return this;
    }

    public Builder firstSeen(Instant value) {
      this.firstSeen = value;
      return this;
    }

    public String ip() {
      return ip;
    }

    public String macAddress() {
      return macAddress;
    }

    public String hostname() {
      return hostname;
    }

    public DeviceStatus status() {
      return status;
    }

    public List<Integer> openPorts() {
      return openPorts;
    }

    public List<ServiceInfo> services() {
      return List.copyOf(services);
    }

    public String osGuess() {
      return osGuess;
    }

    /**
     * Freezes the accumulated evidence.
     *
     * @return immutable device record
     * @throws NullPointerException when {@code lastSeen} was never set
     */
    public DiscoveredDevice build() {
      return new DiscoveredDevice(id, ip, macAddress, hostname, networkId, status, confidence, osGuess, osFamily,
          openPorts, services, lastScanId, lastSeen, firstSeen);
    }
  }
}
