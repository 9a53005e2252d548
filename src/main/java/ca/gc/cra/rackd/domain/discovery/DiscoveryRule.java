package ca.gc.cra.rackd.domain.discovery;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Per-network discovery policy applied to one scan.
 * <p><strong>Why:</strong> Decides which probes run, which ports are tried, which hosts are skipped and how long
 * each network operation may block.</p>
 * <p><strong>Role:</strong> Domain value consumed by the scan orchestrator and every prober.</p>
 * <p><strong>Thread-safety:</strong> Immutable; list components are unmodifiable copies.</p>
 *
 * @param enabled whether schedulers should run this rule; the scanner itself ignores the flag
 * @param scanIntervalHours preferred interval between scheduled runs; informational
 * @param scanType depth of the run; {@code null} resolves to {@link ScanType#FULL}
 * @param scanPorts whether the port prober runs for non-quick scans
 * @param portScanType port set policy; {@code null} resolves to {@link PortScanType#COMMON}
 * @param customPorts ports used by {@link PortScanType#CUSTOM}; duplicates are removed, order kept
 * @param serviceDetection whether open ports are fingerprinted
 * @param osDetection whether the OS heuristic runs
 * @param excludeIps literal addresses or CIDR blocks to skip
 * @param excludeHosts host names to skip once reverse resolution returns them
 * @param timeoutSeconds per-operation timeout for ICMP and TCP connects, 1..300
 * @param maxConcurrentScans concurrent scan budget advertised to schedulers; informational
 * @since 0.1.0
 */
public record DiscoveryRule(
    boolean enabled,
    int scanIntervalHours,
    ScanType scanType,
    boolean scanPorts,
    PortScanType portScanType,
    List<Integer> customPorts,
    boolean serviceDetection,
    boolean osDetection,
    List<String> excludeIps,
    List<String> excludeHosts,
    int timeoutSeconds,
    int maxConcurrentScans) {

  /** Lowest accepted timeout. */
  public static final int MIN_TIMEOUT_SECONDS = 1;
  /** Highest accepted timeout. */
  public static final int MAX_TIMEOUT_SECONDS = 300;

  /**
   * Normalizes components and validates ranges.
   *
   * @throws IllegalArgumentException when a port or the timeout is out of range
   */
  public DiscoveryRule {
    scanType = Objects.requireNonNullElse(scanType, ScanType.FULL);
    portScanType = Objects.requireNonNullElse(portScanType, PortScanType.COMMON);
    customPorts = normalizePorts(customPorts);
    excludeIps = copyEntries(excludeIps);
    excludeHosts = copyEntries(excludeHosts);
    if (timeoutSeconds < MIN_TIMEOUT_SECONDS || timeoutSeconds > MAX_TIMEOUT_SECONDS) {
      throw new IllegalArgumentException("timeoutSeconds must be between " + MIN_TIMEOUT_SECONDS
          + " and " + MAX_TIMEOUT_SECONDS + " (was " + timeoutSeconds + ")");
    }
    if (scanIntervalHours < 0) {
      throw new IllegalArgumentException("scanIntervalHours must not be negative");
    }
    if (maxConcurrentScans < 1) {
      throw new IllegalArgumentException("maxConcurrentScans must be positive");
    }
  }

  /**
   * Returns the rule used for networks without an explicit policy.
   *
   * @return full scan with port, service and OS detection and a 5 second timeout
   */
  public static DiscoveryRule defaults() {
    return new DiscoveryRule(
        true, 24, ScanType.FULL, true, PortScanType.COMMON, List.of(), true, true, List.of(), List.of(), 5, 10);
  }

  /**
   * Returns the per-operation timeout.
   *
   * @return timeout as a duration
   */
  public Duration timeout() {
    return Duration.ofSeconds(timeoutSeconds);
  }

  /**
   * Starts a builder seeded with {@link #defaults()}.
   *
   * @return new builder
   */
  public static Builder builder() {
    return defaults().toBuilder();
  }

  /**
   * Starts a builder seeded with this rule.
   *
   * @return new builder
   */
  public Builder toBuilder() {
    return new Builder(this);
  }

  private static List<Integer> normalizePorts(List<Integer> ports) {
    if (ports == null || ports.isEmpty()) {
      return List.of();
    }
    Set<Integer> unique = new LinkedHashSet<>();
    for (Integer port : ports) {
      if (port == null) {
        continue;
      }
      if (port < 1 || port > 65535) {
        throw new IllegalArgumentException("customPorts must be between 1 and 65535 (was " + port + ")");
      }
      unique.add(port);
    }
    return List.copyOf(unique);
  }

  private static List<String> copyEntries(List<String> entries) {
    if (entries == null || entries.isEmpty()) {
      return List.of();
    }
    List<String> copy = new ArrayList<>(entries.size());
    for (String entry : entries) {
      if (entry != null && !entry.isBlank()) {
        copy.add(entry.trim());
      }
    }
    return List.copyOf(copy);
  }

  /** Mutable builder for {@link DiscoveryRule}. */
  public static final class Builder {
    private boolean enabled;
    private int scanIntervalHours;
    private ScanType scanType;
    private boolean scanPorts;
    private PortScanType portScanType;
    private List<Integer> customPorts;
    private boolean serviceDetection;
    private boolean osDetection;
    private List<String> excludeIps;
    private List<String> excludeHosts;
    private int timeoutSeconds;
    private int maxConcurrentScans;

    private Builder(DiscoveryRule seed) {
      this.enabled = seed.enabled;
      this.scanIntervalHours = seed.scanIntervalHours;
      this.scanType = seed.scanType;
      this.scanPorts = seed.scanPorts;
      this.portScanType = seed.portScanType;
      this.customPorts = seed.customPorts;
      this.serviceDetection = seed.serviceDetection;
      this.osDetection = seed.osDetection;
      this.excludeIps = seed.excludeIps;
      this.excludeHosts = seed.excludeHosts;
      this.timeoutSeconds = seed.timeoutSeconds;
      this.maxConcurrentScans = seed.maxConcurrentScans;
    }

    public Builder enabled(boolean value) {
      this.enabled = value;
      return this;
    }

    public Builder scanIntervalHours(int value) {
      this.scanIntervalHours = value;
      return this;
    }

    public Builder scanType(ScanType value) {
      this.scanType = value;
      return this;
    }

    public Builder scanPorts(boolean value) {
      this.scanPorts = value;
      return this;
    }

    public Builder portScanType(PortScanType value) {
      this.portScanType = value;
      return this;
    }

    public Builder customPorts(List<Integer> value) {
      this.customPorts = value;
      return this;
    }

    public Builder serviceDetection(boolean value) {
      this.serviceDetection = value;
      return this;
    }

    public Builder osDetection(boolean value) {
      this.osDetection = value;
      return this;
    }

    public Builder excludeIps(List<String> value) {
      this.excludeIps = value;
      return this;
    }

    public Builder excludeHosts(List<String> value) {
      this.excludeHosts = value;
      return this;
    }

    public Builder timeoutSeconds(int value) {
      this.timeoutSeconds = value;
      return this;
    }

    public Builder maxConcurrentScans(int value) {
      this.maxConcurrentScans = value;
      return this;
    }

    /**
     * Builds the validated rule.
     *
     * @return immutable rule
     * @throws IllegalArgumentException when a value is out of range
     */
    public DiscoveryRule build() {
      return new DiscoveryRule(
          enabled,
          scanIntervalHours,
          scanType,
          scanPorts,
          portScanType,
          customPorts,
          serviceDetection,
          osDetection,
          excludeIps,
          excludeHosts,
          timeoutSeconds,
          maxConcurrentScans);
    }
  }
}
