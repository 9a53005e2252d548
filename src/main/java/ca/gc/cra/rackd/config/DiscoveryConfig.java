package ca.gc.cra.rackd.config;

import ca.gc.cra.rackd.application.pipeline.ScanSettings;
import ca.gc.cra.rackd.domain.discovery.DiscoveryRule;
import ca.gc.cra.rackd.domain.discovery.PortScanType;
import ca.gc.cra.rackd.domain.discovery.ScanType;
import ca.gc.cra.rackd.validation.Net;
import ca.gc.cra.rackd.validation.Numbers;
import ca.gc.cra.rackd.validation.Paths;
import ca.gc.cra.rackd.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Validated settings for one {@code scan} invocation.
 * <p><strong>Why:</strong> Turns the merged string map (defaults, YAML, CLI) into typed values once, so the
 * scanner never sees malformed input.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot} and the scan CLI.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param networkId identifier of the network being scanned
 * @param networkName display name of the network; defaults to {@code networkId}
 * @param subnet CIDR block to enumerate
 * @param scanner name of the scanner provider to use
 * @param rule discovery policy for the run
 * @param settings host pool size, reporting interval and subnet limit
 * @param serviceConnectTimeout connect deadline used by banner grabbing
 * @param bannerReadTimeout read deadline used by banner grabbing
 * @param reportPath optional JSON report destination
 * @since 0.1.0
 * @implNote Malformed {@code excludeIps} and {@code excludeHosts} entries are kept, since they never match, and
 *     reported as warnings.
 */
public record DiscoveryConfig(
    String networkId,
    String networkName,
    String subnet,
    String scanner,
    DiscoveryRule rule,
    ScanSettings settings,
    Duration serviceConnectTimeout,
    Duration bannerReadTimeout,
    Optional<Path> reportPath) {

  private static final Logger log = LoggerFactory.getLogger(DiscoveryConfig.class);

  /** Network id used when none is configured. */
  public static final String DEFAULT_NETWORK_ID = "default";
  static final int MAX_HOST_CONCURRENCY = 256;
  static final int MAX_PROGRESS_INTERVAL = 10_000;
  static final int MAX_MAX_HOSTS = 16_777_216;
  static final int MAX_PROBE_TIMEOUT_MILLIS = 60_000;

  public DiscoveryConfig {
    networkId = Strings.requireIdentifier("networkId", networkId);
    networkName = networkName == null || networkName.isBlank()
        ? networkId
        : Strings.requirePrintableAscii("networkName", networkName, 128);
    subnet = Net.requireCidr("subnet", subnet);
    scanner = Strings.requireIdentifier("scanner", scanner);
    Objects.requireNonNull(rule, "rule");
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(serviceConnectTimeout, "serviceConnectTimeout");
    Objects.requireNonNull(bannerReadTimeout, "bannerReadTimeout");
    reportPath = reportPath == null ? Optional.empty() : reportPath;
  }

  /**
   * Creates a configuration from merged key/value pairs.
   *
   * @param options keys documented in {@link DiscoveryDefaults}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is missing or invalid; the message names the key
   */
  public static DiscoveryConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Map<String, String> defaults = DiscoveryDefaults.asFlatMap();

    String subnet = value(options, defaults, "subnet");
    if (subnet.isBlank()) {
      throw new IllegalArgumentException("subnet is required (e.g. subnet=192.168.1.0/24)");
    }

    DiscoveryRule rule = DiscoveryRule.builder()
        .scanType(parseScanType(value(options, defaults, "scanType")))
        .scanPorts(parseBoolean("scanPorts", value(options, defaults, "scanPorts")))
        .portScanType(parsePortScanType(value(options, defaults, "portScanType")))
        .customPorts(parsePorts(value(options, defaults, "customPorts")))
        .serviceDetection(parseBoolean("serviceDetection", value(options, defaults, "serviceDetection")))
        .osDetection(parseBoolean("osDetection", value(options, defaults, "osDetection")))
        .excludeIps(parseExcludeIps(value(options, defaults, "excludeIps")))
        .excludeHosts(parseExcludeHosts(value(options, defaults, "excludeHosts")))
        .timeoutSeconds(Numbers.parseIntInRange("timeoutSeconds", value(options, defaults, "timeoutSeconds"),
            DiscoveryRule.MIN_TIMEOUT_SECONDS, DiscoveryRule.MAX_TIMEOUT_SECONDS))
        .build();

    ScanSettings settings = new ScanSettings(
        Numbers.parseIntInRange("hostConcurrency", value(options, defaults, "hostConcurrency"),
            1, MAX_HOST_CONCURRENCY),
        Numbers.parseIntInRange("progressInterval", value(options, defaults, "progressInterval"),
            1, MAX_PROGRESS_INTERVAL),
        Numbers.parseIntInRange("maxHosts", value(options, defaults, "maxHosts"), 1, MAX_MAX_HOSTS));

    Duration connectTimeout = Duration.ofMillis(Numbers.parseIntInRange("serviceConnectTimeoutMillis",
        value(options, defaults, "serviceConnectTimeoutMillis"), 1, MAX_PROBE_TIMEOUT_MILLIS));
    Duration readTimeout = Duration.ofMillis(Numbers.parseIntInRange("bannerReadTimeoutMillis",
        value(options, defaults, "bannerReadTimeoutMillis"), 1, MAX_PROBE_TIMEOUT_MILLIS));

    return new DiscoveryConfig(
        value(options, defaults, "networkId"),
        value(options, defaults, "networkName"),
        subnet,
        value(options, defaults, "scanner").toLowerCase(Locale.ROOT),
        rule,
        settings,
        connectTimeout,
        readTimeout,
        parseReportPath(value(options, defaults, "out")));
  }

  private static String value(Map<String, String> options, Map<String, String> defaults, String key) {
    String raw = options.get(key);
    if (raw == null) {
      raw = defaults.getOrDefault(key, "");
    }
    return raw.trim();
  }

  private static ScanType parseScanType(String raw) {
    try {
      return ScanType.fromWire(raw);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("scanType must be quick, full or deep (was " + raw + ")", ex);
    }
  }

  private static PortScanType parsePortScanType(String raw) {
    try {
      return PortScanType.fromWire(raw);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("portScanType must be common, full or custom (was " + raw + ")", ex);
    }
  }

  private static boolean parseBoolean(String key, String raw) {
    String normalized = raw.toLowerCase(Locale.ROOT);
    if (normalized.equals("true")) {
      return true;
    }
    if (normalized.equals("false")) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false (was " + raw + ")");
  }

  private static List<Integer> parsePorts(String raw) {
    List<Integer> ports = new ArrayList<>();
    for (String token : Strings.splitList("customPorts", raw)) {
      ports.add(Numbers.parseIntInRange("customPorts", token, 1, 65_535));
    }
    return ports;
  }

  private static List<String> parseExcludeIps(String raw) {
    List<String> entries = Strings.splitList("excludeIps", raw);
    for (String entry : entries) {
      if (!Net.isAddressOrCidr(entry)) {
        log.warn("excludeIps entry '{}' is not an address or CIDR block and will never match", entry);
      }
    }
    return entries;
  }

  private static List<String> parseExcludeHosts(String raw) {
    List<String> entries = Strings.splitList("excludeHosts", raw);
    for (String entry : entries) {
      if (!Net.isHostname(entry)) {
        log.warn("excludeHosts entry '{}' is not a valid host name and will never match", entry);
      }
    }
    return entries;
  }

  private static Optional<Path> parseReportPath(String raw) {
    if (raw.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Paths.requireWritableFile("out", Path.of(raw)));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("out is not a valid path: " + raw, ex);
    }
  }
}
