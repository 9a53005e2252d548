package ca.gc.cra.rackd.config;

import ca.gc.cra.rackd.application.pipeline.ScanSettings;
import ca.gc.cra.rackd.domain.discovery.DiscoveryRule;
import ca.gc.cra.rackd.infrastructure.probe.BannerServiceProber;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Supplies the flattened default configuration for the {@code scan} command.
 *
 * <p>Every key a YAML file or CLI argument may set appears here, so the defaults double as the list of
 * recognized keys.</p>
 */
public final class DiscoveryDefaults {
  private static final Map<String, String> DEFAULTS = buildDefaults();

  private DiscoveryDefaults() {}

  /**
   * Returns the default key/value pairs.
   *
   * @return unmodifiable map of defaults as strings
   */
  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  private static Map<String, String> buildDefaults() {
    DiscoveryRule rule = DiscoveryRule.defaults();
    ScanSettings settings = ScanSettings.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("networkId", DiscoveryConfig.DEFAULT_NETWORK_ID);
    map.put("networkName", "");
    map.put("subnet", "");
    map.put("scanner", BuiltinNetworkScannerProvider.NAME);
    map.put("scanType", rule.scanType().wireName());
    map.put("scanPorts", Boolean.toString(rule.scanPorts()));
    map.put("portScanType", rule.portScanType().wireName());
    map.put("customPorts", join(rule.customPorts()));
    map.put("serviceDetection", Boolean.toString(rule.serviceDetection()));
    map.put("osDetection", Boolean.toString(rule.osDetection()));
    map.put("excludeIps", join(rule.excludeIps()));
    map.put("excludeHosts", join(rule.excludeHosts()));
    map.put("timeoutSeconds", Integer.toString(rule.timeoutSeconds()));
    map.put("hostConcurrency", Integer.toString(settings.hostConcurrency()));
    map.put("progressInterval", Integer.toString(settings.progressInterval()));
    map.put("maxHosts", Integer.toString(settings.maxHosts()));
    map.put("serviceConnectTimeoutMillis",
        Long.toString(BannerServiceProber.DEFAULT_CONNECT_TIMEOUT.toMillis()));
    map.put("bannerReadTimeoutMillis", Long.toString(BannerServiceProber.DEFAULT_READ_TIMEOUT.toMillis()));
    map.put("out", "");
    return Map.copyOf(map);
  }

  private static String join(List<?> values) {
    return values.stream().map(String::valueOf).collect(Collectors.joining(","));
  }
}
