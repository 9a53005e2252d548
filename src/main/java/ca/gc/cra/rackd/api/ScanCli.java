package ca.gc.cra.rackd.api;

import ca.gc.cra.rackd.application.discovery.HostRangeEnumerator;
import ca.gc.cra.rackd.application.port.MetricsPort;
import ca.gc.cra.rackd.application.port.NetworkScanner;
import ca.gc.cra.rackd.application.port.ScanFailedException;
import ca.gc.cra.rackd.application.port.ScanUpdateListener;
import ca.gc.cra.rackd.application.util.CancellationToken;
import ca.gc.cra.rackd.config.CompositionRoot;
import ca.gc.cra.rackd.config.ConfigMerger;
import ca.gc.cra.rackd.config.DiscoveryConfig;
import ca.gc.cra.rackd.config.DiscoveryDefaults;
import ca.gc.cra.rackd.config.YamlConfigLoader;
import ca.gc.cra.rackd.domain.discovery.DiscoveredDevice;
import ca.gc.cra.rackd.domain.discovery.DiscoveryRule;
import ca.gc.cra.rackd.domain.discovery.DiscoveryScan;
import ca.gc.cra.rackd.domain.discovery.Network;
import ca.gc.cra.rackd.domain.net.InvalidSubnetException;
import ca.gc.cra.rackd.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.rackd.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.rackd.infrastructure.persistence.InMemoryDiscoveryStore;
import ca.gc.cra.rackd.infrastructure.persistence.PersistingScanUpdateListener;
import ca.gc.cra.rackd.infrastructure.report.JsonScanReportWriter;
import ca.gc.cra.rackd.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one discovery scan against a subnet and prints a summary.
 *
 * <p>Configuration precedence is CLI &gt; YAML ({@code common} then {@code scan} section) &gt; built-in defaults.
 * Results land in an in-memory store; {@code out=} additionally writes them as a JSON report.</p>
 *
 * @since 0.1.0
 */
public final class ScanCli {
  private static final Logger log = LoggerFactory.getLogger(ScanCli.class);
  private static final String MODE = "scan";
  private static final String SUMMARY_USAGE =
      "usage: scan subnet=CIDR [networkId=ID] [networkName=NAME] [scanType=quick|full|deep] "
          + "[scanPorts=true|false] [portScanType=common|full|custom] [customPorts=P1,P2] "
          + "[serviceDetection=true|false] [osDetection=true|false] [excludeIps=IP|CIDR,...] "
          + "[excludeHosts=NAME,...] [timeoutSeconds=N] [hostConcurrency=N] [out=PATH] "
          + "[config=PATH] [--dry-run] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      rackd network discovery scan

      Usage:
        scan subnet=192.168.1.0/24 [options]

      Required:
        subnet=CIDR                  IPv4 or IPv6 block to enumerate

      Optional (validated):
        networkId=ID                 Inventory network id (default "default")
        networkName=NAME             Display name (defaults to networkId)
        scanType=quick|full|deep     quick drops hosts that do not answer ping (default full)
        scanPorts=true|false         Probe TCP ports (default true)
        portScanType=common|full|custom  Port list selection (default common)
        customPorts=P1,P2            Ports used when portScanType=custom
        serviceDetection=true|false  Grab banners from open ports (default true)
        osDetection=true|false       Guess the operating system (default true)
        excludeIps=IP|CIDR,...       Addresses or blocks never probed
        excludeHosts=NAME,...        Host names skipped after reverse lookup
        timeoutSeconds=N             Per-host probe deadline, 1-300 (default 5)
        hostConcurrency=N            Hosts probed at once, 1-256 (default 5)
        progressInterval=N           Hosts between progress snapshots (default 50)
        maxHosts=N                   Refuse subnets larger than N hosts (default 65536)
        serviceConnectTimeoutMillis=N  Banner connect deadline (default 3000)
        bannerReadTimeoutMillis=N    Banner read deadline (default 2000)
        scanner=NAME                 Scanner provider (default builtin)
        out=PATH                     Write the scan and its devices as JSON
        config=PATH                  YAML file with common/scan sections
        metricsExporter=otlp|none    Configure metrics exporter (default none)
        otelEndpoint=URL             OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V   Comma-separated OTel resource attributes
        --dry-run                    Validate inputs and print the plan without probing
        --verbose                    Enable DEBUG logging
        --help                       Show this message

      Notes:
        ? Without raw socket privilege, liveness is unknown and quick scans find nothing.
        ? Exit codes: 0 ok, 2 invalid args, 3 I/O error, 4 config error, 5 scan failed, 130 interrupted.
      """;

  private ScanCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the scan CLI logic using structured logging and exit codes.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for scan CLI");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, MODE);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          MODE, yamlConfig, kv, DiscoveryDefaults.asFlatMap(), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid scan arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    boolean dryRunKey = ConfigCliUtils.takeBoolean(configInputs, "dryRun");
    boolean dryRun = input.hasFlag("--dry-run") || dryRunKey;
    warnUnknownKeys(configInputs);

    boolean otlp;
    DiscoveryConfig config;
    try {
      otlp = TelemetryConfigurator.configureMetrics(configInputs);
      config = DiscoveryConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid scan arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      return printDryRunPlan(config);
    }

    MetricsPort metrics = otlp ? new OpenTelemetryMetricsAdapter() : new NoOpMetricsAdapter();
    try {
      return execute(config, metrics);
    } finally {
      if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
        otel.close();
      }
    }
  }

  private static ExitCode execute(DiscoveryConfig config, MetricsPort metrics) {
    InMemoryDiscoveryStore store = new InMemoryDiscoveryStore();
    store.registerNetwork(Network.of(config.networkId(), config.networkName(), config.subnet()));

    NetworkScanner scanner;
    try {
      scanner = new CompositionRoot(config, store, metrics).networkScanner();
    } catch (IllegalArgumentException ex) {
      log.error("Scanner configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    ScanUpdateListener listener = new PersistingScanUpdateListener(store, metrics, ScanUpdateListener.NO_OP);
    log.info("Configured scan: network={}, subnet={}, scanType={}, scanner={}",
        config.networkId(), config.subnet(), config.rule().scanType().wireName(), config.scanner());

    DiscoveryScan scan;
    try {
      scan = scanner.scanNetwork(CancellationToken.create(), config.networkId(), config.rule(), listener);
    } catch (ScanFailedException ex) {
      log.error("Scan {} failed: {}", ex.scan().id(), ex.scan().errorMessage());
      printSummary(ex.scan(), List.of());
      return ExitCode.RUNTIME_FAILURE;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during scan", ex);
      return ExitCode.RUNTIME_FAILURE;
    }

    List<DiscoveredDevice> devices = store.devicesForNetwork(config.networkId());
    printSummary(scan, devices);

    if (config.reportPath().isPresent()) {
      Path report = config.reportPath().get();
      try {
        new JsonScanReportWriter().write(report, scan, devices);
        CliPrinter.println(" Report written    : " + report);
      } catch (IOException ex) {
        log.error("Unable to write scan report {}", report, ex);
        return ExitCode.IO_ERROR;
      }
    }

    if (Thread.currentThread().isInterrupted()) {
      log.warn("Scan {} was interrupted; results are partial", scan.id());
      return ExitCode.INTERRUPTED;
    }
    return ExitCode.SUCCESS;
  }

  private static void warnUnknownKeys(Map<String, String> configInputs) {
    Map<String, String> defaults = DiscoveryDefaults.asFlatMap();
    for (String key : configInputs.keySet()) {
      if (!defaults.containsKey(key)) {
        log.warn("Ignoring unknown configuration key: {}", key);
      }
    }
  }

  private static ExitCode printDryRunPlan(DiscoveryConfig config) {
    int hostCount;
    try {
      hostCount = new HostRangeEnumerator(config.settings().maxHosts()).enumerate(config.subnet()).size();
    } catch (InvalidSubnetException ex) {
      log.error("Invalid subnet {}: {}", config.subnet(), ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    DiscoveryRule rule = config.rule();
    CliPrinter.printLines(
        "Scan dry-run: no hosts will be probed.",
        " Network           : " + config.networkId() + " (" + config.networkName() + ")",
        " Subnet            : " + config.subnet(),
        " Candidate hosts   : " + hostCount,
        " Scan type         : " + rule.scanType().wireName() + " (depth " + rule.scanType().depth() + ")",
        " Port scan         : " + (rule.scanPorts() ? rule.portScanType().wireName() : "disabled"),
        " Custom ports      : " + (rule.customPorts().isEmpty() ? "<none>" : rule.customPorts()),
        " Service detection : " + rule.serviceDetection(),
        " OS detection      : " + rule.osDetection(),
        " Excluded IPs      : " + (rule.excludeIps().isEmpty() ? "<none>" : String.join(",", rule.excludeIps())),
        " Excluded hosts    : "
            + (rule.excludeHosts().isEmpty() ? "<none>" : String.join(",", rule.excludeHosts())),
        " Host timeout      : " + rule.timeoutSeconds() + "s",
        " Host concurrency  : " + config.settings().hostConcurrency(),
        " Scanner           : " + config.scanner(),
        " Report            : " + config.reportPath().map(Path::toString).orElse("<none>"),
        " Re-run without --dry-run to scan.");
    return ExitCode.SUCCESS;
  }

  private static void printSummary(DiscoveryScan scan, List<DiscoveredDevice> devices) {
    CliPrinter.printLines(
        "Scan " + scan.id() + " " + scan.status().wireName(),
        " Network           : " + scan.networkId(),
        " Hosts scanned     : " + scan.scannedHosts() + "/" + scan.totalHosts(),
        " Hosts found       : " + scan.foundHosts(),
        " Duration          : " + scan.durationSeconds() + "s");
    if (!scan.errorMessage().isEmpty()) {
      CliPrinter.println(" Error             : " + scan.errorMessage());
    }
    for (DiscoveredDevice device : devices) {
      CliPrinter.println(String.format(" %-39s %-17s %3d%% %-24s ports=%s",
          device.ip(),
          device.macAddress().isEmpty() ? "-" : device.macAddress(),
          device.confidence(),
          device.hostname().isEmpty() ? "-" : device.hostname(),
          device.openPorts()));
    }
  }
}
