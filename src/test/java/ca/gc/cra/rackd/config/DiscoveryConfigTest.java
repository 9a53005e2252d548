package ca.gc.cra.rackd.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rackd.application.pipeline.ScanSettings;
import ca.gc.cra.rackd.domain.discovery.PortScanType;
import ca.gc.cra.rackd.domain.discovery.ScanType;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class DiscoveryConfigTest {

  @TempDir Path tempDir;

  @Test
  void subnetOnlyUsesDefaults() {
    DiscoveryConfig config = DiscoveryConfig.fromMap(Map.of("subnet", "192.168.1.0/24"));

    assertEquals("default", config.networkId());
    assertEquals("default", config.networkName());
    assertEquals("192.168.1.0/24", config.subnet());
    assertEquals("builtin", config.scanner());
    assertEquals(ScanType.FULL, config.rule().scanType());
    assertEquals(PortScanType.COMMON, config.rule().portScanType());
    assertEquals(5, config.rule().timeoutSeconds());
    assertEquals(ScanSettings.defaults(), config.settings());
    assertEquals(Duration.ofSeconds(3), config.serviceConnectTimeout());
    assertFalse(config.reportPath().isPresent());
  }

  @Test
  void missingSubnetIsRejectedWithExample() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> DiscoveryConfig.fromMap(Map.of()));
    assertEquals("subnet is required (e.g. subnet=192.168.1.0/24)", ex.getMessage());
  }

  @Test
  void malformedSubnetNamesTheKey() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> DiscoveryConfig.fromMap(Map.of("subnet", "10.0.0.0/40")));
    assertTrue(ex.getMessage().startsWith("subnet "), ex.getMessage());
  }

  @Test
  void parsesRuleOverrides() {
    Map<String, String> options = new HashMap<>();
    options.put("subnet", "10.0.0.0/28");
    options.put("networkId", "lab-1");
    options.put("networkName", "Lab network");
    options.put("scanner", "BUILTIN");
    options.put("scanType", "Quick");
    options.put("scanPorts", "FALSE");
    options.put("portScanType", "custom");
    options.put("customPorts", "22, 8080,22");
    options.put("excludeHosts", "printer.lab,nas.lab");
    options.put("timeoutSeconds", "2");
    options.put("hostConcurrency", "16");
    options.put("progressInterval", "10");
    options.put("maxHosts", "1024");

    DiscoveryConfig config = DiscoveryConfig.fromMap(options);

    assertEquals("lab-1", config.networkId());
    assertEquals("Lab network", config.networkName());
    assertEquals("builtin", config.scanner());
    assertEquals(ScanType.QUICK, config.rule().scanType());
    assertFalse(config.rule().scanPorts());
    assertEquals(List.of(22, 8080), config.rule().customPorts());
    assertEquals(List.of("printer.lab", "nas.lab"), config.rule().excludeHosts());
    assertEquals(2, config.rule().timeoutSeconds());
    assertEquals(new ScanSettings(16, 10, 1024), config.settings());
  }

  @Test
  void booleansAreStrict() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> DiscoveryConfig.fromMap(Map.of("subnet", "10.0.0.0/24", "osDetection", "yes")));
    assertEquals("osDetection must be true or false (was yes)", ex.getMessage());
  }

  @Test
  void unknownScanTypeRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> DiscoveryConfig.fromMap(Map.of("subnet", "10.0.0.0/24", "scanType", "stealth")));
    assertTrue(ex.getMessage().startsWith("scanType must be quick, full or deep"));
  }

  @Test
  void rangesAreEnforced() {
    assertThrows(IllegalArgumentException.class,
        () -> DiscoveryConfig.fromMap(Map.of("subnet", "10.0.0.0/24", "hostConcurrency", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> DiscoveryConfig.fromMap(Map.of("subnet", "10.0.0.0/24", "timeoutSeconds", "301")));
    assertThrows(IllegalArgumentException.class,
        () -> DiscoveryConfig.fromMap(Map.of("subnet", "10.0.0.0/24", "customPorts", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> DiscoveryConfig.fromMap(Map.of("subnet", "10.0.0.0/24", "maxHosts", "lots")));
  }

  @Test
  void networkIdMustBeIdentifier() {
    assertThrows(IllegalArgumentException.class,
        () -> DiscoveryConfig.fromMap(Map.of("subnet", "10.0.0.0/24", "networkId", "lab net")));
  }

  @Test
  void reportPathResolvedAgainstWritableParent() {
    Path report = tempDir.resolve("reports/scan.json");

    DiscoveryConfig config = DiscoveryConfig.fromMap(Map.of("subnet", "10.0.0.0/24", "out", report.toString()));

    assertEquals(report.toAbsolutePath().normalize(), config.reportPath().orElseThrow());
  }

  @Test
  void reportPathRejectsDirectory() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("out"));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> DiscoveryConfig.fromMap(Map.of("subnet", "10.0.0.0/24", "out", dir.toString())));
    assertTrue(ex.getMessage().startsWith("out is a directory"));
  }

  @Test
  void malformedExclusionsAreKeptAndWarned() {
    Logger logger = (Logger) LoggerFactory.getLogger(DiscoveryConfig.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);

    DiscoveryConfig config;
    try {
      config = DiscoveryConfig.fromMap(Map.of(
          "subnet", "10.0.0.0/24",
          "excludeIps", "10.0.0.1,not-an-ip",
          "excludeHosts", "bad_host!"));
    } finally {
      logger.detachAppender(appender);
      appender.stop();
    }

    assertEquals(List.of("10.0.0.1", "not-an-ip"), config.rule().excludeIps());
    assertEquals(List.of("bad_host!"), config.rule().excludeHosts());
    assertEquals(2, appender.list.size());
    assertTrue(appender.list.stream().allMatch(event -> event.getLevel() == Level.WARN));
    assertTrue(appender.list.get(0).getFormattedMessage().contains("not-an-ip"));
  }
}
