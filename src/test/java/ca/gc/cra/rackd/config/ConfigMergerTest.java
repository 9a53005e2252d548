package ca.gc.cra.rackd.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("subnet", "", "hostConcurrency", "5");
    Map<String, String> yaml = Map.of("subnet", "10.0.0.0/24", "hostConcurrency", "8");
    Map<String, String> cli = Map.of("subnet", "10.1.0.0/24");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "scan", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("10.1.0.0/24", merged.get("subnet"));
    assertEquals("8", merged.get("hostConcurrency"));
    assertEquals(List.of("CLI overrides YAML for key: subnet"), warnings);
  }

  @Test
  void defaultsApplyWhenNoOtherSource() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "scan", Optional.empty(), Map.of(), DiscoveryDefaults.asFlatMap(), msg -> {});

    assertEquals("full", merged.get("scanType"));
    assertEquals("builtin", merged.get("scanner"));
  }

  @Test
  void unknownMetricsExporterRejected() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "scan", Optional.empty(), Map.of("metricsExporter", "prometheus"), Map.of(), msg -> {}));
    assertTrue(ex.getMessage().contains("metricsExporter"));
  }

  @Test
  void customPortsWithoutCustomScanTypeWarns() {
    List<String> warnings = new ArrayList<>();

    ConfigMerger.buildEffectiveConfig(
        "scan",
        Optional.of(Map.of("customPorts", "22,8080")),
        Map.of("portScanType", "common"),
        Map.of(),
        warnings::add);

    assertTrue(warnings.contains("customPorts ignored because portScanType=common"));
  }

  @Test
  void customScanTypeWithoutPortsWarns() {
    List<String> warnings = new ArrayList<>();

    ConfigMerger.buildEffectiveConfig(
        "scan", Optional.empty(), Map.of("portScanType", "custom"), Map.of(), warnings::add);

    assertEquals(1, warnings.size());
    assertTrue(warnings.get(0).startsWith("portScanType=custom without customPorts"));
  }
}
