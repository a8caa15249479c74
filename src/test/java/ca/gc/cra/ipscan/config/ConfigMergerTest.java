package ca.gc.cra.ipscan.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {
  private final Map<String, String> defaults = DefaultsForMode.asFlatMap("run");

  @Test
  void precedenceIsCliThenYamlThenEnvironmentThenDefaults() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "run",
        Map.of("databaseName", "env_db", "filePath", "/env/access.log", "runIntervalSeconds", "20"),
        Optional.of(Map.of("databaseName", "yaml_db", "workers", "3")),
        Map.of("workers", "5"),
        defaults,
        warnings::add);

    assertEquals("yaml_db", effective.get("databaseName"));
    assertEquals("/env/access.log", effective.get("filePath"));
    assertEquals("20", effective.get("runIntervalSeconds"));
    assertEquals("5", effective.get("workers"));
    assertEquals("private_ips", effective.get("privateCollectionName"));
    assertTrue(warnings.contains("YAML overrides environment for key: databaseName"));
    assertTrue(warnings.contains("CLI overrides YAML for key: workers"));
  }

  @Test
  void unknownCliKeyFailsFast() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "scan", Map.of(), Optional.empty(), Map.of("runIntervalSeconds", "5"),
            DefaultsForMode.asFlatMap("scan"), null));

    assertEquals("Unknown option for scan: runIntervalSeconds", ex.getMessage());
  }

  @Test
  void unknownYamlKeyOnlyWarns() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "run", Map.of(), Optional.of(Map.of("iface", "eth0")), Map.of(), defaults, warnings::add);

    assertFalse(effective.containsKey("iface"));
    assertEquals(List.of("Ignoring unknown YAML key for run: iface"), warnings);
  }

  @Test
  void environmentKeysOutsideModeAreIgnored() {
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "scan", Map.of("runIntervalSeconds", "30"), Optional.empty(), Map.of(),
        DefaultsForMode.asFlatMap("scan"), null);

    assertFalse(effective.containsKey("runIntervalSeconds"));
  }
}
