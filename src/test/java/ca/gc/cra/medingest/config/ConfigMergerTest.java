package ca.gc.cra.medingest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("workers", "4", "metricsExporter", "none");
    Map<String, String> yaml = Map.of("workers", "8", "out", "/data/processed");
    Map<String, String> cli = Map.of("workers", "2", "out", "/tmp/out");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "ingest",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("2", merged.get("workers"));
    assertEquals("/tmp/out", merged.get("out"));
    assertEquals("none", merged.get("metricsExporter"));
    assertEquals(2, warnings.size());
    assertTrue(warnings.contains("CLI overrides YAML for key: workers"));
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "search",
        Optional.of(Map.of("topK", "10")),
        Map.of(),
        Map.of("topK", "5"),
        warnings::add);

    assertEquals("10", merged.get("topK"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void nullCliValuesDoNotClearLowerLayers() {
    Map<String, String> cli = new HashMap<>();
    cli.put("out", null);

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "ingest", Optional.empty(), cli, Map.of("out", "/default"), msg -> {});

    assertEquals("/default", merged.get("out"));
  }

  @Test
  void skipFailedConflictsWithRetryUnsupported() {
    Map<String, String> cli = Map.of("skipFailed", "true", "retryUnsupported", "true");

    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig("ingest", Optional.empty(), cli, Map.of(), msg -> {}));
  }

  @Test
  void unknownMetricsExporterIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "search", Optional.empty(), Map.of("metricsExporter", "prometheus"), Map.of(), msg -> {}));
  }
}
