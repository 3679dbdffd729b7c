package ca.gc.cra.protomine.config;

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
    Map<String, String> defaults = Map.of("in", "/default", "metricsExporter", "otlp");
    Map<String, String> yaml = Map.of("in", "/yaml", "revision", "10");
    Map<String, String> cli = Map.of("in", "/cli", "revision", "11");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "extract",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("/cli", merged.get("in"));
    assertEquals("11", merged.get("revision"));
    assertEquals("otlp", merged.get("metricsExporter"));
    assertEquals(2, warnings.size());
    assertTrue(warnings.contains("CLI overrides YAML for key: in"));
    assertTrue(warnings.contains("CLI overrides YAML for key: revision"));
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "extract",
        Optional.of(Map.of("metricsExporter", "none")),
        Map.of(),
        DefaultsForMode.asFlatMap("extract"),
        warnings::add);

    assertEquals("none", merged.get("metricsExporter"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void unknownExporterIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "extract",
            Optional.empty(),
            Map.of("metricsExporter", "prometheus"),
            Map.of(),
            msg -> {}));
  }

  @Test
  void shapeRejectsRevision() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "shape",
            Optional.empty(),
            Map.of("revision", "5"),
            DefaultsForMode.asFlatMap("shape"),
            msg -> {}));
  }
}
