package ca.gc.cra.protomine.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("protomine.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
        extract:
          in: pages/
          revision: 19000
        shape:
          table: 3
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "extract").orElseThrow();

    assertEquals("none", map.get("metricsExporter"));
    assertEquals("pages/", map.get("in"));
    assertEquals("19000", map.get("revision"));
    assertFalse(map.containsKey("table"));
  }

  @Test
  void modeSectionOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("override.yaml");
    Files.writeString(yaml, """
        common:
          verbose: false
        Extract:
          verbose: true
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "extract").orElseThrow();
    assertEquals("true", map.get("verbose"));
  }

  @Test
  void nestedMapsAndListsAreFlattened() throws IOException {
    Path yaml = tempDir.resolve("dialect.yaml");
    Files.writeString(yaml, """
        extract:
          dialect:
            states: [Status, Login]
            ignored:
            noFieldsMarker: "''none''"
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "extract").orElseThrow();

    assertEquals("Status,Login", map.get("dialect.states"));
    assertEquals("", map.get("dialect.ignored"));
    assertEquals("''none''", map.get("dialect.noFieldsMarker"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "extract");
    assertTrue(result.isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "shape").orElseThrow());
  }

  @Test
  void nonMappingSectionIsRejected() throws IOException {
    Path yaml = tempDir.resolve("bad.yaml");
    Files.writeString(yaml, "common: just-a-string\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "extract"));
  }

  @Test
  void nestedListsAreRejected() throws IOException {
    Path yaml = tempDir.resolve("lists.yaml");
    Files.writeString(yaml, """
        extract:
          dialect:
            states: [[Status], Login]
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "extract"));
  }

  @Test
  void malformedYamlIsRejected() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "extract: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "extract"));
  }
}
