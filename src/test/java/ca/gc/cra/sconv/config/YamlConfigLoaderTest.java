package ca.gc.cra.sconv.config;

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
    Path yaml = tempDir.resolve("sconv.yaml");
    Files.writeString(yaml, """
        common:
          backend: PLATFORM_CODEPAGE
          legacyUtf8: false
        convert:
          from: CP932
          legacyUtf8: true
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "convert");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("PLATFORM_CODEPAGE", map.get("backend"));
    assertEquals("CP932", map.get("from"));
    assertEquals("true", map.get("legacyUtf8"));
  }

  @Test
  void otherModeSectionsAreIgnored() throws IOException {
    Path yaml = tempDir.resolve("modes.yaml");
    Files.writeString(yaml, """
        convert:
          in: names.bin
        INSPECT:
          direction: write
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "inspect").orElseThrow();
    assertEquals(Map.of("direction", "write"), map);
  }

  @Test
  void loadFlattensNestedMapsAndNulls() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        common:
          otel:
            resource:
              team: archive
          systemCharset:
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "convert").orElseThrow();
    assertEquals("archive", map.get("otel.resource.team"));
    assertEquals("", map.get("systemCharset"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Optional.of(Map.of()), YamlConfigLoader.load(yaml, "convert"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result =
        YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "convert");

    assertFalse(result.isPresent());
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - convert:
            from: UTF-8
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "convert"));
  }

  @Test
  void arraysAreRejected() throws IOException {
    Path yaml = tempDir.resolve("array.yaml");
    Files.writeString(yaml, """
        convert:
          from: [UTF-8, CP932]
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "convert"));
  }

  @Test
  void misspeltSectionIsRejected() throws IOException {
    Path yaml = tempDir.resolve("typo.yaml");
    Files.writeString(yaml, """
        convrt:
          from: CP932
        """);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(yaml, "convert"));
    assertTrue(ex.getMessage().contains("convrt"));
  }

  @Test
  void malformedYamlIsReportedAsIllegalArgument() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "convert: [unclosed\n");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(yaml, "convert"));
    assertTrue(ex.getMessage().startsWith("Failed to parse YAML config"));
  }
}
