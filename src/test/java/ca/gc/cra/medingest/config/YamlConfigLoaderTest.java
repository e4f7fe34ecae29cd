package ca.gc.cra.medingest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("medingest.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          embeddingDimension: 128
        ingest:
          workers: 3
          extensions: [.txt, .pdf]
        search:
          topK: 9
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "Ingest").orElseThrow();

    assertEquals("none", map.get("metricsExporter"));
    assertEquals("128", map.get("embeddingDimension"));
    assertEquals("3", map.get("workers"));
    assertEquals(".txt,.pdf", map.get("extensions"));
    assertFalse(map.containsKey("topK"));
  }

  @Test
  void loadFlattensNestedMaps() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        search:
          otel:
            endpoint: http://collector:4317
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "search").orElseThrow();

    assertEquals("http://collector:4317", map.get("otel.endpoint"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "ingest").isPresent());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("empty.yaml"), "");

    assertTrue(YamlConfigLoader.load(yaml, "ingest").orElseThrow().isEmpty());
  }

  @Test
  void invalidStructuresThrow() throws IOException {
    Path list = Files.writeString(tempDir.resolve("list.yaml"), "- ingest\n- search\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(list, "ingest"));

    Path nestedList = Files.writeString(tempDir.resolve("nested-list.yaml"), """
        ingest:
          extensions:
            - [.txt]
        """);
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(nestedList, "ingest"));

    Path broken = Files.writeString(tempDir.resolve("broken.yaml"), "ingest: [unclosed\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "ingest"));
  }
}
