package ca.gc.cra.medingest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class IngestConfigTest {

  @Test
  void defaultsMatchDocumentedValues() {
    IngestConfig defaults = IngestConfig.defaults();

    assertTrue(defaults.recursive());
    assertTrue(defaults.embed());
    assertEquals(256, defaults.embeddingDimension());
    assertEquals(30, defaults.llmTimeoutSeconds());
    assertTrue(defaults.outputDirectory().endsWith(Path.of(".medingest", "processed_data")));
    assertTrue(defaults.llmEndpoint().isEmpty());
    assertFalse(defaults.dryRun());
  }

  @Test
  void fromMapParsesEveryOption() {
    Map<String, String> options = new HashMap<>();
    options.put("input", "/data/in");
    options.put("output", "/data/out/../processed");
    options.put("recursive", "no");
    options.put("extensions", "TXT, .Pdf,,");
    options.put("workers", "3");
    options.put("embeddingDimension", "64");
    options.put("embed", "false");
    options.put("llmEndpoint", "http://localhost:11434/api/generate");
    options.put("llmTimeoutSeconds", "5");
    options.put("syncOut", "/data/sync.ndjson");
    options.put("failOnErrors", "yes");
    options.put("skipFailed", "1");

    IngestConfig config = IngestConfig.fromMap(options);

    assertEquals(Path.of("/data/in").toAbsolutePath(), config.inputDirectory());
    assertEquals(Path.of("/data/processed").toAbsolutePath(), config.outputDirectory());
    assertFalse(config.recursive());
    assertEquals(Set.of(".txt", ".pdf"), config.extensions());
    assertEquals(3, config.workers());
    assertEquals(64, config.embeddingDimension());
    assertFalse(config.embed());
    assertEquals(URI.create("http://localhost:11434/api/generate"), config.llmEndpoint().orElseThrow());
    assertEquals(5, config.llmTimeoutSeconds());
    assertEquals(Path.of("/data/sync.ndjson").toAbsolutePath(), config.syncOutput().orElseThrow());
    assertTrue(config.failOnErrors());
    assertTrue(config.skipFailed());
    assertFalse(config.retryUnsupported());
  }

  @Test
  void derivedLocationsLiveUnderOutput() {
    IngestConfig config = IngestConfig.fromMap(Map.of("in", "/in", "out", "/srv/out"));

    Path out = Path.of("/srv/out").toAbsolutePath();
    assertEquals(out.resolve("vectordb"), config.effectiveVectorDirectory());
    assertEquals(out.resolve("file_registry").resolve("processed_files.json"), config.registryFile());

    IngestConfig explicit = IngestConfig.fromMap(Map.of("in", "/in", "out", "/srv/out", "vectorDir", "/srv/vec"));
    assertEquals(Path.of("/srv/vec").toAbsolutePath(), explicit.effectiveVectorDirectory());
  }

  @Test
  void tildeExpandsToHome() {
    IngestConfig config = IngestConfig.fromMap(Map.of("in", "~/records"));

    assertEquals(Path.of(System.getProperty("user.home"), "records").toAbsolutePath().normalize(),
        config.inputDirectory());
  }

  @Test
  void acceptsMatchesExtensionCaseInsensitively() {
    IngestConfig config = IngestConfig.fromMap(Map.of("in", "/in", "extensions", ".txt"));

    assertTrue(config.accepts("NOTE.TXT"));
    assertFalse(config.accepts(".txt"));
    assertFalse(config.accepts("README"));
    assertFalse(config.accepts("scan.pdf"));
  }

  @Test
  void invalidOptionsAreRejected() {
    IllegalArgumentException missing =
        assertThrows(IllegalArgumentException.class, () -> IngestConfig.fromMap(Map.of()));
    assertEquals("in is required", missing.getMessage());

    IllegalArgumentException scheme = assertThrows(IllegalArgumentException.class,
        () -> IngestConfig.fromMap(Map.of("in", "/in", "llmEndpoint", "ftp://model")));
    assertEquals("llmEndpoint must be an http(s) URL", scheme.getMessage());

    assertThrows(IllegalArgumentException.class,
        () -> IngestConfig.fromMap(Map.of("in", "/in", "embeddingDimension", "4")));
    assertThrows(IllegalArgumentException.class,
        () -> IngestConfig.fromMap(Map.of("in", "/in", "workers", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> IngestConfig.fromMap(Map.of("in", "/in", "llmTimeoutSeconds", "7200")));
    assertThrows(IllegalArgumentException.class,
        () -> IngestConfig.fromMap(Map.of("in", "/in", "extensions", " , ")));
    assertThrows(IllegalArgumentException.class,
        () -> IngestConfig.fromMap(Map.of("in", "/in", "dryRun", "maybe")));
  }
}
