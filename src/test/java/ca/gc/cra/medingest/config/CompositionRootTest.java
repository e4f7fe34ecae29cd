package ca.gc.cra.medingest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.medingest.domain.run.RunReport;
import ca.gc.cra.medingest.testutil.DocumentFixtures;
import ca.gc.cra.medingest.testutil.RecordingMetricsPort;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir Path tempDir;

  @Test
  void wiresIngestWithSyncOutput() throws Exception {
    Path input = Files.createDirectories(tempDir.resolve("in"));
    DocumentFixtures.writeText(input.resolve("note.txt"), "ASSESSMENT: asthma.\nPLAN: inhaler.\n");
    Path sync = tempDir.resolve("sync.ndjson");
    IngestConfig config = IngestConfig.fromMap(Map.of(
        "in", input.toString(),
        "out", tempDir.resolve("out").toString(),
        "embeddingDimension", "16",
        "workers", "1",
        "syncOut", sync.toString()));

    RunReport report;
    try (CompositionRoot root = new CompositionRoot(new RecordingMetricsPort())) {
      report = root.ingestionUseCase(config).run(config);
    }

    assertEquals(1, report.success());
    List<String> lines = Files.readAllLines(sync);
    assertTrue(lines.get(0).startsWith("{\"entity_type\":\"documents\""));
    assertTrue(Files.exists(tempDir.resolve("out").resolve("vectordb")));
  }

  @Test
  void dryRunSkipsStoreAndSync() throws Exception {
    Path input = Files.createDirectories(tempDir.resolve("in"));
    Path sync = tempDir.resolve("sync.ndjson");
    IngestConfig config = IngestConfig.fromMap(Map.of(
        "in", input.toString(),
        "out", tempDir.resolve("out").toString(),
        "syncOut", sync.toString(),
        "dryRun", "true"));

    try (CompositionRoot root = new CompositionRoot(new RecordingMetricsPort())) {
      root.ingestionUseCase(config).run(config);
    }

    assertFalse(Files.exists(sync));
    assertFalse(Files.exists(tempDir.resolve("out").resolve("vectordb")));
  }

  @Test
  void searchRequiresExistingStoreDirectory() throws Exception {
    SearchConfig config =
        SearchConfig.fromMap(Map.of("query", "asthma", "vectorDir", tempDir.resolve("none").toString()));

    try (CompositionRoot root = new CompositionRoot(new RecordingMetricsPort())) {
      assertThrows(IllegalArgumentException.class, () -> root.searchUseCase(config));
    }
  }

  @Test
  void ingestRequiresExistingInput() throws Exception {
    IngestConfig config = IngestConfig.fromMap(Map.of("in", tempDir.resolve("none").toString(),
        "out", tempDir.resolve("out").toString()));

    try (CompositionRoot root = new CompositionRoot(new RecordingMetricsPort())) {
      assertThrows(IllegalArgumentException.class, () -> root.ingestionUseCase(config));
    }
  }
}
