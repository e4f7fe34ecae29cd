package ca.gc.cra.medingest.infrastructure.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NdjsonWorkspaceSyncAdapterTest {
  @TempDir Path dir;

  @Test
  void appendsOneJsonLinePerRecord() throws Exception {
    Path file = dir.resolve("sync").resolve("workspace.ndjson");
    Map<String, Object> condition = new LinkedHashMap<>();
    condition.put("standard_name", "Asthma");
    condition.put("code", null);

    try (NdjsonWorkspaceSyncAdapter adapter = new NdjsonWorkspaceSyncAdapter(file)) {
      adapter.push("documents", Map.of("name", "note.txt"));
      adapter.push("conditions", condition);
    }
    try (NdjsonWorkspaceSyncAdapter adapter = new NdjsonWorkspaceSyncAdapter(file)) {
      adapter.push("symptoms", null);
    }

    assertEquals(List.of(
            "{\"entity_type\":\"documents\",\"properties\":{\"name\":\"note.txt\"}}",
            "{\"entity_type\":\"conditions\",\"properties\":{\"standard_name\":\"Asthma\",\"code\":null}}",
            "{\"entity_type\":\"symptoms\",\"properties\":{}}"),
        Files.readAllLines(file));
  }
}
