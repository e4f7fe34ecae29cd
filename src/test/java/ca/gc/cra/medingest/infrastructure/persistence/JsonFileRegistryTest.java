package ca.gc.cra.medingest.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.medingest.application.json.JsonSupport;
import ca.gc.cra.medingest.domain.registry.ProcessingStatus;
import ca.gc.cra.medingest.domain.registry.RegistryEntry;
import ca.gc.cra.medingest.domain.run.ErrorKind;
import ca.gc.cra.medingest.domain.run.ProcessingStep;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileRegistryTest {
  private static final Instant T1 = Instant.parse("2024-02-01T10:00:00Z");
  private static final Instant T2 = Instant.parse("2024-02-02T10:00:00Z");

  @TempDir Path dir;

  @Test
  void missingFileStartsEmpty() throws IOException {
    JsonFileRegistry registry = new JsonFileRegistry(dir.resolve(JsonFileRegistry.FILE_NAME));

    assertTrue(registry.snapshot().isEmpty());
    assertTrue(registry.lookup("/in/a.txt").isEmpty());
  }

  @Test
  void entriesRoundTripThroughTheFile() throws IOException {
    Path file = dir.resolve(JsonFileRegistry.FILE_NAME);
    JsonFileRegistry registry = new JsonFileRegistry(file);
    registry.record(RegistryEntry.success("/in/a.txt", T1));
    registry.record(RegistryEntry.error(
        "/in/b.pdf", T1, ProcessingStep.EXTRACT, ErrorKind.EXTRACTION_FAILURE, "PDF syntax error"));

    JsonFileRegistry reopened = new JsonFileRegistry(file);

    assertEquals(registry.snapshot(), reopened.snapshot());
    RegistryEntry failed = reopened.lookup("/in/b.pdf").orElseThrow();
    assertEquals(ProcessingStatus.ERROR, failed.status());
    assertEquals(ProcessingStep.EXTRACT, failed.step());
    assertEquals(ErrorKind.EXTRACTION_FAILURE, failed.errorKind());
    assertEquals("PDF syntax error", failed.error().orElseThrow());
    assertFalse(Files.exists(dir.resolve(JsonFileRegistry.FILE_NAME + ".tmp")));
  }

  @Test
  void wireFormatUsesLowercaseStatusAndOmitsErrorFieldsOnSuccess() throws IOException {
    Path file = dir.resolve(JsonFileRegistry.FILE_NAME);
    JsonFileRegistry registry = new JsonFileRegistry(file);
    registry.record(RegistryEntry.success("/in/a.txt", T1));

    Map<?, ?> root = (Map<?, ?>) new JsonSupport().parse(Files.readString(file));

    assertEquals(Map.of("timestamp", "2024-02-01T10:00:00Z", "status", "success"), root.get("/in/a.txt"));
  }

  @Test
  void reRecordingReplacesInPlace() throws IOException {
    JsonFileRegistry registry = new JsonFileRegistry(dir.resolve(JsonFileRegistry.FILE_NAME));
    registry.record(RegistryEntry.error("/in/a.txt", T1, ProcessingStep.PERSIST, ErrorKind.PERSISTENCE_IO, "disk"));
    registry.record(RegistryEntry.success("/in/b.txt", T1));
    registry.record(RegistryEntry.success("/in/a.txt", T2));

    assertEquals(List.of("/in/a.txt", "/in/b.txt"), List.copyOf(registry.snapshot().keySet()));
    assertTrue(registry.lookup("/in/a.txt").orElseThrow().isSuccess());
    assertEquals(T2, registry.lookup("/in/a.txt").orElseThrow().timestamp());
  }

  @Test
  void snapshotIsImmutable() throws IOException {
    JsonFileRegistry registry = new JsonFileRegistry(dir.resolve(JsonFileRegistry.FILE_NAME));
    registry.record(RegistryEntry.success("/in/a.txt", T1));

    assertThrows(UnsupportedOperationException.class,
        () -> registry.snapshot().put("/in/x.txt", RegistryEntry.success("/in/x.txt", T1)));
  }

  @Test
  void corruptRegistryFailsToOpen() throws IOException {
    Path file = dir.resolve(JsonFileRegistry.FILE_NAME);
    Files.writeString(file, "{\"/in/a.txt\": {\"timestamp\": \"yesterday\", \"status\": \"success\"}}");
    assertThrows(IOException.class, () -> new JsonFileRegistry(file));

    Files.writeString(file, "[1, 2]");
    assertThrows(IOException.class, () -> new JsonFileRegistry(file));

    Files.writeString(file, "{\"/in/a.txt\": ");
    assertThrows(IOException.class, () -> new JsonFileRegistry(file));
  }
}
