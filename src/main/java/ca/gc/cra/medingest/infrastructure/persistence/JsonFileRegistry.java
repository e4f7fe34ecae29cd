package ca.gc.cra.medingest.infrastructure.persistence;

import ca.gc.cra.medingest.application.json.JsonSupport;
import ca.gc.cra.medingest.application.json.JsonWriter;
import ca.gc.cra.medingest.application.port.ProcessedFileRegistry;
import ca.gc.cra.medingest.domain.registry.ProcessingStatus;
import ca.gc.cra.medingest.domain.registry.RegistryEntry;
import ca.gc.cra.medingest.domain.run.ErrorKind;
import ca.gc.cra.medingest.domain.run.ProcessingStep;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Processed-file registry stored as one JSON object keyed by path.
 * <p><strong>Role:</strong> Adapter implementing {@link ProcessedFileRegistry}.</p>
 * <p>Each {@link #record(RegistryEntry)} builds a new map from the current one plus the entry and rewrites the
 * file atomically; the in-memory view only changes once the write succeeded.</p>
 * <p><strong>Thread-safety:</strong> Synchronized; intended for a single coordinating writer.</p>
 *
 * @since 0.1.0
 */
public final class JsonFileRegistry implements ProcessedFileRegistry {
  /** Registry file name under the registry directory. */
  public static final String FILE_NAME = "processed_files.json";

  private final Path file;
  private final JsonWriter writer = new JsonWriter(true);
  private volatile Map<String, RegistryEntry> entries;

  /**
   * Opens the registry, loading any existing file.
   *
   * @param file registry file
   * @throws IOException when the file exists but cannot be read or parsed
   */
  public JsonFileRegistry(Path file) throws IOException {
    this.file = Objects.requireNonNull(file, "file");
    this.entries = load(file);
  }

  @Override
  public Optional<RegistryEntry> lookup(String path) {
    return Optional.ofNullable(entries.get(path));
  }

  @Override
  public synchronized void record(RegistryEntry entry) throws IOException {
    Objects.requireNonNull(entry, "entry");
    Map<String, RegistryEntry> next = new LinkedHashMap<>(entries);
    next.put(entry.path(), entry);
    AtomicFiles.writeJson(file, toJson(next), writer);
    entries = Collections.unmodifiableMap(next);
  }

  @Override
  public Map<String, RegistryEntry> snapshot() {
    return entries;
  }

  private static Map<String, Object> toJson(Map<String, RegistryEntry> entries) {
    Map<String, Object> root = new LinkedHashMap<>();
    for (RegistryEntry entry : entries.values()) {
      Map<String, Object> item = new LinkedHashMap<>();
      item.put("timestamp", entry.timestamp().toString());
      item.put("status", entry.status().wireValue());
      if (!entry.isSuccess()) {
        item.put("step", entry.step() == null ? null : entry.step().name());
        item.put("error_kind", entry.errorKind() == null ? null : entry.errorKind().name());
        item.put("error", entry.errorDetail());
      }
      root.put(entry.path(), item);
    }
    return root;
  }

  private static Map<String, RegistryEntry> load(Path file) throws IOException {
    if (!Files.exists(file)) {
      return Map.of();
    }
    Object parsed;
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      parsed = new JsonSupport().parse(reader);
    } catch (IllegalArgumentException ex) {
      throw new IOException("Registry " + file + " is not valid JSON", ex);
    }
    if (!(parsed instanceof Map<?, ?> root)) {
      throw new IOException("Registry " + file + " is not a JSON object");
    }
    Map<String, RegistryEntry> entries = new LinkedHashMap<>();
    for (Map.Entry<?, ?> item : root.entrySet()) {
      String path = String.valueOf(item.getKey());
      if (!(item.getValue() instanceof Map<?, ?> fields)) {
        throw new IOException("Registry entry for " + path + " is not an object");
      }
      try {
        entries.put(path, entry(path, fields));
      } catch (IllegalArgumentException | DateTimeParseException | NullPointerException ex) {
        throw new IOException("Registry entry for " + path + " is invalid: " + ex.getMessage(), ex);
      }
    }
    return Collections.unmodifiableMap(entries);
  }

  private static RegistryEntry entry(String path, Map<?, ?> fields) {
    Instant timestamp = Instant.parse(JsonSupport.string(fields, "timestamp"));
    ProcessingStatus status = ProcessingStatus.fromWire(JsonSupport.string(fields, "status"));
    String step = JsonSupport.string(fields, "step");
    String kind = JsonSupport.string(fields, "error_kind");
    return new RegistryEntry(
        path,
        timestamp,
        status,
        step == null ? null : ProcessingStep.valueOf(step),
        kind == null ? null : ErrorKind.valueOf(kind),
        JsonSupport.string(fields, "error"));
  }
}
