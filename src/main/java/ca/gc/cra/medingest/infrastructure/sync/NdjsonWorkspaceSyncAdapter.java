package ca.gc.cra.medingest.infrastructure.sync;

import ca.gc.cra.medingest.application.json.JsonWriter;
import ca.gc.cra.medingest.application.port.WorkspaceSyncPort;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Appends workspace records to a newline-delimited JSON file, one {@code {entity_type, properties}} object per
 * line.
 * <p>Synchronized so records pushed from concurrent workers never interleave.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonWorkspaceSyncAdapter implements WorkspaceSyncPort {
  private final JsonWriter json = new JsonWriter(false);
  private final BufferedWriter out;

  /**
   * Opens the target file for appending, creating parent directories.
   *
   * @param file NDJSON target
   * @throws IOException when the file cannot be opened
   */
  public NdjsonWorkspaceSyncAdapter(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    this.out = Files.newBufferedWriter(
        file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
  }

  @Override
  public synchronized void push(String entityType, Map<String, Object> properties) throws IOException {
    Map<String, Object> line = new LinkedHashMap<>();
    line.put("entity_type", Objects.requireNonNull(entityType, "entityType"));
    line.put("properties", properties == null ? Map.of() : properties);
    out.write(json.write(line));
    out.newLine();
    out.flush();
  }

  @Override
  public synchronized void close() throws IOException {
    out.close();
  }
}
