package ca.gc.cra.medingest.infrastructure.persistence;

import ca.gc.cra.medingest.application.json.JsonWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Writes files through a sibling temp file followed by a move, so readers never see a partial file.
 *
 * @since 0.1.0
 */
public final class AtomicFiles {
  private AtomicFiles() {
    // Utility
  }

  /**
   * Serializes {@code value} as JSON and atomically replaces {@code target}.
   *
   * @param target destination file; parent directories are created
   * @param value JSON object graph
   * @param writer serializer
   * @throws IOException when the file cannot be written or moved
   */
  public static void writeJson(Path target, Object value, JsonWriter writer) throws IOException {
    commit(stage(target, value, writer), target);
  }

  /**
   * Serializes {@code value} into the temp sibling of {@code target} without touching {@code target}.
   *
   * @param target eventual destination file; parent directories are created
   * @param value JSON object graph
   * @param writer serializer
   * @return the staged temp file, to be passed to {@link #commit(Path, Path)} or {@link #abandon(Path)}
   * @throws IOException when the temp file cannot be written; nothing is left behind
   */
  public static Path stage(Path target, Object value, JsonWriter writer) throws IOException {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(writer, "writer");
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
    try (OutputStream out = Files.newOutputStream(tmp)) {
      writer.write(value, out);
    } catch (IOException ex) {
      abandonQuietly(tmp, ex);
      throw ex;
    }
    return tmp;
  }

  /**
   * Moves a staged temp file over its target.
   *
   * @param tmp staged file from {@link #stage(Path, Object, JsonWriter)}
   * @param target destination file
   * @throws IOException when the move fails; the temp file is removed
   */
  public static void commit(Path tmp, Path target) throws IOException {
    try {
      move(tmp, target);
    } catch (IOException ex) {
      abandonQuietly(tmp, ex);
      throw ex;
    }
  }

  /**
   * Deletes a staged temp file that will not be committed.
   *
   * @param tmp staged file
   * @throws IOException when the file cannot be deleted
   */
  public static void abandon(Path tmp) throws IOException {
    Files.deleteIfExists(tmp);
  }

  private static void abandonQuietly(Path tmp, IOException failure) {
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException cleanup) {
      failure.addSuppressed(cleanup);
    }
  }

  private static void move(Path tmp, Path target) throws IOException {
    try {
      Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
