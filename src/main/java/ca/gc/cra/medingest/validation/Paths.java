package ca.gc.cra.medingest.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for ingestion inputs and outputs.
 * <p><strong>Role:</strong> Runs before adapters open the input tree, the processed-data root or the vector
 * store directory, so bad paths fail the run up front with a configuration error.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see Strings
 * @see Numbers
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that a path is an existing, readable directory.
   *
   * @param name configuration key used in error messages
   * @param path candidate directory
   * @return absolute normalized path
   * @throws IllegalArgumentException when the directory is missing or unreadable
   */
  public static Path requireReadableDir(String name, Path path) {
    Path normalized = checkRaw(name, path);
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(name + " is not a directory: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates a writable output directory, creating it when missing. Existing content is kept, since output
   * roots are reused across runs.
   *
   * @param name configuration key used in error messages
   * @param path candidate directory
   * @return real path of the directory
   * @throws IllegalArgumentException when the path is not a writable directory or cannot be created
   */
  public static Path requireWritableDir(String name, Path path) {
    Path normalized = checkRaw(name, path);
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath();
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException(name + " is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException(name + " is not writable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to prepare " + name + " " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static Path checkRaw(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(name + " must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
