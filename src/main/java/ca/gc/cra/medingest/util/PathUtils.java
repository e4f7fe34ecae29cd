package ca.gc.cra.medingest.util;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/** Utility helpers for file names and path-derived identifiers. */
public final class PathUtils {
  private PathUtils() {}

  /**
   * Returns the file name for the supplied path when available.
   *
   * @param path source path; may be {@code null}
   * @return optional file name string
   */
  public static Optional<String> fileName(Path path) {
    if (path == null) {
      return Optional.empty();
    }
    Path name = path.getFileName();
    return name == null ? Optional.empty() : Optional.of(name.toString());
  }

  /**
   * Returns the file name without its last extension.
   *
   * @param fileName file name
   * @return stem; the whole name when it has no extension
   */
  public static String stem(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot <= 0 ? fileName : fileName.substring(0, dot);
  }

  /**
   * Returns the lower-case hex SHA-1 of a string's UTF-8 bytes.
   *
   * @param value input
   * @return 40-character digest
   */
  public static String sha1Hex(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-1");
      return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-1 not available", ex);
    }
  }

  /**
   * Builds the artifact key {@code <stem>_<first 8 hex of sha1(path)>} for a source file.
   *
   * @param sourcePath absolute source path
   * @param fileName source file name
   * @return file-system safe key
   */
  public static String artifactKey(String sourcePath, String fileName) {
    return sanitize(stem(fileName)) + "_" + sha1Hex(sourcePath).substring(0, 8);
  }

  /**
   * Replaces characters outside {@code [A-Za-z0-9._-]} with underscores.
   *
   * @param name raw name
   * @return safe name; {@code x} when empty
   */
  public static String sanitize(String name) {
    StringBuilder sb = new StringBuilder(Math.max(16, name.length()));
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.') {
        sb.append(c);
      } else {
        sb.append('_');
      }
    }
    if (sb.length() == 0) {
      sb.append('x');
    }
    return sb.toString();
  }
}
