package ca.gc.cra.medingest.infrastructure.extract;

import ca.gc.cra.medingest.domain.document.DocumentFormat;
import ca.gc.cra.medingest.domain.document.DocumentMetadata;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads file-level metadata shared by all extractors.
 * <p>Unreadable attributes leave size at {@code 0} and timestamps {@code null} rather than failing.</p>
 *
 * @since 0.1.0
 */
public final class FileMetadataReader {
  private static final Logger log = LoggerFactory.getLogger(FileMetadataReader.class);

  /**
   * Reads metadata for a file.
   *
   * @param path source file
   * @param format format family of the extractor
   * @return metadata with the filename date, when one is present
   */
  public DocumentMetadata read(Path path, DocumentFormat format) {
    Path absolute = path.toAbsolutePath().normalize();
    Path namePath = absolute.getFileName();
    String fileName = namePath == null ? absolute.toString() : namePath.toString();
    long size = 0L;
    Instant created = null;
    Instant modified = null;
    try {
      BasicFileAttributes attributes = Files.readAttributes(absolute, BasicFileAttributes.class);
      size = attributes.size();
      created = attributes.creationTime().toInstant();
      modified = attributes.lastModifiedTime().toInstant();
    } catch (IOException ex) {
      log.debug("Unable to read attributes of {}: {}", absolute, ex.getMessage());
    }
    return new DocumentMetadata(
        absolute.toString(),
        fileName,
        extension(fileName),
        format,
        size,
        created,
        modified,
        FilenameDates.parse(fileName).orElse(null),
        null);
  }

  /**
   * Returns the lower-case extension of a file name, including the dot.
   *
   * @param fileName file name
   * @return extension such as {@code .pdf}, or empty when none
   */
  public static String extension(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot <= 0 || dot == fileName.length() - 1) {
      return "";
    }
    return fileName.substring(dot).toLowerCase(Locale.ROOT);
  }
}
