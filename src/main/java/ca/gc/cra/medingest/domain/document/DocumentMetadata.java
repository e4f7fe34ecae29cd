package ca.gc.cra.medingest.domain.document;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> File-level metadata captured alongside extracted content.
 * <p><strong>Role:</strong> Domain value object embedded in {@link ExtractedDocument}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param sourcePath absolute path of the source file as a string
 * @param fileName file name without directories
 * @param extension lower-case extension including the dot, or empty when the file has none
 * @param format format family that produced the extraction
 * @param sizeBytes file size in bytes
 * @param createdAt creation time reported by the filesystem
 * @param modifiedAt last modification time reported by the filesystem
 * @param detectedDate ISO-8601 date parsed from the file name; {@code null} when none matched
 * @param detectedType document type derived from path and content keywords
 * @since 0.1.0
 */
public record DocumentMetadata(
    String sourcePath,
    String fileName,
    String extension,
    DocumentFormat format,
    long sizeBytes,
    Instant createdAt,
    Instant modifiedAt,
    String detectedDate,
    String detectedType) {

  public DocumentMetadata {
    Objects.requireNonNull(sourcePath, "sourcePath");
    Objects.requireNonNull(fileName, "fileName");
    extension = extension == null ? "" : extension;
    Objects.requireNonNull(format, "format");
    detectedType = detectedType == null || detectedType.isBlank() ? "medical_document" : detectedType;
  }

  /**
   * Returns the MIME type of the source format.
   *
   * @return MIME type string
   */
  public String mimeType() {
    return format.mimeType();
  }

  /**
   * Returns the filename date when one was recognized.
   *
   * @return optional ISO-8601 date
   */
  public Optional<String> filenameDate() {
    return Optional.ofNullable(detectedDate);
  }

  /**
   * Returns a copy with a different detected document type.
   *
   * @param type document type label
   * @return updated metadata
   */
  public DocumentMetadata withDetectedType(String type) {
    return new DocumentMetadata(
        sourcePath, fileName, extension, format, sizeBytes, createdAt, modifiedAt, detectedDate, type);
  }
}
