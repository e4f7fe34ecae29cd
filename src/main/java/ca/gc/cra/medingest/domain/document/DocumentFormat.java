package ca.gc.cra.medingest.domain.document;

import java.util.Locale;

/**
 * <strong>What:</strong> Source format families understood by the extractors.
 * <p><strong>Why:</strong> Used for routing files to extractor modules and tagging metrics and artifacts.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum DocumentFormat {
  /** Plain text. */
  TEXT("text/plain"),
  /** Markdown text with heading and list markers. */
  MARKDOWN("text/markdown"),
  /** Comma-delimited tabular data. */
  CSV("text/csv"),
  /** HTML markup. */
  HTML("text/html"),
  /** Rich Text Format. */
  RTF("application/rtf"),
  /** Word-processor documents (OOXML container). */
  DOCX("application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
  /** Portable document format. */
  PDF("application/pdf");

  private final String mimeType;

  DocumentFormat(String mimeType) {
    this.mimeType = mimeType;
  }

  /**
   * Returns the MIME type reported in extracted metadata.
   *
   * @return MIME type string
   */
  public String mimeType() {
    return mimeType;
  }

  /**
   * Returns the lower-case identifier used in metric names and JSON artifacts.
   *
   * @return format id such as {@code pdf}
   */
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
