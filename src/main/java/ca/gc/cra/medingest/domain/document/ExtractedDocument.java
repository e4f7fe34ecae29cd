package ca.gc.cra.medingest.domain.document;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Raw text and metadata produced by a format extractor for one file.
 * <p><strong>Why:</strong> Decouples format parsing from normalization so the normalizer can stay a pure function.</p>
 * <p><strong>Role:</strong> Domain value handed from extractors to the normalizer by the ingest orchestrator.</p>
 * <p><strong>Thread-safety:</strong> Immutable; never mutated after creation.</p>
 *
 * @param metadata file-level metadata
 * @param content extracted text; may contain bracketed error markers such as {@code [Failed to extract ...]}
 * @param structured sections, tables, dates and providers
 * @param confidence fraction of the document reliably extracted, in {@code [0, 1]}
 * @since 0.1.0
 */
public record ExtractedDocument(
    DocumentMetadata metadata, String content, StructuredContent structured, double confidence) {

  private static final Pattern ERROR_MARKER = Pattern.compile("\\[[^\\]\\n]*(?:[Ff]ail|[Ee]rror)[^\\]\\n]*\\]");

  public ExtractedDocument {
    Objects.requireNonNull(metadata, "metadata");
    content = content == null ? "" : content;
    structured = structured == null ? StructuredContent.empty() : structured;
    if (Double.isNaN(confidence)) {
      confidence = 0.0;
    }
    confidence = Math.max(0.0, Math.min(1.0, confidence));
  }

  /**
   * Creates a failed extraction carrying only an in-band error marker.
   *
   * @param metadata file metadata
   * @param marker bracketed error marker
   * @return document with confidence 0
   */
  public static ExtractedDocument failed(DocumentMetadata metadata, String marker) {
    return new ExtractedDocument(metadata, marker, StructuredContent.empty(), 0.0);
  }

  /**
   * Indicates whether nothing usable was extracted: confidence is zero and the text holds nothing but error
   * markers and whitespace.
   *
   * @return {@code true} when extraction failed outright
   */
  public boolean isFailure() {
    if (confidence > 0.0) {
      return false;
    }
    return ERROR_MARKER.matcher(content).replaceAll("").isBlank();
  }
}
