package ca.gc.cra.medingest.infrastructure.extract;

import ca.gc.cra.medingest.application.port.DocumentExtractor;
import ca.gc.cra.medingest.domain.document.DocumentMetadata;
import ca.gc.cra.medingest.domain.document.ExtractedDocument;
import ca.gc.cra.medingest.domain.document.Section;
import ca.gc.cra.medingest.domain.document.StructuredContent;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Template for format extractors: metadata, parsing, then shared secondary extraction.
 * <p><strong>Role:</strong> Base adapter implementing {@link DocumentExtractor}.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Read metadata through {@link FileMetadataReader}.</li>
 *   <li>Delegate parsing to {@link #parse(Path)}; a failed parse becomes a confidence-0 document whose content
 *   is a bracketed marker.</li>
 *   <li>Add body dates, providers and, when the parser found none, text sections.</li>
 *   <li>Classify the document type from file name and content.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Subclasses must be stateless.</p>
 * <p><strong>Observability:</strong> Logs failed extractions at WARN.</p>
 *
 * @since 0.1.0
 */
public abstract class AbstractDocumentExtractor implements DocumentExtractor {
  private static final Logger log = LoggerFactory.getLogger(AbstractDocumentExtractor.class);

  private final FileMetadataReader metadataReader;

  protected AbstractDocumentExtractor(FileMetadataReader metadataReader) {
    this.metadataReader = Objects.requireNonNull(metadataReader, "metadataReader");
  }

  @Override
  public final ExtractedDocument extract(Path path) {
    Objects.requireNonNull(path, "path");
    DocumentMetadata metadata = metadataReader.read(path, format());
    AttemptResult result;
    try {
      result = parse(path);
    } catch (RuntimeException ex) {
      result = AttemptResult.failure(ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
    if (!result.success()) {
      log.warn("{} extraction failed for {}: {}", format().id(), path, result.failure());
      return ExtractedDocument.failed(
          metadata.withDetectedType(ContentMiner.documentType(path, "")), failureMarker(result));
    }
    String content = result.content();
    StructuredContent parsed = result.structured();
    List<Section> sections = parsed.sections().isEmpty() ? ContentMiner.sections(content) : parsed.sections();
    StructuredContent structured = new StructuredContent(
        sections,
        parsed.tables(),
        ContentMiner.dates(content),
        ContentMiner.providers(content),
        parsed.attributes());
    return new ExtractedDocument(
        metadata.withDetectedType(ContentMiner.documentType(path, content)),
        content,
        structured,
        result.confidence());
  }

  /**
   * Parses the file. Implementations return failures instead of throwing where they can.
   *
   * @param path file to parse
   * @return parse outcome
   */
  protected abstract AttemptResult parse(Path path);

  /**
   * Builds the in-band marker for a failed parse.
   *
   * @param result failed outcome
   * @return bracketed marker
   */
  protected String failureMarker(AttemptResult result) {
    return marker("Failed to extract " + format().id() + " content: " + result.failure());
  }

  /**
   * Wraps text in brackets, replacing characters that would end the marker early.
   *
   * @param text marker text
   * @return bracketed single-line marker
   */
  protected static String marker(String text) {
    String safe = String.valueOf(text).replace('[', '(').replace(']', ')').replaceAll("\\s+", " ").trim();
    return "[" + safe + "]";
  }
}
