package ca.gc.cra.medingest.application.port;

import ca.gc.cra.medingest.domain.document.DocumentFormat;
import ca.gc.cra.medingest.domain.document.ExtractedDocument;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Capability that turns one file of a given format into text plus structural metadata.
 * <p><strong>Why:</strong> Lets the orchestrator treat every format uniformly; adding a format means adding one
 * extractor and one {@link ExtractorModule}.</p>
 * <p><strong>Role:</strong> Application port implemented by the per-format adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read the file and fill {@link ExtractedDocument} metadata, content and structure.</li>
 *   <li>Degrade {@code confidence} and write bracketed markers into the content instead of throwing on bad
 *   input.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations are stateless and safe to share across workers.</p>
 * <p><strong>Performance:</strong> Bounded by file size; no network access.</p>
 *
 * @since 0.1.0
 */
public interface DocumentExtractor {
  /**
   * Returns the format family handled by this extractor.
   *
   * @return format; never {@code null}
   */
  DocumentFormat format();

  /**
   * Extracts one file.
   *
   * @param path file to read; must not be {@code null}
   * @return extracted document; confidence {@code 0} with an error marker when nothing could be read
   */
  ExtractedDocument extract(Path path);
}
