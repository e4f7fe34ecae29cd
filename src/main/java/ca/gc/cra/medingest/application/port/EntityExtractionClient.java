package ca.gc.cra.medingest.application.port;

import java.io.IOException;
import java.util.Optional;

/**
 * <strong>What:</strong> Black-box free-text entity extractor, usually backed by a language model.
 * <p><strong>Role:</strong> External collaborator port; its raw response is parsed tolerantly by the caller.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent calls from workers.</p>
 *
 * @since 0.1.0
 */
public interface EntityExtractionClient {
  /**
   * Requests entities for a document.
   *
   * @param content document text
   * @param documentDate first known ISO date of the document; may be {@code null}
   * @param documentType document type label
   * @return raw response text (JSON object, array, fenced JSON or prose); empty when the collaborator returned
   *     nothing
   * @throws IOException when the collaborator cannot be reached
   * @throws InterruptedException when the calling thread is interrupted while waiting
   */
  Optional<String> extract(String content, String documentDate, String documentType)
      throws IOException, InterruptedException;

  /** Client used when no collaborator is configured; always returns an empty response. */
  EntityExtractionClient DISABLED = (content, date, type) -> Optional.empty();
}
