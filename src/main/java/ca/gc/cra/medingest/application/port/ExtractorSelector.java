package ca.gc.cra.medingest.application.port;

import java.nio.file.Path;
import java.util.Optional;

/**
 * <strong>What:</strong> Chooses the extractor for a file by extension, falling back to content sniffing.
 * <p><strong>Role:</strong> Application port implemented by detection adapters.</p>
 * <p><strong>Thread-safety:</strong> Implementations are shared across workers and must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ExtractorModule
 */
public interface ExtractorSelector {
  /**
   * Selects an extractor for the file.
   *
   * @param path file to classify; must not be {@code null}
   * @return extractor, or empty when no module matches or the file cannot be read; never throws for unreadable
   *     files
   */
  Optional<DocumentExtractor> select(Path path);
}
