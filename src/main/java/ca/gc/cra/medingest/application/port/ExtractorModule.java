package ca.gc.cra.medingest.application.port;

import ca.gc.cra.medingest.domain.document.DocumentFormat;
import java.util.Set;

/**
 * <strong>What:</strong> Pluggable module describing how to recognize and extract a specific format.
 * <p><strong>Why:</strong> Gives the selector a registry of extension and signature rules instead of branching on
 * types.</p>
 * <p><strong>Role:</strong> Application port representing format plugins.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose the format and its well-known extensions.</li>
 *   <li>Check a bounded byte prefix for the format's signature.</li>
 *   <li>Provide the {@link DocumentExtractor} for the format.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations are stateless and thread-safe.</p>
 * <p><strong>Performance:</strong> Signature checks are O(n) in the prefix length.</p>
 *
 * @since 0.1.0
 * @see ExtractorSelector
 */
public interface ExtractorModule {
  /**
   * Returns the format served by this module.
   *
   * @return format; never {@code null}
   */
  DocumentFormat format();

  /**
   * Provides lower-case extensions, including the leading dot, that route to this module.
   *
   * @return immutable set of extensions; may be empty
   */
  Set<String> extensions();

  /**
   * Returns the sniffing order; lower values are checked first. Binary magic-byte formats sort before text
   * heuristics.
   *
   * @return priority
   */
  int sniffPriority();

  /**
   * Checks whether the sampled prefix matches this format.
   *
   * @param sample bounded byte prefix and, when it decodes as UTF-8, its text
   * @return {@code true} when the signature matches
   */
  boolean matchesSignature(SniffSample sample);

  /**
   * Returns the extractor for this format.
   *
   * @return shared extractor instance
   */
  DocumentExtractor extractor();
}
