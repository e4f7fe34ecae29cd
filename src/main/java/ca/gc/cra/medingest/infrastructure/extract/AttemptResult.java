package ca.gc.cra.medingest.infrastructure.extract;

import ca.gc.cra.medingest.domain.document.StructuredContent;

/**
 * Uniform outcome of one parser attempt in an {@link AttemptChain}.
 *
 * @param success whether the attempt produced usable content
 * @param content extracted text; may include bracketed markers for failed units
 * @param confidence attempt confidence before any fallback cap
 * @param structured sections and tables found by the attempt
 * @param failure reason when {@code success} is false
 * @since 0.1.0
 */
public record AttemptResult(
    boolean success, String content, double confidence, StructuredContent structured, String failure) {

  public AttemptResult {
    content = content == null ? "" : content;
    structured = structured == null ? StructuredContent.empty() : structured;
  }

  /**
   * Creates a successful result.
   *
   * @param content extracted text
   * @param confidence confidence in {@code [0, 1]}
   * @param structured structure found by the parser
   * @return result
   */
  public static AttemptResult success(String content, double confidence, StructuredContent structured) {
    return new AttemptResult(true, content, confidence, structured, null);
  }

  /**
   * Creates a failed result.
   *
   * @param failure reason
   * @return result
   */
  public static AttemptResult failure(String failure) {
    return new AttemptResult(false, "", 0.0, StructuredContent.empty(), failure);
  }

  /**
   * Returns a copy with the confidence capped.
   *
   * @param cap upper bound
   * @return capped result
   */
  AttemptResult capped(double cap) {
    return confidence <= cap ? this : new AttemptResult(success, content, cap, structured, failure);
  }
}
