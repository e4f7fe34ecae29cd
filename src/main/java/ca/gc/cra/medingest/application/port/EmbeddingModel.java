package ca.gc.cra.medingest.application.port;

/**
 * <strong>What:</strong> Turns text into a fixed-dimension vector.
 * <p><strong>Why:</strong> Keeps the vector-generation scheme pluggable; one model must be used per store.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent {@link #embed(String)} calls.</p>
 *
 * @since 0.1.0
 */
public interface EmbeddingModel {
  /**
   * Returns the length of every vector this model produces.
   *
   * @return dimension, positive
   */
  int dimension();

  /**
   * Embeds text.
   *
   * @param text input text; {@code null} treated as empty
   * @return vector of length {@link #dimension()}; all zeros for text without tokens
   */
  float[] embed(String text);
}
