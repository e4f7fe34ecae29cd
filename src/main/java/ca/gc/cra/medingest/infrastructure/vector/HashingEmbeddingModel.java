package ca.gc.cra.medingest.infrastructure.vector;

import ca.gc.cra.medingest.application.port.EmbeddingModel;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic feature-hashing embedding: lower-cased word tokens are hashed into signed buckets and the
 * result is L2-normalized, so texts sharing words score higher.
 * <p>Blank text embeds to the zero vector. Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class HashingEmbeddingModel implements EmbeddingModel {
  private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+");
  private static final int FNV_OFFSET = 0x811c9dc5;
  private static final int FNV_PRIME = 0x01000193;

  private final int dimension;

  public HashingEmbeddingModel(int dimension) {
    if (dimension <= 0) {
      throw new IllegalArgumentException("dimension must be positive");
    }
    this.dimension = dimension;
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public float[] embed(String text) {
    float[] vector = new float[dimension];
    if (text == null || text.isBlank()) {
      return vector;
    }
    Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      int hash = fnv1a(matcher.group());
      int bucket = Math.floorMod(hash, dimension);
      // High bit selects the sign.
      vector[bucket] += (hash >>> 31) == 0 ? 1f : -1f;
    }
    double norm = 0;
    for (float v : vector) {
      norm += (double) v * v;
    }
    if (norm > 0) {
      float scale = (float) (1.0 / Math.sqrt(norm));
      for (int i = 0; i < vector.length; i++) {
        vector[i] *= scale;
      }
    }
    return vector;
  }

  static int fnv1a(String token) {
    int hash = FNV_OFFSET;
    for (byte b : token.getBytes(StandardCharsets.UTF_8)) {
      hash ^= b & 0xff;
      hash *= FNV_PRIME;
    }
    return hash;
  }
}
