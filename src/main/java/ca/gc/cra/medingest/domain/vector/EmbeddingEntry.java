package ca.gc.cra.medingest.domain.vector;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Vector plus metadata owned by the embedding store.
 * <p>The vector array is copied on construction and on access.</p>
 *
 * @param id caller-supplied identifier; re-adding the same id overwrites
 * @param vector embedding values
 * @param metadata string metadata such as {@code entity_type} and {@code source}
 * @since 0.1.0
 */
public record EmbeddingEntry(String id, float[] vector, Map<String, String> metadata) {
  public EmbeddingEntry {
    Objects.requireNonNull(id, "id");
    vector = Arrays.copyOf(Objects.requireNonNull(vector, "vector"), vector.length);
    metadata = metadata == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  @Override
  public float[] vector() {
    return Arrays.copyOf(vector, vector.length);
  }

  /**
   * Returns the vector dimensionality.
   *
   * @return number of components
   */
  public int dimension() {
    return vector.length;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof EmbeddingEntry that)) {
      return false;
    }
    return id.equals(that.id) && Arrays.equals(vector, that.vector) && metadata.equals(that.metadata);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, Arrays.hashCode(vector), metadata);
  }

  @Override
  public String toString() {
    return "EmbeddingEntry[id=" + id + ", dimension=" + vector.length + ", metadata=" + metadata + "]";
  }
}
