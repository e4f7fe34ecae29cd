package ca.gc.cra.medingest.domain.vector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One ranked similarity result.
 *
 * @param id entry identifier
 * @param score cosine similarity in {@code [-1, 1]}
 * @param metadata entry metadata
 * @since 0.1.0
 */
public record SearchHit(String id, double score, Map<String, String> metadata) {
  public SearchHit {
    metadata = metadata == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
