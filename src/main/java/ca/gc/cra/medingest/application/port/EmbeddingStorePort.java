package ca.gc.cra.medingest.application.port;

import ca.gc.cra.medingest.domain.vector.EmbeddingEntry;
import ca.gc.cra.medingest.domain.vector.SearchHit;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Persistent vector table answering nearest-neighbour queries by cosine similarity.
 * <p><strong>Why:</strong> Lets callers retrieve documents and entities by meaning rather than exact text.</p>
 * <p><strong>Role:</strong> Application port; the only store shared by all ingest workers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Overwrite entries on re-add of the same id.</li>
 *   <li>Rank by descending cosine similarity, ties by insertion order.</li>
 *   <li>Persist the whole table on every mutating call.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations serialize mutations and persistence writes.</p>
 *
 * @since 0.1.0
 */
public interface EmbeddingStorePort {
  /**
   * Returns the fixed vector dimension of this store.
   *
   * @return dimension
   */
  int dimension();

  /**
   * Adds or overwrites an entry and persists the table.
   *
   * @param id entry identifier
   * @param vector embedding of length {@link #dimension()}
   * @param metadata string metadata
   * @throws IOException if persistence fails; the in-memory table is left unchanged
   * @throws IllegalArgumentException if the vector dimension does not match
   */
  void add(String id, float[] vector, Map<String, String> metadata) throws IOException;

  /**
   * Returns the best matches for the query vector.
   *
   * @param queryVector query embedding
   * @param topK maximum number of hits
   * @return hits ordered by descending score
   */
  default List<SearchHit> search(float[] queryVector, int topK) {
    return search(queryVector, topK, Map.of(), Double.NEGATIVE_INFINITY);
  }

  /**
   * Returns the best matches whose metadata contains every filter pair and whose score is at least
   * {@code minScore}.
   *
   * @param queryVector query embedding
   * @param topK maximum number of hits
   * @param filter metadata key/value pairs that must match exactly; empty for no filtering
   * @param minScore minimum score to include
   * @return hits ordered by descending score, ties by insertion order
   */
  List<SearchHit> search(float[] queryVector, int topK, Map<String, String> filter, double minScore);

  /**
   * Looks up an entry by id.
   *
   * @param id entry identifier
   * @return entry, or empty when absent
   */
  Optional<EmbeddingEntry> get(String id);

  /**
   * Deletes an entry and persists the table.
   *
   * @param id entry identifier
   * @return {@code true} when an entry was removed
   * @throws IOException if persistence fails
   */
  boolean delete(String id) throws IOException;

  /**
   * Removes every entry and persists the empty table.
   *
   * @throws IOException if persistence fails
   */
  void clear() throws IOException;

  /**
   * Returns the number of entries.
   *
   * @return entry count
   */
  int size();
}
