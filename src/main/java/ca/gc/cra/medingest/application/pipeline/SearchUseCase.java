package ca.gc.cra.medingest.application.pipeline;

import ca.gc.cra.medingest.application.port.EmbeddingModel;
import ca.gc.cra.medingest.application.port.EmbeddingStorePort;
import ca.gc.cra.medingest.config.SearchConfig;
import ca.gc.cra.medingest.domain.vector.SearchHit;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embeds a free-text query and ranks stored documents and entities by cosine similarity.
 *
 * @since 0.1.0
 */
public final class SearchUseCase {
  private static final Logger log = LoggerFactory.getLogger(SearchUseCase.class);

  private final EmbeddingModel model;
  private final EmbeddingStorePort store;

  public SearchUseCase(EmbeddingModel model, EmbeddingStorePort store) {
    this.model = Objects.requireNonNull(model, "model");
    this.store = Objects.requireNonNull(store, "store");
    if (model.dimension() != store.dimension()) {
      throw new IllegalArgumentException("embedding model dimension " + model.dimension()
          + " does not match store dimension " + store.dimension());
    }
  }

  /**
   * Runs one search.
   *
   * @param config search configuration
   * @return hits ordered by descending score
   */
  public List<SearchHit> search(SearchConfig config) {
    Objects.requireNonNull(config, "config");
    double minScore = config.threshold().orElse(Double.NEGATIVE_INFINITY);
    List<SearchHit> hits = store.search(model.embed(config.query()), config.topK(), config.filter(), minScore);
    log.debug("Query matched {} of {} entries", hits.size(), store.size());
    return hits;
  }
}
