package ca.gc.cra.medingest.config;

import ca.gc.cra.medingest.domain.entity.EntityType;
import ca.gc.cra.medingest.validation.Numbers;
import ca.gc.cra.medingest.validation.Strings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Configuration for a similarity search against an existing embedding store.
 *
 * @param vectorDirectory store directory holding {@code vectors.json} and {@code metadata.json}
 * @param query free text to embed and search for
 * @param topK maximum number of hits
 * @param entityType optional {@code entity_type} metadata filter ({@code document} or an entity type)
 * @param threshold optional minimum cosine score
 * @param embeddingDimension dimension the store was built with
 * @since 0.1.0
 */
public record SearchConfig(
    Path vectorDirectory,
    String query,
    int topK,
    Optional<String> entityType,
    OptionalDouble threshold,
    int embeddingDimension) {

  /** Metadata {@code entity_type} of whole-document entries. */
  public static final String DOCUMENT_TYPE = "document";

  public SearchConfig {
    vectorDirectory = IngestConfig.normalizePath("vectorDir", vectorDirectory);
    query = Strings.requireNonBlank("query", query);
    Numbers.requireRange("topK", topK, 1, 10_000);
    entityType = Objects.requireNonNullElse(entityType, Optional.empty());
    threshold = Objects.requireNonNullElse(threshold, OptionalDouble.empty());
    Numbers.requireRange(
        "embeddingDimension", embeddingDimension, IngestConfig.MIN_DIMENSION, IngestConfig.MAX_DIMENSION);
  }

  /**
   * Builds a configuration from flat key/value options.
   *
   * @param options merged options such as {@code vectorDir}, {@code query}, {@code topK}
   * @return validated configuration
   * @throws IllegalArgumentException when {@code query} is missing or a value is invalid
   */
  public static SearchConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String query = IngestConfig.firstNonBlank(options, "query", "q");
    if (query == null) {
      throw new IllegalArgumentException("query is required");
    }
    String vectorRaw = IngestConfig.firstNonBlank(options, "vectorDir");
    Path vectorDir = vectorRaw == null
        ? IngestConfig.defaultBaseDirectory().resolve("processed_data").resolve("vectordb")
        : IngestConfig.parsePath("vectorDir", vectorRaw);

    String topKRaw = IngestConfig.firstNonBlank(options, "topK");
    int topK = topKRaw == null ? 5 : Numbers.parseInt("topK", topKRaw, 1, 10_000);

    String typeRaw = IngestConfig.firstNonBlank(options, "type");
    Optional<String> type = Optional.empty();
    if (typeRaw != null) {
      type = Optional.of(typeRaw.equalsIgnoreCase(DOCUMENT_TYPE)
          ? DOCUMENT_TYPE
          : EntityType.fromKey(typeRaw)
              .map(EntityType::singular)
              .orElseThrow(() -> new IllegalArgumentException("type is not a known entity type: " + typeRaw)));
    }

    String thresholdRaw = IngestConfig.firstNonBlank(options, "threshold");
    OptionalDouble threshold = thresholdRaw == null
        ? OptionalDouble.empty()
        : OptionalDouble.of(Numbers.parseDouble("threshold", thresholdRaw, -1.0, 1.0));

    String dimensionRaw = IngestConfig.firstNonBlank(options, "embeddingDimension");
    int dimension = dimensionRaw == null
        ? IngestConfig.DEFAULT_DIMENSION
        : Numbers.parseInt(
            "embeddingDimension", dimensionRaw, IngestConfig.MIN_DIMENSION, IngestConfig.MAX_DIMENSION);

    return new SearchConfig(vectorDir, query, topK, type, threshold, dimension);
  }

  /**
   * Returns the metadata filter applied to hits.
   *
   * @return {@code entity_type} filter, or an empty map
   */
  public Map<String, String> filter() {
    return entityType.map(type -> Map.of("entity_type", type)).orElse(Map.<String, String>of());
  }
}
