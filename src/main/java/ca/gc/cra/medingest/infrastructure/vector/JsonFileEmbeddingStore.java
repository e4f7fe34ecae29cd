package ca.gc.cra.medingest.infrastructure.vector;

import ca.gc.cra.medingest.application.json.JsonSupport;
import ca.gc.cra.medingest.application.json.JsonWriter;
import ca.gc.cra.medingest.application.port.EmbeddingStorePort;
import ca.gc.cra.medingest.application.port.MetricsPort;
import ca.gc.cra.medingest.domain.vector.EmbeddingEntry;
import ca.gc.cra.medingest.domain.vector.SearchHit;
import ca.gc.cra.medingest.infrastructure.persistence.AtomicFiles;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Brute-force cosine-similarity store persisted as two JSON files.
 * <p><strong>Why:</strong> Personal-scale corpora fit in memory; a linear scan keeps ranking exact and
 * deterministic.</p>
 * <p><strong>Role:</strong> Adapter implementing {@link EmbeddingStorePort}.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Load {@value #VECTORS_FILE} and {@value #METADATA_FILE} on construction.</li>
 *   <li>Rewrite both files on every mutation; a failed write leaves the previous files and in-memory state.</li>
 *   <li>Rank by descending cosine similarity, ties in insertion order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All operations hold a single lock, so persistence writes are
 * serialized.</p>
 * <p><strong>Performance:</strong> Search is O(n&middot;D); each mutation rewrites the full table.</p>
 * <p><strong>Observability:</strong> Emits {@code vector.add} and {@code vector.search} counters.</p>
 *
 * @since 0.1.0
 */
public final class JsonFileEmbeddingStore implements EmbeddingStorePort {
  private static final Logger log = LoggerFactory.getLogger(JsonFileEmbeddingStore.class);

  /** Vector table file name. */
  public static final String VECTORS_FILE = "vectors.json";
  /** Metadata table file name. */
  public static final String METADATA_FILE = "metadata.json";

  private final Path directory;
  private final int dimension;
  private final MetricsPort metrics;
  private final JsonWriter vectorWriter = new JsonWriter(false);
  private final JsonWriter metadataWriter = new JsonWriter(true);
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, EmbeddingEntry> entries = new LinkedHashMap<>();

  /**
   * Opens or creates a store.
   *
   * @param directory store directory
   * @param dimension vector dimensionality for this store
   * @param metrics metrics sink
   * @throws IOException when existing files cannot be read
   * @throws IllegalStateException when stored vectors have a different dimension
   */
  public JsonFileEmbeddingStore(Path directory, int dimension, MetricsPort metrics) throws IOException {
    this.directory = Objects.requireNonNull(directory, "directory");
    if (dimension <= 0) {
      throw new IllegalArgumentException("dimension must be positive");
    }
    this.dimension = dimension;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Files.createDirectories(directory);
    load();
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public void add(String id, float[] vector, Map<String, String> metadata) throws IOException {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(vector, "vector");
    checkDimension(vector, "vector");
    EmbeddingEntry entry = new EmbeddingEntry(id, vector, metadata);
    lock.lock();
    try {
      EmbeddingEntry previous = entries.put(id, entry);
      try {
        persist();
      } catch (IOException ex) {
        if (previous == null) {
          entries.remove(id);
        } else {
          entries.put(id, previous);
        }
        throw ex;
      }
    } finally {
      lock.unlock();
    }
    metrics.increment("vector.add");
  }

  @Override
  public List<SearchHit> search(
      float[] queryVector, int topK, Map<String, String> filter, double minScore) {
    Objects.requireNonNull(queryVector, "queryVector");
    checkDimension(queryVector, "query vector");
    metrics.increment("vector.search");
    if (topK <= 0) {
      return List.of();
    }
    Map<String, String> criteria = filter == null ? Map.of() : filter;
    List<SearchHit> hits = new ArrayList<>();
    lock.lock();
    try {
      for (EmbeddingEntry entry : entries.values()) {
        if (!matches(entry.metadata(), criteria)) {
          continue;
        }
        double score = cosine(queryVector, entry.vector());
        if (score >= minScore) {
          hits.add(new SearchHit(entry.id(), score, entry.metadata()));
        }
      }
    } finally {
      lock.unlock();
    }
    // List.sort is stable: equal scores keep insertion order.
    hits.sort(Comparator.comparingDouble(SearchHit::score).reversed());
    return hits.size() > topK ? List.copyOf(hits.subList(0, topK)) : List.copyOf(hits);
  }

  @Override
  public Optional<EmbeddingEntry> get(String id) {
    lock.lock();
    try {
      return Optional.ofNullable(entries.get(id));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean delete(String id) throws IOException {
    lock.lock();
    try {
      Map<String, EmbeddingEntry> before = new LinkedHashMap<>(entries);
      if (entries.remove(id) == null) {
        return false;
      }
      restoreOnFailure(before);
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void clear() throws IOException {
    lock.lock();
    try {
      Map<String, EmbeddingEntry> before = new LinkedHashMap<>(entries);
      entries.clear();
      restoreOnFailure(before);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Computes cosine similarity; a zero-norm operand yields {@code 0.0}.
   *
   * @param a first vector
   * @param b second vector of the same length
   * @return similarity in {@code [-1, 1]}
   */
  static double cosine(float[] a, float[] b) {
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0 || normB == 0) {
      return 0.0;
    }
    double score = dot / (Math.sqrt(normA) * Math.sqrt(normB));
    return Math.max(-1.0, Math.min(1.0, score));
  }

  private static boolean matches(Map<String, String> metadata, Map<String, String> filter) {
    for (Map.Entry<String, String> criterion : filter.entrySet()) {
      if (!Objects.equals(metadata.get(criterion.getKey()), criterion.getValue())) {
        return false;
      }
    }
    return true;
  }

  private void checkDimension(float[] vector, String label) {
    if (vector.length != dimension) {
      throw new IllegalArgumentException(
          label + " has dimension " + vector.length + " but store dimension is " + dimension);
    }
  }

  private void restoreOnFailure(Map<String, EmbeddingEntry> before) throws IOException {
    try {
      persist();
    } catch (IOException ex) {
      entries.clear();
      entries.putAll(before);
      throw ex;
    }
  }

  private void persist() throws IOException {
    Map<String, Object> vectors = new LinkedHashMap<>();
    Map<String, Object> metadata = new LinkedHashMap<>();
    for (EmbeddingEntry entry : entries.values()) {
      vectors.put(entry.id(), entry.vector());
      metadata.put(entry.id(), entry.metadata());
    }
    Path vectorsFile = directory.resolve(VECTORS_FILE);
    Path metadataFile = directory.resolve(METADATA_FILE);
    Path stagedVectors = AtomicFiles.stage(vectorsFile, vectors, vectorWriter);
    Path stagedMetadata;
    byte[] previousMetadata;
    try {
      stagedMetadata = AtomicFiles.stage(metadataFile, metadata, metadataWriter);
      previousMetadata = Files.exists(metadataFile) ? Files.readAllBytes(metadataFile) : null;
    } catch (IOException ex) {
      abandon(stagedVectors, ex);
      throw ex;
    }
    // Vectors drive loading, so they are committed last: until then the old table is authoritative.
    try {
      AtomicFiles.commit(stagedMetadata, metadataFile);
    } catch (IOException ex) {
      abandon(stagedVectors, ex);
      throw ex;
    }
    try {
      AtomicFiles.commit(stagedVectors, vectorsFile);
    } catch (IOException ex) {
      restoreMetadata(metadataFile, previousMetadata, ex);
      throw ex;
    }
  }

  private static void abandon(Path staged, IOException failure) {
    try {
      AtomicFiles.abandon(staged);
    } catch (IOException cleanup) {
      failure.addSuppressed(cleanup);
    }
  }

  private static void restoreMetadata(Path metadataFile, byte[] previous, IOException failure) {
    try {
      if (previous == null) {
        Files.deleteIfExists(metadataFile);
      } else {
        Files.write(metadataFile, previous);
      }
    } catch (IOException restore) {
      log.error("Could not restore {} after failed vector write", metadataFile, restore);
      failure.addSuppressed(restore);
    }
  }

  private void load() throws IOException {
    Map<String, Object> vectors = readObject(directory.resolve(VECTORS_FILE));
    Map<String, Object> metadata = readObject(directory.resolve(METADATA_FILE));
    for (Map.Entry<String, Object> stored : vectors.entrySet()) {
      if (!(stored.getValue() instanceof List<?> values)) {
        throw new IOException("Vector for " + stored.getKey() + " is not an array");
      }
      if (values.size() != dimension) {
        throw new IllegalStateException("Stored vector " + stored.getKey() + " has dimension "
            + values.size() + " but store dimension is " + dimension);
      }
      float[] vector = new float[values.size()];
      for (int i = 0; i < vector.length; i++) {
        vector[i] = ((Number) values.get(i)).floatValue();
      }
      Map<String, String> meta = strings(metadata.get(stored.getKey()));
      entries.put(stored.getKey(), new EmbeddingEntry(stored.getKey(), vector, meta));
    }
    if (!entries.isEmpty()) {
      log.info("Loaded {} embeddings from {}", entries.size(), directory);
    }
  }

  private static Map<String, Object> readObject(Path file) throws IOException {
    if (!Files.exists(file)) {
      return Map.of();
    }
    Object parsed;
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      parsed = new JsonSupport().parse(reader);
    } catch (IllegalArgumentException ex) {
      throw new IOException("Corrupt store file " + file, ex);
    }
    if (!(parsed instanceof Map<?, ?> map)) {
      throw new IOException("Store file " + file + " is not a JSON object");
    }
    Map<String, Object> result = new LinkedHashMap<>();
    map.forEach((key, value) -> result.put(String.valueOf(key), value));
    return result;
  }

  private static Map<String, String> strings(Object raw) {
    Map<String, String> values = new LinkedHashMap<>();
    if (raw instanceof Map<?, ?> map) {
      map.forEach((key, value) -> {
        if (value != null) {
          values.put(String.valueOf(key), String.valueOf(value));
        }
      });
    }
    return values;
  }
}
