package ca.gc.cra.medingest.config;

import ca.gc.cra.medingest.application.llm.EntityResponseParser;
import ca.gc.cra.medingest.application.normalize.EntityNormalizer;
import ca.gc.cra.medingest.application.normalize.EntityStandardizer;
import ca.gc.cra.medingest.application.pipeline.DocumentProcessor;
import ca.gc.cra.medingest.application.pipeline.IngestionUseCase;
import ca.gc.cra.medingest.application.pipeline.SearchUseCase;
import ca.gc.cra.medingest.application.port.ClockPort;
import ca.gc.cra.medingest.application.port.EmbeddingModel;
import ca.gc.cra.medingest.application.port.EmbeddingStorePort;
import ca.gc.cra.medingest.application.port.EntityExtractionClient;
import ca.gc.cra.medingest.application.port.ExtractorSelector;
import ca.gc.cra.medingest.application.port.MetricsPort;
import ca.gc.cra.medingest.application.port.WorkspaceSyncPort;
import ca.gc.cra.medingest.infrastructure.detect.DefaultExtractorSelector;
import ca.gc.cra.medingest.infrastructure.detect.FormatModule;
import ca.gc.cra.medingest.infrastructure.extract.FileMetadataReader;
import ca.gc.cra.medingest.infrastructure.extract.TextDecoder;
import ca.gc.cra.medingest.infrastructure.llm.HttpEntityExtractionClient;
import ca.gc.cra.medingest.infrastructure.persistence.FileArtifactStore;
import ca.gc.cra.medingest.infrastructure.persistence.JsonFileRegistry;
import ca.gc.cra.medingest.infrastructure.sync.NdjsonWorkspaceSyncAdapter;
import ca.gc.cra.medingest.infrastructure.vector.HashingEmbeddingModel;
import ca.gc.cra.medingest.infrastructure.vector.JsonFileEmbeddingStore;
import ca.gc.cra.medingest.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Wires ports to adapters for the ingest and search commands.
 * <p><strong>Role:</strong> Composition root; the only place that instantiates infrastructure classes.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Prepare the processed-data root and fail fast when it is not writable.</li>
 *   <li>Open the registry, artifact store and embedding store.</li>
 *   <li>Select the free-text entity extractor and workspace sync target from configuration.</li>
 *   <li>Close opened resources on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Build use cases from a single thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Deque<AutoCloseable> resources = new ArrayDeque<>();

  public CompositionRoot(MetricsPort metrics) {
    this(metrics, ClockPort.SYSTEM);
  }

  public CompositionRoot(MetricsPort metrics, ClockPort clock) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public ExtractorSelector extractorSelector() {
    return new DefaultExtractorSelector(
        FormatModule.standardModules(new FileMetadataReader(), new TextDecoder()));
  }

  public EmbeddingModel embeddingModel(int dimension) {
    return new HashingEmbeddingModel(dimension);
  }

  /**
   * Builds the ingestion use case for one run.
   *
   * @param config ingest configuration
   * @return ready use case
   * @throws IOException when the registry, artifact directories or embedding store cannot be opened
   * @throws IllegalArgumentException when the input or output directory is unusable
   */
  public IngestionUseCase ingestionUseCase(IngestConfig config) throws IOException {
    Objects.requireNonNull(config, "config");
    Paths.requireReadableDir("in", config.inputDirectory());
    Paths.requireWritableDir("out", config.outputDirectory());

    JsonFileRegistry registry = new JsonFileRegistry(config.registryFile());
    FileArtifactStore artifacts = new FileArtifactStore(config.outputDirectory(), clock);
    EmbeddingModel model = embeddingModel(config.embeddingDimension());
    Optional<EmbeddingStorePort> store = Optional.empty();
    if (config.embed() && !config.dryRun()) {
      store = Optional.of(new JsonFileEmbeddingStore(
          Files.createDirectories(config.effectiveVectorDirectory()), config.embeddingDimension(), metrics));
    }

    DocumentProcessor processor = new DocumentProcessor(
        extractorSelector(),
        new EntityNormalizer(),
        entityClient(config),
        new EntityResponseParser(new EntityStandardizer()),
        model,
        store,
        artifacts,
        workspaceSync(config),
        metrics,
        clock);
    return new IngestionUseCase(processor, registry, artifacts, metrics, clock);
  }

  /**
   * Builds the search use case over an existing store.
   *
   * @param config search configuration
   * @return ready use case
   * @throws IOException when the store cannot be loaded
   * @throws IllegalArgumentException when the store directory does not exist
   */
  public SearchUseCase searchUseCase(SearchConfig config) throws IOException {
    Objects.requireNonNull(config, "config");
    Paths.requireReadableDir("vectorDir", config.vectorDirectory());
    EmbeddingStorePort store =
        new JsonFileEmbeddingStore(config.vectorDirectory(), config.embeddingDimension(), metrics);
    return new SearchUseCase(embeddingModel(config.embeddingDimension()), store);
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ClockPort clock() {
    return clock;
  }

  private EntityExtractionClient entityClient(IngestConfig config) {
    return config.llmEndpoint()
        .<EntityExtractionClient>map(uri ->
            new HttpEntityExtractionClient(uri, Duration.ofSeconds(config.llmTimeoutSeconds())))
        .orElse(EntityExtractionClient.DISABLED);
  }

  private WorkspaceSyncPort workspaceSync(IngestConfig config) throws IOException {
    if (config.syncOutput().isEmpty() || config.dryRun()) {
      return WorkspaceSyncPort.NO_OP;
    }
    NdjsonWorkspaceSyncAdapter adapter = new NdjsonWorkspaceSyncAdapter(config.syncOutput().get());
    resources.push(adapter);
    return adapter;
  }

  /**
   * Closes resources opened by this root, most recent first.
   *
   * @throws Exception the first close failure, with later ones suppressed
   */
  @Override
  public void close() throws Exception {
    Exception failure = null;
    while (!resources.isEmpty()) {
      try {
        resources.pop().close();
      } catch (Exception ex) {
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }
}
