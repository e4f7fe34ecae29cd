package ca.gc.cra.medingest.application.pipeline;

import ca.gc.cra.medingest.application.llm.EntityResponseParser;
import ca.gc.cra.medingest.application.normalize.EntityNormalizer;
import ca.gc.cra.medingest.application.port.ArtifactStorePort;
import ca.gc.cra.medingest.application.port.ClockPort;
import ca.gc.cra.medingest.application.port.DocumentExtractor;
import ca.gc.cra.medingest.application.port.EmbeddingModel;
import ca.gc.cra.medingest.application.port.EmbeddingStorePort;
import ca.gc.cra.medingest.application.port.EntityExtractionClient;
import ca.gc.cra.medingest.application.port.ExtractorSelector;
import ca.gc.cra.medingest.application.port.MetricsPort;
import ca.gc.cra.medingest.application.port.WorkspaceSyncPort;
import ca.gc.cra.medingest.application.sync.WorkspaceRecordMapper;
import ca.gc.cra.medingest.application.sync.WorkspaceRecordMapper.WorkspaceRecord;
import ca.gc.cra.medingest.domain.document.ExtractedDocument;
import ca.gc.cra.medingest.domain.entity.EntityType;
import ca.gc.cra.medingest.domain.entity.MedicalEntity;
import ca.gc.cra.medingest.domain.entity.NormalizedRecord;
import ca.gc.cra.medingest.domain.run.ErrorKind;
import ca.gc.cra.medingest.domain.run.FileOutcome;
import ca.gc.cra.medingest.domain.run.ProcessingStep;
import ca.gc.cra.medingest.logging.Logs;
import ca.gc.cra.medingest.util.PathUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs one file through select, extract, normalize, embed and persist.
 * <p><strong>Why:</strong> Keeps the per-file state machine in one place so the use case only schedules files
 * and records outcomes.</p>
 * <p><strong>Role:</strong> Application service invoked from worker threads.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Map every step failure to a {@link FileOutcome} carrying the failing {@link ProcessingStep}.</li>
 *   <li>Merge entities from the free-text extractor when one is configured; its failures never fail the file.</li>
 *   <li>Index the document and its condition, medication and symptom entities.</li>
 *   <li>Remove the file's vectors and partial artifacts when embedding or persisting fails.</li>
 *   <li>Hand workspace records to the sync target; its failures never fail the file.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators, which must be thread-safe.
 * Never writes the processed-file registry.</p>
 * <p><strong>Observability:</strong> Emits {@code ingest.extract.latencyMillis} and
 * {@code ingest.extract.<format>}.</p>
 *
 * @since 0.1.0
 */
public final class DocumentProcessor {
  private static final Logger log = LoggerFactory.getLogger(DocumentProcessor.class);
  private static final String ENCODING_MARKER = "Encoding error";
  private static final int LOG_PREVIEW_BYTES = 256;
  private static final List<EntityType> INDEXED_TYPES =
      List.of(EntityType.CONDITION, EntityType.MEDICATION, EntityType.SYMPTOM);

  private final ExtractorSelector selector;
  private final EntityNormalizer normalizer;
  private final EntityExtractionClient entityClient;
  private final EntityResponseParser responseParser;
  private final EmbeddingModel embeddingModel;
  private final Optional<EmbeddingStorePort> embeddingStore;
  private final ArtifactStorePort artifacts;
  private final WorkspaceSyncPort sync;
  private final WorkspaceRecordMapper recordMapper = new WorkspaceRecordMapper();
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a processor.
   *
   * @param selector extractor selector
   * @param normalizer entity normalizer
   * @param entityClient free-text entity extractor, or {@link EntityExtractionClient#DISABLED}
   * @param responseParser parser for the entity extractor output
   * @param embeddingModel model used for document and entity vectors
   * @param embeddingStore store receiving vectors; empty disables indexing
   * @param artifacts per-file artifact store
   * @param sync workspace sync target, or {@link WorkspaceSyncPort#NO_OP}
   * @param metrics metrics sink
   * @param clock clock used for latency measurements
   */
  public DocumentProcessor(
      ExtractorSelector selector,
      EntityNormalizer normalizer,
      EntityExtractionClient entityClient,
      EntityResponseParser responseParser,
      EmbeddingModel embeddingModel,
      Optional<EmbeddingStorePort> embeddingStore,
      ArtifactStorePort artifacts,
      WorkspaceSyncPort sync,
      MetricsPort metrics,
      ClockPort clock) {
    this.selector = Objects.requireNonNull(selector, "selector");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    this.entityClient = Objects.requireNonNull(entityClient, "entityClient");
    this.responseParser = Objects.requireNonNull(responseParser, "responseParser");
    this.embeddingModel = Objects.requireNonNull(embeddingModel, "embeddingModel");
    this.embeddingStore = Objects.requireNonNull(embeddingStore, "embeddingStore");
    this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
    this.sync = Objects.requireNonNull(sync, "sync");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    embeddingStore.ifPresent(store -> {
      if (store.dimension() != embeddingModel.dimension()) {
        throw new IllegalArgumentException("embedding model dimension " + embeddingModel.dimension()
            + " does not match store dimension " + store.dimension());
      }
    });
  }

  /**
   * Processes one file end to end.
   *
   * @param file file to ingest
   * @return success with entity counts, or the failing step and error kind
   */
  public FileOutcome process(Path file) {
    Objects.requireNonNull(file, "file");
    String key = file.toAbsolutePath().normalize().toString();
    try {
      DocumentExtractor extractor = selector.select(file)
          .orElseThrow(() -> new IngestionException(
              ProcessingStep.SELECT, ErrorKind.UNSUPPORTED_FORMAT, "no extractor for " + file.getFileName()));
      ExtractedDocument document = extract(extractor, file);
      NormalizedRecord record = normalize(document);
      List<String> indexed = embed(key, record);
      persist(key, document, record, indexed);
      syncRecords(record);
      log.debug("Processed {} as {} ({} conditions)", file.getFileName(), record.documentType(),
          record.conditions().size());
      return FileOutcome.success(key, record.entityCounts());
    } catch (IngestionException ex) {
      log.warn("{} failed at {}: {}", file.getFileName(), ex.step(), ex.getMessage());
      return FileOutcome.failure(key, ex.step(), ex.kind(), ex.getMessage());
    }
  }

  private ExtractedDocument extract(DocumentExtractor extractor, Path file) {
    long started = clock.nowMillis();
    ExtractedDocument document;
    try {
      document = extractor.extract(file);
    } catch (RuntimeException ex) {
      throw new IngestionException(ProcessingStep.EXTRACT, ErrorKind.EXTRACTION_FAILURE,
          extractor.format().id() + " extractor failed: " + ex.getMessage(), ex);
    } finally {
      metrics.observe("ingest.extract.latencyMillis", clock.nowMillis() - started);
    }
    metrics.increment("ingest.extract." + extractor.format().id());
    if (document.isFailure()) {
      ErrorKind kind = document.content().contains(ENCODING_MARKER)
          ? ErrorKind.ENCODING_FAILURE
          : ErrorKind.EXTRACTION_FAILURE;
      throw new IngestionException(ProcessingStep.EXTRACT, kind, document.content().trim());
    }
    return document;
  }

  private NormalizedRecord normalize(ExtractedDocument document) {
    NormalizedRecord record;
    try {
      record = normalizer.normalize(document);
    } catch (RuntimeException ex) {
      throw new IngestionException(ProcessingStep.NORMALIZE, ErrorKind.INTERNAL,
          "normalization failed: " + ex.getMessage(), ex);
    }
    List<MedicalEntity> extra = freeTextEntities(record);
    return extra.isEmpty() ? record : EntityNormalizer.merge(record, extra);
  }

  private List<MedicalEntity> freeTextEntities(NormalizedRecord record) {
    String date = record.dates().isEmpty() ? null : record.dates().get(0);
    try {
      Optional<String> response = entityClient.extract(record.source().content(), date, record.documentType());
      return response.map(responseParser::parse).orElse(List.of());
    } catch (IOException | RuntimeException ex) {
      log.warn("Entity extractor unavailable for {}: {}", record.source().metadata().fileName(),
          Logs.truncate(String.valueOf(ex.getMessage()), LOG_PREVIEW_BYTES));
      return List.of();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Entity extractor interrupted for {}", record.source().metadata().fileName());
      return List.of();
    }
  }

  private List<String> embed(String key, NormalizedRecord record) {
    List<String> indexed = new ArrayList<>();
    if (embeddingStore.isEmpty()) {
      return indexed;
    }
    EmbeddingStorePort store = embeddingStore.get();
    String hash = PathUtils.sha1Hex(key);
    String fileName = record.source().metadata().fileName();
    try {
      Map<String, String> documentMetadata = new LinkedHashMap<>();
      documentMetadata.put("entity_type", "document");
      documentMetadata.put("source", fileName);
      documentMetadata.put("name", fileName);
      documentMetadata.put("document_type", record.documentType());
      String documentId = "doc:" + hash;
      store.add(documentId, embeddingModel.embed(record.source().content()), documentMetadata);
      indexed.add(documentId);

      for (EntityType type : INDEXED_TYPES) {
        List<MedicalEntity> entities = record.entities(type);
        for (int i = 0; i < entities.size(); i++) {
          MedicalEntity entity = entities.get(i);
          Map<String, String> metadata = new LinkedHashMap<>();
          metadata.put("entity_type", type.singular());
          metadata.put("source", fileName);
          metadata.put("name", entity.standardName());
          String entityId = type.singular() + ":" + hash + ":" + i;
          store.add(entityId, embeddingModel.embed(entity.standardName()), metadata);
          indexed.add(entityId);
        }
      }
    } catch (IOException ex) {
      IngestionException failure = new IngestionException(ProcessingStep.EMBED, ErrorKind.EMBEDDING_STORE_IO,
          "embedding store write failed: " + ex.getMessage(), ex);
      unindex(indexed, failure);
      throw failure;
    }
    return indexed;
  }

  private void unindex(List<String> ids, IngestionException failure) {
    if (ids.isEmpty() || embeddingStore.isEmpty()) {
      return;
    }
    EmbeddingStorePort store = embeddingStore.get();
    for (String id : ids) {
      try {
        store.delete(id);
      } catch (IOException ex) {
        failure.addSuppressed(ex);
      }
    }
    log.debug("Removed {} vectors after failure at {}", ids.size(), failure.step());
  }

  private void persist(String key, ExtractedDocument document, NormalizedRecord record, List<String> indexed) {
    try {
      artifacts.writeExtracted(document);
      artifacts.writeNormalized(record);
    } catch (IOException ex) {
      IngestionException failure = new IngestionException(ProcessingStep.PERSIST, ErrorKind.PERSISTENCE_IO,
          "artifact write failed: " + ex.getMessage(), ex);
      try {
        artifacts.discard(key);
      } catch (IOException cleanup) {
        failure.addSuppressed(cleanup);
      }
      unindex(indexed, failure);
      throw failure;
    }
  }

  private void syncRecords(NormalizedRecord record) {
    try {
      for (WorkspaceRecord workspaceRecord : recordMapper.map(record)) {
        sync.push(workspaceRecord.entityType(), workspaceRecord.properties());
      }
    } catch (IOException | RuntimeException ex) {
      log.warn("Workspace sync failed for {}: {}", record.source().metadata().fileName(), ex.getMessage());
    }
  }
}
