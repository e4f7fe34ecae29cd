package ca.gc.cra.medingest.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.medingest.application.llm.EntityResponseParser;
import ca.gc.cra.medingest.application.normalize.EntityNormalizer;
import ca.gc.cra.medingest.application.normalize.EntityStandardizer;
import ca.gc.cra.medingest.application.port.ClockPort;
import ca.gc.cra.medingest.application.port.EntityExtractionClient;
import ca.gc.cra.medingest.application.port.WorkspaceSyncPort;
import ca.gc.cra.medingest.config.IngestConfig;
import ca.gc.cra.medingest.domain.registry.ProcessingStatus;
import ca.gc.cra.medingest.domain.registry.RegistryEntry;
import ca.gc.cra.medingest.domain.run.ErrorKind;
import ca.gc.cra.medingest.domain.run.ProcessingStep;
import ca.gc.cra.medingest.domain.run.RunReport;
import ca.gc.cra.medingest.infrastructure.detect.DefaultExtractorSelector;
import ca.gc.cra.medingest.infrastructure.detect.FormatModule;
import ca.gc.cra.medingest.infrastructure.extract.FileMetadataReader;
import ca.gc.cra.medingest.infrastructure.extract.TextDecoder;
import ca.gc.cra.medingest.infrastructure.persistence.FileArtifactStore;
import ca.gc.cra.medingest.infrastructure.persistence.JsonFileRegistry;
import ca.gc.cra.medingest.infrastructure.vector.HashingEmbeddingModel;
import ca.gc.cra.medingest.infrastructure.vector.JsonFileEmbeddingStore;
import ca.gc.cra.medingest.testutil.DocumentFixtures;
import ca.gc.cra.medingest.testutil.RecordingMetricsPort;
import ca.gc.cra.medingest.util.PathUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IngestionUseCaseTest {
  private static final int DIMENSION = 32;
  private static final ClockPort FIXED = () -> Instant.parse("2024-06-01T08:00:00Z").toEpochMilli();
  private static final ClockPort NEXT_DAY = () -> Instant.parse("2024-06-02T08:00:00Z").toEpochMilli();

  @TempDir Path input;
  @TempDir Path output;

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void mixedBatchRecordsEveryOutcome() throws Exception {
    writeBatch();

    RunReport report = run(config(Map.of()));

    assertEquals(5, report.total());
    assertEquals(4, report.success());
    assertEquals(1, report.failed());
    assertEquals(0, report.skipped());
    Path failed = input.resolve("c_fax.pdf").toAbsolutePath().normalize();
    assertEquals(failed.toString(), report.failures().get(0).path());

    JsonFileRegistry registry = new JsonFileRegistry(config(Map.of()).registryFile());
    assertEquals(5, registry.snapshot().size());
    RegistryEntry entry = registry.lookup(failed.toString()).orElseThrow();
    assertEquals(ProcessingStatus.ERROR, entry.status());
    assertEquals(ProcessingStep.EXTRACT, entry.step());
    String held = PathUtils.artifactKey(failed.toString(), "c_fax.pdf") + ".pdf";
    assertTrue(Files.exists(output.resolve("errors").resolve(held)));
    assertTrue(Files.exists(input.resolve("c_fax.pdf")));
    try (var reports = Files.list(output.resolve("reports"))) {
      assertEquals(1, reports.count());
    }
    assertEquals(4, metrics.count("ingest.files.success"));
    assertEquals(1, metrics.count("ingest.files.failed"));
  }

  @Test
  void secondRunSkipsSuccessesAndRetriesFailures() throws Exception {
    writeBatch();
    run(config(Map.of()));
    int indexed = new JsonFileEmbeddingStore(output.resolve("vectordb"), DIMENSION, metrics).size();
    Map<String, RegistryEntry> successes = successes();

    IngestConfig config = config(Map.of());
    RunReport second = useCase(config, NEXT_DAY).run(config);

    assertEquals(4, second.skipped());
    assertEquals(1, second.total());
    assertEquals(1, second.failed());
    assertEquals(indexed, new JsonFileEmbeddingStore(output.resolve("vectordb"), DIMENSION, metrics).size());
    assertEquals(4, successes.size());
    assertEquals(successes, successes());
    String retried = input.resolve("c_fax.pdf").toAbsolutePath().normalize().toString();
    assertEquals(Instant.parse("2024-06-02T08:00:00Z"),
        new JsonFileRegistry(config.registryFile()).lookup(retried).orElseThrow().timestamp());
  }

  @Test
  void skipFailedLeavesPreviousErrorsAlone() throws Exception {
    writeBatch();
    run(config(Map.of()));

    RunReport second = run(config(Map.of("skipFailed", "true")));

    assertEquals(0, second.total());
    assertEquals(5, second.skipped());
  }

  @Test
  void unsupportedFilesAreRetriedOnlyOnRequest() throws Exception {
    Files.write(input.resolve("scan.bin"), new byte[] {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0});
    Map<String, String> binaries = Map.of("extensions", "bin");
    RunReport first = run(config(binaries));
    assertEquals(1, first.unsupported());

    assertEquals(1, run(config(binaries)).skipped());

    RunReport retried = run(config(Map.of("extensions", "bin", "retryUnsupported", "true")));
    assertEquals(1, retried.total());
    assertEquals(ErrorKind.UNSUPPORTED_FORMAT, retried.failures().get(0).errorKind());
  }

  @Test
  void dryRunWritesNothing() throws Exception {
    writeBatch();

    RunReport preview = run(config(Map.of("dryRun", "true")));

    assertEquals(0, preview.total());
    assertFalse(Files.exists(config(Map.of()).registryFile()));
    try (var reports = Files.list(output.resolve("reports"));
        var extracted = Files.list(output.resolve("extracted"))) {
      assertEquals(0, reports.count());
      assertEquals(0, extracted.count());
    }
  }

  @Test
  void discoveryIsSortedFilteredAndOptionallyRecursive() throws Exception {
    DocumentFixtures.writeText(input.resolve("b.txt"), "b");
    DocumentFixtures.writeText(input.resolve("a.md"), "# a");
    DocumentFixtures.writeText(input.resolve("notes.log"), "ignored");
    DocumentFixtures.writeText(input.resolve(".hidden"), "ignored");
    DocumentFixtures.writeText(input.resolve("nested").resolve("c.txt"), "c");
    IngestionUseCase useCase = useCase(config(Map.of()));

    List<Path> recursive = useCase.discover(config(Map.of()));
    List<Path> flat = useCase.discover(config(Map.of("recursive", "false")));

    Path root = input.toAbsolutePath().normalize();
    assertEquals(List.of(root.resolve("a.md"), root.resolve("b.txt"), root.resolve("nested").resolve("c.txt")),
        recursive);
    assertEquals(List.of(root.resolve("a.md"), root.resolve("b.txt")), flat);
  }

  @Test
  void missingInputDirectoryIsAnError() {
    IngestConfig config = config(Map.of("in", input.resolve("absent").toString()));

    assertThrows(IOException.class, () -> useCase(config).discover(config));
  }

  private void writeBatch() throws IOException {
    DocumentFixtures.writeText(input.resolve("a_note.txt"), "ASSESSMENT: hypertension.\nPLAN: recheck.\n");
    DocumentFixtures.writeText(input.resolve("b_summary.md"), "# Summary\nReports headache and nausea.\n");
    DocumentFixtures.writeCorruptPdf(input.resolve("c_fax.pdf"));
    DocumentFixtures.writeText(input.resolve("d_symptoms.csv"), "date,symptom,severity\n2024-01-02,fatigue,3\n");
    DocumentFixtures.writeText(input.resolve("e_letter.html"),
        "<html><body><h1>Referral</h1><p>Asthma since childhood.</p></body></html>");
  }

  private IngestConfig config(Map<String, String> overrides) {
    Map<String, String> options = new HashMap<>();
    options.put("in", input.toString());
    options.put("out", output.toString());
    options.put("workers", "2");
    options.put("embeddingDimension", Integer.toString(DIMENSION));
    options.putAll(overrides);
    return IngestConfig.fromMap(options);
  }

  private RunReport run(IngestConfig config) throws IOException, InterruptedException {
    return useCase(config).run(config);
  }

  private Map<String, RegistryEntry> successes() throws IOException {
    return new JsonFileRegistry(config(Map.of()).registryFile()).snapshot().entrySet().stream()
        .filter(entry -> entry.getValue().status() == ProcessingStatus.SUCCESS)
        .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
  }

  private IngestionUseCase useCase(IngestConfig config) throws IOException {
    return useCase(config, FIXED);
  }

  private IngestionUseCase useCase(IngestConfig config, ClockPort clock) throws IOException {
    FileArtifactStore artifacts = new FileArtifactStore(config.outputDirectory(), clock);
    DocumentProcessor processor = new DocumentProcessor(
        new DefaultExtractorSelector(FormatModule.standardModules(new FileMetadataReader(), new TextDecoder())),
        new EntityNormalizer(),
        EntityExtractionClient.DISABLED,
        new EntityResponseParser(new EntityStandardizer()),
        new HashingEmbeddingModel(DIMENSION),
        Optional.of(new JsonFileEmbeddingStore(config.effectiveVectorDirectory(), DIMENSION, metrics)),
        artifacts,
        WorkspaceSyncPort.NO_OP,
        metrics,
        clock);
    return new IngestionUseCase(processor, new JsonFileRegistry(config.registryFile()), artifacts, metrics, clock);
  }
}
