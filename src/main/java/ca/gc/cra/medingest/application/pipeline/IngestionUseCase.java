package ca.gc.cra.medingest.application.pipeline;

import ca.gc.cra.medingest.application.port.ArtifactStorePort;
import ca.gc.cra.medingest.application.port.ClockPort;
import ca.gc.cra.medingest.application.port.MetricsPort;
import ca.gc.cra.medingest.application.port.ProcessedFileRegistry;
import ca.gc.cra.medingest.config.IngestConfig;
import ca.gc.cra.medingest.domain.registry.RegistryEntry;
import ca.gc.cra.medingest.domain.run.ErrorKind;
import ca.gc.cra.medingest.domain.run.FileOutcome;
import ca.gc.cra.medingest.domain.run.RunReport;
import ca.gc.cra.medingest.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Ingests a directory of medical documents and produces a run report.
 * <p><strong>Why:</strong> Coordinates discovery, the retry policy, the worker pool and the processed-file
 * registry so that re-running over unchanged input is a no-op for files that already succeeded.</p>
 * <p><strong>Role:</strong> Application use case behind the {@code ingest} CLI.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Discover candidate files in sorted order, optionally walking sub-directories.</li>
 *   <li>Skip files the registry records as successful; retry failures unless {@code skipFailed} is set.</li>
 *   <li>Process each file end to end on one worker thread with the file name in MDC key {@code file}.</li>
 *   <li>Record every outcome in the registry from the coordinating thread only.</li>
 *   <li>Copy failed files into the error holding area and write the run report.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Create one instance per run; {@link #run(IngestConfig)} is not reentrant.</p>
 * <p><strong>Observability:</strong> Emits {@code ingest.files.discovered}, {@code ingest.files.skipped},
 * {@code ingest.files.success} and {@code ingest.files.failed}.</p>
 *
 * @since 0.1.0
 */
public final class IngestionUseCase {
  private static final Logger log = LoggerFactory.getLogger(IngestionUseCase.class);
  static final String MDC_FILE = "file";

  private final DocumentProcessor processor;
  private final ProcessedFileRegistry registry;
  private final ArtifactStorePort artifacts;
  private final MetricsPort metrics;
  private final ClockPort clock;

  public IngestionUseCase(
      DocumentProcessor processor,
      ProcessedFileRegistry registry,
      ArtifactStorePort artifacts,
      MetricsPort metrics,
      ClockPort clock) {
    this.processor = Objects.requireNonNull(processor, "processor");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Runs one ingestion batch.
   *
   * @param config validated ingest configuration
   * @return run report; also written under {@code reports/} unless {@code dryRun} is set
   * @throws IOException when the input cannot be listed or the registry or report cannot be written
   * @throws InterruptedException when the coordinating thread is interrupted while waiting for workers
   */
  public RunReport run(IngestConfig config) throws IOException, InterruptedException {
    Objects.requireNonNull(config, "config");
    List<Path> discovered = discover(config);
    metrics.observe("ingest.files.discovered", discovered.size());
    log.info("Discovered {} candidate files under {}", discovered.size(), config.inputDirectory());

    RunReport.Builder report = RunReport.builder();
    List<Path> pending = new ArrayList<>();
    for (Path file : discovered) {
      if (shouldSkip(file, config)) {
        report.skip();
        metrics.increment("ingest.files.skipped");
      } else {
        pending.add(file);
      }
    }

    if (config.dryRun()) {
      pending.forEach(file -> log.info("Dry run: would ingest {}", file));
      RunReport preview = report.build(clock.now());
      log.info("Dry run complete: {} to ingest, {} skipped", pending.size(), preview.skipped());
      return preview;
    }

    if (!pending.isEmpty()) {
      List<FileOutcome> outcomes = processAll(pending, config.workers());
      for (FileOutcome outcome : outcomes) {
        record(outcome);
        report.add(outcome);
      }
    }

    RunReport result = report.build(clock.now());
    Path written = artifacts.writeReport(result);
    log.info("Ingestion complete: total={} success={} failed={} skipped={} report={}",
        result.total(), result.success(), result.failed(), result.skipped(), written);
    return result;
  }

  List<Path> discover(IngestConfig config) throws IOException {
    Path root = config.inputDirectory();
    if (!Files.isDirectory(root)) {
      throw new IOException("input directory does not exist: " + root);
    }
    int depth = config.recursive() ? Integer.MAX_VALUE : 1;
    try (Stream<Path> walk = Files.walk(root, depth)) {
      return walk
          .filter(Files::isRegularFile)
          .filter(path -> config.accepts(path.getFileName().toString()))
          .map(path -> path.toAbsolutePath().normalize())
          .sorted()
          .collect(Collectors.toList());
    } catch (UncheckedIOException ex) {
      throw ex.getCause();
    }
  }

  private boolean shouldSkip(Path file, IngestConfig config) {
    Optional<RegistryEntry> previous = registry.lookup(file.toString());
    if (previous.isEmpty()) {
      return false;
    }
    RegistryEntry entry = previous.get();
    if (entry.isSuccess()) {
      log.debug("Skipping {}; already processed at {}", file.getFileName(), entry.timestamp());
      return true;
    }
    if (entry.errorKind() == ErrorKind.UNSUPPORTED_FORMAT) {
      return !config.retryUnsupported();
    }
    if (config.skipFailed()) {
      log.debug("Skipping previously failed {}", file.getFileName());
      return true;
    }
    log.info("Retrying previously failed {} ({})", file.getFileName(), entry.error().orElse("unknown error"));
    return false;
  }

  private List<FileOutcome> processAll(List<Path> files, int workers) throws InterruptedException {
    List<Callable<FileOutcome>> tasks = new ArrayList<>(files.size());
    for (Path file : files) {
      tasks.add(() -> processWithContext(file));
    }
    int poolSize = Math.min(workers, files.size());
    ExecutorService executor = ExecutorFactories.newWorkerPool(poolSize, "medingest-worker",
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
    try {
      List<Future<FileOutcome>> futures = executor.invokeAll(tasks);
      List<FileOutcome> outcomes = new ArrayList<>(futures.size());
      for (int i = 0; i < futures.size(); i++) {
        outcomes.add(outcomeOf(futures.get(i), files.get(i)));
      }
      return outcomes;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Ingestion interrupted; requesting worker shutdown");
      executor.shutdownNow();
      throw ex;
    } finally {
      executor.shutdown();
    }
  }

  private FileOutcome processWithContext(Path file) {
    String previous = MDC.get(MDC_FILE);
    try {
      MDC.put(MDC_FILE, file.getFileName().toString());
      log.debug("Ingest started");
      FileOutcome outcome = processor.process(file);
      log.debug("Ingest finished with status {}", outcome.status());
      return outcome;
    } finally {
      if (previous == null) {
        MDC.remove(MDC_FILE);
      } else {
        MDC.put(MDC_FILE, previous);
      }
    }
  }

  private FileOutcome outcomeOf(Future<FileOutcome> future, Path file) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      log.error("Worker failed on {}", file, cause);
      return FileOutcome.failure(file.toString(), null, ErrorKind.INTERNAL, String.valueOf(cause.getMessage()));
    }
  }

  private void record(FileOutcome outcome) throws IOException {
    if (outcome.isSuccess()) {
      metrics.increment("ingest.files.success");
      registry.record(RegistryEntry.success(outcome.path(), clock.now()));
      return;
    }
    metrics.increment("ingest.files.failed");
    registry.record(RegistryEntry.error(
        outcome.path(), clock.now(), outcome.step(), outcome.errorKind(), outcome.message()));
    try {
      artifacts.holdFailed(Path.of(outcome.path()), outcome);
    } catch (IOException ex) {
      log.warn("Could not copy failed file {} to the error area: {}", outcome.path(), ex.getMessage());
    }
  }
}
