package ca.gc.cra.medingest.api;

import ca.gc.cra.medingest.application.pipeline.IngestionUseCase;
import ca.gc.cra.medingest.config.CompositionRoot;
import ca.gc.cra.medingest.config.IngestConfig;
import ca.gc.cra.medingest.domain.entity.EntityType;
import ca.gc.cra.medingest.domain.run.FileOutcome;
import ca.gc.cra.medingest.domain.run.RunReport;
import ca.gc.cra.medingest.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.medingest.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code ingest} command: extracts, normalizes and indexes every recognized document under a directory.
 */
public final class IngestCli {
  private static final Logger log = LoggerFactory.getLogger(IngestCli.class);
  static final Set<String> KEYS = Set.of(
      "in", "out", "vectorDir", "recursive", "extensions", "workers", "embed", "llmEndpoint",
      "llmTimeoutSeconds", "syncOut", "failOnErrors", "dryRun", "skipFailed", "retryUnsupported");
  static final Set<String> FLAGS = Set.of(
      "--dry-run", "--skip-failed", "--retry-unsupported", "--fail-on-errors", "--no-embed", "--no-recursive");
  private static final String SUMMARY_USAGE =
      "usage: ingest in=DIR [out=DIR] [vectorDir=DIR] [workers=N] [extensions=.txt,.pdf,...] "
          + "[llmEndpoint=URL] [syncOut=FILE] [config=FILE] [--dry-run] [--skip-failed] "
          + "[--retry-unsupported] [--fail-on-errors] [--no-embed] [--no-recursive]";
  private static final String HELP_TEXT = """
      medingest ingest

      Usage:
        ingest in=./records [out=~/.medingest/processed_data] [options]

      Required:
        in=DIR                     Directory containing medical documents

      Optional:
        out=DIR                    Processed-data root (extracted, processed, errors, reports, file_registry)
        vectorDir=DIR              Embedding store directory (default <out>/vectordb)
        extensions=LIST            Comma-separated extensions (default .txt,.csv,.md,.html,.htm,.rtf,.docx,.doc,.pdf)
        workers=N                  Worker threads, 1-256 (default: available processors)
        embeddingDimension=N       Hashing embedding dimension, 8-4096 (default 256)
        llmEndpoint=URL            Free-text entity extractor endpoint (default disabled)
        llmTimeoutSeconds=N        Entity extractor timeout (default 30)
        syncOut=FILE               Append workspace records as NDJSON (default disabled)
        config=FILE                YAML file with common/ingest sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP endpoint when metricsExporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --dry-run                  List the files that would be ingested; write nothing
        --skip-failed              Do not retry files recorded as failed
        --retry-unsupported        Retry files recorded as unsupported format
        --fail-on-errors           Exit 5 when any file fails
        --no-embed                 Skip the embedding store
        --no-recursive             Do not walk sub-directories
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private IngestCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for ingest CLI");
    }

    IngestConfig config;
    Map<String, String> effective;
    try {
      effective = ConfigCliUtils.effectiveConfig("ingest", input, KEYS, FLAGS, log::warn);
      TelemetryConfigurator.configureMetrics(effective);
      config = IngestConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid ingest arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
        CompositionRoot root = new CompositionRoot(metrics)) {
      log.info("Configured ingest: in={}, out={}, workers={}, embed={}, metricsExporter={}",
          config.inputDirectory(), config.outputDirectory(), config.workers(), config.embed(),
          effective.getOrDefault("metricsExporter", "none"));
      IngestionUseCase useCase = root.ingestionUseCase(config);
      RunReport report = useCase.run(config);
      CliPrinter.printLines(summary(report, config.dryRun()));
      metrics.flush();
      if (config.failOnErrors() && report.failed() > 0) {
        log.error("{} file(s) failed and failOnErrors is set", report.failed());
        return ExitCode.RUNTIME_FAILURE;
      }
      return ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Ingestion interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (IllegalArgumentException | IllegalStateException ex) {
      log.error("Ingest configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Ingestion I/O failure under {}", config.outputDirectory(), ex);
      return ExitCode.IO_ERROR;
    } catch (Exception ex) {
      log.error("Unexpected failure in ingestion", ex);
      return ExitCode.forFailure(ex);
    }
  }

  static List<String> summary(RunReport report, boolean dryRun) {
    List<String> lines = new ArrayList<>();
    lines.add(dryRun ? "Ingestion dry-run: nothing was written." : "Ingestion report");
    lines.add(" Total       : " + report.total());
    lines.add(" Success     : " + report.success());
    lines.add(" Failed      : " + report.failed());
    lines.add(" Skipped     : " + report.skipped());
    lines.add(" Unsupported : " + report.unsupported());
    for (EntityType type : EntityType.values()) {
      lines.add(String.format(" %-12s: %d", type.plural(), report.entityCounts().get(type)));
    }
    for (FileOutcome failure : report.failures()) {
      lines.add(" FAILED " + failure.path() + " [" + failure.step() + "/" + failure.errorKind() + "] "
          + failure.message());
    }
    return lines;
  }
}
