package ca.gc.cra.medingest.api;

import ca.gc.cra.medingest.application.pipeline.SearchUseCase;
import ca.gc.cra.medingest.config.CompositionRoot;
import ca.gc.cra.medingest.config.SearchConfig;
import ca.gc.cra.medingest.domain.vector.SearchHit;
import ca.gc.cra.medingest.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.medingest.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code search} command: ranks indexed documents and entities against a free-text query.
 */
public final class SearchCli {
  private static final Logger log = LoggerFactory.getLogger(SearchCli.class);
  static final Set<String> KEYS = Set.of("vectorDir", "query", "q", "topK", "type", "threshold");
  private static final String SUMMARY_USAGE =
      "usage: search query=TEXT [vectorDir=DIR] [topK=5] [type=document|condition|medication|symptom] "
          + "[threshold=-1..1] [embeddingDimension=N] [config=FILE]";
  private static final String HELP_TEXT = """
      medingest search

      Usage:
        search query="chest pain" [vectorDir=~/.medingest/processed_data/vectordb] [options]

      Required:
        query=TEXT                 Free text to search for

      Optional:
        vectorDir=DIR              Embedding store directory
        topK=N                     Maximum hits (default 5)
        type=NAME                  Restrict to document, condition, medication or symptom entries
        threshold=SCORE            Minimum cosine score
        embeddingDimension=N       Dimension the store was built with (default 256)
        config=FILE                YAML file with common/search sections
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private SearchCli() {}

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
      log.debug("Verbose logging enabled for search CLI");
    }

    SearchConfig config;
    try {
      Map<String, String> effective = ConfigCliUtils.effectiveConfig("search", input, KEYS, Set.of(), log::warn);
      TelemetryConfigurator.configureMetrics(effective);
      config = SearchConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid search arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
        CompositionRoot root = new CompositionRoot(metrics)) {
      SearchUseCase useCase = root.searchUseCase(config);
      List<SearchHit> hits = useCase.search(config);
      if (hits.isEmpty()) {
        CliPrinter.println("No matches.");
      } else {
        CliPrinter.printLines(format(hits));
      }
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException | IllegalStateException ex) {
      log.error("Search configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to load embedding store {}", config.vectorDirectory(), ex);
      return ExitCode.IO_ERROR;
    } catch (Exception ex) {
      log.error("Unexpected failure in search", ex);
      return ExitCode.forFailure(ex);
    }
  }

  static List<String> format(List<SearchHit> hits) {
    List<String> lines = new ArrayList<>(hits.size());
    for (SearchHit hit : hits) {
      lines.add(String.format(Locale.ROOT, "%.4f  %s  %s", hit.score(), hit.id(), hit.metadata()));
    }
    return lines;
  }
}
