package ca.gc.cra.medingest.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.medingest.domain.entity.EntityType;
import ca.gc.cra.medingest.domain.run.ErrorKind;
import ca.gc.cra.medingest.domain.run.FileOutcome;
import ca.gc.cra.medingest.domain.run.ProcessingStep;
import ca.gc.cra.medingest.domain.run.RunReport;
import ca.gc.cra.medingest.testutil.DocumentFixtures;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class IngestCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(IngestCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingInputReturnsUsageAndInvalidArgs() {
    ExitCode code = IngestCli.run(new String[] {"out=" + tempDir.resolve("out")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: ingest"));
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("in is required"));
    assertTrue(logged);
  }

  @Test
  void unknownArgumentIsRejected() {
    ExitCode code = IngestCli.run(new String[] {"in=" + tempDir, "iface=eth0"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void conflictingRetryFlagsAreRejected() {
    ExitCode code = IngestCli.run(new String[] {"in=" + tempDir, "--skip-failed", "--retry-unsupported"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void helpPrintsOptions() {
    assertEquals(ExitCode.SUCCESS, IngestCli.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("--retry-unsupported"));
  }

  @Test
  void missingConfigFileIsAnIoError() {
    ExitCode code = IngestCli.run(new String[] {"in=" + tempDir, "config=" + tempDir.resolve("absent.yaml")});

    assertEquals(ExitCode.IO_ERROR, code);
  }

  @Test
  void missingInputDirectoryIsAConfigError() {
    ExitCode code = IngestCli.run(new String[] {
        "in=" + tempDir.resolve("missing"), "out=" + tempDir.resolve("out")});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void ingestsDirectoryAndSkipsOnRerun() throws IOException {
    Path input = Files.createDirectories(tempDir.resolve("records"));
    DocumentFixtures.writeText(input.resolve("note.txt"), "ASSESSMENT: asthma.\nPLAN: inhaler.\n");
    Path output = tempDir.resolve("out");
    String[] args = {"in=" + input, "out=" + output, "embeddingDimension=32", "workers=1"};

    assertEquals(ExitCode.SUCCESS, IngestCli.run(args));
    String first = buffer.toString();
    assertTrue(first.contains("Ingestion report"));
    assertTrue(first.contains(" Success     : 1"));
    assertTrue(Files.isRegularFile(output.resolve("vectordb").resolve("vectors.json")));

    assertEquals(ExitCode.SUCCESS, IngestCli.run(args));
    assertTrue(buffer.toString().contains(" Skipped     : 1"));
  }

  @Test
  void yamlSuppliesOptionsAndCliWins() throws IOException {
    Path input = Files.createDirectories(tempDir.resolve("records"));
    DocumentFixtures.writeText(input.resolve("note.txt"), "Reports headache.");
    DocumentFixtures.writeText(input.resolve("skip.md"), "# Not selected");
    Path yaml = Files.writeString(tempDir.resolve("medingest.yaml"), """
        ingest:
          extensions: [.md]
          embed: false
        """);

    ExitCode code = IngestCli.run(new String[] {
        "in=" + input, "out=" + tempDir.resolve("out"), "config=" + yaml, "extensions=.txt"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains(" Total       : 1"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().equals("CLI overrides YAML for key: extensions")));
  }

  @Test
  void failOnErrorsTurnsFailuresIntoExitCode() throws IOException {
    Path input = Files.createDirectories(tempDir.resolve("records"));
    DocumentFixtures.writeCorruptPdf(input.resolve("fax.pdf"));

    ExitCode code = IngestCli.run(new String[] {
        "in=" + input, "out=" + tempDir.resolve("out"), "--no-embed", "--fail-on-errors"});

    assertEquals(ExitCode.RUNTIME_FAILURE, code);
    assertTrue(buffer.toString().contains("[EXTRACT/EXTRACTION_FAILURE]"));
  }

  @Test
  void dryRunSummaryIsLabelled() throws IOException {
    Path input = Files.createDirectories(tempDir.resolve("records"));
    DocumentFixtures.writeText(input.resolve("note.txt"), "Asthma.");

    ExitCode code = IngestCli.run(new String[] {"in=" + input, "out=" + tempDir.resolve("out"), "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Ingestion dry-run: nothing was written."));
  }

  @Test
  void summaryListsEveryEntityFamilyAndFailure() {
    RunReport report = RunReport.builder()
        .add(FileOutcome.success("/in/a.txt", Map.of(EntityType.CONDITION, 2)))
        .add(FileOutcome.failure("/in/b.bin", ProcessingStep.SELECT, ErrorKind.UNSUPPORTED_FORMAT,
            "no extractor for b.bin"))
        .build(Instant.EPOCH);

    List<String> lines = IngestCli.summary(report, false);

    assertTrue(lines.contains(" conditions  : 2"));
    assertTrue(lines.contains(" lab_results : 0"));
    assertEquals(" FAILED /in/b.bin [SELECT/UNSUPPORTED_FORMAT] no extractor for b.bin", lines.get(lines.size() - 1));
  }
}
