package ca.gc.cra.medingest.infrastructure.persistence;

import ca.gc.cra.medingest.application.json.JsonWriter;
import ca.gc.cra.medingest.application.json.RecordJson;
import ca.gc.cra.medingest.application.port.ArtifactStorePort;
import ca.gc.cra.medingest.application.port.ClockPort;
import ca.gc.cra.medingest.domain.document.DocumentMetadata;
import ca.gc.cra.medingest.domain.document.ExtractedDocument;
import ca.gc.cra.medingest.domain.entity.NormalizedRecord;
import ca.gc.cra.medingest.domain.run.FileOutcome;
import ca.gc.cra.medingest.domain.run.RunReport;
import ca.gc.cra.medingest.util.PathUtils;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Writes per-file artifacts, held failures and run reports under the processed-data root.
 * <p>Layout: {@code extracted/}, {@code processed/}, {@code errors/} and {@code reports/}. Artifact names are
 * {@code <stem>_<hash8>} where {@code hash8} is the first eight hex digits of the SHA-1 of the source path, so
 * same-named files from different directories do not collide. Held failures keep their extension.</p>
 * <p>Thread-safe: each artifact is written through its own temp file, and error holding is synchronized.</p>
 *
 * @since 0.1.0
 */
public final class FileArtifactStore implements ArtifactStorePort {
  private static final DateTimeFormatter REPORT_STAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

  private final Path extractedDir;
  private final Path processedDir;
  private final Path errorsDir;
  private final Path reportsDir;
  private final ClockPort clock;
  private final JsonWriter writer = new JsonWriter(true);

  /**
   * Creates the store, creating its directories.
   *
   * @param root processed-data root
   * @param clock clock used to stamp error logs
   * @throws IOException when the directories cannot be created
   */
  public FileArtifactStore(Path root, ClockPort clock) throws IOException {
    Objects.requireNonNull(root, "root");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.extractedDir = Files.createDirectories(root.resolve("extracted"));
    this.processedDir = Files.createDirectories(root.resolve("processed"));
    this.errorsDir = Files.createDirectories(root.resolve("errors"));
    this.reportsDir = Files.createDirectories(root.resolve("reports"));
  }

  @Override
  public Path writeExtracted(ExtractedDocument document) throws IOException {
    Path target = extractedDir.resolve(key(document.metadata()) + "_extracted.json");
    AtomicFiles.writeJson(target, RecordJson.extracted(document), writer);
    return target;
  }

  @Override
  public Path writeNormalized(NormalizedRecord record) throws IOException {
    Path target = processedDir.resolve(key(record.source().metadata()) + "_processed.json");
    AtomicFiles.writeJson(target, RecordJson.normalized(record), writer);
    return target;
  }

  @Override
  public void discard(String sourcePath) throws IOException {
    String key = PathUtils.artifactKey(sourcePath, PathUtils.fileName(Path.of(sourcePath)).orElse(sourcePath));
    Files.deleteIfExists(extractedDir.resolve(key + "_extracted.json"));
    Files.deleteIfExists(processedDir.resolve(key + "_processed.json"));
  }

  @Override
  public synchronized Path holdFailed(Path source, FileOutcome outcome) throws IOException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(outcome, "outcome");
    String fileName = PathUtils.fileName(source).orElse("unnamed");
    String name = PathUtils.artifactKey(source.toAbsolutePath().normalize().toString(), fileName)
        + PathUtils.sanitize(extension(fileName));
    Path copy = errorsDir.resolve(name);
    if (Files.isRegularFile(source)) {
      Files.copy(source, copy, StandardCopyOption.REPLACE_EXISTING);
    }
    StringBuilder log = new StringBuilder()
        .append("timestamp: ").append(clock.now()).append('\n')
        .append("path: ").append(outcome.path()).append('\n')
        .append("step: ").append(outcome.step()).append('\n')
        .append("kind: ").append(outcome.errorKind()).append('\n')
        .append("error: ").append(outcome.message()).append('\n');
    Files.writeString(errorsDir.resolve(name + ".error.log"), log, StandardCharsets.UTF_8);
    return copy;
  }

  @Override
  public Path writeReport(RunReport report) throws IOException {
    Path target = reportsDir.resolve("ingestion_report_" + REPORT_STAMP.format(report.timestamp()) + ".json");
    AtomicFiles.writeJson(target, RecordJson.report(report), writer);
    return target;
  }

  private static String extension(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot <= 0 ? "" : fileName.substring(dot);
  }

  private static String key(DocumentMetadata metadata) {
    return PathUtils.artifactKey(metadata.sourcePath(), metadata.fileName());
  }
}
