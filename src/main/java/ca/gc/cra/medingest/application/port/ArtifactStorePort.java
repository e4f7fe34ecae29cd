package ca.gc.cra.medingest.application.port;

import ca.gc.cra.medingest.domain.document.ExtractedDocument;
import ca.gc.cra.medingest.domain.entity.NormalizedRecord;
import ca.gc.cra.medingest.domain.run.FileOutcome;
import ca.gc.cra.medingest.domain.run.RunReport;
import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Writes per-document JSON artifacts, run reports and the error holding area.
 * <p><strong>Role:</strong> Application port implemented by filesystem adapters.</p>
 * <p><strong>Thread-safety:</strong> Per-document writes may run on worker threads; implementations must handle
 * concurrent calls for distinct documents.</p>
 *
 * @since 0.1.0
 */
public interface ArtifactStorePort {
  /**
   * Persists the extraction result.
   *
   * @param document extraction result
   * @return written file
   * @throws IOException on write failure
   */
  Path writeExtracted(ExtractedDocument document) throws IOException;

  /**
   * Persists the normalized record.
   *
   * @param record normalized record
   * @return written file
   * @throws IOException on write failure
   */
  Path writeNormalized(NormalizedRecord record) throws IOException;

  /**
   * Removes artifacts written for a source file whose processing later failed.
   *
   * @param sourcePath source file path
   * @throws IOException on delete failure
   */
  void discard(String sourcePath) throws IOException;

  /**
   * Copies a failed source file into the error holding area with an error log next to it. The source file is
   * left untouched.
   *
   * @param source failed file
   * @param outcome failure outcome
   * @return copied file
   * @throws IOException on copy failure
   */
  Path holdFailed(Path source, FileOutcome outcome) throws IOException;

  /**
   * Persists a run report.
   *
   * @param report run report
   * @return written file
   * @throws IOException on write failure
   */
  Path writeReport(RunReport report) throws IOException;
}
