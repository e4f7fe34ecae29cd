package ca.gc.cra.medingest.domain.registry;

import ca.gc.cra.medingest.domain.run.ErrorKind;
import ca.gc.cra.medingest.domain.run.ProcessingStep;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Last known processing outcome for one file path.
 * <p><strong>Role:</strong> Value stored in the processed-file registry; a path appears at most once and the most
 * recent entry wins.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param path absolute, normalized file path
 * @param timestamp when the outcome was recorded
 * @param status success or error
 * @param step failing step; {@code null} on success
 * @param errorKind failure classification; {@code null} on success
 * @param errorDetail failure message; {@code null} on success
 * @since 0.1.0
 */
public record RegistryEntry(
    String path,
    Instant timestamp,
    ProcessingStatus status,
    ProcessingStep step,
    ErrorKind errorKind,
    String errorDetail) {

  public RegistryEntry {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(status, "status");
  }

  /**
   * Creates a success entry.
   *
   * @param path file path
   * @param timestamp record time
   * @return success entry
   */
  public static RegistryEntry success(String path, Instant timestamp) {
    return new RegistryEntry(path, timestamp, ProcessingStatus.SUCCESS, null, null, null);
  }

  /**
   * Creates an error entry.
   *
   * @param path file path
   * @param timestamp record time
   * @param step failing step
   * @param kind failure classification
   * @param detail failure message
   * @return error entry
   */
  public static RegistryEntry error(
      String path, Instant timestamp, ProcessingStep step, ErrorKind kind, String detail) {
    return new RegistryEntry(path, timestamp, ProcessingStatus.ERROR, step, kind, detail);
  }

  /**
   * Indicates whether this entry records a successful run.
   *
   * @return {@code true} for success
   */
  public boolean isSuccess() {
    return status == ProcessingStatus.SUCCESS;
  }

  /**
   * Returns the failure message, if any.
   *
   * @return optional error detail
   */
  public Optional<String> error() {
    return Optional.ofNullable(errorDetail);
  }
}
