package ca.gc.cra.medingest.domain.run;

import ca.gc.cra.medingest.domain.entity.EntityType;
import ca.gc.cra.medingest.domain.registry.ProcessingStatus;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result a worker hands back to the coordinator for one file.
 *
 * @param path absolute, normalized file path
 * @param status success or error
 * @param step failing step; {@code null} on success
 * @param errorKind failure classification; {@code null} on success
 * @param message failure message; {@code null} on success
 * @param entityCounts entity counts for successful files; empty on failure
 * @since 0.1.0
 */
public record FileOutcome(
    String path,
    ProcessingStatus status,
    ProcessingStep step,
    ErrorKind errorKind,
    String message,
    Map<EntityType, Integer> entityCounts) {

  public FileOutcome {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(status, "status");
    Map<EntityType, Integer> counts = new EnumMap<>(EntityType.class);
    if (entityCounts != null) {
      counts.putAll(entityCounts);
    }
    entityCounts = Collections.unmodifiableMap(counts);
  }

  /**
   * Creates a success outcome.
   *
   * @param path file path
   * @param counts entity counts
   * @return outcome
   */
  public static FileOutcome success(String path, Map<EntityType, Integer> counts) {
    return new FileOutcome(path, ProcessingStatus.SUCCESS, null, null, null, counts);
  }

  /**
   * Creates a failure outcome.
   *
   * @param path file path
   * @param step failing step
   * @param kind failure classification
   * @param message failure message
   * @return outcome
   */
  public static FileOutcome failure(String path, ProcessingStep step, ErrorKind kind, String message) {
    return new FileOutcome(path, ProcessingStatus.ERROR, step, kind, message, Map.of());
  }

  /**
   * Indicates a successful outcome.
   *
   * @return {@code true} on success
   */
  public boolean isSuccess() {
    return status == ProcessingStatus.SUCCESS;
  }
}
