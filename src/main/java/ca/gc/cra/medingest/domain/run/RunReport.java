package ca.gc.cra.medingest.domain.run;

import ca.gc.cra.medingest.domain.entity.EntityType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Summary of one ingest run.
 * <p><strong>Role:</strong> Sole user-visible error channel besides the registry; persisted as a JSON report.</p>
 * <p><strong>Thread-safety:</strong> Immutable; built on the coordinating thread via {@link Builder}.</p>
 *
 * @param timestamp when the run finished
 * @param total files attempted in this run
 * @param success files processed successfully
 * @param failed files that ended in error
 * @param skipped files skipped because the registry already marks them done (or excluded from retry)
 * @param unsupported failed files whose format was not recognized
 * @param entityCounts entity counts aggregated over successful files
 * @param failures failed outcomes in discovery order
 * @since 0.1.0
 */
public record RunReport(
    Instant timestamp,
    int total,
    int success,
    int failed,
    int skipped,
    int unsupported,
    Map<EntityType, Integer> entityCounts,
    List<FileOutcome> failures) {

  public RunReport {
    Objects.requireNonNull(timestamp, "timestamp");
    Map<EntityType, Integer> counts = new EnumMap<>(EntityType.class);
    for (EntityType type : EntityType.values()) {
      counts.put(type, 0);
    }
    if (entityCounts != null) {
      counts.putAll(entityCounts);
    }
    entityCounts = Collections.unmodifiableMap(counts);
    failures = failures == null ? List.of() : List.copyOf(failures);
  }

  /**
   * Creates a report builder.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Accumulates outcomes on the coordinating thread. Not thread-safe. */
  public static final class Builder {
    private final Map<EntityType, Integer> counts = new EnumMap<>(EntityType.class);
    private final List<FileOutcome> failures = new ArrayList<>();
    private int total;
    private int success;
    private int skipped;
    private int unsupported;

    private Builder() {}

    /**
     * Adds one attempted file outcome.
     *
     * @param outcome outcome returned by a worker
     * @return this builder
     */
    public Builder add(FileOutcome outcome) {
      Objects.requireNonNull(outcome, "outcome");
      total++;
      if (outcome.isSuccess()) {
        success++;
        outcome.entityCounts().forEach((type, count) -> counts.merge(type, count, Integer::sum));
      } else {
        failures.add(outcome);
        if (outcome.errorKind() == ErrorKind.UNSUPPORTED_FORMAT) {
          unsupported++;
        }
      }
      return this;
    }

    /**
     * Records a file that was not attempted.
     *
     * @return this builder
     */
    public Builder skip() {
      skipped++;
      return this;
    }

    /**
     * Builds the report.
     *
     * @param timestamp completion time
     * @return immutable report
     */
    public RunReport build(Instant timestamp) {
      return new RunReport(timestamp, total, success, failures.size(), skipped, unsupported, counts, failures);
    }
  }
}
