package ca.gc.cra.medingest.application.port;

import ca.gc.cra.medingest.domain.registry.RegistryEntry;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Idempotence ledger mapping file path to last known processing outcome.
 * <p><strong>Role:</strong> Application port written only by the ingest coordinator; workers never call
 * {@link #record(RegistryEntry)}.</p>
 * <p><strong>Thread-safety:</strong> Implementations may assume a single writer.</p>
 *
 * @since 0.1.0
 */
public interface ProcessedFileRegistry {
  /**
   * Looks up the entry for a path.
   *
   * @param path absolute, normalized path
   * @return entry, or empty when the path was never recorded
   */
  Optional<RegistryEntry> lookup(String path);

  /**
   * Records an outcome, replacing any previous entry for the same path, and persists the registry.
   *
   * @param entry outcome to record
   * @throws IOException if the registry cannot be written
   */
  void record(RegistryEntry entry) throws IOException;

  /**
   * Returns every entry keyed by path.
   *
   * @return immutable snapshot
   */
  Map<String, RegistryEntry> snapshot();
}
