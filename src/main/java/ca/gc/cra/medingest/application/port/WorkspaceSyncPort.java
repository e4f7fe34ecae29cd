package ca.gc.cra.medingest.application.port;

import java.io.IOException;
import java.util.Map;

/**
 * <strong>What:</strong> External workspace target receiving finished records as flat property maps.
 * <p><strong>Role:</strong> Collaborator port; mapping into the target's own schema is the target's concern.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent pushes.</p>
 *
 * @since 0.1.0
 */
public interface WorkspaceSyncPort extends AutoCloseable {
  /**
   * Pushes one record.
   *
   * @param entityType plural entity key such as {@code conditions}, or {@code documents}
   * @param properties properties keyed by canonical field name
   * @throws IOException if the target rejects or cannot receive the record
   */
  void push(String entityType, Map<String, Object> properties) throws IOException;

  @Override
  default void close() throws IOException {}

  /** Target that drops every record. */
  WorkspaceSyncPort NO_OP = (entityType, properties) -> {};
}
