/**
 * <strong>Purpose:</strong> Ports defining the select -> extract -> normalize -> embed -> persist workflow contracts.
 * <p><strong>Pipeline role:</strong> Application layer; adapters in {@code infrastructure} implement these interfaces.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/logging but do not prescribe implementations.
 *
 * @since 0.1.0
 */
package ca.gc.cra.medingest.application.port;
