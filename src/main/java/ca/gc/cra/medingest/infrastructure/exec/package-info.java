/**
 * Executor factories for the ingestion worker pool.
 * <p>Threads are named after a caller-supplied prefix so per-file log lines identify their worker.</p>
 */
package ca.gc.cra.medingest.infrastructure.exec;
