/**
 * Core domain model for the ingest pipeline: extracted documents, normalized records, registry entries and
 * embedding entries.
 * <p><strong>Role:</strong> Domain layer values with no infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable; safe to share across worker threads.</p>
 * <p><strong>Security:</strong> Document content is clinical text; callers must truncate before logging.</p>
 */
package ca.gc.cra.medingest.domain;
