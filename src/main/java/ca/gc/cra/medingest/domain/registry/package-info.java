/**
 * Processed-file registry values used to make ingest runs idempotent.
 */
package ca.gc.cra.medingest.domain.registry;
