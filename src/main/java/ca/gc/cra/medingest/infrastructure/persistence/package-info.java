/**
 * Filesystem persistence: the processed-file registry, per-file JSON artifacts and run reports.
 */
package ca.gc.cra.medingest.infrastructure.persistence;
