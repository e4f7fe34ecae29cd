/**
 * Per-file outcomes, failure taxonomy and run-level reports of the ingest orchestrator.
 */
package ca.gc.cra.medingest.domain.run;
