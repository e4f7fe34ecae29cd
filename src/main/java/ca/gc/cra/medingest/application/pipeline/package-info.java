/**
 * Use cases that ingest a document directory and search the resulting embedding store.
 * <p>{@link ca.gc.cra.medingest.application.pipeline.DocumentProcessor} owns the per-file state machine;
 * {@link ca.gc.cra.medingest.application.pipeline.IngestionUseCase} schedules files on an ExecutorService-backed
 * worker pool (threads named {@code medingest-worker-*}) and is the only writer of the processed-file
 * registry.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.medingest.application.pipeline;
