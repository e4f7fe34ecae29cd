package ca.gc.cra.medingest.domain.run;

/**
 * Failure taxonomy recorded in the registry and run reports.
 *
 * @since 0.1.0
 */
public enum ErrorKind {
  /** No extractor matched the file's extension or content signature. */
  UNSUPPORTED_FORMAT,
  /** Every parser attempt failed or produced no content. */
  EXTRACTION_FAILURE,
  /** Text could not be decoded with the declared or fallback encoding. */
  ENCODING_FAILURE,
  /** The embedding store could not persist its tables. */
  EMBEDDING_STORE_IO,
  /** Artifacts for the file could not be written. */
  PERSISTENCE_IO,
  /** Unexpected failure in any step. */
  INTERNAL
}
