package ca.gc.cra.medingest.domain.run;

/**
 * Steps a file passes through during ingestion, in order.
 *
 * @since 0.1.0
 */
public enum ProcessingStep {
  SELECT,
  EXTRACT,
  NORMALIZE,
  EMBED,
  PERSIST
}
