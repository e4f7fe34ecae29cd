package ca.gc.cra.medingest.application.pipeline;

import ca.gc.cra.medingest.domain.run.ErrorKind;
import ca.gc.cra.medingest.domain.run.ProcessingStep;
import java.util.Objects;

/**
 * Per-file failure raised inside the document pipeline and converted to a {@code FileOutcome} by the processor.
 *
 * @since 0.1.0
 */
public final class IngestionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ProcessingStep step;
  private final ErrorKind kind;

  public IngestionException(ProcessingStep step, ErrorKind kind, String message) {
    this(step, kind, message, null);
  }

  public IngestionException(ProcessingStep step, ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.step = Objects.requireNonNull(step, "step");
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ProcessingStep step() {
    return step;
  }

  public ErrorKind kind() {
    return kind;
  }
}
