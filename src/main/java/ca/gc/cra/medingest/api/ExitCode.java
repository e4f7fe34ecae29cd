package ca.gc.cra.medingest.api;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Process exit codes returned by the {@code medingest} commands.
 */
public enum ExitCode {
  SUCCESS(0),
  INVALID_ARGS(2),
  IO_ERROR(3),
  CONFIG_ERROR(4),
  RUNTIME_FAILURE(5),
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Maps a failure that aborted a whole command to its exit code.
   *
   * @param failure exception that reached the command boundary
   * @return matching exit code
   */
  public static ExitCode forFailure(Throwable failure) {
    if (failure instanceof InterruptedException) {
      return INTERRUPTED;
    }
    if (failure instanceof IOException || failure instanceof UncheckedIOException) {
      return IO_ERROR;
    }
    if (failure instanceof IllegalArgumentException || failure instanceof IllegalStateException) {
      return CONFIG_ERROR;
    }
    return RUNTIME_FAILURE;
  }
}
