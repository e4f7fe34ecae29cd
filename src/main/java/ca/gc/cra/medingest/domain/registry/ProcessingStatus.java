package ca.gc.cra.medingest.domain.registry;

import java.util.Locale;

/**
 * Final outcome recorded for a file in the processed-file registry.
 *
 * @since 0.1.0
 */
public enum ProcessingStatus {
  /** File was extracted, normalized, indexed and persisted. */
  SUCCESS,
  /** A step failed; the registry entry carries the failing step and message. */
  ERROR;

  /**
   * Returns the lower-case wire value ({@code success} or {@code error}).
   *
   * @return wire value
   */
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a wire value, case-insensitively.
   *
   * @param raw wire value
   * @return matching status
   * @throws IllegalArgumentException when the value is unknown
   */
  public static ProcessingStatus fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("status must not be blank");
    }
    return valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }
}
