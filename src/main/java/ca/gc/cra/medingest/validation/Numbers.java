package ca.gc.cra.medingest.validation;

/**
 * Numeric validation helpers for CLI and YAML configuration values.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Ensures a value lies within an inclusive range.
   *
   * @param name configuration key used in the error message
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException when out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer configuration value and checks its range.
   *
   * @param name configuration key
   * @param raw textual value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return parsed value
   * @throws IllegalArgumentException when the value is not an integer or out of range
   */
  public static int parseInt(String name, String raw, int min, int max) {
    int parsed;
    try {
      parsed = Integer.parseInt(Strings.requireNonBlank(name, raw));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was " + raw + ")", ex);
    }
    return (int) requireRange(name, parsed, min, max);
  }

  /**
   * Parses a decimal configuration value and checks its range.
   *
   * @param name configuration key
   * @param raw textual value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return parsed value
   * @throws IllegalArgumentException when the value is not a finite number or out of range
   */
  public static double parseDouble(String name, String raw, double min, double max) {
    double parsed;
    try {
      parsed = Double.parseDouble(Strings.requireNonBlank(name, raw));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was " + raw + ")", ex);
    }
    if (Double.isNaN(parsed) || parsed < min || parsed > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + raw + ")");
    }
    return parsed;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
