package ca.gc.cra.medingest.validation;

import java.util.Locale;
import java.util.Objects;

/**
 * String validation helpers for user-supplied configuration.
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is present, not blank and free of control characters.
   *
   * @param name configuration key used in error messages
   * @param value candidate value
   * @return trimmed value
   * @throws NullPointerException when {@code value} is {@code null}
   * @throws IllegalArgumentException when blank or containing control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Ensures a value is printable ASCII within a length limit.
   *
   * @param name configuration key
   * @param value candidate value
   * @param maxLength maximum length
   * @return trimmed value
   * @throws IllegalArgumentException when the value is blank, too long or not printable ASCII
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Parses a boolean flag accepting {@code true/false}, {@code yes/no} and {@code 1/0}.
   *
   * @param name configuration key
   * @param raw textual value
   * @return parsed flag
   * @throws IllegalArgumentException when the value is not a recognized boolean
   */
  public static boolean parseBoolean(String name, String raw) {
    String value = requireNonBlank(name, raw).toLowerCase(Locale.ROOT);
    return switch (value) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(message(name, "must be true or false (was " + raw + ")"));
    };
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
