package ca.gc.cra.medingest.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses {@code key=value} arguments into an ordered map.
 * <p>Values may contain {@code =} (only the first one separates the key) and may be wrapped in matching quotes,
 * which are stripped. Empty values are kept so an option can be reset explicitly.</p>
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");

  private CliArgsParser() {}

  /**
   * Parses arguments, accepting any well-formed key.
   *
   * @param args {@code key=value} arguments
   * @return ordered map; a repeated key keeps its last value
   * @throws IllegalArgumentException when an argument is malformed
   */
  public static Map<String, String> toMap(String[] args) {
    return toMap(args, Set.of());
  }

  /**
   * Parses arguments and rejects keys outside {@code allowedKeys}.
   *
   * @param args {@code key=value} arguments
   * @param allowedKeys accepted keys; empty accepts every key
   * @return ordered map; a repeated key keeps its last value
   * @throws IllegalArgumentException when an argument is malformed or its key is not accepted
   */
  public static Map<String, String> toMap(String[] args, Set<String> allowedKeys) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = unquote(arg.substring(idx + 1).trim());
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (!allowedKeys.isEmpty() && !allowedKeys.contains(key)) {
        throw new IllegalArgumentException("unknown argument: " + key);
      }
      validateValue(key, value);
      map.put(key, value);
    }
    return map;
  }

  private static String unquote(String value) {
    if (value.length() >= 2) {
      char first = value.charAt(0);
      char last = value.charAt(value.length() - 1);
      if ((first == '"' || first == '\'') && first == last) {
        return value.substring(1, value.length() - 1);
      }
    }
    return value;
  }

  private static void validateValue(String key, String value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
    }
  }
}
