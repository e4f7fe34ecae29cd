package ca.gc.cra.medingest.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Splits raw command-line arguments into {@code key=value} pairs and flags.
 * <p>Recognized option flags ({@code --dry-run}, {@code --skip-failed}, ...) are translated to the configuration
 * key they set, so a flag and its {@code key=value} form are interchangeable.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final Map<String, Map.Entry<String, String>> OPTION_FLAGS = Map.of(
      "--dry-run", Map.entry("dryRun", "true"),
      "--skip-failed", Map.entry("skipFailed", "true"),
      "--retry-unsupported", Map.entry("retryUnsupported", "true"),
      "--fail-on-errors", Map.entry("failOnErrors", "true"),
      "--no-embed", Map.entry("embed", "false"),
      "--no-recursive", Map.entry("recursive", "false"));

  private final String[] keyValueArgs;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;

  private CliInput(String[] keyValueArgs, Set<String> flags, boolean help, boolean verbose) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments. Blank and {@code null} entries are ignored.
   *
   * @param args raw arguments
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of(), false, false);
    }

    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv.toArray(String[]::new), Set.copyOf(flags), help, verbose);
  }

  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }

  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Translates option flags into configuration entries.
   *
   * @param allowed flags accepted by the calling command
   * @return configuration entries set by the flags
   * @throws IllegalArgumentException when a flag is unknown or not accepted by the command
   */
  public Map<String, String> flagOptions(Set<String> allowed) {
    Map<String, String> options = new LinkedHashMap<>();
    for (String flag : flags) {
      if (flag.equals("--help") || flag.equals("--verbose")) {
        continue;
      }
      Map.Entry<String, String> option = OPTION_FLAGS.get(flag);
      if (option == null || !allowed.contains(flag)) {
        throw new IllegalArgumentException("unknown flag: " + flag);
      }
      options.put(option.getKey(), option.getValue());
    }
    return options;
  }
}
