package ca.gc.cra.medingest.api;

import ca.gc.cra.medingest.config.ConfigMerger;
import ca.gc.cra.medingest.config.DefaultsForMode;
import ca.gc.cra.medingest.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Resolves the effective key/value configuration of a command from its arguments, an optional YAML file and
 * embedded defaults.
 */
final class ConfigCliUtils {
  static final Set<String> COMMON_KEYS =
      Set.of("config", "metricsExporter", "otelEndpoint", "otelResourceAttributes", "embeddingDimension");

  private ConfigCliUtils() {}

  /**
   * Builds the effective configuration (CLI over YAML over defaults).
   *
   * @param mode command name
   * @param input parsed command line
   * @param keys command-specific {@code key=value} names
   * @param flags command-specific option flags
   * @param warn sink for override warnings
   * @return immutable effective configuration
   * @throws IllegalArgumentException when an argument, flag or the YAML file is invalid
   * @throws IOException when the YAML file cannot be read
   */
  static Map<String, String> effectiveConfig(
      String mode, CliInput input, Set<String> keys, Set<String> flags, Consumer<String> warn)
      throws IOException {
    Set<String> allowed = new HashSet<>(COMMON_KEYS);
    allowed.addAll(keys);
    Map<String, String> cli = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs(), allowed));
    cli.putAll(input.flagOptions(flags));

    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = extractConfigPath(cli);
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new NoSuchFileException(yamlPath.toString(), null, "configuration file does not exist");
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, cli, DefaultsForMode.asFlatMap(mode), warn);
  }

  static String extractConfigPath(Map<String, String> args) {
    String value = args.remove("config");
    if (value != null && !value.isBlank()) {
      return value.trim();
    }
    return null;
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
