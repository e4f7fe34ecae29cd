package ca.gc.cra.medingest.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Embedded defaults per command, used as the lowest-precedence layer of the effective configuration.
 * <p>{@code in} and {@code query} have no default so that a missing value is reported as an error.</p>
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the flattened defaults for a command.
   *
   * @param mode {@code ingest} or {@code search}
   * @return immutable key/value defaults
   * @throws IllegalArgumentException when the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "ingest" -> buildIngestDefaults();
      case "search" -> buildSearchDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("embeddingDimension", Integer.toString(IngestConfig.DEFAULT_DIMENSION));
    return Map.copyOf(map);
  }

  private static Map<String, String> buildIngestDefaults() {
    IngestConfig defaults = IngestConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("out", defaults.outputDirectory().toString());
    map.put("vectorDir", "");
    map.put("recursive", Boolean.toString(defaults.recursive()));
    map.put("extensions", String.join(",", IngestConfig.DEFAULT_EXTENSIONS));
    map.put("workers", Integer.toString(defaults.workers()));
    map.put("embed", Boolean.toString(defaults.embed()));
    map.put("llmEndpoint", "");
    map.put("llmTimeoutSeconds", Integer.toString(defaults.llmTimeoutSeconds()));
    map.put("syncOut", "");
    map.put("failOnErrors", "false");
    map.put("dryRun", "false");
    map.put("skipFailed", "false");
    map.put("retryUnsupported", "false");
    return map;
  }

  private static Map<String, String> buildSearchDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("vectorDir", IngestConfig.defaults().effectiveVectorDirectory().toString());
    map.put("topK", "5");
    map.put("type", "");
    map.put("threshold", "");
    return map;
  }
}
