package ca.gc.cra.medingest.config;

import ca.gc.cra.medingest.validation.Numbers;
import ca.gc.cra.medingest.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Configuration for one ingestion run over a directory of medical documents.
 * <p><strong>Why:</strong> Collects CLI, YAML and default values into one validated value so the use case never
 * sees raw strings.</p>
 * <p><strong>Role:</strong> Configuration aggregate for the {@code ingest} command.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Resolve the input directory, the processed-data root and the vector store directory.</li>
 *   <li>Normalize recognized extensions to lower-case {@code .ext} form.</li>
 *   <li>Bound worker count and embedding dimension.</li>
 *   <li>Carry the retry policy for previously failed and unsupported files.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param inputDirectory directory scanned for documents
 * @param outputDirectory processed-data root (extracted, processed, errors, reports, file_registry)
 * @param vectorDirectory embedding store directory; empty resolves to {@code <out>/vectordb}
 * @param recursive whether sub-directories are walked
 * @param extensions recognized extensions, lower-case with a leading dot
 * @param workers worker pool size
 * @param embeddingDimension dimension of the hashing embedding model
 * @param embed whether documents and entities are indexed in the embedding store
 * @param llmEndpoint optional free-text entity extractor endpoint
 * @param llmTimeoutSeconds request timeout for the entity extractor
 * @param syncOutput optional NDJSON file receiving workspace records
 * @param failOnErrors whether a run with failed files exits non-zero
 * @param dryRun whether files are only discovered and classified
 * @param skipFailed whether files previously recorded as {@code error} are skipped
 * @param retryUnsupported whether files previously recorded as unsupported are retried
 * @since 0.1.0
 * @see ca.gc.cra.medingest.application.pipeline.IngestionUseCase
 */
public record IngestConfig(
    Path inputDirectory,
    Path outputDirectory,
    Optional<Path> vectorDirectory,
    boolean recursive,
    Set<String> extensions,
    int workers,
    int embeddingDimension,
    boolean embed,
    Optional<URI> llmEndpoint,
    int llmTimeoutSeconds,
    Optional<Path> syncOutput,
    boolean failOnErrors,
    boolean dryRun,
    boolean skipFailed,
    boolean retryUnsupported) {

  /** Extensions recognized when none are configured. */
  public static final List<String> DEFAULT_EXTENSIONS =
      List.of(".txt", ".csv", ".md", ".html", ".htm", ".rtf", ".docx", ".doc", ".pdf");

  static final int MAX_WORKERS = 256;
  static final int MIN_DIMENSION = 8;
  static final int MAX_DIMENSION = 4096;
  static final int DEFAULT_DIMENSION = 256;

  private static final Path DEFAULT_BASE = defaultBaseDirectory();

  public IngestConfig {
    inputDirectory = normalizePath("in", inputDirectory);
    outputDirectory = normalizePath("out", outputDirectory);
    vectorDirectory = Objects.requireNonNullElse(vectorDirectory, Optional.<Path>empty())
        .map(path -> normalizePath("vectorDir", path));
    extensions = normalizeExtensions(extensions);
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
    Numbers.requireRange("embeddingDimension", embeddingDimension, MIN_DIMENSION, MAX_DIMENSION);
    llmEndpoint = Objects.requireNonNullElse(llmEndpoint, Optional.empty());
    Numbers.requireRange("llmTimeoutSeconds", llmTimeoutSeconds, 1, 3600);
    syncOutput = Objects.requireNonNullElse(syncOutput, Optional.<Path>empty())
        .map(path -> normalizePath("syncOut", path));
  }

  /**
   * Returns a configuration reading from the current directory and writing under
   * {@code ~/.medingest/processed_data}.
   *
   * @return default ingest configuration
   */
  public static IngestConfig defaults() {
    return new IngestConfig(
        Path.of("."),
        DEFAULT_BASE.resolve("processed_data"),
        Optional.empty(),
        true,
        Set.copyOf(DEFAULT_EXTENSIONS),
        defaultWorkers(),
        DEFAULT_DIMENSION,
        true,
        Optional.empty(),
        30,
        Optional.empty(),
        false,
        false,
        false,
        false);
  }

  /**
   * Builds a configuration from flat key/value options.
   *
   * @param options merged options such as {@code in}, {@code out}, {@code workers}
   * @return validated configuration
   * @throws IllegalArgumentException when {@code in} is missing or a value is invalid
   */
  public static IngestConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    IngestConfig defaults = defaults();

    String inRaw = firstNonBlank(options, "in", "input");
    if (inRaw == null) {
      throw new IllegalArgumentException("in is required");
    }
    Path input = parsePath("in", inRaw);
    String outRaw = firstNonBlank(options, "out", "output");
    Path output = outRaw == null ? defaults.outputDirectory() : parsePath("out", outRaw);
    Optional<Path> vectorDir = optionalPath("vectorDir", firstNonBlank(options, "vectorDir"));

    boolean recursive = parseBoolean("recursive", options.get("recursive"), defaults.recursive());
    String extensionsRaw = firstNonBlank(options, "extensions");
    Set<String> extensions = extensionsRaw == null
        ? defaults.extensions()
        : new LinkedHashSet<>(List.of(extensionsRaw.split(",")));

    int workers = parseInt(options, "workers", defaults.workers(), 1, MAX_WORKERS);
    int dimension = parseInt(
        options, "embeddingDimension", defaults.embeddingDimension(), MIN_DIMENSION, MAX_DIMENSION);
    boolean embed = parseBoolean("embed", options.get("embed"), defaults.embed());
    Optional<URI> llmEndpoint = optionalUri("llmEndpoint", firstNonBlank(options, "llmEndpoint"));
    int llmTimeout = parseInt(options, "llmTimeoutSeconds", defaults.llmTimeoutSeconds(), 1, 3600);
    Optional<Path> syncOut = optionalPath("syncOut", firstNonBlank(options, "syncOut"));

    return new IngestConfig(
        input,
        output,
        vectorDir,
        recursive,
        extensions,
        workers,
        dimension,
        embed,
        llmEndpoint,
        llmTimeout,
        syncOut,
        parseBoolean("failOnErrors", options.get("failOnErrors"), false),
        parseBoolean("dryRun", options.get("dryRun"), false),
        parseBoolean("skipFailed", options.get("skipFailed"), false),
        parseBoolean("retryUnsupported", options.get("retryUnsupported"), false));
  }

  /**
   * Resolves the embedding store directory, defaulting under the processed-data root.
   *
   * @return vector store directory
   */
  public Path effectiveVectorDirectory() {
    return vectorDirectory.orElseGet(() -> outputDirectory.resolve("vectordb"));
  }

  /**
   * Resolves the registry file location.
   *
   * @return path of {@code processed_files.json}
   */
  public Path registryFile() {
    return outputDirectory.resolve("file_registry").resolve("processed_files.json");
  }

  /**
   * Tests whether a file name carries a recognized extension.
   *
   * @param fileName bare file name
   * @return {@code true} when the lower-cased suffix is configured
   */
  public boolean accepts(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot <= 0) {
      return false;
    }
    return extensions.contains(fileName.substring(dot).toLowerCase(Locale.ROOT));
  }

  static Path defaultBaseDirectory() {
    String home = System.getProperty("user.home");
    if (home == null || home.isBlank()) {
      return Path.of(".medingest");
    }
    return Path.of(home, ".medingest");
  }

  private static int defaultWorkers() {
    return Math.max(1, Math.min(MAX_WORKERS, Runtime.getRuntime().availableProcessors()));
  }

  private static Set<String> normalizeExtensions(Set<String> raw) {
    if (raw == null || raw.isEmpty()) {
      return Set.copyOf(DEFAULT_EXTENSIONS);
    }
    Set<String> normalized = new LinkedHashSet<>();
    for (String value : raw) {
      if (value == null || value.isBlank()) {
        continue;
      }
      String trimmed = value.trim().toLowerCase(Locale.ROOT);
      normalized.add(trimmed.startsWith(".") ? trimmed : "." + trimmed);
    }
    if (normalized.isEmpty()) {
      throw new IllegalArgumentException("extensions must name at least one suffix");
    }
    return Set.copyOf(normalized);
  }

  private static int parseInt(Map<String, String> options, String key, int fallback, int min, int max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseInt(key, raw, min, max);
  }

  private static boolean parseBoolean(String name, String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Strings.parseBoolean(name, value);
  }

  private static Optional<URI> optionalUri(String name, String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    try {
      URI uri = new URI(raw.trim());
      String scheme = uri.getScheme();
      if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException(name + " must be an http(s) URL");
      }
      return Optional.of(uri);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " is not a valid URL: " + raw, ex);
    }
  }

  private static Optional<Path> optionalPath(String name, String raw) {
    return raw == null ? Optional.empty() : Optional.of(parsePath(name, raw));
  }

  static Path parsePath(String name, String raw) {
    try {
      return normalizePath(name, Path.of(expandHome(raw.trim())));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + raw, ex);
    }
  }

  static Path normalizePath(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    return path.toAbsolutePath().normalize();
  }

  private static String expandHome(String raw) {
    if (raw.equals("~") || raw.startsWith("~/")) {
      String home = System.getProperty("user.home", "");
      return home + raw.substring(1);
    }
    return raw;
  }

  static String firstNonBlank(Map<String, String> options, String... keys) {
    for (String key : keys) {
      String value = options.get(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }
}
