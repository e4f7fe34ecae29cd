package ca.gc.cra.medingest.infrastructure.detect;

import ca.gc.cra.medingest.application.port.DocumentExtractor;
import ca.gc.cra.medingest.application.port.ExtractorModule;
import ca.gc.cra.medingest.application.port.ExtractorSelector;
import ca.gc.cra.medingest.application.port.SniffSample;
import ca.gc.cra.medingest.infrastructure.extract.FileMetadataReader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default selector consulting the registered modules, first by file extension then by signature sniffing of a
 * bounded prefix.
 * <p>Thread-safe for concurrent selection once constructed.</p>
 *
 * @since 0.1.0
 */
public final class DefaultExtractorSelector implements ExtractorSelector {
  private static final Logger log = LoggerFactory.getLogger(DefaultExtractorSelector.class);

  /** Maximum number of leading bytes read for sniffing. */
  public static final int SNIFF_LIMIT = 4096;

  private final Map<String, ExtractorModule> byExtension;
  private final List<ExtractorModule> sniffOrder;

  /**
   * Creates a selector over the supplied modules.
   *
   * @param modules format modules; the first module registering an extension wins
   * @throws NullPointerException if {@code modules} is {@code null}
   */
  public DefaultExtractorSelector(Collection<ExtractorModule> modules) {
    Objects.requireNonNull(modules, "modules");
    Map<String, ExtractorModule> extensions = new HashMap<>();
    for (ExtractorModule module : modules) {
      for (String extension : module.extensions()) {
        extensions.putIfAbsent(extension.toLowerCase(Locale.ROOT), module);
      }
    }
    this.byExtension = Map.copyOf(extensions);
    List<ExtractorModule> ordered = new ArrayList<>(modules);
    ordered.sort(Comparator.comparingInt(ExtractorModule::sniffPriority));
    this.sniffOrder = List.copyOf(ordered);
  }

  @Override
  public Optional<DocumentExtractor> select(Path path) {
    Objects.requireNonNull(path, "path");
    Path fileName = path.getFileName();
    String extension = fileName == null ? "" : FileMetadataReader.extension(fileName.toString());
    ExtractorModule byName = byExtension.get(extension);
    if (byName != null) {
      return Optional.of(byName.extractor());
    }

    // Unknown or missing extension; sniff the content.
    SniffSample sample;
    try (InputStream in = Files.newInputStream(path)) {
      sample = SniffSample.of(in.readNBytes(SNIFF_LIMIT));
    } catch (IOException ex) {
      log.debug("Cannot sniff {}: {}", path, ex.getMessage());
      return Optional.empty();
    }
    for (ExtractorModule module : sniffOrder) {
      if (module.matchesSignature(sample)) {
        log.debug("Sniffed {} as {}", path, module.format().id());
        return Optional.of(module.extractor());
      }
    }
    return Optional.empty();
  }
}
