package ca.gc.cra.medingest.infrastructure.extract;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Base for text formats: reads the file, decodes it with one fallback charset, then parses the text.
 * <p>Read errors and undecodable input become failed results with confidence {@code 0}.</p>
 *
 * @since 0.1.0
 */
public abstract class AbstractTextExtractor extends AbstractDocumentExtractor {
  private final TextDecoder decoder;

  protected AbstractTextExtractor(FileMetadataReader metadataReader, TextDecoder decoder) {
    super(metadataReader);
    this.decoder = Objects.requireNonNull(decoder, "decoder");
  }

  @Override
  protected final AttemptResult parse(Path path) {
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(path);
    } catch (IOException ex) {
      return AttemptResult.failure("read failed: " + ex.getMessage());
    }
    Optional<TextDecoder.Decoded> decoded = decoder.decode(bytes);
    if (decoded.isEmpty()) {
      return new AttemptResult(false, "", 0.0, null, "ENCODING");
    }
    return parseText(decoded.get());
  }

  @Override
  protected String failureMarker(AttemptResult result) {
    if ("ENCODING".equals(result.failure())) {
      return marker("Encoding error: " + format().id() + " content could not be decoded");
    }
    return super.failureMarker(result);
  }

  /**
   * Parses decoded text.
   *
   * @param decoded text and the charset that produced it
   * @return parse outcome
   */
  protected abstract AttemptResult parseText(TextDecoder.Decoded decoded);
}
