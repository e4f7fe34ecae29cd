package ca.gc.cra.medingest.infrastructure.extract;

import ca.gc.cra.medingest.domain.document.DocumentFormat;
import ca.gc.cra.medingest.domain.document.StructuredContent;
import java.util.List;
import java.util.Map;

/**
 * Extracts plain text files. Sections come from clinical headings and ALL-CAPS lines.
 *
 * @since 0.1.0
 */
public final class PlainTextExtractor extends AbstractTextExtractor {
  public PlainTextExtractor(FileMetadataReader metadataReader, TextDecoder decoder) {
    super(metadataReader, decoder);
  }

  @Override
  public DocumentFormat format() {
    return DocumentFormat.TEXT;
  }

  @Override
  protected AttemptResult parseText(TextDecoder.Decoded decoded) {
    String text = decoded.text();
    if (text.isBlank()) {
      return AttemptResult.failure("file is empty");
    }
    StructuredContent structured = new StructuredContent(
        ContentMiner.sections(text), List.of(), List.of(), List.of(),
        Map.of("charset", decoded.charset().name()));
    return AttemptResult.success(text, 1.0, structured);
  }
}
