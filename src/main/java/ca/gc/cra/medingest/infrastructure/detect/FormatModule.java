package ca.gc.cra.medingest.infrastructure.detect;

import ca.gc.cra.medingest.application.port.DocumentExtractor;
import ca.gc.cra.medingest.application.port.ExtractorModule;
import ca.gc.cra.medingest.application.port.SniffSample;
import ca.gc.cra.medingest.domain.document.DocumentFormat;
import ca.gc.cra.medingest.infrastructure.extract.CsvExtractor;
import ca.gc.cra.medingest.infrastructure.extract.DocxExtractor;
import ca.gc.cra.medingest.infrastructure.extract.FileMetadataReader;
import ca.gc.cra.medingest.infrastructure.extract.HtmlExtractor;
import ca.gc.cra.medingest.infrastructure.extract.MarkdownExtractor;
import ca.gc.cra.medingest.infrastructure.extract.PdfExtractor;
import ca.gc.cra.medingest.infrastructure.extract.PlainTextExtractor;
import ca.gc.cra.medingest.infrastructure.extract.RtfExtractor;
import ca.gc.cra.medingest.infrastructure.extract.TextDecoder;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * {@link ExtractorModule} binding one format to its extensions, signature check and extractor.
 *
 * @since 0.1.0
 */
public final class FormatModule implements ExtractorModule {
  private final DocumentFormat format;
  private final Set<String> extensions;
  private final int sniffPriority;
  private final Predicate<SniffSample> signature;
  private final DocumentExtractor extractor;

  FormatModule(
      DocumentFormat format,
      Set<String> extensions,
      int sniffPriority,
      Predicate<SniffSample> signature,
      DocumentExtractor extractor) {
    this.format = Objects.requireNonNull(format, "format");
    this.extensions = Set.copyOf(Objects.requireNonNull(extensions, "extensions"));
    this.sniffPriority = sniffPriority;
    this.signature = Objects.requireNonNull(signature, "signature");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
  }

  /**
   * Builds the module for every supported format. Binary signatures sniff before text heuristics and plain
   * text sniffs last.
   *
   * @param metadataReader metadata reader shared by the extractors
   * @param decoder text decoder shared by the text extractors
   * @return modules in sniff order
   */
  public static List<ExtractorModule> standardModules(FileMetadataReader metadataReader, TextDecoder decoder) {
    return List.of(
        new FormatModule(DocumentFormat.PDF, Set.of(".pdf"), 10,
            FormatSignatures::looksLikePdf, new PdfExtractor(metadataReader)),
        new FormatModule(DocumentFormat.RTF, Set.of(".rtf"), 20,
            FormatSignatures::looksLikeRtf, new RtfExtractor(metadataReader)),
        new FormatModule(DocumentFormat.DOCX, Set.of(".docx", ".doc"), 30,
            FormatSignatures::looksLikeWordContainer, new DocxExtractor(metadataReader)),
        new FormatModule(DocumentFormat.HTML, Set.of(".html", ".htm"), 40,
            FormatSignatures::looksLikeHtml, new HtmlExtractor(metadataReader, decoder)),
        new FormatModule(DocumentFormat.CSV, Set.of(".csv"), 50,
            FormatSignatures::looksLikeCsv, new CsvExtractor(metadataReader, decoder)),
        new FormatModule(DocumentFormat.MARKDOWN, Set.of(".md", ".markdown"), 60,
            FormatSignatures::looksLikeMarkdown, new MarkdownExtractor(metadataReader, decoder)),
        new FormatModule(DocumentFormat.TEXT, Set.of(".txt"), 100,
            FormatSignatures::looksLikeText, new PlainTextExtractor(metadataReader, decoder)));
  }

  @Override
  public DocumentFormat format() {
    return format;
  }

  @Override
  public Set<String> extensions() {
    return extensions;
  }

  @Override
  public int sniffPriority() {
    return sniffPriority;
  }

  @Override
  public boolean matchesSignature(SniffSample sample) {
    return sample != null && signature.test(sample);
  }

  @Override
  public DocumentExtractor extractor() {
    return extractor;
  }
}
