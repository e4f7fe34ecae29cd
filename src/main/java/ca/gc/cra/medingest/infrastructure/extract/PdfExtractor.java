package ca.gc.cra.medingest.infrastructure.extract;

import ca.gc.cra.medingest.domain.document.DocumentFormat;
import ca.gc.cra.medingest.domain.document.StructuredContent;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Extracts portable documents page by page with PDFBox.
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Join page text with {@value #PAGE_BREAK}; a page that cannot be read becomes an in-band marker.</li>
 *   <li>Report confidence as the share of pages that produced text.</li>
 *   <li>Fall back to a single whole-document pass, capped at {@value AttemptChain#FALLBACK_CAP}.</li>
 *   <li>Mark documents that cannot be loaded at all as a syntax error.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each call opens its own {@link PDDocument}.</p>
 *
 * @since 0.1.0
 */
public final class PdfExtractor extends AbstractDocumentExtractor {
  private static final Logger log = LoggerFactory.getLogger(PdfExtractor.class);

  /** Separator placed between pages. */
  public static final String PAGE_BREAK = "\n===== PAGE BREAK =====\n";
  static final String SYNTAX_ERROR_MARKER = "[PDF syntax error - possibly corrupted or encrypted file]";
  private static final String LOAD_FAILED = "LOAD_FAILED";

  private final AttemptChain chain = AttemptChain.primary("pdfbox-pages", PdfExtractor::parsePages)
      .then("pdfbox-document", PdfExtractor::parseWhole)
      .build();

  public PdfExtractor(FileMetadataReader metadataReader) {
    super(metadataReader);
  }

  @Override
  public DocumentFormat format() {
    return DocumentFormat.PDF;
  }

  @Override
  protected AttemptResult parse(Path path) {
    return chain.run(path);
  }

  @Override
  protected String failureMarker(AttemptResult result) {
    if (result.failure() != null && result.failure().contains(LOAD_FAILED)) {
      return SYNTAX_ERROR_MARKER;
    }
    return super.failureMarker(result);
  }

  private static AttemptResult parsePages(Path path) {
    PDDocument document;
    try {
      document = PDDocument.load(path.toFile());
    } catch (IOException ex) {
      return AttemptResult.failure(LOAD_FAILED + ": " + ex.getMessage());
    }
    try (document) {
      int pages = document.getNumberOfPages();
      if (pages == 0) {
        return AttemptResult.failure("document has no pages");
      }
      StringBuilder text = new StringBuilder();
      int extracted = 0;
      for (int page = 1; page <= pages; page++) {
        if (page > 1) {
          text.append(PAGE_BREAK);
        }
        try {
          PDFTextStripper stripper = new PDFTextStripper();
          stripper.setStartPage(page);
          stripper.setEndPage(page);
          text.append(stripper.getText(document).strip());
          extracted++;
        } catch (IOException | RuntimeException ex) {
          log.debug("PDF page {} of {} unreadable: {}", page, path, ex.getMessage());
          text.append("[Failed to extract text from page ").append(page).append(']');
        }
      }
      if (extracted == 0) {
        return AttemptResult.failure("no readable pages");
      }
      return AttemptResult.success(text.toString(), (double) extracted / pages, structure(pages, extracted));
    } catch (IOException ex) {
      return AttemptResult.failure("close failed: " + ex.getMessage());
    }
  }

  private static AttemptResult parseWhole(Path path) throws IOException {
    PDDocument document;
    try {
      document = PDDocument.load(path.toFile());
    } catch (IOException ex) {
      return AttemptResult.failure(LOAD_FAILED + ": " + ex.getMessage());
    }
    try (document) {
      int pages = document.getNumberOfPages();
      String text = new PDFTextStripper().getText(document);
      return AttemptResult.success(text, 1.0, structure(pages, pages));
    }
  }

  private static StructuredContent structure(int pages, int extracted) {
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("page_count", Integer.toString(pages));
    attributes.put("pages_extracted", Integer.toString(extracted));
    return new StructuredContent(null, null, null, null, attributes);
  }
}
