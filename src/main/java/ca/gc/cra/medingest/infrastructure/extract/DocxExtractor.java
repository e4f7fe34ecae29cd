package ca.gc.cra.medingest.infrastructure.extract;

import ca.gc.cra.medingest.domain.document.DataTable;
import ca.gc.cra.medingest.domain.document.DocumentFormat;
import ca.gc.cra.medingest.domain.document.Section;
import ca.gc.cra.medingest.domain.document.StructuredContent;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;

/**
 * Extracts OOXML word-processor documents.
 * <p>The primary parser is Apache POI: paragraphs in body order, {@code Heading*} and {@code Title} styles as
 * sections, tables as row maps keyed by the first row. The fallback reads {@code word/document.xml} from the
 * zip container and keeps text runs only; its confidence is capped at {@value AttemptChain#FALLBACK_CAP}.</p>
 *
 * @since 0.1.0
 */
public final class DocxExtractor extends AbstractDocumentExtractor {
  private static final Pattern PARAGRAPH = Pattern.compile("(?s)<w:p[ >].*?</w:p>");
  private static final Pattern TEXT_RUN = Pattern.compile("(?s)<w:t(?: [^>]*)?>(.*?)</w:t>");

  private final AttemptChain chain = AttemptChain.primary("poi-xwpf", DocxExtractor::parseWithPoi)
      .then("zip-document-xml", DocxExtractor::parseDocumentXml)
      .build();

  public DocxExtractor(FileMetadataReader metadataReader) {
    super(metadataReader);
  }

  @Override
  public DocumentFormat format() {
    return DocumentFormat.DOCX;
  }

  @Override
  protected AttemptResult parse(Path path) {
    return chain.run(path);
  }

  private static AttemptResult parseWithPoi(Path path) throws Exception {
    try (InputStream in = Files.newInputStream(path); XWPFDocument document = new XWPFDocument(in)) {
      StringBuilder text = new StringBuilder();
      List<Section> sections = new ArrayList<>();
      List<DataTable> tables = new ArrayList<>();
      String title = null;
      StringBuilder body = new StringBuilder();
      for (IBodyElement element : document.getBodyElements()) {
        if (element instanceof XWPFParagraph paragraph) {
          String line = paragraph.getText();
          if (isHeading(paragraph.getStyle()) && !line.isBlank()) {
            if (title != null) {
              sections.add(new Section(title, body.toString().trim()));
            }
            title = line.trim();
            body.setLength(0);
          } else if (title != null) {
            body.append(line).append('\n');
          }
          text.append(line).append('\n');
        } else if (element instanceof XWPFTable table) {
          DataTable parsed = table(table);
          if (!parsed.headers().isEmpty()) {
            tables.add(parsed);
          }
          for (XWPFTableRow row : table.getRows()) {
            List<String> cells = new ArrayList<>();
            for (XWPFTableCell cell : row.getTableCells()) {
              cells.add(cell.getText().trim());
            }
            text.append(String.join("\t", cells)).append('\n');
          }
        }
      }
      if (title != null) {
        sections.add(new Section(title, body.toString().trim()));
      }
      StructuredContent structured = new StructuredContent(
          sections, tables, List.of(), List.of(),
          Map.of("paragraph_count", Integer.toString(document.getParagraphs().size())));
      return AttemptResult.success(text.toString(), 1.0, structured);
    }
  }

  private static AttemptResult parseDocumentXml(Path path) throws Exception {
    try (ZipInputStream zip = new ZipInputStream(Files.newInputStream(path))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        if ("word/document.xml".equals(entry.getName())) {
          String xml = new String(zip.readAllBytes(), StandardCharsets.UTF_8);
          return AttemptResult.success(textRuns(xml), 1.0, StructuredContent.empty());
        }
      }
    }
    return AttemptResult.failure("word/document.xml not found");
  }

  static String textRuns(String xml) {
    StringBuilder out = new StringBuilder();
    Matcher paragraphs = PARAGRAPH.matcher(xml);
    while (paragraphs.find()) {
      Matcher runs = TEXT_RUN.matcher(paragraphs.group());
      StringBuilder line = new StringBuilder();
      while (runs.find()) {
        line.append(unescape(runs.group(1)));
      }
      out.append(line).append('\n');
    }
    return out.toString();
  }

  private static DataTable table(XWPFTable table) {
    List<XWPFTableRow> rows = table.getRows();
    if (rows.isEmpty()) {
      return DataTable.of(List.of(), List.of());
    }
    List<String> headers = new ArrayList<>();
    for (XWPFTableCell cell : rows.get(0).getTableCells()) {
      headers.add(cell.getText());
    }
    List<List<String>> body = new ArrayList<>();
    for (int i = 1; i < rows.size(); i++) {
      List<String> cells = new ArrayList<>();
      for (XWPFTableCell cell : rows.get(i).getTableCells()) {
        cells.add(cell.getText());
      }
      body.add(cells);
    }
    return DataTable.of(headers, body);
  }

  private static boolean isHeading(String styleId) {
    return styleId != null && (styleId.startsWith("Heading") || styleId.equals("Title"));
  }

  private static String unescape(String xml) {
    return xml.replace("&lt;", "<").replace("&gt;", ">").replace("&quot;", "\"")
        .replace("&apos;", "'").replace("&amp;", "&");
  }
}
