package ca.gc.cra.medingest.infrastructure.extract;

import ca.gc.cra.medingest.domain.document.DataTable;
import ca.gc.cra.medingest.domain.document.DocumentFormat;
import ca.gc.cra.medingest.domain.document.Section;
import ca.gc.cra.medingest.domain.document.StructuredContent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts HTML with jsoup: visible text, title, {@code h1}-{@code h6} sections and {@code table} rows.
 * <p>When jsoup yields no text the markup is stripped with regular expressions and confidence is capped at
 * {@value AttemptChain#FALLBACK_CAP}.</p>
 *
 * @since 0.1.0
 */
public final class HtmlExtractor extends AbstractTextExtractor {
  private static final Logger log = LoggerFactory.getLogger(HtmlExtractor.class);
  private static final Pattern SCRIPT = Pattern.compile("(?is)<(script|style)[^>]*>.*?</\\1>");
  private static final String BLOCKS = "p, div, li, tr, br, h1, h2, h3, h4, h5, h6, table, section, pre";
  private static final Pattern TAG = Pattern.compile("(?s)<[^>]+>");

  public HtmlExtractor(FileMetadataReader metadataReader, TextDecoder decoder) {
    super(metadataReader, decoder);
  }

  @Override
  public DocumentFormat format() {
    return DocumentFormat.HTML;
  }

  @Override
  protected AttemptResult parseText(TextDecoder.Decoded decoded) {
    String html = decoded.text();
    try {
      AttemptResult primary = parseWithJsoup(html);
      if (primary.success()) {
        return primary;
      }
    } catch (RuntimeException ex) {
      log.debug("jsoup could not parse document: {}", ex.getMessage());
    }
    String stripped = stripTags(html);
    if (stripped.isBlank()) {
      return AttemptResult.failure("no text content");
    }
    return AttemptResult.success(stripped, AttemptChain.FALLBACK_CAP, StructuredContent.empty());
  }

  private static AttemptResult parseWithJsoup(String html) {
    Document document = Jsoup.parse(html);
    String text = document.body() == null ? "" : blockText(document.body().clone());
    text = collapseBlankLines(text);
    if (text.isBlank()) {
      return AttemptResult.failure("no text content");
    }
    List<Section> sections = new ArrayList<>();
    for (Element heading : document.select("h1, h2, h3, h4, h5, h6")) {
      sections.add(new Section(heading.text(), sectionBody(heading)));
    }
    List<DataTable> tables = new ArrayList<>();
    for (Element table : document.select("table")) {
      DataTable parsed = table(table);
      if (!parsed.headers().isEmpty()) {
        tables.add(parsed);
      }
    }
    Map<String, String> attributes = new LinkedHashMap<>();
    if (!document.title().isBlank()) {
      attributes.put("title", document.title().trim());
    }
    return AttemptResult.success(
        text, 1.0, new StructuredContent(sections, tables, List.of(), List.of(), attributes));
  }

  // Block elements end a line; cells are separated by a space.
  private static String blockText(Element body) {
    for (Element block : body.select(BLOCKS)) {
      block.after(new TextNode("\n"));
    }
    for (Element cell : body.select("td, th")) {
      cell.after(new TextNode(" "));
    }
    return body.wholeText();
  }

  private static String sectionBody(Element heading) {
    StringBuilder body = new StringBuilder();
    Element sibling = heading.nextElementSibling();
    while (sibling != null && !sibling.tagName().matches("h[1-6]")) {
      String text = sibling.text();
      if (!text.isBlank()) {
        body.append(text).append('\n');
      }
      sibling = sibling.nextElementSibling();
    }
    return body.toString().trim();
  }

  private static DataTable table(Element table) {
    Elements rows = table.select("tr");
    if (rows.isEmpty()) {
      return DataTable.of(List.of(), List.of());
    }
    List<String> headers = new ArrayList<>();
    for (Element cell : rows.get(0).select("th, td")) {
      headers.add(cell.text());
    }
    List<List<String>> body = new ArrayList<>();
    for (int i = 1; i < rows.size(); i++) {
      List<String> cells = new ArrayList<>();
      for (Element cell : rows.get(i).select("th, td")) {
        cells.add(cell.text());
      }
      body.add(cells);
    }
    return DataTable.of(headers, body);
  }

  static String stripTags(String html) {
    String withoutScripts = SCRIPT.matcher(html).replaceAll(" ");
    String text = TAG.matcher(withoutScripts).replaceAll("\n");
    text = text.replace("&nbsp;", " ").replace("&amp;", "&").replace("&lt;", "<").replace("&gt;", ">");
    return collapseBlankLines(text);
  }

  private static String collapseBlankLines(String text) {
    StringBuilder out = new StringBuilder();
    for (String line : text.split("\\R")) {
      String trimmed = line.strip();
      if (!trimmed.isEmpty()) {
        out.append(trimmed).append('\n');
      }
    }
    return out.toString();
  }
}
