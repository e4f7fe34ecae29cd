package ca.gc.cra.medingest.infrastructure.extract;

import ca.gc.cra.medingest.domain.document.DataTable;
import ca.gc.cra.medingest.domain.document.DocumentFormat;
import ca.gc.cra.medingest.domain.document.Section;
import ca.gc.cra.medingest.domain.document.StructuredContent;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts markdown: {@code #} headings become sections and pipe tables become row maps.
 *
 * @since 0.1.0
 */
public final class MarkdownExtractor extends AbstractTextExtractor {
  private static final Pattern HEADING = Pattern.compile("^\\s{0,3}(#{1,6})\\s+(.+?)\\s*#*\\s*$");
  private static final Pattern SEPARATOR = Pattern.compile("^\\s*\\|?\\s*:?-{3,}:?\\s*(\\|\\s*:?-{3,}:?\\s*)*\\|?\\s*$");

  public MarkdownExtractor(FileMetadataReader metadataReader, TextDecoder decoder) {
    super(metadataReader, decoder);
  }

  @Override
  public DocumentFormat format() {
    return DocumentFormat.MARKDOWN;
  }

  @Override
  protected AttemptResult parseText(TextDecoder.Decoded decoded) {
    String text = decoded.text();
    if (text.isBlank()) {
      return AttemptResult.failure("file is empty");
    }
    String[] lines = text.split("\\R", -1);
    StructuredContent structured = new StructuredContent(
        sections(lines), tables(lines), List.of(), List.of(), Map.of("charset", decoded.charset().name()));
    return AttemptResult.success(text, 1.0, structured);
  }

  static List<Section> sections(String[] lines) {
    List<Section> sections = new ArrayList<>();
    String title = null;
    StringBuilder body = new StringBuilder();
    for (String line : lines) {
      Matcher matcher = HEADING.matcher(line);
      if (matcher.matches()) {
        if (title != null) {
          sections.add(new Section(title, body.toString().trim()));
        }
        title = matcher.group(2).trim();
        body.setLength(0);
      } else if (title != null) {
        body.append(line).append('\n');
      }
    }
    if (title != null) {
      sections.add(new Section(title, body.toString().trim()));
    }
    return sections;
  }

  static List<DataTable> tables(String[] lines) {
    List<DataTable> tables = new ArrayList<>();
    int i = 0;
    while (i < lines.length - 1) {
      if (isRow(lines[i]) && SEPARATOR.matcher(lines[i + 1]).matches()) {
        List<String> headers = cells(lines[i]);
        List<List<String>> rows = new ArrayList<>();
        int j = i + 2;
        while (j < lines.length && isRow(lines[j])) {
          rows.add(cells(lines[j]));
          j++;
        }
        tables.add(DataTable.of(headers, rows));
        i = j;
      } else {
        i++;
      }
    }
    return tables;
  }

  private static boolean isRow(String line) {
    String trimmed = line.trim();
    return trimmed.startsWith("|") && trimmed.length() > 1 && trimmed.indexOf('|', 1) > 0;
  }

  private static List<String> cells(String line) {
    String trimmed = line.trim();
    if (trimmed.startsWith("|")) {
      trimmed = trimmed.substring(1);
    }
    if (trimmed.endsWith("|")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    List<String> cells = new ArrayList<>();
    for (String cell : trimmed.split("\\|", -1)) {
      cells.add(cell.trim());
    }
    return cells;
  }
}
