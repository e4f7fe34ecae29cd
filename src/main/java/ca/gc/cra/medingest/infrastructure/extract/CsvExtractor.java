package ca.gc.cra.medingest.infrastructure.extract;

import ca.gc.cra.medingest.domain.document.DataTable;
import ca.gc.cra.medingest.domain.document.DocumentFormat;
import ca.gc.cra.medingest.domain.document.StructuredContent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Extracts comma-delimited tables.
 * <p>The first record is the header row unless every cell in it is numeric, in which case columns are named
 * {@code column_N}. Quoted fields may contain commas, doubled quotes and line breaks. Column roles
 * (symptom, date, provider, severity) and a {@code data_type} are recorded as attributes.</p>
 *
 * @since 0.1.0
 */
public final class CsvExtractor extends AbstractTextExtractor {
  static final List<String> SYMPTOM_COLUMNS = List.of("symptom", "symptoms", "condition", "diagnosis", "issue");
  static final List<String> DATE_COLUMNS = List.of("date", "day", "visit_date", "appointment", "test_date");
  static final List<String> PROVIDER_COLUMNS =
      List.of("doctor", "provider", "physician", "specialist", "clinician");
  static final List<String> SEVERITY_COLUMNS = List.of("severity", "intensity", "pain_level", "scale", "rating");

  public CsvExtractor(FileMetadataReader metadataReader, TextDecoder decoder) {
    super(metadataReader, decoder);
  }

  @Override
  public DocumentFormat format() {
    return DocumentFormat.CSV;
  }

  @Override
  protected AttemptResult parseText(TextDecoder.Decoded decoded) {
    List<List<String>> records = parseRecords(decoded.text());
    records.removeIf(CsvExtractor::isBlankRecord);
    if (records.isEmpty()) {
      return AttemptResult.failure("file is empty");
    }
    List<String> first = records.get(0);
    boolean hasHeader = !first.stream().allMatch(CsvExtractor::isNumeric);
    List<String> headers = hasHeader ? first : new ArrayList<>();
    if (!hasHeader) {
      for (int i = 0; i < first.size(); i++) {
        headers.add("");
      }
    }
    List<List<String>> body = records.subList(hasHeader ? 1 : 0, records.size());
    DataTable table = DataTable.of(headers, body);

    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("charset", decoded.charset().name());
    attributes.put("columns", String.join(",", table.headers()));
    attributes.put("row_count", Integer.toString(table.rows().size()));
    attributes.put("data_type", dataType(table.headers()));
    putRole(attributes, "symptom_columns", table.headers(), SYMPTOM_COLUMNS);
    putRole(attributes, "date_columns", table.headers(), DATE_COLUMNS);
    putRole(attributes, "provider_columns", table.headers(), PROVIDER_COLUMNS);
    putRole(attributes, "severity_columns", table.headers(), SEVERITY_COLUMNS);

    StructuredContent structured =
        new StructuredContent(List.of(), List.of(table), List.of(), List.of(), attributes);
    return AttemptResult.success(render(table), 1.0, structured);
  }

  static String dataType(List<String> headers) {
    String joined = String.join(" ", headers).toLowerCase(Locale.ROOT);
    for (String header : headers) {
      if (SYMPTOM_COLUMNS.contains(header.toLowerCase(Locale.ROOT))) {
        return "symptom_tracking";
      }
    }
    if (joined.contains("test") && joined.contains("result")) {
      return "lab_results";
    }
    for (String header : headers) {
      if (DATE_COLUMNS.contains(header.toLowerCase(Locale.ROOT))) {
        return "medical_timeline";
      }
    }
    return "unknown";
  }

  /**
   * Splits CSV text into records.
   *
   * @param text CSV text
   * @return records as cell lists
   */
  static List<List<String>> parseRecords(String text) {
    List<List<String>> records = new ArrayList<>();
    List<String> record = new ArrayList<>();
    StringBuilder cell = new StringBuilder();
    boolean quoted = false;
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (quoted) {
        if (c == '"') {
          if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
            cell.append('"');
            i++;
          } else {
            quoted = false;
          }
        } else {
          cell.append(c);
        }
      } else if (c == '"' && cell.length() == 0) {
        quoted = true;
      } else if (c == ',') {
        record.add(cell.toString());
        cell.setLength(0);
      } else if (c == '\n' || c == '\r') {
        if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
          i++;
        }
        record.add(cell.toString());
        cell.setLength(0);
        records.add(record);
        record = new ArrayList<>();
      } else {
        cell.append(c);
      }
      i++;
    }
    if (cell.length() > 0 || !record.isEmpty()) {
      record.add(cell.toString());
      records.add(record);
    }
    return records;
  }

  private static String render(DataTable table) {
    StringBuilder out = new StringBuilder(String.join(", ", table.headers())).append('\n');
    for (Map<String, String> row : table.rows()) {
      List<String> parts = new ArrayList<>();
      row.forEach((header, value) -> {
        if (!value.isEmpty()) {
          parts.add(header + ": " + value);
        }
      });
      out.append(String.join("; ", parts)).append('\n');
    }
    return out.toString();
  }

  private static void putRole(Map<String, String> attributes, String key, List<String> headers,
      List<String> hints) {
    List<String> matched = new ArrayList<>();
    for (String header : headers) {
      String lower = header.toLowerCase(Locale.ROOT);
      for (String hint : hints) {
        if (lower.contains(hint)) {
          matched.add(header);
          break;
        }
      }
    }
    if (!matched.isEmpty()) {
      attributes.put(key, String.join(",", matched));
    }
  }

  private static boolean isBlankRecord(List<String> record) {
    return record.stream().allMatch(String::isBlank);
  }

  private static boolean isNumeric(String cell) {
    return cell.trim().matches("[-+]?\\d+(?:\\.\\d+)?");
  }
}
