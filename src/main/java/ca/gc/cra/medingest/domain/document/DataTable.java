package ca.gc.cra.medingest.domain.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table extracted from tabular, markup or word-processor sources as a list of row maps keyed by header.
 *
 * @param headers column headers in source order
 * @param rows rows keyed by header, preserving column order
 * @since 0.1.0
 */
public record DataTable(List<String> headers, List<Map<String, String>> rows) {
  public DataTable {
    headers = headers == null ? List.of() : List.copyOf(headers);
    List<Map<String, String>> copy = new ArrayList<>();
    if (rows != null) {
      for (Map<String, String> row : rows) {
        copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
      }
    }
    rows = List.copyOf(copy);
  }

  /**
   * Builds a table from a header row and raw cell rows, padding short rows with empty strings.
   *
   * @param headers header cells
   * @param cells data rows as cell lists
   * @return table keyed by header
   */
  public static DataTable of(List<String> headers, List<List<String>> cells) {
    List<String> names = new ArrayList<>();
    for (int i = 0; i < headers.size(); i++) {
      String header = headers.get(i) == null ? "" : headers.get(i).trim();
      names.add(header.isEmpty() ? "column_" + (i + 1) : header);
    }
    List<Map<String, String>> rows = new ArrayList<>();
    for (List<String> row : cells) {
      Map<String, String> mapped = new LinkedHashMap<>();
      for (int i = 0; i < names.size(); i++) {
        String value = i < row.size() && row.get(i) != null ? row.get(i).trim() : "";
        mapped.put(names.get(i), value);
      }
      rows.add(mapped);
    }
    return new DataTable(names, rows);
  }

  /**
   * Indicates whether the table has no data rows.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return rows.isEmpty();
  }
}
