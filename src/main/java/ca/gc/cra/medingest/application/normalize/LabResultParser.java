package ca.gc.cra.medingest.application.normalize;

import ca.gc.cra.medingest.domain.document.DataTable;
import ca.gc.cra.medingest.domain.entity.LabResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Parses laboratory values from text lines and tables and flags abnormal results.
 * <p><strong>Role:</strong> Lab stage of the entity normalizer.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Recognize {@code <test>: <value> <unit> (Reference Range: <range>)} lines, range clause optional.</li>
 *   <li>Read tables whose headers name a test column and a value column.</li>
 *   <li>Canonicalize test names and units through {@link LabVocabulary}, keeping the original on a miss.</li>
 *   <li>Derive the abnormal flag once, from the reference range.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class LabResultParser {
  private static final Pattern LINE = Pattern.compile(
      "^\\s*[-*•]?\\s*([A-Za-z][A-Za-z0-9 ,/()+\\-]*?)\\s*:\\s*"
          + "([-+]?\\d+(?:\\.\\d+)?)(?![\\d/.\\-])\\s*"
          + "([^\\s(]+)?"
          + "\\s*(?:\\(\\s*(?:(?:reference|ref\\.?|normal)\\s*(?:range)?\\s*:?\\s*)?([^)]*)\\))?",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern RANGE = Pattern.compile("([\\d.]+)\\s*-\\s*([\\d.]+)");
  private static final String UNIT_TAIL = "(?:\\s*[A-Za-z%/\u00b5\u03bc].*)?";
  private static final Pattern BOUND = Pattern.compile("^([<>])(=?)\\s*([\\d.]+)" + UNIT_TAIL + "$");
  private static final Pattern SINGLE = Pattern.compile("^([\\d.]+)" + UNIT_TAIL + "$");
  private static final Pattern CLEAN_TOKENS = Pattern.compile("test|level");

  private static final List<String> TEST_COLUMNS = List.of("test", "test name", "analyte", "component", "name");
  private static final List<String> VALUE_COLUMNS = List.of("value", "result", "results");
  private static final List<String> UNIT_COLUMNS = List.of("unit", "units");
  private static final List<String> RANGE_COLUMNS =
      List.of("reference range", "reference", "ref range", "range", "normal range");

  /**
   * Parses lab lines from free text.
   * <p>A line is accepted when its unit or test name is known, or when it carries a reference range, so
   * lines such as {@code Visit: 3 days} are not mistaken for lab values.</p>
   *
   * @param text document text
   * @return lab results in order of appearance
   */
  public List<LabResult> parseText(String text) {
    List<LabResult> results = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return results;
    }
    for (String line : text.split("\\R")) {
      Matcher matcher = LINE.matcher(line);
      if (!matcher.find()) {
        continue;
      }
      String rawName = matcher.group(1).trim();
      String rawUnit = matcher.group(3) == null ? "" : matcher.group(3).trim();
      String range = matcher.group(4) == null ? "" : matcher.group(4).trim();
      boolean knownUnit = !rawUnit.isEmpty() && LabVocabulary.UNITS.containsKey(rawUnit.toLowerCase(Locale.ROOT));
      boolean knownName = canonicalTestName(rawName).isPresent();
      if (!knownUnit && !knownName && range.isEmpty()) {
        continue;
      }
      parseValue(matcher.group(2))
          .ifPresent(value -> results.add(create(rawName, value, rawUnit, range)));
    }
    return results;
  }

  /**
   * Parses lab rows from a table whose headers include a test column and a value column.
   *
   * @param table extracted table
   * @return lab results in row order; empty when the headers do not look like a lab table
   */
  public List<LabResult> parseTable(DataTable table) {
    List<LabResult> results = new ArrayList<>();
    Optional<String> testColumn = column(table.headers(), TEST_COLUMNS);
    Optional<String> valueColumn = column(table.headers(), VALUE_COLUMNS);
    if (testColumn.isEmpty() || valueColumn.isEmpty()) {
      return results;
    }
    Optional<String> unitColumn = column(table.headers(), UNIT_COLUMNS);
    Optional<String> rangeColumn = column(table.headers(), RANGE_COLUMNS);
    for (Map<String, String> row : table.rows()) {
      String rawName = row.getOrDefault(testColumn.get(), "").trim();
      if (rawName.isEmpty()) {
        continue;
      }
      String unit = unitColumn.map(c -> row.getOrDefault(c, "")).orElse("").trim();
      String range = rangeColumn.map(c -> row.getOrDefault(c, "")).orElse("").trim();
      parseValue(row.getOrDefault(valueColumn.get(), ""))
          .ifPresent(value -> results.add(create(rawName, value, unit, range)));
    }
    return results;
  }

  /**
   * Builds a lab result with canonical name and unit and a derived abnormal flag.
   *
   * @param rawName test name as written
   * @param value numeric value
   * @param rawUnit unit as written; may be empty
   * @param referenceRange range text; may be empty
   * @return lab result
   */
  public LabResult create(String rawName, double value, String rawUnit, String referenceRange) {
    String range = referenceRange == null ? "" : referenceRange.trim();
    return new LabResult(
        rawName,
        canonicalTestName(rawName).orElse(rawName),
        value,
        canonicalUnit(rawUnit),
        range,
        isAbnormal(value, range));
  }

  /**
   * Decides whether a value lies outside a reference range.
   * <ul>
   *   <li>{@code a-b}: abnormal when {@code value < a} or {@code value > b}</li>
   *   <li>{@code >t}: abnormal when {@code value <= t}; {@code >=t}: when {@code value < t}</li>
   *   <li>{@code <t}: abnormal when {@code value >= t}; {@code <=t}: when {@code value > t}</li>
   *   <li>{@code t}: abnormal when {@code value != t}</li>
   *   <li>anything else is not abnormal</li>
   * </ul>
   *
   * @param value measured value
   * @param range reference range text; may be {@code null}
   * @return {@code true} only when the range parses and excludes the value
   */
  public static boolean isAbnormal(double value, String range) {
    if (range == null) {
      return false;
    }
    String trimmed = range.trim().replace('≥', '>').replace('≤', '<');
    if (trimmed.isEmpty()) {
      return false;
    }
    try {
      Matcher bound = BOUND.matcher(trimmed);
      if (bound.matches()) {
        double threshold = Double.parseDouble(bound.group(3));
        boolean inclusive = !bound.group(2).isEmpty();
        if (">".equals(bound.group(1))) {
          return inclusive ? value < threshold : value <= threshold;
        }
        return inclusive ? value > threshold : value >= threshold;
      }
      Matcher interval = RANGE.matcher(trimmed);
      if (interval.find()) {
        double low = Double.parseDouble(interval.group(1));
        double high = Double.parseDouble(interval.group(2));
        return value < low || value > high;
      }
      Matcher single = SINGLE.matcher(trimmed);
      if (single.matches()) {
        return value != Double.parseDouble(single.group(1));
      }
    } catch (NumberFormatException ex) {
      return false;
    }
    return false;
  }

  /**
   * Looks up the canonical test name.
   *
   * @param rawName test name as written
   * @return canonical name, or empty when not in the table
   */
  public static Optional<String> canonicalTestName(String rawName) {
    if (rawName == null) {
      return Optional.empty();
    }
    String cleaned = CLEAN_TOKENS.matcher(rawName.toLowerCase(Locale.ROOT)).replaceAll("")
        .replaceAll("\\s+", " ")
        .trim();
    if (cleaned.isEmpty()) {
      return Optional.empty();
    }
    for (Map.Entry<String, String> entry : LabVocabulary.TEST_NAMES.entrySet()) {
      String key = entry.getKey();
      if (cleaned.equals(key) || cleaned.startsWith(key + " ") || cleaned.endsWith(" " + key)) {
        return Optional.of(entry.getValue());
      }
    }
    return Optional.empty();
  }

  /**
   * Canonicalizes a unit, keeping the original when unknown.
   *
   * @param rawUnit unit as written; may be {@code null}
   * @return canonical unit, original unit, or empty string
   */
  public static String canonicalUnit(String rawUnit) {
    if (rawUnit == null || rawUnit.isBlank()) {
      return "";
    }
    String trimmed = rawUnit.trim();
    return LabVocabulary.UNITS.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);
  }

  private static Optional<Double> parseValue(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Double.parseDouble(raw.trim()));
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
  }

  private static Optional<String> column(List<String> headers, List<String> candidates) {
    for (String candidate : candidates) {
      for (String header : headers) {
        if (header.trim().toLowerCase(Locale.ROOT).equals(candidate)) {
          return Optional.of(header);
        }
      }
    }
    return Optional.empty();
  }
}
