package ca.gc.cra.medingest.infrastructure.extract;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a date embedded in a file name.
 * <p>Patterns are tried in order: {@code YYYY-MM-DD}, {@code YYYYMMDD}, {@code MM-DD-YYYY}, then the
 * underscore variants {@code YYYY_MM_DD} and {@code MM_DD_YYYY}. Month and day may have one or two digits in
 * the separated forms. A match that is not a real calendar date is skipped.</p>
 *
 * @since 0.1.0
 */
public final class FilenameDates {
  private static final List<DatePattern> PATTERNS = List.of(
      new DatePattern(Pattern.compile("(?<!\\d)(\\d{4})-(\\d{1,2})-(\\d{1,2})(?!\\d)"), 1, 2, 3),
      new DatePattern(Pattern.compile("(?<!\\d)(\\d{4})(\\d{2})(\\d{2})(?!\\d)"), 1, 2, 3),
      new DatePattern(Pattern.compile("(?<!\\d)(\\d{1,2})-(\\d{1,2})-(\\d{4})(?!\\d)"), 3, 1, 2),
      new DatePattern(Pattern.compile("(?<!\\d)(\\d{4})_(\\d{1,2})_(\\d{1,2})(?!\\d)"), 1, 2, 3),
      new DatePattern(Pattern.compile("(?<!\\d)(\\d{1,2})_(\\d{1,2})_(\\d{4})(?!\\d)"), 3, 1, 2));

  private FilenameDates() {
    // Utility
  }

  /**
   * Extracts the first recognizable date from a file name.
   *
   * @param fileName file name, with or without extension
   * @return ISO-8601 date, or empty when no pattern yields a valid date
   */
  public static Optional<String> parse(String fileName) {
    if (fileName == null || fileName.isEmpty()) {
      return Optional.empty();
    }
    for (DatePattern pattern : PATTERNS) {
      Matcher matcher = pattern.regex().matcher(fileName);
      while (matcher.find()) {
        Optional<String> date = toIso(
            matcher.group(pattern.yearGroup()),
            matcher.group(pattern.monthGroup()),
            matcher.group(pattern.dayGroup()));
        if (date.isPresent()) {
          return date;
        }
      }
    }
    return Optional.empty();
  }

  private static Optional<String> toIso(String year, String month, String day) {
    try {
      return Optional.of(
          LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day)).toString());
    } catch (DateTimeException | NumberFormatException ex) {
      return Optional.empty();
    }
  }

  private record DatePattern(Pattern regex, int yearGroup, int monthGroup, int dayGroup) {}
}
