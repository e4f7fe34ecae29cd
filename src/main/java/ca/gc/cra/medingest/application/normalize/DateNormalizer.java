package ca.gc.cra.medingest.application.normalize;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Converts free-form date strings to ISO-8601 using a fixed, ordered list of formats.
 * <p><strong>Role:</strong> Date stage of the entity normalizer; also used for filename and content dates.</p>
 * <p><strong>Thread-safety:</strong> Stateless; formatters are immutable.</p>
 * <p>The first format that parses wins, so {@code 01/02/2023} is read month-first. Two-digit years above 50
 * resolve to the 1900s. Strings no format accepts are dropped.</p>
 *
 * @since 0.1.0
 */
public final class DateNormalizer {
  private static final List<DateTimeFormatter> FORMATS = List.of(
      strict("uuuu-M-d"),
      strict("M/d/uuuu"),
      strict("d/M/uuuu"),
      strict("M-d-uuuu"),
      strict("d-M-uuuu"),
      strict("uuuu/M/d"),
      strict("MMM d, uuuu"),
      strict("d MMM uuuu"),
      strict("MMMM d, uuuu"),
      strict("d MMMM uuuu"),
      twoDigitYear("M/d/"),
      twoDigitYear("d/M/"));

  /**
   * Parses one date string.
   *
   * @param raw candidate such as {@code 04/15/2023} or {@code Jan 5, 2023}; may be {@code null}
   * @return ISO-8601 date, or empty when no format matched
   */
  public Optional<String> normalize(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String candidate = raw.trim().replaceAll("\\s+", " ");
    if (candidate.isEmpty()) {
      return Optional.empty();
    }
    for (DateTimeFormatter format : FORMATS) {
      try {
        return Optional.of(LocalDate.parse(candidate, format).toString());
      } catch (DateTimeException ignored) {
        // try the next format
      }
    }
    return Optional.empty();
  }

  /**
   * Normalizes a collection of candidates into a sorted list without duplicates.
   *
   * @param raws candidate strings in any order
   * @return ISO dates, ascending
   */
  public List<String> normalizeAll(Collection<String> raws) {
    TreeSet<String> dates = new TreeSet<>();
    for (String raw : raws) {
      normalize(raw).ifPresent(dates::add);
    }
    return new ArrayList<>(dates);
  }

  private static DateTimeFormatter strict(String pattern) {
    return new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern(pattern)
        .toFormatter(Locale.ENGLISH)
        .withResolverStyle(ResolverStyle.STRICT);
  }

  private static DateTimeFormatter twoDigitYear(String prefix) {
    return new DateTimeFormatterBuilder()
        .appendPattern(prefix)
        .appendValueReduced(ChronoField.YEAR, 2, 2, 1951)
        .toFormatter(Locale.ENGLISH)
        .withResolverStyle(ResolverStyle.STRICT);
  }
}
