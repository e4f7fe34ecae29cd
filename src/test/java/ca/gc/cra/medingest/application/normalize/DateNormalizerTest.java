package ca.gc.cra.medingest.application.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DateNormalizerTest {
  private final DateNormalizer normalizer = new DateNormalizer();

  @Test
  void commonFormatsBecomeIso() {
    assertEquals(Optional.of("2023-03-14"), normalizer.normalize("2023-03-14"));
    assertEquals(Optional.of("2023-03-14"), normalizer.normalize("3/14/2023"));
    assertEquals(Optional.of("2023-03-14"), normalizer.normalize("Mar 14, 2023"));
    assertEquals(Optional.of("2023-03-14"), normalizer.normalize("14 March 2023"));
  }

  @Test
  void monthFirstWinsWhenBothReadingsAreValid() {
    assertEquals(Optional.of("2023-02-03"), normalizer.normalize("02/03/2023"));
    assertEquals(Optional.of("2023-03-25"), normalizer.normalize("25/03/2023"));
  }

  @Test
  void twoDigitYearsPivotAt1951() {
    assertEquals(Optional.of("2024-01-05"), normalizer.normalize("1/5/24"));
    assertEquals(Optional.of("1960-01-05"), normalizer.normalize("1/5/60"));
  }

  @Test
  void invalidTextIsDropped() {
    assertTrue(normalizer.normalize("13/13/2023").isEmpty());
    assertTrue(normalizer.normalize("soon").isEmpty());
    assertTrue(normalizer.normalize(null).isEmpty());
  }

  @Test
  void normalizeAllSortsAndDeduplicates() {
    assertEquals(List.of("2022-12-31", "2023-03-14"),
        normalizer.normalizeAll(List.of("3/14/2023", "junk", "2022-12-31", "2023-03-14")));
  }
}
