package ca.gc.cra.medingest.infrastructure.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class FilenameDatesTest {

  @Test
  void isoDashedDateIsRecognized() {
    assertEquals(Optional.of("2023-04-15"), FilenameDates.parse("lab_2023-04-15.pdf"));
  }

  @Test
  void compactDateIsRecognized() {
    assertEquals(Optional.of("2023-04-15"), FilenameDates.parse("visit20230415.txt"));
  }

  @Test
  void monthFirstDateIsRecognized() {
    assertEquals(Optional.of("2023-04-15"), FilenameDates.parse("note_04-15-2023.md"));
  }

  @Test
  void underscoreSeparatedDatesAreRecognized() {
    assertEquals(Optional.of("2022-11-03"), FilenameDates.parse("xray_2022_11_03.pdf"));
    assertEquals(Optional.of("2022-11-03"), FilenameDates.parse("xray_11_03_2022.pdf"));
  }

  @Test
  void impossibleCalendarDatesAreIgnored() {
    assertTrue(FilenameDates.parse("report_2023-02-30.pdf").isEmpty());
    assertTrue(FilenameDates.parse("scan_20231341.pdf").isEmpty());
  }

  @Test
  void laterCandidateIsUsedWhenFirstIsInvalid() {
    assertEquals(Optional.of("2021-06-01"), FilenameDates.parse("2021-13-01_then_2021-06-01.txt"));
  }

  @Test
  void namesWithoutDatesYieldEmpty() {
    assertTrue(FilenameDates.parse("history.txt").isEmpty());
    assertTrue(FilenameDates.parse("").isEmpty());
    assertTrue(FilenameDates.parse(null).isEmpty());
  }
}
