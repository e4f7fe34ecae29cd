package ca.gc.cra.medingest.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("asthma", Strings.requireNonBlank("query", "  asthma "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("query", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("query", "a\tb"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("query", null));
  }

  @Test
  void parseBooleanAcceptsCommonSpellings() {
    assertTrue(Strings.parseBoolean("dryRun", "YES"));
    assertTrue(Strings.parseBoolean("dryRun", "1"));
    assertFalse(Strings.parseBoolean("dryRun", "false"));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.parseBoolean("dryRun", "maybe"));
    assertEquals("dryRun must be true or false (was maybe)", ex.getMessage());
  }

  @Test
  void printableAsciiIsBounded() {
    assertEquals("env=dev", Strings.requirePrintableAscii("attrs", "env=dev", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "env=dév", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "0123456789", 4));
  }
}
