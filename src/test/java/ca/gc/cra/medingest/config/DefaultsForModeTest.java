package ca.gc.cra.medingest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void ingestDefaultsLeaveInputUnset() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("ingest");

    assertFalse(defaults.containsKey("in"));
    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals("256", defaults.get("embeddingDimension"));
    assertEquals("true", defaults.get("recursive"));
    assertEquals("false", defaults.get("skipFailed"));
    assertEquals(".txt,.csv,.md,.html,.htm,.rtf,.docx,.doc,.pdf", defaults.get("extensions"));
  }

  @Test
  void searchDefaultsLeaveQueryUnset() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" SEARCH ");

    assertFalse(defaults.containsKey("query"));
    assertEquals("5", defaults.get("topK"));
    assertEquals(IngestConfig.defaults().effectiveVectorDirectory().toString(), defaults.get("vectorDir"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
