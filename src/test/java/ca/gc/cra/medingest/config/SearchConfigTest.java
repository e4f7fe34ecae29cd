package ca.gc.cra.medingest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SearchConfigTest {

  @Test
  void fromMapAppliesDefaults() {
    SearchConfig config = SearchConfig.fromMap(Map.of("query", "  chest pain  "));

    assertEquals("chest pain", config.query());
    assertEquals(5, config.topK());
    assertEquals(256, config.embeddingDimension());
    assertTrue(config.filter().isEmpty());
    assertTrue(config.threshold().isEmpty());
    assertTrue(config.vectorDirectory().endsWith(Path.of(".medingest", "processed_data", "vectordb")));
  }

  @Test
  void typeFilterAcceptsPluralAndDocument() {
    SearchConfig conditions = SearchConfig.fromMap(Map.of("q", "asthma", "type", "Conditions"));
    SearchConfig documents = SearchConfig.fromMap(Map.of("q", "asthma", "type", "DOCUMENT"));

    assertEquals(Map.of("entity_type", "condition"), conditions.filter());
    assertEquals(Map.of("entity_type", "document"), documents.filter());
  }

  @Test
  void thresholdAndTopKAreParsed() {
    SearchConfig config = SearchConfig.fromMap(
        Map.of("query", "fatigue", "topK", "12", "threshold", "0.25", "vectorDir", "/srv/vec"));

    assertEquals(12, config.topK());
    assertEquals(0.25, config.threshold().getAsDouble());
    assertEquals(Path.of("/srv/vec").toAbsolutePath(), config.vectorDirectory());
  }

  @Test
  void invalidOptionsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> SearchConfig.fromMap(Map.of()));
    assertThrows(IllegalArgumentException.class,
        () -> SearchConfig.fromMap(Map.of("query", "x", "type", "allergy")));
    assertThrows(IllegalArgumentException.class,
        () -> SearchConfig.fromMap(Map.of("query", "x", "threshold", "1.5")));
    assertThrows(IllegalArgumentException.class,
        () -> SearchConfig.fromMap(Map.of("query", "x", "topK", "0")));
  }
}
