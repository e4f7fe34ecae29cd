package ca.gc.cra.medingest.application.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.medingest.domain.run.ErrorKind;
import java.io.StringReader;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonSupportTest {
  private final JsonSupport json = new JsonSupport();

  @Test
  void parsesNestedStructuresInOrder() {
    Object parsed = json.parse("{\"b\": [1, 2.5, \"x\", true], \"a\": null}");

    Map<?, ?> map = (Map<?, ?>) parsed;
    assertEquals(List.of("b", "a"), List.copyOf(map.keySet()));
    List<?> values = (List<?>) map.get("b");
    assertEquals(1, ((Number) values.get(0)).intValue());
    assertEquals(2.5, ((Number) values.get(1)).doubleValue());
    assertEquals("x", values.get(2));
    assertEquals(Boolean.TRUE, values.get(3));
    assertNull(map.get("a"));
  }

  @Test
  void blankInputIsAnEmptyObject() throws Exception {
    assertEquals(Map.of(), json.parse(""));
    assertEquals(Map.of(), json.parse(new StringReader("  ")));
  }

  @Test
  void malformedOrTrailingInputIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> json.parse("{\"a\": "));
    assertThrows(IllegalArgumentException.class, () -> json.parse("{} {}"));
  }

  @Test
  void stringFieldToleratesScalars() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("n", 3);
    map.put("s", "text");

    assertEquals("3", JsonSupport.string(map, "n"));
    assertEquals("text", JsonSupport.string(map, "s"));
    assertNull(JsonSupport.string(map, "missing"));
  }

  @Test
  void writerOutputParsesBack() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("kind", ErrorKind.PERSISTENCE_IO);
    map.put("vector", new float[] {0.5f, -1.0f});
    map.put("items", Arrays.asList(true, null, 7L));

    String text = new JsonWriter(false).write(map);

    assertEquals("{\"kind\":\"PERSISTENCE_IO\",\"vector\":[0.5,-1.0],\"items\":[true,null,7]}", text);
    Map<?, ?> back = (Map<?, ?>) json.parse(text);
    assertEquals("PERSISTENCE_IO", back.get("kind"));
    assertTrue(new JsonWriter(true).write(map).contains("\n"));
  }
}
