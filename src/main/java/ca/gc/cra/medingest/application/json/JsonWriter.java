package ca.gc.cra.medingest.application.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;

/**
 * Writes map/list object graphs with a jackson-core {@link JsonGenerator}.
 * <p>Maps are written in iteration order so callers control field order; identical graphs produce identical
 * bytes.</p>
 *
 * @since 0.1.0
 */
public final class JsonWriter {
  private final JsonFactory factory = new JsonFactory();
  private final boolean pretty;

  /**
   * Creates a writer.
   *
   * @param pretty whether to indent output
   */
  public JsonWriter(boolean pretty) {
    this.pretty = pretty;
  }

  /**
   * Serializes a value to a string.
   *
   * @param value map, list, array, string, number, boolean or {@code null}
   * @return JSON text
   */
  public String write(Object value) {
    StringWriter out = new StringWriter();
    try {
      write(value, out);
    } catch (IOException ex) {
      throw new IllegalStateException("In-memory JSON write failed", ex);
    }
    return out.toString();
  }

  /**
   * Serializes a value to a character stream. The stream is flushed but not closed.
   *
   * @param value value to write
   * @param out target writer
   * @throws IOException when writing fails
   */
  public void write(Object value, Writer out) throws IOException {
    Objects.requireNonNull(out, "out");
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      if (pretty) {
        gen.useDefaultPrettyPrinter();
      }
      writeValue(gen, value);
    }
  }

  /**
   * Serializes a value to a UTF-8 byte stream. The stream is flushed but not closed.
   *
   * @param value value to write
   * @param out target stream
   * @throws IOException when writing fails
   */
  public void write(Object value, OutputStream out) throws IOException {
    Objects.requireNonNull(out, "out");
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      if (pretty) {
        gen.useDefaultPrettyPrinter();
      }
      writeValue(gen, value);
    }
  }

  private void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof Iterable<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else if (value instanceof float[] floats) {
      gen.writeStartArray();
      for (float f : floats) {
        gen.writeNumber(f);
      }
      gen.writeEndArray();
    } else if (value instanceof String text) {
      gen.writeString(text);
    } else if (value instanceof Boolean bool) {
      gen.writeBoolean(bool);
    } else if (value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte) {
      gen.writeNumber(((Number) value).longValue());
    } else if (value instanceof Float f) {
      gen.writeNumber(f);
    } else if (value instanceof Double d) {
      gen.writeNumber(d);
    } else if (value instanceof BigDecimal decimal) {
      gen.writeNumber(decimal);
    } else if (value instanceof BigInteger integer) {
      gen.writeNumber(integer);
    } else if (value instanceof Enum<?> constant) {
      gen.writeString(constant.name());
    } else {
      gen.writeString(value.toString());
    }
  }
}
