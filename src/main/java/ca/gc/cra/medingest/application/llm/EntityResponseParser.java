package ca.gc.cra.medingest.application.llm;

import ca.gc.cra.medingest.application.json.JsonSupport;
import ca.gc.cra.medingest.application.normalize.EntityStandardizer;
import ca.gc.cra.medingest.domain.entity.EntityType;
import ca.gc.cra.medingest.domain.entity.MedicalEntity;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Converts the free-text extractor's raw response into standardized entities.
 * <p><strong>Why:</strong> The collaborator is a black box: it may wrap JSON in markdown fences, surround it with
 * prose, return nothing, or return text that is not JSON at all.</p>
 * <p><strong>Role:</strong> Application-side adapter between {@code EntityExtractionClient} and the
 * normalizer's merge step.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Accept a JSON array of entities, an object with an {@code entities} array, or an object keyed by entity
 *   family ({@code conditions}, {@code medications}, ...).</li>
 *   <li>Read {@code name} or {@code text} per entity plus optional {@code dosage} and {@code frequency}.</li>
 *   <li>Return an empty list instead of failing on anything unusable.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the thread-safe JSON factory.</p>
 * <p><strong>Observability:</strong> Logs unusable responses at WARN.</p>
 *
 * @since 0.1.0
 */
public final class EntityResponseParser {
  private static final Logger log = LoggerFactory.getLogger(EntityResponseParser.class);
  private static final Pattern FENCE = Pattern.compile("```(?:[A-Za-z]+)?\\s*\\n?(.*?)```", Pattern.DOTALL);
  private static final String SOURCE = "llm";

  private final JsonSupport json = new JsonSupport();
  private final EntityStandardizer standardizer;

  /**
   * Creates a parser.
   *
   * @param standardizer canonical-name mapper applied to every parsed entity
   */
  public EntityResponseParser(EntityStandardizer standardizer) {
    this.standardizer = Objects.requireNonNull(standardizer, "standardizer");
  }

  /**
   * Parses a raw response.
   *
   * @param raw response text; may be {@code null}
   * @return standardized entities; empty when the response holds none or cannot be read
   */
  public List<MedicalEntity> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      log.warn("Entity extractor returned an empty response");
      return List.of();
    }
    Optional<Object> tree = readTree(raw.trim());
    if (tree.isEmpty()) {
      log.warn("Entity extractor response is not JSON; ignoring {} chars", raw.length());
      return List.of();
    }
    List<MedicalEntity> entities = new ArrayList<>();
    Object root = tree.get();
    if (root instanceof List<?> list) {
      readList(list, null, entities);
    } else if (root instanceof Map<?, ?> map) {
      Object wrapped = map.get("entities");
      if (wrapped instanceof List<?> list) {
        readList(list, null, entities);
      } else if (map.containsKey("type")) {
        readEntity(map, null, entities);
      } else {
        map.forEach((key, value) -> EntityType.fromKey(String.valueOf(key)).ifPresent(type -> {
          if (value instanceof List<?> list) {
            readList(list, type, entities);
          }
        }));
      }
    }
    if (entities.isEmpty()) {
      log.warn("Entity extractor response contained no usable entities");
    }
    return entities;
  }

  private Optional<Object> readTree(String text) {
    Matcher fence = FENCE.matcher(text);
    String candidate = fence.find() ? fence.group(1).trim() : text;
    Optional<Object> direct = tryParse(candidate);
    if (direct.isPresent()) {
      return direct;
    }
    int objectStart = candidate.indexOf('{');
    int arrayStart = candidate.indexOf('[');
    int start;
    char close;
    if (arrayStart >= 0 && (objectStart < 0 || arrayStart < objectStart)) {
      start = arrayStart;
      close = ']';
    } else if (objectStart >= 0) {
      start = objectStart;
      close = '}';
    } else {
      return Optional.empty();
    }
    int end = candidate.lastIndexOf(close);
    if (end <= start) {
      return Optional.empty();
    }
    return tryParse(candidate.substring(start, end + 1));
  }

  private Optional<Object> tryParse(String text) {
    if (text.isEmpty()) {
      return Optional.empty();
    }
    char first = text.charAt(0);
    if (first != '{' && first != '[') {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(json.parse(text));
    } catch (IllegalArgumentException ex) {
      log.debug("Entity extractor fragment is not valid JSON: {}", ex.getMessage());
      return Optional.empty();
    }
  }

  private void readList(List<?> items, EntityType family, List<MedicalEntity> out) {
    for (Object item : items) {
      if (item instanceof Map<?, ?> map) {
        readEntity(map, family, out);
      } else if (item instanceof String name && family != null && !name.isBlank()) {
        out.add(build(family, name, null, null));
      }
    }
  }

  private void readEntity(Map<?, ?> map, EntityType family, List<MedicalEntity> out) {
    EntityType type = family;
    String rawType = JsonSupport.string(map, "type");
    if (rawType != null) {
      type = EntityType.fromKey(rawType).orElse(family);
    }
    String name = JsonSupport.string(map, "name");
    if (name == null || name.isBlank()) {
      name = JsonSupport.string(map, "text");
    }
    if (type == null || type == EntityType.LAB_RESULT || name == null || name.isBlank()) {
      return;
    }
    out.add(build(type, name, JsonSupport.string(map, "dosage"), JsonSupport.string(map, "frequency")));
  }

  private MedicalEntity build(EntityType type, String name, String dosage, String frequency) {
    return switch (type) {
      case CONDITION -> standardizer.condition(name, SOURCE);
      case MEDICATION -> standardizer.medication(name, dosage, frequency, SOURCE);
      default -> standardizer.passthrough(type, name, SOURCE);
    };
  }
}
