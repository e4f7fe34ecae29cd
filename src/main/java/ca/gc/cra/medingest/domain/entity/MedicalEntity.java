package ca.gc.cra.medingest.domain.entity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> A condition, medication, symptom or provider mention with its canonical name.
 * <p><strong>Role:</strong> Domain value stored inside {@link NormalizedRecord}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param type entity family
 * @param text text as it appeared in the document
 * @param standardName canonical name, or the original text when no mapping exists
 * @param code taxonomy code (ICD-10 for conditions); {@code null} when unmapped
 * @param standardizationConfidence {@code 0.9} when a canonical mapping was applied, otherwise {@code 0.5}
 * @param attributes extra attributes such as {@code dosage} and {@code frequency}
 * @param source producer of the entity: {@code rules} or {@code llm}
 * @since 0.1.0
 */
public record MedicalEntity(
    EntityType type,
    String text,
    String standardName,
    String code,
    double standardizationConfidence,
    Map<String, String> attributes,
    String source) {

  public MedicalEntity {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(text, "text");
    standardName = standardName == null || standardName.isBlank() ? text : standardName;
    attributes = attributes == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    source = source == null || source.isBlank() ? "rules" : source;
  }

  /**
   * Returns the taxonomy code when mapped.
   *
   * @return optional code
   */
  public Optional<String> taxonomyCode() {
    return Optional.ofNullable(code);
  }
}
