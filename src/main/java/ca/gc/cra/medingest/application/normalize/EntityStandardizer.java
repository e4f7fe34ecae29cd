package ca.gc.cra.medingest.application.normalize;

import ca.gc.cra.medingest.domain.entity.EntityType;
import ca.gc.cra.medingest.domain.entity.MedicalEntity;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps raw entity mentions to canonical names and taxonomy codes.
 * <p>A mention found in the lookup table gets standardization confidence {@value #MAPPED_CONFIDENCE}; otherwise
 * the original text becomes the standard name with confidence {@value #UNMAPPED_CONFIDENCE}. Conditions also
 * receive an ICD-10 code when the canonical name has one.</p>
 *
 * @since 0.1.0
 */
public final class EntityStandardizer {
  public static final double MAPPED_CONFIDENCE = 0.9;
  public static final double UNMAPPED_CONFIDENCE = 0.5;

  private static final Pattern EVERY_N_HOURS = Pattern.compile("(?i)\\bq(\\d+)h\\b");
  private static final Pattern QD = Pattern.compile("(?i)\\bqd\\b");
  private static final Pattern BID = Pattern.compile("(?i)\\bbid\\b");
  private static final Pattern TID = Pattern.compile("(?i)\\btid\\b");
  private static final Pattern QID = Pattern.compile("(?i)\\bqid\\b");

  /**
   * Standardizes a condition mention.
   *
   * @param text mention as written
   * @param source producer label ({@code rules} or {@code llm})
   * @return standardized entity
   */
  public MedicalEntity condition(String text, String source) {
    String key = key(text);
    String canonical = ClinicalVocabulary.CONDITION_NAMES.get(key);
    String standardName = canonical == null ? text.trim() : canonical;
    String code = ClinicalVocabulary.ICD10_CODES.get(standardName.toLowerCase(Locale.ROOT));
    if (code == null) {
      code = ClinicalVocabulary.ICD10_CODES.get(key);
    }
    return new MedicalEntity(
        EntityType.CONDITION,
        text.trim(),
        standardName,
        code,
        canonical == null ? UNMAPPED_CONFIDENCE : MAPPED_CONFIDENCE,
        Map.of(),
        source);
  }

  /**
   * Standardizes a medication mention.
   *
   * @param text medication name as written
   * @param dosage dosage such as {@code 500 mg}; may be {@code null}
   * @param frequency frequency such as {@code bid}; may be {@code null}
   * @param source producer label
   * @return standardized entity with {@code dosage} and {@code frequency} attributes when present
   */
  public MedicalEntity medication(String text, String dosage, String frequency, String source) {
    String canonical = ClinicalVocabulary.MEDICATION_NAMES.get(key(text));
    Map<String, String> attributes = new LinkedHashMap<>();
    if (dosage != null && !dosage.isBlank()) {
      attributes.put("dosage", normalizeDosage(dosage));
    }
    if (frequency != null && !frequency.isBlank()) {
      attributes.put("frequency", normalizeDosage(frequency));
    }
    return new MedicalEntity(
        EntityType.MEDICATION,
        text.trim(),
        canonical == null ? text.trim() : canonical,
        null,
        canonical == null ? UNMAPPED_CONFIDENCE : MAPPED_CONFIDENCE,
        attributes,
        source);
  }

  /**
   * Wraps a mention that has no canonical table, such as a symptom or provider.
   *
   * @param type entity family
   * @param text mention as written
   * @param source producer label
   * @return entity whose standard name is the original text
   */
  public MedicalEntity passthrough(EntityType type, String text, String source) {
    return new MedicalEntity(type, text.trim(), text.trim(), null, UNMAPPED_CONFIDENCE, Map.of(), source);
  }

  /**
   * Normalizes dosage and frequency notation: collapses whitespace and spells out {@code qd}, {@code bid},
   * {@code tid}, {@code qid} and {@code qNh}.
   *
   * @param dosage raw dosage text
   * @return normalized text
   */
  public static String normalizeDosage(String dosage) {
    String result = dosage.trim().replaceAll("\\s+", " ");
    result = EVERY_N_HOURS.matcher(result).replaceAll("every $1 hours");
    result = QD.matcher(result).replaceAll("daily");
    result = BID.matcher(result).replaceAll("twice daily");
    result = TID.matcher(result).replaceAll("three times daily");
    result = QID.matcher(result).replaceAll("four times daily");
    return result;
  }

  private static String key(String text) {
    return text.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
  }
}
