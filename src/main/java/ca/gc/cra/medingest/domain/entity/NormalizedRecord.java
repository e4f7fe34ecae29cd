package ca.gc.cra.medingest.domain.entity;

import ca.gc.cra.medingest.domain.document.ExtractedDocument;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Canonical, entity-tagged representation of one document.
 * <p><strong>Why:</strong> Gives downstream indexing, sync and reporting a single stable shape regardless of
 * source format.</p>
 * <p><strong>Role:</strong> Output of the entity normalizer; persisted as the processed artifact.</p>
 * <p><strong>Thread-safety:</strong> Immutable; collections are defensively copied in their given order.</p>
 *
 * @param source extraction the record was derived from
 * @param documentType document type label
 * @param dates ISO-8601 dates, sorted ascending without duplicates
 * @param specialties specialty to confidence, ordered by specialty name
 * @param conditions standardized condition mentions
 * @param medications standardized medication mentions
 * @param symptoms symptom mentions
 * @param labResults lab results with abnormality flags
 * @param providers provider mentions
 * @param conditionCategories category to matched terms, ordered by category name
 * @since 0.1.0
 */
public record NormalizedRecord(
    ExtractedDocument source,
    String documentType,
    List<String> dates,
    Map<String, Double> specialties,
    List<MedicalEntity> conditions,
    List<MedicalEntity> medications,
    List<MedicalEntity> symptoms,
    List<LabResult> labResults,
    List<MedicalEntity> providers,
    Map<String, List<ConditionMatch>> conditionCategories) {

  public NormalizedRecord {
    Objects.requireNonNull(source, "source");
    documentType = documentType == null ? source.metadata().detectedType() : documentType;
    dates = List.copyOf(dates);
    specialties = Collections.unmodifiableMap(new LinkedHashMap<>(specialties));
    conditions = List.copyOf(conditions);
    medications = List.copyOf(medications);
    symptoms = List.copyOf(symptoms);
    labResults = List.copyOf(labResults);
    providers = List.copyOf(providers);
    Map<String, List<ConditionMatch>> categories = new LinkedHashMap<>();
    conditionCategories.forEach((key, value) -> categories.put(key, List.copyOf(value)));
    conditionCategories = Collections.unmodifiableMap(categories);
  }

  /**
   * Returns the entities of the given family, excluding lab results.
   *
   * @param type entity family
   * @return entities of that family; empty for {@link EntityType#LAB_RESULT}
   */
  public List<MedicalEntity> entities(EntityType type) {
    return switch (type) {
      case CONDITION -> conditions;
      case MEDICATION -> medications;
      case SYMPTOM -> symptoms;
      case PROVIDER -> providers;
      case LAB_RESULT -> List.of();
    };
  }

  /**
   * Counts entities per family for run reports.
   *
   * @return count per entity type, in enum order
   */
  public Map<EntityType, Integer> entityCounts() {
    Map<EntityType, Integer> counts = new EnumMap<>(EntityType.class);
    counts.put(EntityType.CONDITION, conditions.size());
    counts.put(EntityType.MEDICATION, medications.size());
    counts.put(EntityType.SYMPTOM, symptoms.size());
    counts.put(EntityType.LAB_RESULT, labResults.size());
    counts.put(EntityType.PROVIDER, providers.size());
    return counts;
  }
}
