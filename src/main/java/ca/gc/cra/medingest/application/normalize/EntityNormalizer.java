package ca.gc.cra.medingest.application.normalize;

import ca.gc.cra.medingest.domain.document.DataTable;
import ca.gc.cra.medingest.domain.document.ExtractedDocument;
import ca.gc.cra.medingest.domain.entity.EntityType;
import ca.gc.cra.medingest.domain.entity.LabResult;
import ca.gc.cra.medingest.domain.entity.MedicalEntity;
import ca.gc.cra.medingest.domain.entity.NormalizedRecord;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Turns an {@link ExtractedDocument} into a {@link NormalizedRecord}.
 * <p><strong>Why:</strong> Downstream indexing and sync need canonical names, ISO dates and abnormal flags
 * regardless of how the source document spelled them.</p>
 * <p><strong>Role:</strong> Pure application service between extraction and embedding.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Normalize filename and content dates to sorted ISO-8601 strings.</li>
 *   <li>Score specialties and collect condition categories.</li>
 *   <li>Parse lab results from text and tables.</li>
 *   <li>Mine and standardize conditions, medications, symptoms and providers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless after construction; safe to share across workers.</p>
 * <p><strong>Performance:</strong> Linear in content length per vocabulary term.</p>
 * <p><strong>Observability:</strong> No I/O and no logging; the output depends only on the input document, so
 * normalizing the same document twice yields equal records.</p>
 *
 * @since 0.1.0
 */
public final class EntityNormalizer {
  private final DateNormalizer dates;
  private final SpecialtyClassifier specialties;
  private final ConditionCategorizer categories;
  private final LabResultParser labs;
  private final EntityMiner miner;

  /** Creates a normalizer over the built-in vocabularies. */
  public EntityNormalizer() {
    this(
        new DateNormalizer(),
        new SpecialtyClassifier(),
        new ConditionCategorizer(),
        new LabResultParser(),
        new EntityMiner(new EntityStandardizer()));
  }

  /**
   * Creates a normalizer from its stages.
   *
   * @param dates date normalizer
   * @param specialties specialty classifier
   * @param categories condition categorizer
   * @param labs lab result parser
   * @param miner entity miner
   */
  public EntityNormalizer(
      DateNormalizer dates,
      SpecialtyClassifier specialties,
      ConditionCategorizer categories,
      LabResultParser labs,
      EntityMiner miner) {
    this.dates = Objects.requireNonNull(dates, "dates");
    this.specialties = Objects.requireNonNull(specialties, "specialties");
    this.categories = Objects.requireNonNull(categories, "categories");
    this.labs = Objects.requireNonNull(labs, "labs");
    this.miner = Objects.requireNonNull(miner, "miner");
  }

  /**
   * Normalizes one extracted document.
   *
   * @param document extraction result
   * @return normalized record
   */
  public NormalizedRecord normalize(ExtractedDocument document) {
    Objects.requireNonNull(document, "document");
    String content = document.content();

    List<String> candidates = new ArrayList<>();
    document.metadata().filenameDate().ifPresent(candidates::add);
    candidates.addAll(document.structured().contentDates());

    List<LabResult> labResults = new ArrayList<>(labs.parseText(content));
    for (DataTable table : document.structured().tables()) {
      labResults.addAll(labs.parseTable(table));
    }

    return new NormalizedRecord(
        document,
        document.metadata().detectedType(),
        dates.normalizeAll(candidates),
        specialties.classify(content),
        miner.conditions(content),
        miner.medications(content),
        miner.symptoms(content),
        labResults,
        miner.providers(document.structured().providers()),
        categories.categorize(content));
  }

  /**
   * Returns a copy of {@code record} with extra entities appended to their families. Entities whose standard
   * name is already present in the family are dropped; lab results are ignored.
   *
   * @param record normalized record
   * @param extra entities from another producer, such as the free-text extractor
   * @return merged record, or {@code record} itself when nothing new was added
   */
  public static NormalizedRecord merge(NormalizedRecord record, List<MedicalEntity> extra) {
    if (extra == null || extra.isEmpty()) {
      return record;
    }
    Map<EntityType, List<MedicalEntity>> families = new EnumMap<>(EntityType.class);
    Map<EntityType, Set<String>> names = new EnumMap<>(EntityType.class);
    for (EntityType type : EntityType.values()) {
      List<MedicalEntity> existing = new ArrayList<>(record.entities(type));
      Set<String> known = new HashSet<>();
      existing.forEach(e -> known.add(e.standardName().toLowerCase(Locale.ROOT)));
      families.put(type, existing);
      names.put(type, known);
    }
    boolean changed = false;
    for (MedicalEntity entity : extra) {
      if (entity.type() == EntityType.LAB_RESULT) {
        continue;
      }
      if (names.get(entity.type()).add(entity.standardName().toLowerCase(Locale.ROOT))) {
        families.get(entity.type()).add(entity);
        changed = true;
      }
    }
    if (!changed) {
      return record;
    }
    return new NormalizedRecord(
        record.source(),
        record.documentType(),
        record.dates(),
        record.specialties(),
        families.get(EntityType.CONDITION),
        families.get(EntityType.MEDICATION),
        families.get(EntityType.SYMPTOM),
        record.labResults(),
        families.get(EntityType.PROVIDER),
        record.conditionCategories());
  }
}
