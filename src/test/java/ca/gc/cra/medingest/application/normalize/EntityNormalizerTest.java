package ca.gc.cra.medingest.application.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.medingest.application.json.JsonWriter;
import ca.gc.cra.medingest.application.json.RecordJson;
import ca.gc.cra.medingest.domain.document.DataTable;
import ca.gc.cra.medingest.domain.document.ExtractedDocument;
import ca.gc.cra.medingest.domain.document.StructuredContent;
import ca.gc.cra.medingest.domain.entity.EntityType;
import ca.gc.cra.medingest.domain.entity.MedicalEntity;
import ca.gc.cra.medingest.domain.entity.NormalizedRecord;
import ca.gc.cra.medingest.testutil.DocumentFixtures;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EntityNormalizerTest {
  private static final String NOTE = String.join("\n",
      "CLINICAL NOTE",
      "Patient seen by Dr. Alice Moreau on 03/14/2023.",
      "ASSESSMENT: HTN and migraine headache with nausea.",
      "MEDICATIONS: Tylenol 500 mg bid, Metformin 850 mg daily",
      "Glucose: 130 mg/dL (Reference: 70-99)");

  private final EntityNormalizer normalizer = new EntityNormalizer();

  private static ExtractedDocument note() {
    StructuredContent structured = new StructuredContent(
        List.of(), List.of(), List.of("03/14/2023"), List.of("Dr. Alice Moreau"), Map.of());
    return DocumentFixtures.document("clinic_note_2023-03-10.txt", NOTE, structured);
  }

  @Test
  void extractsConditionsWithCodes() {
    NormalizedRecord record = normalizer.normalize(note());

    List<MedicalEntity> conditions = record.conditions();
    assertEquals(2, conditions.size());
    MedicalEntity hypertension = conditions.get(0);
    assertEquals("htn", hypertension.text());
    assertEquals("Hypertension", hypertension.standardName());
    assertEquals("I10", hypertension.code());
    assertEquals(EntityStandardizer.MAPPED_CONFIDENCE, hypertension.standardizationConfidence());
    assertEquals("Migraine", conditions.get(1).standardName());
  }

  @Test
  void extractsMedicationsWithNormalizedDosage() {
    NormalizedRecord record = normalizer.normalize(note());

    List<MedicalEntity> medications = record.medications();
    assertEquals(2, medications.size());
    MedicalEntity acetaminophen = medications.get(0);
    assertEquals("Tylenol", acetaminophen.text());
    assertEquals("Acetaminophen", acetaminophen.standardName());
    assertEquals("500 mg", acetaminophen.attributes().get("dosage"));
    assertEquals("twice daily", acetaminophen.attributes().get("frequency"));
    assertEquals("Metformin", medications.get(1).standardName());
  }

  @Test
  void collectsSymptomsDatesProvidersAndLabs() {
    NormalizedRecord record = normalizer.normalize(note());

    assertEquals(List.of("headache", "nausea"),
        record.symptoms().stream().map(MedicalEntity::standardName).toList());
    assertEquals(List.of("2023-03-10", "2023-03-14"), record.dates());
    assertEquals(List.of("Dr. Alice Moreau"),
        record.providers().stream().map(MedicalEntity::standardName).toList());
    assertEquals(1, record.labResults().size());
    assertTrue(record.labResults().get(0).abnormal());
    assertEquals(0.07, record.specialties().get("neurology"));
    assertEquals("clinical_note", record.documentType());
  }

  @Test
  void tableLabsAreAppendedAfterTextLabs() {
    DataTable table = DataTable.of(
        List.of("Test", "Value", "Unit", "Range"),
        List.of(List.of("Sodium", "150", "mmol/L", "135-145")));
    StructuredContent structured = new StructuredContent(List.of(), List.of(table), List.of(), List.of(), Map.of());

    NormalizedRecord record = normalizer.normalize(DocumentFixtures.document("labs.csv", NOTE, structured));

    assertEquals(2, record.labResults().size());
    assertEquals("Glucose", record.labResults().get(0).testName());
    assertEquals(150.0, record.labResults().get(1).value());
    assertTrue(record.labResults().get(1).abnormal());
  }

  @Test
  void normalizationIsDeterministic() {
    JsonWriter writer = new JsonWriter(true);

    String first = writer.write(RecordJson.normalized(normalizer.normalize(note())));
    String second = writer.write(RecordJson.normalized(new EntityNormalizer().normalize(note())));

    assertEquals(first, second);
  }

  @Test
  void emptyContentYieldsEmptyFamilies() {
    NormalizedRecord record = normalizer.normalize(DocumentFixtures.document("blank.txt", ""));

    record.entityCounts().values().forEach(count -> assertEquals(0, count));
    assertTrue(record.dates().isEmpty());
    assertTrue(record.conditionCategories().isEmpty());
  }

  @Test
  void mergeAddsOnlyUnseenEntities() {
    NormalizedRecord record = normalizer.normalize(note());
    EntityStandardizer standardizer = new EntityStandardizer();

    NormalizedRecord merged = EntityNormalizer.merge(record, List.of(
        standardizer.condition("hypertension", "llm"),
        standardizer.condition("asthma", "llm"),
        standardizer.passthrough(EntityType.SYMPTOM, "fatigue", "llm")));

    assertEquals(3, merged.conditions().size());
    assertEquals("Asthma", merged.conditions().get(2).standardName());
    assertEquals("llm", merged.conditions().get(2).source());
    assertEquals(3, merged.symptoms().size());
  }

  @Test
  void mergeWithoutNewEntitiesReturnsSameRecord() {
    NormalizedRecord record = normalizer.normalize(note());

    assertSame(record, EntityNormalizer.merge(record, List.of()));
    assertSame(record, EntityNormalizer.merge(record,
        List.of(new EntityStandardizer().medication("Tylenol", null, null, "llm"))));
  }
}
