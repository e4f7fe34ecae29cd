package ca.gc.cra.medingest.application.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.medingest.domain.entity.EntityType;
import ca.gc.cra.medingest.domain.entity.MedicalEntity;
import org.junit.jupiter.api.Test;

class EntityStandardizerTest {
  private final EntityStandardizer standardizer = new EntityStandardizer();

  @Test
  void mappedConditionGetsCanonicalNameAndCode() {
    MedicalEntity entity = standardizer.condition("  Diabetes  ", "rules");

    assertEquals("Diabetes", entity.text());
    assertEquals("Diabetes Mellitus", entity.standardName());
    assertEquals("E11.9", entity.code());
    assertEquals(0.9, entity.standardizationConfidence());
  }

  @Test
  void unmappedConditionKeepsTextWithLowerConfidence() {
    MedicalEntity entity = standardizer.condition("Gout", "llm");

    assertEquals("Gout", entity.standardName());
    assertNull(entity.code());
    assertEquals(0.5, entity.standardizationConfidence());
    assertEquals("llm", entity.source());
  }

  @Test
  void medicationMapsBrandToGeneric() {
    MedicalEntity entity = standardizer.medication("Advil", "200  mg", "q6h", "rules");

    assertEquals("Ibuprofen", entity.standardName());
    assertEquals("200 mg", entity.attributes().get("dosage"));
    assertEquals("every 6 hours", entity.attributes().get("frequency"));
  }

  @Test
  void blankDosageIsOmitted() {
    assertTrue(standardizer.medication("Aspirin", " ", null, "rules").attributes().isEmpty());
  }

  @Test
  void dosageAbbreviationsExpand() {
    assertEquals("1 tab three times daily", EntityStandardizer.normalizeDosage("1 tab TID"));
    assertEquals("2 puffs four times daily", EntityStandardizer.normalizeDosage("2 puffs qid"));
  }

  @Test
  void passthroughKeepsText() {
    MedicalEntity entity = standardizer.passthrough(EntityType.SYMPTOM, " fatigue ", "rules");

    assertEquals("fatigue", entity.standardName());
    assertEquals(EntityType.SYMPTOM, entity.type());
  }
}
