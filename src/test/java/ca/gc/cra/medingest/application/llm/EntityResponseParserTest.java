package ca.gc.cra.medingest.application.llm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.medingest.application.normalize.EntityStandardizer;
import ca.gc.cra.medingest.domain.entity.EntityType;
import ca.gc.cra.medingest.domain.entity.MedicalEntity;
import java.util.List;
import org.junit.jupiter.api.Test;

class EntityResponseParserTest {
  private final EntityResponseParser parser = new EntityResponseParser(new EntityStandardizer());

  @Test
  void fencedArrayIsStandardized() {
    String raw = "Here is what I found:\n```json\n"
        + "[{\"type\": \"condition\", \"name\": \"htn\"},\n"
        + " {\"type\": \"medication\", \"name\": \"Advil\", \"dosage\": \"200 mg\", \"frequency\": \"q6h\"}]\n"
        + "```\n";

    List<MedicalEntity> entities = parser.parse(raw);

    assertEquals(2, entities.size());
    MedicalEntity condition = entities.get(0);
    assertEquals(EntityType.CONDITION, condition.type());
    assertEquals("Hypertension", condition.standardName());
    assertEquals("I10", condition.code());
    assertEquals("llm", condition.source());

    MedicalEntity medication = entities.get(1);
    assertEquals("Ibuprofen", medication.standardName());
    assertEquals("200 mg", medication.attributes().get("dosage"));
    assertEquals("every 6 hours", medication.attributes().get("frequency"));
  }

  @Test
  void objectSurroundedByProseIsRecovered() {
    String raw = "Sure! {\"entities\": [{\"type\": \"symptom\", \"text\": \"fatigue\"}]} Hope this helps.";

    List<MedicalEntity> entities = parser.parse(raw);

    assertEquals(1, entities.size());
    assertEquals(EntityType.SYMPTOM, entities.get(0).type());
    assertEquals("fatigue", entities.get(0).standardName());
    assertEquals(EntityStandardizer.UNMAPPED_CONFIDENCE, entities.get(0).standardizationConfidence());
  }

  @Test
  void familyKeyedObjectAcceptsNamesAndObjects() {
    String raw = "{\"conditions\": [\"Asthma\", {\"name\": \"gout\"}],"
        + " \"medications\": [{\"name\": \"metformin\"}],"
        + " \"lab_results\": [{\"name\": \"glucose\", \"value\": 90}],"
        + " \"notes\": \"ignored\"}";

    List<MedicalEntity> entities = parser.parse(raw);

    assertEquals(3, entities.size());
    assertEquals("Asthma", entities.get(0).standardName());
    assertEquals("J45.909", entities.get(0).code());
    assertEquals("gout", entities.get(1).standardName());
    assertNull(entities.get(1).code());
    assertEquals(EntityType.MEDICATION, entities.get(2).type());
    assertEquals("Metformin", entities.get(2).standardName());
  }

  @Test
  void singleTypedObjectIsAccepted() {
    List<MedicalEntity> entities = parser.parse("{\"type\": \"provider\", \"name\": \"Dr. Lee\"}");

    assertEquals(1, entities.size());
    assertEquals(EntityType.PROVIDER, entities.get(0).type());
  }

  @Test
  void unusableResponsesYieldNothing() {
    assertTrue(parser.parse(null).isEmpty());
    assertTrue(parser.parse("   ").isEmpty());
    assertTrue(parser.parse("I could not find any entities.").isEmpty());
    assertTrue(parser.parse("{not json at all}").isEmpty());
    assertTrue(parser.parse("[{\"type\": \"allergy\", \"name\": \"peanut\"}, {\"type\": \"condition\"}]").isEmpty());
  }
}
