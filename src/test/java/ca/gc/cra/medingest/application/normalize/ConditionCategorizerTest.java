package ca.gc.cra.medingest.application.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.medingest.domain.entity.ConditionMatch;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConditionCategorizerTest {

  @Test
  void categoriesCarryMatchedTermAndContext() {
    Map<String, List<ConditionMatch>> categories = new ConditionCategorizer()
        .categorize("Long history of Fibromyalgia. Beighton score 7/9 suggests hypermobility.");

    assertEquals(List.of("chronic_pain", "eds"), List.copyOf(categories.keySet()));
    ConditionMatch pain = categories.get("chronic_pain").get(0);
    assertEquals("fibromyalgia", pain.term());
    assertTrue(pain.context().contains("long history of fibromyalgia"));
    assertEquals(2, categories.get("eds").size());
  }

  @Test
  void specialtyScoresScaleWithKeywordHits() {
    Map<String, Double> scores = new SpecialtyClassifier(Map.of("cardiology", List.of("heart", "ecg")))
        .classify("Heart rate normal. ECG unremarkable. heart sounds regular.");

    assertEquals(Map.of("cardiology", 0.75), scores);
  }

  @Test
  void noKeywordsMeansNoSpecialty() {
    assertTrue(new SpecialtyClassifier().classify("nothing notable").isEmpty());
  }
}
