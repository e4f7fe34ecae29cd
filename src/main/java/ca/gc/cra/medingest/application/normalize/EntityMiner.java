package ca.gc.cra.medingest.application.normalize;

import ca.gc.cra.medingest.domain.entity.EntityType;
import ca.gc.cra.medingest.domain.entity.MedicalEntity;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based entity mining over document text.
 * <p>Conditions come from the canonical condition table, medications from a {@code Name <dose><unit>}
 * pattern with an optional frequency, symptoms from a fixed vocabulary. Each family is de-duplicated by
 * standard name and ordered by first appearance.</p>
 *
 * @since 0.1.0
 */
public final class EntityMiner {
  private static final Pattern MEDICATION = Pattern.compile(
      "\\b((?:[A-Z][a-z]+\\s?){1,3})\\s*(\\d+(?:\\.\\d+)?)\\s*(mg/ml|mcg/ml|mg|mcg|g|ml|%)(?![A-Za-z])"
          + "(?:\\s+(?i:(qd|bid|tid|qid|q\\d+h|daily|twice daily|as needed|prn)))?");

  private final EntityStandardizer standardizer;
  private final List<Term> conditionTerms;
  private final List<Term> symptomTerms;

  /**
   * Creates a miner.
   *
   * @param standardizer canonical-name mapper
   */
  public EntityMiner(EntityStandardizer standardizer) {
    this.standardizer = standardizer;
    this.conditionTerms = terms(ClinicalVocabulary.CONDITION_NAMES.keySet());
    this.symptomTerms = terms(ClinicalVocabulary.SYMPTOMS);
  }

  /**
   * Finds condition mentions listed in the condition table.
   *
   * @param text document text
   * @return standardized conditions
   */
  public List<MedicalEntity> conditions(String text) {
    List<MedicalEntity> result = new ArrayList<>();
    Set<String> seen = new LinkedHashSet<>();
    for (Hit hit : longestMatches(text, conditionTerms)) {
      if (isShortAbbreviation(hit.text()) && !writtenAsAbbreviation(text, hit)) {
        continue;
      }
      MedicalEntity entity = standardizer.condition(hit.text(), "rules");
      if (seen.add(entity.standardName().toLowerCase(Locale.ROOT))) {
        result.add(entity);
      }
    }
    return result;
  }

  /**
   * Finds medication mentions with a dose.
   *
   * @param text document text
   * @return standardized medications
   */
  public List<MedicalEntity> medications(String text) {
    List<MedicalEntity> result = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return result;
    }
    Set<String> seen = new LinkedHashSet<>();
    Matcher matcher = MEDICATION.matcher(text);
    while (matcher.find()) {
      String name = drugName(matcher.group(1).trim());
      String dosage = matcher.group(2) + " " + matcher.group(3);
      MedicalEntity entity = standardizer.medication(name, dosage, matcher.group(4), "rules");
      if (seen.add(entity.standardName().toLowerCase(Locale.ROOT))) {
        result.add(entity);
      }
    }
    return result;
  }

  /**
   * Finds symptom mentions. A phrase such as {@code joint pain} suppresses the {@code pain} inside it.
   *
   * @param text document text
   * @return symptoms
   */
  public List<MedicalEntity> symptoms(String text) {
    List<MedicalEntity> result = new ArrayList<>();
    Set<String> seen = new LinkedHashSet<>();
    for (Hit hit : longestMatches(text, symptomTerms)) {
      String name = hit.text().toLowerCase(Locale.ROOT);
      if (seen.add(name)) {
        result.add(standardizer.passthrough(EntityType.SYMPTOM, name, "rules"));
      }
    }
    return result;
  }

  /**
   * Wraps provider names already mined by the extractor.
   *
   * @param names provider names in order of appearance
   * @return provider entities without duplicates
   */
  public List<MedicalEntity> providers(Collection<String> names) {
    List<MedicalEntity> result = new ArrayList<>();
    Set<String> seen = new LinkedHashSet<>();
    for (String name : names) {
      if (name != null && !name.isBlank() && seen.add(name.trim())) {
        result.add(standardizer.passthrough(EntityType.PROVIDER, name, "rules"));
      }
    }
    return result;
  }

  private static boolean isShortAbbreviation(String term) {
    return term.length() <= 4 && term.indexOf(' ') < 0;
  }

  // Short table keys such as "add" or "dm" only count when written with capitals ("ADD", "hEDS").
  private static boolean writtenAsAbbreviation(String text, Hit hit) {
    int end = hit.position() + hit.text().length();
    if (end > text.length()) {
      return false;
    }
    int upper = 0;
    for (int i = hit.position(); i < end; i++) {
      if (Character.isUpperCase(text.charAt(i))) {
        upper++;
      }
    }
    return upper >= 2;
  }

  // When a capitalized run such as "Started Metformin" precedes the dose, keep the known drug word.
  private static String drugName(String run) {
    String[] words = run.split("\\s+");
    for (int i = words.length - 1; i >= 0; i--) {
      if (ClinicalVocabulary.MEDICATION_NAMES.containsKey(words[i].toLowerCase(Locale.ROOT))) {
        return words[i];
      }
    }
    return run;
  }

  private static List<Hit> longestMatches(String text, List<Term> terms) {
    List<Hit> hits = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return hits;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    boolean[] claimed = new boolean[lower.length()];
    for (Term term : terms) {
      Matcher matcher = term.pattern().matcher(lower);
      while (matcher.find()) {
        if (isFree(claimed, matcher.start(), matcher.end())) {
          for (int i = matcher.start(); i < matcher.end(); i++) {
            claimed[i] = true;
          }
          hits.add(new Hit(matcher.start(), matcher.group()));
        }
      }
    }
    hits.sort(Comparator.comparingInt(Hit::position));
    return hits;
  }

  private static boolean isFree(boolean[] claimed, int start, int end) {
    for (int i = start; i < end; i++) {
      if (claimed[i]) {
        return false;
      }
    }
    return true;
  }

  private static List<Term> terms(Collection<String> vocabulary) {
    List<Term> terms = new ArrayList<>();
    for (String word : vocabulary) {
      terms.add(new Term(word, Pattern.compile("\\b" + Pattern.quote(word) + "\\b")));
    }
    terms.sort(Comparator.comparingInt((Term t) -> t.word().length()).reversed()
        .thenComparing(Term::word));
    return List.copyOf(terms);
  }

  private record Term(String word, Pattern pattern) {}

  private record Hit(int position, String text) {}
}
