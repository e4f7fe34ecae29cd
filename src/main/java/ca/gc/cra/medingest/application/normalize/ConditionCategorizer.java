package ca.gc.cra.medingest.application.normalize;

import ca.gc.cra.medingest.domain.entity.ConditionMatch;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns a document to condition categories by term matching.
 * <p>Each category keeps its matched terms once, in table order, with the first occurrence's context of up to
 * 50 characters on either side. Categories with no match are absent; the rest are ordered by name.</p>
 *
 * @since 0.1.0
 */
public final class ConditionCategorizer {
  static final int CONTEXT_RADIUS = 50;

  private final Map<String, List<Pattern>> patterns;

  /** Creates a categorizer over {@link ClinicalVocabulary#CONDITION_CATEGORIES}. */
  public ConditionCategorizer() {
    this(ClinicalVocabulary.CONDITION_CATEGORIES);
  }

  /**
   * Creates a categorizer over a custom table.
   *
   * @param categories category to terms
   */
  public ConditionCategorizer(Map<String, List<String>> categories) {
    Map<String, List<Pattern>> compiled = new LinkedHashMap<>();
    categories.forEach((name, terms) -> compiled.put(name, SpecialtyClassifier.wordPatterns(terms)));
    this.patterns = Collections.unmodifiableMap(compiled);
  }

  /**
   * Matches all categories against the text.
   *
   * @param text document text
   * @return category to matches, ordered by category name
   */
  public Map<String, List<ConditionMatch>> categorize(String text) {
    String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
    Map<String, List<ConditionMatch>> result = new TreeMap<>();
    patterns.forEach((category, termPatterns) -> {
      List<ConditionMatch> matches = new ArrayList<>();
      Set<String> seen = new LinkedHashSet<>();
      for (Pattern pattern : termPatterns) {
        Matcher matcher = pattern.matcher(lower);
        if (matcher.find() && seen.add(matcher.group())) {
          int start = Math.max(0, matcher.start() - CONTEXT_RADIUS);
          int end = Math.min(lower.length(), matcher.end() + CONTEXT_RADIUS);
          String context = lower.substring(start, end).replaceAll("\\s+", " ").trim();
          matches.add(new ConditionMatch(matcher.group(), context));
        }
      }
      if (!matches.isEmpty()) {
        result.put(category, matches);
      }
    });
    return new LinkedHashMap<>(result);
  }
}
