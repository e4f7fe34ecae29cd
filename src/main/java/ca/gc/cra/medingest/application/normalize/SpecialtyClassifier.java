package ca.gc.cra.medingest.application.normalize;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores medical specialties by keyword frequency.
 * <p>Confidence is {@code min(matches / keywordCount * 0.5, 1.0)} rounded half-up to two decimals. Specialties
 * without a match are omitted and the result is ordered by specialty name.</p>
 *
 * @since 0.1.0
 */
public final class SpecialtyClassifier {
  private final Map<String, List<Pattern>> patterns;

  /** Creates a classifier over {@link ClinicalVocabulary#SPECIALTIES}. */
  public SpecialtyClassifier() {
    this(ClinicalVocabulary.SPECIALTIES);
  }

  /**
   * Creates a classifier over a custom table.
   *
   * @param specialties specialty name to keywords
   */
  public SpecialtyClassifier(Map<String, List<String>> specialties) {
    Map<String, List<Pattern>> compiled = new LinkedHashMap<>();
    specialties.forEach((name, keywords) -> compiled.put(name, wordPatterns(keywords)));
    this.patterns = Collections.unmodifiableMap(compiled);
  }

  /**
   * Scores the text.
   *
   * @param text document text
   * @return specialty to confidence, ordered by specialty name
   */
  public Map<String, Double> classify(String text) {
    String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
    Map<String, Double> scores = new TreeMap<>();
    patterns.forEach((specialty, keywordPatterns) -> {
      int matches = 0;
      for (Pattern pattern : keywordPatterns) {
        Matcher matcher = pattern.matcher(lower);
        while (matcher.find()) {
          matches++;
        }
      }
      if (matches > 0) {
        double raw = Math.min(matches / (double) keywordPatterns.size() * 0.5, 1.0);
        scores.put(specialty, round2(raw));
      }
    });
    return new LinkedHashMap<>(scores);
  }

  static List<Pattern> wordPatterns(List<String> terms) {
    List<Pattern> compiled = new ArrayList<>(terms.size());
    for (String term : terms) {
      compiled.add(Pattern.compile("\\b" + Pattern.quote(term.toLowerCase(Locale.ROOT)) + "\\b"));
    }
    return List.copyOf(compiled);
  }

  private static double round2(double value) {
    return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }
}
