package ca.gc.cra.medingest.infrastructure.extract;

import ca.gc.cra.medingest.domain.document.Section;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Secondary extraction shared by all formats: body dates, clinical sections, provider names and document type.
 *
 * @since 0.1.0
 */
public final class ContentMiner {
  private static final Pattern NUMERIC_DATE =
      Pattern.compile("\\b(\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}|\\d{4}[/-]\\d{1,2}[/-]\\d{1,2})\\b");
  private static final String MONTH =
      "(?:Jan(?:uary)?|Feb(?:ruary)?|Mar(?:ch)?|Apr(?:il)?|May|June?|July?|Aug(?:ust)?|Sep(?:t(?:ember)?)?"
          + "|Oct(?:ober)?|Nov(?:ember)?|Dec(?:ember)?)";
  private static final Pattern NAMED_DATE = Pattern.compile(
      "\\b(" + MONTH + "\\.? \\d{1,2}, \\d{4}|\\d{1,2} " + MONTH + "\\.? \\d{4})\\b");
  private static final Pattern DOCTOR = Pattern.compile("\\bDr\\.?\\s+([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)?)");
  private static final Pattern CREDENTIAL = Pattern.compile(
      "\\b([A-Z][a-z]+(?:\\s+[A-Z]\\.)?\\s+[A-Z][a-z]+),\\s*(?:MD|DO|M\\.D\\.|D\\.O\\.)(?![A-Za-z])");
  private static final Pattern LABELLED_PROVIDER = Pattern.compile(
      "(?:Provider|Physician|Attending|Consultant|Seen by|Evaluated by):\\s*(?:Dr\\.?\\s*)?"
          + "([A-Z][a-z]+\\s+[A-Z][a-z]+)");
  private static final List<String> CLINICAL_HEADINGS = List.of(
      "ASSESSMENT", "DIAGNOSIS", "DIAGNOSES", "MEDICATIONS", "ALLERGIES", "HISTORY", "PHYSICAL EXAMINATION",
      "LABS", "LABORATORY", "PLAN", "CHIEF COMPLAINT", "HISTORY OF PRESENT ILLNESS", "PAST MEDICAL HISTORY",
      "IMPRESSION", "FOLLOW-UP");
  private static final Pattern RX = Pattern.compile("\\brx\\b");
  private static final Pattern CAPS_LINE = Pattern.compile("^[A-Z][A-Z0-9 &/()\\-]*:?$");

  private ContentMiner() {
    // Utility
  }

  /**
   * Collects raw date strings from body text in order of appearance, without duplicates.
   *
   * @param text body text
   * @return raw date strings
   */
  public static List<String> dates(String text) {
    Set<String> found = new LinkedHashSet<>();
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    Matcher numeric = NUMERIC_DATE.matcher(text);
    while (numeric.find()) {
      found.add(numeric.group(1));
    }
    Matcher named = NAMED_DATE.matcher(text);
    while (named.find()) {
      found.add(named.group(1).replace(".", ""));
    }
    return List.copyOf(found);
  }

  /**
   * Collects provider names from {@code Dr. <Name>}, {@code <Name>, MD|DO} and labelled lines.
   *
   * @param text body text
   * @return provider names in order of appearance, without duplicates
   */
  public static List<String> providers(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    List<Mention> mentions = new ArrayList<>();
    collect(DOCTOR, text, "Dr. ", mentions);
    collect(CREDENTIAL, text, "", mentions);
    collect(LABELLED_PROVIDER, text, "", mentions);
    mentions.sort(Comparator.comparingInt(Mention::position));
    Set<String> result = new LinkedHashSet<>();
    Set<String> bareNames = new LinkedHashSet<>();
    for (Mention mention : mentions) {
      String name = mention.name();
      String bare = name.startsWith("Dr. ") ? name.substring(4) : name;
      if (bareNames.add(bare)) {
        result.add(name);
      }
    }
    return List.copyOf(result);
  }

  /**
   * Splits plain text into sections at clinical headings and short ALL-CAPS lines.
   * Text before the first heading is not a section.
   *
   * @param text body text
   * @return sections in document order
   */
  public static List<Section> sections(String text) {
    List<Section> sections = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return sections;
    }
    String title = null;
    StringBuilder body = new StringBuilder();
    for (String line : text.split("\\R")) {
      String heading = heading(line);
      if (heading != null) {
        if (title != null) {
          sections.add(new Section(title, body.toString().trim()));
        }
        title = heading;
        body.setLength(0);
        String remainder = inlineRemainder(line);
        if (!remainder.isEmpty()) {
          body.append(remainder).append('\n');
        }
      } else if (title != null) {
        body.append(line).append('\n');
      }
    }
    if (title != null) {
      sections.add(new Section(title, body.toString().trim()));
    }
    return sections;
  }

  /**
   * Classifies the document, consulting file-name keywords before content keywords.
   *
   * @param path source file
   * @param text body text
   * @return document type label
   */
  public static String documentType(Path path, String text) {
    Path fileName = path.getFileName();
    String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
    if (name.contains("lab") || name.contains("test")) {
      return "lab_result";
    }
    if (name.contains("note") || name.contains("clinical") || name.contains("doctor")) {
      return "clinical_note";
    }
    if (name.contains("xray") || name.contains("mri") || name.contains("ct_") || name.contains("ct-")) {
      return "imaging";
    }
    if (name.contains("history") || name.contains("story")) {
      return "patient_history";
    }
    if (name.contains("timeline")) {
      return "medical_timeline";
    }
    if (name.contains("symptom")) {
      return "symptom_tracker";
    }
    String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
    if (lower.contains("lab") && lower.contains("result")) {
      return "lab_report";
    }
    if (lower.contains("radiology") || lower.contains("imaging") || lower.contains("x-ray")) {
      return "imaging_report";
    }
    if (lower.contains("assessment") && lower.contains("plan")) {
      return "clinical_note";
    }
    if (lower.contains("prescription") || RX.matcher(lower).find()) {
      return "prescription";
    }
    if (lower.contains("discharge") && lower.contains("summary")) {
      return "discharge_summary";
    }
    if (lower.contains("referral")) {
      return "referral";
    }
    if (lower.contains("progress") && lower.contains("note")) {
      return "progress_note";
    }
    if (lower.contains("history") && lower.contains("physical")) {
      return "history_physical";
    }
    return "medical_document";
  }

  private static String heading(String line) {
    String trimmed = line.trim();
    if (trimmed.isEmpty()) {
      return null;
    }
    int colon = trimmed.indexOf(':');
    String label = colon > 0 ? trimmed.substring(0, colon).trim() : trimmed;
    String upper = label.toUpperCase(Locale.ROOT);
    if (CLINICAL_HEADINGS.contains(upper) && (colon > 0 || label.equals(upper))) {
      return upper;
    }
    if (trimmed.length() <= 60 && CAPS_LINE.matcher(trimmed).matches() && letters(trimmed) >= 3) {
      return trimmed.endsWith(":") ? trimmed.substring(0, trimmed.length() - 1).trim() : trimmed;
    }
    return null;
  }

  private static String inlineRemainder(String line) {
    int colon = line.indexOf(':');
    return colon < 0 ? "" : line.substring(colon + 1).trim();
  }

  private static int letters(String text) {
    int count = 0;
    for (int i = 0; i < text.length(); i++) {
      if (Character.isLetter(text.charAt(i))) {
        count++;
      }
    }
    return count;
  }

  private static void collect(Pattern pattern, String text, String prefix, List<Mention> mentions) {
    Matcher matcher = pattern.matcher(text);
    while (matcher.find()) {
      mentions.add(new Mention(matcher.start(), prefix + matcher.group(1).trim()));
    }
  }

  private record Mention(int position, String name) {}
}
