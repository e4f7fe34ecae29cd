package ca.gc.cra.medingest.application.normalize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> Fixed lookup tables for specialties, condition categories, symptoms and canonical
 * condition/medication names.
 * <p><strong>Role:</strong> Immutable reference data shared by the normalizer components.</p>
 * <p><strong>Thread-safety:</strong> All tables are unmodifiable and built once at class initialization.</p>
 * <p>Iteration order is fixed so normalization output never depends on hash ordering.</p>
 *
 * @since 0.1.0
 */
public final class ClinicalVocabulary {
  private ClinicalVocabulary() {
    // Utility
  }

  /** Specialty name to keywords; confidence scales with the keyword count of each specialty. */
  public static final Map<String, List<String>> SPECIALTIES = orderedLists(
      "rheumatology", List.of("rheumatology", "rheumatologist", "arthritis", "joints", "connective tissue"),
      "neurology", List.of("neurology", "neurologist", "brain", "nerve", "spinal", "seizure", "migraine"),
      "cardiology", List.of("cardiology", "cardiologist", "heart", "cardiac", "ecg", "echocardiogram"),
      "gastroenterology",
      List.of("gastroenterology", "gastroenterologist", "stomach", "intestine", "colon", "bowel"),
      "endocrinology", List.of("endocrinology", "endocrinologist", "hormone", "thyroid", "diabetes"),
      "psychiatry", List.of("psychiatry", "psychiatrist", "mental health", "depression", "anxiety", "adhd"),
      "genetics", List.of("genetics", "geneticist", "dna", "chromosome", "mutation"),
      "immunology", List.of("immunology", "immunologist", "allergy", "immune", "autoimmune"),
      "dermatology", List.of("dermatology", "dermatologist", "skin", "rash", "eczema"),
      "orthopedics", List.of("orthopedics", "orthopedist", "bone", "joint", "fracture", "spine"),
      "primary care",
      List.of("primary care", "family medicine", "general practice", "internist", "family physician"));

  /** Condition category to the terms that place a document in it. */
  public static final Map<String, List<String>> CONDITION_CATEGORIES = orderedLists(
      "eds", List.of("ehlers-danlos", "ehlers danlos", "hypermobility", "eds", "heds", "eds-ht",
          "joint hypermobility", "skin elasticity", "hypermobile", "beighton"),
      "pots", List.of("pots", "postural orthostatic tachycardia", "dysautonomia", "orthostatic intolerance",
          "tachycardia", "postural tachycardia"),
      "mcas", List.of("mcas", "mast cell activation", "mast cell", "histamine", "mastocytosis",
          "mast cell mediator"),
      "asd", List.of("autism", "autistic", "asd", "asperger", "neurodivergent", "sensory processing",
          "stimming", "special interest", "social communication", "repetitive behavior", "overstimulation"),
      "adhd", List.of("adhd", "attention deficit", "hyperactivity", "executive function", "impulsivity",
          "inattention", "dopamine", "executive dysfunction"),
      "chronic_pain", List.of("chronic pain", "fibromyalgia", "myalgia", "pain syndrome", "constant pain",
          "persistent pain", "pain management"));

  /** Symptom vocabulary matched on word boundaries; longer phrases win over the words they contain. */
  public static final List<String> SYMPTOMS = List.of(
      "pain", "joint pain", "chest pain", "abdominal pain", "back pain", "headache", "fatigue",
      "chronic fatigue", "dizziness", "nausea", "vomiting", "diarrhea", "constipation", "fever",
      "palpitations", "shortness of breath", "brain fog", "insomnia", "fainting", "syncope", "bruising",
      "numbness", "tingling", "rash", "weakness", "light sensitivity", "sensory sensitivity");

  /** Condition synonyms (lower-case) to canonical names. */
  public static final Map<String, String> CONDITION_NAMES = ordered(
      "diabetes", "Diabetes Mellitus",
      "diabetes mellitus", "Diabetes Mellitus",
      "dm", "Diabetes Mellitus",
      "t1d", "Type 1 Diabetes Mellitus",
      "t2d", "Type 2 Diabetes Mellitus",
      "hypertension", "Hypertension",
      "htn", "Hypertension",
      "high blood pressure", "Hypertension",
      "asthma", "Asthma",
      "gerd", "Gastroesophageal Reflux Disease",
      "acid reflux", "Gastroesophageal Reflux Disease",
      "migraine", "Migraine",
      "migraine headache", "Migraine",
      "eds", "Ehlers-Danlos Syndrome",
      "ehlers danlos", "Ehlers-Danlos Syndrome",
      "ehlers-danlos", "Ehlers-Danlos Syndrome",
      "ehlers-danlos syndrome", "Ehlers-Danlos Syndrome",
      "heds", "Hypermobile Ehlers-Danlos Syndrome",
      "hypermobile eds", "Hypermobile Ehlers-Danlos Syndrome",
      "asd", "Autism Spectrum Disorder",
      "autism", "Autism Spectrum Disorder",
      "autism spectrum disorder", "Autism Spectrum Disorder",
      "adhd", "Attention Deficit Hyperactivity Disorder",
      "add", "Attention Deficit Hyperactivity Disorder",
      "pots", "Postural Orthostatic Tachycardia Syndrome",
      "postural orthostatic tachycardia syndrome", "Postural Orthostatic Tachycardia Syndrome");

  /** Canonical condition name (lower-case) to ICD-10 code. */
  public static final Map<String, String> ICD10_CODES = ordered(
      "diabetes mellitus", "E11.9",
      "type 1 diabetes mellitus", "E10.9",
      "type 2 diabetes mellitus", "E11.9",
      "hypertension", "I10",
      "asthma", "J45.909",
      "migraine", "G43.909",
      "gastroesophageal reflux disease", "K21.9",
      "ehlers-danlos syndrome", "Q79.6",
      "hypermobile ehlers-danlos syndrome", "Q79.6",
      "autism spectrum disorder", "F84.0",
      "attention deficit hyperactivity disorder", "F90.9",
      "postural orthostatic tachycardia syndrome", "I49.8",
      "pots", "I49.8");

  /** Medication brand or generic names (lower-case) to generic canonical names. */
  public static final Map<String, String> MEDICATION_NAMES = ordered(
      "tylenol", "Acetaminophen",
      "acetaminophen", "Acetaminophen",
      "ibuprofen", "Ibuprofen",
      "advil", "Ibuprofen",
      "motrin", "Ibuprofen",
      "aspirin", "Aspirin",
      "lisinopril", "Lisinopril",
      "metformin", "Metformin",
      "lipitor", "Atorvastatin",
      "atorvastatin", "Atorvastatin");

  static Map<String, String> ordered(String... pairs) {
    if (pairs.length % 2 != 0) {
      throw new IllegalArgumentException("pairs must have an even length");
    }
    Map<String, String> map = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      map.put(pairs[i], pairs[i + 1]);
    }
    return Collections.unmodifiableMap(map);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, List<String>> orderedLists(Object... pairs) {
    Map<String, List<String>> map = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      map.put((String) pairs[i], List.copyOf((List<String>) pairs[i + 1]));
    }
    return Collections.unmodifiableMap(map);
  }
}
