package ca.gc.cra.medingest.application.normalize;

import java.util.Map;

/**
 * Canonical laboratory test names and units.
 * <p>Keys are lower-case. Test-name keys are compared after {@code test} and {@code level} are removed from
 * the raw name; the first entry in table order whose key equals, prefixes or suffixes the cleaned name wins.</p>
 *
 * @since 0.1.0
 */
public final class LabVocabulary {
  private LabVocabulary() {
    // Utility
  }

  /** Raw unit (lower-case) to canonical unit. */
  public static final Map<String, String> UNITS = ClinicalVocabulary.ordered(
      "mg/dl", "mg/dL",
      "mg/l", "mg/L",
      "g/dl", "g/dL",
      "g/l", "g/L",
      "mmol/l", "mmol/L",
      "umol/l", "µmol/L",
      "µmol/l", "µmol/L",
      "pmol/l", "pmol/L",
      "k/ul", "10^3/µL",
      "k/µl", "10^3/µL",
      "10^3/ul", "10^3/µL",
      "10^3/µl", "10^3/µL",
      "x10^9/l", "10^9/L",
      "10^9/l", "10^9/L",
      "m/ul", "10^6/µL",
      "m/µl", "10^6/µL",
      "10^6/ul", "10^6/µL",
      "10^6/µl", "10^6/µL",
      "x10^12/l", "10^12/L",
      "10^12/l", "10^12/L",
      "iu/l", "U/L",
      "u/l", "U/L",
      "meq/l", "mEq/L",
      "ng/ml", "ng/mL",
      "pg/ml", "pg/mL",
      "µg/dl", "µg/dL",
      "ug/dl", "µg/dL",
      "mcg/dl", "µg/dL",
      "miu/l", "mIU/L",
      "uiu/ml", "mIU/L",
      "µiu/ml", "mIU/L",
      "%", "%",
      "fl", "fL",
      "pg", "pg");

  /** Cleaned test name (lower-case) to canonical name, grouped by panel. */
  public static final Map<String, String> TEST_NAMES = ClinicalVocabulary.ordered(
      // Complete blood count
      "wbc count", "White Blood Cell Count",
      "white blood cell count", "White Blood Cell Count",
      "white blood cells", "White Blood Cell Count",
      "white blood cell", "White Blood Cell Count",
      "white cell count", "White Blood Cell Count",
      "leukocytes", "White Blood Cell Count",
      "wbc", "White Blood Cell Count",
      "red blood cell count", "Red Blood Cell Count",
      "red blood cells", "Red Blood Cell Count",
      "red blood cell", "Red Blood Cell Count",
      "red cell count", "Red Blood Cell Count",
      "erythrocytes", "Red Blood Cell Count",
      "rbc", "Red Blood Cell Count",
      "mean corpuscular hemoglobin concentration", "Mean Corpuscular Hemoglobin Concentration",
      "mean corpuscular hemoglobin", "Mean Corpuscular Hemoglobin",
      "mean corpuscular volume", "Mean Corpuscular Volume",
      "mchc", "Mean Corpuscular Hemoglobin Concentration",
      "mch", "Mean Corpuscular Hemoglobin",
      "mcv", "Mean Corpuscular Volume",
      "hemoglobin a1c", "Hemoglobin A1c",
      "hba1c", "Hemoglobin A1c",
      "a1c", "Hemoglobin A1c",
      "hemoglobin", "Hemoglobin",
      "haemoglobin", "Hemoglobin",
      "hgb", "Hemoglobin",
      "hb", "Hemoglobin",
      "hematocrit", "Hematocrit",
      "haematocrit", "Hematocrit",
      "packed cell volume", "Hematocrit",
      "hct", "Hematocrit",
      "pcv", "Hematocrit",
      "platelet count", "Platelet Count",
      "platelets", "Platelet Count",
      "thrombocytes", "Platelet Count",
      "plt", "Platelet Count",
      // Metabolic panel
      "fasting blood glucose", "Glucose (Fasting)",
      "fasting glucose", "Glucose (Fasting)",
      "fbg", "Glucose (Fasting)",
      "blood glucose", "Glucose",
      "glucose", "Glucose",
      "blood urea nitrogen", "Blood Urea Nitrogen",
      "bun", "Blood Urea Nitrogen",
      "urea", "Blood Urea Nitrogen",
      "creatinine", "Creatinine",
      "creat", "Creatinine",
      "sodium", "Sodium",
      "na+", "Sodium",
      "na", "Sodium",
      "potassium", "Potassium",
      "k+", "Potassium",
      "k", "Potassium",
      "chloride", "Chloride",
      "cl-", "Chloride",
      "cl", "Chloride",
      "carbon dioxide", "Carbon Dioxide",
      "bicarbonate", "Carbon Dioxide",
      "hco3-", "Carbon Dioxide",
      "hco3", "Carbon Dioxide",
      "co2", "Carbon Dioxide",
      "calcium", "Calcium",
      "ca++", "Calcium",
      "ca", "Calcium",
      "phosphorus", "Phosphorus",
      "phosphate", "Phosphorus",
      "phos", "Phosphorus",
      // Liver panel
      "alanine aminotransferase", "Alanine Aminotransferase",
      "sgpt", "Alanine Aminotransferase",
      "alt", "Alanine Aminotransferase",
      "aspartate aminotransferase", "Aspartate Aminotransferase",
      "sgot", "Aspartate Aminotransferase",
      "ast", "Aspartate Aminotransferase",
      "gamma-glutamyl transferase", "Gamma-Glutamyl Transferase",
      "gamma gt", "Gamma-Glutamyl Transferase",
      "ggt", "Gamma-Glutamyl Transferase",
      "alkaline phosphatase", "Alkaline Phosphatase",
      "alp", "Alkaline Phosphatase",
      "lactate dehydrogenase", "Lactate Dehydrogenase",
      "ldh", "Lactate Dehydrogenase",
      "total bilirubin", "Total Bilirubin",
      "bilirubin, total", "Total Bilirubin",
      "bilirubin total", "Total Bilirubin",
      "direct bilirubin", "Direct Bilirubin",
      "bilirubin, direct", "Direct Bilirubin",
      "bilirubin direct", "Direct Bilirubin",
      "indirect bilirubin", "Indirect Bilirubin",
      "bilirubin, indirect", "Indirect Bilirubin",
      "bilirubin indirect", "Indirect Bilirubin",
      "total protein", "Total Protein",
      "protein, total", "Total Protein",
      "protein total", "Total Protein",
      "albumin/globulin ratio", "Albumin/Globulin Ratio",
      "a/g ratio", "Albumin/Globulin Ratio",
      "albumin", "Albumin",
      "alb", "Albumin",
      "globulin", "Globulin",
      "glob", "Globulin",
      // Lipid panel
      "total cholesterol", "Total Cholesterol",
      "cholesterol, total", "Total Cholesterol",
      "cholesterol total", "Total Cholesterol",
      "triglycerides", "Triglycerides",
      "tg", "Triglycerides",
      "hdl cholesterol", "HDL Cholesterol",
      "hdl-c", "HDL Cholesterol",
      "hdl", "HDL Cholesterol",
      "vldl cholesterol", "VLDL Cholesterol",
      "vldl-c", "VLDL Cholesterol",
      "vldl", "VLDL Cholesterol",
      "ldl cholesterol", "LDL Cholesterol",
      "ldl-c", "LDL Cholesterol",
      "ldl", "LDL Cholesterol",
      // Iron studies
      "total iron binding capacity", "Total Iron Binding Capacity",
      "tibc", "Total Iron Binding Capacity",
      "ferritin", "Ferritin",
      "transferrin", "Transferrin",
      "iron", "Iron",
      "fe", "Iron",
      // Thyroid
      "thyroid stimulating hormone", "Thyroid Stimulating Hormone",
      "tsh", "Thyroid Stimulating Hormone",
      "free t3", "Free Triiodothyronine (Free T3)",
      "ft3", "Free Triiodothyronine (Free T3)",
      "free t4", "Free Thyroxine (Free T4)",
      "ft4", "Free Thyroxine (Free T4)",
      "total t3", "Triiodothyronine (T3)",
      "triiodothyronine", "Triiodothyronine (T3)",
      "t3", "Triiodothyronine (T3)",
      "total t4", "Thyroxine (T4)",
      "thyroxine", "Thyroxine (T4)",
      "t4", "Thyroxine (T4)");
}
