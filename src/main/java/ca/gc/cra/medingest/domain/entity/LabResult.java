package ca.gc.cra.medingest.domain.entity;

import java.util.Objects;

/**
 * Laboratory value with canonicalized test name and unit.
 * <p>{@code abnormal} is derived once from {@code referenceRange} when the result is created and is never
 * recomputed.</p>
 *
 * @param rawName test name as written in the document
 * @param testName canonical test name, or the raw name when not in the lookup table
 * @param value numeric value
 * @param unit canonical unit, or the raw unit when not in the lookup table; may be empty
 * @param referenceRange reference range text; empty when the document gave none
 * @param abnormal whether the value falls outside the reference range
 * @since 0.1.0
 */
public record LabResult(
    String rawName,
    String testName,
    double value,
    String unit,
    String referenceRange,
    boolean abnormal) {

  public LabResult {
    Objects.requireNonNull(rawName, "rawName");
    testName = testName == null || testName.isBlank() ? rawName : testName;
    unit = unit == null ? "" : unit;
    referenceRange = referenceRange == null ? "" : referenceRange;
  }
}
