/**
 * Entity normalization: dates, specialties, condition categories, lab results and standardized entities.
 * <p>Everything here is free of I/O. Lookup tables are immutable and ordered, which keeps normalization
 * deterministic.</p>
 */
package ca.gc.cra.medingest.application.normalize;
