package ca.gc.cra.medingest.domain.entity;

import java.util.Locale;
import java.util.Optional;

/**
 * Entity families tracked in normalized records, run reports and embedding metadata.
 *
 * @since 0.1.0
 */
public enum EntityType {
  CONDITION("condition", "conditions"),
  MEDICATION("medication", "medications"),
  SYMPTOM("symptom", "symptoms"),
  LAB_RESULT("lab_result", "lab_results"),
  PROVIDER("provider", "providers");

  private final String singular;
  private final String plural;

  EntityType(String singular, String plural) {
    this.singular = singular;
    this.plural = plural;
  }

  /**
   * Returns the singular key used in embedding metadata (e.g. {@code condition}).
   *
   * @return singular key
   */
  public String singular() {
    return singular;
  }

  /**
   * Returns the plural key used in JSON artifacts and reports (e.g. {@code conditions}).
   *
   * @return plural key
   */
  public String plural() {
    return plural;
  }

  /**
   * Resolves either the singular or plural key, case-insensitively.
   *
   * @param raw key such as {@code Condition} or {@code lab_results}
   * @return matching type, or empty when unknown
   */
  public static Optional<EntityType> fromKey(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String key = raw.trim().toLowerCase(Locale.ROOT);
    for (EntityType type : values()) {
      if (type.singular.equals(key) || type.plural.equals(key) || type.name().equalsIgnoreCase(key)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
