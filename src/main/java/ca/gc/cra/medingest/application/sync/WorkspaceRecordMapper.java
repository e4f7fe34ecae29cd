package ca.gc.cra.medingest.application.sync;

import ca.gc.cra.medingest.domain.entity.EntityType;
import ca.gc.cra.medingest.domain.entity.LabResult;
import ca.gc.cra.medingest.domain.entity.MedicalEntity;
import ca.gc.cra.medingest.domain.entity.NormalizedRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Flattens a normalized record into property maps for the workspace sync target.
 * <p>One {@code documents} record per file, then one record per entity keyed by the entity family's plural
 * name. Field names are {@code name}, {@code standard_name}, {@code code}, {@code confidence}, {@code date},
 * {@code source_file}, and for lab results {@code value}, {@code unit}, {@code reference_range} and
 * {@code is_abnormal}.</p>
 *
 * @since 0.1.0
 */
public final class WorkspaceRecordMapper {
  /** Entity type key used for the per-document record. */
  public static final String DOCUMENTS = "documents";

  /**
   * Flat record ready for {@code WorkspaceSyncPort.push}.
   *
   * @param entityType plural entity key or {@link #DOCUMENTS}
   * @param properties properties keyed by canonical field name
   */
  public record WorkspaceRecord(String entityType, Map<String, Object> properties) {
    public WorkspaceRecord {
      Objects.requireNonNull(entityType, "entityType");
      properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }
  }

  /**
   * Maps one normalized record.
   *
   * @param record normalized record
   * @return document record followed by entity records
   */
  public List<WorkspaceRecord> map(NormalizedRecord record) {
    String sourceFile = record.source().metadata().fileName();
    String date = record.dates().isEmpty() ? null : record.dates().get(0);
    List<WorkspaceRecord> out = new ArrayList<>();

    Map<String, Object> document = new LinkedHashMap<>();
    document.put("name", sourceFile);
    document.put("document_type", record.documentType());
    document.put("date", date);
    document.put("source_file", sourceFile);
    document.put("confidence", record.source().confidence());
    document.put("specialties", String.join(", ", record.specialties().keySet()));
    out.add(new WorkspaceRecord(DOCUMENTS, document));

    for (EntityType type : EntityType.values()) {
      if (type == EntityType.LAB_RESULT) {
        for (LabResult lab : record.labResults()) {
          out.add(new WorkspaceRecord(type.plural(), lab(lab, date, sourceFile)));
        }
      } else {
        for (MedicalEntity entity : record.entities(type)) {
          out.add(new WorkspaceRecord(type.plural(), entity(entity, date, sourceFile)));
        }
      }
    }
    return out;
  }

  private static Map<String, Object> entity(MedicalEntity entity, String date, String sourceFile) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("name", entity.text());
    map.put("standard_name", entity.standardName());
    map.put("code", entity.code());
    map.put("confidence", entity.standardizationConfidence());
    map.put("date", date);
    map.put("source_file", sourceFile);
    map.put("source", entity.source());
    entity.attributes().forEach(map::put);
    return map;
  }

  private static Map<String, Object> lab(LabResult lab, String date, String sourceFile) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("name", lab.rawName());
    map.put("standard_name", lab.testName());
    map.put("value", lab.value());
    map.put("unit", lab.unit());
    map.put("reference_range", lab.referenceRange());
    map.put("is_abnormal", lab.abnormal());
    map.put("date", date);
    map.put("source_file", sourceFile);
    return map;
  }
}
