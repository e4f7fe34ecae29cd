package ca.gc.cra.medingest.application.json;

import ca.gc.cra.medingest.domain.document.DataTable;
import ca.gc.cra.medingest.domain.document.DocumentMetadata;
import ca.gc.cra.medingest.domain.document.ExtractedDocument;
import ca.gc.cra.medingest.domain.document.Section;
import ca.gc.cra.medingest.domain.document.StructuredContent;
import ca.gc.cra.medingest.domain.entity.ConditionMatch;
import ca.gc.cra.medingest.domain.entity.EntityType;
import ca.gc.cra.medingest.domain.entity.LabResult;
import ca.gc.cra.medingest.domain.entity.MedicalEntity;
import ca.gc.cra.medingest.domain.entity.NormalizedRecord;
import ca.gc.cra.medingest.domain.run.FileOutcome;
import ca.gc.cra.medingest.domain.run.RunReport;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps domain records to ordered map graphs for {@link JsonWriter}.
 * <p>Field order is fixed, so a record always serializes to the same bytes.</p>
 *
 * @since 0.1.0
 */
public final class RecordJson {
  private RecordJson() {}

  /**
   * Maps an extraction result, including its full content.
   *
   * @param document extraction result
   * @return ordered map
   */
  public static Map<String, Object> extracted(ExtractedDocument document) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("metadata", metadata(document.metadata()));
    map.put("confidence", document.confidence());
    map.put("content", document.content());
    map.put("structured", structured(document.structured()));
    return map;
  }

  /**
   * Maps a normalized record. The source extraction is referenced by metadata and confidence only.
   *
   * @param record normalized record
   * @return ordered map
   */
  public static Map<String, Object> normalized(NormalizedRecord record) {
    Map<String, Object> source = new LinkedHashMap<>();
    source.put("metadata", metadata(record.source().metadata()));
    source.put("confidence", record.source().confidence());

    Map<String, Object> entities = new LinkedHashMap<>();
    entities.put(EntityType.CONDITION.plural(), entities(record.conditions()));
    entities.put(EntityType.MEDICATION.plural(), entities(record.medications()));
    entities.put(EntityType.SYMPTOM.plural(), entities(record.symptoms()));
    entities.put(EntityType.LAB_RESULT.plural(), labResults(record.labResults()));
    entities.put(EntityType.PROVIDER.plural(), entities(record.providers()));

    Map<String, Object> categories = new LinkedHashMap<>();
    record.conditionCategories().forEach((category, matches) -> {
      List<Object> items = new ArrayList<>();
      for (ConditionMatch match : matches) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("term", match.term());
        item.put("context", match.context());
        items.add(item);
      }
      categories.put(category, items);
    });

    Map<String, Object> map = new LinkedHashMap<>();
    map.put("source", source);
    map.put("document_type", record.documentType());
    map.put("dates", record.dates());
    map.put("specialties", new LinkedHashMap<>(record.specialties()));
    map.put("entities", entities);
    map.put("condition_categories", categories);
    return map;
  }

  /**
   * Maps a run report.
   *
   * @param report run report
   * @return ordered map
   */
  public static Map<String, Object> report(RunReport report) {
    Map<String, Object> counts = new LinkedHashMap<>();
    report.entityCounts().forEach((type, count) -> counts.put(type.plural(), count));
    List<Object> failures = new ArrayList<>();
    for (FileOutcome outcome : report.failures()) {
      Map<String, Object> item = new LinkedHashMap<>();
      item.put("path", outcome.path());
      item.put("step", outcome.step() == null ? null : outcome.step().name());
      item.put("kind", outcome.errorKind() == null ? null : outcome.errorKind().name());
      item.put("error", outcome.message());
      failures.add(item);
    }
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("timestamp", report.timestamp().toString());
    map.put("total", report.total());
    map.put("success", report.success());
    map.put("failed", report.failed());
    map.put("skipped", report.skipped());
    map.put("unsupported", report.unsupported());
    map.put("entity_counts", counts);
    map.put("failures", failures);
    return map;
  }

  static Map<String, Object> metadata(DocumentMetadata metadata) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("file_path", metadata.sourcePath());
    map.put("file_name", metadata.fileName());
    map.put("extension", metadata.extension());
    map.put("format", metadata.format().id());
    map.put("mime_type", metadata.mimeType());
    map.put("size", metadata.sizeBytes());
    map.put("created", metadata.createdAt() == null ? null : metadata.createdAt().toString());
    map.put("modified", metadata.modifiedAt() == null ? null : metadata.modifiedAt().toString());
    map.put("detected_date", metadata.detectedDate());
    map.put("detected_type", metadata.detectedType());
    return map;
  }

  static Map<String, Object> structured(StructuredContent structured) {
    List<Object> sections = new ArrayList<>();
    for (Section section : structured.sections()) {
      Map<String, Object> item = new LinkedHashMap<>();
      item.put("title", section.title());
      item.put("content", section.content());
      sections.add(item);
    }
    List<Object> tables = new ArrayList<>();
    for (DataTable table : structured.tables()) {
      Map<String, Object> item = new LinkedHashMap<>();
      item.put("headers", table.headers());
      item.put("rows", table.rows());
      tables.add(item);
    }
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("sections", sections);
    map.put("tables", tables);
    map.put("dates", structured.contentDates());
    map.put("providers", structured.providers());
    map.put("attributes", structured.attributes());
    return map;
  }

  static List<Object> entities(List<MedicalEntity> entities) {
    List<Object> items = new ArrayList<>();
    for (MedicalEntity entity : entities) {
      Map<String, Object> item = new LinkedHashMap<>();
      item.put("text", entity.text());
      item.put("standard_name", entity.standardName());
      item.put("code", entity.code());
      item.put("standardization_confidence", entity.standardizationConfidence());
      item.put("source", entity.source());
      if (!entity.attributes().isEmpty()) {
        item.put("attributes", entity.attributes());
      }
      items.add(item);
    }
    return items;
  }

  static List<Object> labResults(List<LabResult> results) {
    List<Object> items = new ArrayList<>();
    for (LabResult result : results) {
      Map<String, Object> item = new LinkedHashMap<>();
      item.put("test_name", result.testName());
      item.put("raw_name", result.rawName());
      item.put("value", result.value());
      item.put("unit", result.unit());
      item.put("reference_range", result.referenceRange());
      item.put("is_abnormal", result.abnormal());
      items.add(item);
    }
    return items;
  }
}
