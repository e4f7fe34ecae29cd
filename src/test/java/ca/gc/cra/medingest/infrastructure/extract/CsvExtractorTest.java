package ca.gc.cra.medingest.infrastructure.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.medingest.domain.document.DataTable;
import ca.gc.cra.medingest.domain.document.ExtractedDocument;
import ca.gc.cra.medingest.testutil.DocumentFixtures;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvExtractorTest {
  private final CsvExtractor extractor = new CsvExtractor(new FileMetadataReader(), new TextDecoder());

  @TempDir Path dir;

  @Test
  void symptomLogBecomesTableWithRoleColumns() throws Exception {
    Path file = DocumentFixtures.writeText(dir.resolve("symptoms.csv"),
        "date,symptom,severity\n"
            + "2024-01-02,headache,7\n"
            + "2024-01-03,\"nausea, mild\",3\n");

    ExtractedDocument doc = extractor.extract(file);

    assertEquals(1.0, doc.confidence());
    assertEquals(1, doc.structured().tables().size());
    DataTable table = doc.structured().tables().get(0);
    assertEquals(List.of("date", "symptom", "severity"), table.headers());
    assertEquals(2, table.rows().size());
    assertEquals("nausea, mild", table.rows().get(1).get("symptom"));

    Map<String, String> attributes = doc.structured().attributes();
    assertEquals("symptom_tracking", attributes.get("data_type"));
    assertEquals("2", attributes.get("row_count"));
    assertEquals("date,symptom,severity", attributes.get("columns"));
    assertEquals("symptom", attributes.get("symptom_columns"));
    assertEquals("date", attributes.get("date_columns"));
    assertEquals("severity", attributes.get("severity_columns"));
    assertFalse(attributes.containsKey("provider_columns"));

    assertTrue(doc.content().startsWith("date, symptom, severity\n"));
    assertTrue(doc.content().contains("date: 2024-01-02; symptom: headache; severity: 7"));
    assertEquals("symptom_tracker", doc.metadata().detectedType());
  }

  @Test
  void numericFirstRowIsTreatedAsData() throws Exception {
    Path file = DocumentFixtures.writeText(dir.resolve("readings.csv"), "120,80\n118,76\n");

    ExtractedDocument doc = extractor.extract(file);

    DataTable table = doc.structured().tables().get(0);
    assertEquals(List.of("column_1", "column_2"), table.headers());
    assertEquals(2, table.rows().size());
    assertEquals("unknown", doc.structured().attributes().get("data_type"));
  }

  @Test
  void blankFileIsAFailure() throws Exception {
    Path file = DocumentFixtures.writeText(dir.resolve("empty.csv"), "\n\n");

    ExtractedDocument doc = extractor.extract(file);

    assertTrue(doc.isFailure());
    assertEquals("[Failed to extract csv content: file is empty]", doc.content());
  }

  @Test
  void parseRecordsHandlesQuotesAndLineEndings() {
    List<List<String>> records = CsvExtractor.parseRecords("a,\"say \"\"hi\"\"\"\r\n\"multi\nline\",b");

    assertEquals(List.of(List.of("a", "say \"hi\""), List.of("multi\nline", "b")), records);
  }

  @Test
  void dataTypeFollowsHeaderVocabulary() {
    assertEquals("lab_results", CsvExtractor.dataType(List.of("Test Name", "Result")));
    assertEquals("medical_timeline", CsvExtractor.dataType(List.of("Visit_Date", "Notes")));
    assertEquals("symptom_tracking", CsvExtractor.dataType(List.of("Day", "Diagnosis")));
    assertEquals("unknown", CsvExtractor.dataType(List.of("a", "b")));
  }
}
