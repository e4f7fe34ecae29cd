package ca.gc.cra.medingest.infrastructure.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import ca.gc.cra.medingest.domain.document.DocumentFormat;
import ca.gc.cra.medingest.domain.document.ExtractedDocument;
import ca.gc.cra.medingest.testutil.DocumentFixtures;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RtfExtractorTest {
  @TempDir Path dir;

  @Test
  void controlWordsAndDestinationsAreRemoved() {
    String rtf = "{\\rtf1\\ansi{\\fonttbl{\\f0 Arial;}}{\\*\\generator Writer;}"
        + "\\f0 Patient reports fatigue.\\par Caf\\'e9 visit\\par\\u8226?follow-up}";

    assertEquals("Patient reports fatigue.\nCafé visit\n•follow-up", RtfExtractor.toPlainText(rtf));
  }

  @Test
  void escapedBracesAndTabsArePreserved() {
    assertEquals("dose {a}\tb", RtfExtractor.toPlainText("{\\rtf1 dose \\{a\\}\\tab b}"));
  }

  @Test
  void rtfFileIsExtractedWithFullConfidence() throws Exception {
    Path file = DocumentFixtures.writeText(dir.resolve("letter.rtf"), "{\\rtf1\\ansi Referral letter\\par Dr. Moreau}");

    ExtractedDocument doc = new RtfExtractor(new FileMetadataReader()).extract(file);

    assertFalse(doc.isFailure());
    assertEquals(1.0, doc.confidence());
    assertEquals("Referral letter\nDr. Moreau", doc.content());
    assertEquals(DocumentFormat.RTF, doc.metadata().format());
    assertEquals("referral", doc.metadata().detectedType());
  }
}
