package ca.gc.cra.medingest.infrastructure.detect;

import ca.gc.cra.medingest.application.port.SniffSample;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/** Byte and text heuristics used when a file's extension does not identify its format. */
final class FormatSignatures {
  private static final byte[] PDF = "%PDF".getBytes(StandardCharsets.US_ASCII);
  private static final byte[] RTF = "{\\rtf".getBytes(StandardCharsets.US_ASCII);
  private static final byte[] ZIP = {'P', 'K', 3, 4};

  private FormatSignatures() {
    // Utility
  }

  static boolean looksLikePdf(SniffSample sample) {
    return sample.startsWith(PDF);
  }

  static boolean looksLikeRtf(SniffSample sample) {
    return sample.startsWith(RTF);
  }

  static boolean looksLikeWordContainer(SniffSample sample) {
    return sample.startsWith(ZIP);
  }

  static boolean looksLikeHtml(SniffSample sample) {
    String head = new String(sample.bytes(), StandardCharsets.ISO_8859_1).stripLeading().toLowerCase(Locale.ROOT);
    if (head.startsWith("<!doctype html") || head.startsWith("<html")) {
      return true;
    }
    return sample.utf8Text()
        .map(text -> text.toLowerCase(Locale.ROOT))
        .map(text -> text.contains("<html") || text.contains("<body") || text.contains("<div"))
        .orElse(false);
  }

  static boolean looksLikeCsv(SniffSample sample) {
    return sample.utf8Text().map(text -> {
      int newline = text.indexOf('\n');
      if (newline < 0) {
        return false;
      }
      String firstLine = text.substring(0, newline);
      return firstLine.chars().filter(c -> c == ',').count() >= 2;
    }).orElse(false);
  }

  static boolean looksLikeMarkdown(SniffSample sample) {
    return sample.utf8Text().map(text -> {
      for (String line : text.split("\\R")) {
        if (line.startsWith("# ") || line.startsWith("## ") || line.startsWith("- ")) {
          return true;
        }
      }
      return false;
    }).orElse(false);
  }

  static boolean looksLikeText(SniffSample sample) {
    return sample.utf8Text().isPresent();
  }
}
