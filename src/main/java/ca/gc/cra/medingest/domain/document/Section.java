package ca.gc.cra.medingest.domain.document;

import java.util.Objects;

/**
 * Titled block of document text detected from headings, styles or ALL-CAPS lines.
 *
 * @param title heading text as it appeared in the source
 * @param content text between this heading and the next one
 * @since 0.1.0
 */
public record Section(String title, String content) {
  public Section {
    Objects.requireNonNull(title, "title");
    content = content == null ? "" : content;
  }
}
