package ca.gc.cra.medingest.domain.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Format-specific secondary extraction attached to an {@link ExtractedDocument}.
 *
 * @param sections detected sections in document order
 * @param tables tables in document order
 * @param contentDates raw date strings mined from the body text, in order of appearance
 * @param providers provider names mined from the body text, de-duplicated, in order of appearance
 * @param attributes format-specific scalar attributes (page counts, CSV data type, column roles, title)
 * @since 0.1.0
 */
public record StructuredContent(
    List<Section> sections,
    List<DataTable> tables,
    List<String> contentDates,
    List<String> providers,
    Map<String, String> attributes) {

  private static final StructuredContent EMPTY =
      new StructuredContent(List.of(), List.of(), List.of(), List.of(), Map.of());

  public StructuredContent {
    sections = sections == null ? List.of() : List.copyOf(sections);
    tables = tables == null ? List.of() : List.copyOf(tables);
    contentDates = contentDates == null ? List.of() : List.copyOf(contentDates);
    providers = providers == null ? List.of() : List.copyOf(providers);
    attributes = attributes == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  /**
   * Returns a structure with no secondary extraction.
   *
   * @return empty structure
   */
  public static StructuredContent empty() {
    return EMPTY;
  }
}
