package ca.gc.cra.medingest.infrastructure.extract;

import ca.gc.cra.medingest.domain.document.DocumentFormat;
import ca.gc.cra.medingest.domain.document.StructuredContent;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import javax.swing.text.DefaultStyledDocument;
import javax.swing.text.rtf.RTFEditorKit;

/**
 * Extracts Rich Text Format.
 * <p>The primary parser walks control words and groups directly, skipping destinations such as font tables,
 * stylesheets and embedded pictures. The fallback is the JDK {@link RTFEditorKit}, capped at
 * {@value AttemptChain#FALLBACK_CAP}.</p>
 *
 * @since 0.1.0
 */
public final class RtfExtractor extends AbstractDocumentExtractor {
  private static final Set<String> SKIPPED_DESTINATIONS = Set.of(
      "fonttbl", "colortbl", "stylesheet", "info", "pict", "object", "header", "footer", "headerl",
      "headerr", "footerl", "footerr", "xmlnstbl", "listtable", "listoverridetable", "themedata",
      "colorschememapping", "latentstyles", "datastore", "generator", "rsidtbl", "filetbl", "revtbl");

  private final AttemptChain chain = AttemptChain.primary("rtf-control-words", RtfExtractor::stripControlWords)
      .then("rtf-editor-kit", RtfExtractor::editorKit)
      .build();

  public RtfExtractor(FileMetadataReader metadataReader) {
    super(metadataReader);
  }

  @Override
  public DocumentFormat format() {
    return DocumentFormat.RTF;
  }

  @Override
  protected AttemptResult parse(Path path) {
    return chain.run(path);
  }

  private static AttemptResult stripControlWords(Path path) throws Exception {
    String rtf = new String(Files.readAllBytes(path), StandardCharsets.ISO_8859_1);
    if (!rtf.startsWith("{\\rtf")) {
      return AttemptResult.failure("missing {\\rtf header");
    }
    return AttemptResult.success(toPlainText(rtf), 1.0, StructuredContent.empty());
  }

  private static AttemptResult editorKit(Path path) throws Exception {
    RTFEditorKit kit = new RTFEditorKit();
    DefaultStyledDocument document = new DefaultStyledDocument();
    try (InputStream in = new ByteArrayInputStream(Files.readAllBytes(path))) {
      kit.read(in, document, 0);
    }
    return AttemptResult.success(document.getText(0, document.getLength()), 1.0, StructuredContent.empty());
  }

  /**
   * Converts RTF markup to plain text.
   *
   * @param rtf RTF source read as ISO-8859-1
   * @return text with paragraph breaks as newlines
   */
  static String toPlainText(String rtf) {
    StringBuilder out = new StringBuilder();
    // Depth at which an ignored destination started, or -1.
    int depth = 0;
    int skipDepth = -1;
    int ucSkip = 1;
    int pendingSkip = 0;
    int i = 0;
    int length = rtf.length();
    while (i < length) {
      char c = rtf.charAt(i);
      if (c == '{') {
        depth++;
        i++;
        if (skipDepth < 0 && i + 1 < length && rtf.charAt(i) == '\\' && rtf.charAt(i + 1) == '*') {
          skipDepth = depth;
        }
        continue;
      }
      if (c == '}') {
        if (skipDepth == depth) {
          skipDepth = -1;
        }
        depth--;
        i++;
        continue;
      }
      if (c == '\\') {
        if (i + 1 >= length) {
          break;
        }
        char next = rtf.charAt(i + 1);
        if (next == '\\' || next == '{' || next == '}') {
          if (skipDepth < 0) {
            out.append(next);
          }
          i += 2;
          continue;
        }
        if (next == '\'') {
          if (i + 3 < length && skipDepth < 0) {
            if (pendingSkip > 0) {
              pendingSkip--;
            } else {
              out.append((char) Integer.parseInt(rtf.substring(i + 2, i + 4), 16));
            }
          }
          i += 4;
          continue;
        }
        if (!Character.isLetter(next)) {
          if (next == '~' && skipDepth < 0) {
            out.append(' ');
          }
          i += 2;
          continue;
        }
        int start = i + 1;
        int end = start;
        while (end < length && Character.isLetter(rtf.charAt(end))) {
          end++;
        }
        String word = rtf.substring(start, end);
        int paramStart = end;
        if (end < length && (rtf.charAt(end) == '-' || Character.isDigit(rtf.charAt(end)))) {
          end++;
          while (end < length && Character.isDigit(rtf.charAt(end))) {
            end++;
          }
        }
        String param = rtf.substring(paramStart, end);
        if (end < length && rtf.charAt(end) == ' ') {
          end++;
        }
        i = end;
        if (skipDepth >= 0) {
          continue;
        }
        if (SKIPPED_DESTINATIONS.contains(word)) {
          skipDepth = depth;
          continue;
        }
        switch (word) {
          case "par", "line", "sect", "page", "row" -> out.append('\n');
          case "tab", "cell" -> out.append('\t');
          case "uc" -> ucSkip = param.isEmpty() ? 1 : Integer.parseInt(param);
          case "u" -> {
            if (!param.isEmpty()) {
              int code = Integer.parseInt(param);
              out.append((char) (code < 0 ? code + 65536 : code));
              pendingSkip = ucSkip;
            }
          }
          case "emdash" -> out.append('-');
          case "endash" -> out.append('-');
          case "bullet" -> out.append('*');
          default -> {
            // formatting control word
          }
        }
        continue;
      }
      if (c == '\r' || c == '\n') {
        i++;
        continue;
      }
      if (skipDepth < 0) {
        if (pendingSkip > 0) {
          pendingSkip--;
        } else {
          out.append(c);
        }
      }
      i++;
    }
    return out.toString().replaceAll("[ \\t]+\\n", "\n").replaceAll("\\n{3,}", "\n\n").trim();
  }
}
