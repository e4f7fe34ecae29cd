package ca.gc.cra.medingest.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PathUtilsTest {

  @Test
  void stemDropsOnlyTheLastExtension() {
    assertEquals("lab.2023", PathUtils.stem("lab.2023.pdf"));
    assertEquals(".profile", PathUtils.stem(".profile"));
    assertEquals("README", PathUtils.stem("README"));
  }

  @Test
  void sha1IsHex() {
    assertEquals("a9993e364706816aba3e25717850c26c9cd0d89d", PathUtils.sha1Hex("abc"));
  }

  @Test
  void artifactKeyCombinesStemAndHashPrefix() {
    assertEquals("visit_note_a9993e36", PathUtils.artifactKey("abc", "visit note.txt"));
  }

  @Test
  void sanitizeReplacesUnsafeCharacters() {
    assertEquals("scan__1_.pdf", PathUtils.sanitize("scan (1).pdf"));
    assertEquals("x", PathUtils.sanitize(""));
  }

  @Test
  void fileNameHandlesRoots() {
    assertEquals(Optional.of("a.txt"), PathUtils.fileName(Path.of("dir", "a.txt")));
    assertTrue(PathUtils.fileName(null).isEmpty());
    assertTrue(PathUtils.fileName(Path.of("/")).isEmpty());
  }
}
