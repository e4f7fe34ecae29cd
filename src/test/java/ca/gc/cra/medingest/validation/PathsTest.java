package ca.gc.cra.medingest.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void readableDirMustExist() throws Exception {
    assertEquals(tempDir.toAbsolutePath().normalize(), Paths.requireReadableDir("in", tempDir));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableDir("in", tempDir.resolve("absent")));
    Path file = Files.writeString(tempDir.resolve("note.txt"), "x");
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableDir("in", file));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableDir("in", null));
  }

  @Test
  void writableDirIsCreated() throws Exception {
    Path created = Paths.requireWritableDir("out", tempDir.resolve("a").resolve("b"));

    assertTrue(Files.isDirectory(created));
    Path file = Files.writeString(tempDir.resolve("taken"), "x");
    assertThrows(IllegalArgumentException.class, () -> Paths.requireWritableDir("out", file));
  }
}
