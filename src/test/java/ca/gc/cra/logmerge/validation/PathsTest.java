package ca.gc.cra.logmerge.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void readableDirResolvesRealPath() throws IOException {
    assertEquals(tempDir.toRealPath(), Paths.requireReadableDir("in", tempDir));
  }

  @Test
  void readableDirRejectsMissingAndFiles() throws IOException {
    Path file = Files.writeString(tempDir.resolve("a.adi"), "x");

    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableDir("in", tempDir.resolve("nope")));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableDir("in", file));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableDir("in", null));
  }

  @Test
  void writableDirIsCreatedOnlyWhenAsked() {
    Path target = tempDir.resolve("a").resolve("b");

    Paths.validateWritableDir(target, false, false);
    assertFalse(Files.exists(target));

    Paths.validateWritableDir(target, true, false);
    assertTrue(Files.isDirectory(target));
  }

  @Test
  void nonEmptyDirNeedsReuse() throws IOException {
    Files.writeString(tempDir.resolve("old.adi"), "x");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.validateWritableDir(tempDir, true, false));
    assertTrue(ex.getMessage().contains("--allow-overwrite"));
    assertEquals(tempDir.toRealPath(), Paths.validateWritableDir(tempDir, true, true));
  }

  @Test
  void fileIsNotADirectory() throws IOException {
    Path file = Files.writeString(tempDir.resolve("out"), "x");

    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(file, true, true));
  }
}
