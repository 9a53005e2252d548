package ca.gc.cra.rackd.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
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
  void requireWritableFileAllowsMissingParents() {
    Path target = tempDir.resolve("reports/2024/scan.json");

    Path validated = Paths.requireWritableFile("out", target);

    assertEquals(target.toAbsolutePath().normalize(), validated);
  }

  @Test
  void requireWritableFileAllowsReplacingExistingFile() throws IOException {
    Path existing = Files.writeString(tempDir.resolve("scan.json"), "{}");

    assertEquals(existing.toAbsolutePath().normalize(), Paths.requireWritableFile("out", existing));
  }

  @Test
  void requireWritableFileRejectsDirectory() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.requireWritableFile("out", tempDir));
    assertTrue(ex.getMessage().startsWith("out is a directory"));
  }

  @Test
  void requireWritableFileRejectsFileParent() throws IOException {
    Path file = Files.writeString(tempDir.resolve("not-a-dir"), "x");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.requireWritableFile("out", file.resolve("scan.json")));
    assertTrue(ex.getMessage().startsWith("out has no writable parent directory"));
  }

  @Test
  void requireWritableFileRejectsNull() {
    assertThrows(IllegalArgumentException.class, () -> Paths.requireWritableFile("out", null));
  }
}
