package ca.gc.cra.halo.validation;

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
  void validateWritableDirReturnsRealPathForExistingDirectory() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("existing"));
    assertEquals(dir.toRealPath(), Paths.validateWritableDir(dir, false));
  }

  @Test
  void validateWritableDirCreatesMissingDirectoryWhenAsked() {
    Path dir = tempDir.resolve("out/nested");
    Path validated = Paths.validateWritableDir(dir, true);
    assertTrue(Files.isDirectory(validated));
  }

  @Test
  void validateWritableDirLeavesMissingDirectoryAloneDuringDryRun() {
    Path dir = tempDir.resolve("future/child");
    Path validated = Paths.validateWritableDir(dir, false);
    assertEquals(dir.toAbsolutePath().normalize(), validated);
    assertFalse(Files.exists(validated));
  }

  @Test
  void validateWritableDirRejectsRegularFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve("results.json"), "[]");
    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(file, true));
  }

  @Test
  void requireReadableFileChecksExistenceAndContent() throws IOException {
    Path cascade = Files.writeString(tempDir.resolve("cascade.xml"), "<opencv_storage/>");
    Path empty = Files.createFile(tempDir.resolve("empty.xml"));

    assertEquals(cascade.toAbsolutePath().normalize(), Paths.requireReadableFile("cascade", cascade));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("cascade", empty));
    assertThrows(IllegalArgumentException.class,
        () -> Paths.requireReadableFile("cascade", tempDir.resolve("missing.xml")));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("cascade", null));
  }
}
