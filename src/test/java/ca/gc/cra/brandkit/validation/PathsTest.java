package ca.gc.cra.brandkit.validation;

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
  void validateWritableDirReturnsCanonicalPathWhenDirectoryExists() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("existing"));
    Path validated = Paths.validateWritableDir(dir, null, false, true);
    assertEquals(dir.toRealPath(), validated);
  }

  @Test
  void validateWritableDirRejectsNonEmptyDirectoryWithoutReuse() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("nonEmpty"));
    Files.createFile(dir.resolve("brand_config.yaml"));
    assertThrows(IllegalArgumentException.class, () ->
        Paths.validateWritableDir(dir, null, false, false));
  }

  @Test
  void validateWritableDirCreatesMissingRoot() {
    Path validated = Paths.validateWritableDir(tempDir.resolve("config/brands"), null, true, true);
    assertTrue(Files.isDirectory(validated));
  }

  @Test
  void resolveWithinKeepsPathsInsideBase() {
    Path resolved = Paths.resolveWithin(tempDir, "assets/images/logo.png");
    assertTrue(resolved.startsWith(tempDir.toAbsolutePath().normalize()));
    assertTrue(resolved.endsWith(Path.of("assets", "images", "logo.png")));
  }

  @Test
  void resolveWithinRejectsTraversal() {
    assertThrows(IllegalArgumentException.class, () -> Paths.resolveWithin(tempDir, "../outside.png"));
    assertThrows(IllegalArgumentException.class, () -> Paths.resolveWithin(tempDir, "assets/../../x"));
    assertThrows(IllegalArgumentException.class, () -> Paths.resolveWithin(tempDir, "."));
  }

  @Test
  void resolveWithinRejectsAbsolutePaths() {
    assertThrows(IllegalArgumentException.class,
        () -> Paths.resolveWithin(tempDir, tempDir.resolve("x.png").toAbsolutePath().toString()));
  }
}
