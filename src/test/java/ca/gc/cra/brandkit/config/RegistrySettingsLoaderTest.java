package ca.gc.cra.brandkit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RegistrySettingsLoaderTest {

  @TempDir Path tempDir;

  @Test
  void createsRootsAndDefaultsArchiveToParent() throws IOException {
    Path brands = tempDir.resolve("data/brands");
    Path templates = tempDir.resolve("data/templates");

    RegistrySettings settings = RegistrySettingsLoader.load(
        "brand",
        tempDir.resolve("absent.yaml"),
        Map.of("brandsRoot", brands.toString(), "templatesRoot", templates.toString()),
        null);

    assertTrue(Files.isDirectory(brands));
    assertTrue(Files.isDirectory(templates));
    assertEquals(brands.toAbsolutePath().normalize(), settings.brandsRoot());
    assertEquals(tempDir.resolve("data").toAbsolutePath().normalize(), settings.archiveDir());
    assertEquals(RegistrySettings.DEFAULT_MAX_ASSET_BYTES, settings.maxAssetBytes());
  }

  @Test
  void yamlSettingsApplyAndCliOverridesAreReported() throws IOException {
    Path yaml = tempDir.resolve("brandkit.yaml");
    Files.writeString(yaml, """
        common:
          brandsRoot: %s
          templatesRoot: %s
        asset:
          maxAssetBytes: 2048
        """.formatted(tempDir.resolve("b"), tempDir.resolve("t")));
    List<String> warnings = new ArrayList<>();

    RegistrySettings settings = RegistrySettingsLoader.load(
        "asset", yaml, Map.of("maxAssetBytes", "4096"), warnings::add);

    assertEquals(4096, settings.maxAssetBytes());
    assertEquals(tempDir.resolve("b").toAbsolutePath().normalize(), settings.brandsRoot());
    assertEquals(1, warnings.size());
  }

  @Test
  void invalidExporterRejected() {
    assertThrows(IllegalArgumentException.class, () -> RegistrySettingsLoader.load(
        "brand", null,
        Map.of("brandsRoot", tempDir.resolve("b").toString(), "metricsExporter", "statsd"),
        null));
  }
}
