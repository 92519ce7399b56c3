package ca.gc.cra.brandkit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class SettingsFileTest {

  @TempDir Path tempDir;

  @Test
  void commandSectionOverridesCommon() throws IOException {
    Path yaml = write("""
        common:
          brandsRoot: /srv/brands
          metricsExporter: none
        Asset:
          maxAssetBytes: 5242880
          metricsExporter: otlp
        template:
          templatesRoot: /srv/templates
        """);

    Map<String, String> settings = SettingsFile.read(yaml, "asset").orElseThrow();

    assertEquals(Path.of("/srv/brands").toString(), settings.get("brandsRoot"));
    assertEquals("5242880", settings.get("maxAssetBytes"));
    assertEquals("otlp", settings.get("metricsExporter"));
    assertFalse(settings.containsKey("templatesRoot"));
  }

  @Test
  void relativePathsResolveAgainstTheSettingsFile() throws IOException {
    Path yaml = write("""
        common:
          brands_root: brands
          templatesRoot: ../shared/templates
          archive-dir: archive
        """);

    Map<String, String> settings = SettingsFile.read(yaml, "brand").orElseThrow();

    assertEquals(tempDir.resolve("brands").toAbsolutePath().normalize().toString(), settings.get("brandsRoot"));
    assertEquals(tempDir.toAbsolutePath().getParent().resolve("shared/templates").normalize().toString(),
        settings.get("templatesRoot"));
    assertEquals(tempDir.resolve("archive").toAbsolutePath().normalize().toString(), settings.get("archiveDir"));
  }

  @Test
  void unknownSettingsAndSectionsAreWarnedAndSkipped() throws IOException {
    Path yaml = write("""
        common:
          brandRoot: /typo
          maxAssetBytes: 1024
        palette:
          primary: blue
        """);
    Logger logger = (Logger) LoggerFactory.getLogger(SettingsFile.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    Map<String, String> settings;
    try {
      settings = SettingsFile.read(yaml, "asset").orElseThrow();
    } finally {
      logger.detachAppender(appender);
    }

    assertEquals(Map.of("maxAssetBytes", "1024"), settings);
    assertTrue(appender.list.stream()
        .anyMatch(e -> e.getFormattedMessage().startsWith("Ignoring unknown setting 'brandRoot' in section 'common'")));
    assertTrue(appender.list.stream()
        .anyMatch(e -> e.getFormattedMessage().startsWith("Ignoring unknown settings section 'palette'")));
  }

  @Test
  void nullInCommandSectionUnsetsCommonValue() throws IOException {
    Path yaml = write("""
        common:
          metricsExporter: otlp
        brand:
          metricsExporter:
        """);

    assertNull(SettingsFile.read(yaml, "brand").orElseThrow().get("metricsExporter"));
  }

  @Test
  void missingFileIsEmptyAndEmptyFileHasNoSettings() throws IOException {
    assertTrue(SettingsFile.read(tempDir.resolve("absent.yaml"), "brand").isEmpty());
    assertEquals(Map.of(), SettingsFile.read(write(""), "brand").orElseThrow());
  }

  @Test
  void structuredValuesAreRejected() throws IOException {
    Path yaml = write("""
        common:
          brandsRoot:
            - a
            - b
        """);
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> SettingsFile.read(yaml, "brand"));
    assertTrue(ex.getMessage().contains("must be a single value"));
  }

  @Test
  void badShapesAndBrokenYamlAreRejected() throws IOException {
    assertThrows(IllegalArgumentException.class, () -> SettingsFile.read(write("common: [unclosed"), "brand"));
    assertThrows(IllegalArgumentException.class, () -> SettingsFile.read(write("- common"), "brand"));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> SettingsFile.read(write("brand: 42"), "brand"));
    assertTrue(ex.getMessage().startsWith("Section 'brand'"));
    assertThrows(IllegalArgumentException.class, () -> SettingsFile.read(tempDir, "brand"));
  }

  @Test
  void settingNamesAcceptSnakeCase() {
    assertEquals("maxAssetBytes", SettingsFile.settingName("max_asset_bytes"));
    assertEquals("metricsExporter", SettingsFile.settingName("metricsExporter"));
    assertNull(SettingsFile.settingName("colour"));
  }

  private Path write(String content) throws IOException {
    Path yaml = Files.createTempFile(tempDir, "brandkit", ".yaml");
    Files.writeString(yaml, content);
    return yaml;
  }
}
