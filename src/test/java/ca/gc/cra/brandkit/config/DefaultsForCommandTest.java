package ca.gc.cra.brandkit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForCommandTest {

  @Test
  void assetDefaultsIncludeSizeCeiling() {
    Map<String, String> defaults = DefaultsForCommand.asFlatMap("asset");
    assertEquals(Long.toString(10L * 1024 * 1024), defaults.get("maxAssetBytes"));
    assertEquals(Path.of("config", "brands").toString(), defaults.get("brandsRoot"));
  }

  @Test
  void brandDefaultsOmitArchiveDir() {
    Map<String, String> defaults = DefaultsForCommand.asFlatMap(" Brand ");
    assertFalse(defaults.containsKey("archiveDir"));
    assertEquals("none", defaults.get("metricsExporter"));
  }

  @Test
  void unknownCommandRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForCommand.asFlatMap("poster"));
  }
}
