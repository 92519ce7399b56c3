package ca.gc.cra.brandkit.config;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.brandkit.infrastructure.metrics.NoOpMetricsAdapter;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {

  @TempDir Path tempDir;

  @Test
  void wiresRegistriesWithNoOpMetricsByDefault() {
    RegistrySettings settings = new RegistrySettings(
        tempDir.resolve("brands"), tempDir.resolve("templates"), 1024, null, null);

    try (CompositionRoot root = new CompositionRoot(settings)) {
      assertTrue(root.metrics() instanceof NoOpMetricsAdapter);
      assertNotNull(root.brandRegistry());
      assertNotNull(root.assetRegistry());
      assertNotNull(root.templateCatalog());
      assertTrue(root.brandRegistry().listNames().isEmpty());
    }
  }
}
