package ca.gc.cra.brandkit.testutil;

import ca.gc.cra.brandkit.application.asset.AssetRegistry;
import ca.gc.cra.brandkit.application.registry.BrandRegistry;
import ca.gc.cra.brandkit.application.template.TemplateCatalog;
import ca.gc.cra.brandkit.config.CompositionRoot;
import ca.gc.cra.brandkit.config.RegistrySettings;
import ca.gc.cra.brandkit.infrastructure.events.InMemoryProtectionEventEmitter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry graph rooted in a temporary directory, with recording metrics, a fixed clock and in-memory events.
 */
public final class RegistryFixture implements AutoCloseable {
  public static final long MAX_ASSET_BYTES = 10L * 1024 * 1024;

  public final Path root;
  public final Path brandsRoot;
  public final Path templatesRoot;
  public final Path archiveDir;
  public final RecordingMetricsPort metrics = new RecordingMetricsPort();
  public final MutableClock clock = MutableClock.at("2024-03-01T10:15:30Z");
  public final InMemoryProtectionEventEmitter events = new InMemoryProtectionEventEmitter();
  private final CompositionRoot composition;

  public RegistryFixture(Path root) {
    this.root = root;
    this.brandsRoot = root.resolve("brands");
    this.templatesRoot = root.resolve("templates");
    this.archiveDir = root.resolve("archive");
    RegistrySettings settings =
        new RegistrySettings(brandsRoot, templatesRoot, MAX_ASSET_BYTES, archiveDir, "none");
    this.composition = new CompositionRoot(settings, metrics, clock, events);
  }

  public BrandRegistry brands() {
    return composition.brandRegistry();
  }

  public AssetRegistry assets() {
    return composition.assetRegistry();
  }

  public TemplateCatalog templates() {
    return composition.templateCatalog();
  }

  /** Returns a minimal valid brand document with two colors and a primary font. */
  public static Map<String, Object> sampleDocument(String displayName) {
    Map<String, Object> brand = new LinkedHashMap<>();
    brand.put("name", displayName);
    brand.put("tagline", "Built together");
    Map<String, Object> colors = new LinkedHashMap<>();
    colors.put("primary", "#0055AA");
    colors.put("secondary", "#FFCC00");
    Map<String, Object> typography = new LinkedHashMap<>();
    typography.put("primary_font", "Inter");
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("brand", brand);
    document.put("colors", colors);
    document.put("typography", typography);
    return document;
  }

  /** Returns a single-key document {@code {section: {key: value}}}. */
  public static Map<String, Object> fragment(String section, String key, Object value) {
    Map<String, Object> inner = new LinkedHashMap<>();
    inner.put(key, value);
    Map<String, Object> outer = new LinkedHashMap<>();
    outer.put(section, inner);
    return outer;
  }

  /** Returns {@code {assets: {role: paths}}} for a list-valued role. */
  public static Map<String, Object> assetList(String role, List<String> paths) {
    return fragment("assets", role, paths);
  }

  @Override
  public void close() {
    composition.close();
  }
}
