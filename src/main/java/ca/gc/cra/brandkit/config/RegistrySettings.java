package ca.gc.cra.brandkit.config;

import ca.gc.cra.brandkit.validation.Numbers;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Runtime settings for the brand, template and asset registries.
 * <p><strong>Why:</strong> Registry roots and the asset size ceiling vary per deployment and must be validated once
 * at bootstrap.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param brandsRoot directory holding one subdirectory per brand
 * @param templatesRoot directory holding one subdirectory per template
 * @param maxAssetBytes decoded size ceiling for uploaded assets
 * @param archiveDir directory receiving deletion archives
 * @param metricsExporter {@code none} or {@code otlp}
 * @since 0.1.0
 */
public record RegistrySettings(
    Path brandsRoot,
    Path templatesRoot,
    long maxAssetBytes,
    Path archiveDir,
    String metricsExporter) {

  /** Setting names accepted from the settings file and the command line. */
  public static final Set<String> KEYS =
      Set.of("brandsRoot", "templatesRoot", "maxAssetBytes", "archiveDir", "metricsExporter");

  /** Default decoded asset ceiling (10 MiB). */
  public static final long DEFAULT_MAX_ASSET_BYTES = 10L * 1024 * 1024;

  /** Largest configurable asset ceiling (1 GiB). */
  public static final long MAX_ASSET_BYTES_CEILING = 1024L * 1024 * 1024;

  public RegistrySettings {
    brandsRoot = Objects.requireNonNull(brandsRoot, "brandsRoot");
    templatesRoot = Objects.requireNonNull(templatesRoot, "templatesRoot");
    Numbers.requireRange("maxAssetBytes", maxAssetBytes, 1, MAX_ASSET_BYTES_CEILING);
    archiveDir = archiveDir == null ? defaultArchiveDir(brandsRoot) : archiveDir;
    metricsExporter = metricsExporter == null || metricsExporter.isBlank()
        ? "none"
        : metricsExporter.trim().toLowerCase(Locale.ROOT);
  }

  /**
   * Returns the built-in defaults rooted at the working directory.
   *
   * @return default settings
   */
  public static RegistrySettings defaults() {
    Path brands = Path.of("config", "brands");
    return new RegistrySettings(brands, Path.of("config", "templates"), DEFAULT_MAX_ASSET_BYTES, null, "none");
  }

  /**
   * Builds settings from an effective flat map.
   *
   * @param values merged settings; absent keys take defaults
   * @return validated settings
   * @throws IllegalArgumentException if a path or number is invalid
   */
  public static RegistrySettings fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    RegistrySettings defaults = defaults();
    Path brands = path(values, "brandsRoot", defaults.brandsRoot());
    Path templates = path(values, "templatesRoot", defaults.templatesRoot());
    String rawMax = values.get("maxAssetBytes");
    long maxBytes = rawMax == null || rawMax.isBlank()
        ? DEFAULT_MAX_ASSET_BYTES
        : Numbers.parseRange("maxAssetBytes", rawMax, 1, MAX_ASSET_BYTES_CEILING);
    Path archive = path(values, "archiveDir", null);
    return new RegistrySettings(brands, templates, maxBytes, archive, values.get("metricsExporter"));
  }

  /**
   * Returns a copy with the roots replaced by their validated, created forms.
   *
   * @param brands validated brands root
   * @param templates validated templates root
   * @return settings with resolved roots
   */
  public RegistrySettings withRoots(Path brands, Path templates) {
    return new RegistrySettings(brands, templates, maxAssetBytes, archiveDir, metricsExporter);
  }

  private static Path defaultArchiveDir(Path brandsRoot) {
    Path parent = brandsRoot.toAbsolutePath().normalize().getParent();
    return parent == null ? brandsRoot.toAbsolutePath().normalize() : parent;
  }

  private static Path path(Map<String, String> values, String key, Path fallback) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Path.of(raw.trim());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }
}
