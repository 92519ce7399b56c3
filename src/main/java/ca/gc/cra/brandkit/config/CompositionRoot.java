package ca.gc.cra.brandkit.config;

import ca.gc.cra.brandkit.application.asset.AssetRegistry;
import ca.gc.cra.brandkit.application.port.BackupPort;
import ca.gc.cra.brandkit.application.port.ClockPort;
import ca.gc.cra.brandkit.application.port.ConfigStore;
import ca.gc.cra.brandkit.application.port.MetricsPort;
import ca.gc.cra.brandkit.application.port.ProtectionEventEmitter;
import ca.gc.cra.brandkit.application.registry.BrandLayout;
import ca.gc.cra.brandkit.application.registry.BrandLocks;
import ca.gc.cra.brandkit.application.registry.BrandRegistry;
import ca.gc.cra.brandkit.application.registry.ProtectionGuard;
import ca.gc.cra.brandkit.application.template.TemplateCatalog;
import ca.gc.cra.brandkit.infrastructure.backup.BackupManager;
import ca.gc.cra.brandkit.infrastructure.events.LoggingProtectionEventEmitter;
import ca.gc.cra.brandkit.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.brandkit.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.brandkit.infrastructure.persistence.JsonAssetIndexAdapter;
import ca.gc.cra.brandkit.infrastructure.persistence.YamlConfigStore;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the brand, asset and template services to their file adapters.
 * <p><strong>Why:</strong> Keeps the translation from {@link RegistrySettings} to a service graph in one place.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the metrics adapter from {@link RegistrySettings#metricsExporter()}.</li>
 *   <li>Share one {@link BrandLocks} between {@link BrandRegistry} and {@link AssetRegistry}.</li>
 *   <li>Close the metrics adapter on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Built once at startup; the services it exposes are thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final RegistrySettings settings;
  private final MetricsPort metrics;
  private final TemplateCatalog templates;
  private final BrandRegistry brands;
  private final AssetRegistry assets;

  /**
   * Creates a composition root using the system clock and a metrics adapter chosen from {@code settings}.
   *
   * @param settings validated settings
   */
  public CompositionRoot(RegistrySettings settings) {
    this(settings, metricsFor(settings), ClockPort.SYSTEM, null);
  }

  /**
   * Creates a composition root with explicit collaborators.
   *
   * @param settings validated settings
   * @param metrics metrics sink
   * @param clock timestamp source
   * @param events protection event sink; {@code null} logs events and counts them in {@code metrics}
   */
  public CompositionRoot(
      RegistrySettings settings, MetricsPort metrics, ClockPort clock, ProtectionEventEmitter events) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(clock, "clock");
    ProtectionEventEmitter emitter = events == null ? new LoggingProtectionEventEmitter(metrics) : events;

    ConfigStore store = new YamlConfigStore();
    BackupPort backups = new BackupManager(store, clock);
    BrandLayout layout = new BrandLayout(settings.brandsRoot(), store.fileExtension());
    BrandLocks locks = new BrandLocks();

    this.templates = new TemplateCatalog(settings.templatesRoot(), store, metrics, clock);
    ProtectionGuard guard = new ProtectionGuard(layout, store, emitter, metrics, clock);
    this.brands = new BrandRegistry(
        layout, store, backups, guard, templates, locks, metrics, clock, settings.archiveDir());
    this.assets = new AssetRegistry(
        brands, new JsonAssetIndexAdapter(), backups, locks, metrics, clock, settings.maxAssetBytes());
    log.debug("Wired registry: brands={}, templates={}, archive={}",
        settings.brandsRoot(), settings.templatesRoot(), settings.archiveDir());
  }

  public RegistrySettings settings() {
    return settings;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public BrandRegistry brandRegistry() {
    return brands;
  }

  public AssetRegistry assetRegistry() {
    return assets;
  }

  public TemplateCatalog templateCatalog() {
    return templates;
  }

  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter: {}", ex.getMessage());
      }
    }
  }

  private static MetricsPort metricsFor(RegistrySettings settings) {
    if ("otlp".equals(settings.metricsExporter())) {
      return new OpenTelemetryMetricsAdapter("otlp");
    }
    return new NoOpMetricsAdapter();
  }
}
