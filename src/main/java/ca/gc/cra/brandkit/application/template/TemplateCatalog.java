package ca.gc.cra.brandkit.application.template;

import ca.gc.cra.brandkit.application.port.ClockPort;
import ca.gc.cra.brandkit.application.port.ConfigStore;
import ca.gc.cra.brandkit.application.port.MalformedDocumentException;
import ca.gc.cra.brandkit.application.port.MetricsPort;
import ca.gc.cra.brandkit.application.registry.BrandLocks;
import ca.gc.cra.brandkit.application.registry.VersionManager;
import ca.gc.cra.brandkit.application.template.TemplateValidationReport.Issue;
import ca.gc.cra.brandkit.application.template.TemplateValidationReport.IssueType;
import ca.gc.cra.brandkit.config.ConfigMerger;
import ca.gc.cra.brandkit.domain.brand.BrandDocuments;
import ca.gc.cra.brandkit.domain.error.EntityExistsException;
import ca.gc.cra.brandkit.domain.error.EntityNotFoundException;
import ca.gc.cra.brandkit.domain.error.RegistryException;
import ca.gc.cra.brandkit.domain.error.RegistryInternalException;
import ca.gc.cra.brandkit.domain.error.RegistryValidationException;
import ca.gc.cra.brandkit.domain.template.BrandTemplate;
import ca.gc.cra.brandkit.domain.template.TemplateSummary;
import ca.gc.cra.brandkit.util.DirectoryTrees;
import ca.gc.cra.brandkit.util.PathUtils;
import ca.gc.cra.brandkit.validation.Strings;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Stores named preset documents used as a basis for new brands.
 * <p><strong>Layout:</strong> {@code <templatesRoot>/<name>/template_config.<ext>} plus an optional
 * {@code assets/} directory. Descriptive metadata lives under the document's {@code template_info} key,
 * which {@link BrandTemplate#document()} leaves out.</p>
 * <p><strong>Asset lists:</strong> required assets are every non-empty entry of the {@code assets} section
 * except the {@link #OPTIONAL_ASSET_KEYS}, plus {@code compliance.required_assets}; optional assets are the
 * values of the optional keys. Both lists are de-duplicated in document order.</p>
 * <p><strong>Thread-safety:</strong> Mutations of one template are serialized; reads are lock-free.</p>
 * <p>Templates carry no protection state.</p>
 *
 * @since 0.1.0
 */
public final class TemplateCatalog {
  private static final Logger log = LoggerFactory.getLogger(TemplateCatalog.class);

  /** Document key holding template metadata. */
  public static final String TEMPLATE_INFO = "template_info";
  /** Base name of the template document. */
  public static final String DOCUMENT_BASENAME = "template_config";
  /** Asset roles treated as optional. */
  public static final List<String> OPTIONAL_ASSET_KEYS = List.of("watermark", "favicon", "background");
  /** Sections whose change bumps a template's version. */
  public static final Set<String> VERSIONED_SECTIONS = Set.of("brand", "colors", "typography", "assets", "compliance");

  static final int MAX_REQUIRED_ASSETS = 20;
  private static final List<String> REQUIRED_INFO_FIELDS = List.of("name", "description", "category");
  private static final Set<String> IMAGE_EXTENSIONS = Set.of(".png", ".jpg", ".jpeg", ".svg");
  private static final Set<String> FONT_EXTENSIONS = Set.of(".woff", ".woff2", ".ttf", ".otf");

  private final Path root;
  private final ConfigStore store;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final BrandLocks locks = new BrandLocks();

  /**
   * Creates a catalog rooted at {@code root}.
   *
   * @param root templates root directory
   * @param store document store
   * @param metrics metrics sink
   * @param clock timestamp source
   */
  public TemplateCatalog(Path root, ConfigStore store, MetricsPort metrics, ClockPort clock) {
    this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    this.store = Objects.requireNonNull(store, "store");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Creates a template.
   *
   * @param name template name
   * @param document preset document; any {@code template_info} it carries is kept and overwritten field by field
   * @param description human-readable description
   * @param category category; blank selects {@link BrandTemplate#DEFAULT_CATEGORY}
   * @param features feature tags; may be {@code null}
   * @return creation outcome
   * @throws RegistryValidationException if the name is invalid or {@code assets} is not a mapping
   * @throws EntityExistsException if the template exists
   * @throws RegistryInternalException if writing fails; the partial directory is removed
   */
  public TemplateCreationResult create(
      String name, Map<String, Object> document, String description, String category, List<String> features) {
    Path directory = directory(name);
    String effectiveCategory = category == null || category.isBlank() ? BrandTemplate.DEFAULT_CATEGORY : category;
    try (BrandLocks.Held held = locks.lock(name)) {
      if (Files.exists(directory, LinkOption.NOFOLLOW_LINKS)) {
        throw new EntityExistsException(name, "Template '" + name + "' already exists");
      }
      Map<String, Object> stored = BrandDocuments.deepCopy(document);
      boolean hasAssets = !BrandDocuments.section(name, stored, BrandDocuments.ASSETS).isEmpty();
      Map<String, Object> info = infoOf(stored);
      info.put("name", name);
      info.put("description", description == null ? "" : description);
      info.put("category", effectiveCategory);
      info.put("version", BrandDocuments.INITIAL_VERSION);
      info.put("created_at", clock.now().toString());
      info.put("features", features == null ? new ArrayList<>() : new ArrayList<>(features));
      info.put("required_assets", requiredAssets(stored));
      info.put("optional_assets", optionalAssets(stored));
      stored.put(TEMPLATE_INFO, info);
      List<String> warnings = structureWarnings(stored);

      try {
        Files.createDirectories(directory);
        store.save(documentPath(name), stored);
        if (hasAssets) {
          Files.createDirectories(directory.resolve("assets"));
        }
      } catch (IOException ex) {
        rollback(name, directory, ex);
        throw new RegistryInternalException(name, "Failed to create template: " + ex.getMessage(), ex);
      }
      metrics.increment("template.create.success");
      log.info("Created template '{}' in category '{}'", name, effectiveCategory);
      return new TemplateCreationResult(name, directory, effectiveCategory, BrandDocuments.INITIAL_VERSION, warnings);
    }
  }

  /**
   * Loads a template.
   *
   * @param name template name
   * @return template
   * @throws EntityNotFoundException if absent
   * @throws RegistryValidationException if its document is malformed
   */
  public BrandTemplate load(String name) {
    Path path = documentPath(name);
    Map<String, Object> stored = read(name, path);
    Map<String, Object> info = BrandDocuments.section(name, stored, TEMPLATE_INFO);
    Map<String, Object> document = new LinkedHashMap<>(stored);
    document.remove(TEMPLATE_INFO);
    return new BrandTemplate(
        text(info.get("name"), name),
        text(info.get("description"), ""),
        text(info.get("category"), BrandTemplate.DEFAULT_CATEGORY),
        text(info.get("version"), BrandDocuments.INITIAL_VERSION),
        text(info.get("created_at"), null),
        text(info.get("updated_at"), null),
        stringList(info.get("features")),
        stringList(info.get("required_assets")),
        stringList(info.get("optional_assets")),
        document);
  }

  /**
   * Reports whether a template exists.
   *
   * @param name template name
   * @return {@code true} when its document exists
   */
  public boolean exists(String name) {
    return Strings.isValidEntityName(name) && store.exists(documentPath(name));
  }

  /**
   * Lists templates sorted by category, then name. Unreadable templates are logged and skipped.
   *
   * @param categoryFilter category to keep; {@code null} or blank keeps all
   * @return listing
   */
  public TemplateListing list(String categoryFilter) {
    String filter = categoryFilter == null || categoryFilter.isBlank() ? null : categoryFilter;
    List<TemplateSummary> summaries = new ArrayList<>();
    Set<String> categories = new TreeSet<>();
    for (String name : templateNames()) {
      BrandTemplate template;
      try {
        template = load(name);
      } catch (RegistryException ex) {
        log.warn("Failed to load template {}: {}", name, ex.getMessage());
        continue;
      }
      categories.add(template.category());
      if (filter == null || filter.equals(template.category())) {
        summaries.add(template.summary());
      }
    }
    summaries.sort(Comparator.comparing(TemplateSummary::category).thenComparing(TemplateSummary::name));
    return new TemplateListing(summaries, new ArrayList<>(categories), filter);
  }

  /**
   * Merges {@code updates} into a template, bumping its version when a {@link #VERSIONED_SECTIONS} key changes
   * and recomputing the asset lists when {@code assets} changes.
   *
   * @param name template name
   * @param updates partial document
   * @return update outcome
   * @throws EntityNotFoundException if absent
   */
  public TemplateUpdateResult update(String name, Map<String, Object> updates) {
    Objects.requireNonNull(updates, "updates");
    Path path = documentPath(name);
    try (BrandLocks.Held held = locks.lock(name)) {
      Map<String, Object> current = read(name, path);
      Map<String, Object> merged = ConfigMerger.merge(current, updates);
      BrandDocuments.section(name, merged, BrandDocuments.ASSETS);
      Map<String, Object> info = infoOf(merged);
      info.put("updated_at", clock.now().toString());
      String version = text(info.get("version"), BrandDocuments.INITIAL_VERSION);
      version = VersionManager.nextVersion(version, updates.keySet(), VERSIONED_SECTIONS);
      info.put("version", version);
      if (updates.containsKey(BrandDocuments.ASSETS)) {
        info.put("required_assets", requiredAssets(merged));
        info.put("optional_assets", optionalAssets(merged));
      }
      merged.put(TEMPLATE_INFO, info);
      List<String> warnings = structureWarnings(merged);
      try {
        store.save(path, merged);
      } catch (IOException ex) {
        log.error("Failed to update template {}", name, ex);
        throw new RegistryInternalException(name, "Failed to update template: " + ex.getMessage(), ex);
      }
      log.info("Updated template '{}' to version {}", name, version);
      return new TemplateUpdateResult(name, version, new ArrayList<>(updates.keySet()), warnings);
    }
  }

  /**
   * Deletes a template directory.
   *
   * @param name template name
   * @param confirm must be {@code true}
   * @return deletion outcome
   * @throws IllegalArgumentException if {@code confirm} is {@code false}
   * @throws EntityNotFoundException if absent
   */
  public TemplateDeletionResult delete(String name, boolean confirm) {
    if (!confirm) {
      throw new IllegalArgumentException("Confirmation required for template deletion");
    }
    Path directory = directory(name);
    try (BrandLocks.Held held = locks.lock(name)) {
      if (!Files.exists(directory, LinkOption.NOFOLLOW_LINKS)) {
        throw new EntityNotFoundException(name, "Template '" + name + "' not found");
      }
      String category = null;
      String version = null;
      try {
        BrandTemplate template = load(name);
        category = template.category();
        version = template.version();
      } catch (RegistryException ex) {
        log.debug("Deleting unreadable template {}: {}", name, ex.getMessage());
      }
      DirectoryTrees.TreeStats removed;
      try {
        removed = DirectoryTrees.deleteTree(directory);
      } catch (IOException ex) {
        log.error("Failed to delete template {}", name, ex);
        throw new RegistryInternalException(name, "Failed to delete template: " + ex.getMessage(), ex);
      }
      log.info("Deleted template '{}' ({} files)", name, removed.files());
      return new TemplateDeletionResult(name, category, version, removed.files());
    }
  }

  /**
   * Validates a template's structure and asset lists.
   *
   * @param name template name
   * @return report; a template that cannot be read yields status {@code error} with a {@code load} issue
   * @throws EntityNotFoundException if absent
   */
  public TemplateValidationReport validate(String name) {
    Path path = documentPath(name);
    Map<String, Object> stored;
    try {
      stored = read(name, path);
    } catch (RegistryValidationException | RegistryInternalException ex) {
      List<Issue> issues = List.of(new Issue(IssueType.LOAD, "Validation failed: " + ex.getMessage()));
      return new TemplateValidationReport(name, TemplateValidationReport.Status.ERROR, issues);
    }
    List<Issue> issues = new ArrayList<>();
    for (String warning : structureWarnings(stored)) {
      issues.add(new Issue(IssueType.STRUCTURE, warning));
    }
    BrandTemplate template = load(name);
    for (String warning : assetWarnings(template)) {
      issues.add(new Issue(IssueType.ASSET, warning));
    }
    return new TemplateValidationReport(name, TemplateValidationReport.statusOf(issues), issues);
  }

  static List<String> requiredAssets(Map<String, Object> document) {
    Set<String> required = new LinkedHashSet<>();
    Object assets = document.get(BrandDocuments.ASSETS);
    if (assets instanceof Map<?, ?> map) {
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!OPTIONAL_ASSET_KEYS.contains(String.valueOf(entry.getKey()))) {
          addPaths(required, entry.getValue());
        }
      }
    }
    if (document.get(BrandDocuments.COMPLIANCE) instanceof Map<?, ?> compliance) {
      addPaths(required, compliance.get("required_assets"));
    }
    return new ArrayList<>(required);
  }

  static List<String> optionalAssets(Map<String, Object> document) {
    Set<String> optional = new LinkedHashSet<>();
    if (document.get(BrandDocuments.ASSETS) instanceof Map<?, ?> assets) {
      for (String key : OPTIONAL_ASSET_KEYS) {
        addPaths(optional, assets.get(key));
      }
    }
    return new ArrayList<>(optional);
  }

  static List<String> structureWarnings(Map<String, Object> document) {
    List<String> warnings = new ArrayList<>(BrandDocuments.structureWarnings(document));
    Object info = document.get(TEMPLATE_INFO);
    if (!(info instanceof Map<?, ?> map)) {
      warnings.add("Missing template_info section");
      return warnings;
    }
    for (String field : REQUIRED_INFO_FIELDS) {
      if (!map.containsKey(field)) {
        warnings.add("Missing template_info field: " + field);
      }
    }
    return warnings;
  }

  static List<String> assetWarnings(BrandTemplate template) {
    List<String> warnings = new ArrayList<>();
    if (template.requiredAssets().size() > MAX_REQUIRED_ASSETS) {
      warnings.add("Template requires too many assets (>" + MAX_REQUIRED_ASSETS + ")");
    }
    boolean standard = false;
    List<String> all = new ArrayList<>(template.requiredAssets());
    all.addAll(template.optionalAssets());
    for (String asset : all) {
      String extension = PathUtils.extension(asset);
      if (IMAGE_EXTENSIONS.contains(extension) || FONT_EXTENSIONS.contains(extension) || extension.equals(".css")) {
        standard = true;
        break;
      }
    }
    if (!standard) {
      warnings.add("Template doesn't specify any standard asset types");
    }
    return warnings;
  }

  private Map<String, Object> read(String name, Path path) {
    if (!store.exists(path)) {
      throw new EntityNotFoundException(name, "Template '" + name + "' not found");
    }
    try {
      return store.load(path);
    } catch (MalformedDocumentException ex) {
      log.error("Invalid template document {}: {}", path, ex.getMessage());
      throw new RegistryValidationException(name, "Invalid template configuration: " + ex.getMessage(), ex);
    } catch (IOException ex) {
      throw new RegistryInternalException(name, "Failed to load template: " + ex.getMessage(), ex);
    }
  }

  private List<String> templateNames() {
    if (!Files.isDirectory(root)) {
      return List.of();
    }
    List<String> names = new ArrayList<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(root)) {
      for (Path entry : entries) {
        String name = entry.getFileName().toString();
        if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS) && Strings.isValidEntityName(name)
            && store.exists(documentPath(name))) {
          names.add(name);
        }
      }
    } catch (IOException ex) {
      throw new RegistryInternalException(null, "Failed to list templates: " + ex.getMessage(), ex);
    }
    names.sort(null);
    return names;
  }

  private Path directory(String name) {
    if (!Strings.isValidEntityName(name)) {
      throw new RegistryValidationException(name, "Invalid template name: " + name);
    }
    return root.resolve(name);
  }

  private Path documentPath(String name) {
    return directory(name).resolve(DOCUMENT_BASENAME + "." + store.fileExtension());
  }

  private static void rollback(String name, Path directory, IOException cause) {
    try {
      DirectoryTrees.deleteTree(directory);
    } catch (IOException cleanup) {
      cause.addSuppressed(cleanup);
    }
    log.error("Failed to create template {}", name, cause);
  }

  private static Map<String, Object> infoOf(Map<String, Object> document) {
    Object info = document.get(TEMPLATE_INFO);
    Map<String, Object> copy = new LinkedHashMap<>();
    if (info instanceof Map<?, ?> map) {
      map.forEach((k, v) -> copy.put(String.valueOf(k), v));
    }
    return copy;
  }

  private static void addPaths(Set<String> target, Object value) {
    if (value instanceof List<?> list) {
      for (Object item : list) {
        if (item != null && !item.toString().isBlank()) {
          target.add(item.toString());
        }
      }
    } else if (value != null && !(value instanceof Map<?, ?>) && !value.toString().isBlank()) {
      target.add(value.toString());
    }
  }

  private static List<String> stringList(Object value) {
    List<String> out = new ArrayList<>();
    if (value instanceof List<?> list) {
      for (Object item : list) {
        if (item != null) {
          out.add(item.toString());
        }
      }
    }
    return out;
  }

  private static String text(Object value, String fallback) {
    return value == null || value.toString().isEmpty() ? fallback : value.toString();
  }
}
