package ca.gc.cra.brandkit.application.registry;

import ca.gc.cra.brandkit.application.port.BackupPort;
import ca.gc.cra.brandkit.application.port.ClockPort;
import ca.gc.cra.brandkit.application.port.ConfigStore;
import ca.gc.cra.brandkit.application.port.MalformedDocumentException;
import ca.gc.cra.brandkit.application.port.MetricsPort;
import ca.gc.cra.brandkit.application.template.TemplateCatalog;
import ca.gc.cra.brandkit.config.ConfigMerger;
import ca.gc.cra.brandkit.domain.brand.AssetReference;
import ca.gc.cra.brandkit.domain.brand.Brand;
import ca.gc.cra.brandkit.domain.brand.BrandDocuments;
import ca.gc.cra.brandkit.domain.brand.BrandProtection;
import ca.gc.cra.brandkit.domain.brand.BrandStatus;
import ca.gc.cra.brandkit.domain.brand.ProtectionLevel;
import ca.gc.cra.brandkit.domain.brand.ResolvedAsset;
import ca.gc.cra.brandkit.domain.error.EntityExistsException;
import ca.gc.cra.brandkit.domain.error.EntityNotFoundException;
import ca.gc.cra.brandkit.domain.error.ProtectionViolationException;
import ca.gc.cra.brandkit.domain.error.RegistryException;
import ca.gc.cra.brandkit.domain.error.RegistryInternalException;
import ca.gc.cra.brandkit.domain.error.RegistryValidationException;
import ca.gc.cra.brandkit.logging.Logs;
import ca.gc.cra.brandkit.util.DirectoryTrees;
import ca.gc.cra.brandkit.validation.Strings;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Entry point for the brand lifecycle: create, load, update, delete, list, lock and unlock.
 * <p><strong>Why:</strong> Every brand mutation must pass the same protection, backup, merge and versioning
 * steps in the same order.</p>
 * <p><strong>Role:</strong> Application service composing {@link ConfigStore}, {@link BackupPort},
 * {@link ProtectionGuard}, {@link TemplateCatalog} and {@link VersionManager}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create brands from a template, a copy of another brand, an explicit document and overrides.</li>
 *   <li>Consult the protection guard before unforced updates and deletions.</li>
 *   <li>Snapshot documents before updates and archive directories before deletions.</li>
 *   <li>Stamp timestamps and versions.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Mutations of one brand are serialized through {@link BrandLocks}; reads
 * are lock-free and retry once on a transient I/O failure.</p>
 * <p><strong>Observability:</strong> Counters {@code brand.create.success}, {@code brand.update.success},
 * {@code brand.delete.success}; the brand name is bound to the {@code brand} MDC key during mutations.</p>
 *
 * @since 0.1.0
 */
public final class BrandRegistry {
  private static final Logger log = LoggerFactory.getLogger(BrandRegistry.class);

  private static final int READ_ATTEMPTS = 2;
  private static final List<String> SKELETON =
      List.of("assets/images", "assets/fonts", BrandLayout.TEMPLATES_DIR, BrandLayout.BACKUPS_DIR);

  private final BrandLayout layout;
  private final ConfigStore store;
  private final BackupPort backups;
  private final ProtectionGuard guard;
  private final TemplateCatalog templates;
  private final ComplianceValidator compliance;
  private final BrandLocks locks;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Path archiveDir;

  /**
   * Creates a registry.
   *
   * @param layout registry layout
   * @param store document store
   * @param backups backup writer
   * @param guard protection guard
   * @param templates template catalog used by {@code create}
   * @param locks per-brand locks shared with the asset registry
   * @param metrics metrics sink
   * @param clock timestamp source
   * @param archiveDir directory receiving deletion archives
   */
  public BrandRegistry(
      BrandLayout layout,
      ConfigStore store,
      BackupPort backups,
      ProtectionGuard guard,
      TemplateCatalog templates,
      BrandLocks locks,
      MetricsPort metrics,
      ClockPort clock,
      Path archiveDir) {
    this.layout = Objects.requireNonNull(layout, "layout");
    this.store = Objects.requireNonNull(store, "store");
    this.backups = Objects.requireNonNull(backups, "backups");
    this.guard = Objects.requireNonNull(guard, "guard");
    this.templates = Objects.requireNonNull(templates, "templates");
    this.locks = Objects.requireNonNull(locks, "locks");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.archiveDir = Objects.requireNonNull(archiveDir, "archiveDir");
    this.compliance = new ComplianceValidator();
  }

  /**
   * Creates a brand from {@code config} alone.
   *
   * @param name brand name
   * @param config brand document
   * @return creation outcome
   * @see #create(String, Map, String, Map, String)
   */
  public CreationResult create(String name, Map<String, Object> config) {
    return create(name, config, null, null, null);
  }

  /**
   * Creates a brand.
   *
   * <p>The document is composed from, in order: the {@code copyFrom} brand's document (whose {@code assets/}
   * and {@code templates/} trees are copied too) or else the {@code templateName} preset; then {@code config};
   * then {@code overrides}. A copied brand's protection is not inherited; protection keys supplied in the preset,
   * {@code config} or {@code overrides} are kept, and absent ones take the unprotected defaults. On any failure
   * the new directory is removed.</p>
   *
   * @param name brand name
   * @param config explicit document; may be {@code null}
   * @param templateName preset to start from; ignored when {@code copyFrom} is given; may be {@code null}
   * @param overrides document merged last; may be {@code null}
   * @param copyFrom existing brand to copy; may be {@code null}
   * @return creation outcome
   * @throws RegistryValidationException if the name is invalid or the resulting document is malformed
   * @throws EntityExistsException if the brand exists
   * @throws EntityNotFoundException if the template or source brand does not exist
   */
  public CreationResult create(
      String name,
      Map<String, Object> config,
      String templateName,
      Map<String, Object> overrides,
      String copyFrom) {
    Path directory = layout.directory(name);
    try (BrandLocks.Held held = locks.lock(name); Logs.MdcScope mdc = Logs.brandScope(name)) {
      if (Files.exists(directory, LinkOption.NOFOLLOW_LINKS)) {
        throw new EntityExistsException(name, "Brand '" + name + "' already exists");
      }
      boolean copying = copyFrom != null && !copyFrom.isBlank();
      boolean templated = !copying && templateName != null && !templateName.isBlank();
      Map<String, Object> base = new LinkedHashMap<>();
      String source = null;
      if (copying) {
        if (!Files.isDirectory(layout.directory(copyFrom), LinkOption.NOFOLLOW_LINKS)) {
          throw new EntityNotFoundException(copyFrom, "Source brand '" + copyFrom + "' not found");
        }
        base = readDocument(copyFrom);
        BrandDocuments.PROTECTION_KEYS.forEach(base::remove);
        source = copyFrom;
      } else if (templated) {
        base = BrandDocuments.deepCopy(templates.load(templateName).document());
        source = templateName;
      }

      try {
        for (String relative : SKELETON) {
          Files.createDirectories(directory.resolve(relative));
        }
        if (copying) {
          copyTrees(layout.directory(copyFrom), directory);
          log.info("Copied brand structure from '{}' to '{}'", copyFrom, name);
        }

        Map<String, Object> document = ConfigMerger.merge(ConfigMerger.merge(base, config), overrides);
        BrandDocuments.protectionFragment(BrandProtection.NONE).forEach(document::putIfAbsent);

        String now = clock.now().toString();
        Map<String, Object> metadata = BrandDocuments.section(name, document, BrandDocuments.METADATA);
        metadata.put(BrandDocuments.META_CREATED_AT, now);
        metadata.put(BrandDocuments.META_UPDATED_AT, now);
        metadata.put(BrandDocuments.META_VERSION, BrandDocuments.INITIAL_VERSION);
        metadata.put(BrandDocuments.META_STATUS, BrandStatus.ACTIVE.value());
        metadata.put(BrandDocuments.META_TEMPLATE_SOURCE, source);
        document.put(BrandDocuments.METADATA, metadata);

        Map<String, Object> info = BrandDocuments.section(name, document, BrandDocuments.BRAND);
        Object displayName = info.get("name");
        if (displayName == null || displayName.toString().isBlank()) {
          info.put("name", BrandDocuments.displayName(name));
        }
        document.put(BrandDocuments.BRAND, info);

        BrandDocuments.toBrand(name, directory, document, path -> true);
        store.save(layout.document(name), document);

        List<String> created = listCreated(directory);
        metrics.increment("brand.create.success");
        log.info("Created brand '{}'{}", name, source == null ? "" : " from '" + source + "'");
        return new CreationResult(name, directory, BrandDocuments.INITIAL_VERSION, source, created,
            BrandDocuments.structureWarnings(document));
      } catch (IOException | RuntimeException ex) {
        rollback(name, directory, ex);
        if (ex instanceof RegistryException registryException) {
          throw registryException;
        }
        if (ex instanceof IOException io) {
          throw new RegistryInternalException(name, "Failed to create brand: " + io.getMessage(), io);
        }
        throw (RuntimeException) ex;
      }
    }
  }

  /**
   * Loads a brand. Asset paths resolve to absolute paths; missing files are logged and flagged, never fatal.
   *
   * @param name brand name
   * @return typed brand
   * @throws EntityNotFoundException if absent
   * @throws RegistryValidationException if the document is malformed
   */
  public Brand load(String name) {
    Map<String, Object> document = readDocument(name);
    Brand brand = BrandDocuments.toBrand(name, layout.directory(name), document,
        path -> Files.exists(path, LinkOption.NOFOLLOW_LINKS));
    for (AssetReference reference : brand.assets().values()) {
      for (ResolvedAsset asset : reference.paths()) {
        if (!asset.resolved()) {
          log.warn("Asset '{}' for brand '{}' not found: {}", reference.role(), name, asset.path());
        } else {
          log.debug("Resolved asset '{}' for brand '{}': {}", reference.role(), name, asset.path());
        }
      }
    }
    return brand;
  }

  /**
   * Reports whether a brand document exists.
   *
   * @param name brand name
   * @return {@code true} when present; invalid names report {@code false}
   */
  public boolean exists(String name) {
    return Strings.isValidEntityName(name) && store.exists(layout.document(name));
  }

  /**
   * Lists the names of every directory under the root holding a brand document.
   *
   * @return sorted names
   */
  public List<String> listNames() {
    Path root = layout.root();
    if (!Files.isDirectory(root)) {
      return List.of();
    }
    List<String> names = new ArrayList<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(root)) {
      for (Path entry : entries) {
        String name = entry.getFileName().toString();
        if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS) && exists(name)) {
          names.add(name);
        }
      }
    } catch (IOException ex) {
      throw new RegistryInternalException(null, "Failed to list brands: " + ex.getMessage(), ex);
    }
    names.sort(null);
    return names;
  }

  /**
   * Lists brands sorted by name. Brands whose document cannot be read are logged and skipped.
   *
   * @param detailed whether to walk each {@code assets/} tree for counts and sizes
   * @param statusFilter status to keep; {@code null} keeps all
   * @return summaries
   */
  public List<BrandSummary> list(boolean detailed, BrandStatus statusFilter) {
    List<BrandSummary> summaries = new ArrayList<>();
    for (String name : listNames()) {
      try {
        Map<String, Object> document = readDocument(name);
        Map<String, Object> metadata = BrandDocuments.section(name, document, BrandDocuments.METADATA);
        BrandStatus status = BrandStatus.parseOr(text(metadata.get(BrandDocuments.META_STATUS)), BrandStatus.ACTIVE);
        if (statusFilter != null && status != statusFilter) {
          continue;
        }
        Map<String, Object> info = BrandDocuments.section(name, document, BrandDocuments.BRAND);
        DirectoryTrees.TreeStats assets = detailed ? DirectoryTrees.measure(layout.assets(name)) : null;
        summaries.add(new BrandSummary(
            name,
            Objects.requireNonNullElse(text(info.get("name")), name),
            status,
            Objects.requireNonNullElse(text(metadata.get(BrandDocuments.META_VERSION)), BrandDocuments.INITIAL_VERSION),
            BrandDocuments.protection(name, document).effectiveLevel(),
            text(metadata.get(BrandDocuments.META_TEMPLATE_SOURCE)),
            text(metadata.get(BrandDocuments.META_CREATED_AT)),
            text(metadata.get(BrandDocuments.META_UPDATED_AT)),
            assets == null ? -1 : assets.files(),
            assets == null ? -1 : assets.bytes()));
      } catch (RegistryException | IOException ex) {
        log.warn("Failed to load metadata for {}: {}", name, ex.getMessage());
      }
    }
    return summaries;
  }

  /**
   * Applies a partial update with a backup and the protection check.
   *
   * @param name brand name
   * @param updates partial document
   * @return update outcome
   * @see #update(String, Map, boolean, boolean)
   */
  public UpdateResult update(String name, Map<String, Object> updates) {
    return update(name, updates, true, false);
  }

  /**
   * Merges {@code updates} onto a brand's document.
   *
   * <p>The version's minor component is bumped when {@code updates} touches a
   * {@link VersionManager#MAJOR_IMPACT_SECTIONS} key.</p>
   *
   * @param name brand name
   * @param updates partial document
   * @param createBackup whether to snapshot the current document first
   * @param force skip the protection check
   * @return update outcome including structure and warn-level protection warnings
   * @throws EntityNotFoundException if absent
   * @throws ProtectionViolationException if strictly protected and not forced
   * @throws RegistryValidationException if the merged document is malformed
   */
  public UpdateResult update(String name, Map<String, Object> updates, boolean createBackup, boolean force) {
    Objects.requireNonNull(updates, "updates");
    layout.directory(name);
    try (BrandLocks.Held held = locks.lock(name); Logs.MdcScope mdc = Logs.brandScope(name)) {
      if (!exists(name)) {
        throw notFound(name);
      }
      List<String> warnings = new ArrayList<>();
      if (!force) {
        guard.check(name, "update").ifPresent(warnings::add);
      }
      Map<String, Object> current = readDocument(name);
      Map<String, Object> merged = ConfigMerger.merge(current, updates);

      Map<String, Object> metadata = BrandDocuments.section(name, merged, BrandDocuments.METADATA);
      String previousVersion = Objects.requireNonNullElse(
          text(metadata.get(BrandDocuments.META_VERSION)), BrandDocuments.INITIAL_VERSION);
      String version = VersionManager.nextVersion(previousVersion, updates.keySet());
      metadata.put(BrandDocuments.META_UPDATED_AT, clock.now().toString());
      metadata.put(BrandDocuments.META_VERSION, version);
      merged.put(BrandDocuments.METADATA, metadata);
      BrandDocuments.toBrand(name, layout.directory(name), merged, path -> true);
      warnings.addAll(BrandDocuments.structureWarnings(merged));

      Path backup = null;
      try {
        if (createBackup) {
          backup = backups.snapshot(layout.backups(name), current);
        }
        store.save(layout.document(name), merged);
      } catch (IOException ex) {
        log.error("Failed to update brand {}", name, ex);
        throw new RegistryInternalException(name, "Failed to update brand: " + ex.getMessage(), ex);
      }
      metrics.increment("brand.update.success");
      log.info("Updated brand '{}' fields {} (version {} -> {})", name, updates.keySet(), previousVersion, version);
      return new UpdateResult(name, previousVersion, version, new ArrayList<>(updates.keySet()), backup, warnings);
    }
  }

  /**
   * Deletes a brand directory.
   *
   * @param name brand name
   * @param confirm explicit confirmation
   * @param force skip the protection check and the archive
   * @param createBackup archive the directory first; ignored when {@code force}
   * @return deletion outcome
   * @throws IllegalArgumentException if neither {@code confirm} nor {@code force}
   * @throws EntityNotFoundException if absent
   * @throws ProtectionViolationException if strictly protected and not forced
   */
  public DeletionResult delete(String name, boolean confirm, boolean force, boolean createBackup) {
    if (!confirm && !force) {
      throw new IllegalArgumentException("Confirmation required for brand deletion");
    }
    Path directory = layout.directory(name);
    try (BrandLocks.Held held = locks.lock(name); Logs.MdcScope mdc = Logs.brandScope(name)) {
      if (!Files.isDirectory(directory, LinkOption.NOFOLLOW_LINKS)) {
        throw notFound(name);
      }
      List<String> warnings = new ArrayList<>();
      if (!force) {
        guard.check(name, "delete").ifPresent(warnings::add);
      }
      try {
        Path backup = null;
        if (createBackup && !force) {
          backup = backups.archive(directory, archiveDir, name);
        }
        DirectoryTrees.TreeStats removed = DirectoryTrees.deleteTree(directory);
        metrics.increment("brand.delete.success");
        log.info("Deleted brand '{}' ({} files, {} bytes, force={})", name, removed.files(), removed.bytes(), force);
        return new DeletionResult(name, removed.files(), removed.directories(), removed.bytes(), backup, force,
            warnings);
      } catch (IOException ex) {
        log.error("Failed to delete brand {}", name, ex);
        throw new RegistryInternalException(name, "Failed to delete brand: " + ex.getMessage(), ex);
      }
    }
  }

  /**
   * Sets a brand's protection. Always forced, so an existing lock never blocks it.
   *
   * @param name brand name
   * @param level new level; {@code none} clears protection
   * @param reason reason; blank yields {@code "Brand locked at <level> level"}
   * @param by actor applying the lock
   * @return update outcome
   * @throws IllegalArgumentException if {@code by} is {@code null} or blank
   */
  public UpdateResult lock(String name, ProtectionLevel level, String reason, String by) {
    Objects.requireNonNull(level, "level");
    String actor = requireActor("protected_by", by);
    String effectiveReason = reason == null || reason.isBlank()
        ? "Brand locked at " + level.value() + " level"
        : reason;
    BrandProtection protection =
        new BrandProtection(level != ProtectionLevel.NONE, level, actor, clock.now().toString(), effectiveReason);
    UpdateResult result = update(name, BrandDocuments.protectionFragment(protection), true, true);
    log.info("Brand '{}' protection set to '{}' by {}", name, level.value(), Logs.truncate(actor));
    return result;
  }

  /**
   * Clears a brand's protection. Always forced.
   *
   * @param name brand name
   * @param by actor removing the lock
   * @return update outcome
   * @throws IllegalArgumentException if {@code by} is {@code null} or blank
   */
  public UpdateResult unlock(String name, String by) {
    String actor = requireActor("unlocked_by", by);
    UpdateResult result = update(name, BrandDocuments.protectionFragment(BrandProtection.NONE), true, true);
    log.info("Brand '{}' protection removed by {}", name, Logs.truncate(actor));
    return result;
  }

  /**
   * Reports a brand's protection state.
   *
   * @param name brand name
   * @return status
   * @throws EntityNotFoundException if absent
   */
  public ProtectionStatus protectionStatus(String name) {
    BrandProtection protection = BrandDocuments.protection(name, readDocument(name));
    boolean allowed = protection.effectiveLevel() != ProtectionLevel.STRICT;
    return new ProtectionStatus(
        name,
        protection.isProtected(),
        protection.effectiveLevel(),
        protection.protectedBy(),
        protection.protectedAt(),
        protection.reason(),
        allowed,
        allowed);
  }

  /**
   * Changes {@code metadata.status}. A guarded update unless forced.
   *
   * @param name brand name
   * @param status new status
   * @param actor operator making the change
   * @param force skip the protection check
   * @return update outcome
   * @throws IllegalArgumentException if {@code actor} is {@code null} or blank
   */
  public UpdateResult setStatus(String name, BrandStatus status, String actor, boolean force) {
    Objects.requireNonNull(status, "status");
    String by = requireActor("actor", actor);
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(BrandDocuments.META_STATUS, status.value());
    Map<String, Object> fragment = new LinkedHashMap<>();
    fragment.put(BrandDocuments.METADATA, metadata);
    UpdateResult result = update(name, fragment, true, force);
    log.info("Brand '{}' status set to '{}' by {}", name, status.value(), Logs.truncate(by));
    return result;
  }

  /**
   * Checks a brand against the rules in its own {@code compliance} section.
   *
   * @param brand loaded brand
   * @return advisory warnings
   */
  public List<String> validateCompliance(Brand brand) {
    return compliance.validate(brand);
  }

  /**
   * Loads a brand and checks it against its compliance rules.
   *
   * @param name brand name
   * @return advisory warnings
   */
  public List<String> validateCompliance(String name) {
    return compliance.validate(load(name));
  }

  /**
   * Lists asset paths declared by a brand whose file is missing.
   *
   * @param brand loaded brand
   * @return one warning per missing file
   */
  public static List<String> missingAssetWarnings(Brand brand) {
    List<String> warnings = new ArrayList<>();
    for (AssetReference reference : brand.assets().values()) {
      for (ResolvedAsset asset : reference.paths()) {
        if (!asset.resolved()) {
          warnings.add("Asset not found for " + reference.role() + ": " + asset.path());
        }
      }
    }
    return warnings;
  }

  /** Returns the registry layout. */
  public BrandLayout layout() {
    return layout;
  }

  private static String requireActor(String key, String actor) {
    return Strings.requireNonBlank(key, actor == null ? "" : actor);
  }

  Map<String, Object> readDocument(String name) {
    Path path = layout.document(name);
    for (int attempt = 1; ; attempt++) {
      try {
        return store.load(path);
      } catch (NoSuchFileException ex) {
        throw notFound(name);
      } catch (MalformedDocumentException ex) {
        throw new RegistryValidationException(name, "Invalid brand configuration: " + ex.getMessage(), ex);
      } catch (IOException ex) {
        if (attempt < READ_ATTEMPTS) {
          log.debug("Retrying read of {} after {}", path, ex.toString());
          continue;
        }
        throw new RegistryInternalException(name, "Failed to load brand: " + ex.getMessage(), ex);
      }
    }
  }

  private static EntityNotFoundException notFound(String name) {
    return new EntityNotFoundException(name, "Brand '" + name + "' not found");
  }

  private static void copyTrees(Path source, Path target) throws IOException {
    for (String tree : List.of(BrandLayout.ASSETS_DIR, BrandLayout.TEMPLATES_DIR)) {
      Path from = source.resolve(tree);
      if (Files.isDirectory(from, LinkOption.NOFOLLOW_LINKS)) {
        DirectoryTrees.copyTree(from, target.resolve(tree));
      }
    }
  }

  private static List<String> listCreated(Path directory) throws IOException {
    try (Stream<Path> walk = Files.walk(directory)) {
      return walk
          .filter(path -> !path.equals(directory))
          .sorted()
          .map(path -> {
            String relative = directory.relativize(path).toString().replace('\\', '/');
            return Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS) ? relative + "/" : relative;
          })
          .toList();
    }
  }

  private static void rollback(String name, Path directory, Exception cause) {
    try {
      DirectoryTrees.deleteTree(directory);
    } catch (IOException cleanup) {
      cause.addSuppressed(cleanup);
    }
    log.error("Failed to create brand {}", name, cause);
  }

  private static String text(Object value) {
    return value == null ? null : value.toString();
  }
}
