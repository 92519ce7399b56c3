package ca.gc.cra.brandkit.application.asset;

import ca.gc.cra.brandkit.application.port.AssetIndexPort;
import ca.gc.cra.brandkit.application.port.BackupPort;
import ca.gc.cra.brandkit.application.port.ClockPort;
import ca.gc.cra.brandkit.application.port.MetricsPort;
import ca.gc.cra.brandkit.application.registry.BrandLayout;
import ca.gc.cra.brandkit.application.registry.BrandLocks;
import ca.gc.cra.brandkit.application.registry.BrandRegistry;
import ca.gc.cra.brandkit.domain.asset.AssetRecord;
import ca.gc.cra.brandkit.domain.asset.AssetType;
import ca.gc.cra.brandkit.domain.brand.Brand;
import ca.gc.cra.brandkit.domain.error.EntityNotFoundException;
import ca.gc.cra.brandkit.domain.error.RegistryException;
import ca.gc.cra.brandkit.domain.error.RegistryInternalException;
import ca.gc.cra.brandkit.domain.error.RegistryValidationException;
import ca.gc.cra.brandkit.logging.Logs;
import ca.gc.cra.brandkit.util.DirectoryTrees;
import ca.gc.cra.brandkit.util.PathUtils;
import ca.gc.cra.brandkit.validation.Paths;
import ca.gc.cra.brandkit.validation.Strings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-brand catalogue of uploaded binary assets.
 * <p><strong>Why:</strong> Uploaded files come from operators as base64 text and must be size-checked,
 * type-checked and checksummed before they land inside a brand directory.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate, store and checksum uploads, suffixing names that collide.</li>
 *   <li>Keep the advisory {@code asset_registry.json} index in step, best effort.</li>
 *   <li>Validate, list, delete and clean up stored assets.</li>
 * </ul>
 * <p>The filesystem is authoritative; the index is never consulted to decide what exists.</p>
 * <p><strong>Thread-safety:</strong> Uploads, deletions and cleanups of one brand are serialized through the
 * {@link BrandLocks} shared with {@link BrandRegistry}.</p>
 * <p><strong>Observability:</strong> Counters {@code asset.upload.success}, {@code asset.upload.rejected},
 * {@code asset.delete.success}, {@code asset.cleanup.removed}; observation {@code asset.upload.bytes}.</p>
 *
 * @since 0.1.0
 */
public final class AssetRegistry {
  private static final Logger log = LoggerFactory.getLogger(AssetRegistry.class);

  /** Image extensions accepted by {@link #upload}. */
  public static final Set<String> IMAGE_EXTENSIONS = Set.of(".png", ".jpg", ".jpeg", ".svg", ".gif");
  /** Font extensions accepted by {@link #upload}. */
  public static final Set<String> FONT_EXTENSIONS = Set.of(".woff", ".woff2", ".ttf", ".otf", ".eot");
  /** Other extensions accepted by {@link #upload}. */
  public static final Set<String> OTHER_EXTENSIONS = Set.of(".css", ".js", ".html");

  static final int MAX_FILENAME_LENGTH = 255;

  private final BrandLayout layout;
  private final BrandRegistry brands;
  private final AssetIndexPort index;
  private final BackupPort backups;
  private final BrandLocks locks;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final long maxAssetBytes;

  /**
   * Creates an asset registry.
   *
   * @param brands brand registry, used to resolve referenced assets during cleanup
   * @param index asset index adapter
   * @param backups backup writer
   * @param locks per-brand locks shared with {@code brands}
   * @param metrics metrics sink
   * @param clock timestamp source
   * @param maxAssetBytes decoded size ceiling per upload
   */
  public AssetRegistry(
      BrandRegistry brands,
      AssetIndexPort index,
      BackupPort backups,
      BrandLocks locks,
      MetricsPort metrics,
      ClockPort clock,
      long maxAssetBytes) {
    this.brands = Objects.requireNonNull(brands, "brands");
    this.layout = brands.layout();
    this.index = Objects.requireNonNull(index, "index");
    this.backups = Objects.requireNonNull(backups, "backups");
    this.locks = Objects.requireNonNull(locks, "locks");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (maxAssetBytes <= 0) {
      throw new IllegalArgumentException("maxAssetBytes must be positive");
    }
    this.maxAssetBytes = maxAssetBytes;
  }

  /**
   * Stores a base64-encoded asset in the brand's type-specific directory.
   *
   * @param brand brand name
   * @param base64Data encoded file content
   * @param filename requested filename
   * @param assetType declared type, e.g. {@code logo} or {@code font}; unlisted types are stored under
   *     {@code assets/misc} and recorded as declared
   * @param metadata free-form metadata recorded in the index; may be {@code null}
   * @return upload outcome
   * @throws EntityNotFoundException if the brand does not exist
   * @throws RegistryValidationException on the first failed content check
   */
  public UploadResult upload(
      String brand, String base64Data, String filename, String assetType, Map<String, Object> metadata) {
    Path brandDir = requireBrand(brand);
    byte[] content;
    String extension;
    try {
      content = decode(brand, base64Data);
      extension = checkFilename(brand, filename);
    } catch (RegistryValidationException ex) {
      metrics.increment("asset.upload.rejected");
      log.warn("Rejected asset upload for brand {}: {}", brand, ex.getMessage());
      throw ex;
    }
    AssetType type = AssetType.fromValue(assetType);
    String declaredType = AssetType.declaredName(assetType);

    try (BrandLocks.Held held = locks.lock(brand); Logs.MdcScope mdc = Logs.brandScope(brand)) {
      Path targetDir = brandDir.resolve(type.directory());
      String storedName;
      Path target;
      try {
        Files.createDirectories(targetDir);
        storedName = uniqueFilename(targetDir, filename);
        target = targetDir.resolve(storedName);
        writeNew(target, content);
      } catch (IOException ex) {
        log.error("Failed to upload asset {} to brand {}", Logs.truncate(filename), brand, ex);
        throw new RegistryInternalException(brand, "Failed to upload asset: " + ex.getMessage(), ex);
      }

      String checksum = sha256(content);
      String uploadedAt = clock.now().toString();
      AssetRecord record = new AssetRecord(storedName, declaredType, content.length, checksum, uploadedAt, metadata);
      register(brand, record);

      metrics.increment("asset.upload.success");
      metrics.observe("asset.upload.bytes", content.length);
      String relative = relativize(brandDir, target);
      log.info("Uploaded asset {} ({} bytes, {}) to brand {}", relative, content.length, extension, brand);
      return new UploadResult(brand, storedName, declaredType, relative, content.length, checksum, uploadedAt);
    }
  }

  /**
   * Recomputes the checksum and type status of a stored asset.
   *
   * @param brand brand name
   * @param assetPath path relative to the brand directory
   * @return report; I/O failures yield status {@code error} rather than an exception
   * @throws RegistryValidationException if {@code assetPath} escapes the brand directory
   */
  public AssetValidationReport validate(String brand, String assetPath) {
    Path file = resolve(brand, layout.directory(brand), assetPath);
    String extension = PathUtils.extension(PathUtils.fileName(file).orElse(""));
    boolean allowed = isAllowedExtension(extension);
    if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
      return new AssetValidationReport(brand, assetPath, AssetValidationReport.Status.MISSING,
          -1, null, null, extension, allowed, null, "Asset file not found");
    }
    try {
      byte[] content = Files.readAllBytes(file);
      String checksum = sha256(content);
      String modified = Files.getLastModifiedTime(file).toInstant().toString();
      Boolean indexMatch = indexChecksumMatches(brand, file.getFileName().toString(), checksum);
      AssetValidationReport.Status status =
          allowed ? AssetValidationReport.Status.VALID : AssetValidationReport.Status.INVALID_TYPE;
      return new AssetValidationReport(brand, assetPath, status, content.length, checksum, modified, extension,
          allowed, indexMatch, "Asset validation completed");
    } catch (IOException ex) {
      log.error("Failed to validate asset {}: {}", Logs.truncate(assetPath), ex.getMessage());
      return new AssetValidationReport(brand, assetPath, AssetValidationReport.Status.ERROR,
          -1, null, null, extension, allowed, null, "Validation failed: " + ex.getMessage());
    }
  }

  /**
   * Lists files under the brand's {@code assets/} tree, sorted by filename.
   *
   * @param brand brand name
   * @param typeFilter inferred type to keep ({@code image}, {@code font}, {@code css}, {@code misc});
   *     {@code null} or blank keeps all
   * @return listing
   * @throws EntityNotFoundException if the brand does not exist
   */
  public AssetListing list(String brand, String typeFilter) {
    Path brandDir = requireBrand(brand);
    Path assetsDir = brandDir.resolve(BrandLayout.ASSETS_DIR);
    String filter = typeFilter == null || typeFilter.isBlank() ? null : typeFilter;
    List<AssetSummary> assets = new ArrayList<>();
    long totalSize = 0;
    try {
      for (Path file : DirectoryTrees.regularFiles(assetsDir)) {
        Path relative = assetsDir.relativize(file);
        String inferred = inferType(relative);
        if (filter != null && !filter.equals(inferred)) {
          continue;
        }
        long size = Files.size(file);
        totalSize += size;
        String name = file.getFileName().toString();
        assets.add(new AssetSummary(name, relative.toString().replace('\\', '/'), inferred, size,
            Files.getLastModifiedTime(file).toInstant().toString(), PathUtils.extension(name)));
      }
    } catch (IOException ex) {
      log.error("Failed to list assets for brand {}", brand, ex);
      throw new RegistryInternalException(brand, "Failed to list assets: " + ex.getMessage(), ex);
    }
    assets.sort(Comparator.comparing(AssetSummary::filename).thenComparing(AssetSummary::relativePath));
    return new AssetListing(brand, assets, totalSize, filter);
  }

  /**
   * Deletes a stored asset and its index entry.
   *
   * @param brand brand name
   * @param assetPath path relative to the brand directory
   * @param createBackup copy the file to {@code backups/} first
   * @return deletion outcome
   * @throws RegistryValidationException if the file does not exist or the path escapes the brand
   */
  public AssetDeletionResult delete(String brand, String assetPath, boolean createBackup) {
    Path brandDir = layout.directory(brand);
    Path file = resolve(brand, brandDir, assetPath);
    try (BrandLocks.Held held = locks.lock(brand); Logs.MdcScope mdc = Logs.brandScope(brand)) {
      if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
        throw new RegistryValidationException(brand, "Asset not found: " + assetPath);
      }
      try {
        long size = Files.size(file);
        String backupPath = null;
        if (createBackup) {
          backupPath = relativize(brandDir, backups.copyAside(file, layout.backups(brand)));
        }
        Files.delete(file);
        unregister(brand, file.getFileName().toString());
        metrics.increment("asset.delete.success");
        log.info("Deleted asset {} from brand {}", Logs.truncate(assetPath), brand);
        return new AssetDeletionResult(brand, assetPath, size, backupPath);
      } catch (IOException ex) {
        log.error("Failed to delete asset {}", Logs.truncate(assetPath), ex);
        throw new RegistryInternalException(brand, "Failed to delete asset: " + ex.getMessage(), ex);
      }
    }
  }

  /**
   * Prunes the brand's {@code assets/} tree.
   *
   * <p>With {@code removeUnused}, every file whose absolute path is not referenced by the brand's
   * {@code assets} section is deleted. If the brand document cannot be loaded nothing is deleted and a
   * warning is reported. Empty directories are removed in both modes.</p>
   *
   * @param brand brand name
   * @param removeUnused delete unreferenced files
   * @return summary
   * @throws EntityNotFoundException if the brand does not exist
   */
  public CleanupSummary cleanup(String brand, boolean removeUnused) {
    Path brandDir = requireBrand(brand);
    Path assetsDir = brandDir.resolve(BrandLayout.ASSETS_DIR);
    List<String> warnings = new ArrayList<>();
    try (BrandLocks.Held held = locks.lock(brand); Logs.MdcScope mdc = Logs.brandScope(brand)) {
      if (!Files.isDirectory(assetsDir, LinkOption.NOFOLLOW_LINKS)) {
        return new CleanupSummary(brand, 0, 0, 0, 0, List.of("No assets directory to clean"));
      }
      Set<Path> referenced = null;
      if (removeUnused) {
        try {
          Brand loaded = brands.load(brand);
          referenced = loaded.referencedAssetPaths();
        } catch (RegistryException ex) {
          log.warn("Could not load brand config for cleanup of {}: {}", brand, ex.getMessage());
          warnings.add("Brand configuration unreadable; no files removed: " + ex.getMessage());
        }
      }
      long processed = 0;
      long removed = 0;
      long reclaimed = 0;
      try {
        for (Path file : DirectoryTrees.regularFiles(assetsDir)) {
          processed++;
          Path normalized = file.toAbsolutePath().normalize();
          if (referenced != null && !referenced.contains(normalized)) {
            long size = Files.size(file);
            Files.delete(file);
            removed++;
            reclaimed += size;
            metrics.increment("asset.cleanup.removed");
            log.debug("Removed unreferenced asset {}", normalized);
          }
        }
        int emptyDirs = DirectoryTrees.removeEmptyDirectories(assetsDir);
        log.info("Cleaned up assets for brand {}: {} of {} files removed", brand, removed, processed);
        return new CleanupSummary(brand, processed, removed, reclaimed, emptyDirs, warnings);
      } catch (IOException ex) {
        log.error("Failed to cleanup assets for brand {}", brand, ex);
        throw new RegistryInternalException(brand, "Failed to cleanup assets: " + ex.getMessage(), ex);
      }
    }
  }

  /**
   * Reports whether {@code extension} is on the upload allow-list.
   *
   * @param extension lower-case extension including the dot
   * @return {@code true} when allowed
   */
  public static boolean isAllowedExtension(String extension) {
    return IMAGE_EXTENSIONS.contains(extension)
        || FONT_EXTENSIONS.contains(extension)
        || OTHER_EXTENSIONS.contains(extension);
  }

  static String inferType(Path relative) {
    for (Path part : relative) {
      String name = part.toString();
      if (name.equals("images")) {
        return "image";
      }
      if (name.equals("fonts")) {
        return "font";
      }
    }
    return PathUtils.extension(relative.getFileName().toString()).equals(".css") ? "css" : "misc";
  }

  private byte[] decode(String brand, String base64Data) {
    if (base64Data == null || base64Data.isEmpty()) {
      throw new RegistryValidationException(brand, "Invalid asset data: must be non-empty base64 string");
    }
    if (base64Data.length() > maxAssetBytes * 2) {
      throw new RegistryValidationException(brand, "Base64 data too large: " + base64Data.length() + " chars");
    }
    byte[] content;
    try {
      content = Base64.getDecoder().decode(base64Data);
    } catch (IllegalArgumentException ex) {
      throw new RegistryValidationException(brand, "Invalid base64 data: " + ex.getMessage(), ex);
    }
    if (content.length > maxAssetBytes) {
      throw new RegistryValidationException(brand,
          "File too large: " + content.length + " bytes > " + maxAssetBytes);
    }
    if (content.length == 0) {
      throw new RegistryValidationException(brand, "File cannot be empty");
    }
    return content;
  }

  private static String checkFilename(String brand, String filename) {
    if (filename == null || filename.isEmpty() || filename.length() > MAX_FILENAME_LENGTH) {
      throw new RegistryValidationException(brand, "Invalid filename: must be 1-" + MAX_FILENAME_LENGTH + " characters");
    }
    if (!Strings.isPlainFilename(filename)) {
      throw new RegistryValidationException(brand, "Invalid filename: must not contain path separators");
    }
    String extension = PathUtils.extension(filename);
    if (!isAllowedExtension(extension)) {
      throw new RegistryValidationException(brand, "File type not allowed: " + extension);
    }
    return extension;
  }

  private Path requireBrand(String brand) {
    Path directory = layout.directory(brand);
    if (!Files.isDirectory(directory, LinkOption.NOFOLLOW_LINKS)) {
      throw new EntityNotFoundException(brand, "Brand '" + brand + "' not found");
    }
    return directory;
  }

  private static Path resolve(String brand, Path brandDir, String assetPath) {
    try {
      return Paths.resolveWithin(brandDir, assetPath);
    } catch (IllegalArgumentException ex) {
      throw new RegistryValidationException(brand, "Invalid asset path: " + ex.getMessage(), ex);
    }
  }

  private static String uniqueFilename(Path directory, String filename) {
    if (!Files.exists(directory.resolve(filename), LinkOption.NOFOLLOW_LINKS)) {
      return filename;
    }
    String stem = PathUtils.stem(filename);
    String extension = PathUtils.rawExtension(filename);
    int counter = 1;
    String candidate;
    do {
      candidate = stem + "_" + counter + extension;
      counter++;
    } while (Files.exists(directory.resolve(candidate), LinkOption.NOFOLLOW_LINKS));
    return candidate;
  }

  private static void writeNew(Path target, byte[] content) throws IOException {
    Path temp = Files.createTempFile(target.getParent(), ".upload", ".tmp");
    try {
      Files.write(temp, content);
      Files.move(temp, target);
    } catch (IOException ex) {
      try {
        Files.deleteIfExists(temp);
      } catch (IOException cleanup) {
        ex.addSuppressed(cleanup);
      }
      throw ex;
    }
  }

  private void register(String brand, AssetRecord record) {
    Path indexFile = layout.index(brand);
    try {
      Map<String, AssetRecord> records = index.read(indexFile);
      records.put(record.filename(), record);
      index.write(indexFile, records);
    } catch (IOException ex) {
      log.warn("Failed to update asset registry for brand {}: {}", brand, ex.getMessage());
    }
  }

  private void unregister(String brand, String filename) {
    Path indexFile = layout.index(brand);
    try {
      Map<String, AssetRecord> records = index.read(indexFile);
      if (records.remove(filename) != null) {
        index.write(indexFile, records);
      }
    } catch (IOException ex) {
      log.warn("Failed to update asset registry for brand {}: {}", brand, ex.getMessage());
    }
  }

  private Boolean indexChecksumMatches(String brand, String filename, String checksum) {
    try {
      AssetRecord record = index.read(layout.index(brand)).get(filename);
      return record == null ? null : record.checksum().equalsIgnoreCase(checksum);
    } catch (IOException ex) {
      log.debug("Asset index unreadable for brand {}: {}", brand, ex.getMessage());
      return null;
    }
  }

  private static String relativize(Path base, Path path) {
    return base.relativize(path.toAbsolutePath().normalize()).toString().replace('\\', '/');
  }

  static String sha256(byte[] content) {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }
}
