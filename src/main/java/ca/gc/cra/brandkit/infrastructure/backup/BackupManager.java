package ca.gc.cra.brandkit.infrastructure.backup;

import ca.gc.cra.brandkit.application.port.BackupPort;
import ca.gc.cra.brandkit.application.port.ClockPort;
import ca.gc.cra.brandkit.application.port.ConfigStore;
import ca.gc.cra.brandkit.util.PathUtils;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Filesystem {@link BackupPort} writing document snapshots, single-file copies and
 * gzip-compressed tar archives.
 * <p><strong>Why:</strong> Updates and deletions must leave a recoverable copy behind before they touch
 * a brand.</p>
 * <p><strong>Naming:</strong> {@code backup_<yyyyMMdd_HHmmss>.<ext>}, {@code <stem>_<yyyyMMdd_HHmmss><ext>} and
 * {@code <entry>_deleted_<yyyyMMdd_HHmmss>.tar.gz}, all in UTC. A name already taken within the same second
 * gets a {@code _1}, {@code _2}, ... suffix.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; callers serialize per brand.</p>
 *
 * @since 0.1.0
 */
public final class BackupManager implements BackupPort {
  private static final Logger log = LoggerFactory.getLogger(BackupManager.class);

  static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

  private static final String ARCHIVE_EXTENSION = ".tar.gz";

  private final ConfigStore store;
  private final ClockPort clock;

  /**
   * Creates a backup manager.
   *
   * @param store document store used to serialize snapshots
   * @param clock timestamp source for backup names
   */
  public BackupManager(ConfigStore store, ClockPort clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Path snapshot(Path backupsDir, Map<String, Object> document) throws IOException {
    Objects.requireNonNull(document, "document");
    Files.createDirectories(backupsDir);
    Path target = uniqueName(backupsDir, "backup_" + timestamp(), "." + store.fileExtension());
    store.save(target, document);
    log.info("Wrote document snapshot {}", target);
    return target;
  }

  @Override
  public Path copyAside(Path file, Path backupsDir) throws IOException {
    String filename = PathUtils.fileName(file)
        .orElseThrow(() -> new IOException("Cannot back up path without a file name: " + file));
    Files.createDirectories(backupsDir);
    Path target = uniqueName(backupsDir,
        PathUtils.stem(filename) + "_" + timestamp(), PathUtils.rawExtension(filename));
    Files.copy(file, target, StandardCopyOption.COPY_ATTRIBUTES);
    log.info("Copied {} aside to {}", filename, target);
    return target;
  }

  @Override
  public Path archive(Path directory, Path archiveDir, String entryName) throws IOException {
    if (!Files.isDirectory(directory, LinkOption.NOFOLLOW_LINKS)) {
      throw new IOException("Not a directory: " + directory);
    }
    Files.createDirectories(archiveDir);
    Path target = uniqueName(archiveDir, entryName + "_deleted_" + timestamp(), ARCHIVE_EXTENSION);
    Path temp = Files.createTempFile(archiveDir, "." + entryName, ".partial");
    try {
      try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp));
          GzipCompressorOutputStream gzip = new GzipCompressorOutputStream(out);
          TarArchiveOutputStream tar = new TarArchiveOutputStream(gzip)) {
        tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
        tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
        writeTree(tar, directory, entryName);
        tar.finish();
      }
      Files.move(temp, target);
    } catch (IOException | RuntimeException ex) {
      try {
        Files.deleteIfExists(temp);
      } catch (IOException cleanup) {
        ex.addSuppressed(cleanup);
      }
      throw ex;
    }
    log.info("Archived {} to {}", directory, target);
    return target;
  }

  private static void writeTree(TarArchiveOutputStream tar, Path root, String entryName) throws IOException {
    Files.walkFileTree(root, new SimpleFileVisitor<>() {
      @Override
      public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
        TarArchiveEntry entry = new TarArchiveEntry(dir.toFile(), entryPath(root, dir, entryName) + "/");
        tar.putArchiveEntry(entry);
        tar.closeArchiveEntry();
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
        if (!attrs.isRegularFile()) {
          log.debug("Skipping non-regular file {} in archive", file);
          return FileVisitResult.CONTINUE;
        }
        TarArchiveEntry entry = new TarArchiveEntry(file.toFile(), entryPath(root, file, entryName));
        entry.setSize(attrs.size());
        tar.putArchiveEntry(entry);
        Files.copy(file, tar);
        tar.closeArchiveEntry();
        return FileVisitResult.CONTINUE;
      }
    });
  }

  private static String entryPath(Path root, Path path, String entryName) {
    Path relative = root.relativize(path);
    if (relative.toString().isEmpty()) {
      return entryName;
    }
    StringBuilder name = new StringBuilder(entryName);
    for (Path part : relative) {
      name.append('/').append(part);
    }
    return name.toString();
  }

  private String timestamp() {
    return TIMESTAMP.format(clock.now());
  }

  private static Path uniqueName(Path dir, String base, String extension) {
    Path candidate = dir.resolve(base + extension);
    int counter = 1;
    while (Files.exists(candidate, LinkOption.NOFOLLOW_LINKS)) {
      candidate = dir.resolve(base + "_" + counter + extension);
      counter++;
    }
    return candidate;
  }
}
