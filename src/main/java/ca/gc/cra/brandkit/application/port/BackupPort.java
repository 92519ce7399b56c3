package ca.gc.cra.brandkit.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * <strong>What:</strong> Port producing immutable backups before mutations.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Snapshot a document into a timestamped file.</li>
 *   <li>Copy a single asset file aside before it is unlinked.</li>
 *   <li>Archive an entire brand directory before deletion.</li>
 * </ul>
 * <p>Backups are never pruned.</p>
 *
 * @since 0.1.0
 */
public interface BackupPort {
  /**
   * Writes {@code document} to {@code backupsDir/backup_<YYYYMMDD_HHMMSS>.<ext>}.
   *
   * @param backupsDir directory receiving the snapshot; created when absent
   * @param document document to copy
   * @return path of the written snapshot
   * @throws IOException if the snapshot cannot be written
   */
  Path snapshot(Path backupsDir, Map<String, Object> document) throws IOException;

  /**
   * Copies a file to {@code backupsDir/<stem>_<YYYYMMDD_HHMMSS><ext>}.
   *
   * @param file file to copy
   * @param backupsDir directory receiving the copy; created when absent
   * @return path of the copy
   * @throws IOException if the copy fails
   */
  Path copyAside(Path file, Path backupsDir) throws IOException;

  /**
   * Archives {@code directory} to {@code archiveDir/<entryName>_deleted_<YYYYMMDD_HHMMSS>.tar.gz}.
   *
   * @param directory directory tree to archive
   * @param archiveDir directory receiving the archive; created when absent
   * @param entryName top-level entry name inside the archive
   * @return path of the archive
   * @throws IOException if the archive cannot be written
   */
  Path archive(Path directory, Path archiveDir, String entryName) throws IOException;
}
