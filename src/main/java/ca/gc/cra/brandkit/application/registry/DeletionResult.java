package ca.gc.cra.brandkit.application.registry;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of {@link BrandRegistry#delete}.
 *
 * @param name brand name
 * @param filesDeleted regular files removed
 * @param directoriesRemoved directories removed, including the brand directory
 * @param bytesDeleted summed size of removed files
 * @param backupPath archive written before deletion; {@code null} when skipped
 * @param forceUsed whether the protection check and archive were skipped
 * @param warnings warn-level protection warnings
 */
public record DeletionResult(
    String name,
    long filesDeleted,
    long directoriesRemoved,
    long bytesDeleted,
    Path backupPath,
    boolean forceUsed,
    List<String> warnings) {
  public DeletionResult {
    warnings = List.copyOf(warnings);
  }
}
