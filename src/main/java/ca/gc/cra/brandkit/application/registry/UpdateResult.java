package ca.gc.cra.brandkit.application.registry;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a brand update, lock, unlock or status change.
 *
 * @param name brand name
 * @param previousVersion version before the update
 * @param version version after the update
 * @param updatedFields top-level keys present in the update
 * @param backupPath snapshot written before the update; {@code null} when none was taken
 * @param warnings structure and warn-level protection warnings
 */
public record UpdateResult(
    String name,
    String previousVersion,
    String version,
    List<String> updatedFields,
    Path backupPath,
    List<String> warnings) {
  public UpdateResult {
    updatedFields = List.copyOf(updatedFields);
    warnings = List.copyOf(warnings);
  }

  /** Returns whether the update changed the version. */
  public boolean versionChanged() {
    return !version.equals(previousVersion);
  }
}
