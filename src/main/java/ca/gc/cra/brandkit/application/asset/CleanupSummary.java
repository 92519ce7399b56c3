package ca.gc.cra.brandkit.application.asset;

import java.util.List;

/**
 * Outcome of {@link AssetRegistry#cleanup(String, boolean)}.
 *
 * @param brand brand name
 * @param filesProcessed files examined
 * @param filesRemoved unreferenced files deleted
 * @param spaceReclaimed bytes freed
 * @param emptyDirsRemoved empty directories deleted
 * @param warnings problems that limited the cleanup
 */
public record CleanupSummary(
    String brand,
    long filesProcessed,
    long filesRemoved,
    long spaceReclaimed,
    long emptyDirsRemoved,
    List<String> warnings) {
  public CleanupSummary {
    warnings = List.copyOf(warnings);
  }
}
