package ca.gc.cra.brandkit.application.asset;

/**
 * Outcome of {@link AssetRegistry#delete}.
 *
 * @param brand brand name
 * @param assetPath deleted path relative to the brand directory
 * @param fileSizeDeleted size of the deleted file
 * @param backupPath backup copy relative to the brand directory; {@code null} when none was taken
 */
public record AssetDeletionResult(String brand, String assetPath, long fileSizeDeleted, String backupPath) {
  public boolean backupCreated() {
    return backupPath != null;
  }
}
