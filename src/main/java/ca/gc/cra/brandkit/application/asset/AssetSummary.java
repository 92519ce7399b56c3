package ca.gc.cra.brandkit.application.asset;

/**
 * One file under a brand's {@code assets/} tree.
 *
 * @param filename file name
 * @param relativePath path relative to {@code assets/}
 * @param assetType type inferred from the path: {@code image}, {@code font}, {@code css} or {@code misc}
 * @param fileSize size in bytes
 * @param modifiedTime ISO-8601 modification time
 * @param extension lower-case extension including the dot
 */
public record AssetSummary(
    String filename,
    String relativePath,
    String assetType,
    long fileSize,
    String modifiedTime,
    String extension) {}
