package ca.gc.cra.brandkit.application.asset;

/**
 * Outcome of {@link AssetRegistry#upload}.
 *
 * @param brand brand name
 * @param filename stored filename, possibly suffixed to avoid a collision
 * @param assetType declared asset type
 * @param relativePath path relative to the brand directory
 * @param fileSize decoded size in bytes
 * @param checksum hex SHA-256 of the decoded bytes
 * @param uploadedAt ISO-8601 upload timestamp
 */
public record UploadResult(
    String brand,
    String filename,
    String assetType,
    String relativePath,
    long fileSize,
    String checksum,
    String uploadedAt) {}
